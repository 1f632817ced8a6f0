package works.datashape.compact;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.EnumAccess;
import works.datashape.de.Expected;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.VariantAccess;
import works.datashape.de.Visitor;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.Flavor;
import works.datashape.model.IntegerRanges;

/**
 * Reads values written by {@link CompactSerializer}.
 * <p>
 * Every method reads exactly the shape it is named for,
 * so {@link #deserializeAny} and {@link #deserializeIgnoredAny} are unsupported.
 * Strings and bytes are borrowed when the input is a {@link SliceInput}
 * over a buffer that outlives the read, and the visitor accepts them that way.
 */
public final class CompactDeserializer implements Deserializer {
	private final CompactInput input;
	private final CompactSettings settings;
	private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
		.onMalformedInput(CodingErrorAction.REPORT)
		.onUnmappableCharacter(CodingErrorAction.REPORT);
	private byte[] scratch = new byte[64];
	private int depth = 0;

	public CompactDeserializer(CompactInput input, CompactSettings settings) {
		this.input = input;
		this.settings = settings;
	}

	public CompactDeserializer(CompactInput input) {
		this(input, CompactSettings.DEFAULT);
	}

	/**
	 * Checks that the whole input has been consumed.
	 *
	 * @throws MalformedInputException if it hasn't
	 */
	public void end() {
		if (!input.isAtEnd()) {
			throw new MalformedInputException("Trailing bytes after compact value", "end of input", input.offset());
		}
	}

	@Override
	public Set<Flavor> supportedFlavors() {
		return input.flavors();
	}

	@Override
	public boolean isHumanReadable() {
		return false;
	}

	@Override
	public <T> T deserializeAny(Visitor<T> visitor) {
		throw notSelfDescribing(visitor);
	}

	@Override
	public <T> T deserializeIgnoredAny(Visitor<T> visitor) {
		throw notSelfDescribing(visitor);
	}

	private MalformedInputException notSelfDescribing(Expected expected) {
		return new MalformedInputException("compact format is not self-describing", expected.expecting(), input.offset());
	}

	@Override
	public <T> T deserializeBool(Visitor<T> visitor) {
		byte b = input.readByte(visitor.expecting());
		return switch (b) {
			case 0 -> visitor.visitBool(false);
			case 1 -> visitor.visitBool(true);
			default -> throw new MalformedInputException("Invalid bool byte " + b, visitor.expecting(), input.offset() - 1);
		};
	}

	@Override public <T> T deserializeI8(Visitor<T> visitor) { return visitor.visitI8(input.readByte(visitor.expecting())); }
	@Override public <T> T deserializeI16(Visitor<T> visitor) { return visitor.visitI16((short) input.readLittleEndian(2, visitor.expecting())); }
	@Override public <T> T deserializeI32(Visitor<T> visitor) { return visitor.visitI32((int) input.readLittleEndian(4, visitor.expecting())); }
	@Override public <T> T deserializeI64(Visitor<T> visitor) { return visitor.visitI64(input.readLittleEndian(8, visitor.expecting())); }
	@Override public <T> T deserializeI128(Visitor<T> visitor) { return visitor.visitI128(new BigInteger(read128(visitor))); }
	@Override public <T> T deserializeU8(Visitor<T> visitor) { return visitor.visitU8(input.readByte(visitor.expecting()) & 0xFF); }
	@Override public <T> T deserializeU16(Visitor<T> visitor) { return visitor.visitU16((int) input.readLittleEndian(2, visitor.expecting())); }
	@Override public <T> T deserializeU32(Visitor<T> visitor) { return visitor.visitU32(input.readLittleEndian(4, visitor.expecting())); }
	@Override public <T> T deserializeU64(Visitor<T> visitor) { return visitor.visitU64(input.readLittleEndian(8, visitor.expecting())); }
	@Override public <T> T deserializeU128(Visitor<T> visitor) { return visitor.visitU128(new BigInteger(1, read128(visitor))); }
	@Override public <T> T deserializeF32(Visitor<T> visitor) { return visitor.visitF32(Float.intBitsToFloat((int) input.readLittleEndian(4, visitor.expecting()))); }
	@Override public <T> T deserializeF64(Visitor<T> visitor) { return visitor.visitF64(Double.longBitsToDouble(input.readLittleEndian(8, visitor.expecting()))); }

	/**
	 * @return the sixteen little-endian bytes, reversed into the big-endian order {@link BigInteger} wants
	 */
	private byte[] read128(Expected expected) {
		byte[] littleEndian = new byte[16];
		input.readFully(littleEndian, 0, 16, expected.expecting());
		byte[] bigEndian = new byte[16];
		for (int i = 0; i < 16; i++) {
			bigEndian[15 - i] = littleEndian[i];
		}
		return bigEndian;
	}

	@Override
	public <T> T deserializeChar(Visitor<T> visitor) {
		long codePoint = input.readLittleEndian(4, visitor.expecting());
		if (codePoint > Character.MAX_CODE_POINT || !IntegerRanges.isUnicodeScalar((int) codePoint)) {
			throw new MalformedInputException("Invalid character 0x" + Long.toHexString(codePoint), visitor.expecting(), input.offset() - 4);
		}
		return visitor.visitChar((int) codePoint);
	}

	@Override public <T> T deserializeStr(Visitor<T> visitor) { return visitText(visitor, false); }
	@Override public <T> T deserializeString(Visitor<T> visitor) { return visitText(visitor, true); }
	@Override public <T> T deserializeBytes(Visitor<T> visitor) { return visitBytes(visitor, false); }
	@Override public <T> T deserializeByteBuf(Visitor<T> visitor) { return visitBytes(visitor, true); }

	/**
	 * @return the input to borrow from, or null if the visitor should get a copy.
	 * A visitor that asked to own the value still borrows if that is all it accepts.
	 */
	private SliceInput lender(Set<Flavor> accepted, boolean owned) {
		if (input instanceof SliceInput slice && slice.lends()
			&& accepted.contains(Flavor.BORROWED) && (!owned || !accepted.contains(Flavor.OWNED))) {
			return slice;
		}
		return null;
	}

	/**
	 * @param owned whether the visitor asked for a string it intends to keep
	 */
	private <T> T visitText(Visitor<T> visitor, boolean owned) {
		int length = readLength(visitor);
		Set<Flavor> accepted = visitor.acceptedFlavors();
		SliceInput slice = lender(accepted, owned);
		if (slice != null) {
			int start = slice.validatedRange(length, visitor.expecting());
			decode(slice.rawBytes(), start, length, visitor);
			return visitor.visitBorrowedStr(slice.borrowText(start, length));
		}
		byte[] raw = scratch(length);
		input.readFully(raw, 0, length, visitor.expecting());
		String text = decode(raw, 0, length, visitor);
		if (owned || !accepted.contains(Flavor.TRANSIENT)) {
			return visitor.visitString(text);
		}
		return visitor.visitStr(text);
	}

	private String decode(byte[] bytes, int start, int length, Expected expected) {
		try {
			return utf8.decode(ByteBuffer.wrap(bytes, start, length)).toString();
		} catch (CharacterCodingException e) {
			throw new MalformedInputException("Invalid UTF-8 in string", expected.expecting(), input.offset() - length, e);
		}
	}

	/**
	 * @param owned whether the visitor asked for bytes it intends to keep
	 */
	private <T> T visitBytes(Visitor<T> visitor, boolean owned) {
		int length = readLength(visitor);
		Set<Flavor> accepted = visitor.acceptedFlavors();
		SliceInput slice = lender(accepted, owned);
		if (slice != null) {
			return visitor.visitBorrowedBytes(slice.borrowBytes(length, visitor.expecting()));
		}
		if (!owned && accepted.contains(Flavor.TRANSIENT)) {
			byte[] raw = scratch(length);
			input.readFully(raw, 0, length, visitor.expecting());
			return visitor.visitBytes(ByteBuffer.wrap(raw, 0, length).asReadOnlyBuffer());
		}
		byte[] bytes = new byte[length];
		input.readFully(bytes, 0, length, visitor.expecting());
		return visitor.visitByteBuf(bytes);
	}

	private byte[] scratch(int length) {
		if (scratch.length < length) {
			scratch = new byte[Math.max(length, 2 * scratch.length)];
		}
		return scratch;
	}

	/**
	 * Reads a u64 length and checks it against {@link CompactSettings#maxLength()}
	 * before anything is allocated for it.
	 */
	private int readLength(Expected expected) {
		long length = input.readLittleEndian(8, expected.expecting());
		if (length < 0 || length > settings.maxLength()) {
			throw new MalformedInputException("Declared length " + Long.toUnsignedString(length)
				+ " exceeds the maximum of " + settings.maxLength(), expected.expecting(), input.offset() - 8);
		}
		return (int) length;
	}

	@Override
	public <T> T deserializeOption(Visitor<T> visitor) {
		byte tag = input.readByte(visitor.expecting());
		return switch (tag) {
			case 0 -> visitor.visitNone();
			case 1 -> visitor.visitSome(this);
			default -> throw new MalformedInputException("Invalid option tag " + tag, visitor.expecting(), input.offset() - 1);
		};
	}

	@Override public <T> T deserializeUnit(Visitor<T> visitor) { return visitor.visitUnit(); }
	@Override public <T> T deserializeUnitStruct(String name, Visitor<T> visitor) { return visitor.visitUnit(); }
	@Override public <T> T deserializeNewtypeStruct(String name, Visitor<T> visitor) { return visitor.visitNewtypeStruct(this); }
	@Override public <T> T deserializeSeq(Visitor<T> visitor) { return visitElements(visitor, readLength(visitor)); }
	@Override public <T> T deserializeTuple(int length, Visitor<T> visitor) { return visitElements(visitor, length); }
	@Override public <T> T deserializeTupleStruct(String name, int length, Visitor<T> visitor) { return visitElements(visitor, length); }
	@Override public <T> T deserializeMap(Visitor<T> visitor) { return visitEntries(visitor, readLength(visitor)); }

	/**
	 * Fields are read in declaration order, as a tuple of {@code fields.size()} elements.
	 */
	@Override
	public <T> T deserializeStruct(String name, List<String> fields, Visitor<T> visitor) {
		return visitElements(visitor, fields.size());
	}

	@Override
	public <T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor) {
		return visitor.visitEnum(new IndexedVariant());
	}

	/**
	 * Variants are identified by index; field names are never written.
	 */
	@Override
	public <T> T deserializeIdentifier(Visitor<T> visitor) {
		return visitor.visitU32(input.readLittleEndian(4, visitor.expecting()));
	}

	private void enter(Expected expected) {
		if (++depth > settings.maxNestingDepth()) {
			throw new MalformedInputException("Nesting deeper than " + settings.maxNestingDepth(), expected.expecting(), input.offset());
		}
	}

	private void leave() {
		depth--;
	}

	private <T> T visitElements(Visitor<T> visitor, int count) {
		enter(visitor);
		ElementAccess access = new ElementAccess(count);
		T result = visitor.visitSeq(access);
		if (access.remaining > 0) {
			throw new MalformedInputException("Trailing elements: " + access.remaining + " of " + count + " were not read", visitor.expecting(), input.offset());
		}
		leave();
		return result;
	}

	private <T> T visitEntries(Visitor<T> visitor, int count) {
		enter(visitor);
		EntryAccess access = new EntryAccess(count);
		T result = visitor.visitMap(access);
		if (access.expectingValue) {
			throw new MalformedInputException("Visitor read a map key but not its value", visitor.expecting(), input.offset());
		}
		if (access.remaining > 0) {
			throw new MalformedInputException("Trailing entries: " + access.remaining + " of " + count + " were not read", visitor.expecting(), input.offset());
		}
		leave();
		return result;
	}

	@Override
	public String toString() {
		return "CompactDeserializer(" + input + ")";
	}

	private final class ElementAccess implements SeqAccess {
		int remaining;

		ElementAccess(int count) {
			this.remaining = count;
		}

		@Override
		public <E> Optional<E> nextElement(Deserialize<E> element) {
			if (remaining == 0) {
				return Optional.empty();
			}
			remaining--;
			return Optional.of(element.deserialize(CompactDeserializer.this));
		}

		@Override
		public OptionalInt sizeHint() {
			return OptionalInt.of(remaining);
		}
	}

	private final class EntryAccess implements MapAccess {
		int remaining;
		boolean expectingValue = false;

		EntryAccess(int count) {
			this.remaining = count;
		}

		@Override
		public <K> Optional<K> nextKey(Deserialize<K> key) {
			if (expectingValue) {
				throw new IllegalStateException("nextKey called before nextValue");
			}
			if (remaining == 0) {
				return Optional.empty();
			}
			remaining--;
			K result = key.deserialize(CompactDeserializer.this);
			expectingValue = true;
			return Optional.of(result);
		}

		@Override
		public <V> V nextValue(Deserialize<V> value) {
			if (!expectingValue) {
				throw new IllegalStateException("nextValue called without a key");
			}
			expectingValue = false;
			return value.deserialize(CompactDeserializer.this);
		}

		@Override
		public OptionalInt sizeHint() {
			return OptionalInt.of(remaining);
		}
	}

	/**
	 * A u32 variant index followed by the payload, if any.
	 */
	private final class IndexedVariant implements EnumAccess, VariantAccess {
		@Override
		public <V> Variant<V> variant(Deserialize<V> tag) {
			return new Variant<>(tag.deserialize(CompactDeserializer.this), this);
		}

		@Override
		public void unitVariant() {
			// Nothing follows the index
		}

		@Override
		public <T> T newtypeVariant(Deserialize<T> value) {
			return value.deserialize(CompactDeserializer.this);
		}

		@Override
		public <T> T tupleVariant(int length, Visitor<T> visitor) {
			return visitElements(visitor, length);
		}

		@Override
		public <T> T structVariant(List<String> fields, Visitor<T> visitor) {
			return visitElements(visitor, fields.size());
		}
	}
}
