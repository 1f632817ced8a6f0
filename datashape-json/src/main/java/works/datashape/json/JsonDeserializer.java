package works.datashape.json;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.EnumAccess;
import works.datashape.de.Expected;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.Unexpected;
import works.datashape.de.VariantAccess;
import works.datashape.de.Visitor;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.BorrowedText;
import works.datashape.lifetime.Flavor;
import works.datashape.lifetime.Flavors;
import works.datashape.lifetime.InputBuffer;
import works.datashape.model.IntegerRanges;

import static works.datashape.exceptions.UnrecognizedContentException.invalidType;

/**
 * Reads one JSON value from a char {@link InputBuffer}.
 * <p>
 * JSON is self-describing, so most hints are ignored in favour of
 * {@link #deserializeAny}; the exceptions are options (where {@code null} means none),
 * enums (a bare string or a single-member object), and {@code f32} (parsed directly
 * to avoid double rounding).
 * <p>
 * Strings without escapes are offered {@link Flavor#BORROWED borrowed} from the buffer
 * to visitors that accept that; others are decoded into a scratch buffer and offered
 * {@link Flavor#TRANSIENT transient}, valid only during the visit.
 */
public final class JsonDeserializer implements Deserializer {
	private static final Pattern INTEGER_NAME = Pattern.compile("-?(0|[1-9][0-9]*)");

	private final JsonReader reader;
	private final JsonSettings settings;
	private final boolean lends;
	private final StringBuilder scratch = new StringBuilder();
	private int depth = 0;

	/**
	 * Reads from a buffer that outlives the decoded value,
	 * so strings can be lent from it.
	 */
	public JsonDeserializer(InputBuffer buffer, JsonSettings settings) {
		this(buffer, settings, true);
	}

	/**
	 * @param lends false if {@code buffer} is released when decoding ends,
	 * in which case nothing is borrowed from it
	 */
	JsonDeserializer(InputBuffer buffer, JsonSettings settings, boolean lends) {
		this.reader = new CharArrayJsonReader(buffer);
		this.settings = settings;
		this.lends = lends;
	}

	/**
	 * Checks that nothing but whitespace follows the value.
	 *
	 * @throws MalformedInputException if anything else does
	 */
	public void end() {
		Token token = reader.peekToken();
		if (token != Token.END_TEXT) {
			throw new MalformedInputException("Trailing characters after JSON value: '" + reader.previewString(20) + "'", "end of input", reader.currentOffset());
		}
	}

	@Override
	public Set<Flavor> supportedFlavors() {
		return lends ? Flavors.ALL : Flavors.NOT_BORROWABLE;
	}

	@Override
	public <T> T deserializeAny(Visitor<T> visitor) {
		Token token = reader.peekToken();
		return switch (token) {
			case NULL -> {
				reader.consumeFixedToken(token);
				yield visitor.visitUnit();
			}
			case TRUE, FALSE -> {
				reader.consumeFixedToken(token);
				yield visitor.visitBool(token == Token.TRUE);
			}
			case NUMBER -> visitNumber(reader.consumeNumber(), visitor, false);
			case STRING -> visitString(visitor, false);
			case START_ARRAY -> visitArray(visitor);
			case START_OBJECT -> visitObject(visitor);
			default -> throw unexpected(token, visitor);
		};
	}

	private MalformedInputException unexpected(Token token, Expected expected) {
		return new MalformedInputException("Unexpected " + token.description(), expected.expecting(), reader.currentOffset());
	}

	private <T> T visitNumber(CharSequence number, Visitor<T> visitor, boolean single) {
		String text = number.toString();
		if (!isIntegral(text)) {
			try {
				return single ? visitor.visitF32(Float.parseFloat(text)) : visitor.visitF64(Double.parseDouble(text));
			} catch (NumberFormatException e) {
				throw new MalformedInputException("Malformed number " + text, visitor.expecting(), reader.currentOffset(), e);
			}
		}
		if (text.length() <= 18) {
			long value = Long.parseLong(text);
			return (value < 0) ? visitor.visitI64(value) : visitor.visitU64(value);
		}
		BigInteger big = new BigInteger(text);
		if (big.signum() < 0) {
			if (big.bitLength() <= 63) {
				return visitor.visitI64(big.longValue());
			} else if (IntegerRanges.isI128(big)) {
				return visitor.visitI128(big);
			}
		} else {
			if (big.bitLength() <= 64) {
				return visitor.visitU64(big.longValue());
			} else if (IntegerRanges.isU128(big)) {
				return visitor.visitU128(big);
			}
		}
		// Beyond 128 bits, the nearest double is the best we can do
		return visitor.visitF64(big.doubleValue());
	}

	private static boolean isIntegral(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '.' || c == 'e' || c == 'E') {
				return false;
			}
		}
		return true;
	}

	/**
	 * @param owned whether the visitor asked for a string it intends to keep.
	 * It still gets a borrowed one if that is all it accepts.
	 */
	private <T> T visitString(Visitor<T> visitor, boolean owned) {
		Set<Flavor> accepted = visitor.acceptedFlavors();
		if (lends && accepted.contains(Flavor.BORROWED) && (!owned || !accepted.contains(Flavor.OWNED))) {
			BorrowedText borrowed = reader.tryBorrowString();
			if (borrowed != null) {
				return visitor.visitBorrowedStr(borrowed);
			}
		}
		scratch.setLength(0);
		reader.consumeStringContents(scratch);
		if (owned || !accepted.contains(Flavor.TRANSIENT)) {
			return visitor.visitString(scratch.toString());
		}
		try {
			return visitor.visitStr(scratch);
		} finally {
			scratch.setLength(0);
		}
	}

	private void enter(Expected expected) {
		if (++depth > settings.getMaxNestingDepth()) {
			throw new MalformedInputException("Nesting deeper than " + settings.getMaxNestingDepth(), expected.expecting(), reader.currentOffset());
		}
	}

	private void leave() {
		depth--;
	}

	private <T> T visitArray(Visitor<T> visitor) {
		enter(visitor);
		reader.consumeFixedToken(Token.START_ARRAY);
		ArrayAccess access = new ArrayAccess();
		T result = visitor.visitSeq(access);
		if (reader.peekToken() != Token.END_ARRAY) {
			throw new MalformedInputException("Trailing elements in array after " + access.count + " were read", visitor.expecting(), reader.currentOffset());
		}
		reader.consumeFixedToken(Token.END_ARRAY);
		leave();
		return result;
	}

	private <T> T visitObject(Visitor<T> visitor) {
		enter(visitor);
		reader.consumeFixedToken(Token.START_OBJECT);
		ObjectAccess access = new ObjectAccess();
		T result = visitor.visitMap(access);
		if (access.expectingValue) {
			throw new MalformedInputException("Visitor read a member name but not its value", visitor.expecting(), reader.currentOffset());
		}
		if (reader.peekToken() != Token.END_OBJECT) {
			throw new MalformedInputException("Trailing members in object after " + access.count + " were read", visitor.expecting(), reader.currentOffset());
		}
		reader.consumeFixedToken(Token.END_OBJECT);
		leave();
		return result;
	}

	@Override public <T> T deserializeBool(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI8(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI16(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI32(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI64(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI128(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU8(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU16(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU32(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU64(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU128(Visitor<T> visitor) { return deserializeAny(visitor); }

	@Override
	public <T> T deserializeF32(Visitor<T> visitor) {
		if (reader.peekToken() == Token.NUMBER) {
			return visitNumber(reader.consumeNumber(), visitor, true);
		}
		return deserializeAny(visitor);
	}

	@Override public <T> T deserializeF64(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeChar(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeStr(Visitor<T> visitor) { return deserializeAny(visitor); }

	@Override
	public <T> T deserializeString(Visitor<T> visitor) {
		if (reader.peekToken() == Token.STRING) {
			return visitString(visitor, true);
		}
		return deserializeAny(visitor);
	}

	@Override public <T> T deserializeBytes(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeByteBuf(Visitor<T> visitor) { return deserializeAny(visitor); }

	@Override
	public <T> T deserializeOption(Visitor<T> visitor) {
		if (reader.peekToken() == Token.NULL) {
			reader.consumeFixedToken(Token.NULL);
			return visitor.visitNone();
		}
		return visitor.visitSome(this);
	}

	@Override public <T> T deserializeUnit(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeUnitStruct(String name, Visitor<T> visitor) { return deserializeAny(visitor); }

	@Override
	public <T> T deserializeNewtypeStruct(String name, Visitor<T> visitor) {
		return visitor.visitNewtypeStruct(this);
	}

	@Override public <T> T deserializeSeq(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeTuple(int length, Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeTupleStruct(String name, int length, Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeMap(Visitor<T> visitor) { return deserializeAny(visitor); }

	/**
	 * Accepts an object, or an array holding the fields in order.
	 */
	@Override public <T> T deserializeStruct(String name, List<String> fields, Visitor<T> visitor) { return deserializeAny(visitor); }

	/**
	 * Accepts a string naming a unit variant, or an object with a single member
	 * whose name is the variant and whose value is the payload.
	 */
	@Override
	public <T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor) {
		Token token = reader.peekToken();
		if (token == Token.STRING) {
			return visitor.visitEnum(new BareVariant());
		} else if (token == Token.START_OBJECT) {
			enter(visitor);
			reader.consumeFixedToken(Token.START_OBJECT);
			T result = visitor.visitEnum(new TaggedVariant());
			if (reader.peekToken() != Token.END_OBJECT) {
				throw new MalformedInputException("Enum object must have exactly one member", visitor.expecting(), reader.currentOffset());
			}
			reader.consumeFixedToken(Token.END_OBJECT);
			leave();
			return result;
		} else {
			throw unexpected(token, visitor);
		}
	}

	@Override public <T> T deserializeIdentifier(Visitor<T> visitor) { return deserializeAny(visitor); }

	@Override
	public <T> T deserializeIgnoredAny(Visitor<T> visitor) {
		skipValue(visitor);
		return visitor.visitUnit();
	}

	private void skipValue(Expected expected) {
		Token token = reader.peekToken();
		switch (token) {
			case NULL, TRUE, FALSE -> reader.consumeFixedToken(token);
			case NUMBER -> reader.consumeNumber();
			case STRING -> reader.skipString();
			case START_ARRAY -> {
				enter(expected);
				reader.consumeFixedToken(token);
				boolean first = true;
				while (reader.peekToken() != Token.END_ARRAY) {
					if (!first) {
						reader.expectFixedToken(Token.COMMA);
					}
					first = false;
					skipValue(expected);
				}
				reader.consumeFixedToken(Token.END_ARRAY);
				leave();
			}
			case START_OBJECT -> {
				enter(expected);
				reader.consumeFixedToken(token);
				boolean first = true;
				while (reader.peekToken() != Token.END_OBJECT) {
					if (!first) {
						reader.expectFixedToken(Token.COMMA);
					}
					first = false;
					if (reader.peekToken() != Token.STRING) {
						throw new MalformedInputException("Object member names must be strings", expected.expecting(), reader.currentOffset());
					}
					reader.skipString();
					reader.expectFixedToken(Token.COLON);
					skipValue(expected);
				}
				reader.consumeFixedToken(Token.END_OBJECT);
				leave();
			}
			default -> throw unexpected(token, expected);
		}
	}

	@Override
	public String toString() {
		return "JsonDeserializer(offset=" + reader.currentOffset() + ")";
	}

	private final class ArrayAccess implements SeqAccess {
		int count = 0;

		@Override
		public <E> Optional<E> nextElement(Deserialize<E> element) {
			if (reader.peekToken() == Token.END_ARRAY) {
				return Optional.empty();
			}
			if (count > 0) {
				reader.expectFixedToken(Token.COMMA);
			}
			count++;
			return Optional.of(element.deserialize(JsonDeserializer.this));
		}
	}

	private final class ObjectAccess implements MapAccess {
		int count = 0;
		boolean expectingValue = false;

		@Override
		public <K> Optional<K> nextKey(Deserialize<K> key) {
			if (expectingValue) {
				throw new IllegalStateException("nextKey called before nextValue");
			}
			if (reader.peekToken() == Token.END_OBJECT) {
				return Optional.empty();
			}
			if (count > 0) {
				reader.expectFixedToken(Token.COMMA);
			}
			if (reader.peekToken() != Token.STRING) {
				throw new MalformedInputException("Object member names must be strings", "a member name", reader.currentOffset());
			}
			count++;
			K result = key.deserialize(new MemberNameDeserializer());
			reader.expectFixedToken(Token.COLON);
			expectingValue = true;
			return Optional.of(result);
		}

		@Override
		public <V> V nextValue(Deserialize<V> value) {
			if (!expectingValue) {
				throw new IllegalStateException("nextValue called without a key");
			}
			expectingValue = false;
			return value.deserialize(JsonDeserializer.this);
		}

		@Override
		public OptionalInt sizeHint() {
			return OptionalInt.empty();
		}
	}

	/**
	 * A unit variant written as its bare name.
	 */
	private final class BareVariant implements EnumAccess, VariantAccess {
		@Override
		public <V> Variant<V> variant(Deserialize<V> tag) {
			return new Variant<>(tag.deserialize(JsonDeserializer.this), this);
		}

		@Override
		public void unitVariant() {
			// The name was the whole value
		}

		@Override
		public <T> T newtypeVariant(Deserialize<T> value) {
			throw invalidType(Unexpected.unitVariant(), Expected.of("newtype variant"));
		}

		@Override
		public <T> T tupleVariant(int length, Visitor<T> visitor) {
			throw invalidType(Unexpected.unitVariant(), Expected.of("tuple variant"));
		}

		@Override
		public <T> T structVariant(List<String> fields, Visitor<T> visitor) {
			throw invalidType(Unexpected.unitVariant(), Expected.of("struct variant"));
		}
	}

	/**
	 * The inside of {@code {"Variant": payload}}, after the opening brace.
	 */
	private final class TaggedVariant implements EnumAccess, VariantAccess {
		@Override
		public <V> Variant<V> variant(Deserialize<V> tag) {
			if (reader.peekToken() != Token.STRING) {
				throw new MalformedInputException("Expected a variant name", "a variant name", reader.currentOffset());
			}
			V result = tag.deserialize(JsonDeserializer.this);
			reader.expectFixedToken(Token.COLON);
			return new Variant<>(result, this);
		}

		@Override
		public void unitVariant() {
			deserializeUnit(new Visitor<Void>() {
				@Override public String expecting() { return "null payload of a unit variant"; }
				@Override public Void visitUnit() { return null; }
			});
		}

		@Override
		public <T> T newtypeVariant(Deserialize<T> value) {
			return value.deserialize(JsonDeserializer.this);
		}

		@Override
		public <T> T tupleVariant(int length, Visitor<T> visitor) {
			return deserializeSeq(visitor);
		}

		@Override
		public <T> T structVariant(List<String> fields, Visitor<T> visitor) {
			return deserializeMap(visitor);
		}
	}

	/**
	 * Member names are always strings, but integer hints parse them as numbers,
	 * so maps with integer keys read back what {@link JsonSerializer} wrote.
	 */
	private final class MemberNameDeserializer implements Deserializer {
		private <T> T integer(Visitor<T> visitor) {
			scratch.setLength(0);
			reader.consumeStringContents(scratch);
			String text = scratch.toString();
			if (INTEGER_NAME.matcher(text).matches()) {
				return visitNumber(text, visitor, false);
			}
			return visitor.visitString(text);
		}

		@Override public Set<Flavor> supportedFlavors() { return Flavors.ALL; }
		@Override public <T> T deserializeAny(Visitor<T> visitor) { return visitString(visitor, false); }
		@Override public <T> T deserializeBool(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeI8(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeI16(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeI32(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeI64(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeI128(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeU8(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeU16(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeU32(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeU64(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeU128(Visitor<T> visitor) { return integer(visitor); }
		@Override public <T> T deserializeF32(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeF64(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeChar(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeStr(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeString(Visitor<T> visitor) { return visitString(visitor, true); }
		@Override public <T> T deserializeBytes(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeByteBuf(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeOption(Visitor<T> visitor) { return visitor.visitSome(this); }
		@Override public <T> T deserializeUnit(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeUnitStruct(String name, Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeNewtypeStruct(String name, Visitor<T> visitor) { return visitor.visitNewtypeStruct(this); }
		@Override public <T> T deserializeSeq(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeTuple(int length, Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeTupleStruct(String name, int length, Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeMap(Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeStruct(String name, List<String> fields, Visitor<T> visitor) { return deserializeAny(visitor); }
		@Override public <T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor) { return visitor.visitEnum(new BareVariant()); }
		@Override public <T> T deserializeIdentifier(Visitor<T> visitor) { return deserializeAny(visitor); }

		@Override
		public <T> T deserializeIgnoredAny(Visitor<T> visitor) {
			reader.skipString();
			return visitor.visitUnit();
		}
	}
}
