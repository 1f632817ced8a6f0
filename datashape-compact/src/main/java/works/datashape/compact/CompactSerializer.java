package works.datashape.compact;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import works.datashape.exceptions.SerializationException;
import works.datashape.model.IntegerRanges;
import works.datashape.model.Shape;
import works.datashape.ser.LengthTracker;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeMap;
import works.datashape.ser.SerializeSeq;
import works.datashape.ser.SerializeStruct;
import works.datashape.ser.SerializeStructVariant;
import works.datashape.ser.SerializeTuple;
import works.datashape.ser.SerializeTupleStruct;
import works.datashape.ser.SerializeTupleVariant;
import works.datashape.ser.Serializer;

/**
 * Writes each value in the compact binary format.
 * <p>
 * Numbers are fixed-width little-endian.
 * Strings, byte arrays, sequences and maps are preceded by their length as a u64;
 * tuples and structs are not, because the reader knows how many elements to expect.
 * Variants are preceded by their index as a u32.
 * Nothing identifies the shape of a value, and struct field names are not written.
 */
public final class CompactSerializer implements Serializer {
	private final OutputStream out;
	private final byte[] scratch = new byte[16];
	private final CharsetEncoder utf8 = StandardCharsets.UTF_8.newEncoder()
		.onMalformedInput(CodingErrorAction.REPORT)
		.onUnmappableCharacter(CodingErrorAction.REPORT);

	public CompactSerializer(OutputStream out) {
		this.out = out;
	}

	private void write(byte[] bytes, int start, int length) {
		try {
			out.write(bytes, start, length);
		} catch (IOException e) {
			throw new SerializationException("Unable to write compact output", e);
		}
	}

	private void writeByte(int b) {
		try {
			out.write(b);
		} catch (IOException e) {
			throw new SerializationException("Unable to write compact output", e);
		}
	}

	private void writeLittleEndian(long value, int width) {
		for (int i = 0; i < width; i++) {
			scratch[i] = (byte) (value >>> (8 * i));
		}
		write(scratch, 0, width);
	}

	/**
	 * Sixteen bytes of two's complement, least significant first.
	 * A non-negative value may have a 17-byte {@link BigInteger#toByteArray() byte array}
	 * whose extra leading byte is just the zero sign bit; it is dropped.
	 */
	private void write128(BigInteger value) {
		byte[] bigEndian = value.toByteArray();
		byte fill = (byte) ((value.signum() < 0) ? 0xFF : 0);
		for (int i = 0; i < 16; i++) {
			int index = bigEndian.length - 1 - i;
			scratch[i] = (index >= 0) ? bigEndian[index] : fill;
		}
		write(scratch, 0, 16);
	}

	private void writeLength(int length) {
		writeLittleEndian(length, 8);
	}

	private void writeVariantIndex(int variantIndex) {
		if (variantIndex < 0) {
			throw new SerializationException("Negative variant index " + variantIndex);
		}
		writeLittleEndian(variantIndex, 4);
	}

	@Override public void serializeBool(boolean value) { writeByte(value ? 1 : 0); }
	@Override public void serializeI8(byte value) { writeByte(value); }
	@Override public void serializeI16(short value) { writeLittleEndian(value, 2); }
	@Override public void serializeI32(int value) { writeLittleEndian(value, 4); }
	@Override public void serializeI64(long value) { writeLittleEndian(value, 8); }

	@Override
	public void serializeI128(BigInteger value) {
		if (!IntegerRanges.isI128(value)) {
			throw new SerializationException("Value out of range for i128: " + value);
		}
		write128(value);
	}

	@Override
	public void serializeU8(int value) {
		if (!IntegerRanges.isU8(value)) {
			throw new SerializationException("Value out of range for u8: " + value);
		}
		writeByte(value);
	}

	@Override
	public void serializeU16(int value) {
		if (!IntegerRanges.isU16(value)) {
			throw new SerializationException("Value out of range for u16: " + value);
		}
		writeLittleEndian(value, 2);
	}

	@Override
	public void serializeU32(long value) {
		if (!IntegerRanges.isU32(value)) {
			throw new SerializationException("Value out of range for u32: " + value);
		}
		writeLittleEndian(value, 4);
	}

	@Override public void serializeU64(long value) { writeLittleEndian(value, 8); }

	@Override
	public void serializeU128(BigInteger value) {
		if (!IntegerRanges.isU128(value)) {
			throw new SerializationException("Value out of range for u128: " + value);
		}
		write128(value);
	}

	@Override public void serializeF32(float value) { writeLittleEndian(Float.floatToRawIntBits(value), 4); }
	@Override public void serializeF64(double value) { writeLittleEndian(Double.doubleToRawLongBits(value), 8); }

	@Override
	public void serializeChar(int codePoint) {
		if (!IntegerRanges.isUnicodeScalar(codePoint)) {
			throw new SerializationException("Not a Unicode scalar value: 0x" + Integer.toHexString(codePoint));
		}
		writeLittleEndian(codePoint, 4);
	}

	@Override
	public void serializeStr(CharSequence value) {
		ByteBuffer encoded;
		try {
			encoded = utf8.encode(CharBuffer.wrap(value));
		} catch (CharacterCodingException e) {
			throw new SerializationException("String is not well-formed UTF-16", e);
		}
		writeBytes(encoded);
	}

	@Override
	public void serializeBytes(ByteBuffer value) {
		writeBytes(value.duplicate());
	}

	private void writeBytes(ByteBuffer bytes) {
		int length = bytes.remaining();
		writeLength(length);
		if (bytes.hasArray()) {
			write(bytes.array(), bytes.arrayOffset() + bytes.position(), length);
		} else {
			byte[] copy = new byte[length];
			bytes.get(copy);
			write(copy, 0, length);
		}
	}

	@Override public void serializeNone() { writeByte(0); }

	@Override
	public void serializeSome(Serialize value) {
		writeByte(1);
		value.serialize(this);
	}

	@Override public void serializeUnit() { }
	@Override public void serializeUnitStruct(String name) { }
	@Override public void serializeUnitVariant(String name, int variantIndex, String variant) { writeVariantIndex(variantIndex); }
	@Override public void serializeNewtypeStruct(String name, Serialize value) { value.serialize(this); }

	@Override
	public void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value) {
		writeVariantIndex(variantIndex);
		value.serialize(this);
	}

	@Override
	public SerializeSeq serializeSeq(OptionalInt length) {
		return new ElementSession(LengthTracker.of(Shape.SEQ, requireLength(length)), true);
	}

	@Override
	public SerializeTuple serializeTuple(int length) {
		return new ElementSession(LengthTracker.of(Shape.TUPLE, length), false);
	}

	@Override
	public SerializeTupleStruct serializeTupleStruct(String name, int length) {
		return new ElementSession(LengthTracker.of(Shape.TUPLE_STRUCT, length), false);
	}

	@Override
	public SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length) {
		LengthTracker tracker = LengthTracker.of(Shape.TUPLE_VARIANT, length);
		writeVariantIndex(variantIndex);
		return new ElementSession(tracker, false);
	}

	@Override
	public SerializeMap serializeMap(OptionalInt length) {
		return new EntrySession(LengthTracker.of(Shape.MAP, requireLength(length)));
	}

	@Override
	public SerializeStruct serializeStruct(String name, int length) {
		return new FieldSession(LengthTracker.of(Shape.STRUCT, length));
	}

	@Override
	public SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length) {
		LengthTracker tracker = LengthTracker.of(Shape.STRUCT_VARIANT, length);
		writeVariantIndex(variantIndex);
		return new FieldSession(tracker);
	}

	@Override
	public boolean isHumanReadable() {
		return false;
	}

	private static int requireLength(OptionalInt length) {
		if (length.isEmpty()) {
			throw new SerializationException("compact format requires sequence lengths");
		}
		return length.getAsInt();
	}

	private final class ElementSession implements SerializeSeq, SerializeTuple, SerializeTupleStruct, SerializeTupleVariant {
		final LengthTracker tracker;

		ElementSession(LengthTracker tracker, boolean prefixed) {
			this.tracker = tracker;
			if (prefixed) {
				writeLength(tracker.declared().getAsInt());
			}
		}

		@Override
		public void serializeElement(Serialize value) {
			tracker.element();
			value.serialize(CompactSerializer.this);
		}

		@Override
		public void serializeField(Serialize value) {
			serializeElement(value);
		}

		@Override
		public void end() {
			tracker.finish();
		}
	}

	private final class EntrySession implements SerializeMap {
		final LengthTracker tracker;
		boolean expectingValue = false;

		EntrySession(LengthTracker tracker) {
			this.tracker = tracker;
			writeLength(tracker.declared().getAsInt());
		}

		@Override
		public void serializeKey(Serialize key) {
			if (expectingValue) {
				throw new SerializationException("serializeKey called twice without serializeValue");
			}
			tracker.element();
			key.serialize(CompactSerializer.this);
			expectingValue = true;
		}

		@Override
		public void serializeValue(Serialize value) {
			if (!expectingValue) {
				throw new SerializationException("serializeValue called without serializeKey");
			}
			expectingValue = false;
			value.serialize(CompactSerializer.this);
		}

		@Override
		public void end() {
			if (expectingValue) {
				throw new SerializationException("Map ended after a key with no value");
			}
			tracker.finish();
		}
	}

	/**
	 * Fields are written in order, without their names.
	 */
	private final class FieldSession implements SerializeStruct, SerializeStructVariant {
		final LengthTracker tracker;

		FieldSession(LengthTracker tracker) {
			this.tracker = tracker;
		}

		@Override
		public void serializeField(String key, Serialize value) {
			tracker.element();
			value.serialize(CompactSerializer.this);
		}

		@Override
		public void skipField(String key) {
			throw new SerializationException("compact format cannot skip struct field `" + key + "`: fields are positional");
		}

		@Override
		public void end() {
			tracker.finish();
		}
	}
}
