package works.datashape.json;

import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.ByteBuffer;
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
 * Writes each value as JSON text.
 * <p>
 * Enum variants with a payload are externally tagged, as a single-member object
 * whose name is the variant and whose value is the payload.
 * Unit variants are just their name as a string.
 */
public final class JsonSerializer implements Serializer {
	private final Writer out;
	private final JsonSettings settings;
	private int depth = 0;

	public JsonSerializer(Writer out, JsonSettings settings) {
		this.out = out;
		this.settings = settings;
	}

	public JsonSerializer(Writer out) {
		this(out, JsonSettings.DEFAULT);
	}

	private void print(String s) {
		try {
			out.write(s);
		} catch (IOException e) {
			throw new SerializationException("Unable to write JSON", e);
		}
	}

	private void print(char c) {
		try {
			out.write(c);
		} catch (IOException e) {
			throw new SerializationException("Unable to write JSON", e);
		}
	}

	@Override public void serializeBool(boolean value) { print(value ? Token.TRUE.fixedRepresentation() : Token.FALSE.fixedRepresentation()); }
	@Override public void serializeI8(byte value) { print(Long.toString(value)); }
	@Override public void serializeI16(short value) { print(Long.toString(value)); }
	@Override public void serializeI32(int value) { print(Long.toString(value)); }
	@Override public void serializeI64(long value) { print(Long.toString(value)); }

	@Override
	public void serializeI128(BigInteger value) {
		if (!IntegerRanges.isI128(value)) {
			throw new SerializationException("Value out of range for i128: " + value);
		}
		print(value.toString());
	}

	@Override
	public void serializeU8(int value) {
		if (!IntegerRanges.isU8(value)) {
			throw new SerializationException("Value out of range for u8: " + value);
		}
		print(Integer.toString(value));
	}

	@Override
	public void serializeU16(int value) {
		if (!IntegerRanges.isU16(value)) {
			throw new SerializationException("Value out of range for u16: " + value);
		}
		print(Integer.toString(value));
	}

	@Override
	public void serializeU32(long value) {
		if (!IntegerRanges.isU32(value)) {
			throw new SerializationException("Value out of range for u32: " + value);
		}
		print(Long.toString(value));
	}

	@Override public void serializeU64(long value) { print(Long.toUnsignedString(value)); }

	@Override
	public void serializeU128(BigInteger value) {
		if (!IntegerRanges.isU128(value)) {
			throw new SerializationException("Value out of range for u128: " + value);
		}
		print(value.toString());
	}

	@Override
	public void serializeF32(float value) {
		requireFinite(value);
		print(Float.toString(value));
	}

	@Override
	public void serializeF64(double value) {
		requireFinite(value);
		print(Double.toString(value));
	}

	private static void requireFinite(double value) {
		if (Double.isNaN(value)) {
			throw new SerializationException("JSON cannot represent NaN");
		} else if (Double.isInfinite(value)) {
			throw new SerializationException("JSON cannot represent " + value);
		}
	}

	@Override
	public void serializeChar(int codePoint) {
		if (!IntegerRanges.isUnicodeScalar(codePoint)) {
			throw new SerializationException("Not a Unicode scalar value: 0x" + Integer.toHexString(codePoint));
		}
		print(stringLiteral(new String(Character.toChars(codePoint))));
	}

	@Override
	public void serializeStr(CharSequence value) {
		print(stringLiteral(value));
	}

	String stringLiteral(CharSequence s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				case '\b': sb.append("\\b"); break;
				case '\f': sb.append("\\f"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\t': sb.append("\\t"); break;
				default:
					if (c < 0x20 || c == 0x7F || (c > 0x7E && settings.isEscapeNonAscii())) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		sb.append('"');
		return sb.toString();
	}

	/**
	 * JSON has no byte strings, so bytes become an array of numbers.
	 */
	@Override
	public void serializeBytes(ByteBuffer value) {
		SerializeSeq seq = serializeSeq(OptionalInt.of(value.remaining()));
		ByteBuffer source = value.duplicate();
		while (source.hasRemaining()) {
			int b = source.get() & 0xFF;
			seq.serializeElement(s -> s.serializeU8(b));
		}
		seq.end();
	}

	@Override public void serializeNone() { print(Token.NULL.fixedRepresentation()); }
	@Override public void serializeSome(Serialize value) { value.serialize(this); }
	@Override public void serializeUnit() { print(Token.NULL.fixedRepresentation()); }
	@Override public void serializeUnitStruct(String name) { print(Token.NULL.fixedRepresentation()); }
	@Override public void serializeUnitVariant(String name, int variantIndex, String variant) { serializeStr(variant); }
	@Override public void serializeNewtypeStruct(String name, Serialize value) { value.serialize(this); }

	@Override
	public void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value) {
		openTag(variant);
		value.serialize(this);
		closeTag();
	}

	@Override
	public SerializeSeq serializeSeq(OptionalInt length) {
		return new ArraySession(LengthTracker.of(Shape.SEQ, length), false);
	}

	@Override
	public SerializeTuple serializeTuple(int length) {
		return new ArraySession(LengthTracker.of(Shape.TUPLE, length), false);
	}

	@Override
	public SerializeTupleStruct serializeTupleStruct(String name, int length) {
		return new ArraySession(LengthTracker.of(Shape.TUPLE_STRUCT, length), false);
	}

	@Override
	public SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length) {
		LengthTracker tracker = LengthTracker.of(Shape.TUPLE_VARIANT, length);
		openTag(variant);
		return new ArraySession(tracker, true);
	}

	@Override
	public SerializeMap serializeMap(OptionalInt length) {
		return new ObjectSession(LengthTracker.of(Shape.MAP, length), false);
	}

	@Override
	public SerializeStruct serializeStruct(String name, int length) {
		return new ObjectSession(LengthTracker.of(Shape.STRUCT, length), false);
	}

	@Override
	public SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length) {
		LengthTracker tracker = LengthTracker.of(Shape.STRUCT_VARIANT, length);
		openTag(variant);
		return new ObjectSession(tracker, true);
	}

	private void openTag(String variant) {
		open('{');
		newline();
		print(stringLiteral(variant));
		print(nameSeparator());
	}

	private void closeTag() {
		close('}', true);
	}

	private void open(char bracket) {
		print(bracket);
		depth++;
	}

	private void close(char bracket, boolean nonEmpty) {
		depth--;
		if (nonEmpty) {
			newline();
		}
		print(bracket);
	}

	private void newline() {
		if (settings.isPrettyPrint()) {
			print('\n');
			print("  ".repeat(depth));
		}
	}

	private String nameSeparator() {
		return settings.isPrettyPrint() ? ": " : ":";
	}

	private final class ArraySession implements SerializeSeq, SerializeTuple, SerializeTupleStruct, SerializeTupleVariant {
		final LengthTracker tracker;
		final boolean tagged;

		ArraySession(LengthTracker tracker, boolean tagged) {
			this.tracker = tracker;
			this.tagged = tagged;
			open('[');
		}

		@Override
		public void serializeElement(Serialize value) {
			tracker.element();
			if (tracker.count() > 1) {
				print(',');
			}
			newline();
			value.serialize(JsonSerializer.this);
		}

		@Override
		public void serializeField(Serialize value) {
			serializeElement(value);
		}

		@Override
		public void end() {
			tracker.finish();
			close(']', tracker.count() > 0);
			if (tagged) {
				closeTag();
			}
		}
	}

	private final class ObjectSession implements SerializeMap, SerializeStruct, SerializeStructVariant {
		final LengthTracker tracker;
		final boolean tagged;
		int written = 0;
		boolean expectingValue = false;

		ObjectSession(LengthTracker tracker, boolean tagged) {
			this.tracker = tracker;
			this.tagged = tagged;
			open('{');
		}

		private void beforeMember() {
			if (written++ > 0) {
				print(',');
			}
			newline();
		}

		@Override
		public void serializeKey(Serialize key) {
			if (expectingValue) {
				throw new SerializationException("serializeKey called twice without serializeValue");
			}
			tracker.element();
			beforeMember();
			key.serialize(new MapKeySerializer());
			print(nameSeparator());
			expectingValue = true;
		}

		@Override
		public void serializeValue(Serialize value) {
			if (!expectingValue) {
				throw new SerializationException("serializeValue called without serializeKey");
			}
			expectingValue = false;
			value.serialize(JsonSerializer.this);
		}

		@Override
		public void serializeField(String key, Serialize value) {
			tracker.element();
			beforeMember();
			print(stringLiteral(key));
			print(nameSeparator());
			value.serialize(JsonSerializer.this);
		}

		@Override
		public void skipField(String key) {
			tracker.element();
		}

		@Override
		public void end() {
			if (expectingValue) {
				throw new SerializationException("Map ended after a key with no value");
			}
			tracker.finish();
			close('}', written > 0);
			if (tagged) {
				closeTag();
			}
		}
	}

	/**
	 * JSON member names are strings, so keys must be strings or
	 * something with an obvious string form: integers, chars, and unit variants.
	 */
	private final class MapKeySerializer implements Serializer {
		private SerializationException notAKey(Shape shape) {
			return new SerializationException("JSON map keys must be strings or integers, not " + shape.expecting());
		}

		private void quoted(String text) {
			print('"');
			print(text);
			print('"');
		}

		@Override public void serializeBool(boolean value) { throw notAKey(Shape.BOOL); }
		@Override public void serializeI8(byte value) { quoted(Long.toString(value)); }
		@Override public void serializeI16(short value) { quoted(Long.toString(value)); }
		@Override public void serializeI32(int value) { quoted(Long.toString(value)); }
		@Override public void serializeI64(long value) { quoted(Long.toString(value)); }
		@Override public void serializeI128(BigInteger value) { quoted(value.toString()); }
		@Override public void serializeU8(int value) { quoted(Integer.toString(value)); }
		@Override public void serializeU16(int value) { quoted(Integer.toString(value)); }
		@Override public void serializeU32(long value) { quoted(Long.toString(value)); }
		@Override public void serializeU64(long value) { quoted(Long.toUnsignedString(value)); }
		@Override public void serializeU128(BigInteger value) { quoted(value.toString()); }
		@Override public void serializeF32(float value) { throw notAKey(Shape.F32); }
		@Override public void serializeF64(double value) { throw notAKey(Shape.F64); }
		@Override public void serializeChar(int codePoint) { JsonSerializer.this.serializeChar(codePoint); }
		@Override public void serializeStr(CharSequence value) { JsonSerializer.this.serializeStr(value); }
		@Override public void serializeBytes(ByteBuffer value) { throw notAKey(Shape.BYTES); }
		@Override public void serializeNone() { throw notAKey(Shape.OPTION); }
		@Override public void serializeSome(Serialize value) { throw notAKey(Shape.OPTION); }
		@Override public void serializeUnit() { throw notAKey(Shape.UNIT); }
		@Override public void serializeUnitStruct(String name) { throw notAKey(Shape.UNIT_STRUCT); }
		@Override public void serializeUnitVariant(String name, int variantIndex, String variant) { JsonSerializer.this.serializeStr(variant); }
		@Override public void serializeNewtypeStruct(String name, Serialize value) { value.serialize(this); }
		@Override public void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value) { throw notAKey(Shape.NEWTYPE_VARIANT); }
		@Override public SerializeSeq serializeSeq(OptionalInt length) { throw notAKey(Shape.SEQ); }
		@Override public SerializeTuple serializeTuple(int length) { throw notAKey(Shape.TUPLE); }
		@Override public SerializeTupleStruct serializeTupleStruct(String name, int length) { throw notAKey(Shape.TUPLE_STRUCT); }
		@Override public SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length) { throw notAKey(Shape.TUPLE_VARIANT); }
		@Override public SerializeMap serializeMap(OptionalInt length) { throw notAKey(Shape.MAP); }
		@Override public SerializeStruct serializeStruct(String name, int length) { throw notAKey(Shape.STRUCT); }
		@Override public SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length) { throw notAKey(Shape.STRUCT_VARIANT); }
		@Override public boolean isHumanReadable() { return true; }
	}
}
