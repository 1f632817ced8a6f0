package works.datashape.value;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.OptionalInt;
import works.datashape.de.Deserializer;
import works.datashape.model.IntegerRanges;
import works.datashape.model.Shape;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeMap;
import works.datashape.ser.SerializeSeq;
import works.datashape.ser.SerializeStruct;
import works.datashape.ser.SerializeStructVariant;
import works.datashape.ser.SerializeTuple;
import works.datashape.ser.SerializeTupleStruct;
import works.datashape.ser.SerializeTupleVariant;
import works.datashape.ser.Serializer;

import static java.util.Objects.requireNonNull;

/**
 * A dynamically typed value of any {@link Shape}.
 * <p>
 * Serializing a {@code Value} replays exactly the shape it holds,
 * so {@link ValueSerializer#toValue} followed by serializing the result
 * produces the same calls as the original.
 * Decoding into a {@code Value} from a self-describing format, using {@link ValueVisitor},
 * keeps whatever the format can tell apart;
 * a struct read back from a format that writes structs as maps
 * becomes a {@link MapValue}, for instance.
 */
public sealed interface Value extends Serialize permits
	Value.Bool,
	Value.Int,
	Value.BigInt,
	Value.Float,
	Value.Char,
	Value.Str,
	Value.Bytes,
	Value.None,
	Value.Some,
	Value.UnitValue,
	Value.UnitStruct,
	Value.UnitVariant,
	Value.Newtype,
	Value.NewtypeVariant,
	Value.Seq,
	Value.Tuple,
	Value.TupleStruct,
	Value.TupleVariant,
	Value.MapValue,
	Value.Struct,
	Value.StructVariant
{
	Shape shape();

	/**
	 * @return a self-describing deserializer that reads this value
	 */
	default Deserializer deserializer() {
		return new ValueDeserializer(this);
	}

	record Bool(boolean value) implements Value {
		@Override public Shape shape() { return Shape.BOOL; }
		@Override public void serialize(Serializer s) { s.serializeBool(value); }
	}

	/**
	 * Any integer shape of 64 bits or fewer.
	 * For {@link Shape#U64}, the bit pattern of {@code value} is read as unsigned.
	 */
	record Int(Shape shape, long value) implements Value {
		public Int {
			switch (shape) {
				case I8 -> checkRange(value == (byte) value, shape, value);
				case I16 -> checkRange(value == (short) value, shape, value);
				case I32 -> checkRange(value == (int) value, shape, value);
				case U8 -> checkRange(IntegerRanges.isU8(value), shape, value);
				case U16 -> checkRange(IntegerRanges.isU16(value), shape, value);
				case U32 -> checkRange(IntegerRanges.isU32(value), shape, value);
				case I64, U64 -> { }
				default -> throw new IllegalArgumentException("Not a 64-bit integer shape: " + shape);
			}
		}

		public static Int i8(int v) { return new Int(Shape.I8, v); }
		public static Int i16(int v) { return new Int(Shape.I16, v); }
		public static Int i32(int v) { return new Int(Shape.I32, v); }
		public static Int i64(long v) { return new Int(Shape.I64, v); }
		public static Int u8(int v) { return new Int(Shape.U8, v); }
		public static Int u16(int v) { return new Int(Shape.U16, v); }
		public static Int u32(long v) { return new Int(Shape.U32, v); }
		public static Int u64(long v) { return new Int(Shape.U64, v); }

		@Override
		public void serialize(Serializer s) {
			switch (shape) {
				case I8 -> s.serializeI8((byte) value);
				case I16 -> s.serializeI16((short) value);
				case I32 -> s.serializeI32((int) value);
				case I64 -> s.serializeI64(value);
				case U8 -> s.serializeU8((int) value);
				case U16 -> s.serializeU16((int) value);
				case U32 -> s.serializeU32(value);
				case U64 -> s.serializeU64(value);
				default -> throw new AssertionError("Unexpected shape: " + shape);
			}
		}

		@Override
		public String toString() {
			String digits = (shape == Shape.U64) ? Long.toUnsignedString(value) : Long.toString(value);
			return digits + shape.name().toLowerCase();
		}

		private static void checkRange(boolean inRange, Shape shape, long value) {
			if (!inRange) {
				throw new IllegalArgumentException(value + " is out of range for " + shape);
			}
		}
	}

	record BigInt(Shape shape, BigInteger value) implements Value {
		public BigInt {
			requireNonNull(value);
			switch (shape) {
				case I128 -> {
					if (!IntegerRanges.isI128(value)) {
						throw new IllegalArgumentException(value + " is out of range for " + shape);
					}
				}
				case U128 -> {
					if (!IntegerRanges.isU128(value)) {
						throw new IllegalArgumentException(value + " is out of range for " + shape);
					}
				}
				default -> throw new IllegalArgumentException("Not a 128-bit integer shape: " + shape);
			}
		}

		@Override
		public void serialize(Serializer s) {
			if (shape == Shape.I128) {
				s.serializeI128(value);
			} else {
				s.serializeU128(value);
			}
		}
	}

	/**
	 * For {@link Shape#F32}, {@code value} holds a float exactly.
	 */
	record Float(Shape shape, double value) implements Value {
		public Float {
			if (shape != Shape.F32 && shape != Shape.F64) {
				throw new IllegalArgumentException("Not a floating-point shape: " + shape);
			}
		}

		public static Float f32(float v) { return new Float(Shape.F32, v); }
		public static Float f64(double v) { return new Float(Shape.F64, v); }

		@Override
		public void serialize(Serializer s) {
			if (shape == Shape.F32) {
				s.serializeF32((float) value);
			} else {
				s.serializeF64(value);
			}
		}

		/**
		 * Compares bit patterns, so NaN equals itself.
		 */
		@Override
		public boolean equals(Object obj) {
			return obj instanceof Float other
				&& shape == other.shape
				&& Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
		}

		@Override
		public int hashCode() {
			return shape.hashCode() * 31 + Double.hashCode(value);
		}
	}

	record Char(int codePoint) implements Value {
		public Char {
			if (!IntegerRanges.isUnicodeScalar(codePoint)) {
				throw new IllegalArgumentException("Not a Unicode scalar value: " + Integer.toHexString(codePoint));
			}
		}

		@Override public Shape shape() { return Shape.CHAR; }
		@Override public void serialize(Serializer s) { s.serializeChar(codePoint); }
	}

	record Str(String value) implements Value {
		public Str {
			requireNonNull(value);
		}

		@Override public Shape shape() { return Shape.STRING; }
		@Override public void serialize(Serializer s) { s.serializeStr(value); }
	}

	record Bytes(byte[] value) implements Value {
		public Bytes {
			value = value.clone();
		}

		@Override
		public byte[] value() {
			return value.clone();
		}

		@Override public Shape shape() { return Shape.BYTES; }
		@Override public void serialize(Serializer s) { s.serializeBytes(value.clone()); }

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Bytes other && Arrays.equals(value, other.value);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(value);
		}

		@Override
		public String toString() {
			return "Bytes[" + HexFormat.of().formatHex(value) + "]";
		}
	}

	record None() implements Value {
		@Override public Shape shape() { return Shape.OPTION; }
		@Override public void serialize(Serializer s) { s.serializeNone(); }
	}

	record Some(Value value) implements Value {
		public Some {
			requireNonNull(value);
		}

		@Override public Shape shape() { return Shape.OPTION; }
		@Override public void serialize(Serializer s) { s.serializeSome(value); }
	}

	record UnitValue() implements Value {
		@Override public Shape shape() { return Shape.UNIT; }
		@Override public void serialize(Serializer s) { s.serializeUnit(); }
	}

	record UnitStruct(String name) implements Value {
		@Override public Shape shape() { return Shape.UNIT_STRUCT; }
		@Override public void serialize(Serializer s) { s.serializeUnitStruct(name); }
	}

	record UnitVariant(String name, int variantIndex, String variant) implements Value {
		@Override public Shape shape() { return Shape.UNIT_VARIANT; }
		@Override public void serialize(Serializer s) { s.serializeUnitVariant(name, variantIndex, variant); }
	}

	record Newtype(String name, Value value) implements Value {
		@Override public Shape shape() { return Shape.NEWTYPE_STRUCT; }
		@Override public void serialize(Serializer s) { s.serializeNewtypeStruct(name, value); }
	}

	record NewtypeVariant(String name, int variantIndex, String variant, Value value) implements Value {
		@Override public Shape shape() { return Shape.NEWTYPE_VARIANT; }
		@Override public void serialize(Serializer s) { s.serializeNewtypeVariant(name, variantIndex, variant, value); }
	}

	record Seq(List<Value> elements) implements Value {
		public Seq {
			elements = List.copyOf(elements);
		}

		@Override public Shape shape() { return Shape.SEQ; }

		@Override
		public void serialize(Serializer s) {
			SerializeSeq seq = s.serializeSeq(OptionalInt.of(elements.size()));
			elements.forEach(seq::serializeElement);
			seq.end();
		}
	}

	record Tuple(List<Value> elements) implements Value {
		public Tuple {
			elements = List.copyOf(elements);
		}

		@Override public Shape shape() { return Shape.TUPLE; }

		@Override
		public void serialize(Serializer s) {
			SerializeTuple tuple = s.serializeTuple(elements.size());
			elements.forEach(tuple::serializeElement);
			tuple.end();
		}
	}

	record TupleStruct(String name, List<Value> elements) implements Value {
		public TupleStruct {
			elements = List.copyOf(elements);
		}

		@Override public Shape shape() { return Shape.TUPLE_STRUCT; }

		@Override
		public void serialize(Serializer s) {
			SerializeTupleStruct tuple = s.serializeTupleStruct(name, elements.size());
			elements.forEach(tuple::serializeField);
			tuple.end();
		}
	}

	record TupleVariant(String name, int variantIndex, String variant, List<Value> elements) implements Value {
		public TupleVariant {
			elements = List.copyOf(elements);
		}

		@Override public Shape shape() { return Shape.TUPLE_VARIANT; }

		@Override
		public void serialize(Serializer s) {
			SerializeTupleVariant tuple = s.serializeTupleVariant(name, variantIndex, variant, elements.size());
			elements.forEach(tuple::serializeField);
			tuple.end();
		}
	}

	/**
	 * Entries are kept in order, and duplicate keys are allowed,
	 * since the value reflects the input rather than any particular map type.
	 */
	record MapValue(List<Entry> entries) implements Value {
		public MapValue {
			entries = List.copyOf(entries);
		}

		@Override public Shape shape() { return Shape.MAP; }

		@Override
		public void serialize(Serializer s) {
			SerializeMap map = s.serializeMap(OptionalInt.of(entries.size()));
			for (Entry entry : entries) {
				map.serializeEntry(entry.key(), entry.value());
			}
			map.end();
		}
	}

	record Entry(Value key, Value value) { }

	record Struct(String name, List<Field> fields) implements Value {
		public Struct {
			fields = List.copyOf(fields);
		}

		@Override public Shape shape() { return Shape.STRUCT; }

		@Override
		public void serialize(Serializer s) {
			SerializeStruct struct = s.serializeStruct(name, fields.size());
			for (Field field : fields) {
				struct.serializeField(field.name(), field.value());
			}
			struct.end();
		}
	}

	record Field(String name, Value value) { }

	record StructVariant(String name, int variantIndex, String variant, List<Field> fields) implements Value {
		public StructVariant {
			fields = List.copyOf(fields);
		}

		@Override public Shape shape() { return Shape.STRUCT_VARIANT; }

		@Override
		public void serialize(Serializer s) {
			SerializeStructVariant struct = s.serializeStructVariant(name, variantIndex, variant, fields.size());
			for (Field field : fields) {
				struct.serializeField(field.name(), field.value());
			}
			struct.end();
		}
	}
}
