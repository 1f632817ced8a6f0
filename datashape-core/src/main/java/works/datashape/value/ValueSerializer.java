package works.datashape.value;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
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
 * A {@link Serializer} whose output is a {@link Value} tree.
 * An in-memory format: every shape is preserved exactly.
 */
public final class ValueSerializer implements Serializer {
	private Value result;

	private ValueSerializer() {}

	public static Value toValue(Serialize value) {
		ValueSerializer serializer = new ValueSerializer();
		value.serialize(serializer);
		if (serializer.result == null) {
			throw new SerializationException("Nothing was serialized");
		}
		return serializer.result;
	}

	private void emit(Value value) {
		if (result != null) {
			throw new SerializationException("Only one value may be serialized; already have " + result.shape());
		}
		result = value;
	}

	@Override public void serializeBool(boolean value) { emit(new Value.Bool(value)); }
	@Override public void serializeI8(byte value) { emit(Value.Int.i8(value)); }
	@Override public void serializeI16(short value) { emit(Value.Int.i16(value)); }
	@Override public void serializeI32(int value) { emit(Value.Int.i32(value)); }
	@Override public void serializeI64(long value) { emit(Value.Int.i64(value)); }

	@Override
	public void serializeI128(BigInteger value) {
		if (!IntegerRanges.isI128(value)) {
			throw new SerializationException(value + " is out of range for i128");
		}
		emit(new Value.BigInt(Shape.I128, value));
	}

	@Override
	public void serializeU8(int value) {
		if (!IntegerRanges.isU8(value)) {
			throw new SerializationException(value + " is out of range for u8");
		}
		emit(Value.Int.u8(value));
	}

	@Override
	public void serializeU16(int value) {
		if (!IntegerRanges.isU16(value)) {
			throw new SerializationException(value + " is out of range for u16");
		}
		emit(Value.Int.u16(value));
	}

	@Override
	public void serializeU32(long value) {
		if (!IntegerRanges.isU32(value)) {
			throw new SerializationException(value + " is out of range for u32");
		}
		emit(Value.Int.u32(value));
	}

	@Override public void serializeU64(long value) { emit(Value.Int.u64(value)); }

	@Override
	public void serializeU128(BigInteger value) {
		if (!IntegerRanges.isU128(value)) {
			throw new SerializationException(value + " is out of range for u128");
		}
		emit(new Value.BigInt(Shape.U128, value));
	}

	@Override public void serializeF32(float value) { emit(Value.Float.f32(value)); }
	@Override public void serializeF64(double value) { emit(Value.Float.f64(value)); }

	@Override
	public void serializeChar(int codePoint) {
		if (!IntegerRanges.isUnicodeScalar(codePoint)) {
			throw new SerializationException("Not a Unicode scalar value: " + Integer.toHexString(codePoint));
		}
		emit(new Value.Char(codePoint));
	}

	@Override public void serializeStr(CharSequence value) { emit(new Value.Str(value.toString())); }

	@Override
	public void serializeBytes(ByteBuffer value) {
		byte[] bytes = new byte[value.remaining()];
		value.duplicate().get(bytes);
		emit(new Value.Bytes(bytes));
	}

	@Override public void serializeNone() { emit(new Value.None()); }
	@Override public void serializeSome(Serialize value) { emit(new Value.Some(toValue(value))); }
	@Override public void serializeUnit() { emit(new Value.UnitValue()); }
	@Override public void serializeUnitStruct(String name) { emit(new Value.UnitStruct(name)); }

	@Override
	public void serializeUnitVariant(String name, int variantIndex, String variant) {
		emit(new Value.UnitVariant(name, variantIndex, variant));
	}

	@Override
	public void serializeNewtypeStruct(String name, Serialize value) {
		emit(new Value.Newtype(name, toValue(value)));
	}

	@Override
	public void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value) {
		emit(new Value.NewtypeVariant(name, variantIndex, variant, toValue(value)));
	}

	@Override
	public SerializeSeq serializeSeq(OptionalInt length) {
		return new Elements(LengthTracker.of(Shape.SEQ, length)) {
			@Override Value finish(List<Value> elements) { return new Value.Seq(elements); }
		};
	}

	@Override
	public SerializeTuple serializeTuple(int length) {
		return new Elements(LengthTracker.of(Shape.TUPLE, length)) {
			@Override Value finish(List<Value> elements) { return new Value.Tuple(elements); }
		};
	}

	@Override
	public SerializeTupleStruct serializeTupleStruct(String name, int length) {
		return new Elements(LengthTracker.of(Shape.TUPLE_STRUCT, length)) {
			@Override Value finish(List<Value> elements) { return new Value.TupleStruct(name, elements); }
		};
	}

	@Override
	public SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length) {
		return new Elements(LengthTracker.of(Shape.TUPLE_VARIANT, length)) {
			@Override Value finish(List<Value> elements) { return new Value.TupleVariant(name, variantIndex, variant, elements); }
		};
	}

	@Override
	public SerializeMap serializeMap(OptionalInt length) {
		LengthTracker tracker = LengthTracker.of(Shape.MAP, length);
		List<Value.Entry> entries = new ArrayList<>();
		return new SerializeMap() {
			Value pendingKey;

			@Override
			public void serializeKey(Serialize key) {
				if (pendingKey != null) {
					throw new SerializationException("Map key serialized twice without a value");
				}
				tracker.element();
				pendingKey = toValue(key);
			}

			@Override
			public void serializeValue(Serialize value) {
				if (pendingKey == null) {
					throw new SerializationException("Map value serialized without a key");
				}
				entries.add(new Value.Entry(pendingKey, toValue(value)));
				pendingKey = null;
			}

			@Override
			public void end() {
				if (pendingKey != null) {
					throw new SerializationException("Map ended with a key that has no value");
				}
				tracker.finish();
				emit(new Value.MapValue(entries));
			}
		};
	}

	@Override
	public SerializeStruct serializeStruct(String name, int length) {
		return new Fields(LengthTracker.of(Shape.STRUCT, length)) {
			@Override Value finish(List<Value.Field> fields) { return new Value.Struct(name, fields); }
		};
	}

	@Override
	public SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length) {
		return new Fields(LengthTracker.of(Shape.STRUCT_VARIANT, length)) {
			@Override Value finish(List<Value.Field> fields) { return new Value.StructVariant(name, variantIndex, variant, fields); }
		};
	}

	private abstract class Elements implements SerializeSeq, SerializeTuple, SerializeTupleStruct, SerializeTupleVariant {
		final LengthTracker tracker;
		final List<Value> elements = new ArrayList<>();

		Elements(LengthTracker tracker) {
			this.tracker = tracker;
		}

		abstract Value finish(List<Value> elements);

		@Override
		public void serializeElement(Serialize value) {
			tracker.element();
			elements.add(toValue(value));
		}

		@Override
		public void serializeField(Serialize value) {
			serializeElement(value);
		}

		@Override
		public void end() {
			tracker.finish();
			emit(finish(elements));
		}
	}

	/**
	 * A skipped field counts towards the declared length but is absent from the result.
	 */
	private abstract class Fields implements SerializeStruct, SerializeStructVariant {
		final LengthTracker tracker;
		final List<Value.Field> fields = new ArrayList<>();

		Fields(LengthTracker tracker) {
			this.tracker = tracker;
		}

		abstract Value finish(List<Value.Field> fields);

		@Override
		public void serializeField(String key, Serialize value) {
			tracker.element();
			fields.add(new Value.Field(key, toValue(value)));
		}

		@Override
		public void skipField(String key) {
			tracker.element();
		}

		@Override
		public void end() {
			tracker.finish();
			emit(finish(fields));
		}
	}
}
