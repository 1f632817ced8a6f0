package works.datashape.testing;

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
 * Records each serializer call as a {@link Token}.
 * Checks session discipline and declared lengths as a real format would,
 * so mapping logic that misuses the protocol fails here too.
 */
public final class TokenSerializer implements Serializer {
	private final List<Token> tokens = new ArrayList<>();
	private final boolean humanReadable;

	public TokenSerializer() {
		this(true);
	}

	public TokenSerializer(boolean humanReadable) {
		this.humanReadable = humanReadable;
	}

	public static List<Token> tokens(Serialize value) {
		TokenSerializer serializer = new TokenSerializer();
		value.serialize(serializer);
		return serializer.tokens();
	}

	public List<Token> tokens() {
		return List.copyOf(tokens);
	}

	@Override
	public boolean isHumanReadable() {
		return humanReadable;
	}

	private void add(Token token) {
		tokens.add(token);
	}

	@Override public void serializeBool(boolean value) { add(new Token.Bool(value)); }
	@Override public void serializeI8(byte value) { add(new Token.I8(value)); }
	@Override public void serializeI16(short value) { add(new Token.I16(value)); }
	@Override public void serializeI32(int value) { add(new Token.I32(value)); }
	@Override public void serializeI64(long value) { add(new Token.I64(value)); }

	@Override
	public void serializeI128(BigInteger value) {
		if (!IntegerRanges.isI128(value)) {
			throw new SerializationException(value + " is out of range for i128");
		}
		add(new Token.I128(value));
	}

	@Override
	public void serializeU8(int value) {
		if (!IntegerRanges.isU8(value)) {
			throw new SerializationException(value + " is out of range for u8");
		}
		add(new Token.U8(value));
	}

	@Override
	public void serializeU16(int value) {
		if (!IntegerRanges.isU16(value)) {
			throw new SerializationException(value + " is out of range for u16");
		}
		add(new Token.U16(value));
	}

	@Override
	public void serializeU32(long value) {
		if (!IntegerRanges.isU32(value)) {
			throw new SerializationException(value + " is out of range for u32");
		}
		add(new Token.U32(value));
	}

	@Override public void serializeU64(long value) { add(new Token.U64(value)); }

	@Override
	public void serializeU128(BigInteger value) {
		if (!IntegerRanges.isU128(value)) {
			throw new SerializationException(value + " is out of range for u128");
		}
		add(new Token.U128(value));
	}

	@Override public void serializeF32(float value) { add(new Token.F32(value)); }
	@Override public void serializeF64(double value) { add(new Token.F64(value)); }

	@Override
	public void serializeChar(int codePoint) {
		if (!IntegerRanges.isUnicodeScalar(codePoint)) {
			throw new SerializationException("Not a Unicode scalar value: " + Integer.toHexString(codePoint));
		}
		add(new Token.Char(codePoint));
	}

	@Override public void serializeStr(CharSequence value) { add(new Token.Str(value.toString())); }

	@Override
	public void serializeBytes(ByteBuffer value) {
		byte[] bytes = new byte[value.remaining()];
		value.duplicate().get(bytes);
		add(new Token.Bytes(bytes));
	}

	@Override public void serializeNone() { add(new Token.None()); }

	@Override
	public void serializeSome(Serialize value) {
		add(new Token.Some());
		value.serialize(this);
	}

	@Override public void serializeUnit() { add(new Token.Unit()); }
	@Override public void serializeUnitStruct(String name) { add(new Token.UnitStruct(name)); }

	@Override
	public void serializeUnitVariant(String name, int variantIndex, String variant) {
		add(new Token.UnitVariant(name, variantIndex, variant));
	}

	@Override
	public void serializeNewtypeStruct(String name, Serialize value) {
		add(new Token.NewtypeStruct(name));
		value.serialize(this);
	}

	@Override
	public void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value) {
		add(new Token.NewtypeVariant(name, variantIndex, variant));
		value.serialize(this);
	}

	@Override
	public SerializeSeq serializeSeq(OptionalInt length) {
		add(new Token.Seq(length));
		return new Elements(LengthTracker.of(Shape.SEQ, length), new Token.SeqEnd());
	}

	@Override
	public SerializeTuple serializeTuple(int length) {
		add(new Token.Tuple(length));
		return new Elements(LengthTracker.of(Shape.TUPLE, length), new Token.TupleEnd());
	}

	@Override
	public SerializeTupleStruct serializeTupleStruct(String name, int length) {
		add(new Token.TupleStruct(name, length));
		return new Elements(LengthTracker.of(Shape.TUPLE_STRUCT, length), new Token.TupleStructEnd());
	}

	@Override
	public SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length) {
		add(new Token.TupleVariant(name, variantIndex, variant, length));
		return new Elements(LengthTracker.of(Shape.TUPLE_VARIANT, length), new Token.TupleVariantEnd());
	}

	@Override
	public SerializeMap serializeMap(OptionalInt length) {
		add(new Token.Map(length));
		LengthTracker tracker = LengthTracker.of(Shape.MAP, length);
		return new SerializeMap() {
			boolean expectingValue = false;

			@Override
			public void serializeKey(Serialize key) {
				if (expectingValue) {
					throw new SerializationException("Map key serialized twice without a value");
				}
				tracker.element();
				key.serialize(TokenSerializer.this);
				expectingValue = true;
			}

			@Override
			public void serializeValue(Serialize value) {
				if (!expectingValue) {
					throw new SerializationException("Map value serialized without a key");
				}
				value.serialize(TokenSerializer.this);
				expectingValue = false;
			}

			@Override
			public void end() {
				if (expectingValue) {
					throw new SerializationException("Map ended with a key that has no value");
				}
				tracker.finish();
				add(new Token.MapEnd());
			}
		};
	}

	@Override
	public SerializeStruct serializeStruct(String name, int length) {
		add(new Token.Struct(name, length));
		return new Fields(LengthTracker.of(Shape.STRUCT, length), new Token.StructEnd());
	}

	@Override
	public SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length) {
		add(new Token.StructVariant(name, variantIndex, variant, length));
		return new Fields(LengthTracker.of(Shape.STRUCT_VARIANT, length), new Token.StructVariantEnd());
	}

	private final class Elements implements SerializeSeq, SerializeTuple, SerializeTupleStruct, SerializeTupleVariant {
		final LengthTracker tracker;
		final Token endToken;

		Elements(LengthTracker tracker, Token endToken) {
			this.tracker = tracker;
			this.endToken = endToken;
		}

		@Override
		public void serializeElement(Serialize value) {
			tracker.element();
			value.serialize(TokenSerializer.this);
		}

		@Override
		public void serializeField(Serialize value) {
			serializeElement(value);
		}

		@Override
		public void end() {
			tracker.finish();
			add(endToken);
		}
	}

	/**
	 * Skipped fields leave no token; they only count towards the declared length.
	 */
	private final class Fields implements SerializeStruct, SerializeStructVariant {
		final LengthTracker tracker;
		final Token endToken;

		Fields(LengthTracker tracker, Token endToken) {
			this.tracker = tracker;
			this.endToken = endToken;
		}

		@Override
		public void serializeField(String key, Serialize value) {
			tracker.element();
			add(new Token.Str(key));
			value.serialize(TokenSerializer.this);
		}

		@Override
		public void skipField(String key) {
			tracker.element();
		}

		@Override
		public void end() {
			tracker.finish();
			add(endToken);
		}
	}
}
