package works.datashape.value;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.EnumAccess;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.Visitor;
import works.datashape.lifetime.BorrowedBytes;
import works.datashape.lifetime.BorrowedText;
import works.datashape.model.Shape;

/**
 * Builds a {@link Value} from whatever a self-describing format offers.
 * Every visit method is accepted.
 * <p>
 * What the format cannot tell apart is folded into the plainer shape:
 * structs arrive as {@link Value.MapValue maps}, newtype wrappers have no name,
 * and an enum is kept as a single-entry map from its variant tag to its payload,
 * which reads back as the same variant.
 */
public enum ValueVisitor implements Visitor<Value>, Deserialize<Value> {
	INSTANCE;

	@Override
	public Value deserialize(Deserializer deserializer) {
		if (deserializer instanceof ValueDeserializer vd) {
			// Values are immutable; nothing to rebuild
			return vd.value();
		}
		return deserializer.deserializeAny(this);
	}

	@Override
	public String expecting() {
		return "any value";
	}

	@Override public Value visitBool(boolean value) { return new Value.Bool(value); }
	@Override public Value visitI8(byte value) { return Value.Int.i8(value); }
	@Override public Value visitI16(short value) { return Value.Int.i16(value); }
	@Override public Value visitI32(int value) { return Value.Int.i32(value); }
	@Override public Value visitI64(long value) { return Value.Int.i64(value); }
	@Override public Value visitI128(BigInteger value) { return new Value.BigInt(Shape.I128, value); }
	@Override public Value visitU8(int value) { return Value.Int.u8(value); }
	@Override public Value visitU16(int value) { return Value.Int.u16(value); }
	@Override public Value visitU32(long value) { return Value.Int.u32(value); }
	@Override public Value visitU64(long value) { return Value.Int.u64(value); }
	@Override public Value visitU128(BigInteger value) { return new Value.BigInt(Shape.U128, value); }
	@Override public Value visitF32(float value) { return Value.Float.f32(value); }
	@Override public Value visitF64(double value) { return Value.Float.f64(value); }
	@Override public Value visitChar(int codePoint) { return new Value.Char(codePoint); }
	@Override public Value visitStr(CharSequence value) { return new Value.Str(value.toString()); }
	@Override public Value visitBorrowedStr(BorrowedText value) { return new Value.Str(value.toString()); }
	@Override public Value visitString(String value) { return new Value.Str(value); }

	@Override
	public Value visitBytes(ByteBuffer value) {
		byte[] copy = new byte[value.remaining()];
		value.duplicate().get(copy);
		return new Value.Bytes(copy);
	}

	@Override
	public Value visitBorrowedBytes(BorrowedBytes value) {
		return new Value.Bytes(value.toByteArray());
	}

	@Override
	public Value visitByteBuf(byte[] value) {
		return new Value.Bytes(value);
	}

	@Override public Value visitNone() { return new Value.None(); }
	@Override public Value visitUnit() { return new Value.UnitValue(); }

	@Override
	public Value visitSome(Deserializer deserializer) {
		return new Value.Some(deserialize(deserializer));
	}

	@Override
	public Value visitNewtypeStruct(Deserializer deserializer) {
		return new Value.Newtype("", deserialize(deserializer));
	}

	@Override
	public Value visitSeq(SeqAccess seq) {
		List<Value> elements = new ArrayList<>(seq.sizeHint().orElse(8));
		for (Optional<Value> element = seq.nextElement(this); element.isPresent(); element = seq.nextElement(this)) {
			elements.add(element.get());
		}
		return new Value.Seq(elements);
	}

	@Override
	public Value visitMap(MapAccess map) {
		List<Value.Entry> entries = new ArrayList<>(map.sizeHint().orElse(8));
		for (Optional<Value> key = map.nextKey(this); key.isPresent(); key = map.nextKey(this)) {
			entries.add(new Value.Entry(key.get(), map.nextValue(this)));
		}
		return new Value.MapValue(entries);
	}

	@Override
	public Value visitEnum(EnumAccess data) {
		EnumAccess.Variant<Value> variant = data.variant(this);
		Value payload = variant.payload().newtypeVariant(this);
		return new Value.MapValue(List.of(new Value.Entry(variant.tag(), payload)));
	}
}
