package works.datashape.de;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import works.datashape.model.Unit;

/**
 * Accepts and discards any value.
 * Used to skip unknown struct fields and unwanted elements
 * so that nothing is left unconsumed.
 */
public enum IgnoredAny implements Visitor<Unit>, Deserialize<Unit> {
	INSTANCE;

	@Override
	public Unit deserialize(Deserializer deserializer) {
		return deserializer.deserializeIgnoredAny(this);
	}

	@Override
	public String expecting() {
		return "anything at all";
	}

	@Override public Unit visitBool(boolean value) { return Unit.INSTANCE; }
	@Override public Unit visitI64(long value) { return Unit.INSTANCE; }
	@Override public Unit visitI128(BigInteger value) { return Unit.INSTANCE; }
	@Override public Unit visitU64(long value) { return Unit.INSTANCE; }
	@Override public Unit visitU128(BigInteger value) { return Unit.INSTANCE; }
	@Override public Unit visitF64(double value) { return Unit.INSTANCE; }
	@Override public Unit visitStr(CharSequence value) { return Unit.INSTANCE; }
	@Override public Unit visitBytes(ByteBuffer value) { return Unit.INSTANCE; }
	@Override public Unit visitNone() { return Unit.INSTANCE; }
	@Override public Unit visitUnit() { return Unit.INSTANCE; }

	@Override
	public Unit visitSome(Deserializer deserializer) {
		return deserialize(deserializer);
	}

	@Override
	public Unit visitNewtypeStruct(Deserializer deserializer) {
		return deserialize(deserializer);
	}

	@Override
	public Unit visitSeq(SeqAccess seq) {
		while (seq.nextElement(this).isPresent()) { }
		return Unit.INSTANCE;
	}

	@Override
	public Unit visitMap(MapAccess map) {
		while (map.nextEntry(this, this).isPresent()) { }
		return Unit.INSTANCE;
	}

	@Override
	public Unit visitEnum(EnumAccess data) {
		// The payload's shape is unknowable here, so only self-describing formats can skip enums.
		EnumAccess.Variant<Unit> variant = data.variant(this);
		return variant.payload().newtypeVariant(this);
	}
}
