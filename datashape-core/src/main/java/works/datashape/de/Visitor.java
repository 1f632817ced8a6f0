package works.datashape.de;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Set;
import works.datashape.exceptions.BorrowUnavailableException;
import works.datashape.exceptions.UnrecognizedContentException;
import works.datashape.lifetime.BorrowedBytes;
import works.datashape.lifetime.BorrowedText;
import works.datashape.lifetime.Flavor;
import works.datashape.lifetime.Flavors;

import static works.datashape.exceptions.UnrecognizedContentException.invalidType;

/**
 * Builds an in-memory value from exactly one decoded shape.
 * <p>
 * There is one method per shape, and a {@link Deserializer} calls exactly one of them per decode.
 * Every method has a default; implementers override only those for the shapes they can build from.
 * The defaults either forward to a wider method of the same family
 * (narrower signed integers to {@link #visitI64}, narrower unsigned integers to {@link #visitU64},
 * {@link #visitF32} to {@link #visitF64}, characters and every string flavor to {@link #visitStr},
 * every byte flavor to {@link #visitBytes}),
 * or throw {@link UnrecognizedContentException} naming what was found and what was {@link #expecting() expected}.
 * This lets one interface serve strict visitors, which override a single method,
 * and lenient ones, which override many.
 * <p>
 * Strings and bytes arrive in one of three {@link Flavor flavors}.
 * A visitor that insists on borrowed data declares so with {@link #acceptedFlavors()},
 * and the defaults then fail with {@link BorrowUnavailableException} when offered anything else.
 *
 * @param <T> the type of value built
 */
public interface Visitor<T> extends Expected {

	/**
	 * @return the string and byte flavors this visitor accepts; all of them, by default
	 */
	default Set<Flavor> acceptedFlavors() {
		return Flavors.ALL;
	}

	default T visitBool(boolean value) {
		throw invalidType(Unexpected.bool(value), this);
	}

	default T visitI8(byte value) {
		return visitI64(value);
	}

	default T visitI16(short value) {
		return visitI64(value);
	}

	default T visitI32(int value) {
		return visitI64(value);
	}

	default T visitI64(long value) {
		throw invalidType(Unexpected.signed(value), this);
	}

	default T visitI128(BigInteger value) {
		throw invalidType(Unexpected.bigInteger(value), this);
	}

	default T visitU8(int value) {
		return visitU64(value);
	}

	default T visitU16(int value) {
		return visitU64(value);
	}

	default T visitU32(long value) {
		return visitU64(value);
	}

	/**
	 * @param value bit pattern interpreted as unsigned
	 */
	default T visitU64(long value) {
		throw invalidType(Unexpected.unsigned(value), this);
	}

	default T visitU128(BigInteger value) {
		throw invalidType(Unexpected.bigInteger(value), this);
	}

	default T visitF32(float value) {
		return visitF64(value);
	}

	default T visitF64(double value) {
		throw invalidType(Unexpected.floating(value), this);
	}

	default T visitChar(int codePoint) {
		return visitStr(new String(Character.toChars(codePoint)));
	}

	/**
	 * @param value {@link Flavor#TRANSIENT transient}: valid only until this method returns
	 */
	default T visitStr(CharSequence value) {
		Flavors.requireAccepted(this, Flavor.TRANSIENT);
		throw invalidType(Unexpected.str(value), this);
	}

	/**
	 * @param value {@link Flavor#BORROWED borrowed} from the input buffer
	 */
	default T visitBorrowedStr(BorrowedText value) {
		return visitStr(value);
	}

	/**
	 * @param value {@link Flavor#OWNED owned} by the visitor from now on
	 */
	default T visitString(String value) {
		Flavors.requireAccepted(this, Flavor.OWNED);
		return visitStr(value);
	}

	/**
	 * @param value {@link Flavor#TRANSIENT transient}: valid only until this method returns
	 */
	default T visitBytes(ByteBuffer value) {
		Flavors.requireAccepted(this, Flavor.TRANSIENT);
		throw invalidType(Unexpected.bytes(), this);
	}

	/**
	 * @param value {@link Flavor#BORROWED borrowed} from the input buffer
	 */
	default T visitBorrowedBytes(BorrowedBytes value) {
		return visitBytes(value.asByteBuffer());
	}

	/**
	 * @param value {@link Flavor#OWNED owned} by the visitor from now on
	 */
	default T visitByteBuf(byte[] value) {
		Flavors.requireAccepted(this, Flavor.OWNED);
		return visitBytes(ByteBuffer.wrap(value));
	}

	default T visitNone() {
		throw invalidType(Unexpected.option(), this);
	}

	/**
	 * @param deserializer positioned at the present value
	 */
	default T visitSome(Deserializer deserializer) {
		throw invalidType(Unexpected.option(), this);
	}

	default T visitUnit() {
		throw invalidType(Unexpected.unit(), this);
	}

	/**
	 * @param deserializer positioned at the wrapped value
	 */
	default T visitNewtypeStruct(Deserializer deserializer) {
		throw invalidType(Unexpected.newtypeStruct(), this);
	}

	/**
	 * The visitor must pull elements until {@link SeqAccess#nextElement} signals the end
	 * or stop early and fail; elements left unread are rejected by the deserializer.
	 */
	default T visitSeq(SeqAccess seq) {
		throw invalidType(Unexpected.seq(), this);
	}

	/**
	 * @see #visitSeq
	 */
	default T visitMap(MapAccess map) {
		throw invalidType(Unexpected.map(), this);
	}

	default T visitEnum(EnumAccess data) {
		throw invalidType(Unexpected.enumeration(), this);
	}
}
