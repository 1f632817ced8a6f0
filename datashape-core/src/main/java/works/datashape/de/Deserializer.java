package works.datashape.de;

import java.util.List;
import java.util.Set;
import works.datashape.exceptions.DeserializationException;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.Flavor;

/**
 * The decode side of the protocol, implemented by format readers.
 * <p>
 * Each entry operation tells the reader which shape the caller expects,
 * inspects the next value in the input,
 * and invokes <em>exactly one</em> method on the supplied {@link Visitor},
 * returning its result.
 * Self-describing formats may treat the expected shape as a hint,
 * letting the input decide and relying on the visitor to reject what it can't use;
 * formats that are not self-describing rely on it to interpret the input at all,
 * and must fail if the input cannot satisfy it.
 * <p>
 * Compound shapes are delivered as access objects
 * ({@link SeqAccess}, {@link MapAccess}, {@link EnumAccess})
 * from which the visitor pulls elements on demand.
 * Once the visitor returns, any elements it did not pull
 * are treated as malformed input.
 * <p>
 * All failures are {@link DeserializationException}s.
 * <p>
 * A deserializer instance is used by one thread at a time, for one decode session.
 */
public interface Deserializer {
	/**
	 * Lets the input determine the shape.
	 *
	 * @throws MalformedInputException if the format is not self-describing
	 */
	<T> T deserializeAny(Visitor<T> visitor);

	<T> T deserializeBool(Visitor<T> visitor);
	<T> T deserializeI8(Visitor<T> visitor);
	<T> T deserializeI16(Visitor<T> visitor);
	<T> T deserializeI32(Visitor<T> visitor);
	<T> T deserializeI64(Visitor<T> visitor);
	<T> T deserializeI128(Visitor<T> visitor);
	<T> T deserializeU8(Visitor<T> visitor);
	<T> T deserializeU16(Visitor<T> visitor);
	<T> T deserializeU32(Visitor<T> visitor);
	<T> T deserializeU64(Visitor<T> visitor);
	<T> T deserializeU128(Visitor<T> visitor);
	<T> T deserializeF32(Visitor<T> visitor);
	<T> T deserializeF64(Visitor<T> visitor);
	<T> T deserializeChar(Visitor<T> visitor);

	/**
	 * Expects a string and offers it in the longest-lived flavor available,
	 * preferring {@link Flavor#BORROWED borrowed} where possible.
	 */
	<T> T deserializeStr(Visitor<T> visitor);

	/**
	 * Expects a string the visitor intends to keep;
	 * formats should offer an {@link Flavor#OWNED owned} copy if that saves the visitor a copy.
	 */
	<T> T deserializeString(Visitor<T> visitor);

	/**
	 * Byte counterpart of {@link #deserializeStr}.
	 */
	<T> T deserializeBytes(Visitor<T> visitor);

	/**
	 * Byte counterpart of {@link #deserializeString}.
	 */
	<T> T deserializeByteBuf(Visitor<T> visitor);

	<T> T deserializeOption(Visitor<T> visitor);
	<T> T deserializeUnit(Visitor<T> visitor);
	<T> T deserializeUnitStruct(String name, Visitor<T> visitor);
	<T> T deserializeNewtypeStruct(String name, Visitor<T> visitor);
	<T> T deserializeSeq(Visitor<T> visitor);

	/**
	 * @param length the static number of elements, known to the caller without consulting the input
	 */
	<T> T deserializeTuple(int length, Visitor<T> visitor);

	<T> T deserializeTupleStruct(String name, int length, Visitor<T> visitor);
	<T> T deserializeMap(Visitor<T> visitor);

	/**
	 * @param fields the struct's field names, known statically, in declaration order
	 */
	<T> T deserializeStruct(String name, List<String> fields, Visitor<T> visitor);

	/**
	 * @param variants the enum's variant names, indexed by variant index
	 */
	<T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor);

	/**
	 * Expects the name of a struct field or enum variant.
	 * Formats that identify these by index deliver an integer instead.
	 */
	<T> T deserializeIdentifier(Visitor<T> visitor);

	/**
	 * Expects a value the caller will discard.
	 * Self-describing formats skip it and call {@link Visitor#visitUnit()}.
	 */
	<T> T deserializeIgnoredAny(Visitor<T> visitor);

	/**
	 * @see works.datashape.ser.Serializer#isHumanReadable()
	 */
	default boolean isHumanReadable() {
		return true;
	}

	/**
	 * @return the string and byte flavors this deserializer can supply for its current input
	 */
	Set<Flavor> supportedFlavors();
}
