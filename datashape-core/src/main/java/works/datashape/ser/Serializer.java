package works.datashape.ser;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;
import works.datashape.exceptions.SerializationException;

/**
 * The encode side of the protocol, implemented by format writers.
 * <p>
 * There is one operation per shape. The compound shapes
 * (sequences, maps, tuples, and structs, plus their named and variant forms)
 * are written as sessions: the begin operation returns a session object,
 * which receives the elements or entries in order and is then {@code end}ed.
 * Calls must follow the literal nesting of the data:
 * every session is ended before its enclosing session continues.
 * <p>
 * Every operation either succeeds or throws {@link SerializationException}
 * synchronously, leaving any output already written in place.
 * <p>
 * Implementations must implement every shape explicitly,
 * even if only to reject it.
 */
public interface Serializer {
	void serializeBool(boolean value);

	void serializeI8(byte value);
	void serializeI16(short value);
	void serializeI32(int value);
	void serializeI64(long value);

	/**
	 * @throws SerializationException if {@code value} is outside the signed 128-bit range,
	 * or if the format cannot represent 128-bit integers
	 */
	void serializeI128(BigInteger value);

	/**
	 * @param value between 0 and 255
	 */
	void serializeU8(int value);

	/**
	 * @param value between 0 and 65535
	 */
	void serializeU16(int value);

	/**
	 * @param value between 0 and 2<sup>32</sup>-1
	 */
	void serializeU32(long value);

	/**
	 * @param value bit pattern interpreted as unsigned
	 */
	void serializeU64(long value);

	/**
	 * @throws SerializationException if {@code value} is outside the unsigned 128-bit range,
	 * or if the format cannot represent 128-bit integers
	 */
	void serializeU128(BigInteger value);

	void serializeF32(float value);
	void serializeF64(double value);

	/**
	 * @param codePoint must be a Unicode scalar value
	 */
	void serializeChar(int codePoint);

	void serializeStr(CharSequence value);

	/**
	 * Writes the {@link ByteBuffer#remaining() remaining} bytes of {@code value}
	 * without changing its position.
	 */
	void serializeBytes(ByteBuffer value);

	default void serializeBytes(byte[] value) {
		serializeBytes(ByteBuffer.wrap(value));
	}

	void serializeNone();
	void serializeSome(Serialize value);

	void serializeUnit();
	void serializeUnitStruct(String name);
	void serializeUnitVariant(String name, int variantIndex, String variant);

	void serializeNewtypeStruct(String name, Serialize value);
	void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value);

	/**
	 * @param length the number of elements, if known in advance.
	 *               When present, it must equal the number of elements actually written.
	 */
	SerializeSeq serializeSeq(OptionalInt length);

	SerializeTuple serializeTuple(int length);
	SerializeTupleStruct serializeTupleStruct(String name, int length);
	SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length);

	/**
	 * @param length the number of entries, if known in advance.
	 *               When present, it must equal the number of entries actually written.
	 */
	SerializeMap serializeMap(OptionalInt length);

	/**
	 * @param length the number of fields, including any that will be {@link SerializeStruct#skipField skipped}
	 */
	SerializeStruct serializeStruct(String name, int length);

	SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length);

	/**
	 * Whether the format is meant to be read by people.
	 * Mappings may use this to choose a more legible representation,
	 * provided they make the same choice when decoding.
	 */
	default boolean isHumanReadable() {
		return true;
	}

	default <T> void collectSeq(Iterable<T> elements, Function<? super T, ? extends Serialize> mapping) {
		OptionalInt length = (elements instanceof Collection<?> c) ? OptionalInt.of(c.size()) : OptionalInt.empty();
		SerializeSeq seq = serializeSeq(length);
		for (T element : elements) {
			seq.serializeElement(mapping.apply(element));
		}
		seq.end();
	}

	default <K, V> void collectMap(
		Map<K, V> map,
		Function<? super K, ? extends Serialize> keyMapping,
		Function<? super V, ? extends Serialize> valueMapping
	) {
		SerializeMap session = serializeMap(OptionalInt.of(map.size()));
		for (Map.Entry<K, V> entry : map.entrySet()) {
			session.serializeEntry(keyMapping.apply(entry.getKey()), valueMapping.apply(entry.getValue()));
		}
		session.end();
	}

	/**
	 * Writes the {@link Object#toString() string form} of {@code value}.
	 */
	default void collectStr(Object value) {
		serializeStr(String.valueOf(value));
	}
}
