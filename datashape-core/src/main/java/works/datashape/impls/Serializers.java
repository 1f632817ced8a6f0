package works.datashape.impls;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.function.Function;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeSeq;
import works.datashape.ser.SerializeStruct;

/**
 * {@link Serialize} mappings for common JDK types.
 * Each has a counterpart in {@link Deserializers} that reads back what it writes.
 */
public final class Serializers {
	private Serializers() {}

	public static Serialize bool(boolean value) { return s -> s.serializeBool(value); }
	public static Serialize i8(byte value) { return s -> s.serializeI8(value); }
	public static Serialize i16(short value) { return s -> s.serializeI16(value); }
	public static Serialize i32(int value) { return s -> s.serializeI32(value); }
	public static Serialize i64(long value) { return s -> s.serializeI64(value); }
	public static Serialize u8(int value) { return s -> s.serializeU8(value); }
	public static Serialize u16(int value) { return s -> s.serializeU16(value); }
	public static Serialize u32(long value) { return s -> s.serializeU32(value); }
	public static Serialize u64(long value) { return s -> s.serializeU64(value); }
	public static Serialize f32(float value) { return s -> s.serializeF32(value); }
	public static Serialize f64(double value) { return s -> s.serializeF64(value); }
	public static Serialize character(char value) { return s -> s.serializeChar(value); }
	public static Serialize codePoint(int value) { return s -> s.serializeChar(value); }
	public static Serialize string(CharSequence value) { return s -> s.serializeStr(value); }
	public static Serialize bytes(byte[] value) { return s -> s.serializeBytes(value); }
	public static Serialize bytes(ByteBuffer value) { return s -> s.serializeBytes(value); }
	public static Serialize unit() { return s -> s.serializeUnit(); }

	/**
	 * As {@link works.datashape.model.Shape#I128 i128}.
	 */
	public static Serialize bigInteger(BigInteger value) {
		return s -> s.serializeI128(value);
	}

	public static Serialize unsignedBigInteger(BigInteger value) {
		return s -> s.serializeU128(value);
	}

	public static <T> Serialize optional(Optional<T> value, Function<? super T, ? extends Serialize> inner) {
		return s -> {
			if (value.isPresent()) {
				s.serializeSome(inner.apply(value.get()));
			} else {
				s.serializeNone();
			}
		};
	}

	/**
	 * Works for any collection, including sets; elements are written in iteration order.
	 */
	public static <T> Serialize collection(Collection<T> value, Function<? super T, ? extends Serialize> element) {
		return s -> s.collectSeq(value, element);
	}

	public static <T> Serialize list(List<T> value, Function<? super T, ? extends Serialize> element) {
		return collection(value, element);
	}

	public static <K, V> Serialize map(
		Map<K, V> value,
		Function<? super K, ? extends Serialize> key,
		Function<? super V, ? extends Serialize> val
	) {
		return s -> s.collectMap(value, key, val);
	}

	/**
	 * As a {@link works.datashape.model.Shape#TUPLE tuple} of the given elements.
	 */
	public static Serialize tuple(Serialize... elements) {
		return s -> {
			var tuple = s.serializeTuple(elements.length);
			for (Serialize element : elements) {
				tuple.serializeElement(element);
			}
			tuple.end();
		};
	}

	/**
	 * As a unit variant of an enum named for the constant's class,
	 * identified by its ordinal and {@link Enum#name() name}.
	 */
	public static Serialize enumValue(Enum<?> value) {
		return s -> s.serializeUnitVariant(value.getDeclaringClass().getSimpleName(), value.ordinal(), value.name());
	}

	public static Serialize path(Path value) {
		return s -> s.collectStr(value);
	}

	/**
	 * As struct {@code Duration {secs: i64, nanos: u32}}, with {@code nanos} always below one billion.
	 */
	public static Serialize duration(Duration value) {
		return s -> {
			SerializeStruct struct = s.serializeStruct(DURATION, 2);
			struct.serializeField(DURATION_FIELDS.get(0), i64(value.getSeconds()));
			struct.serializeField(DURATION_FIELDS.get(1), u32(value.getNano()));
			struct.end();
		};
	}

	/**
	 * As its canonical string in human-readable formats, and as 16 big-endian bytes otherwise.
	 */
	public static Serialize uuid(UUID value) {
		return s -> {
			if (s.isHumanReadable()) {
				s.collectStr(value);
			} else {
				ByteBuffer buffer = ByteBuffer.allocate(16);
				buffer.putLong(value.getMostSignificantBits());
				buffer.putLong(value.getLeastSignificantBits());
				s.serializeBytes(buffer.flip());
			}
		};
	}

	/**
	 * As a {@link works.datashape.model.Shape#SEQ seq} of {@code u8}, for formats or peers that expect that
	 * rather than {@link works.datashape.model.Shape#BYTES bytes}.
	 */
	public static Serialize byteSeq(byte[] value) {
		return s -> {
			SerializeSeq seq = s.serializeSeq(OptionalInt.of(value.length));
			for (byte b : value) {
				seq.serializeElement(u8(b & 0xFF));
			}
			seq.end();
		};
	}

	static final String DURATION = "Duration";
	static final List<String> DURATION_FIELDS = List.of("secs", "nanos");
}
