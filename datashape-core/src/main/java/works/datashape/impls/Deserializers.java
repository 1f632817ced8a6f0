package works.datashape.impls;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.LongFunction;
import java.util.function.Supplier;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.EnumAccess;
import works.datashape.de.Expected;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.Unexpected;
import works.datashape.de.Visitor;
import works.datashape.model.IntegerRanges;
import works.datashape.model.Unit;

import static works.datashape.exceptions.UnrecognizedContentException.invalidLength;
import static works.datashape.exceptions.UnrecognizedContentException.invalidValue;
import static works.datashape.impls.Serializers.DURATION;
import static works.datashape.impls.Serializers.DURATION_FIELDS;

/**
 * {@link Deserialize} mappings for common JDK types, matching {@link Serializers}.
 * <p>
 * Numeric mappings accept any integer the input offers as long as it fits;
 * out-of-range values fail with {@code invalid value} rather than being truncated.
 */
public final class Deserializers {
	private Deserializers() {}

	public static final Deserialize<Boolean> BOOL = d -> d.deserializeBool(new Visitor<Boolean>() {
		@Override public String expecting() { return "a boolean"; }
		@Override public Boolean visitBool(boolean value) { return value; }
	});

	public static final Deserialize<Byte> I8 = d -> d.deserializeI8(new SignedVisitor<Byte>("i8", Byte.MIN_VALUE, Byte.MAX_VALUE, v -> (byte) v));
	public static final Deserialize<Short> I16 = d -> d.deserializeI16(new SignedVisitor<Short>("i16", Short.MIN_VALUE, Short.MAX_VALUE, v -> (short) v));
	public static final Deserialize<Integer> I32 = d -> d.deserializeI32(new SignedVisitor<Integer>("i32", Integer.MIN_VALUE, Integer.MAX_VALUE, v -> (int) v));
	public static final Deserialize<Long> I64 = d -> d.deserializeI64(new SignedVisitor<Long>("i64", Long.MIN_VALUE, Long.MAX_VALUE, v -> v));
	public static final Deserialize<Integer> U8 = d -> d.deserializeU8(new UnsignedVisitor<Integer>("u8", 0xFFL, v -> (int) v));
	public static final Deserialize<Integer> U16 = d -> d.deserializeU16(new UnsignedVisitor<Integer>("u16", 0xFFFFL, v -> (int) v));
	public static final Deserialize<Long> U32 = d -> d.deserializeU32(new UnsignedVisitor<Long>("u32", 0xFFFF_FFFFL, v -> v));

	/**
	 * The result is a bit pattern to be read as unsigned.
	 */
	public static final Deserialize<Long> U64 = d -> d.deserializeU64(new UnsignedVisitor<Long>("u64", -1L, v -> v));

	public static final Deserialize<BigInteger> I128 = d -> d.deserializeI128(new BigIntegerVisitor("i128", IntegerRanges.MIN_I128, IntegerRanges.MAX_I128));
	public static final Deserialize<BigInteger> U128 = d -> d.deserializeU128(new BigIntegerVisitor("u128", BigInteger.ZERO, IntegerRanges.MAX_U128));

	public static final Deserialize<Float> F32 = d -> d.deserializeF32(new Visitor<Float>() {
		@Override public String expecting() { return "f32"; }
		@Override public Float visitF64(double value) { return (float) value; }
		@Override public Float visitI64(long value) { return (float) value; }
		@Override public Float visitU64(long value) { return IntegerRanges.unsignedToBig(value).floatValue(); }
	});

	public static final Deserialize<Double> F64 = d -> d.deserializeF64(new Visitor<Double>() {
		@Override public String expecting() { return "f64"; }
		@Override public Double visitF64(double value) { return value; }
		@Override public Double visitI64(long value) { return (double) value; }
		@Override public Double visitU64(long value) { return IntegerRanges.unsignedToBig(value).doubleValue(); }
	});

	/**
	 * Any Unicode scalar value, from a char or a string holding exactly one.
	 */
	public static final Deserialize<Integer> CODE_POINT = d -> d.deserializeChar(new Visitor<Integer>() {
		@Override public String expecting() { return "a character"; }

		@Override
		public Integer visitChar(int codePoint) {
			return codePoint;
		}

		@Override
		public Integer visitStr(CharSequence value) {
			if (value.length() > 0 && Character.charCount(Character.codePointAt(value, 0)) == value.length()) {
				return Character.codePointAt(value, 0);
			}
			throw invalidValue(Unexpected.str(value), this);
		}
	});

	/**
	 * Characters outside the basic multilingual plane don't fit and are rejected.
	 */
	public static final Deserialize<Character> CHARACTER = d -> {
		int codePoint = CODE_POINT.deserialize(d);
		if (Character.isBmpCodePoint(codePoint)) {
			return (char) codePoint;
		}
		throw invalidValue(Unexpected.character(codePoint), Expected.of("a character in the basic multilingual plane"));
	};

	public static final Deserialize<String> STRING = d -> d.deserializeString(new Visitor<String>() {
		@Override public String expecting() { return "a string"; }
		@Override public String visitStr(CharSequence value) { return value.toString(); }
		@Override public String visitString(String value) { return value; }
	});

	/**
	 * From bytes, or from a sequence of {@code u8}.
	 */
	public static final Deserialize<byte[]> BYTES = d -> d.deserializeByteBuf(new Visitor<byte[]>() {
		@Override public String expecting() { return "a byte array"; }

		@Override
		public byte[] visitBytes(ByteBuffer value) {
			byte[] result = new byte[value.remaining()];
			value.duplicate().get(result);
			return result;
		}

		@Override
		public byte[] visitByteBuf(byte[] value) {
			return value;
		}

		@Override
		public byte[] visitSeq(SeqAccess seq) {
			byte[] result = new byte[seq.sizeHint().orElse(16)];
			int length = 0;
			for (Optional<Integer> b = seq.nextElement(U8); b.isPresent(); b = seq.nextElement(U8)) {
				if (length == result.length) {
					result = Arrays.copyOf(result, Math.max(16, length * 2));
				}
				result[length++] = (byte) b.get().intValue();
			}
			return (length == result.length) ? result : Arrays.copyOf(result, length);
		}
	});

	public static final Deserialize<Unit> UNIT = d -> d.deserializeUnit(new Visitor<Unit>() {
		@Override public String expecting() { return "unit"; }
		@Override public Unit visitUnit() { return Unit.INSTANCE; }
	});

	public static final Deserialize<Path> PATH = d -> {
		String path = STRING.deserialize(d);
		try {
			return Path.of(path);
		} catch (InvalidPathException e) {
			throw invalidValue(Unexpected.str(path), Expected.of("a path"));
		}
	};

	public static final Deserialize<UUID> UUID_VALUE = d -> {
		if (d.isHumanReadable()) {
			String text = STRING.deserialize(d);
			try {
				return UUID.fromString(text);
			} catch (IllegalArgumentException e) {
				throw invalidValue(Unexpected.str(text), Expected.of("a UUID"));
			}
		}
		byte[] bytes = BYTES.deserialize(d);
		if (bytes.length != 16) {
			throw invalidLength(bytes.length, Expected.of("16 bytes"));
		}
		ByteBuffer buffer = ByteBuffer.wrap(bytes);
		return new UUID(buffer.getLong(), buffer.getLong());
	};

	public static final Deserialize<Duration> DURATION_VALUE = d -> d.deserializeStruct(DURATION, DURATION_FIELDS, new Visitor<Duration>() {
		@Override
		public String expecting() {
			return "struct Duration";
		}

		@Override
		public Duration visitSeq(SeqAccess seq) {
			long secs = seq.nextElement(I64).orElseThrow(() -> invalidLength(0, this));
			long nanos = seq.nextElement(U32).orElseThrow(() -> invalidLength(1, this));
			return build(secs, nanos);
		}

		@Override
		public Duration visitMap(MapAccess map) {
			StructFields fields = new StructFields(FieldVisitor.of(DURATION_FIELDS));
			fields.readAll(map, index -> (index == 0) ? I64 : U32);
			long secs = fields.<Long>get(0);
			long nanos = fields.<Long>get(1);
			return build(secs, nanos);
		}

		private Duration build(long secs, long nanos) {
			if (nanos >= 1_000_000_000L) {
				throw invalidValue(Unexpected.unsigned(nanos), Expected.of("nanos below one billion"));
			}
			return Duration.ofSeconds(secs, nanos);
		}
	});

	public static <T> Deserialize<Optional<T>> optional(Deserialize<T> inner) {
		return d -> d.deserializeOption(new Visitor<Optional<T>>() {
			@Override public String expecting() { return "option"; }
			@Override public Optional<T> visitNone() { return Optional.empty(); }
			@Override public Optional<T> visitUnit() { return Optional.empty(); }
			@Override public Optional<T> visitSome(Deserializer deserializer) { return Optional.of(inner.deserialize(deserializer)); }
		});
	}

	public static <T> Deserialize<List<T>> list(Deserialize<T> element) {
		return collection(element, ArrayList::new);
	}

	/**
	 * Duplicates are collapsed; iteration order follows the input.
	 */
	public static <T> Deserialize<Set<T>> set(Deserialize<T> element) {
		return collection(element, LinkedHashSet::new);
	}

	public static <T, C extends Collection<T>> Deserialize<C> collection(Deserialize<T> element, Supplier<C> factory) {
		return d -> d.deserializeSeq(new Visitor<C>() {
			@Override public String expecting() { return "a sequence"; }

			@Override
			public C visitSeq(SeqAccess seq) {
				C result = factory.get();
				for (Optional<T> e = seq.nextElement(element); e.isPresent(); e = seq.nextElement(element)) {
					result.add(e.get());
				}
				return result;
			}
		});
	}

	/**
	 * Entries keep input order; a repeated key keeps its last value.
	 */
	public static <K, V> Deserialize<Map<K, V>> map(Deserialize<K> key, Deserialize<V> value) {
		return d -> d.deserializeMap(new Visitor<Map<K, V>>() {
			@Override public String expecting() { return "a map"; }

			@Override
			public Map<K, V> visitMap(MapAccess map) {
				Map<K, V> result = new LinkedHashMap<>();
				for (Optional<Map.Entry<K, V>> e = map.nextEntry(key, value); e.isPresent(); e = map.nextEntry(key, value)) {
					result.put(e.get().getKey(), e.get().getValue());
				}
				return result;
			}
		});
	}

	/**
	 * Reads a tuple of exactly as many elements as there are {@code elements}.
	 */
	public static Deserialize<List<Object>> tuple(Deserialize<?>... elements) {
		List<Deserialize<?>> types = List.of(elements);
		return d -> d.deserializeTuple(types.size(), new Visitor<List<Object>>() {
			@Override public String expecting() { return "a tuple of size " + types.size(); }

			@Override
			public List<Object> visitSeq(SeqAccess seq) {
				List<Object> result = new ArrayList<>(types.size());
				for (Deserialize<?> type : types) {
					Optional<?> element = seq.nextElement(type);
					if (element.isEmpty()) {
						throw invalidLength(result.size(), this);
					}
					result.add(element.get());
				}
				return result;
			}
		});
	}

	/**
	 * Reads a unit variant of an enum named for {@code type},
	 * identified by {@link Enum#name() name} or ordinal.
	 */
	public static <E extends Enum<E>> Deserialize<E> enumByName(Class<E> type) {
		E[] constants = type.getEnumConstants();
		VariantVisitor tag = VariantVisitor.of(Arrays.stream(constants).map(Enum::name).toList());
		return d -> d.deserializeEnum(type.getSimpleName(), tag.variants(), new Visitor<E>() {
			@Override public String expecting() { return "enum " + type.getSimpleName(); }

			@Override
			public E visitEnum(EnumAccess data) {
				EnumAccess.Variant<Integer> variant = data.variant(tag);
				variant.payload().unitVariant();
				return constants[variant.tag()];
			}
		});
	}

	private static final class SignedVisitor<T> implements Visitor<T> {
		private final String name;
		private final long min;
		private final long max;
		private final LongFunction<T> box;

		SignedVisitor(String name, long min, long max, LongFunction<T> box) {
			this.name = name;
			this.min = min;
			this.max = max;
			this.box = box;
		}

		@Override
		public String expecting() {
			return name;
		}

		@Override
		public T visitI64(long value) {
			if (value < min || value > max) {
				throw invalidValue(Unexpected.signed(value), this);
			}
			return box.apply(value);
		}

		@Override
		public T visitU64(long value) {
			if (value < 0 || value > max) {
				throw invalidValue(Unexpected.unsigned(value), this);
			}
			return box.apply(value);
		}

		@Override
		public T visitI128(BigInteger value) {
			return fromBig(value);
		}

		@Override
		public T visitU128(BigInteger value) {
			return fromBig(value);
		}

		private T fromBig(BigInteger value) {
			if (value.bitLength() < 64) {
				return visitI64(value.longValue());
			}
			throw invalidValue(Unexpected.bigInteger(value), this);
		}
	}

	/**
	 * @param max as an unsigned bit pattern
	 */
	private static final class UnsignedVisitor<T> implements Visitor<T> {
		private final String name;
		private final long max;
		private final LongFunction<T> box;

		UnsignedVisitor(String name, long max, LongFunction<T> box) {
			this.name = name;
			this.max = max;
			this.box = box;
		}

		@Override
		public String expecting() {
			return name;
		}

		@Override
		public T visitI64(long value) {
			if (value < 0) {
				throw invalidValue(Unexpected.signed(value), this);
			}
			return visitU64(value);
		}

		@Override
		public T visitU64(long value) {
			if (Long.compareUnsigned(value, max) > 0) {
				throw invalidValue(Unexpected.unsigned(value), this);
			}
			return box.apply(value);
		}

		@Override
		public T visitI128(BigInteger value) {
			return fromBig(value);
		}

		@Override
		public T visitU128(BigInteger value) {
			return fromBig(value);
		}

		private T fromBig(BigInteger value) {
			if (value.signum() >= 0 && value.bitLength() <= 64) {
				return visitU64(value.longValue());
			}
			throw invalidValue(Unexpected.bigInteger(value), this);
		}
	}

	private static final class BigIntegerVisitor implements Visitor<BigInteger> {
		private final String name;
		private final BigInteger min;
		private final BigInteger max;

		BigIntegerVisitor(String name, BigInteger min, BigInteger max) {
			this.name = name;
			this.min = min;
			this.max = max;
		}

		@Override
		public String expecting() {
			return name;
		}

		@Override
		public BigInteger visitI64(long value) {
			return visitI128(BigInteger.valueOf(value));
		}

		@Override
		public BigInteger visitU64(long value) {
			return visitI128(IntegerRanges.unsignedToBig(value));
		}

		@Override
		public BigInteger visitI128(BigInteger value) {
			if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
				throw invalidValue(Unexpected.bigInteger(value), this);
			}
			return value;
		}

		@Override
		public BigInteger visitU128(BigInteger value) {
			return visitI128(value);
		}
	}
}
