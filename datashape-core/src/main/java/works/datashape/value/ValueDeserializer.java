package works.datashape.value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.EnumAccess;
import works.datashape.de.Expected;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.Unexpected;
import works.datashape.de.VariantAccess;
import works.datashape.de.Visitor;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.Flavor;
import works.datashape.lifetime.Flavors;
import works.datashape.model.Shape;

import static works.datashape.exceptions.UnrecognizedContentException.invalidType;

/**
 * A self-describing {@link Deserializer} that reads an in-memory {@link Value}.
 * <p>
 * The expected shape passed to each entry operation is only a hint:
 * the value itself decides which visitor method is called,
 * except where the hint changes the interpretation,
 * as with options, newtype wrappers, and enums.
 * Strings are offered {@link Flavor#OWNED owned}, since they are already immutable.
 */
public final class ValueDeserializer implements Deserializer {
	private final Value value;

	public ValueDeserializer(Value value) {
		this.value = value;
	}

	Value value() {
		return value;
	}

	@Override
	public <T> T deserializeAny(Visitor<T> visitor) {
		if (value instanceof Value.Bool v) {
			return visitor.visitBool(v.value());
		} else if (value instanceof Value.Int v) {
			return visitInt(v, visitor);
		} else if (value instanceof Value.BigInt v) {
			return (v.shape() == Shape.I128) ? visitor.visitI128(v.value()) : visitor.visitU128(v.value());
		} else if (value instanceof Value.Float v) {
			return (v.shape() == Shape.F32) ? visitor.visitF32((float) v.value()) : visitor.visitF64(v.value());
		} else if (value instanceof Value.Char v) {
			return visitor.visitChar(v.codePoint());
		} else if (value instanceof Value.Str v) {
			return visitor.visitString(v.value());
		} else if (value instanceof Value.Bytes v) {
			return visitor.visitByteBuf(v.value());
		} else if (value instanceof Value.None) {
			return visitor.visitNone();
		} else if (value instanceof Value.Some v) {
			return visitor.visitSome(new ValueDeserializer(v.value()));
		} else if (value instanceof Value.UnitValue || value instanceof Value.UnitStruct) {
			return visitor.visitUnit();
		} else if (value instanceof Value.Newtype v) {
			return visitor.visitNewtypeStruct(new ValueDeserializer(v.value()));
		} else if (value instanceof Value.Seq v) {
			return visitElements(v.elements(), visitor);
		} else if (value instanceof Value.Tuple v) {
			return visitElements(v.elements(), visitor);
		} else if (value instanceof Value.TupleStruct v) {
			return visitElements(v.elements(), visitor);
		} else if (value instanceof Value.MapValue v) {
			return visitEntries(v.entries(), visitor);
		} else if (value instanceof Value.Struct v) {
			return visitEntries(fieldEntries(v.fields()), visitor);
		} else {
			return visitor.visitEnum(enumAccess(visitor));
		}
	}

	private static <T> T visitInt(Value.Int v, Visitor<T> visitor) {
		long n = v.value();
		return switch (v.shape()) {
			case I8 -> visitor.visitI8((byte) n);
			case I16 -> visitor.visitI16((short) n);
			case I32 -> visitor.visitI32((int) n);
			case I64 -> visitor.visitI64(n);
			case U8 -> visitor.visitU8((int) n);
			case U16 -> visitor.visitU16((int) n);
			case U32 -> visitor.visitU32(n);
			default -> visitor.visitU64(n);
		};
	}

	@Override public <T> T deserializeBool(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI8(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI16(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI32(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI64(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeI128(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU8(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU16(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU32(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU64(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeU128(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeF32(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeF64(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeChar(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeStr(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeString(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeBytes(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeByteBuf(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeUnit(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeUnitStruct(String name, Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeSeq(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeTuple(int length, Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeTupleStruct(String name, int length, Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeMap(Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeStruct(String name, List<String> fields, Visitor<T> visitor) { return deserializeAny(visitor); }
	@Override public <T> T deserializeIdentifier(Visitor<T> visitor) { return deserializeAny(visitor); }

	/**
	 * A unit value stands for absence, and anything other than an option
	 * is taken to be present.
	 */
	@Override
	public <T> T deserializeOption(Visitor<T> visitor) {
		if (value instanceof Value.None || value instanceof Value.UnitValue) {
			return visitor.visitNone();
		} else if (value instanceof Value.Some v) {
			return visitor.visitSome(new ValueDeserializer(v.value()));
		} else {
			return visitor.visitSome(this);
		}
	}

	/**
	 * A value not wrapped in a newtype is taken to be the wrapped value itself.
	 */
	@Override
	public <T> T deserializeNewtypeStruct(String name, Visitor<T> visitor) {
		if (value instanceof Value.Newtype v) {
			return visitor.visitNewtypeStruct(new ValueDeserializer(v.value()));
		} else {
			return visitor.visitNewtypeStruct(this);
		}
	}

	/**
	 * Besides the variant values, accepts a string naming a unit variant,
	 * and a single-entry map from variant tag to payload.
	 */
	@Override
	public <T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor) {
		if (value instanceof Value.Str) {
			return visitor.visitEnum(new ValueEnumAccess(value, null));
		} else if (value instanceof Value.MapValue v) {
			if (v.entries().size() != 1) {
				throw invalidType(Unexpected.map(), Expected.of("map with a single key"));
			}
			Value.Entry entry = v.entries().get(0);
			return visitor.visitEnum(new ValueEnumAccess(entry.key(), entry.value()));
		} else if (isVariant(value)) {
			return visitor.visitEnum(enumAccess(visitor));
		} else {
			throw invalidType(unexpected(value), Expected.of("enum " + name));
		}
	}

	@Override
	public <T> T deserializeIgnoredAny(Visitor<T> visitor) {
		return visitor.visitUnit();
	}

	@Override
	public Set<Flavor> supportedFlavors() {
		return Flavors.NOT_BORROWABLE;
	}

	private static boolean isVariant(Value value) {
		return value.shape().isVariant();
	}

	private ValueEnumAccess enumAccess(Expected expected) {
		if (value instanceof Value.UnitVariant v) {
			return new ValueEnumAccess(new Value.Str(v.variant()), null);
		} else if (value instanceof Value.NewtypeVariant v) {
			return new ValueEnumAccess(new Value.Str(v.variant()), new Value.Newtype(v.name(), v.value()));
		} else if (value instanceof Value.TupleVariant v) {
			return new ValueEnumAccess(new Value.Str(v.variant()), new Value.Tuple(v.elements()));
		} else if (value instanceof Value.StructVariant v) {
			return new ValueEnumAccess(new Value.Str(v.variant()), new Value.Struct(v.variant(), v.fields()));
		} else {
			throw invalidType(unexpected(value), expected);
		}
	}

	static Unexpected unexpected(Value value) {
		if (value instanceof Value.Bool v) {
			return Unexpected.bool(v.value());
		} else if (value instanceof Value.Int v) {
			return (v.shape() == Shape.U8 || v.shape() == Shape.U16 || v.shape() == Shape.U32 || v.shape() == Shape.U64) ? Unexpected.unsigned(v.value()) : Unexpected.signed(v.value());
		} else if (value instanceof Value.BigInt v) {
			return Unexpected.bigInteger(v.value());
		} else if (value instanceof Value.Float v) {
			return Unexpected.floating(v.value());
		} else if (value instanceof Value.Char v) {
			return Unexpected.character(v.codePoint());
		} else if (value instanceof Value.Str v) {
			return Unexpected.str(v.value());
		}
		return switch (value.shape()) {
			case BYTES -> Unexpected.bytes();
			case OPTION -> Unexpected.option();
			case UNIT, UNIT_STRUCT -> Unexpected.unit();
			case NEWTYPE_STRUCT -> Unexpected.newtypeStruct();
			case UNIT_VARIANT -> Unexpected.unitVariant();
			case NEWTYPE_VARIANT -> Unexpected.newtypeVariant();
			case TUPLE_VARIANT -> Unexpected.tupleVariant();
			case STRUCT_VARIANT -> Unexpected.structVariant();
			case MAP, STRUCT -> Unexpected.map();
			default -> Unexpected.seq();
		};
	}

	private static List<Value.Entry> fieldEntries(List<Value.Field> fields) {
		List<Value.Entry> entries = new ArrayList<>(fields.size());
		for (Value.Field field : fields) {
			entries.add(new Value.Entry(new Value.Str(field.name()), field.value()));
		}
		return entries;
	}

	private static <T> T visitElements(List<Value> elements, Visitor<T> visitor) {
		ElementAccess access = new ElementAccess(elements);
		T result = visitor.visitSeq(access);
		if (access.remaining.hasNext()) {
			throw new MalformedInputException("Trailing elements in sequence of length " + elements.size(), visitor.expecting(), -1);
		}
		return result;
	}

	private static <T> T visitEntries(List<Value.Entry> entries, Visitor<T> visitor) {
		EntryAccess access = new EntryAccess(entries);
		T result = visitor.visitMap(access);
		if (access.remaining.hasNext() || access.pendingValue != null) {
			throw new MalformedInputException("Trailing entries in map of size " + entries.size(), visitor.expecting(), -1);
		}
		return result;
	}

	private static final class ElementAccess implements SeqAccess {
		final Iterator<Value> remaining;
		int left;

		ElementAccess(List<Value> elements) {
			this.remaining = elements.iterator();
			this.left = elements.size();
		}

		@Override
		public <T> Optional<T> nextElement(Deserialize<T> element) {
			if (!remaining.hasNext()) {
				return Optional.empty();
			}
			left--;
			return Optional.of(element.deserialize(new ValueDeserializer(remaining.next())));
		}

		@Override
		public OptionalInt sizeHint() {
			return OptionalInt.of(left);
		}
	}

	private static final class EntryAccess implements MapAccess {
		final Iterator<Value.Entry> remaining;
		int left;
		Value pendingValue;

		EntryAccess(List<Value.Entry> entries) {
			this.remaining = entries.iterator();
			this.left = entries.size();
		}

		@Override
		public <K> Optional<K> nextKey(Deserialize<K> key) {
			if (pendingValue != null) {
				throw new IllegalStateException("nextKey called before nextValue");
			}
			if (!remaining.hasNext()) {
				return Optional.empty();
			}
			left--;
			Value.Entry entry = remaining.next();
			pendingValue = entry.value();
			return Optional.of(key.deserialize(new ValueDeserializer(entry.key())));
		}

		@Override
		public <V> V nextValue(Deserialize<V> value) {
			if (pendingValue == null) {
				throw new IllegalStateException("nextValue called without a key");
			}
			Value v = pendingValue;
			pendingValue = null;
			return value.deserialize(new ValueDeserializer(v));
		}

		@Override
		public OptionalInt sizeHint() {
			return OptionalInt.of(left);
		}
	}

	/**
	 * @param payload null for a unit variant
	 */
	private record ValueEnumAccess(Value tag, Value payload) implements EnumAccess, VariantAccess {
		@Override
		public <V> Variant<V> variant(Deserialize<V> tagDeserialize) {
			return new Variant<>(tagDeserialize.deserialize(new ValueDeserializer(tag)), this);
		}

		@Override
		public void unitVariant() {
			if (payload != null && !(payload instanceof Value.UnitValue)) {
				throw invalidType(unexpectedPayload(), Expected.of("unit variant"));
			}
		}

		@Override
		public <T> T newtypeVariant(Deserialize<T> value) {
			if (payload == null) {
				throw invalidType(Unexpected.unitVariant(), Expected.of("newtype variant"));
			}
			Value inner = (payload instanceof Value.Newtype n) ? n.value() : payload;
			return value.deserialize(new ValueDeserializer(inner));
		}

		@Override
		public <T> T tupleVariant(int length, Visitor<T> visitor) {
			if (payload instanceof Value.Tuple v) {
				return visitElements(v.elements(), visitor);
			} else if (payload instanceof Value.Seq v) {
				return visitElements(v.elements(), visitor);
			}
			throw invalidType(unexpectedPayload(), Expected.of("tuple variant"));
		}

		@Override
		public <T> T structVariant(List<String> fields, Visitor<T> visitor) {
			if (payload instanceof Value.Struct v) {
				return visitEntries(fieldEntries(v.fields()), visitor);
			} else if (payload instanceof Value.MapValue v) {
				return visitEntries(v.entries(), visitor);
			}
			throw invalidType(unexpectedPayload(), Expected.of("struct variant"));
		}

		private Unexpected unexpectedPayload() {
			if (payload == null) {
				return Unexpected.unitVariant();
			} else if (payload instanceof Value.Tuple) {
				return Unexpected.tupleVariant();
			} else if (payload instanceof Value.Struct) {
				return Unexpected.structVariant();
			} else if (payload instanceof Value.Newtype) {
				return Unexpected.newtypeVariant();
			}
			return unexpected(payload);
		}
	}
}
