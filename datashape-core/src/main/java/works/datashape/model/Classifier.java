package works.datashape.model;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * Determines the {@link Shape} a value maps to, with its metadata.
 * <p>
 * Rather than consulting a separate table, this runs the value's own
 * {@link Serialize mapping logic} against a serializer that records
 * only the outermost call. Nested values are never visited,
 * and nothing is written anywhere.
 * Since the encoder runs the very same logic, the two cannot disagree.
 */
public final class Classifier {
	private Classifier() {}

	/**
	 * @throws IllegalStateException if the mapping logic makes no top-level call or more than one,
	 * which is a defect in the mapping logic rather than a property of the value
	 */
	public static ShapeDescriptor classify(Serialize value) {
		Recorder recorder = new Recorder();
		value.serialize(recorder);
		if (recorder.result == null) {
			throw new IllegalStateException("Mapping logic made no serializer call");
		}
		LOGGER.trace("Classified {} as {}", value, recorder.result);
		return recorder.result;
	}

	public static Shape shapeOf(Serialize value) {
		return classify(value).shape();
	}

	private static final class Recorder implements Serializer {
		ShapeDescriptor result;

		private void record(ShapeDescriptor descriptor) {
			if (result != null) {
				throw new IllegalStateException("Mapping logic straddles two shapes: "
					+ result.shape() + " and " + descriptor.shape());
			}
			result = descriptor;
		}

		private void record(Shape shape) {
			record(ShapeDescriptor.of(shape));
		}

		@Override public void serializeBool(boolean value) { record(Shape.BOOL); }
		@Override public void serializeI8(byte value) { record(Shape.I8); }
		@Override public void serializeI16(short value) { record(Shape.I16); }
		@Override public void serializeI32(int value) { record(Shape.I32); }
		@Override public void serializeI64(long value) { record(Shape.I64); }
		@Override public void serializeI128(BigInteger value) { record(Shape.I128); }
		@Override public void serializeU8(int value) { record(Shape.U8); }
		@Override public void serializeU16(int value) { record(Shape.U16); }
		@Override public void serializeU32(long value) { record(Shape.U32); }
		@Override public void serializeU64(long value) { record(Shape.U64); }
		@Override public void serializeU128(BigInteger value) { record(Shape.U128); }
		@Override public void serializeF32(float value) { record(Shape.F32); }
		@Override public void serializeF64(double value) { record(Shape.F64); }
		@Override public void serializeChar(int codePoint) { record(Shape.CHAR); }
		@Override public void serializeStr(CharSequence value) { record(Shape.STRING); }
		@Override public void serializeBytes(ByteBuffer value) { record(Shape.BYTES); }
		@Override public void serializeNone() { record(Shape.OPTION); }
		@Override public void serializeSome(Serialize value) { record(Shape.OPTION); }
		@Override public void serializeUnit() { record(Shape.UNIT); }

		@Override
		public void serializeUnitStruct(String name) {
			record(ShapeDescriptor.named(Shape.UNIT_STRUCT, name));
		}

		@Override
		public void serializeUnitVariant(String name, int variantIndex, String variant) {
			record(ShapeDescriptor.variant(Shape.UNIT_VARIANT, name, variantIndex, variant));
		}

		@Override
		public void serializeNewtypeStruct(String name, Serialize value) {
			record(ShapeDescriptor.named(Shape.NEWTYPE_STRUCT, name));
		}

		@Override
		public void serializeNewtypeVariant(String name, int variantIndex, String variant, Serialize value) {
			record(ShapeDescriptor.variant(Shape.NEWTYPE_VARIANT, name, variantIndex, variant));
		}

		@Override
		public SerializeSeq serializeSeq(OptionalInt length) {
			record(ShapeDescriptor.of(Shape.SEQ).withLength(length));
			return new Ignored();
		}

		@Override
		public SerializeTuple serializeTuple(int length) {
			record(ShapeDescriptor.of(Shape.TUPLE).withLength(OptionalInt.of(length)));
			return new Ignored();
		}

		@Override
		public SerializeTupleStruct serializeTupleStruct(String name, int length) {
			record(ShapeDescriptor.named(Shape.TUPLE_STRUCT, name).withLength(OptionalInt.of(length)));
			return new Ignored();
		}

		@Override
		public SerializeTupleVariant serializeTupleVariant(String name, int variantIndex, String variant, int length) {
			record(ShapeDescriptor.variant(Shape.TUPLE_VARIANT, name, variantIndex, variant).withLength(OptionalInt.of(length)));
			return new Ignored();
		}

		@Override
		public SerializeMap serializeMap(OptionalInt length) {
			record(ShapeDescriptor.of(Shape.MAP).withLength(length));
			return new Ignored();
		}

		@Override
		public SerializeStruct serializeStruct(String name, int length) {
			FieldCollector fields = new FieldCollector(ShapeDescriptor.named(Shape.STRUCT, name));
			record(fields.descriptor);
			return fields;
		}

		@Override
		public SerializeStructVariant serializeStructVariant(String name, int variantIndex, String variant, int length) {
			FieldCollector fields = new FieldCollector(ShapeDescriptor.variant(Shape.STRUCT_VARIANT, name, variantIndex, variant));
			record(fields.descriptor);
			return fields;
		}

		/**
		 * Collects field names, including skipped ones, without touching the field values.
		 * The descriptor is replaced with the complete one on {@link #end()}.
		 */
		private final class FieldCollector implements SerializeStruct, SerializeStructVariant {
			final ShapeDescriptor descriptor;
			final List<String> names = new ArrayList<>();

			FieldCollector(ShapeDescriptor descriptor) {
				this.descriptor = descriptor;
			}

			@Override
			public void serializeField(String key, Serialize value) {
				names.add(key);
			}

			@Override
			public void skipField(String key) {
				names.add(key);
			}

			@Override
			public void end() {
				result = descriptor.withFields(names);
			}
		}
	}

	/**
	 * Elements of the outermost compound value are not classified.
	 */
	private static final class Ignored implements SerializeSeq, SerializeTuple, SerializeTupleStruct, SerializeTupleVariant, SerializeMap {
		@Override public void serializeElement(Serialize value) { }
		@Override public void serializeField(Serialize value) { }
		@Override public void serializeKey(Serialize key) { }
		@Override public void serializeValue(Serialize value) { }
		@Override public void end() { }
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Classifier.class);
}
