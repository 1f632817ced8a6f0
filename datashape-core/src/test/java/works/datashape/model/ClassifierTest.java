package works.datashape.model;

import java.math.BigInteger;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeStruct;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClassifierTest {

	@Test
	void primitives() {
		assertEquals(Shape.BOOL, Classifier.shapeOf(s -> s.serializeBool(true)));
		assertEquals(Shape.U128, Classifier.shapeOf(s -> s.serializeU128(BigInteger.TEN)));
		assertEquals(Shape.CHAR, Classifier.shapeOf(s -> s.serializeChar('x')));
		assertEquals(Shape.OPTION, Classifier.shapeOf(s -> s.serializeNone()));
	}

	@Test
	void variantMetadata() {
		ShapeDescriptor d = Classifier.classify(s -> s.serializeUnitVariant("Color", 2, "Blue"));
		assertEquals(Shape.UNIT_VARIANT, d.shape());
		assertEquals("Color", d.name());
		assertEquals(OptionalInt.of(2), d.variantIndex());
		assertEquals("Blue", d.variant());
	}

	@Test
	void seqLengthHint() {
		ShapeDescriptor known = Classifier.classify(s -> s.collectSeq(List.of(1, 2, 3), i -> x -> x.serializeI32(i)));
		assertEquals(Shape.SEQ, known.shape());
		assertEquals(OptionalInt.of(3), known.length());

		ShapeDescriptor unknown = Classifier.classify(s -> s.serializeSeq(OptionalInt.empty()).end());
		assertEquals(OptionalInt.empty(), unknown.length());
	}

	@Test
	void structFieldsIncludeSkipped() {
		Serialize point = s -> {
			SerializeStruct struct = s.serializeStruct("Point", 3);
			struct.serializeField("x", v -> v.serializeI32(1));
			struct.skipField("label");
			struct.serializeField("y", v -> v.serializeI32(2));
			struct.end();
		};
		ShapeDescriptor d = Classifier.classify(point);
		assertEquals(Shape.STRUCT, d.shape());
		assertEquals("Point", d.name());
		assertEquals(List.of("x", "label", "y"), d.fields());
		assertEquals(OptionalInt.of(3), d.length());
	}

	@Test
	void nestedValuesAreNotClassified() {
		Serialize wrapper = s -> s.serializeNewtypeStruct("Meters", v -> v.serializeF64(1.5));
		assertEquals(Shape.NEWTYPE_STRUCT, Classifier.shapeOf(wrapper));
	}

	@Test
	void noCall_throws() {
		assertThrows(IllegalStateException.class, () -> Classifier.classify(s -> { }));
	}

	@Test
	void twoCalls_throws() {
		assertThrows(IllegalStateException.class, () -> Classifier.classify(s -> {
			s.serializeBool(true);
			s.serializeBool(false);
		}));
	}
}
