package works.datashape.testing.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiFunction;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.datashape.de.Deserializer;
import works.datashape.de.IgnoredAny;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.Visitor;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.exceptions.SerializationException;
import works.datashape.exceptions.UnrecognizedContentException;
import works.datashape.impls.Deserializers;
import works.datashape.impls.Serializers;
import works.datashape.model.Classifier;
import works.datashape.model.Shape;
import works.datashape.model.Unit;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeSeq;
import works.datashape.testing.RecordingVisitor;
import works.datashape.testing.state.OneOfEach;
import works.datashape.testing.state.ShapeCase;
import works.datashape.testing.state.Suit;
import works.datashape.value.Value;
import works.datashape.value.ValueVisitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Checks that a {@link Codec} carries every {@link Shape} faithfully,
 * calls exactly one visitor method per value,
 * and rejects input the visitor leaves unread.
 * <p>
 * Use this by extending it and assigning {@link #codec} in a
 * {@link org.junit.jupiter.api.BeforeEach BeforeEach} method.
 */
public abstract class CodecConformanceTest<E> extends AbstractCodecTest<E> {

	@ParameterizedTest
	@MethodSource("works.datashape.testing.state.ShapeCases#stream")
	void everyShape_roundTrips(ShapeCase shapeCase) {
		assertEquals(shapeCase.shape(), Classifier.shapeOf(shapeCase.serialize()),
			"Fixture should have the shape it claims");
		Object actual = roundTrip(shapeCase.serialize(), shapeCase.deserialize());
		assertTrue(Objects.deepEquals(shapeCase.value(), actual),
			() -> codec.name() + " changed " + shapeCase.shape() + " value " + shapeCase.value() + " into " + actual);
	}

	@Test
	void oneOfEach_roundTrips() {
		OneOfEach expected = OneOfEach.sample();
		assertEquals(expected, roundTrip(expected, OneOfEach.DESERIALIZE));
	}

	@ParameterizedTest
	@MethodSource("works.datashape.testing.state.ShapeCases#stream")
	void selfDescribing_skipsEveryShape(ShapeCase shapeCase) {
		assumeTrue(codec.isSelfDescribing());
		assertEquals(Unit.INSTANCE, roundTrip(shapeCase.serialize(), IgnoredAny.INSTANCE));
	}

	@ParameterizedTest
	@MethodSource("works.datashape.testing.state.ShapeCases#stream")
	void selfDescribing_survivesValueDetour(ShapeCase shapeCase) {
		assumeTrue(codec.isSelfDescribing());
		// Variants decoded without type hints lose their payload kind
		assumeTrue(!shapeCase.shape().isVariant() && shapeCase.shape() != Shape.STRUCT);
		Value value = roundTrip(shapeCase.serialize(), ValueVisitor.INSTANCE);
		Object actual = shapeCase.deserialize().deserialize(value.deserializer());
		assertTrue(Objects.deepEquals(shapeCase.value(), actual),
			() -> shapeCase.shape() + " value " + shapeCase.value() + " came back as " + actual + " via " + value);
	}

	static Stream<Arguments> visitCases() {
		Map<String, Long> counts = new LinkedHashMap<>();
		counts.put("a", 1L);
		counts.put("b", -2L);
		return Stream.of(
			visitCase("bool", Serializers.bool(true), Deserializer::deserializeBool, true),
			visitCase("i32", Serializers.i32(-5), Deserializer::deserializeI32, -5L),
			visitCase("u64", Serializers.u64(5), Deserializer::deserializeU64, 5L),
			visitCase("f64", Serializers.f64(0.5), Deserializer::deserializeF64, 0.5),
			visitCase("str", Serializers.string("text"), Deserializer::deserializeStr, "text"),
			visitCase("none", Serializers.optional(Optional.<String>empty(), Serializers::string), Deserializer::deserializeOption, Optional.empty()),
			visitCase("some", Serializers.optional(Optional.of("x"), Serializers::string), Deserializer::deserializeOption, Optional.of("x")),
			visitCase("unit", Serializers.unit(), Deserializer::deserializeUnit, Unit.INSTANCE),
			visitCase("seq", Serializers.list(List.of(1L, 2L), Serializers::i64), Deserializer::deserializeSeq, List.of(1L, 2L)),
			visitCase("map", Serializers.map(counts, Serializers::string, Serializers::i64), Deserializer::deserializeMap, counts)
		);
	}

	private static Arguments visitCase(String name, Serialize value, BiFunction<Deserializer, Visitor<Object>, Object> entry, Object expected) {
		return Arguments.of(name, value, entry, expected);
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("visitCases")
	void deserializer_callsVisitorExactlyOnce(String name, Serialize value, BiFunction<Deserializer, Visitor<Object>, Object> entry, Object expected) {
		RecordingVisitor<Object> recorder = RecordingVisitor.wrap(new Probe());
		Object actual = roundTrip(value, d -> entry.apply(d, recorder));
		assertEquals(expected, actual);
		recorder.onlyCall();
	}

	@Test
	void unreadElements_rejected() {
		Serialize three = Serializers.list(List.of(1, 2, 3), Serializers::i32);
		assertThrows(MalformedInputException.class, () -> roundTrip(three, d -> d.deserializeSeq(new Visitor<Integer>() {
			@Override public String expecting() { return "just the first element"; }

			@Override
			public Integer visitSeq(SeqAccess seq) {
				return seq.nextElement(Deserializers.I32).orElseThrow();
			}
		})));
	}

	@Test
	void unreadEntries_rejected() {
		Serialize two = Serializers.map(Map.of("a", 1, "b", 2), Serializers::string, Serializers::i32);
		assertThrows(MalformedInputException.class, () -> roundTrip(two, d -> d.deserializeMap(new Visitor<String>() {
			@Override public String expecting() { return "just the first key"; }

			@Override
			public String visitMap(MapAccess map) {
				String key = map.nextKey(Deserializers.STRING).orElseThrow();
				map.nextValue(Deserializers.I32);
				return key;
			}
		})));
	}

	@Test
	void wrongElementCount_rejectedBySerializer() {
		Serialize lying = s -> {
			SerializeSeq seq = s.serializeSeq(OptionalInt.of(2));
			seq.serializeElement(Serializers.i32(1));
			seq.serializeElement(Serializers.i32(2));
			seq.serializeElement(Serializers.i32(3));
			seq.end();
		};
		assertThrows(SerializationException.class, () -> codec.encode(lying));
	}

	@Test
	void unknownVariant_unrecognized() {
		Serialize joker = s -> s.serializeUnitVariant("Suit", 7, "JOKER");
		assertThrows(UnrecognizedContentException.class, () -> roundTrip(joker, Deserializers.enumByName(Suit.class)));
	}

	@Test
	void missingField_unrecognized() {
		assumeTrue(codec.isSelfDescribing());
		Serialize partial = s -> {
			var struct = s.serializeStruct("Duration", 1);
			struct.serializeField("secs", Serializers.i64(1));
			struct.end();
		};
		UnrecognizedContentException e = assertThrows(UnrecognizedContentException.class,
			() -> roundTrip(partial, Deserializers.DURATION_VALUE));
		assertEquals("missing field `nanos`", e.getMessage());
	}

	/**
	 * Accepts the handful of shapes used by {@link #visitCases()},
	 * reading nested values with typed hints so it works on any codec.
	 */
	private static final class Probe implements Visitor<Object> {
		@Override public String expecting() { return "anything the probe understands"; }
		@Override public Object visitBool(boolean value) { return value; }
		@Override public Object visitI64(long value) { return value; }
		@Override public Object visitU64(long value) { return value; }
		@Override public Object visitF64(double value) { return value; }
		@Override public Object visitStr(CharSequence value) { return value.toString(); }
		@Override public Object visitNone() { return Optional.empty(); }
		@Override public Object visitSome(Deserializer deserializer) { return Optional.of(Deserializers.STRING.deserialize(deserializer)); }
		@Override public Object visitUnit() { return Unit.INSTANCE; }

		@Override
		public Object visitSeq(SeqAccess seq) {
			List<Long> result = new ArrayList<>();
			for (Optional<Long> e = seq.nextElement(Deserializers.I64); e.isPresent(); e = seq.nextElement(Deserializers.I64)) {
				result.add(e.get());
			}
			return result;
		}

		@Override
		public Object visitMap(MapAccess map) {
			Map<String, Long> result = new LinkedHashMap<>();
			for (Optional<String> k = map.nextKey(Deserializers.STRING); k.isPresent(); k = map.nextKey(Deserializers.STRING)) {
				result.put(k.get(), map.nextValue(Deserializers.I64));
			}
			return result;
		}
	}
}
