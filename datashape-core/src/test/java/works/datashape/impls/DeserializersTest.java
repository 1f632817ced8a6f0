package works.datashape.impls;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import works.datashape.de.Deserialize;
import works.datashape.de.MapAccess;
import works.datashape.de.Visitor;
import works.datashape.exceptions.UnrecognizedContentException;
import works.datashape.model.IntegerRanges;
import works.datashape.ser.Serialize;
import works.datashape.value.Value;
import works.datashape.value.ValueSerializer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeserializersTest {

	static <T> T roundTrip(Serialize value, Deserialize<T> type) {
		return type.deserialize(ValueSerializer.toValue(value).deserializer());
	}

	@Test
	void jdkTypes() {
		Duration duration = Duration.ofSeconds(-5, 250);
		assertEquals(duration, roundTrip(Serializers.duration(duration), Deserializers.DURATION_VALUE));

		UUID uuid = UUID.randomUUID();
		assertEquals(uuid, roundTrip(Serializers.uuid(uuid), Deserializers.UUID_VALUE));

		Path path = Path.of("some", "file.txt");
		assertEquals(path, roundTrip(Serializers.path(path), Deserializers.PATH));

		assertEquals(Set.of("a", "b"), roundTrip(
			Serializers.collection(Set.of("a", "b"), Serializers::string),
			Deserializers.set(Deserializers.STRING)));
	}

	@Test
	void durationFromSequence() {
		Value positional = new Value.Tuple(List.of(Value.Int.i64(3), Value.Int.u32(7)));
		assertEquals(Duration.ofSeconds(3, 7), Deserializers.DURATION_VALUE.deserialize(positional.deserializer()));
	}

	@Test
	void durationNanosOutOfRange() {
		Value value = new Value.MapValue(List.of(
			new Value.Entry(new Value.Str("secs"), Value.Int.i64(1)),
			new Value.Entry(new Value.Str("nanos"), Value.Int.u32(1_000_000_000L))));
		assertThrows(UnrecognizedContentException.class, () -> Deserializers.DURATION_VALUE.deserialize(value.deserializer()));
	}

	@Test
	void structFieldErrors() {
		Value missing = new Value.MapValue(List.of(new Value.Entry(new Value.Str("secs"), Value.Int.i64(1))));
		UnrecognizedContentException e = assertThrows(UnrecognizedContentException.class,
			() -> Deserializers.DURATION_VALUE.deserialize(missing.deserializer()));
		assertEquals("missing field `nanos`", e.getMessage());

		Value duplicate = new Value.MapValue(List.of(
			new Value.Entry(new Value.Str("secs"), Value.Int.i64(1)),
			new Value.Entry(new Value.Str("secs"), Value.Int.i64(2))));
		e = assertThrows(UnrecognizedContentException.class, () -> Deserializers.DURATION_VALUE.deserialize(duplicate.deserializer()));
		assertEquals("duplicate field `secs`", e.getMessage());

		Value unknown = new Value.MapValue(List.of(new Value.Entry(new Value.Str("millis"), Value.Int.i64(1))));
		e = assertThrows(UnrecognizedContentException.class, () -> Deserializers.DURATION_VALUE.deserialize(unknown.deserializer()));
		assertEquals("unknown field `millis`, expected one of `secs`, `nanos`", e.getMessage());
	}

	@Test
	void ignoringUnknownFields() {
		FieldVisitor fields = FieldVisitor.of(List.of("a")).ignoringUnknown();
		Value value = new Value.MapValue(List.of(
			new Value.Entry(new Value.Str("zzz"), new Value.Seq(List.of(new Value.Bool(true)))),
			new Value.Entry(new Value.Str("a"), Value.Int.i32(9))));
		int a = value.deserializer().deserializeStruct("A", fields.fields(), new Visitor<Integer>() {
			@Override public String expecting() { return "struct A"; }

			@Override
			public Integer visitMap(MapAccess map) {
				StructFields collected = new StructFields(fields);
				collected.readAll(map, index -> Deserializers.I32);
				return collected.get(0);
			}
		});
		assertEquals(9, a);
	}

	@Test
	void fieldByIndex() {
		FieldVisitor fields = FieldVisitor.of(List.of("a", "b"));
		assertEquals(1, fields.deserialize(Value.Int.u8(1).deserializer()));
		assertThrows(UnrecognizedContentException.class, () -> fields.deserialize(Value.Int.u8(2).deserializer()));
	}

	@Test
	void characters() {
		assertEquals('x', roundTrip(Serializers.character('x'), Deserializers.CHARACTER));
		assertEquals(0x1F60E, roundTrip(Serializers.string("😎"), Deserializers.CODE_POINT));
		assertThrows(UnrecognizedContentException.class, () -> roundTrip(Serializers.codePoint(0x1F60E), Deserializers.CHARACTER));
		assertThrows(UnrecognizedContentException.class, () -> roundTrip(Serializers.string("xy"), Deserializers.CODE_POINT));
	}

	@Test
	void bytesFromSequence() {
		assertArrayEquals(new byte[] { 0, 127, -1 }, roundTrip(Serializers.byteSeq(new byte[] { 0, 127, -1 }), Deserializers.BYTES));
	}

	@Test
	void tuples() {
		Serialize pair = Serializers.tuple(Serializers.string("x"), Serializers.u16(65535));
		assertEquals(List.of("x", 65535), roundTrip(pair, Deserializers.tuple(Deserializers.STRING, Deserializers.U16)));
		assertThrows(UnrecognizedContentException.class,
			() -> roundTrip(Serializers.tuple(Serializers.bool(true)), Deserializers.tuple(Deserializers.BOOL, Deserializers.BOOL)));
	}

	@Test
	void integerRanges() {
		assertEquals(-1L, roundTrip(Serializers.u64(-1L), Deserializers.U64));
		assertThrows(UnrecognizedContentException.class, () -> roundTrip(Serializers.u64(-1L), Deserializers.I64));
		assertThrows(UnrecognizedContentException.class, () -> roundTrip(Serializers.i32(-1), Deserializers.U32));
		assertEquals(IntegerRanges.MAX_U128, roundTrip(Serializers.unsignedBigInteger(IntegerRanges.MAX_U128), Deserializers.U128));
		assertThrows(UnrecognizedContentException.class,
			() -> roundTrip(Serializers.unsignedBigInteger(IntegerRanges.MAX_U128), Deserializers.I128));
		assertEquals(12L, roundTrip(Serializers.bigInteger(BigInteger.valueOf(12)), Deserializers.I64));
		assertEquals(BigInteger.valueOf(-7), roundTrip(Serializers.i8((byte) -7), Deserializers.I128));
	}

	@Test
	void floats() {
		assertEquals(1.5f, roundTrip(Serializers.f32(1.5f), Deserializers.F32));
		assertEquals(3.0, roundTrip(Serializers.i32(3), Deserializers.F64));
		assertThrows(UnrecognizedContentException.class, () -> roundTrip(Serializers.string("1.0"), Deserializers.F64));
	}
}
