package works.datashape.testing.state;

import java.util.List;
import java.util.stream.Stream;
import works.datashape.impls.Deserializers;
import works.datashape.impls.Serializers;
import works.datashape.model.Shape;

/**
 * One {@link ShapeCase} per {@link Shape}, drawn from {@link OneOfEach#sample()}.
 */
public final class ShapeCases {
	private ShapeCases() {}

	public static List<ShapeCase> all() {
		OneOfEach s = OneOfEach.sample();
		return List.of(
			new ShapeCase(Shape.BOOL, s.flag(), Serializers.bool(s.flag()), Deserializers.BOOL),
			new ShapeCase(Shape.I8, s.tiny(), Serializers.i8(s.tiny()), Deserializers.I8),
			new ShapeCase(Shape.I16, s.small(), Serializers.i16(s.small()), Deserializers.I16),
			new ShapeCase(Shape.I32, s.medium(), Serializers.i32(s.medium()), Deserializers.I32),
			new ShapeCase(Shape.I64, s.large(), Serializers.i64(s.large()), Deserializers.I64),
			new ShapeCase(Shape.I128, s.huge(), Serializers.bigInteger(s.huge()), Deserializers.I128),
			new ShapeCase(Shape.U8, s.ubyte(), Serializers.u8(s.ubyte()), Deserializers.U8),
			new ShapeCase(Shape.U16, s.ushort(), Serializers.u16(s.ushort()), Deserializers.U16),
			new ShapeCase(Shape.U32, s.uint(), Serializers.u32(s.uint()), Deserializers.U32),
			new ShapeCase(Shape.U64, s.ulong(), Serializers.u64(s.ulong()), Deserializers.U64),
			new ShapeCase(Shape.U128, s.uhuge(), Serializers.unsignedBigInteger(s.uhuge()), Deserializers.U128),
			new ShapeCase(Shape.F32, s.single(), Serializers.f32(s.single()), Deserializers.F32),
			new ShapeCase(Shape.F64, s.dbl(), Serializers.f64(s.dbl()), Deserializers.F64),
			new ShapeCase(Shape.CHAR, s.letter(), Serializers.codePoint(s.letter()), Deserializers.CODE_POINT),
			new ShapeCase(Shape.STRING, s.text(), Serializers.string(s.text()), Deserializers.STRING),
			new ShapeCase(Shape.BYTES, s.blob(), Serializers.bytes(s.blob()), Deserializers.BYTES),
			new ShapeCase(Shape.OPTION, s.maybe(), Serializers.optional(s.maybe(), Serializers::string), Deserializers.optional(Deserializers.STRING)),
			new ShapeCase(Shape.UNIT, s.nothing(), Serializers.unit(), Deserializers.UNIT),
			new ShapeCase(Shape.UNIT_STRUCT, s.marker(), s.marker(), Marker.DESERIALIZE),
			new ShapeCase(Shape.UNIT_VARIANT, s.suit(), Serializers.enumValue(s.suit()), Deserializers.enumByName(Suit.class)),
			new ShapeCase(Shape.NEWTYPE_STRUCT, s.meters(), s.meters(), Meters.DESERIALIZE),
			new ShapeCase(Shape.NEWTYPE_VARIANT, s.wrapped(), s.wrapped(), Payload.DESERIALIZE),
			new ShapeCase(Shape.SEQ, s.numbers(), Serializers.list(s.numbers(), Serializers::i32), Deserializers.list(Deserializers.I32)),
			new ShapeCase(Shape.MAP, s.counts(), Serializers.map(s.counts(), Serializers::string, Serializers::i32), Deserializers.map(Deserializers.STRING, Deserializers.I32)),
			new ShapeCase(Shape.TUPLE, s.coordinates(), s.coordinates(), Coordinates.DESERIALIZE),
			new ShapeCase(Shape.TUPLE_STRUCT, s.color(), s.color(), Rgb.DESERIALIZE),
			new ShapeCase(Shape.TUPLE_VARIANT, s.pair(), s.pair(), Payload.DESERIALIZE),
			new ShapeCase(Shape.STRUCT, s, s, OneOfEach.DESERIALIZE),
			new ShapeCase(Shape.STRUCT_VARIANT, s.labeled(), s.labeled(), Payload.DESERIALIZE));
	}

	public static Stream<ShapeCase> stream() {
		return all().stream();
	}
}
