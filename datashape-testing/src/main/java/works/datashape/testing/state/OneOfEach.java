package works.datashape.testing.state;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import works.datashape.de.Deserialize;
import works.datashape.de.MapAccess;
import works.datashape.de.SeqAccess;
import works.datashape.de.Visitor;
import works.datashape.impls.Deserializers;
import works.datashape.impls.FieldVisitor;
import works.datashape.impls.Serializers;
import works.datashape.impls.StructFields;
import works.datashape.model.Unit;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeStruct;
import works.datashape.ser.Serializer;

import static works.datashape.exceptions.UnrecognizedContentException.invalidLength;

/**
 * A struct whose fields, together with the struct itself,
 * cover every {@link works.datashape.model.Shape shape}.
 * <p>
 * Field order matches {@link #FIELDS}, which is also the positional order
 * used by formats that write structs as sequences.
 */
public record OneOfEach(
	boolean flag,
	byte tiny,
	short small,
	int medium,
	long large,
	BigInteger huge,
	int ubyte,
	int ushort,
	long uint,
	long ulong,
	BigInteger uhuge,
	float single,
	double dbl,
	int letter,
	String text,
	byte[] blob,
	Optional<String> maybe,
	Unit nothing,
	Marker marker,
	Suit suit,
	Meters meters,
	Payload wrapped,
	List<Integer> numbers,
	Coordinates coordinates,
	Rgb color,
	Payload pair,
	Map<String, Integer> counts,
	Payload labeled
) implements Serialize {
	public static final String NAME = "OneOfEach";

	public static final List<String> FIELDS = List.of(
		"flag", "tiny", "small", "medium", "large", "huge",
		"ubyte", "ushort", "uint", "ulong", "uhuge",
		"single", "dbl", "letter", "text", "blob",
		"maybe", "nothing", "marker", "suit", "meters", "wrapped",
		"numbers", "coordinates", "color", "pair", "counts", "labeled");

	private static final List<Deserialize<?>> FIELD_TYPES = List.of(
		Deserializers.BOOL, Deserializers.I8, Deserializers.I16, Deserializers.I32, Deserializers.I64, Deserializers.I128,
		Deserializers.U8, Deserializers.U16, Deserializers.U32, Deserializers.U64, Deserializers.U128,
		Deserializers.F32, Deserializers.F64, Deserializers.CODE_POINT, Deserializers.STRING, Deserializers.BYTES,
		Deserializers.optional(Deserializers.STRING), Deserializers.UNIT, Marker.DESERIALIZE,
		Deserializers.enumByName(Suit.class), Meters.DESERIALIZE, Payload.DESERIALIZE,
		Deserializers.list(Deserializers.I32), Coordinates.DESERIALIZE, Rgb.DESERIALIZE, Payload.DESERIALIZE,
		Deserializers.map(Deserializers.STRING, Deserializers.I32), Payload.DESERIALIZE);

	public OneOfEach {
		blob = blob.clone();
	}

	/**
	 * Values chosen to sit near the edges of their ranges
	 * while staying exactly representable in every format.
	 */
	public static OneOfEach sample() {
		Map<String, Integer> counts = new LinkedHashMap<>();
		counts.put("apples", 3);
		counts.put("pears", -7);
		return new OneOfEach(
			true,
			Byte.MIN_VALUE,
			Short.MAX_VALUE,
			-123_456,
			Long.MIN_VALUE,
			BigInteger.ONE.shiftLeft(100).negate(),
			255,
			65_535,
			4_000_000_000L,
			-2L, // 2^64 - 2 as an unsigned pattern
			BigInteger.ONE.shiftLeft(127).add(BigInteger.TEN),
			1.5f,
			-0.1,
			0x1F600,
			"tab\there \"quoted\" é",
			new byte[] { 0, 1, (byte) 0x7F, (byte) 0x80, (byte) 0xFF },
			Optional.of("present"),
			Unit.INSTANCE,
			Marker.INSTANCE,
			Suit.HEARTS,
			new Meters(2.25),
			new Payload.Wrapped(42),
			List.of(1, 2, 3),
			new Coordinates(-1, 1),
			new Rgb(10, 200, 255),
			new Payload.Pair(7, "seven"),
			counts,
			new Payload.Labeled("label", false));
	}

	@Override
	public byte[] blob() {
		return blob.clone();
	}

	@Override
	public void serialize(Serializer serializer) {
		SerializeStruct struct = serializer.serializeStruct(NAME, FIELDS.size());
		struct.serializeField("flag", Serializers.bool(flag));
		struct.serializeField("tiny", Serializers.i8(tiny));
		struct.serializeField("small", Serializers.i16(small));
		struct.serializeField("medium", Serializers.i32(medium));
		struct.serializeField("large", Serializers.i64(large));
		struct.serializeField("huge", Serializers.bigInteger(huge));
		struct.serializeField("ubyte", Serializers.u8(ubyte));
		struct.serializeField("ushort", Serializers.u16(ushort));
		struct.serializeField("uint", Serializers.u32(uint));
		struct.serializeField("ulong", Serializers.u64(ulong));
		struct.serializeField("uhuge", Serializers.unsignedBigInteger(uhuge));
		struct.serializeField("single", Serializers.f32(single));
		struct.serializeField("dbl", Serializers.f64(dbl));
		struct.serializeField("letter", Serializers.codePoint(letter));
		struct.serializeField("text", Serializers.string(text));
		struct.serializeField("blob", Serializers.bytes(blob));
		struct.serializeField("maybe", Serializers.optional(maybe, Serializers::string));
		struct.serializeField("nothing", Serializers.unit());
		struct.serializeField("marker", marker);
		struct.serializeField("suit", Serializers.enumValue(suit));
		struct.serializeField("meters", meters);
		struct.serializeField("wrapped", wrapped);
		struct.serializeField("numbers", Serializers.list(numbers, Serializers::i32));
		struct.serializeField("coordinates", coordinates);
		struct.serializeField("color", color);
		struct.serializeField("pair", pair);
		struct.serializeField("counts", Serializers.map(counts, Serializers::string, Serializers::i32));
		struct.serializeField("labeled", labeled);
		struct.end();
	}

	public static final Deserialize<OneOfEach> DESERIALIZE = d -> d.deserializeStruct(NAME, FIELDS, new Visitor<OneOfEach>() {
		@Override public String expecting() { return "struct " + NAME; }

		@Override
		public OneOfEach visitSeq(SeqAccess seq) {
			Object[] values = new Object[FIELDS.size()];
			for (int i = 0; i < values.length; i++) {
				values[i] = seq.nextElement(FIELD_TYPES.get(i)).orElseThrow(invalidLengthAt(i));
			}
			return fromValues(values);
		}

		@Override
		public OneOfEach visitMap(MapAccess map) {
			StructFields fields = new StructFields(FieldVisitor.of(FIELDS));
			fields.readAll(map, FIELD_TYPES::get);
			Object[] values = new Object[FIELDS.size()];
			for (int i = 0; i < values.length; i++) {
				values[i] = fields.get(i);
			}
			return fromValues(values);
		}

		private Supplier<RuntimeException> invalidLengthAt(int index) {
			return () -> invalidLength(index, this);
		}
	});

	@SuppressWarnings("unchecked")
	private static OneOfEach fromValues(Object[] v) {
		return new OneOfEach(
			(Boolean) v[0], (Byte) v[1], (Short) v[2], (Integer) v[3], (Long) v[4], (BigInteger) v[5],
			(Integer) v[6], (Integer) v[7], (Long) v[8], (Long) v[9], (BigInteger) v[10],
			(Float) v[11], (Double) v[12], (Integer) v[13], (String) v[14], (byte[]) v[15],
			(Optional<String>) v[16], (Unit) v[17], (Marker) v[18], (Suit) v[19], (Meters) v[20], (Payload) v[21],
			(List<Integer>) v[22], (Coordinates) v[23], (Rgb) v[24], (Payload) v[25],
			(Map<String, Integer>) v[26], (Payload) v[27]);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof OneOfEach other)) {
			return false;
		}
		return flag == other.flag
			&& tiny == other.tiny
			&& small == other.small
			&& medium == other.medium
			&& large == other.large
			&& huge.equals(other.huge)
			&& ubyte == other.ubyte
			&& ushort == other.ushort
			&& uint == other.uint
			&& ulong == other.ulong
			&& uhuge.equals(other.uhuge)
			&& Float.compare(single, other.single) == 0
			&& Double.compare(dbl, other.dbl) == 0
			&& letter == other.letter
			&& text.equals(other.text)
			&& Arrays.equals(blob, other.blob)
			&& maybe.equals(other.maybe)
			&& nothing.equals(other.nothing)
			&& marker == other.marker
			&& suit == other.suit
			&& meters.equals(other.meters)
			&& wrapped.equals(other.wrapped)
			&& numbers.equals(other.numbers)
			&& coordinates.equals(other.coordinates)
			&& color.equals(other.color)
			&& pair.equals(other.pair)
			&& counts.equals(other.counts)
			&& labeled.equals(other.labeled);
	}

	@Override
	public int hashCode() {
		return Objects.hash(flag, tiny, small, medium, large, huge, ubyte, ushort, uint, ulong, uhuge,
			single, dbl, letter, text, Arrays.hashCode(blob), maybe, nothing, marker, suit, meters,
			wrapped, numbers, coordinates, color, pair, counts, labeled);
	}

	@Override
	public String toString() {
		return "OneOfEach[text=" + text + ", blob=" + Arrays.toString(blob) + ", counts=" + counts + ", ...]";
	}
}
