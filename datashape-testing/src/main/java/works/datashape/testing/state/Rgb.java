package works.datashape.testing.state;

import works.datashape.de.Deserialize;
import works.datashape.de.SeqAccess;
import works.datashape.de.Visitor;
import works.datashape.impls.Deserializers;
import works.datashape.impls.Serializers;
import works.datashape.ser.Serialize;
import works.datashape.ser.SerializeTupleStruct;
import works.datashape.ser.Serializer;

import static works.datashape.exceptions.UnrecognizedContentException.invalidLength;

/**
 * Written as tuple struct {@code Rgb(u8, u8, u8)}.
 */
public record Rgb(int r, int g, int b) implements Serialize {
	@Override
	public void serialize(Serializer serializer) {
		SerializeTupleStruct tuple = serializer.serializeTupleStruct("Rgb", 3);
		tuple.serializeField(Serializers.u8(r));
		tuple.serializeField(Serializers.u8(g));
		tuple.serializeField(Serializers.u8(b));
		tuple.end();
	}

	public static final Deserialize<Rgb> DESERIALIZE = d -> d.deserializeTupleStruct("Rgb", 3, new Visitor<Rgb>() {
		@Override public String expecting() { return "tuple struct Rgb"; }

		@Override
		public Rgb visitSeq(SeqAccess seq) {
			int r = seq.nextElement(Deserializers.U8).orElseThrow(() -> invalidLength(0, this));
			int g = seq.nextElement(Deserializers.U8).orElseThrow(() -> invalidLength(1, this));
			int b = seq.nextElement(Deserializers.U8).orElseThrow(() -> invalidLength(2, this));
			return new Rgb(r, g, b);
		}
	});
}
