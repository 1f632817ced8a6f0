package works.datashape.json;

import works.datashape.de.Deserialize;
import works.datashape.ser.Serialize;
import works.datashape.testing.codec.Codec;

record JsonCodec(Json json) implements Codec<String> {
	@Override
	public String name() {
		return json.settings().isPrettyPrint() ? "json (pretty)" : "json";
	}

	@Override
	public boolean isSelfDescribing() {
		return true;
	}

	@Override
	public String encode(Serialize value) {
		return json.toString(value);
	}

	@Override
	public <T> T decode(String encoded, Deserialize<T> type) {
		return json.fromString(encoded, type);
	}

	@Override
	public String toString() {
		return name();
	}
}
