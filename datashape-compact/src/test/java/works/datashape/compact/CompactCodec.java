package works.datashape.compact;

import java.io.ByteArrayInputStream;
import works.datashape.de.Deserialize;
import works.datashape.ser.Serialize;
import works.datashape.testing.codec.Codec;

/**
 * @param streaming whether to decode through {@link StreamInput} rather than {@link SliceInput}
 */
record CompactCodec(Compact compact, boolean streaming) implements Codec<byte[]> {
	@Override
	public String name() {
		return streaming ? "compact (stream)" : "compact";
	}

	@Override
	public boolean isSelfDescribing() {
		return false;
	}

	@Override
	public byte[] encode(Serialize value) {
		return compact.toBytes(value);
	}

	@Override
	public <T> T decode(byte[] encoded, Deserialize<T> type) {
		if (streaming) {
			return compact.fromStream(new ByteArrayInputStream(encoded), type);
		}
		return compact.fromBytes(encoded, type);
	}

	@Override
	public String toString() {
		return name();
	}
}
