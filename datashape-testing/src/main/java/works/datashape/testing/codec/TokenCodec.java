package works.datashape.testing.codec;

import java.util.List;
import works.datashape.de.Deserialize;
import works.datashape.ser.Serialize;
import works.datashape.testing.Token;
import works.datashape.testing.TokenDeserializer;
import works.datashape.testing.TokenSerializer;

/**
 * Encodes values as the {@link Token} stream of {@link TokenSerializer}.
 * Useful mainly to check the conformance suite itself.
 */
public final class TokenCodec implements Codec<List<Token>> {
	private final boolean humanReadable;

	public TokenCodec(boolean humanReadable) {
		this.humanReadable = humanReadable;
	}

	@Override
	public String name() {
		return humanReadable ? "tokens" : "tokens (compact)";
	}

	@Override
	public boolean isSelfDescribing() {
		return true;
	}

	@Override
	public List<Token> encode(Serialize value) {
		TokenSerializer serializer = new TokenSerializer(humanReadable);
		value.serialize(serializer);
		return serializer.tokens();
	}

	@Override
	public <T> T decode(List<Token> encoded, Deserialize<T> type) {
		TokenDeserializer deserializer = new TokenDeserializer(encoded, humanReadable);
		T result = type.deserialize(deserializer);
		deserializer.end();
		return result;
	}

	@Override
	public String toString() {
		return name();
	}
}
