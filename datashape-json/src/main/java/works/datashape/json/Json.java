package works.datashape.json;

import java.io.StringWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.datashape.de.Deserialize;
import works.datashape.exceptions.DataShapeException;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.InputBuffer;
import works.datashape.ser.Serialize;

/**
 * Entry points for reading and writing JSON text.
 * <p>
 * Each call is one session: one value written, or one value read
 * followed by a check that only whitespace remains.
 */
public final class Json {
	private final JsonSettings settings;

	private Json(JsonSettings settings) {
		this.settings = settings;
	}

	public static Json with(@NotNull JsonSettings settings) {
		return new Json(settings);
	}

	public static Json standard() {
		return STANDARD;
	}

	public JsonSettings settings() {
		return settings;
	}

	public String toString(Serialize value) {
		StringWriter out = new StringWriter();
		write(out, value);
		return out.toString();
	}

	public void write(Writer out, Serialize value) {
		LOGGER.debug("Writing JSON with {}", settings);
		value.serialize(new JsonSerializer(out, settings));
	}

	/**
	 * The buffer holding {@code text} ends with this call, so nothing is borrowed from it.
	 */
	public <T> T fromString(String text, Deserialize<T> type) {
		InputBuffer buffer = InputBuffer.ofString(text);
		try {
			return read(buffer, type, false);
		} finally {
			buffer.release();
		}
	}

	/**
	 * Reads one value from {@code buffer}, which the caller keeps ownership of.
	 * Text the value borrowed remains valid until the caller
	 * {@link InputBuffer#release() releases} the buffer.
	 * A buffer of bytes is decoded as UTF-8 first, in which case nothing is borrowed from it.
	 *
	 * @throws MalformedInputException if a byte buffer is not well-formed UTF-8
	 */
	public <T> T fromBuffer(InputBuffer buffer, Deserialize<T> type) {
		if (buffer.hasChars()) {
			return read(buffer, type, true);
		}
		InputBuffer decoded = InputBuffer.ofChars(decodeUtf8(buffer.bytes()));
		try {
			return read(decoded, type, false);
		} finally {
			decoded.release();
		}
	}

	private <T> T read(InputBuffer buffer, Deserialize<T> type, boolean lends) {
		LOGGER.debug("Reading JSON from {}", buffer);
		JsonDeserializer deserializer = new JsonDeserializer(buffer, settings, lends);
		try {
			T result = type.deserialize(deserializer);
			deserializer.end();
			return result;
		} catch (DataShapeException e) {
			LOGGER.debug("Failed reading JSON at {}", deserializer, e);
			throw e;
		}
	}

	/**
	 * UTF-8 never decodes to more chars than it has bytes.
	 */
	private static char[] decodeUtf8(byte[] bytes) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		ByteBuffer in = ByteBuffer.wrap(bytes);
		CharBuffer out = CharBuffer.allocate(bytes.length);
		CoderResult result = decoder.decode(in, out, true);
		if (result.isUnderflow()) {
			result = decoder.flush(out);
		}
		if (result.isError()) {
			throw new MalformedInputException("Invalid UTF-8", "valid JSON", in.position());
		}
		return Arrays.copyOf(out.array(), out.position());
	}

	private static final Json STANDARD = new Json(JsonSettings.DEFAULT);
	private static final Logger LOGGER = LoggerFactory.getLogger(Json.class);
}
