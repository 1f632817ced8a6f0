package works.datashape.compact;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.datashape.de.Deserialize;
import works.datashape.exceptions.DataShapeException;
import works.datashape.lifetime.InputBuffer;
import works.datashape.ser.Serialize;

/**
 * Entry points for reading and writing the compact binary format.
 * <p>
 * Each call is one session: one value written,
 * or one value read followed by a check that the input has been used up.
 */
public final class Compact {
	private final CompactSettings settings;

	private Compact(CompactSettings settings) {
		this.settings = settings;
	}

	public static Compact with(@NotNull CompactSettings settings) {
		return new Compact(settings);
	}

	public static Compact standard() {
		return STANDARD;
	}

	public CompactSettings settings() {
		return settings;
	}

	public byte[] toBytes(Serialize value) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		write(out, value);
		return out.toByteArray();
	}

	public void write(OutputStream out, Serialize value) {
		LOGGER.debug("Writing compact output with {}", settings);
		value.serialize(new CompactSerializer(out));
	}

	/**
	 * The buffer wrapping {@code bytes} ends with this call, so nothing is borrowed from it.
	 */
	public <T> T fromBytes(byte[] bytes, Deserialize<T> type) {
		InputBuffer buffer = InputBuffer.ofBytes(bytes);
		try {
			LOGGER.debug("Reading compact input from {} bytes", bytes.length);
			return read(new SliceInput(buffer, false), type);
		} finally {
			buffer.release();
		}
	}

	/**
	 * Reads one value from {@code buffer}, which the caller keeps ownership of.
	 * Strings and bytes the value borrowed remain valid until the caller
	 * {@link InputBuffer#release() releases} the buffer.
	 *
	 * @throws IllegalStateException if {@code buffer} holds chars rather than bytes
	 */
	public <T> T fromBuffer(InputBuffer buffer, Deserialize<T> type) {
		LOGGER.debug("Reading compact input from {}", buffer);
		return read(new SliceInput(buffer), type);
	}

	/**
	 * Reads one value that must be followed by the end of {@code stream}.
	 * Nothing is borrowed. The stream is not closed.
	 */
	public <T> T fromStream(InputStream stream, Deserialize<T> type) {
		LOGGER.debug("Reading compact input from stream");
		return read(new StreamInput(stream), type);
	}

	private <T> T read(CompactInput input, Deserialize<T> type) {
		CompactDeserializer deserializer = new CompactDeserializer(input, settings);
		try {
			T result = type.deserialize(deserializer);
			deserializer.end();
			return result;
		} catch (DataShapeException e) {
			LOGGER.debug("Failed reading compact input at {}", deserializer, e);
			throw e;
		}
	}

	private static final Compact STANDARD = new Compact(CompactSettings.DEFAULT);
	private static final Logger LOGGER = LoggerFactory.getLogger(Compact.class);
}
