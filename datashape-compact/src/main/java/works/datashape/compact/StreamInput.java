package works.datashape.compact;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.Flavor;
import works.datashape.lifetime.Flavors;

/**
 * Reads from an {@link InputStream} a chunk at a time.
 * Nothing read this way outlives the chunk buffer,
 * so strings and bytes are only ever transient or owned.
 */
public final class StreamInput implements CompactInput {
	private final InputStream stream;
	private final byte[] chunk;
	private int pos = 0;
	private int limit = 0;
	private long consumedBeforeChunk = 0;

	public StreamInput(InputStream stream) {
		this(stream, 8192);
	}

	StreamInput(InputStream stream, int chunkSize) {
		assert chunkSize > 0: "Chunk size must be positive";
		this.stream = stream;
		this.chunk = new byte[chunkSize];
	}

	@Override
	public Set<Flavor> flavors() {
		return Flavors.NOT_BORROWABLE;
	}

	@Override
	public long offset() {
		return consumedBeforeChunk + pos;
	}

	@Override
	public byte readByte(String expected) {
		if (pos >= limit && !fill(expected)) {
			throw truncated(expected);
		}
		return chunk[pos++];
	}

	@Override
	public void readFully(byte[] destination, int start, int length, String expected) {
		int copied = 0;
		while (copied < length) {
			if (pos >= limit && !fill(expected)) {
				throw truncated(expected);
			}
			int n = Math.min(length - copied, limit - pos);
			System.arraycopy(chunk, pos, destination, start + copied, n);
			pos += n;
			copied += n;
		}
	}

	@Override
	public boolean isAtEnd() {
		return pos >= limit && !fill("end of input");
	}

	/**
	 * @return false at end of stream
	 * @throws MalformedInputException if the stream fails
	 */
	private boolean fill(String expected) {
		int length;
		do {
			try {
				length = stream.read(chunk, 0, chunk.length);
			} catch (IOException e) {
				throw new MalformedInputException("Unable to read compact input", expected, offset(), e);
			}
		} while (length == 0);
		if (length == -1) {
			return false;
		}
		consumedBeforeChunk += limit;
		pos = 0;
		limit = length;
		return true;
	}

	@Override
	public String toString() {
		return "StreamInput(" + offset() + ")";
	}
}
