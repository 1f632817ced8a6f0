package works.datashape.compact;

import java.util.Set;
import works.datashape.lifetime.BorrowedBytes;
import works.datashape.lifetime.BorrowedText;
import works.datashape.lifetime.Flavor;
import works.datashape.lifetime.Flavors;
import works.datashape.lifetime.InputBuffer;

/**
 * Reads from a byte {@link InputBuffer}. Unless told the buffer dies with the read,
 * it lends out views of it that stay valid until the buffer's owner releases it.
 */
public final class SliceInput implements CompactInput {
	private final InputBuffer buffer;
	private final byte[] bytes;
	private final boolean lends;
	private int pos = 0;

	/**
	 * @throws IllegalStateException if {@code buffer} holds chars rather than bytes
	 */
	public SliceInput(InputBuffer buffer) {
		this(buffer, true);
	}

	/**
	 * @param lends false if {@code buffer} is released when decoding ends
	 */
	SliceInput(InputBuffer buffer, boolean lends) {
		this.buffer = buffer;
		this.bytes = buffer.bytes();
		this.lends = lends;
	}

	@Override
	public Set<Flavor> flavors() {
		return lends ? Flavors.ALL : Flavors.NOT_BORROWABLE;
	}

	boolean lends() {
		return lends;
	}

	@Override
	public long offset() {
		return pos;
	}

	@Override
	public byte readByte(String expected) {
		require(1, expected);
		return bytes[pos++];
	}

	@Override
	public long readLittleEndian(int width, String expected) {
		require(width, expected);
		long result = 0;
		for (int i = 0; i < width; i++) {
			result |= (bytes[pos + i] & 0xFFL) << (8 * i);
		}
		pos += width;
		return result;
	}

	@Override
	public void readFully(byte[] destination, int start, int length, String expected) {
		require(length, expected);
		System.arraycopy(bytes, pos, destination, start, length);
		pos += length;
	}

	@Override
	public boolean isAtEnd() {
		return pos >= bytes.length;
	}

	public BorrowedBytes borrowBytes(int length, String expected) {
		require(length, expected);
		BorrowedBytes result = buffer.slice(pos, pos + length);
		pos += length;
		return result;
	}

	/**
	 * The caller must already have checked that the range is valid UTF-8;
	 * see {@link #validatedRange}.
	 */
	BorrowedText borrowText(int start, int length) {
		return buffer.text(start, start + length);
	}

	/**
	 * Skips {@code length} bytes and returns where they started.
	 */
	int validatedRange(int length, String expected) {
		require(length, expected);
		int start = pos;
		pos += length;
		return start;
	}

	byte[] rawBytes() {
		return bytes;
	}

	/**
	 * Fails before the caller allocates anything for a length the input cannot hold.
	 */
	void require(long length, String expected) {
		if (length > bytes.length - pos) {
			throw truncated(expected);
		}
	}

	@Override
	public String toString() {
		return "SliceInput(" + pos + "/" + bytes.length + ")";
	}
}
