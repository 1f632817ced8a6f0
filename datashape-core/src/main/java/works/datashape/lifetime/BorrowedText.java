package works.datashape.lifetime;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A {@link Flavor#BORROWED borrowed} string: a view of a range of an {@link InputBuffer}.
 * <p>
 * Over a char buffer, characters are read straight from the caller's array.
 * Over a byte buffer, the range holds UTF-8 which is decoded on first character access;
 * {@link #utf8()} gives zero-copy access to the encoded form.
 * <p>
 * Every accessor checks that the buffer is still live.
 * Use {@link #toString()} to get an owned copy that outlives the buffer.
 */
public final class BorrowedText implements CharSequence {
	private final InputBuffer buffer;
	private final int start;
	private final int end;
	private String decoded; // Lazily, for byte buffers only

	BorrowedText(InputBuffer buffer, int start, int end) {
		this.buffer = buffer;
		this.start = start;
		this.end = end;
	}

	public InputBuffer buffer() {
		return buffer;
	}

	@Override
	public int length() {
		buffer.checkLive();
		if (buffer.hasChars()) {
			return end - start;
		} else {
			return decoded().length();
		}
	}

	@Override
	public char charAt(int index) {
		buffer.checkLive();
		if (buffer.hasChars()) {
			if (index < 0 || index >= end - start) {
				throw new IndexOutOfBoundsException(index);
			}
			return buffer.rawChar(start + index);
		} else {
			return decoded().charAt(index);
		}
	}

	@Override
	public CharSequence subSequence(int from, int to) {
		buffer.checkLive();
		if (buffer.hasChars()) {
			if (from < 0 || to > end - start || from > to) {
				throw new IndexOutOfBoundsException();
			}
			return new BorrowedText(buffer, start + from, start + to);
		} else {
			return decoded().subSequence(from, to);
		}
	}

	/**
	 * @return the UTF-8 encoded bytes, borrowed from the buffer
	 * @throws IllegalStateException if the buffer holds chars
	 */
	public BorrowedBytes utf8() {
		return buffer.slice(start, end);
	}

	public boolean contentEquals(CharSequence other) {
		return toString().contentEquals(other);
	}

	/**
	 * @return an owned copy
	 */
	@Override
	public String toString() {
		buffer.checkLive();
		if (buffer.hasChars()) {
			return new String(buffer.rawChars(), start, end - start);
		} else {
			return decoded();
		}
	}

	private String decoded() {
		if (decoded == null) {
			decoded = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(buffer.rawBytes(), start, end - start)).toString();
		}
		return decoded;
	}
}
