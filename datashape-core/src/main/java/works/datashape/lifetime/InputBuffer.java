package works.datashape.lifetime;

import java.nio.charset.StandardCharsets;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A contiguous, read-only region of input owned by the caller of a decode session.
 * Consumers reading from an {@code InputBuffer} may hand out
 * {@link Flavor#BORROWED borrowed} views into it rather than copies.
 * <p>
 * The caller promises not to modify the underlying array until it calls {@link #release()}.
 * After that, every borrowed view throws {@link IllegalStateException} when accessed,
 * which turns a use-after-scope mistake into an immediate failure
 * instead of silently observing modified data.
 * <p>
 * A buffer holds either bytes or chars, never both.
 */
public final class InputBuffer {
	private final byte[] bytes;
	private final char[] chars;
	private volatile boolean released = false;

	private InputBuffer(byte[] bytes, char[] chars) {
		this.bytes = bytes;
		this.chars = chars;
	}

	/**
	 * Does not copy {@code bytes}.
	 */
	public static InputBuffer ofBytes(@NotNull byte[] bytes) {
		return new InputBuffer(bytes, null);
	}

	/**
	 * Does not copy {@code chars}.
	 */
	public static InputBuffer ofChars(@NotNull char[] chars) {
		return new InputBuffer(null, chars);
	}

	public static InputBuffer ofString(String text) {
		return ofChars(text.toCharArray());
	}

	public static InputBuffer ofUtf8(String text) {
		return ofBytes(text.getBytes(StandardCharsets.UTF_8));
	}

	public boolean hasBytes() {
		return bytes != null;
	}

	public boolean hasChars() {
		return chars != null;
	}

	public int length() {
		return hasBytes() ? bytes.length : chars.length;
	}

	public boolean isLive() {
		return !released;
	}

	/**
	 * Ends the buffer's lifetime. Borrowed views fail from now on,
	 * and the caller is free to reuse the underlying array.
	 * Idempotent.
	 */
	public void release() {
		if (!released) {
			LOGGER.trace("Releasing {}", this);
			released = true;
		}
	}

	/**
	 * @throws IllegalStateException if this buffer has been released
	 */
	public void checkLive() {
		if (released) {
			throw new IllegalStateException("Input buffer has been released; borrowed data is no longer valid");
		}
	}

	/**
	 * Direct access for consumers.
	 * @throws IllegalStateException if this buffer holds chars
	 */
	public byte[] bytes() {
		checkLive();
		if (bytes == null) {
			throw new IllegalStateException("Input buffer holds chars, not bytes");
		}
		return bytes;
	}

	/**
	 * Direct access for consumers.
	 * @throws IllegalStateException if this buffer holds bytes
	 */
	public char[] chars() {
		checkLive();
		if (chars == null) {
			throw new IllegalStateException("Input buffer holds bytes, not chars");
		}
		return chars;
	}

	/**
	 * @return a borrowed view of {@code [start, end)}.
	 * For a byte buffer, the range must contain well-formed UTF-8;
	 * the consumer is responsible for having validated it.
	 */
	public BorrowedText text(int start, int end) {
		checkRange(start, end);
		return new BorrowedText(this, start, end);
	}

	/**
	 * @return a borrowed view of {@code [start, end)}
	 * @throws IllegalStateException if this buffer holds chars
	 */
	public BorrowedBytes slice(int start, int end) {
		checkRange(start, end);
		if (bytes == null) {
			throw new IllegalStateException("Input buffer holds chars, not bytes");
		}
		return new BorrowedBytes(this, start, end);
	}

	private void checkRange(int start, int end) {
		checkLive();
		if (start < 0 || end > length() || start > end) {
			throw new IndexOutOfBoundsException("Range [" + start + ", " + end + ") outside buffer of length " + length());
		}
	}

	// Package-private raw accessors for the views, which do their own liveness checks

	byte rawByte(int index) {
		return bytes[index];
	}

	char rawChar(int index) {
		return chars[index];
	}

	byte[] rawBytes() {
		return bytes;
	}

	char[] rawChars() {
		return chars;
	}

	@Override
	public String toString() {
		return "InputBuffer(" + (hasBytes() ? "bytes" : "chars") + ", length=" + length() + (released ? ", released" : "") + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InputBuffer.class);
}
