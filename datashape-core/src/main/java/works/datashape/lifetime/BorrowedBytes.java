package works.datashape.lifetime;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * {@link Flavor#BORROWED Borrowed} bytes: a view of a range of a byte {@link InputBuffer}.
 * Every accessor checks that the buffer is still live.
 */
public final class BorrowedBytes {
	private final InputBuffer buffer;
	private final int start;
	private final int end;

	BorrowedBytes(InputBuffer buffer, int start, int end) {
		this.buffer = buffer;
		this.start = start;
		this.end = end;
	}

	public InputBuffer buffer() {
		return buffer;
	}

	public int length() {
		buffer.checkLive();
		return end - start;
	}

	public byte byteAt(int index) {
		buffer.checkLive();
		if (index < 0 || index >= end - start) {
			throw new IndexOutOfBoundsException(index);
		}
		return buffer.rawByte(start + index);
	}

	/**
	 * @return a read-only view sharing the buffer's storage.
	 * Note that the returned {@link ByteBuffer} cannot check liveness itself,
	 * so it must not be used after the buffer is released.
	 */
	public ByteBuffer asByteBuffer() {
		buffer.checkLive();
		return ByteBuffer.wrap(buffer.rawBytes(), start, end - start).slice().asReadOnlyBuffer();
	}

	/**
	 * @return an owned copy
	 */
	public byte[] toByteArray() {
		buffer.checkLive();
		return Arrays.copyOfRange(buffer.rawBytes(), start, end);
	}

	public boolean contentEquals(byte[] other) {
		buffer.checkLive();
		return Arrays.equals(buffer.rawBytes(), start, end, other, 0, other.length);
	}

	@Override
	public String toString() {
		return "BorrowedBytes(" + (end - start) + " bytes from " + buffer + ")";
	}
}
