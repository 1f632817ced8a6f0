package works.datashape.compact;

import java.util.Set;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.Flavor;

/**
 * Where a {@link CompactDeserializer} gets its bytes.
 * <p>
 * Every read that runs past the end of the input
 * throws {@link MalformedInputException} naming what was being read.
 */
public sealed interface CompactInput permits SliceInput, StreamInput {
	/**
	 * @return the flavors of strings and bytes this input can supply
	 */
	Set<Flavor> flavors();

	/**
	 * @return number of bytes consumed so far
	 */
	long offset();

	byte readByte(String expected);

	void readFully(byte[] destination, int start, int length, String expected);

	/**
	 * @return whether no bytes remain
	 */
	boolean isAtEnd();

	/**
	 * Reads {@code width} bytes, least significant first.
	 */
	default long readLittleEndian(int width, String expected) {
		long result = 0;
		for (int i = 0; i < width; i++) {
			result |= (readByte(expected) & 0xFFL) << (8 * i);
		}
		return result;
	}

	default MalformedInputException truncated(String expected) {
		return new MalformedInputException("Unexpected end of input", expected, offset());
	}
}
