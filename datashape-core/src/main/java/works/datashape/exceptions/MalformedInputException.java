package works.datashape.exceptions;

/**
 * The input is truncated, malformed, carries an unexpected tag,
 * disagrees with a declared length, or holds a value out of range
 * for the primitive it encodes.
 */
public final class MalformedInputException extends DeserializationException {
	private final String expected;
	private final long offset;

	/**
	 * @param expected describes what the consumer was trying to decode
	 * @param offset position in the input where the problem was detected, or -1 if unknown
	 */
	public MalformedInputException(String message, String expected, long offset) {
		super(fullMessage(message, expected, offset));
		this.expected = expected;
		this.offset = offset;
	}

	public MalformedInputException(String message, String expected, long offset, Throwable cause) {
		super(fullMessage(message, expected, offset), cause);
		this.expected = expected;
		this.offset = offset;
	}

	/**
	 * Used by {@link DataShapeException#wrap}; the message is already complete.
	 */
	MalformedInputException(String fullMessage, String expected, long offset, MalformedInputException cause) {
		super(fullMessage, cause);
		this.expected = expected;
		this.offset = offset;
	}

	public String expected() {
		return expected;
	}

	public long offset() {
		return offset;
	}

	private static String fullMessage(String message, String expected, long offset) {
		String where = (offset < 0) ? "" : " at offset " + offset;
		return message + where + " (expected " + expected + ")";
	}
}
