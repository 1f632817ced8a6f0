package works.datashape.exceptions;

/**
 * Root of every failure reported by the encode and decode protocols.
 * <p>
 * All failures are reported synchronously at the call that detects them
 * and propagate up the recursive call chain to the original caller.
 * There is no retry and no fatal class: every subclass describes
 * an outcome the caller can recover from.
 */
public sealed abstract class DataShapeException extends RuntimeException permits DeserializationException, SerializationException {
	protected DataShapeException(String message) {
		super(message);
	}

	protected DataShapeException(Throwable cause) {
		super(cause);
	}

	protected DataShapeException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same class as {@code exception}
	 * whose message is prefixed with {@code context},
	 * such as the name of the field being processed.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends DataShapeException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof MalformedInputException e) {
			return (T) new MalformedInputException(newMessage, e.expected(), e.offset(), e);
		} else if (exception instanceof UnrecognizedContentException e) {
			return (T) new UnrecognizedContentException(newMessage, e);
		} else if (exception instanceof BorrowUnavailableException e) {
			return (T) new BorrowUnavailableException(newMessage, e);
		} else if (exception instanceof SerializationException e) {
			return (T) new SerializationException(newMessage, e);
		} else {
			throw new IllegalArgumentException("Unexpected exception type: " + exception.getClass());
		}
	}
}
