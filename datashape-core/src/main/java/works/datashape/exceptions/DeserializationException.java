package works.datashape.exceptions;

/**
 * A consumer failure.
 * The subclass tells callers whether the input bytes were bad
 * ({@link MalformedInputException})
 * or were fine but not recognized by the structure being built
 * ({@link UnrecognizedContentException}, {@link BorrowUnavailableException}).
 */
public sealed abstract class DeserializationException extends DataShapeException permits
	BorrowUnavailableException,
	MalformedInputException,
	UnrecognizedContentException
{
	protected DeserializationException(String message) {
		super(message);
	}

	protected DeserializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
