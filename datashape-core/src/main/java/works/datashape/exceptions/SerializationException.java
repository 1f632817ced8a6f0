package works.datashape.exceptions;

/**
 * A producer failure: the target format cannot represent a given value,
 * the producer protocol was misused,
 * or an I/O fault occurred while writing.
 * <p>
 * Output already written before the failure is not rolled back.
 */
public final class SerializationException extends DataShapeException {
	public SerializationException(String message) {
		super(message);
	}

	public SerializationException(Throwable cause) {
		super(cause);
	}

	public SerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
