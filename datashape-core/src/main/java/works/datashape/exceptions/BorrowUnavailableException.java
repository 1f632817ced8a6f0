package works.datashape.exceptions;

import works.datashape.lifetime.Flavor;

/**
 * A visitor required {@link Flavor#BORROWED borrowed} data,
 * but the consumer could only supply a shorter-lived flavor.
 * The decode fails rather than handing out data that may not outlive the call.
 */
public final class BorrowUnavailableException extends DeserializationException {
	public BorrowUnavailableException(Flavor offered, String expected) {
		super("Borrowed data required, but only " + offered.description() + " data is available (expected " + expected + ")");
	}

	BorrowUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
