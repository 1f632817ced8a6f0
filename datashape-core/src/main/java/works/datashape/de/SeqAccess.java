package works.datashape.de;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Pull-based access to the elements of a sequence, tuple, or tuple-like struct,
 * handed to {@link Visitor#visitSeq}.
 */
public interface SeqAccess {
	/**
	 * @return the next element, or empty at the end of the sequence.
	 * Once empty has been returned, the sequence is over.
	 */
	<T> Optional<T> nextElement(Deserialize<T> element);

	/**
	 * @return the number of remaining elements, if the format knows it
	 */
	default OptionalInt sizeHint() {
		return OptionalInt.empty();
	}
}
