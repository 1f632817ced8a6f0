package works.datashape.ser;

import java.util.OptionalInt;
import works.datashape.exceptions.SerializationException;
import works.datashape.model.Shape;

/**
 * Bookkeeping for serializer sessions:
 * counts elements, enforces any declared length,
 * and rejects use of a session after it has ended.
 */
public final class LengthTracker {
	private final Shape shape;
	private final OptionalInt declared;
	private int count = 0;
	private boolean ended = false;

	private LengthTracker(Shape shape, OptionalInt declared) {
		this.shape = shape;
		this.declared = declared;
	}

	public static LengthTracker of(Shape shape, OptionalInt declared) {
		if (declared.isPresent() && declared.getAsInt() < 0) {
			throw new SerializationException("Negative length " + declared.getAsInt() + " for " + shape.expecting());
		}
		return new LengthTracker(shape, declared);
	}

	public static LengthTracker of(Shape shape, int declared) {
		return of(shape, OptionalInt.of(declared));
	}

	/**
	 * Call before writing each element, entry, or field.
	 *
	 * @throws SerializationException if the session has ended or the declared length would be exceeded
	 */
	public void element() {
		checkNotEnded();
		if (declared.isPresent() && count >= declared.getAsInt()) {
			throw new SerializationException("Too many elements for " + shape.expecting() + " of declared length " + declared.getAsInt());
		}
		count++;
	}

	/**
	 * Call when the session ends.
	 *
	 * @throws SerializationException if the session has already ended
	 * or fewer elements were written than declared
	 */
	public void finish() {
		checkNotEnded();
		ended = true;
		if (declared.isPresent() && count != declared.getAsInt()) {
			throw new SerializationException("Wrote " + count + " elements for " + shape.expecting() + " of declared length " + declared.getAsInt());
		}
	}

	public int count() {
		return count;
	}

	public OptionalInt declared() {
		return declared;
	}

	public boolean isEnded() {
		return ended;
	}

	private void checkNotEnded() {
		if (ended) {
			throw new SerializationException("Session for " + shape.expecting() + " has already ended");
		}
	}
}
