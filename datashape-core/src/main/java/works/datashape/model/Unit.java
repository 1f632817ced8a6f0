package works.datashape.model;

/**
 * The in-memory representation of the {@link Shape#UNIT unit} value.
 * Decoded values are never {@code null}, so unit needs a value of its own.
 */
public enum Unit {
	INSTANCE;

	@Override
	public String toString() {
		return "()";
	}
}
