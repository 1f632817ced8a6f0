package works.datashape.model;

/**
 * The partition of {@link Shape}s into families with common treatment.
 */
public enum ShapeGroup {
	/** Fixed-width, self-contained values. */
	PRIMITIVE,
	/** UTF-8 text with an explicit length. */
	TEXT,
	/** Arbitrary bytes with an explicit length. */
	BINARY,
	/** Tagged absent or present value. */
	OPTIONAL,
	/** Values carrying no data beyond their identity. */
	EMPTY_MARKER,
	/** Named wrappers around exactly one inner value. */
	SINGLE_PAYLOAD_WRAPPER,
	/** Sequences whose length is known only from the data. */
	VARIABLE_SEQUENCE,
	/** Sequences whose length is known statically. */
	FIXED_SEQUENCE,
	/** Key-value structures whose keys are constant strings known statically. */
	FIXED_KEY_VALUE,
}
