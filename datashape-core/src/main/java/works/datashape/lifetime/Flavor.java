package works.datashape.lifetime;

/**
 * How long extracted string or byte data remains valid.
 * Orthogonal to {@link works.datashape.model.Shape}.
 */
public enum Flavor {
	/**
	 * Valid only during the visitor callback that receives it.
	 * The consumer may overwrite the storage as soon as the callback returns,
	 * so the visitor must copy anything it wants to keep.
	 */
	TRANSIENT("transient"),

	/**
	 * An independent copy that now belongs to the visitor.
	 */
	OWNED("owned"),

	/**
	 * A view into the caller's {@link InputBuffer},
	 * valid for as long as that buffer has not been {@link InputBuffer#release released}.
	 */
	BORROWED("borrowed");

	private final String description;

	Flavor(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
