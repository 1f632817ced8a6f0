package works.datashape.ser;

/**
 * Session for writing a struct. Obtained from {@link Serializer#serializeStruct}.
 */
public interface SerializeStruct {
	/**
	 * @param key one of the struct's field names, which are constant for the type
	 */
	void serializeField(String key, Serialize value);

	/**
	 * Indicates that a declared field is deliberately omitted.
	 * Formats that identify fields by position may reject this.
	 */
	default void skipField(String key) {
	}

	void end();
}
