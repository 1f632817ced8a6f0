package works.datashape.ser;

/**
 * Session for writing a struct variant. Obtained from {@link Serializer#serializeStructVariant}.
 */
public interface SerializeStructVariant {
	void serializeField(String key, Serialize value);

	default void skipField(String key) {
	}

	void end();
}
