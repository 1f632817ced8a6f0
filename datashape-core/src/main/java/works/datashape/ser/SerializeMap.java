package works.datashape.ser;

/**
 * Session for writing a map. Obtained from {@link Serializer#serializeMap}.
 * <p>
 * Keys and values alternate, starting with a key.
 * Keys need not all have the same shape, and neither do values.
 */
public interface SerializeMap {
	void serializeKey(Serialize key);

	void serializeValue(Serialize value);

	default void serializeEntry(Serialize key, Serialize value) {
		serializeKey(key);
		serializeValue(value);
	}

	void end();
}
