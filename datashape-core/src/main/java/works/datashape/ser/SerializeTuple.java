package works.datashape.ser;

/**
 * Session for writing a tuple. Obtained from {@link Serializer}.
 */
public interface SerializeTuple {
	void serializeElement(Serialize value);

	void end();
}
