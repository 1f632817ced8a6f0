package works.datashape.ser;

/**
 * Session for writing a tuple struct. Obtained from {@link Serializer}.
 */
public interface SerializeTupleStruct {
	void serializeField(Serialize value);

	void end();
}
