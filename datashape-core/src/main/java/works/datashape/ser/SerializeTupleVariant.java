package works.datashape.ser;

/**
 * Session for writing a tuple variant. Obtained from {@link Serializer}.
 */
public interface SerializeTupleVariant {
	void serializeField(Serialize value);

	void end();
}
