package works.datashape.ser;

/**
 * Session for writing a sequence. Obtained from {@link Serializer}.
 */
public interface SerializeSeq {
	void serializeElement(Serialize value);

	void end();
}
