/**
 * The producer protocol.
 * <p>
 * Mapping logic implements {@link works.datashape.ser.Serialize} and drives a
 * {@link works.datashape.ser.Serializer}, which a format writer implements.
 * Neither side knows about the other's concrete type.
 */
package works.datashape.ser;
