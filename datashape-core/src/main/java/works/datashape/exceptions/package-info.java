/**
 * The two failure families of the protocol:
 * {@link works.datashape.exceptions.SerializationException producer failures}
 * and {@link works.datashape.exceptions.DeserializationException consumer failures}.
 * <p>
 * All are unchecked. Codecs translate checked {@link java.io.IOException}s
 * at their boundary into one of these.
 */
package works.datashape.exceptions;
