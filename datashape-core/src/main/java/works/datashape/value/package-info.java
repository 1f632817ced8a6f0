/**
 * A dynamically typed, in-memory rendition of the data model.
 * <p>
 * {@link works.datashape.value.Value} is both a format and a type:
 * anything can be serialized into one and any self-describing input decoded into one,
 * and it in turn serializes and deserializes like any other type.
 */
package works.datashape.value;
