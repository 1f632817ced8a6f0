/**
 * The consumer and visitor protocols.
 * <p>
 * Mapping logic implements {@link works.datashape.de.Deserialize},
 * which calls one entry operation of a {@link works.datashape.de.Deserializer}
 * with a {@link works.datashape.de.Visitor}.
 * The deserializer calls back exactly one visitor method,
 * recursing through the access objects for nested shapes.
 */
package works.datashape.de;
