/**
 * A compact binary format for the datashape data model.
 * <p>
 * {@link works.datashape.compact.Compact} is the entry point.
 * The format is not self-describing: readers must know the shape they expect,
 * and structs are written positionally without field names.
 * Strings and bytes read from an in-memory buffer can be borrowed;
 * those read from a stream cannot.
 */
module works.datashape.compact {
	requires static org.jetbrains.annotations;
	requires org.slf4j;
	requires transitive works.datashape.core;

	exports works.datashape.compact;
}
