/**
 * JSON text for the datashape data model.
 * <p>
 * {@link works.datashape.json.Json} is the entry point.
 * Underneath, {@link works.datashape.json.JsonSerializer} writes values as JSON,
 * and {@link works.datashape.json.JsonDeserializer} reads them back
 * through a token-level {@link works.datashape.json.JsonReader},
 * lending unescaped strings straight from the input buffer.
 */
module works.datashape.json {
	requires static lombok;
	requires static org.jetbrains.annotations;
	requires org.slf4j;
	requires transitive works.datashape.core;

	exports works.datashape.json;
}
