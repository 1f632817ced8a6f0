package works.datashape.de;

/**
 * Access to an enum value, handed to {@link Visitor#visitEnum}:
 * first identifies the variant, then gives access to its payload.
 */
public interface EnumAccess {
	/**
	 * @param tag decodes the variant identifier, which may arrive as a name or an index
	 *            depending on the format; see {@link Deserializer#deserializeIdentifier}
	 */
	<V> Variant<V> variant(Deserialize<V> tag);

	/**
	 * @param tag the decoded variant identifier
	 * @param payload access to the variant's contents; exactly one of its methods must be called
	 */
	record Variant<V>(V tag, VariantAccess payload) { }
}
