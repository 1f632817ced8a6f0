/**
 * The datashape data model and its two protocols.
 * <p>
 * Mapping logic for a type implements {@link works.datashape.ser.Serialize} and
 * {@link works.datashape.de.Deserialize}; a format implements
 * {@link works.datashape.ser.Serializer} and {@link works.datashape.de.Deserializer}.
 * The two never refer to each other, and meet only at the 29
 * {@link works.datashape.model.Shape shapes} of the data model.
 * <p>
 * The packages are:
 *
 * <ul>
 *     <li>{@link works.datashape.model}, the shapes and the classifier;</li>
 *     <li>{@link works.datashape.ser}, the encode protocol;</li>
 *     <li>{@link works.datashape.de}, the decode protocol and visitors;</li>
 *     <li>{@link works.datashape.lifetime}, borrowed, owned, and transient data;</li>
 *     <li>{@link works.datashape.exceptions}, the failures both protocols report;</li>
 *     <li>{@link works.datashape.value}, a dynamically typed value of any shape; and</li>
 *     <li>{@link works.datashape.impls}, mappings for common JDK types.</li>
 * </ul>
 */
module works.datashape.core {
	requires static org.jetbrains.annotations;
	requires org.slf4j;

	exports works.datashape.de;
	exports works.datashape.exceptions;
	exports works.datashape.impls;
	exports works.datashape.lifetime;
	exports works.datashape.model;
	exports works.datashape.ser;
	exports works.datashape.value;
}
