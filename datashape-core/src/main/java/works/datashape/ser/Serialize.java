package works.datashape.ser;

/**
 * Encode-side mapping logic for one value:
 * describes the value to a {@link Serializer} by making exactly one top-level call.
 * <p>
 * The call made must depend only on the value's type, never on its contents,
 * so that the type always maps to the same {@link works.datashape.model.Shape Shape}.
 * Shapes with variable length are the exception in that their
 * length hint naturally depends on the contents.
 */
@FunctionalInterface
public interface Serialize {
	void serialize(Serializer serializer);
}
