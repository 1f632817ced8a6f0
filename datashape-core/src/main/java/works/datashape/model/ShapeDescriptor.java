package works.datashape.model;

import java.util.List;
import java.util.OptionalInt;
import org.jetbrains.annotations.Nullable;

/**
 * The result of classifying a value:
 * its {@link Shape} plus whatever metadata that shape carries.
 *
 * @param name the type name, for {@link Shape#isNamed() named} shapes; otherwise null
 * @param variantIndex for {@link Shape#isVariant() variant} shapes
 * @param variant the variant name, for variant shapes; otherwise null
 * @param fields the declared field names, in order, for struct shapes; otherwise empty
 * @param length the static length for fixed shapes, the length hint (if any) for variable ones
 */
public record ShapeDescriptor(
	Shape shape,
	@Nullable String name,
	OptionalInt variantIndex,
	@Nullable String variant,
	List<String> fields,
	OptionalInt length
) {
	public ShapeDescriptor {
		fields = List.copyOf(fields);
	}

	public static ShapeDescriptor of(Shape shape) {
		return new ShapeDescriptor(shape, null, OptionalInt.empty(), null, List.of(), OptionalInt.empty());
	}

	public static ShapeDescriptor named(Shape shape, String name) {
		return new ShapeDescriptor(shape, name, OptionalInt.empty(), null, List.of(), OptionalInt.empty());
	}

	public static ShapeDescriptor variant(Shape shape, String name, int variantIndex, String variant) {
		return new ShapeDescriptor(shape, name, OptionalInt.of(variantIndex), variant, List.of(), OptionalInt.empty());
	}

	public ShapeDescriptor withLength(OptionalInt length) {
		return new ShapeDescriptor(shape, name, variantIndex, variant, fields, length);
	}

	public ShapeDescriptor withFields(List<String> fields) {
		return new ShapeDescriptor(shape, name, variantIndex, variant, fields, OptionalInt.of(fields.size()));
	}
}
