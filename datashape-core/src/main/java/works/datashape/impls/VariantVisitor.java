package works.datashape.impls;

import java.util.List;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.Unexpected;
import works.datashape.de.Visitor;

import static works.datashape.exceptions.UnrecognizedContentException.invalidValue;
import static works.datashape.exceptions.UnrecognizedContentException.unknownVariant;

/**
 * Identifies an enum variant by name or by index, yielding its index in {@code variants}.
 * Use it as the tag in {@link works.datashape.de.EnumAccess#variant}.
 */
public final class VariantVisitor implements Visitor<Integer>, Deserialize<Integer> {
	private final List<String> variants;

	private VariantVisitor(List<String> variants) {
		this.variants = List.copyOf(variants);
	}

	public static VariantVisitor of(List<String> variants) {
		return new VariantVisitor(variants);
	}

	public List<String> variants() {
		return variants;
	}

	@Override
	public Integer deserialize(Deserializer deserializer) {
		return deserializer.deserializeIdentifier(this);
	}

	@Override
	public String expecting() {
		return "variant identifier";
	}

	@Override
	public Integer visitU64(long value) {
		if (value < 0 || value >= variants.size()) {
			throw invalidValue(Unexpected.unsigned(value), () -> "variant index 0 <= i < " + variants.size());
		}
		return (int) value;
	}

	@Override
	public Integer visitStr(CharSequence value) {
		int index = variants.indexOf(value.toString());
		if (index < 0) {
			throw unknownVariant(value.toString(), variants);
		}
		return index;
	}
}
