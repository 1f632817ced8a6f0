package works.datashape.impls;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import works.datashape.de.Deserialize;
import works.datashape.de.Deserializer;
import works.datashape.de.Unexpected;
import works.datashape.de.Visitor;

import static works.datashape.exceptions.UnrecognizedContentException.invalidValue;
import static works.datashape.exceptions.UnrecognizedContentException.unknownField;

/**
 * Identifies a struct field by name or by index,
 * yielding its index in {@code fields}.
 * <p>
 * Unknown names fail with {@code unknown field} unless the visitor {@link #ignoringUnknown() ignores them},
 * in which case they yield {@link #UNKNOWN}, and the caller should skip the field's value.
 */
public final class FieldVisitor implements Visitor<Integer>, Deserialize<Integer> {
	public static final int UNKNOWN = -1;

	private final List<String> fields;
	private final boolean ignoreUnknown;

	private FieldVisitor(List<String> fields, boolean ignoreUnknown) {
		this.fields = List.copyOf(fields);
		this.ignoreUnknown = ignoreUnknown;
	}

	public static FieldVisitor of(List<String> fields) {
		return new FieldVisitor(fields, false);
	}

	public FieldVisitor ignoringUnknown() {
		return new FieldVisitor(fields, true);
	}

	public List<String> fields() {
		return fields;
	}

	@Override
	public Integer deserialize(Deserializer deserializer) {
		return deserializer.deserializeIdentifier(this);
	}

	@Override
	public String expecting() {
		return "field identifier";
	}

	@Override
	public Integer visitU64(long value) {
		if (value < 0 || value >= fields.size()) {
			throw invalidValue(Unexpected.unsigned(value), () -> "field index 0 <= i < " + fields.size());
		}
		return (int) value;
	}

	@Override
	public Integer visitStr(CharSequence value) {
		for (int i = 0; i < fields.size(); i++) {
			if (fields.get(i).contentEquals(value)) {
				return i;
			}
		}
		if (ignoreUnknown) {
			return UNKNOWN;
		}
		throw unknownField(value.toString(), fields);
	}

	@Override
	public Integer visitBytes(ByteBuffer value) {
		byte[] copy = new byte[value.remaining()];
		value.duplicate().get(copy);
		return visitStr(new String(copy, StandardCharsets.UTF_8));
	}
}
