package works.datashape.impls;

import java.util.List;
import java.util.Optional;
import works.datashape.de.Deserialize;
import works.datashape.de.IgnoredAny;
import works.datashape.de.MapAccess;

import static works.datashape.exceptions.UnrecognizedContentException.duplicateField;
import static works.datashape.exceptions.UnrecognizedContentException.missingField;

/**
 * Collects the field values of a struct read from a {@link MapAccess},
 * rejecting duplicates and reporting missing fields.
 *
 * <pre>
 * StructFields fields = new StructFields(FIELD_VISITOR);
 * fields.readAll(map, index -> switch (index) {
 *     case 0 -> Deserializers.I32;
 *     default -> Deserializers.STRING;
 * });
 * int x = fields.get(0);
 * </pre>
 */
public final class StructFields {
	private final FieldVisitor fieldVisitor;
	private final Object[] values;
	private final boolean[] present;

	public StructFields(FieldVisitor fieldVisitor) {
		this.fieldVisitor = fieldVisitor;
		int size = fieldVisitor.fields().size();
		this.values = new Object[size];
		this.present = new boolean[size];
	}

	@FunctionalInterface
	public interface FieldTypes {
		Deserialize<?> forField(int index);
	}

	/**
	 * Reads every remaining entry of {@code map}.
	 * Unknown fields, if the field visitor lets them through, are skipped.
	 */
	public void readAll(MapAccess map, FieldTypes types) {
		for (Optional<Integer> key = map.nextKey(fieldVisitor); key.isPresent(); key = map.nextKey(fieldVisitor)) {
			int index = key.get();
			if (index == FieldVisitor.UNKNOWN) {
				map.nextValue(IgnoredAny.INSTANCE);
			} else {
				read(index, map, types.forField(index));
			}
		}
	}

	public void read(int index, MapAccess map, Deserialize<?> value) {
		if (present[index]) {
			throw duplicateField(name(index));
		}
		values[index] = map.nextValue(value);
		present[index] = true;
	}

	public boolean isPresent(int index) {
		return present[index];
	}

	@SuppressWarnings("unchecked")
	public <T> T get(int index) {
		if (!present[index]) {
			throw missingField(name(index));
		}
		return (T) values[index];
	}

	@SuppressWarnings("unchecked")
	public <T> T getOrDefault(int index, T defaultValue) {
		return present[index] ? (T) values[index] : defaultValue;
	}

	private String name(int index) {
		List<String> fields = fieldVisitor.fields();
		return fields.get(index);
	}
}
