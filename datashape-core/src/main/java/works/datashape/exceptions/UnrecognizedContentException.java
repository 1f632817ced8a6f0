package works.datashape.exceptions;

import java.util.List;
import works.datashape.de.Expected;
import works.datashape.de.Unexpected;

import static java.util.stream.Collectors.joining;

/**
 * The input was syntactically valid, but the structure being built
 * does not recognize what it contains:
 * an unexpected shape, an out-of-range value, an unknown enum variant, and so on.
 * <p>
 * Callers can catch this separately from {@link MalformedInputException}
 * to distinguish "bad bytes" from "unrecognized content".
 */
public final class UnrecognizedContentException extends DeserializationException {
	public UnrecognizedContentException(String message) {
		super(message);
	}

	public UnrecognizedContentException(String message, Throwable cause) {
		super(message, cause);
	}

	public static UnrecognizedContentException custom(String message) {
		return new UnrecognizedContentException(message);
	}

	/**
	 * The input held a value of the wrong shape,
	 * such as a map where a sequence was expected.
	 */
	public static UnrecognizedContentException invalidType(Unexpected unexpected, Expected expected) {
		return new UnrecognizedContentException("invalid type: " + unexpected + ", expected " + expected.expecting());
	}

	/**
	 * The input held a value of the right shape but an unacceptable value,
	 * such as an integer too large for the target type.
	 */
	public static UnrecognizedContentException invalidValue(Unexpected unexpected, Expected expected) {
		return new UnrecognizedContentException("invalid value: " + unexpected + ", expected " + expected.expecting());
	}

	public static UnrecognizedContentException invalidLength(int length, Expected expected) {
		return new UnrecognizedContentException("invalid length " + length + ", expected " + expected.expecting());
	}

	public static UnrecognizedContentException unknownVariant(String variant, List<String> expected) {
		return new UnrecognizedContentException("unknown variant `" + variant + "`, " + oneOf(expected));
	}

	public static UnrecognizedContentException unknownField(String field, List<String> expected) {
		return new UnrecognizedContentException("unknown field `" + field + "`, " + oneOf(expected));
	}

	public static UnrecognizedContentException missingField(String field) {
		return new UnrecognizedContentException("missing field `" + field + "`");
	}

	public static UnrecognizedContentException duplicateField(String field) {
		return new UnrecognizedContentException("duplicate field `" + field + "`");
	}

	private static String oneOf(List<String> names) {
		return switch (names.size()) {
			case 0 -> "there are no variants or fields";
			case 1 -> "expected `" + names.get(0) + "`";
			default -> names.stream()
				.map(n -> "`" + n + "`")
				.collect(joining(", ", "expected one of ", ""));
		};
	}
}
