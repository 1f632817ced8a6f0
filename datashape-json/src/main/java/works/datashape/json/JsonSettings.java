package works.datashape.json;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class JsonSettings {
	public static final JsonSettings DEFAULT = JsonSettings.builder().build();

	/**
	 * Break compound values across lines, indenting each level by two spaces.
	 */
	@Default boolean prettyPrint = false;

	/**
	 * Write every character outside printable ASCII as a {@code \\uXXXX} escape,
	 * so the output is pure ASCII.
	 * Otherwise, only control characters are escaped.
	 */
	@Default boolean escapeNonAscii = false;

	/**
	 * Arrays and objects nested deeper than this are rejected when reading,
	 * which bounds the stack depth a hostile document can cause.
	 */
	@Default int maxNestingDepth = 128;
}
