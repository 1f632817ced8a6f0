package works.datashape.de;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Something that can describe what it expected to find in the input,
 * for use in error messages.
 */
@FunctionalInterface
public interface Expected {
	/**
	 * @return a phrase like "a sequence of length 3" or "struct Point"
	 */
	String expecting();

	static Expected of(String description) {
		return () -> description;
	}

	static Expected oneOf(List<String> names) {
		String description = names.stream()
			.map(n -> "`" + n + "`")
			.collect(joining(", ", "one of ", ""));
		return () -> description;
	}
}
