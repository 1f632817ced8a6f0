package works.datashape.json;

import org.jetbrains.annotations.Nullable;

/**
 * What the next non-whitespace character of JSON text begins.
 * Member names and string values are both {@link #STRING}.
 */
public enum Token {
	END_TEXT("", "end of input"),
	NULL("null"),
	FALSE("false"),
	TRUE("true"),
	NUMBER(null, "a number"),
	START_OBJECT("{"),
	END_OBJECT("}"),
	START_ARRAY("["),
	END_ARRAY("]"),
	STRING(null, "a string"),
	COMMA(","),
	COLON(":"),
	ERROR(null, "an invalid character");

	private final @Nullable String text;
	private final String description;

	Token(@Nullable String text, String description) {
		this.text = text;
		this.description = description;
	}

	Token(String text) {
		this(text, "'" + text + "'");
	}

	/**
	 * @param c a char, or -1 at end of input
	 */
	public static Token startingWith(int c) {
		if (c >= '0' && c <= '9') {
			return NUMBER;
		}
		return switch (c) {
			case -1 -> END_TEXT;
			case '-' -> NUMBER;
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '{' -> START_OBJECT;
			case '}' -> END_OBJECT;
			case '[' -> START_ARRAY;
			case ']' -> END_ARRAY;
			case '"' -> STRING;
			case ',' -> COMMA;
			case ':' -> COLON;
			default -> ERROR;
		};
	}

	/**
	 * @return whether this token is always spelled the same way, so it can be consumed by length
	 */
	public boolean hasFixedRepresentation() {
		return text != null;
	}

	/**
	 * @throws IllegalArgumentException for {@link #NUMBER}, {@link #STRING} and {@link #ERROR}
	 */
	public String fixedRepresentation() {
		if (text == null) {
			throw new IllegalArgumentException("Token has no fixed representation: " + this);
		}
		return text;
	}

	/**
	 * How the token reads in an error message.
	 */
	public String description() {
		return description;
	}
}
