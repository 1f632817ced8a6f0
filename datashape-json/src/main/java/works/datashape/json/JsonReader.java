package works.datashape.json;

import works.datashape.exceptions.MalformedInputException;
import works.datashape.lifetime.BorrowedText;

/**
 * A streaming, token-level JSON reader.
 * Methods mutate the reader's position in ways that are not obvious
 * from the outside, so the calling rules documented here matter.
 * <p>
 * Start with {@link #peekToken}. Depending on the token returned,
 * the next method called must be one of the following:
 * <ul>
 *     <li>
 *         for any token with a {@link Token#hasFixedRepresentation fixed representation},
 *         {@link #consumeFixedToken};
 *     </li>
 *     <li>
 *         for {@link Token#NUMBER}, {@link #consumeNumber}; or
 *     </li>
 *     <li>
 *         for {@link Token#STRING}, {@link #tryBorrowString}, {@link #consumeStringContents},
 *         or {@link #startConsumingString}.
 *     </li>
 * </ul>
 *
 * All syntax errors are reported as {@link MalformedInputException} carrying {@link #currentOffset()}.
 */
public sealed interface JsonReader permits CharArrayJsonReader {
	/**
	 * Skips whitespace and returns the next token, without consuming it.
	 * Idempotent.
	 */
	Token peekToken();

	/**
	 * @param token must be the last token returned by {@link #peekToken}
	 */
	void consumeFixedToken(Token token);

	/**
	 * @throws MalformedInputException if the next token is not {@code expected}
	 */
	default void expectFixedToken(Token expected) {
		Token actual = peekToken();
		if (actual != expected) {
			throw syntaxError("Expected " + expected.description() + " but found " + actual.description());
		}
		consumeFixedToken(expected);
	}

	/**
	 * Consumes a number, checking it against the JSON number grammar.
	 *
	 * @return the text of the number, valid until the next call on this reader
	 */
	CharSequence consumeNumber();

	/**
	 * If the upcoming string has no escape sequences,
	 * consumes it and returns a borrowed view of its contents.
	 * Otherwise, consumes nothing and returns null.
	 */
	BorrowedText tryBorrowString();

	/**
	 * Consumes the opening quote of a string.
	 * Follow with {@link #nextStringChar} until it returns -1.
	 */
	void startConsumingString();

	/**
	 * @return the next decoded character of the string, which may be either half of a surrogate pair,
	 * or -1 at the end of the string, at which point the closing quote has been consumed.
	 */
	int nextStringChar();

	default void consumeStringContents(StringBuilder sb) {
		startConsumingString();
		int c;
		while ((c = nextStringChar()) != -1) {
			sb.append((char) c);
		}
	}

	default void skipString() {
		startConsumingString();
		while (nextStringChar() != -1) { }
	}

	/**
	 * On a best-effort basis, return the upcoming characters in the input.
	 */
	String previewString(int requestedLength);

	/**
	 * @return the position of the next unread character
	 */
	long currentOffset();

	default MalformedInputException syntaxError(String message) {
		return new MalformedInputException(message, "valid JSON", currentOffset());
	}
}
