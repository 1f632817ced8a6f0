package works.datashape.json;

import java.nio.CharBuffer;
import works.datashape.lifetime.BorrowedText;
import works.datashape.lifetime.InputBuffer;

import static java.lang.Math.min;

/**
 * A {@link JsonReader} over the chars of an {@link InputBuffer}.
 * Strings without escapes can be handed out as borrowed views of the buffer.
 */
public final class CharArrayJsonReader implements JsonReader {
	private final InputBuffer buffer;
	private final char[] chars;
	private int pos = 0;

	/**
	 * @param buffer must hold chars
	 */
	public CharArrayJsonReader(InputBuffer buffer) {
		this.buffer = buffer;
		this.chars = buffer.chars();
	}

	@Override
	public Token peekToken() {
		skipWhitespace();
		return Token.startingWith(peekRawChar());
	}

	/**
	 * @return NOT a code point!
	 */
	private int peekRawChar() {
		if (pos >= chars.length) {
			return -1;
		} else {
			return chars[pos];
		}
	}

	private void skipWhitespace() {
		while (isWhitespace(peekRawChar())) {
			pos++;
		}
	}

	@Override
	public void consumeFixedToken(Token token) {
		String representation = token.fixedRepresentation();
		if (representation.length() > chars.length - pos) {
			throw syntaxError("Unexpected end of input; expecting '" + representation + "'");
		}
		for (int i = 0; i < representation.length(); i++) {
			if (chars[pos + i] != representation.charAt(i)) {
				throw syntaxError("Unexpected character '" + chars[pos + i] + "'; expecting '" + representation + "'");
			}
		}
		pos += representation.length();
	}

	@Override
	public CharSequence consumeNumber() {
		int start = pos;
		if (peekRawChar() == '-') {
			pos++;
		}
		if (peekRawChar() == '0') {
			pos++;
		} else {
			digits("integer part");
		}
		if (peekRawChar() == '.') {
			pos++;
			digits("fraction");
		}
		int c = peekRawChar();
		if (c == 'e' || c == 'E') {
			pos++;
			c = peekRawChar();
			if (c == '+' || c == '-') {
				pos++;
			}
			digits("exponent");
		}
		if (isNumberChar(peekRawChar())) {
			throw syntaxError("Malformed number starting with '" + new String(chars, start, pos - start) + "'");
		}
		return CharBuffer.wrap(chars, start, pos - start);
	}

	private void digits(String what) {
		int start = pos;
		while (pos < chars.length && chars[pos] >= '0' && chars[pos] <= '9') {
			pos++;
		}
		if (pos == start) {
			throw syntaxError("Number has no digits in its " + what);
		}
	}

	@Override
	public BorrowedText tryBorrowString() {
		int start = pos + 1; // First actual character in the string's value
		for (int i = start; i < chars.length; i++) {
			char c = chars[i];
			if (c == '"') {
				pos = i + 1;
				return buffer.text(start, i);
			} else if (c == '\\' || c < 0x20) {
				// Decoding needed; leave it to the slow path, which also reports bad characters
				return null;
			}
		}
		return null;
	}

	@Override
	public void startConsumingString() {
		pos++; // Skip opening quote
	}

	@Override
	public int nextStringChar() {
		if (pos >= chars.length) {
			throw syntaxError("Unterminated string at end of input");
		}
		char c = chars[pos++];
		if (c == '"') {
			return -1;
		} else if (c == '\\') {
			if (pos >= chars.length) {
				throw syntaxError("Unterminated escape sequence at end of input");
			}
			char esc = chars[pos++];
			return switch (esc) {
				case '"', '\\', '/' -> esc;
				case 'b' -> '\b';
				case 'f' -> '\f';
				case 'n' -> '\n';
				case 'r' -> '\r';
				case 't' -> '\t';
				case 'u' -> {
					if (pos + 4 > chars.length) {
						throw syntaxError("Incomplete Unicode escape sequence at end of input");
					}
					int value = 0;
					for (int i = 0; i < 4; i++) {
						int digit = Character.digit(chars[pos++], 16);
						if (digit < 0) {
							throw syntaxError("Invalid hex digit in Unicode escape");
						}
						value = (value << 4) | digit;
					}
					yield value;
				}
				default -> throw syntaxError("Invalid escape: \\" + esc);
			};
		} else if (c >= 0x20) {
			return c;
		} else {
			// Only here can we distinguish actual illegal characters from legal escape sequences
			throw syntaxError("Invalid character in string: 0x" + Integer.toHexString(c));
		}
	}

	@Override
	public String previewString(int requestedLength) {
		int actualLength = min(requestedLength, chars.length - pos);
		return new String(chars, pos, actualLength);
	}

	@Override
	public long currentOffset() {
		return pos;
	}

	private static boolean isWhitespace(int c) {
		return c == 0x20 || c == 0x0A || c == 0x0D || c == 0x09;
	}

	private static boolean isNumberChar(int c) {
		return (c >= '0' && c <= '9') || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E';
	}
}
