package works.datashape.de;

import java.math.BigInteger;

/**
 * Describes what was actually found in the input when a visitor
 * rejects it, for use in error messages.
 *
 * @param description a phrase like "integer `300`" or "sequence"
 */
public record Unexpected(String description) {
	public static Unexpected bool(boolean value) {
		return new Unexpected("boolean `" + value + "`");
	}

	public static Unexpected signed(long value) {
		return new Unexpected("integer `" + value + "`");
	}

	public static Unexpected unsigned(long value) {
		return new Unexpected("integer `" + Long.toUnsignedString(value) + "`");
	}

	public static Unexpected bigInteger(BigInteger value) {
		return new Unexpected("integer `" + value + "`");
	}

	public static Unexpected floating(double value) {
		return new Unexpected("floating point `" + value + "`");
	}

	public static Unexpected character(int codePoint) {
		return new Unexpected("character `" + new String(Character.toChars(codePoint)) + "`");
	}

	public static Unexpected str(CharSequence value) {
		return new Unexpected("string \"" + value + "\"");
	}

	public static Unexpected bytes() {
		return new Unexpected("byte array");
	}

	public static Unexpected unit() {
		return new Unexpected("unit value");
	}

	public static Unexpected option() {
		return new Unexpected("Option value");
	}

	public static Unexpected newtypeStruct() {
		return new Unexpected("newtype struct");
	}

	public static Unexpected seq() {
		return new Unexpected("sequence");
	}

	public static Unexpected map() {
		return new Unexpected("map");
	}

	public static Unexpected enumeration() {
		return new Unexpected("enum");
	}

	public static Unexpected unitVariant() {
		return new Unexpected("unit variant");
	}

	public static Unexpected newtypeVariant() {
		return new Unexpected("newtype variant");
	}

	public static Unexpected tupleVariant() {
		return new Unexpected("tuple variant");
	}

	public static Unexpected structVariant() {
		return new Unexpected("struct variant");
	}

	public static Unexpected other(String description) {
		return new Unexpected(description);
	}

	@Override
	public String toString() {
		return description;
	}
}
