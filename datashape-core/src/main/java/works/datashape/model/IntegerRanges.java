package works.datashape.model;

import java.math.BigInteger;

/**
 * Range checks for the integer shapes that have no exact Java counterpart.
 * <p>
 * Unsigned shapes use the narrowest Java type that holds their whole range,
 * except {@link Shape#U64}, which uses a {@code long} whose bit pattern is read as unsigned
 * (see {@link Long#toUnsignedString(long)}).
 * The 128-bit shapes use {@link BigInteger}.
 */
public final class IntegerRanges {
	public static final BigInteger MIN_I128 = BigInteger.ONE.shiftLeft(127).negate();
	public static final BigInteger MAX_I128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
	public static final BigInteger MAX_U128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
	public static final BigInteger MAX_U64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

	private IntegerRanges() {}

	public static boolean isU8(long value) {
		return 0 <= value && value <= 0xFF;
	}

	public static boolean isU16(long value) {
		return 0 <= value && value <= 0xFFFF;
	}

	public static boolean isU32(long value) {
		return 0 <= value && value <= 0xFFFF_FFFFL;
	}

	public static boolean isI128(BigInteger value) {
		return value.compareTo(MIN_I128) >= 0 && value.compareTo(MAX_I128) <= 0;
	}

	public static boolean isU128(BigInteger value) {
		return value.signum() >= 0 && value.compareTo(MAX_U128) <= 0;
	}

	/**
	 * @return true if {@code codePoint} is a valid {@link Shape#CHAR}
	 */
	public static boolean isUnicodeScalar(int codePoint) {
		return Character.isValidCodePoint(codePoint)
			&& !(Character.MIN_SURROGATE <= codePoint && codePoint <= Character.MAX_SURROGATE);
	}

	/**
	 * @return the unsigned value of {@code u64} as a {@link BigInteger}
	 */
	public static BigInteger unsignedToBig(long u64) {
		BigInteger result = BigInteger.valueOf(u64 & Long.MAX_VALUE);
		return (u64 < 0) ? result.setBit(63) : result;
	}
}
