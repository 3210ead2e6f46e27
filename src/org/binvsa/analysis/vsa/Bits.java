package org.binvsa.analysis.vsa;

import org.binvsa.util.Optional;

import java.math.BigInteger;

/**
 * Arithmetic helpers for values of arbitrary bit widths between 1 and 64. Values are
 * kept sign-extended in a long; strides are non-negative longs.
 */
public final class Bits {

	private Bits() {
	}

	/**
	 * @param bitWidth Bit width.
	 * @return A number with only the most significant bit of the given width set.
	 */
	public static long highBit(int bitWidth) {
		assert bitWidth >= 1 && bitWidth <= 64 : "Unsupported bit width " + bitWidth;
		return 1L << (bitWidth - 1);
	}

	public static long maxSigned(int bitWidth) {
		return highBit(bitWidth) - 1L;
	}

	public static long minSigned(int bitWidth) {
		return extend(bitWidth, highBit(bitWidth));
	}

	/**
	 * Largest unsigned value of a width, as sign-extended long. Only meaningful for
	 * widths below 64.
	 *
	 * @param bitWidth Bit width.
	 * @return 2^bitWidth - 1.
	 */
	public static long maxUnsigned(int bitWidth) {
		return bitWidth == 64 ? -1L : (1L << bitWidth) - 1L;
	}

	/**
	 * Sign-extend the lower bits of a value.
	 *
	 * @param bitWidth Width of the value.
	 * @param val The value.
	 * @return The sign-extended value.
	 */
	public static long extend(int bitWidth, long val) {
		if (bitWidth == 64) {
			return val;
		}
		return (val << (64 - bitWidth)) >> (64 - bitWidth);
	}

	/**
	 * Zero-extend the lower bits of a value.
	 *
	 * @param bitWidth Width of the value.
	 * @param val The value.
	 * @return The truncated value.
	 */
	public static long trunc(int bitWidth, long val) {
		if (bitWidth == 64) {
			return val;
		}
		return val & ((1L << bitWidth) - 1L);
	}

	public static boolean fits(int bitWidth, long val) {
		return val == extend(bitWidth, val);
	}

	/**
	 * Mathematical residue of a value, i.e. the result is always in [0, s).
	 *
	 * @param val The value.
	 * @param s Positive modulus.
	 * @return val mod s.
	 */
	public static long residue(long val, long s) {
		assert s > 0L;
		return Math.floorMod(val, s);
	}

	/**
	 * @return True if a and b are congruent modulo s. Every value is congruent modulo 0
	 * only to itself.
	 */
	public static boolean congruent(long a, long b, long s) {
		if (s == 0L) {
			return a == b;
		}
		return residue(a, s) == residue(b, s);
	}

	public static long gcd(long a, long b) {
		assert a >= 0L && b >= 0L : "gcd of negative numbers " + a + ", " + b;
		while (b != 0L) {
			long t = a % b;
			a = b;
			b = t;
		}
		return a;
	}

	/**
	 * LCM of two non-negative numbers. Returns nothing on overflow.
	 *
	 * @param a First number.
	 * @param b Second number.
	 * @return lcm(a, b).
	 */
	public static Optional<Long> lcm(long a, long b) {
		assert a >= 0L && b >= 0L;
		if (a == 0L || b == 0L) {
			return new Optional<>(0L);
		}
		BigInteger tmp = BigInteger.valueOf(a).divide(BigInteger.valueOf(gcd(a, b))).multiply(BigInteger.valueOf(b));
		if (tmp.bitLength() < 64) {
			return new Optional<>(tmp.longValue());
		}
		return Optional.none();
	}

	/**
	 * Distance between two values, or -1 if it does not fit into a non-negative long.
	 *
	 * @param low Smaller value.
	 * @param high Larger value.
	 * @return high - low.
	 */
	public static long distance(long low, long high) {
		assert low <= high;
		long d = high - low;
		return d < 0L ? -1L : d;
	}

	/**
	 * Check whether a + b = sum overflowed in 64 bit arithmetic.
	 */
	public static boolean additionOverflows(long a, long b, long sum) {
		return ((a ^ sum) & (b ^ sum)) < 0L;
	}

	/**
	 * Smallest value of the given width that is congruent to val modulo s.
	 *
	 * @param bitWidth Bit width.
	 * @param val Value whose residue is kept, need not be in range.
	 * @param s Stride.
	 * @return A value in [minSigned, minSigned + s).
	 */
	public static long lower(int bitWidth, long val, long s) {
		long min = minSigned(bitWidth);
		if (s < 1L) {
			return min;
		}
		return firstAtLeast(min, val, s);
	}

	/**
	 * Largest value of the given width that is congruent to val modulo s.
	 *
	 * @param bitWidth Bit width.
	 * @param val Value whose residue is kept, need not be in range.
	 * @param s Stride.
	 * @return A value in (maxSigned - s, maxSigned].
	 */
	public static long upper(int bitWidth, long val, long s) {
		long max = maxSigned(bitWidth);
		if (s < 1L) {
			return max;
		}
		return lastAtMost(max, val, s);
	}

	/**
	 * @return The smallest x >= bound with x = val (mod s). May overflow if no such value
	 * exists below 2^63.
	 */
	public static long firstAtLeast(long bound, long val, long s) {
		assert s > 0L;
		long r = residue(val, s) - residue(bound, s);
		if (r < 0L) {
			r += s;
		}
		return bound + r;
	}

	/**
	 * @return The largest x <= bound with x = val (mod s).
	 */
	public static long lastAtMost(long bound, long val, long s) {
		assert s > 0L;
		long r = residue(bound, s) - residue(val, s);
		if (r < 0L) {
			r += s;
		}
		return bound - r;
	}

	/**
	 * Number of trailing zeros; 0 for the value 0.
	 */
	public static int ntz(long x) {
		return x == 0L ? 0 : Long.numberOfTrailingZeros(x);
	}

	/**
	 * Minimum of a | b for a in [a, b] and c in [c, d], all compared unsigned within the
	 * given width (Warren, Hacker's Delight 4-3).
	 */
	public static long minOr(int bitWidth, long a, long b, long c, long d) {
		long m = highBit(bitWidth);
		while (m != 0L) {
			if ((~a & c & m) != 0L) {
				long temp = (a | m) & -m;
				if (Long.compareUnsigned(temp, b) <= 0) {
					a = temp;
					break;
				}
			} else if ((a & ~c & m) != 0L) {
				long temp = (c | m) & -m;
				if (Long.compareUnsigned(temp, d) <= 0) {
					c = temp;
					break;
				}
			}
			m >>>= 1;
		}
		return a | c;
	}

	/**
	 * Maximum of a | b for a in [a, b] and c in [c, d], all compared unsigned within the
	 * given width.
	 */
	public static long maxOr(int bitWidth, long a, long b, long c, long d) {
		long m = highBit(bitWidth);
		while (m != 0L) {
			if ((b & d & m) != 0L) {
				long temp = (b - m) | (m - 1L);
				if (Long.compareUnsigned(temp, a) >= 0) {
					b = temp;
					break;
				}
				temp = (d - m) | (m - 1L);
				if (Long.compareUnsigned(temp, c) >= 0) {
					d = temp;
					break;
				}
			}
			m >>>= 1;
		}
		return b | d;
	}
}
