package org.binvsa.analysis.vsa;

import org.binvsa.ssa.BinaryOperator;
import org.binvsa.ssa.CastType;
import org.binvsa.ssa.UnaryOperator;
import org.binvsa.util.Logger;
import org.binvsa.util.Optional;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A strided interval {@code s[lb, ub]} of signed values of a fixed bit width, denoting
 * the set {lb, lb + s, ..., ub}. Instances are immutable and always in reduced form:
 * <ul>
 *     <li>the empty interval is represented as {@code -1[1, 0]},</li>
 *     <li>singletons have stride 0,</li>
 *     <li>otherwise lb &lt; ub, the stride is positive and both bounds are congruent modulo the stride.</li>
 * </ul>
 * All bounds are within the signed range of the bit width.
 *
 * @see <a href="https://research.cs.wisc.edu/wpis/papers/cc04.pdf">Analyzing memory accesses in x86 executables</a>
 */
public final class StridedInterval implements Iterable<Long> {

	private static final Logger logger = Logger.getLogger(StridedInterval.class);

	/** Truth values of comparisons. True is the one bit value -1. */
	public static final StridedInterval YES = new StridedInterval(1, 0L, -1L, -1L);
	public static final StridedInterval NO = new StridedInterval(1, 0L, 0L, 0L);
	public static final StridedInterval MAYBE = new StridedInterval(1, 1L, -1L, 0L);

	private enum ShiftKind { LEFT, RIGHT_LOGICAL, RIGHT_ARITHMETIC }

	private final int bitWidth;
	private final long stride;
	private final long lower;
	private final long upper;

	private StridedInterval(int bitWidth, long stride, long lower, long upper) {
		this.bitWidth = bitWidth;
		this.stride = stride;
		this.lower = lower;
		this.upper = upper;
	}

	/**
	 * Create an interval and bring it into reduced form. Equal bounds give a singleton,
	 * a negative stride or swapped bounds give the empty interval.
	 *
	 * @throws IllegalStateException if the result violates the reduced form otherwise.
	 */
	public static StridedInterval create(int bitWidth, long stride, long lower, long upper) {
		checkBitWidth(bitWidth);
		StridedInterval si;
		if (lower == upper) {
			si = new StridedInterval(bitWidth, 0L, lower, upper);
		} else if (stride < 0L || upper < lower) {
			return empty(bitWidth);
		} else {
			si = new StridedInterval(bitWidth, stride, lower, upper);
		}
		if (!si.isReduced()) {
			throw new IllegalStateException("Strided interval not in reduced form: " + stride + "[" + lower + ", " + upper + "]:u" + bitWidth);
		}
		return si;
	}

	/**
	 * Create an interval from bounds with a stride that may not fit the bounds. The stride
	 * is coarsened until both bounds are congruent.
	 */
	private static StridedInterval approximate(int bitWidth, long stride, long lower, long upper) {
		if (lower >= upper) {
			return create(bitWidth, 0L, lower, upper);
		}
		assert stride >= 1L : "Approximating with stride " + stride;
		long d = Bits.distance(lower, upper);
		long s = d < 0L ? 1L : Bits.gcd(stride, d);
		return create(bitWidth, s, lower, upper);
	}

	private static void checkBitWidth(int bitWidth) {
		if (bitWidth < 1 || bitWidth > 64) {
			throw new IllegalArgumentException("Unsupported bit width: " + bitWidth);
		}
	}

	public static StridedInterval top(int bitWidth) {
		checkBitWidth(bitWidth);
		return new StridedInterval(bitWidth, 1L, Bits.minSigned(bitWidth), Bits.maxSigned(bitWidth));
	}

	public static StridedInterval empty(int bitWidth) {
		checkBitWidth(bitWidth);
		return new StridedInterval(bitWidth, -1L, 1L, 0L);
	}

	/**
	 * @param bitWidth Bit width.
	 * @param value Value, sign-extended from the bit width.
	 * @return {value}.
	 */
	public static StridedInterval single(int bitWidth, long value) {
		checkBitWidth(bitWidth);
		long v = Bits.extend(bitWidth, value);
		return new StridedInterval(bitWidth, 0L, v, v);
	}

	public static StridedInterval zero(int bitWidth) {
		return single(bitWidth, 0L);
	}

	public static StridedInterval one(int bitWidth) {
		return single(bitWidth, 1L);
	}

	public static StridedInterval minusOne(int bitWidth) {
		return single(bitWidth, -1L);
	}

	/**
	 * @return All values greater than x.
	 */
	public static StridedInterval above(int bitWidth, long x) {
		if (x >= Bits.maxSigned(bitWidth)) {
			return empty(bitWidth);
		}
		return create(bitWidth, 1L, x + 1L, Bits.maxSigned(bitWidth));
	}

	/**
	 * @return All values smaller than x.
	 */
	public static StridedInterval below(int bitWidth, long x) {
		if (x <= Bits.minSigned(bitWidth)) {
			return empty(bitWidth);
		}
		return create(bitWidth, 1L, Bits.minSigned(bitWidth), x - 1L);
	}

	public static StridedInterval aboveEq(int bitWidth, long x) {
		return create(bitWidth, 1L, x, Bits.maxSigned(bitWidth));
	}

	public static StridedInterval belowEq(int bitWidth, long x) {
		return create(bitWidth, 1L, Bits.minSigned(bitWidth), x);
	}

	/**
	 * Unsigned x &lt; v for non-negative x, assuming v does not exceed the signed range.
	 */
	public static StridedInterval aboveUnsigned(int bitWidth, long x) {
		return above(bitWidth, x);
	}

	/**
	 * Unsigned v &lt; x for non-negative x, assuming v does not exceed the signed range.
	 */
	public static StridedInterval belowUnsigned(int bitWidth, long x) {
		if (x <= 0L) {
			return empty(bitWidth);
		}
		return create(bitWidth, 1L, 0L, x - 1L);
	}

	public static StridedInterval aboveEqUnsigned(int bitWidth, long x) {
		return aboveEq(bitWidth, x);
	}

	public static StridedInterval belowEqUnsigned(int bitWidth, long x) {
		if (x < 0L) {
			return empty(bitWidth);
		}
		return create(bitWidth, 1L, 0L, x);
	}

	public int getBitWidth() {
		return bitWidth;
	}

	public long getStride() {
		return stride;
	}

	public long getLowerBound() {
		return lower;
	}

	public long getUpperBound() {
		return upper;
	}

	public boolean isEmpty() {
		return stride == -1L && lower == 1L && upper == 0L;
	}

	public boolean isTop() {
		return stride == 1L && lower == Bits.minSigned(bitWidth) && upper == Bits.maxSigned(bitWidth);
	}

	public boolean isSingleton() {
		return stride == 0L;
	}

	public boolean hasUniqueConcretization() {
		return isSingleton();
	}

	/**
	 * Check the reduced form invariant.
	 *
	 * @return True if this interval is in reduced form.
	 */
	public boolean isReduced() {
		if (isEmpty()) {
			return true;
		}
		if (lower < Bits.minSigned(bitWidth) || upper > Bits.maxSigned(bitWidth)) {
			return false;
		}
		if (stride == 0L) {
			return lower == upper;
		}
		return stride > 0L && lower < upper && Bits.congruent(lower, upper, stride);
	}

	/**
	 * @param value A value, sign-extended from this bit width.
	 * @return True if the value is an element of this interval.
	 */
	public boolean contains(long value) {
		if (isEmpty() || value < lower || value > upper) {
			return false;
		}
		return Bits.congruent(value, lower, stride);
	}

	/**
	 * Inclusion of the concretizations.
	 *
	 * @param other Another interval.
	 * @return True if every element of this interval is an element of other.
	 */
	public boolean lessOrEqual(StridedInterval other) {
		checkCompatible(other);
		if (isEmpty()) {
			return true;
		}
		if (!other.contains(lower) || !other.contains(upper)) {
			return false;
		}
		if (isSingleton()) {
			return true;
		}
		return !other.isSingleton() && stride % other.stride == 0L;
	}

	/**
	 * Number of elements, saturating at {@link Long#MAX_VALUE}.
	 *
	 * @return The size.
	 */
	public long size() {
		if (isEmpty()) {
			return 0L;
		}
		if (isSingleton()) {
			return 1L;
		}
		long q = Long.divideUnsigned(upper - lower, stride);
		if (q < 0L || q == Long.MAX_VALUE) {
			return Long.MAX_VALUE;
		}
		return q + 1L;
	}

	@Override
	public Iterator<Long> iterator() {
		return new Iterator<Long>() {
			private long next = lower;
			private boolean done = isEmpty();

			@Override
			public boolean hasNext() {
				return !done;
			}

			@Override
			public Long next() {
				if (done) {
					throw new NoSuchElementException();
				}
				long current = next;
				if (current == upper) {
					done = true;
				} else {
					next = current + stride;
				}
				return current;
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}

	private void checkCompatible(StridedInterval other) {
		if (bitWidth != other.bitWidth) {
			throw new BitWidthMismatchException(bitWidth, other.bitWidth);
		}
	}

	/**
	 * Addition with wraparound semantics.
	 *
	 * @param other The second summand.
	 * @return this + other.
	 */
	public StridedInterval add(StridedInterval other) {
		return add(other, true);
	}

	/**
	 * Addition. If the sum of the bounds leaves the signed range, the result is top when
	 * overflow is allowed. Otherwise each bound outside the range is replaced by the
	 * extreme in-range value congruent to it, i.e. the operands are assumed not to wrap.
	 *
	 * @param other The second summand.
	 * @param allowOverflow Whether the addition may wrap around.
	 * @return this + other.
	 */
	public StridedInterval add(StridedInterval other, boolean allowOverflow) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		long s = Bits.gcd(stride, other.stride);
		long lb = lower + other.lower;
		long ub = upper + other.upper;
		if (bitWidth == 64) {
			if (Bits.additionOverflows(lower, other.lower, lb) || Bits.additionOverflows(upper, other.upper, ub)) {
				// the mathematical bounds are not representable
				return top(bitWidth);
			}
			return create(bitWidth, s, lb, ub);
		}
		long min = Bits.minSigned(bitWidth);
		long max = Bits.maxSigned(bitWidth);
		boolean lbInRange = lb >= min && lb <= max;
		boolean ubInRange = ub >= min && ub <= max;
		if (lbInRange && ubInRange) {
			return create(bitWidth, s, lb, ub);
		}
		if (allowOverflow) {
			return top(bitWidth);
		}
		long newLb = lbInRange ? lb : Bits.lower(bitWidth, lb, s);
		long newUb = ubInRange ? ub : Bits.upper(bitWidth, ub, s);
		if (newLb > newUb) {
			return top(bitWidth);
		}
		return create(bitWidth, s, newLb, newUb);
	}

	public StridedInterval neg() {
		if (isEmpty()) {
			return this;
		}
		if (lower != Bits.minSigned(bitWidth)) {
			return create(bitWidth, stride, -upper, -lower);
		} else if (isSingleton()) {
			return this;
		} else {
			return top(bitWidth);
		}
	}

	public StridedInterval sub(StridedInterval other) {
		return add(other.neg(), true);
	}

	public StridedInterval not() {
		if (isEmpty()) {
			return this;
		}
		return create(bitWidth, stride, ~upper, ~lower);
	}

	public StridedInterval or(StridedInterval other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		long a = lower;
		long b = upper;
		long c = other.lower;
		long d = other.upper;
		// bits below the smallest stride power of two are the same for all elements
		int t;
		if (isSingleton()) {
			t = other.isSingleton() ? 0 : Bits.ntz(other.stride);
		} else if (other.isSingleton()) {
			t = Bits.ntz(stride);
		} else {
			t = Math.min(Bits.ntz(stride), Bits.ntz(other.stride));
		}
		long s = 1L << t;
		long lowBits = (a | c) & (s - 1L);
		long lb;
		long ub;
		int signs = (a < 0L ? 8 : 0) | (b < 0L ? 4 : 0) | (c < 0L ? 2 : 0) | (d < 0L ? 1 : 0);
		switch (signs) {
		case 0xF: // both negative
		case 0xC: // first negative, second non-negative
		case 0x3: // first non-negative, second negative
		case 0x0: // both non-negative
			lb = Bits.minOr(bitWidth, a, b, c, d);
			ub = Bits.maxOr(bitWidth, a, b, c, d);
			break;
		case 0xE:
			lb = a;
			ub = -1L;
			break;
		case 0xB:
			lb = c;
			ub = -1L;
			break;
		case 0xA:
			lb = Math.min(a, c);
			ub = Bits.maxOr(bitWidth, 0L, b, 0L, d);
			break;
		case 0x8:
			lb = Bits.minOr(bitWidth, a, -1L, c, d);
			ub = Bits.maxOr(bitWidth, 0L, b, c, d);
			break;
		case 0x2:
			lb = Bits.minOr(bitWidth, a, b, c, -1L);
			ub = Bits.maxOr(bitWidth, a, b, 0L, d);
			break;
		default:
			throw new AssertionError("Impossible sign combination of " + this + " and " + other);
		}
		long highMask = ~(s - 1L);
		lb = (lb & highMask) | lowBits;
		ub = (ub & highMask) | lowBits;
		return create(bitWidth, s, lb, ub);
	}

	public StridedInterval and(StridedInterval other) {
		return not().or(other.not()).not();
	}

	public StridedInterval xor(StridedInterval other) {
		StridedInterval left = not().or(other).not();
		StridedInterval right = or(other.not()).not();
		return left.or(right);
	}

	/**
	 * Unsigned remainder.
	 *
	 * @param other The divisor.
	 * @return this % other.
	 * @throws UnimplementedOperationException if the divisor is zero.
	 */
	public StridedInterval mod(StridedInterval other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		if (other.isSingleton() && other.lower == 0L) {
			throw new UnimplementedOperationException("Modulus by zero");
		}
		if (lower >= 0L && other.lower > 0L) {
			if (upper < other.lower) {
				return this;
			}
			return create(bitWidth, 1L, 0L, Math.min(upper, other.upper - 1L));
		}
		return top(bitWidth);
	}

	public StridedInterval shiftLeft(StridedInterval amount) {
		int[] z = shiftAmounts(amount);
		return shift(ShiftKind.LEFT, amount, z[0], z[1]);
	}

	public StridedInterval shiftRight(StridedInterval amount) {
		int[] z = shiftAmounts(amount);
		return shift(ShiftKind.RIGHT_LOGICAL, amount, z[0], z[1]);
	}

	public StridedInterval shiftRightArithmetic(StridedInterval amount) {
		int[] z = shiftAmounts(amount);
		return shift(ShiftKind.RIGHT_ARITHMETIC, amount, z[0], z[1]);
	}

	/**
	 * Range of shift amounts. Negative amounts and amounts beyond the bit width shift by
	 * the full bit width.
	 */
	private int[] shiftAmounts(StridedInterval amount) {
		if (amount.isEmpty()) {
			return new int[] {0, 0};
		}
		long x = amount.lower;
		long y = amount.upper;
		if (amount.isSingleton()) {
			int z = clampShift(x);
			return new int[] {z, z};
		}
		if (x < 0L) {
			return y >= 0L ? new int[] {0, bitWidth} : new int[] {bitWidth, bitWidth};
		}
		return new int[] {clampShift(x), clampShift(y)};
	}

	private int clampShift(long x) {
		return x > bitWidth || x < 0L ? bitWidth : (int) x;
	}

	private long shiftValue(ShiftKind kind, long n, int z) {
		switch (kind) {
		case LEFT:
			return z >= 64 ? 0L : Bits.extend(bitWidth, n << z);
		case RIGHT_LOGICAL:
			return z >= 64 ? 0L : Bits.extend(bitWidth, n >>> z);
		case RIGHT_ARITHMETIC:
			return z >= 64 ? (n < 0L ? -1L : 0L) : n >> z;
		default:
			throw new AssertionError("Unknown shift " + kind);
		}
	}

	private boolean losesBits(long n, int z) {
		if (z >= 64) {
			return n != 0L;
		}
		return (Bits.extend(bitWidth, n << z) >> z) != n;
	}

	private StridedInterval shift(ShiftKind kind, StridedInterval amount, int z1, int z2) {
		if (isEmpty() || amount.isEmpty()) {
			return empty(bitWidth);
		}
		if (z1 == 0 && z2 == 0) {
			return this;
		}
		long a = lower;
		long b = upper;
		if (kind == ShiftKind.RIGHT_LOGICAL) {
			if (a < 0L && b >= 0L) {
				// the unsigned order differs from the signed one
				return top(bitWidth);
			}
			a = Bits.trunc(bitWidth, a);
			b = Bits.trunc(bitWidth, b);
		}
		long l = Long.MAX_VALUE;
		long u = Long.MIN_VALUE;
		boolean simple = true;
		for (int z = z1; z <= z2; z++) {
			long ra = shiftValue(kind, a, z);
			long rb = shiftValue(kind, b, z);
			simple &= (ra >= 0L) == (a >= 0L) && (rb >= 0L) == (b >= 0L);
			if (kind == ShiftKind.LEFT) {
				simple &= !losesBits(a, z) && !losesBits(b, z);
			}
			l = Math.min(l, Math.min(ra, rb));
			u = Math.max(u, Math.max(ra, rb));
		}
		if (!simple) {
			return top(bitWidth);
		}
		if (l == u) {
			return single(bitWidth, l);
		}
		long s = 1L;
		if (z1 == z2 && z1 < 64 && !isSingleton()) {
			if (kind == ShiftKind.LEFT) {
				long scaled = stride << z1;
				s = scaled > 0L ? scaled : 1L;
			} else if ((stride & ((1L << z1) - 1L)) == 0L) {
				s = stride >>> z1;
			}
		}
		return approximate(bitWidth, s, l, u);
	}

	public StridedInterval castLow(int toBitWidth) {
		if (toBitWidth == bitWidth) {
			return this;
		}
		if (toBitWidth > bitWidth) {
			throw new BitWidthMismatchException("Low cast of " + this + " to wider type u" + toBitWidth);
		}
		if (isEmpty()) {
			return empty(toBitWidth);
		}
		if (isSingleton()) {
			return single(toBitWidth, lower);
		}
		if (Bits.fits(toBitWidth, stride) && Bits.fits(toBitWidth, lower) && Bits.fits(toBitWidth, upper)) {
			return create(toBitWidth, stride, lower, upper);
		}
		return top(toBitWidth);
	}

	public StridedInterval castHigh(int toBitWidth) {
		if (toBitWidth == bitWidth) {
			return this;
		}
		if (toBitWidth > bitWidth) {
			throw new BitWidthMismatchException("High cast of " + this + " to wider type u" + toBitWidth);
		}
		int z = bitWidth - toBitWidth;
		return shift(ShiftKind.RIGHT_ARITHMETIC, this, z, z).castLow(toBitWidth);
	}

	public StridedInterval castSigned(int toBitWidth) {
		if (toBitWidth <= bitWidth) {
			return castLow(toBitWidth);
		}
		if (isEmpty()) {
			return empty(toBitWidth);
		}
		return create(toBitWidth, stride, lower, upper);
	}

	public StridedInterval castUnsigned(int toBitWidth) {
		if (toBitWidth <= bitWidth) {
			return castLow(toBitWidth);
		}
		if (isEmpty()) {
			return empty(toBitWidth);
		}
		if (lower >= 0L) {
			return create(toBitWidth, stride, lower, upper);
		}
		if (upper < 0L) {
			return create(toBitWidth, stride, Bits.trunc(bitWidth, lower), Bits.trunc(bitWidth, upper));
		}
		return create(toBitWidth, 1L, 0L, Bits.maxUnsigned(bitWidth));
	}

	public StridedInterval cast(CastType type, int toBitWidth) {
		switch (type) {
		case UNSIGNED:
			return castUnsigned(toBitWidth);
		case SIGNED:
			return castSigned(toBitWidth);
		case HIGH:
			return castHigh(toBitWidth);
		case LOW:
			return castLow(toBitWidth);
		default:
			throw new UnimplementedOperationException("Cast " + type);
		}
	}

	/**
	 * Extract the bits high down to low.
	 *
	 * @param high Most significant bit, inclusive.
	 * @param low Least significant bit, inclusive.
	 * @return The extracted value.
	 */
	public StridedInterval extract(int high, int low) {
		if (low < 0 || high < low || high >= bitWidth) {
			throw new BitWidthMismatchException("Invalid bit range " + high + ":" + low + " of " + this);
		}
		StridedInterval shifted = low == 0 ? this : shift(ShiftKind.RIGHT_LOGICAL, this, low, low);
		return shifted.castLow(high - low + 1);
	}

	/**
	 * Concatenate this interval as the high bits with another one as the low bits.
	 *
	 * @param low The low part.
	 * @return this @ low.
	 */
	public StridedInterval concat(StridedInterval low) {
		int width = bitWidth + low.bitWidth;
		if (width > 64) {
			throw new BitWidthMismatchException("Concatenation " + this + " @ " + low + " wider than 64 bits");
		}
		if (isEmpty() || low.isEmpty()) {
			return empty(width);
		}
		if (isSingleton() && low.isSingleton()) {
			return single(width, (Bits.trunc(bitWidth, lower) << low.bitWidth) | Bits.trunc(low.bitWidth, low.lower));
		}
		StridedInterval highPart = castUnsigned(width);
		StridedInterval lowPart = low.castUnsigned(width);
		return highPart.shift(ShiftKind.LEFT, this, low.bitWidth, low.bitWidth).or(lowPart);
	}

	/**
	 * Compare two intervals for equality.
	 *
	 * @param other Other interval.
	 * @return {@link #YES}, {@link #NO} or {@link #MAYBE}.
	 */
	public StridedInterval eq(StridedInterval other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(1);
		}
		if (isSingleton() && other.isSingleton() && lower == other.lower) {
			return YES;
		}
		if (upper < other.lower || other.upper < lower) {
			return NO;
		}
		long s = Bits.gcd(stride, other.stride);
		if (s == 0L) {
			return NO;
		}
		return Bits.congruent(lower, other.lower, s) ? MAYBE : NO;
	}

	public StridedInterval neq(StridedInterval other) {
		return eq(other).not();
	}

	/**
	 * Apply a binary operator to two intervals.
	 *
	 * @throws UnimplementedOperationException for operators without an interval semantics.
	 */
	public StridedInterval binop(BinaryOperator op, StridedInterval other) {
		switch (op) {
		case PLUS:
			return add(other, true);
		case MINUS:
			return sub(other);
		case AND:
			return and(other);
		case OR:
			return or(other);
		case XOR:
			return xor(other);
		case MOD:
			return mod(other);
		case RSHIFT:
			return shiftRight(other);
		case ARSHIFT:
			return shiftRightArithmetic(other);
		case LSHIFT:
			return shiftLeft(other);
		case EQ:
			return eq(other);
		case NEQ:
			return neq(other);
		default:
			throw new UnimplementedOperationException("Operator " + op + " on strided intervals");
		}
	}

	public StridedInterval unop(UnaryOperator op) {
		switch (op) {
		case NEG:
			return neg();
		case NOT:
			return not();
		default:
			throw new UnimplementedOperationException("Operator " + op + " on strided intervals");
		}
	}

	public StridedInterval union(StridedInterval other) {
		checkCompatible(other);
		if (isEmpty()) {
			return other;
		}
		if (other.isEmpty()) {
			return this;
		}
		long l = Math.min(lower, other.lower);
		long u = Math.max(upper, other.upper);
		long d = Bits.distance(Math.min(lower, other.lower), Math.max(lower, other.lower));
		long s;
		if (d < 0L) {
			s = 1L;
		} else {
			s = Bits.gcd(Bits.gcd(stride, other.stride), d);
		}
		if (s == 0L) {
			return this;
		}
		return create(bitWidth, s, l, u);
	}

	/**
	 * Intersection. Exact whenever the common stride is small enough to search for the
	 * first common element, otherwise the progression with the larger stride restricted
	 * to the overlap.
	 *
	 * @param other Other interval.
	 * @return this &#8745; other.
	 */
	public StridedInterval intersection(StridedInterval other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		long l = Math.max(lower, other.lower);
		long u = Math.min(upper, other.upper);
		if (l > u) {
			return empty(bitWidth);
		}
		if (isSingleton()) {
			return other.contains(lower) ? this : empty(bitWidth);
		}
		if (other.isSingleton()) {
			return contains(other.lower) ? other : empty(bitWidth);
		}
		long g = Bits.gcd(stride, other.stride);
		if (!Bits.congruent(lower, other.lower, g)) {
			return empty(bitWidth);
		}
		StridedInterval big = stride >= other.stride ? this : other;
		StridedInterval small = big == this ? other : this;
		long first = Bits.firstAtLeast(l, big.lower, big.stride);
		long last = Bits.lastAtMost(u, big.lower, big.stride);
		if (first > last) {
			return empty(bitWidth);
		}
		Optional<Long> lcm = Bits.lcm(stride, other.stride);
		if (!lcm.hasValue() || lcm.getValue() == big.stride) {
			return create(bitWidth, big.stride, first, last);
		}
		long steps = lcm.getValue() / big.stride;
		if (steps > 1024L) {
			return create(bitWidth, big.stride, first, last);
		}
		long candidate = first;
		for (long i = 0L; i < steps; i++) {
			if (Bits.congruent(candidate, small.lower, small.stride)) {
				return create(bitWidth, lcm.getValue(), candidate, Bits.lastAtMost(last, candidate, lcm.getValue()));
			}
			if (candidate > last - big.stride) {
				break;
			}
			candidate += big.stride;
		}
		return empty(bitWidth);
	}

	/**
	 * Widen this interval by a newer one. Only bounds that moved outward are relaxed,
	 * to the extreme value congruent to the joined stride.
	 *
	 * @param newer The newer interval.
	 * @return this widened by newer.
	 */
	public StridedInterval widen(StridedInterval newer) {
		checkCompatible(newer);
		if (isEmpty()) {
			return newer.isEmpty() ? this : top(bitWidth);
		}
		if (newer.isEmpty()) {
			return this;
		}
		StridedInterval joined = union(newer);
		if (joined.isSingleton()) {
			return joined;
		}
		long s = joined.stride;
		long l = newer.lower < lower ? Bits.lower(bitWidth, joined.lower, s) : joined.lower;
		long u = newer.upper > upper ? Bits.upper(bitWidth, joined.upper, s) : joined.upper;
		StridedInterval result = create(bitWidth, s, l, u);
		if (logger.isDebugEnabled()) {
			logger.debug("Widened " + this + " by " + newer + " to " + result);
		}
		return result;
	}

	/**
	 * Forget the lower bound, keeping stride and residue.
	 */
	public StridedInterval removeLowerBound() {
		if (isEmpty()) {
			return this;
		}
		long s = Math.max(stride, 1L);
		return create(bitWidth, s, Bits.lower(bitWidth, upper, s), upper);
	}

	/**
	 * Forget the upper bound, keeping stride and residue.
	 */
	public StridedInterval removeUpperBound() {
		if (isEmpty()) {
			return this;
		}
		long s = Math.max(stride, 1L);
		return create(bitWidth, s, lower, Bits.upper(bitWidth, lower, s));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof StridedInterval)) {
			return false;
		}
		StridedInterval other = (StridedInterval) obj;
		return bitWidth == other.bitWidth && stride == other.stride && lower == other.lower && upper == other.upper;
	}

	@Override
	public int hashCode() {
		int result = bitWidth;
		result = 31 * result + Long.hashCode(stride);
		result = 31 * result + Long.hashCode(lower);
		result = 31 * result + Long.hashCode(upper);
		return result;
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "[empty]:u" + bitWidth;
		}
		if (isSingleton()) {
			return lower + ":u" + bitWidth;
		}
		return stride + "[" + lower + ", " + upper + "]:u" + bitWidth;
	}
}
