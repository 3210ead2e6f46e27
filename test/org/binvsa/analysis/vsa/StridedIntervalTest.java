package org.binvsa.analysis.vsa;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StridedIntervalTest {

	private static StridedInterval si(long stride, long lower, long upper) {
		return StridedInterval.create(8, stride, lower, upper);
	}

	private static StridedInterval single(long value) {
		return StridedInterval.single(8, value);
	}

	@Test
	public void testCreateNormalizesSingleton() {
		StridedInterval s = StridedInterval.create(8, 4L, 3L, 3L);
		assertTrue(s.isSingleton());
		assertEquals(0L, s.getStride());
		assertEquals(single(3L), s);
	}

	@Test
	public void testCreateSwappedBoundsIsEmpty() {
		assertTrue(si(1L, 5L, 2L).isEmpty());
		assertEquals(StridedInterval.empty(8), si(1L, 5L, 2L));
	}

	@Test(expected = IllegalStateException.class)
	public void testCreateRejectsIncongruentBounds() {
		si(2L, 0L, 3L);
	}

	@Test(expected = IllegalStateException.class)
	public void testCreateRejectsOutOfRangeBounds() {
		si(1L, 0L, 200L);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnsupportedBitWidth() {
		StridedInterval.top(65);
	}

	@Test
	public void testToString() {
		assertEquals("2[0, 10]:u8", si(2L, 0L, 10L).toString());
		assertEquals("5:u8", single(5L).toString());
		assertEquals("-1:u8", single(255L).toString());
		assertEquals("[empty]:u8", StridedInterval.empty(8).toString());
		assertEquals("1[-128, 127]:u8", StridedInterval.top(8).toString());
	}

	@Test
	public void testMembership() {
		StridedInterval s = si(3L, 1L, 10L);
		assertEquals(4L, s.size());
		List<Long> values = new ArrayList<>();
		for (Long v : s) {
			values.add(v);
		}
		assertEquals(Arrays.asList(1L, 4L, 7L, 10L), values);
		assertTrue(s.contains(7L));
		assertFalse(s.contains(8L));
		assertFalse(s.contains(13L));
		assertEquals(256L, StridedInterval.top(8).size());
		assertEquals(Long.MAX_VALUE, StridedInterval.top(64).size());
		assertEquals(0L, StridedInterval.empty(8).size());
	}

	@Test
	public void testLessOrEqual() {
		assertTrue(si(4L, 0L, 8L).lessOrEqual(si(2L, 0L, 10L)));
		assertFalse(si(2L, 0L, 10L).lessOrEqual(si(4L, 0L, 8L)));
		assertTrue(StridedInterval.empty(8).lessOrEqual(single(3L)));
		assertTrue(single(3L).lessOrEqual(StridedInterval.top(8)));
	}

	@Test
	public void testAdd() {
		assertEquals(si(1L, 1L, 17L), si(2L, 0L, 10L).add(si(3L, 1L, 7L)));
		assertEquals(si(4L, 2L, 10L), si(4L, 0L, 8L).add(single(2L)));
	}

	@Test
	public void testAddOverflow() {
		assertTrue(si(2L, 100L, 120L).add(si(2L, 10L, 20L), true).isTop());
		assertEquals(si(2L, 110L, 126L), si(2L, 100L, 120L).add(si(2L, 10L, 20L), false));
		assertTrue(StridedInterval.single(64, Long.MAX_VALUE).add(StridedInterval.one(64)).isTop());
	}

	@Test
	public void testSubAndNeg() {
		assertEquals(si(1L, 7L, 10L), single(10L).sub(si(1L, 0L, 3L)));
		assertEquals(si(2L, -10L, -2L), si(2L, 2L, 10L).neg());
		assertEquals(single(-128L), single(-128L).neg());
		assertTrue(si(1L, -128L, 0L).neg().isTop());
	}

	@Test
	public void testNot() {
		assertEquals(si(2L, -11L, -1L), si(2L, 0L, 10L).not());
	}

	@Test
	public void testOr() {
		assertEquals(si(1L, 16L, 19L), single(0x10L).or(si(1L, 0L, 3L)));
		// the lowest bits are known
		assertEquals(si(4L, 1L, 9L), si(4L, 0L, 8L).or(single(1L)));
		assertEquals(single(-1L), single(-16L).or(single(15L)));
	}

	@Test
	public void testAndXor() {
		assertEquals(single(0x0CL), single(0x3CL).and(single(0x0FL)));
		assertEquals(single(5L), single(6L).xor(single(3L)));
	}

	@Test
	public void testMod() {
		assertEquals(si(1L, 0L, 9L), si(1L, 0L, 100L).mod(single(10L)));
		assertEquals(si(1L, 2L, 5L), si(1L, 2L, 5L).mod(si(1L, 10L, 20L)));
		assertTrue(si(1L, -5L, 5L).mod(single(3L)).isTop());
	}

	@Test(expected = UnimplementedOperationException.class)
	public void testModByZero() {
		si(1L, 0L, 100L).mod(StridedInterval.zero(8));
	}

	@Test
	public void testShiftLeft() {
		assertEquals(si(8L, 4L, 20L), si(2L, 1L, 5L).shiftLeft(single(2L)));
		assertTrue(single(64L).shiftLeft(single(2L)).isTop());
		// the set bit is shifted out
		assertTrue(single(1L).shiftLeft(single(8L)).isTop());
	}

	@Test
	public void testShiftRight() {
		assertEquals(single(8L), single(-128L).shiftRight(single(4L)));
		assertTrue(si(1L, -1L, 1L).shiftRight(single(1L)).isTop());
		assertEquals(si(1L, -4L, 4L), si(4L, -16L, 16L).shiftRightArithmetic(single(2L)));
		assertEquals(si(1L, 0L, 10L), si(1L, 0L, 20L).shiftRight(si(1L, 1L, 2L)));
	}

	@Test
	public void testCasts() {
		assertEquals(StridedInterval.single(16, 255L), single(-1L).castUnsigned(16));
		assertEquals(StridedInterval.create(16, 1L, 0L, 255L), si(1L, -1L, 1L).castUnsigned(16));
		assertEquals(StridedInterval.create(16, 1L, -1L, 1L), si(1L, -1L, 1L).castSigned(16));
		assertTrue(StridedInterval.create(16, 1L, 0L, 300L).castLow(8).isTop());
		assertEquals(si(2L, 0L, 100L), StridedInterval.create(16, 2L, 0L, 100L).castLow(8));
		assertEquals(single(0x12L), StridedInterval.single(16, 0x1234L).castHigh(8));
		assertEquals(single(0x34L), StridedInterval.single(16, 0x1234L).castLow(8));
	}

	@Test
	public void testExtractAndConcat() {
		assertEquals(single(0x23L), StridedInterval.single(16, 0x1234L).extract(11, 4));
		assertEquals(StridedInterval.single(16, 0x1234L), single(0x12L).concat(single(0x34L)));
		assertEquals(StridedInterval.single(16, 0xFF01L), single(-1L).concat(single(1L)));
	}

	@Test
	public void testEq() {
		assertEquals(StridedInterval.YES, single(3L).eq(single(3L)));
		assertEquals(StridedInterval.NO, si(1L, 0L, 3L).eq(si(1L, 5L, 9L)));
		assertEquals(StridedInterval.NO, si(2L, 0L, 8L).eq(si(2L, 1L, 9L)));
		assertEquals(StridedInterval.MAYBE, si(1L, 0L, 5L).eq(single(3L)));
		assertEquals(StridedInterval.NO, single(3L).neq(single(3L)));
	}

	@Test
	public void testUnion() {
		assertEquals(si(4L, 0L, 4L), single(0L).union(single(4L)));
		assertEquals(si(2L, 0L, 8L), si(4L, 0L, 8L).union(single(2L)));
		assertEquals(single(3L), single(3L).union(StridedInterval.empty(8)));
	}

	@Test
	public void testIntersection() {
		assertEquals(si(6L, 0L, 18L), si(2L, 0L, 20L).intersection(si(3L, 0L, 30L)));
		assertTrue(si(2L, 0L, 20L).intersection(si(2L, 1L, 21L)).isEmpty());
		assertTrue(si(1L, 0L, 10L).intersection(si(1L, 20L, 30L)).isEmpty());
		assertEquals(si(1L, 0L, 9L), si(1L, 0L, 127L).intersection(StridedInterval.below(8, 10L)));
		assertEquals(single(4L), si(2L, 0L, 10L).intersection(single(4L)));
		assertTrue(si(2L, 0L, 10L).intersection(single(5L)).isEmpty());
	}

	@Test
	public void testWiden() {
		assertEquals(si(1L, 0L, 127L), single(0L).widen(si(1L, 0L, 1L)));
		assertEquals(si(2L, -128L, 10L), si(2L, 0L, 10L).widen(si(2L, -4L, 10L)));
		assertEquals(si(2L, 0L, 10L), si(2L, 0L, 10L).widen(si(2L, 2L, 8L)));
		assertTrue(StridedInterval.empty(8).widen(single(1L)).isTop());
	}

	@Test
	public void testBounds() {
		assertTrue(StridedInterval.below(8, -128L).isEmpty());
		assertTrue(StridedInterval.above(8, 127L).isEmpty());
		assertEquals(si(1L, 11L, 127L), StridedInterval.above(8, 10L));
		assertEquals(si(1L, -128L, 10L), StridedInterval.belowEq(8, 10L));
		assertEquals(si(1L, 0L, 5L), StridedInterval.belowEqUnsigned(8, 5L));
		assertEquals(si(1L, 0L, 4L), StridedInterval.belowUnsigned(8, 5L));
		assertEquals(si(3L, -128L, 10L), si(3L, 1L, 10L).removeLowerBound());
		assertEquals(si(3L, 1L, 127L), si(3L, 1L, 10L).removeUpperBound());
	}

	@Test(expected = BitWidthMismatchException.class)
	public void testWidthMismatch() {
		single(1L).add(StridedInterval.single(16, 1L));
	}
}
