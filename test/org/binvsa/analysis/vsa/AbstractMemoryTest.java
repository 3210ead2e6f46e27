package org.binvsa.analysis.vsa;

import org.binvsa.analysis.vsa.statistic.Statistic;
import org.binvsa.util.Optional;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AbstractMemoryTest {

	private static final Optional<Integer> NO_LIMIT = Optional.none();

	private RegionTable regions;
	private MemoryRegion stack;
	private Statistic statistic;

	@Before
	public void setUp() {
		regions = new RegionTable();
		stack = regions.getRegion("R_ESP");
		statistic = new Statistic();
	}

	private static ValueSet num(long value) {
		return ValueSet.single(32, value);
	}

	private ValueSet stack(long offset) {
		return ValueSet.of(stack, StridedInterval.single(32, offset));
	}

	private ValueSet stack(long stride, long lower, long upper) {
		return ValueSet.of(stack, StridedInterval.create(32, stride, lower, upper));
	}

	private AbstractMemory write(AbstractMemory m, ValueSet address, ValueSet value) {
		return m.write(address, value, NO_LIMIT, statistic);
	}

	@Test
	public void testTopReadsTop() {
		assertTrue(AbstractMemory.TOP.isTop());
		assertTrue(AbstractMemory.TOP.read(32, stack(0L)).isTop());
		assertTrue(AbstractMemory.TOP.read(32, ValueSet.top(32)).isTop());
		assertTrue(AbstractMemory.TOP.read(32, ValueSet.empty(32)).isEmpty());
	}

	@Test
	public void testStrongUpdate() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(5L));
		assertEquals(num(5L), m.read(32, stack(0L)));
		assertTrue(m.read(32, stack(4L)).isTop());
		m = write(m, stack(0L), num(6L));
		assertEquals(num(6L), m.read(32, stack(0L)));
		assertEquals(1, m.size());
		assertEquals(2L, statistic.getStrongUpdateCount());
		assertTrue(AbstractMemory.TOP.isTop());
	}

	@Test
	public void testWritingTopRemovesEntry() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(5L));
		assertTrue(write(m, stack(0L), ValueSet.top(32)).isTop());
	}

	@Test
	public void testOverlappingWriteRemovesEntry() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(0x11223344L));
		m = write(m, stack(2L), ValueSet.single(8, 0x55L));
		assertEquals(1, m.size());
		assertTrue(m.read(32, stack(0L)).isTop());
		assertEquals(ValueSet.single(8, 0x55L), m.read(8, stack(2L)));
	}

	@Test
	public void testReadCombinesBytes() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), ValueSet.single(8, 0x34L));
		m = write(m, stack(1L), ValueSet.single(8, 0x12L));
		assertEquals(ValueSet.single(16, 0x1234L), m.read(16, stack(0L)));
		// a wider entry cannot be read partially
		assertTrue(write(m, stack(0L), ValueSet.single(16, 1L)).read(8, stack(0L)).isTop());
	}

	@Test
	public void testWeakUpdate() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(1L));
		m = write(m, stack(4L), num(2L));
		m = write(m, stack(4L, 0L, 4L), num(3L));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 2L, 1L, 3L)), m.read(32, stack(0L)));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 1L, 2L, 3L)), m.read(32, stack(4L)));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 1L, 1L, 3L)), m.read(32, stack(4L, 0L, 4L)));
		assertEquals(1L, statistic.getWeakUpdateCount());
	}

	@Test
	public void testWeakUpdateOfUnknownRegion() {
		assertTrue(write(AbstractMemory.TOP, stack(4L, 0L, 4L), num(3L)).isTop());
	}

	@Test
	public void testReadOfPartlyKnownAddress() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(1L));
		assertTrue(m.read(32, stack(4L, 0L, 4L)).isTop());
	}

	@Test
	public void testWriteToWholeRegion() {
		MemoryRegion heap = regions.createRegion("heap");
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(1L));
		m = write(m, ValueSet.of(heap, StridedInterval.single(32, 0L)), num(2L));
		m = write(m, ValueSet.of(stack, StridedInterval.top(32)), num(3L));
		assertTrue(m.read(32, stack(0L)).isTop());
		assertEquals(num(2L), m.read(32, ValueSet.of(heap, StridedInterval.single(32, 0L))));
		assertEquals(1L, statistic.getMemoryCollapseCount());
	}

	@Test
	public void testWriteToUnknownAddress() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(1L));
		assertTrue(write(m, ValueSet.top(32), num(3L)).isTop());
		assertTrue(m.write(ValueSet.top(32), num(3L), new Optional<>(16), statistic).isTop());
		assertEquals(2L, statistic.getMemoryCollapseCount());
	}

	@Test
	public void testByteWriteToUnknownAddress() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), ValueSet.single(8, 1L));
		m = write(m, stack(4L), num(7L));
		AbstractMemory weak = write(m, ValueSet.top(32), ValueSet.single(8, 3L));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(8, 2L, 1L, 3L)), weak.read(8, stack(0L)));
		// a byte may land inside the word
		assertTrue(weak.read(32, stack(4L)).isTop());
		assertEquals(1, weak.size());
	}

	@Test
	public void testWordWriteToUnknownAddressCoversMixedBytes() {
		AbstractMemory m = AbstractMemory.TOP;
		for (long offset = 0L; offset < 8L; offset++) {
			m = write(m, stack(offset), ValueSet.single(8, 0x11L));
		}
		assertEquals(num(0x11111111L), m.read(32, stack(0L)));
		AbstractMemory weak = write(m, ValueSet.top(32), num(0L));
		ValueSet read = weak.read(32, stack(0L));
		// the word may have been written at offset 2, leaving 11 11 00 00
		assertTrue(read.toString(), num(0x1111L).lessOrEqual(read));
		assertTrue(num(0x11111111L).lessOrEqual(read));
		assertTrue(num(0L).lessOrEqual(read));
	}

	@Test
	public void testRegionLimit() {
		Optional<Integer> limit = new Optional<>(2);
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), num(1L));
		assertTrue(m.write(stack(4L, 0L, 8L), num(2L), limit, statistic).isTop());
		assertFalse(m.write(stack(4L, 0L, 4L), num(2L), limit, statistic).isTop());
	}

	@Test
	public void testUnionDropsOneSidedEntries() {
		AbstractMemory a = write(write(AbstractMemory.TOP, stack(0L), num(1L)), stack(4L), num(2L));
		AbstractMemory b = write(AbstractMemory.TOP, stack(0L), num(3L));
		AbstractMemory joined = a.union(b);
		assertEquals(1, joined.size());
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 2L, 1L, 3L)), joined.read(32, stack(0L)));
		assertTrue(joined.read(32, stack(4L)).isTop());
		assertSame(a, a.union(a));
	}

	@Test
	public void testUnionDropsWidthMismatch() {
		AbstractMemory a = write(AbstractMemory.TOP, stack(0L), num(1L));
		AbstractMemory b = write(AbstractMemory.TOP, stack(0L), ValueSet.single(8, 1L));
		assertTrue(a.union(b).isTop());
	}

	@Test
	public void testIntersectionKeepsOneSidedEntries() {
		AbstractMemory a = write(write(AbstractMemory.TOP, stack(0L), num(1L)), stack(4L), num(2L));
		AbstractMemory b = write(AbstractMemory.TOP, stack(0L),
				ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 10L)));
		AbstractMemory met = a.intersection(b);
		assertEquals(2, met.size());
		assertEquals(num(1L), met.read(32, stack(0L)));
		assertEquals(num(2L), met.read(32, stack(4L)));
	}

	@Test
	public void testWiden() {
		AbstractMemory a = write(AbstractMemory.TOP, stack(0L), num(0L));
		AbstractMemory b = write(AbstractMemory.TOP, stack(0L), ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 1L)));
		AbstractMemory widened = a.widen(b);
		assertEquals(ValueSet.ofInterval(StridedInterval.aboveEq(32, 0L)), widened.read(32, stack(0L)));
	}

	@Test
	public void testWriteIntersection() {
		AbstractMemory m = write(AbstractMemory.TOP, stack(0L), ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 100L)));
		AbstractMemory narrowed = m.writeIntersection(stack(0L), ValueSet.ofInterval(StridedInterval.below(32, 10L)));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 9L)), narrowed.read(32, stack(0L)));
		// an unknown location takes the narrowed value
		AbstractMemory fresh = AbstractMemory.TOP.writeIntersection(stack(0L), num(7L));
		assertEquals(num(7L), fresh.read(32, stack(0L)));
		assertSame(m, m.writeIntersection(stack(4L, 0L, 4L), num(7L)));
	}

	@Test
	public void testToString() {
		assertEquals("[top memory]", AbstractMemory.TOP.toString());
		assertEquals("[R_ESP#1+0 -> 5:u32]", write(AbstractMemory.TOP, stack(0L), num(5L)).toString());
	}
}
