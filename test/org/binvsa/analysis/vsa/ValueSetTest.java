package org.binvsa.analysis.vsa;

import org.binvsa.ssa.BinaryOperator;
import org.binvsa.ssa.CastType;
import org.binvsa.ssa.UnaryOperator;
import org.binvsa.util.Optional;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ValueSetTest {

	private MemoryRegion stack;
	private MemoryRegion heap;

	@Before
	public void setUp() {
		RegionTable regions = new RegionTable();
		stack = regions.getRegion("R_ESP");
		heap = regions.createRegion("heap");
	}

	private static ValueSet num(long value) {
		return ValueSet.single(32, value);
	}

	private ValueSet stack(long offset) {
		return ValueSet.of(stack, StridedInterval.single(32, offset));
	}

	@Test
	public void testRegionTable() {
		RegionTable regions = new RegionTable();
		MemoryRegion a = regions.getRegion("R_ESP");
		assertSame(a, regions.getRegion("R_ESP"));
		MemoryRegion b = regions.createRegion("heap");
		MemoryRegion c = regions.createRegion("heap");
		assertFalse(b.equals(c));
		assertTrue(MemoryRegion.GLOBAL.compareTo(a) < 0);
		assertTrue(a.compareTo(b) < 0);
		assertEquals(3, regions.size());
	}

	@Test
	public void testCreateDropsEmptyIntervals() {
		Map<MemoryRegion, StridedInterval> entries = new HashMap<>();
		entries.put(MemoryRegion.GLOBAL, StridedInterval.empty(32));
		entries.put(stack, StridedInterval.single(32, 4L));
		ValueSet vs = ValueSet.create(32, entries);
		assertEquals(stack(4L), vs);
		assertNull(vs.get(MemoryRegion.GLOBAL));

		entries.put(stack, StridedInterval.empty(32));
		assertTrue(ValueSet.create(32, entries).isEmpty());
	}

	@Test(expected = BitWidthMismatchException.class)
	public void testCreateRejectsWidthMismatch() {
		Map<MemoryRegion, StridedInterval> entries = new HashMap<>();
		entries.put(stack, StridedInterval.single(16, 4L));
		ValueSet.create(32, entries);
	}

	@Test
	public void testTopAbsorbsUnion() {
		assertTrue(ValueSet.top(32).union(num(1L)).isTop());
		assertTrue(num(1L).union(ValueSet.top(32)).isTop());
		assertEquals(num(1L), ValueSet.empty(32).union(num(1L)));
	}

	@Test
	public void testPointerArithmetic() {
		assertEquals(stack(-4L), stack(0L).add(num(-4L)));
		assertEquals(stack(-4L), num(-4L).add(stack(0L)));
		assertEquals(stack(8L), stack(12L).sub(num(4L)));
		assertTrue(stack(0L).add(stack(4L)).isTop());
		// the distance of two pointers into one region is a number
		assertEquals(num(8L), stack(8L).sub(stack(0L)));
		assertTrue(num(8L).sub(stack(0L)).isTop());
	}

	@Test
	public void testPointersDoNotWrap() {
		StridedInterval offsets = StridedInterval.create(32, 1L, 0L, Bits.maxSigned(32));
		ValueSet vs = ValueSet.of(stack, offsets).add(num(1L));
		assertEquals(StridedInterval.create(32, 1L, 1L, Bits.maxSigned(32)), vs.get(stack));
		assertTrue(ValueSet.ofInterval(offsets).add(num(1L)).isTop());
	}

	@Test
	public void testBitwiseOnPointers() {
		assertEquals(stack(4L), stack(4L).and(num(-1L)));
		assertEquals(num(0L), stack(4L).and(num(0L)));
		assertEquals(stack(4L), stack(4L).or(num(0L)));
		assertEquals(num(-1L), num(-1L).or(stack(4L)));
		assertEquals(stack(4L), stack(4L).xor(num(0L)));
		assertTrue(stack(4L).or(num(5L)).isTop());
		assertEquals(num(7L), num(5L).or(num(3L)));
	}

	@Test
	public void testEq() {
		ValueSet yes = ValueSet.ofInterval(StridedInterval.YES);
		ValueSet no = ValueSet.ofInterval(StridedInterval.NO);
		ValueSet maybe = ValueSet.ofInterval(StridedInterval.MAYBE);
		assertEquals(yes, stack(4L).eq(stack(4L)));
		assertEquals(no, stack(4L).eq(stack(8L)));
		// different regions may alias
		assertEquals(maybe, stack(4L).eq(num(4L)));
		assertEquals(maybe, ValueSet.of(heap, StridedInterval.single(32, 0L)).eq(stack(0L)));
		assertEquals(no, num(1L).neq(num(1L)));
		assertEquals(1, num(1L).eq(num(2L)).getBitWidth());
	}

	@Test
	public void testBinopOnNumbers() {
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 4L)), num(11L).binop(BinaryOperator.MOD, num(5L)));
		assertEquals(num(3L), num(3L).binop(BinaryOperator.MOD, num(5L)));
		assertEquals(num(16L), num(4L).binop(BinaryOperator.LSHIFT, num(2L)));
		assertEquals(num(-5L), num(5L).unop(UnaryOperator.NEG));
		assertTrue(num(5L).binop(BinaryOperator.MOD, ValueSet.empty(32)).isEmpty());
	}

	@Test(expected = UnimplementedOperationException.class)
	public void testUnsupportedOperator() {
		num(3L).binop(BinaryOperator.TIMES, num(4L));
	}

	@Test(expected = UnimplementedOperationException.class)
	public void testShiftOfPointer() {
		stack(4L).binop(BinaryOperator.LSHIFT, num(1L));
	}

	@Test
	public void testCasts() {
		ValueSet v = stack(4L);
		assertSame(v, v.cast(CastType.UNSIGNED, 32));
		assertEquals(ValueSet.single(8, 0x34L), ValueSet.single(16, 0x1234L).cast(CastType.LOW, 8));
		assertEquals(ValueSet.single(8, 0x12L), ValueSet.single(16, 0x1234L).extract(15, 8));
		assertEquals(ValueSet.single(16, 0x1234L), ValueSet.single(8, 0x12L).concat(ValueSet.single(8, 0x34L)));
	}

	@Test(expected = UnimplementedOperationException.class)
	public void testCastOfPointer() {
		stack(4L).cast(CastType.LOW, 16);
	}

	@Test
	public void testUnionKeepsRegions() {
		ValueSet vs = stack(0L).union(num(5L));
		assertEquals(2, vs.getEntries().size());
		assertEquals(StridedInterval.single(32, 0L), vs.get(stack));
		assertEquals(StridedInterval.single(32, 5L), vs.get(MemoryRegion.GLOBAL));
		assertFalse(vs.isSingleRegion());
		assertEquals(ValueSet.of(stack, StridedInterval.create(32, 8L, 0L, 8L)), stack(0L).union(stack(8L)));
	}

	@Test
	public void testIntersection() {
		ValueSet range = ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 100L));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 9L)),
				range.intersection(ValueSet.ofInterval(StridedInterval.below(32, 10L))));
		assertSame(range, range.intersection(ValueSet.top(32)));
		assertTrue(num(3L).intersection(num(4L)).isEmpty());
		ValueSet both = stack(0L).union(num(5L));
		assertEquals(stack(0L), both.intersection(stack(0L)));
		assertEquals(num(5L), num(5L).intersection(both));
	}

	@Test
	public void testIntersectionIsContainedInBothOperands() {
		ValueSet pointer = stack(0L);
		ValueSet number = num(5L);
		assertTrue(pointer.intersection(number).isEmpty());
		assertTrue(number.intersection(pointer).isEmpty());

		List<ValueSet> samples = Arrays.asList(pointer, number, pointer.union(number),
				ValueSet.of(stack, StridedInterval.create(32, 4L, 0L, 16L)).union(num(1L)),
				ValueSet.of(heap, StridedInterval.create(32, 1L, -8L, 8L)),
				ValueSet.ofInterval(StridedInterval.below(32, 3L)), ValueSet.top(32));
		for (ValueSet a : samples) {
			for (ValueSet b : samples) {
				ValueSet met = a.intersection(b);
				assertTrue(a + " meet " + b, met.lessOrEqual(a));
				assertTrue(a + " meet " + b, met.lessOrEqual(b));
			}
		}
	}

	@Test
	public void testWiden() {
		ValueSet widened = num(0L).widen(ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 1L)));
		assertEquals(ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, Bits.maxSigned(32))), widened);
		assertEquals(stack(4L).union(num(1L)), stack(4L).widen(num(1L)));
	}

	@Test(expected = BitWidthMismatchException.class)
	public void testUnionWidthMismatch() {
		num(1L).union(ValueSet.single(16, 1L));
	}

	@Test
	public void testLessOrEqual() {
		assertTrue(stack(4L).lessOrEqual(stack(4L).union(num(1L))));
		assertFalse(stack(4L).lessOrEqual(num(4L)));
		assertTrue(ValueSet.empty(32).lessOrEqual(stack(4L)));
		assertTrue(stack(4L).lessOrEqual(ValueSet.top(32)));
	}

	@Test
	public void testConcretize() {
		ValueSet vs = ValueSet.ofInterval(StridedInterval.create(32, 4L, 0L, 8L));
		Optional<List<Long>> values = vs.concretize(5L);
		assertTrue(values.hasValue());
		assertEquals(Arrays.asList(0L, 4L, 8L), values.getValue());
		assertFalse(vs.concretize(2L).hasValue());
		assertFalse(stack(0L).concretize(10L).hasValue());
		assertEquals(3L, vs.size());
	}

	@Test
	public void testLocations() {
		ValueSet vs = ValueSet.of(stack, StridedInterval.create(32, 4L, 0L, 8L)).union(num(1L));
		List<AbstractLocation> locations = new ArrayList<>();
		for (AbstractLocation l : vs.locations()) {
			locations.add(l);
		}
		assertEquals(Arrays.asList(new AbstractLocation(MemoryRegion.GLOBAL, 1L), new AbstractLocation(stack, 0L),
				new AbstractLocation(stack, 4L), new AbstractLocation(stack, 8L)), locations);
		assertFalse(ValueSet.empty(32).locations().iterator().hasNext());
	}

	@Test
	public void testRemoveBounds() {
		ValueSet vs = ValueSet.ofInterval(StridedInterval.create(32, 1L, 0L, 9L));
		assertEquals(ValueSet.ofInterval(StridedInterval.belowEq(32, 9L)), vs.removeLowerBound());
		assertEquals(ValueSet.ofInterval(StridedInterval.aboveEq(32, 0L)), vs.removeUpperBound());
	}

	@Test
	public void testToString() {
		assertEquals("5:u32", num(5L).toString());
		assertEquals("{$ -> 1:u32, R_ESP#1 -> 0:u32}", stack(0L).union(num(1L)).toString());
	}
}
