package org.binvsa.analysis.vsa;

import org.binvsa.ssa.BinaryOperator;
import org.binvsa.ssa.CastType;
import org.binvsa.ssa.UnaryOperator;
import org.binvsa.util.Optional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NoSuchElementException;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A value set: a strided interval of offsets for every memory region the value may be
 * based on. Plain numbers are offsets into the global region. Immutable.
 *
 * <p>Value sets never contain empty intervals, except for the empty value set itself,
 * which is the empty interval in the global region.</p>
 */
public final class ValueSet {

	private final int bitWidth;
	private final SortedMap<MemoryRegion, StridedInterval> entries;

	private ValueSet(int bitWidth, SortedMap<MemoryRegion, StridedInterval> entries) {
		assert !entries.isEmpty();
		this.bitWidth = bitWidth;
		this.entries = Collections.unmodifiableSortedMap(entries);
	}

	/**
	 * Create a value set from region entries. Empty intervals are dropped.
	 */
	public static ValueSet create(int bitWidth, Map<MemoryRegion, StridedInterval> entries) {
		SortedMap<MemoryRegion, StridedInterval> map = new TreeMap<>();
		for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
			StridedInterval si = entry.getValue();
			if (si.getBitWidth() != bitWidth) {
				throw new BitWidthMismatchException(bitWidth, si.getBitWidth());
			}
			if (!si.isEmpty()) {
				map.put(entry.getKey(), si);
			}
		}
		if (map.isEmpty()) {
			return empty(bitWidth);
		}
		return new ValueSet(bitWidth, map);
	}

	public static ValueSet of(MemoryRegion region, StridedInterval si) {
		SortedMap<MemoryRegion, StridedInterval> map = new TreeMap<>();
		if (si.isEmpty()) {
			map.put(MemoryRegion.GLOBAL, si);
		} else {
			map.put(region, si);
		}
		return new ValueSet(si.getBitWidth(), map);
	}

	public static ValueSet ofInterval(StridedInterval si) {
		return of(MemoryRegion.GLOBAL, si);
	}

	public static ValueSet top(int bitWidth) {
		return ofInterval(StridedInterval.top(bitWidth));
	}

	public static ValueSet empty(int bitWidth) {
		return ofInterval(StridedInterval.empty(bitWidth));
	}

	public static ValueSet single(int bitWidth, long value) {
		return ofInterval(StridedInterval.single(bitWidth, value));
	}

	public int getBitWidth() {
		return bitWidth;
	}

	public SortedMap<MemoryRegion, StridedInterval> getEntries() {
		return entries;
	}

	/**
	 * @return The interval for the region, or null if the value cannot point into it.
	 */
	public StridedInterval get(MemoryRegion region) {
		if (isEmpty()) {
			return null;
		}
		return entries.get(region);
	}

	public boolean isTop() {
		return isGlobal() && getGlobalInterval().isTop();
	}

	public boolean isEmpty() {
		return isGlobal() && getGlobalInterval().isEmpty();
	}

	/**
	 * @return True if the value set only consists of plain numbers.
	 */
	public boolean isGlobal() {
		return entries.size() == 1 && entries.firstKey().isGlobal();
	}

	public boolean isSingleRegion() {
		return entries.size() == 1;
	}

	public StridedInterval getGlobalInterval() {
		assert isGlobal() : "Not a global value set: " + this;
		return entries.get(MemoryRegion.GLOBAL);
	}

	private StridedInterval globalOperand(String operation) {
		if (!isGlobal()) {
			throw new UnimplementedOperationException(operation + " on pointer value set " + this);
		}
		return getGlobalInterval();
	}

	private void checkCompatible(ValueSet other) {
		if (bitWidth != other.bitWidth) {
			throw new BitWidthMismatchException(bitWidth, other.bitWidth);
		}
	}

	private static ValueSet addOffset(ValueSet vs, StridedInterval offset) {
		Map<MemoryRegion, StridedInterval> result = new TreeMap<>();
		for (Entry<MemoryRegion, StridedInterval> entry : vs.entries.entrySet()) {
			MemoryRegion r = entry.getKey();
			// pointers are assumed not to wrap around their region
			result.put(r, entry.getValue().add(offset, r.isGlobal()));
		}
		return create(vs.bitWidth, result);
	}

	public ValueSet add(ValueSet other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		if (other.isGlobal()) {
			return addOffset(this, other.getGlobalInterval());
		}
		if (isGlobal()) {
			return addOffset(other, getGlobalInterval());
		}
		return top(bitWidth);
	}

	public ValueSet sub(ValueSet other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		if (other.isGlobal()) {
			StridedInterval offset = other.getGlobalInterval();
			Map<MemoryRegion, StridedInterval> result = new TreeMap<>();
			for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
				result.put(entry.getKey(), entry.getValue().sub(offset));
			}
			return create(bitWidth, result);
		}
		if (isSingleRegion() && other.isSingleRegion() && entries.firstKey().equals(other.entries.firstKey())) {
			// difference of two pointers into the same region
			return ofInterval(entries.get(entries.firstKey()).sub(other.entries.get(entries.firstKey())));
		}
		return top(bitWidth);
	}

	private boolean isGlobalValue(StridedInterval si) {
		return isGlobal() && getGlobalInterval().equals(si);
	}

	/**
	 * Bitwise operators on pointers are only defined for their identity and
	 * annihilator.
	 */
	private ValueSet bitwise(BinaryOperator op, ValueSet other, StridedInterval identity, StridedInterval annihilator) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		if (isGlobal() && other.isGlobal()) {
			return ofInterval(getGlobalInterval().binop(op, other.getGlobalInterval()));
		}
		if (isGlobalValue(identity)) {
			return other;
		}
		if (other.isGlobalValue(identity)) {
			return this;
		}
		if (annihilator != null && (isGlobalValue(annihilator) || other.isGlobalValue(annihilator))) {
			return ofInterval(annihilator);
		}
		return top(bitWidth);
	}

	public ValueSet and(ValueSet other) {
		return bitwise(BinaryOperator.AND, other, StridedInterval.minusOne(bitWidth), StridedInterval.zero(bitWidth));
	}

	public ValueSet or(ValueSet other) {
		return bitwise(BinaryOperator.OR, other, StridedInterval.zero(bitWidth), StridedInterval.minusOne(bitWidth));
	}

	public ValueSet xor(ValueSet other) {
		return bitwise(BinaryOperator.XOR, other, StridedInterval.zero(bitWidth), null);
	}

	/**
	 * Compare two value sets. Values based on different regions may still alias, so
	 * they compare as maybe equal.
	 *
	 * @param other Other value set.
	 * @return A one bit value set holding yes, no or maybe.
	 */
	public ValueSet eq(ValueSet other) {
		checkCompatible(other);
		if (isEmpty() || other.isEmpty()) {
			return empty(1);
		}
		if (isSingleRegion() && other.isSingleRegion() && entries.firstKey().equals(other.entries.firstKey())) {
			return ofInterval(entries.get(entries.firstKey()).eq(other.entries.get(entries.firstKey())));
		}
		if (isTop() || other.isTop()) {
			return ofInterval(StridedInterval.MAYBE);
		}
		boolean maybe = false;
		for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
			StridedInterval otherSi = other.entries.get(entry.getKey());
			if (otherSi == null || !entry.getValue().eq(otherSi).equals(StridedInterval.NO)) {
				maybe = true;
			}
		}
		for (MemoryRegion r : other.entries.keySet()) {
			if (!entries.containsKey(r)) {
				maybe = true;
			}
		}
		return ofInterval(maybe ? StridedInterval.MAYBE : StridedInterval.NO);
	}

	public ValueSet neq(ValueSet other) {
		ValueSet eq = eq(other);
		return ofInterval(eq.getGlobalInterval().not());
	}

	/**
	 * Apply a binary operator.
	 *
	 * @throws UnimplementedOperationException if the operator is not defined on the operands.
	 */
	public ValueSet binop(BinaryOperator op, ValueSet other) {
		switch (op) {
		case PLUS:
			return add(other);
		case MINUS:
			return sub(other);
		case AND:
			return and(other);
		case OR:
			return or(other);
		case XOR:
			return xor(other);
		case EQ:
			return eq(other);
		case NEQ:
			return neq(other);
		default:
			if (isEmpty() || other.isEmpty()) {
				return empty(op.isComparison() ? 1 : bitWidth);
			}
			return ofInterval(globalOperand(op.name()).binop(op, other.globalOperand(op.name())));
		}
	}

	public ValueSet unop(UnaryOperator op) {
		return ofInterval(globalOperand(op.name()).unop(op));
	}

	public ValueSet cast(CastType type, int toBitWidth) {
		if (toBitWidth == bitWidth) {
			return this;
		}
		return ofInterval(globalOperand("Cast " + type).cast(type, toBitWidth));
	}

	public ValueSet extract(int high, int low) {
		return ofInterval(globalOperand("Extract").extract(high, low));
	}

	/**
	 * @param low The low part.
	 * @return this @ low.
	 */
	public ValueSet concat(ValueSet low) {
		return ofInterval(globalOperand("Concat").concat(low.globalOperand("Concat")));
	}

	public ValueSet union(ValueSet other) {
		checkCompatible(other);
		if (equals(other)) {
			return this;
		}
		if (isTop() || other.isTop()) {
			return top(bitWidth);
		}
		if (isEmpty()) {
			return other;
		}
		if (other.isEmpty()) {
			return this;
		}
		Map<MemoryRegion, StridedInterval> result = new TreeMap<>(entries);
		for (Entry<MemoryRegion, StridedInterval> entry : other.entries.entrySet()) {
			StridedInterval mine = result.get(entry.getKey());
			result.put(entry.getKey(), mine == null ? entry.getValue() : mine.union(entry.getValue()));
		}
		return create(bitWidth, result);
	}

	/**
	 * Intersection. Only regions present in both value sets survive, so a pointer
	 * intersected with a plain number is empty.
	 */
	public ValueSet intersection(ValueSet other) {
		checkCompatible(other);
		if (equals(other) || other.isTop()) {
			return this;
		}
		if (isTop()) {
			return other;
		}
		if (isEmpty() || other.isEmpty()) {
			return empty(bitWidth);
		}
		Map<MemoryRegion, StridedInterval> result = new TreeMap<>();
		for (Entry<MemoryRegion, StridedInterval> entry : other.entries.entrySet()) {
			StridedInterval mine = entries.get(entry.getKey());
			if (mine != null) {
				result.put(entry.getKey(), mine.intersection(entry.getValue()));
			}
		}
		return create(bitWidth, result);
	}

	/**
	 * Widen this value set by a newer one. Regions only present in one value set are kept.
	 */
	public ValueSet widen(ValueSet newer) {
		checkCompatible(newer);
		if (equals(newer)) {
			return this;
		}
		if (isTop() || newer.isTop()) {
			return top(bitWidth);
		}
		Map<MemoryRegion, StridedInterval> result = new TreeMap<>(entries);
		for (Entry<MemoryRegion, StridedInterval> entry : newer.entries.entrySet()) {
			StridedInterval mine = result.get(entry.getKey());
			result.put(entry.getKey(), mine == null ? entry.getValue() : mine.widen(entry.getValue()));
		}
		return create(bitWidth, result);
	}

	/**
	 * Forget the lower bound of every region.
	 */
	public ValueSet removeLowerBound() {
		Map<MemoryRegion, StridedInterval> result = new TreeMap<>();
		for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
			result.put(entry.getKey(), entry.getValue().removeLowerBound());
		}
		return create(bitWidth, result);
	}

	/**
	 * Forget the upper bound of every region.
	 */
	public ValueSet removeUpperBound() {
		Map<MemoryRegion, StridedInterval> result = new TreeMap<>();
		for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
			result.put(entry.getKey(), entry.getValue().removeUpperBound());
		}
		return create(bitWidth, result);
	}

	/**
	 * @return True if every value of this set is contained in other.
	 */
	public boolean lessOrEqual(ValueSet other) {
		checkCompatible(other);
		if (isEmpty() || other.isTop()) {
			return true;
		}
		for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
			StridedInterval otherSi = other.get(entry.getKey());
			if (otherSi == null || !entry.getValue().lessOrEqual(otherSi)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Number of concrete region/offset pairs, saturating at {@link Long#MAX_VALUE}.
	 */
	public long size() {
		if (isEmpty()) {
			return 0L;
		}
		long size = 0L;
		for (StridedInterval si : entries.values()) {
			size += si.size();
			if (size < 0L) {
				return Long.MAX_VALUE;
			}
		}
		return size;
	}

	/**
	 * Enumerate the numbers in this value set.
	 *
	 * @param max Maximum number of values.
	 * @return The values, or nothing if the set is larger or contains pointers.
	 */
	public Optional<List<Long>> concretize(long max) {
		if (!isGlobal() || getGlobalInterval().size() > max) {
			return Optional.none();
		}
		List<Long> values = new ArrayList<>();
		for (Long v : getGlobalInterval()) {
			values.add(v);
		}
		return new Optional<>(values);
	}

	/**
	 * @return All region/offset pairs of this value set, lazily.
	 */
	public Iterable<AbstractLocation> locations() {
		return new Iterable<AbstractLocation>() {
			@Override
			public Iterator<AbstractLocation> iterator() {
				final Iterator<Entry<MemoryRegion, StridedInterval>> regions = isEmpty()
						? Collections.<Entry<MemoryRegion, StridedInterval>>emptyIterator()
						: entries.entrySet().iterator();
				return new Iterator<AbstractLocation>() {
					private MemoryRegion region;
					private Iterator<Long> offsets = Collections.<Long>emptyIterator();

					@Override
					public boolean hasNext() {
						while (!offsets.hasNext() && regions.hasNext()) {
							Entry<MemoryRegion, StridedInterval> next = regions.next();
							region = next.getKey();
							offsets = next.getValue().iterator();
						}
						return offsets.hasNext();
					}

					@Override
					public AbstractLocation next() {
						if (!hasNext()) {
							throw new NoSuchElementException();
						}
						return new AbstractLocation(region, offsets.next());
					}

					@Override
					public void remove() {
						throw new UnsupportedOperationException();
					}
				};
			}
		};
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ValueSet)) {
			return false;
		}
		ValueSet other = (ValueSet) obj;
		return bitWidth == other.bitWidth && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return bitWidth * 31 + entries.hashCode();
	}

	@Override
	public String toString() {
		if (isGlobal()) {
			return getGlobalInterval().toString();
		}
		StringBuilder res = new StringBuilder("{");
		boolean first = true;
		for (Entry<MemoryRegion, StridedInterval> entry : entries.entrySet()) {
			if (!first) {
				res.append(", ");
			}
			first = false;
			res.append(entry.getKey()).append(" -> ").append(entry.getValue());
		}
		return res.append('}').toString();
	}
}
