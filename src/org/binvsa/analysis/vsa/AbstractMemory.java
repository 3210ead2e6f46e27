package org.binvsa.analysis.vsa;

import org.binvsa.analysis.vsa.statistic.Statistic;
import org.binvsa.util.Logger;
import org.binvsa.util.Optional;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Sparse abstract memory, mapping regions to byte offsets to value sets. A missing
 * region or offset means the contents are unknown (top). Immutable; updates return a
 * new memory sharing unchanged regions.
 */
public final class AbstractMemory {

	private static final Logger logger = Logger.getLogger(AbstractMemory.class);

	/** Memory where nothing is known. */
	public static final AbstractMemory TOP = new AbstractMemory(new TreeMap<MemoryRegion, SortedMap<Long, ValueSet>>());

	/** Merge function for two entries at the same location. */
	private interface EntryMerge {
		ValueSet apply(ValueSet a, ValueSet b);
	}

	private final SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> regions;

	private AbstractMemory(SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> regions) {
		this.regions = regions;
	}

	public boolean isTop() {
		return regions.isEmpty();
	}

	/**
	 * @return The stored entries of a region, empty if nothing is known about it.
	 */
	public SortedMap<Long, ValueSet> getRegion(MemoryRegion region) {
		SortedMap<Long, ValueSet> r = regions.get(region);
		if (r == null) {
			return Collections.emptySortedMap();
		}
		return Collections.unmodifiableSortedMap(r);
	}

	public Iterable<MemoryRegion> getRegions() {
		return Collections.unmodifiableSet(regions.keySet());
	}

	/**
	 * @return Number of stored entries over all regions.
	 */
	public int size() {
		int size = 0;
		for (SortedMap<Long, ValueSet> r : regions.values()) {
			size += r.size();
		}
		return size;
	}

	/**
	 * Read the value of the given width at one location. Entries narrower than the
	 * width are combined with the following bytes, least significant byte first.
	 *
	 * @param bitWidth Width of the value to read.
	 * @param location The location.
	 * @return The value.
	 */
	public ValueSet readConcrete(int bitWidth, AbstractLocation location) {
		SortedMap<Long, ValueSet> r = regions.get(location.getRegion());
		ValueSet v = r == null ? null : r.get(location.getOffset());
		if (v == null) {
			return ValueSet.top(bitWidth);
		}
		int w = v.getBitWidth();
		if (w == bitWidth) {
			return v;
		}
		if (w > bitWidth || w % 8 != 0) {
			return ValueSet.top(bitWidth);
		}
		ValueSet rest = readConcrete(bitWidth - w, new AbstractLocation(location.getRegion(), location.getOffset() + w / 8));
		try {
			return rest.concat(v);
		} catch (UnimplementedOperationException e) {
			logger.debug("Cannot combine " + rest + " and " + v + " at " + location, e);
			return ValueSet.top(bitWidth);
		}
	}

	/**
	 * Read a value of the given width from all locations of an address.
	 *
	 * @param bitWidth Width of the value to read.
	 * @param address Address value set.
	 * @return The union of the values at all addresses.
	 */
	public ValueSet read(int bitWidth, ValueSet address) {
		if (address.isEmpty()) {
			return ValueSet.empty(bitWidth);
		}
		if (address.isTop()) {
			return ValueSet.top(bitWidth);
		}
		for (Entry<MemoryRegion, StridedInterval> entry : address.getEntries().entrySet()) {
			SortedMap<Long, ValueSet> r = regions.get(entry.getKey());
			if (r == null || entry.getValue().size() > r.size()) {
				// at least one location is not stored
				return ValueSet.top(bitWidth);
			}
		}
		ValueSet result = ValueSet.empty(bitWidth);
		for (AbstractLocation loc : address.locations()) {
			result = result.union(readConcrete(bitWidth, loc));
			if (result.isTop()) {
				break;
			}
		}
		return result;
	}

	/**
	 * Write a value to all locations of an address.
	 *
	 * @param address Address value set.
	 * @param value The value.
	 * @param regionLimit Maximum number of entries in a region, or nothing for no limit.
	 * @param statistic Counters to update.
	 * @return The updated memory.
	 */
	public AbstractMemory write(ValueSet address, ValueSet value, Optional<Integer> regionLimit, Statistic statistic) {
		if (address.isEmpty()) {
			return this;
		}
		if (address.isTop()) {
			// a value wider than a byte may land across any stored entry
			if (value.isTop() || regionLimit.hasValue() || byteSize(value.getBitWidth()) > 1) {
				statistic.countMemoryCollapse();
				return TOP;
			}
			SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> result = new TreeMap<>();
			for (Entry<MemoryRegion, SortedMap<Long, ValueSet>> r : regions.entrySet()) {
				SortedMap<Long, ValueSet> updated = new TreeMap<>();
				for (Entry<Long, ValueSet> e : r.getValue().entrySet()) {
					if (e.getValue().getBitWidth() != value.getBitWidth()) {
						continue;
					}
					ValueSet merged = e.getValue().union(value);
					if (!merged.isTop()) {
						updated.put(e.getKey(), merged);
					}
				}
				if (!updated.isEmpty()) {
					result.put(r.getKey(), updated);
				}
			}
			statistic.countWeakUpdate();
			return new AbstractMemory(result);
		}
		if (address.isSingleRegion()) {
			MemoryRegion region = address.getEntries().firstKey();
			StridedInterval offsets = address.getEntries().get(region);
			if (offsets.isTop()) {
				// any offset of the region may be overwritten
				statistic.countMemoryCollapse();
				return removeRegion(region);
			}
			if (offsets.isSingleton()) {
				statistic.countStrongUpdate();
				return writeStrong(new AbstractLocation(region, offsets.getLowerBound()), value);
			}
		}
		if (regionLimit.hasValue() && address.size() > regionLimit.getValue()) {
			statistic.countMemoryCollapse();
			return TOP;
		}
		AbstractMemory result = writeWeak(address, value);
		statistic.countWeakUpdate();
		if (regionLimit.hasValue()) {
			result = result.enforceLimit(regionLimit.getValue(), statistic);
		}
		return result;
	}

	/**
	 * Narrow the value at a single location with an intersection. Does nothing for
	 * addresses with more than one location.
	 */
	public AbstractMemory writeIntersection(ValueSet address, ValueSet value) {
		if (address.isEmpty() || !address.isSingleRegion()) {
			return this;
		}
		MemoryRegion region = address.getEntries().firstKey();
		StridedInterval offsets = address.getEntries().get(region);
		if (!offsets.isSingleton()) {
			return this;
		}
		AbstractLocation loc = new AbstractLocation(region, offsets.getLowerBound());
		ValueSet old = readConcrete(value.getBitWidth(), loc);
		return writeStrong(loc, old.intersection(value));
	}

	private AbstractMemory writeWeak(ValueSet address, ValueSet value) {
		SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> result = new TreeMap<>(regions);
		for (Entry<MemoryRegion, StridedInterval> entry : address.getEntries().entrySet()) {
			MemoryRegion region = entry.getKey();
			SortedMap<Long, ValueSet> old = regions.get(region);
			if (old == null) {
				// every location of the region stays top
				continue;
			}
			TreeMap<Long, ValueSet> updated = new TreeMap<>(old);
			for (Long offset : entry.getValue()) {
				ValueSet merged = readConcrete(value.getBitWidth(), new AbstractLocation(region, offset)).union(value);
				removeOverlapping(updated, offset, value.getBitWidth());
				if (!merged.isTop()) {
					updated.put(offset, merged);
				}
			}
			if (updated.isEmpty()) {
				result.remove(region);
			} else {
				result.put(region, updated);
			}
		}
		return new AbstractMemory(result);
	}

	private AbstractMemory writeStrong(AbstractLocation loc, ValueSet value) {
		SortedMap<Long, ValueSet> r = regions.get(loc.getRegion());
		ValueSet old = r == null ? null : r.get(loc.getOffset());
		if (value.equals(old)) {
			return this;
		}
		if (r == null && value.isTop()) {
			return this;
		}
		TreeMap<Long, ValueSet> updated = r == null ? new TreeMap<Long, ValueSet>() : new TreeMap<>(r);
		removeOverlapping(updated, loc.getOffset(), value.getBitWidth());
		if (!value.isTop()) {
			updated.put(loc.getOffset(), value);
		}
		return withRegion(loc.getRegion(), updated);
	}

	private static long byteSize(int bitWidth) {
		return Math.max(1, bitWidth / 8);
	}

	/**
	 * Remove all entries sharing a byte with a value of the given width at offset.
	 */
	private static void removeOverlapping(TreeMap<Long, ValueSet> contents, long offset, int bitWidth) {
		long bytes = byteSize(bitWidth);
		long from = offset >= Long.MIN_VALUE + 8L ? offset - 7L : Long.MIN_VALUE;
		SortedMap<Long, ValueSet> candidates = offset <= Long.MAX_VALUE - bytes
				? contents.subMap(from, offset + bytes)
				: contents.tailMap(from);
		Iterator<Entry<Long, ValueSet>> it = candidates.entrySet().iterator();
		while (it.hasNext()) {
			Entry<Long, ValueSet> e = it.next();
			long start = e.getKey();
			long size = byteSize(e.getValue().getBitWidth());
			if (start >= offset || start + size > offset) {
				it.remove();
			}
		}
	}

	private AbstractMemory withRegion(MemoryRegion region, SortedMap<Long, ValueSet> contents) {
		SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> result = new TreeMap<>(regions);
		if (contents.isEmpty()) {
			result.remove(region);
		} else {
			result.put(region, contents);
		}
		return new AbstractMemory(result);
	}

	private AbstractMemory removeRegion(MemoryRegion region) {
		if (!regions.containsKey(region)) {
			return this;
		}
		SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> result = new TreeMap<>(regions);
		result.remove(region);
		return new AbstractMemory(result);
	}

	private AbstractMemory enforceLimit(int limit, Statistic statistic) {
		AbstractMemory result = this;
		for (Entry<MemoryRegion, SortedMap<Long, ValueSet>> r : regions.entrySet()) {
			if (r.getValue().size() > limit) {
				if (logger.isVerboseEnabled()) {
					logger.verbose("Region " + r.getKey() + " exceeds " + limit + " entries, setting it to top");
				}
				statistic.countMemoryCollapse();
				result = result.removeRegion(r.getKey());
			}
		}
		return result;
	}

	/**
	 * Merge two memories location by location. Locations whose widths disagree are
	 * dropped.
	 *
	 * @param inclusive Whether locations present on only one side are kept.
	 */
	private AbstractMemory merge(AbstractMemory other, boolean inclusive, EntryMerge f) {
		SortedMap<MemoryRegion, SortedMap<Long, ValueSet>> result = new TreeMap<>();
		for (Entry<MemoryRegion, SortedMap<Long, ValueSet>> r : regions.entrySet()) {
			SortedMap<Long, ValueSet> otherRegion = other.regions.get(r.getKey());
			if (otherRegion == null) {
				if (inclusive) {
					result.put(r.getKey(), r.getValue());
				}
				continue;
			}
			SortedMap<Long, ValueSet> merged = mergeRegion(r.getValue(), otherRegion, inclusive, f);
			if (!merged.isEmpty()) {
				result.put(r.getKey(), merged);
			}
		}
		if (inclusive) {
			for (Entry<MemoryRegion, SortedMap<Long, ValueSet>> r : other.regions.entrySet()) {
				if (!regions.containsKey(r.getKey())) {
					result.put(r.getKey(), r.getValue());
				}
			}
		}
		return new AbstractMemory(result);
	}

	private static SortedMap<Long, ValueSet> mergeRegion(SortedMap<Long, ValueSet> a, SortedMap<Long, ValueSet> b,
			boolean inclusive, EntryMerge f) {
		SortedMap<Long, ValueSet> result = new TreeMap<>();
		for (Entry<Long, ValueSet> e : a.entrySet()) {
			ValueSet other = b.get(e.getKey());
			if (other == null) {
				if (inclusive) {
					result.put(e.getKey(), e.getValue());
				}
				continue;
			}
			try {
				ValueSet merged = f.apply(e.getValue(), other);
				if (!merged.isTop()) {
					result.put(e.getKey(), merged);
				}
			} catch (BitWidthMismatchException ex) {
				logger.debug("Dropping entry at offset " + e.getKey() + " of different widths", ex);
			}
		}
		if (inclusive) {
			for (Entry<Long, ValueSet> e : b.entrySet()) {
				if (!a.containsKey(e.getKey())) {
					result.put(e.getKey(), e.getValue());
				}
			}
		}
		return result;
	}

	public AbstractMemory union(AbstractMemory other) {
		if (equals(other)) {
			return this;
		}
		return merge(other, false, new EntryMerge() {
			@Override
			public ValueSet apply(ValueSet a, ValueSet b) {
				return a.union(b);
			}
		});
	}

	public AbstractMemory intersection(AbstractMemory other) {
		if (equals(other)) {
			return this;
		}
		return merge(other, true, new EntryMerge() {
			@Override
			public ValueSet apply(ValueSet a, ValueSet b) {
				return a.intersection(b);
			}
		});
	}

	public AbstractMemory widen(AbstractMemory newer) {
		if (equals(newer)) {
			return this;
		}
		return merge(newer, true, new EntryMerge() {
			@Override
			public ValueSet apply(ValueSet a, ValueSet b) {
				return a.widen(b);
			}
		});
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof AbstractMemory && regions.equals(((AbstractMemory) obj).regions);
	}

	@Override
	public int hashCode() {
		return regions.hashCode();
	}

	@Override
	public String toString() {
		if (isTop()) {
			return "[top memory]";
		}
		StringBuilder res = new StringBuilder("[");
		boolean first = true;
		for (Entry<MemoryRegion, SortedMap<Long, ValueSet>> r : regions.entrySet()) {
			for (Map.Entry<Long, ValueSet> e : r.getValue().entrySet()) {
				if (!first) {
					res.append(", ");
				}
				first = false;
				res.append(r.getKey()).append('+').append(e.getKey()).append(" -> ").append(e.getValue());
			}
		}
		return res.append(']').toString();
	}
}
