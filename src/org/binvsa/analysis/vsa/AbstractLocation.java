package org.binvsa.analysis.vsa;

/**
 * A concrete byte address relative to a region.
 */
public final class AbstractLocation implements Comparable<AbstractLocation> {

	private final MemoryRegion region;
	private final long offset;

	public AbstractLocation(MemoryRegion region, long offset) {
		assert region != null;
		this.region = region;
		this.offset = offset;
	}

	public MemoryRegion getRegion() {
		return region;
	}

	public long getOffset() {
		return offset;
	}

	@Override
	public int compareTo(AbstractLocation o) {
		int c = region.compareTo(o.region);
		return c != 0 ? c : Long.compare(offset, o.offset);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof AbstractLocation)) {
			return false;
		}
		AbstractLocation other = (AbstractLocation) obj;
		return region.equals(other.region) && offset == other.offset;
	}

	@Override
	public int hashCode() {
		return region.hashCode() * 31 + Long.hashCode(offset);
	}

	@Override
	public String toString() {
		return region + "+" + offset;
	}
}
