package org.binvsa.analysis.vsa;

/**
 * An abstract base address. Regions are identified and ordered by their id alone; the
 * name is only used for printing. Id 0 is reserved for the global region, all other
 * regions are handed out by a {@link RegionTable}.
 */
public final class MemoryRegion implements Comparable<MemoryRegion> {

	public static final MemoryRegion GLOBAL = new MemoryRegion(0, "global");

	private final int id;
	private final String name;

	MemoryRegion(int id, String name) {
		assert name != null;
		this.id = id;
		this.name = name;
	}

	public int getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public boolean isGlobal() {
		return id == GLOBAL.id;
	}

	@Override
	public int compareTo(MemoryRegion o) {
		return Integer.compare(id, o.id);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof MemoryRegion && ((MemoryRegion) obj).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	public String toString() {
		return isGlobal() ? "$" : name + "#" + id;
	}
}
