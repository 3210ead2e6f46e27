package org.binvsa.analysis.vsa;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Allocates memory regions with consecutive ids. Regions requested under the same name
 * are the same region. Each analysis run owns its own table.
 */
public final class RegionTable {

	private final Map<String, MemoryRegion> regions = new LinkedHashMap<>();
	private int nextId = MemoryRegion.GLOBAL.getId() + 1;

	/**
	 * Get the region of the given name, allocating it on first use.
	 *
	 * @param name Name of the region, e.g. the stack pointer it is based on.
	 * @return The region.
	 */
	public MemoryRegion getRegion(String name) {
		MemoryRegion r = regions.get(name);
		if (r == null) {
			r = new MemoryRegion(nextId++, name);
			regions.put(name, r);
		}
		return r;
	}

	/**
	 * Allocate a region that is distinct from all others, e.g. for a heap allocation site.
	 *
	 * @param prefix Name prefix.
	 * @return A new region.
	 */
	public MemoryRegion createRegion(String prefix) {
		int id = nextId++;
		MemoryRegion r = new MemoryRegion(id, prefix + "_" + id);
		regions.put(r.getName(), r);
		return r;
	}

	public int size() {
		return regions.size();
	}
}
