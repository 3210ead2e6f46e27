package org.binvsa.ssa;

/**
 * Kinds of width conversions. Unsigned and signed casts extend, high and low casts
 * take the most or least significant bits.
 */
public enum CastType {
	UNSIGNED("pad"), SIGNED("extend"), HIGH("high"), LOW("low");

	private final String name;

	CastType(String name) {
		this.name = name;
	}

	@Override
	public String toString() {
		return name;
	}
}
