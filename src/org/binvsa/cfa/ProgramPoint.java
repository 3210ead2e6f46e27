package org.binvsa.cfa;

/**
 * The point before statement {@code index} of a block. Index {@code block.size()}
 * denotes the point after the last statement.
 */
public final class ProgramPoint {

	private final BasicBlock block;
	private final int index;

	public ProgramPoint(BasicBlock block, int index) {
		if (index < 0 || index > block.size()) {
			throw new IllegalArgumentException("No statement " + index + " in " + block);
		}
		this.block = block;
		this.index = index;
	}

	public BasicBlock getBlock() {
		return block;
	}

	public int getIndex() {
		return index;
	}

	public boolean isLast() {
		return index == block.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ProgramPoint)) {
			return false;
		}
		ProgramPoint other = (ProgramPoint) obj;
		return block.equals(other.block) && index == other.index;
	}

	@Override
	public int hashCode() {
		return block.hashCode() * 31 + index;
	}

	@Override
	public String toString() {
		return block + ":" + index;
	}
}
