package org.binvsa.util;

/**
 * An immutable pair of two non-null values.
 */
public final class Pair<L, R> {

	private final L left;
	private final R right;

	public static <L, R> Pair<L, R> create(L left, R right) {
		return new Pair<>(left, right);
	}

	public Pair(L left, R right) {
		assert left != null && right != null;
		this.left = left;
		this.right = right;
	}

	public L getLeft() {
		return left;
	}

	public R getRight() {
		return right;
	}

	@Override
	public int hashCode() {
		return 31 * left.hashCode() + right.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Pair<?, ?>)) {
			return false;
		}
		Pair<?, ?> other = (Pair<?, ?>) obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public String toString() {
		return "(" + left + ", " + right + ")";
	}
}
