package org.binvsa.ssa;

/**
 * A memory expression that equals the given memory updated at one index.
 */
public final class Store extends Expression {

	private final Expression memory;
	private final Expression index;
	private final Expression value;

	public Store(Expression memory, Expression index, Expression value) {
		assert memory != null && index != null && value != null;
		if (!memory.getType().isMemory()) {
			throw new IllegalArgumentException("Store to non-memory expression " + memory);
		}
		this.memory = memory;
		this.index = index;
		this.value = value;
	}

	public Expression getMemory() {
		return memory;
	}

	public Expression getIndex() {
		return index;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public Type getType() {
		return memory.getType();
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Store)) {
			return false;
		}
		Store other = (Store) obj;
		return memory.equals(other.memory) && index.equals(other.index) && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return (memory.hashCode() * 31 + index.hashCode()) * 31 + value.hashCode();
	}

	@Override
	public String toString() {
		return memory + " with [" + index + "] = " + value;
	}
}
