package org.binvsa.ssa;

/**
 * Read of a value of the given type from a memory variable. Endianness is
 * normalized before the analysis sees the load.
 */
public final class Load extends Expression {

	private final Expression memory;
	private final Expression index;
	private final Type type;

	public Load(Expression memory, Expression index, Type type) {
		assert memory != null && index != null && type != null;
		if (!memory.getType().isMemory()) {
			throw new IllegalArgumentException("Load from non-memory expression " + memory);
		}
		this.memory = memory;
		this.index = index;
		this.type = type;
	}

	public Expression getMemory() {
		return memory;
	}

	public Expression getIndex() {
		return index;
	}

	@Override
	public Type getType() {
		return type;
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Load)) {
			return false;
		}
		Load other = (Load) obj;
		return memory.equals(other.memory) && index.equals(other.index) && type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return (memory.hashCode() * 31 + index.hashCode()) * 31 + type.hashCode();
	}

	@Override
	public String toString() {
		return memory + "[" + index + "]:" + type;
	}
}
