package org.binvsa.ssa;

/**
 * An SSA variable. Variables are identified by name and type.
 */
public final class Variable extends Expression implements Comparable<Variable> {

	private final String name;
	private final Type type;

	public Variable(String name, Type type) {
		assert name != null && type != null;
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
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
	public int compareTo(Variable o) {
		int c = name.compareTo(o.name);
		if (c != 0) {
			return c;
		}
		return type.toString().compareTo(o.type.toString());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Variable)) {
			return false;
		}
		Variable other = (Variable) obj;
		return name.equals(other.name) && type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + type.hashCode();
	}

	@Override
	public String toString() {
		return name + ":" + type;
	}
}
