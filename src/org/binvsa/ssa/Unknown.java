package org.binvsa.ssa;

/**
 * A value the IL cannot describe, e.g. the result of an unmodeled instruction.
 */
public final class Unknown extends Expression {

	private final String description;
	private final Type type;

	public Unknown(String description, Type type) {
		assert description != null && type != null;
		this.description = description;
		this.type = type;
	}

	public String getDescription() {
		return description;
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
		if (!(obj instanceof Unknown)) {
			return false;
		}
		Unknown other = (Unknown) obj;
		return description.equals(other.description) && type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return description.hashCode() * 31 + type.hashCode();
	}

	@Override
	public String toString() {
		return "unknown \"" + description + "\":" + type;
	}
}
