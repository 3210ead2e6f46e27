package org.binvsa.ssa;

/**
 * Reference to a named label, used as jump target.
 */
public final class LabelRef extends Expression {

	private static final Type ADDRESS_TYPE = Type.reg(64);

	private final String label;

	public LabelRef(String label) {
		assert label != null;
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public Type getType() {
		return ADDRESS_TYPE;
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LabelRef && label.equals(((LabelRef) obj).label);
	}

	@Override
	public int hashCode() {
		return label.hashCode();
	}

	@Override
	public String toString() {
		return "\"" + label + "\"";
	}
}
