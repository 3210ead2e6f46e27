package org.binvsa.analysis.vsa;

/**
 * Abstract value of an SSA variable: a value set for registers or an abstract memory
 * for memory variables.
 */
public abstract class AbstractValue {

	public enum Kind { SCALAR, ARRAY }

	private AbstractValue() {
	}

	public abstract Kind getKind();

	public static Scalar scalar(ValueSet vs) {
		return new Scalar(vs);
	}

	public static Array array(AbstractMemory memory) {
		return new Array(memory);
	}

	public boolean isScalar() {
		return getKind() == Kind.SCALAR;
	}

	public ValueSet getValueSet() {
		if (!isScalar()) {
			throw new IllegalStateException("Expected a value set but found memory " + this);
		}
		return ((Scalar) this).vs;
	}

	public AbstractMemory getMemory() {
		if (isScalar()) {
			throw new IllegalStateException("Expected memory but found value set " + this);
		}
		return ((Array) this).memory;
	}

	/**
	 * Join two values of the same kind.
	 */
	public AbstractValue union(AbstractValue other) {
		checkKind(other);
		if (isScalar()) {
			return scalar(getValueSet().union(other.getValueSet()));
		}
		return array(getMemory().union(other.getMemory()));
	}

	public AbstractValue widen(AbstractValue newer) {
		checkKind(newer);
		if (isScalar()) {
			return scalar(getValueSet().widen(newer.getValueSet()));
		}
		return array(getMemory().widen(newer.getMemory()));
	}

	private void checkKind(AbstractValue other) {
		if (getKind() != other.getKind()) {
			throw new IllegalStateException("Merging incompatible values " + this + " and " + other);
		}
	}

	public static final class Scalar extends AbstractValue {
		private final ValueSet vs;

		private Scalar(ValueSet vs) {
			assert vs != null;
			this.vs = vs;
		}

		@Override
		public Kind getKind() {
			return Kind.SCALAR;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Scalar && vs.equals(((Scalar) obj).vs);
		}

		@Override
		public int hashCode() {
			return vs.hashCode();
		}

		@Override
		public String toString() {
			return vs.toString();
		}
	}

	public static final class Array extends AbstractValue {
		private final AbstractMemory memory;

		private Array(AbstractMemory memory) {
			assert memory != null;
			this.memory = memory;
		}

		@Override
		public Kind getKind() {
			return Kind.ARRAY;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Array && memory.equals(((Array) obj).memory);
		}

		@Override
		public int hashCode() {
			return memory.hashCode();
		}

		@Override
		public String toString() {
			return memory.toString();
		}
	}
}
