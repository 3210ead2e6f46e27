package org.binvsa.analysis.vsa;

import org.binvsa.ssa.Variable;
import org.binvsa.util.Optional;

import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Maps SSA variables to abstract values. Unbound variables are top. Immutable.
 */
public final class AbstractEnvironment {

	public static final AbstractEnvironment EMPTY = new AbstractEnvironment(new TreeMap<Variable, AbstractValue>());

	private final SortedMap<Variable, AbstractValue> values;

	private AbstractEnvironment(SortedMap<Variable, AbstractValue> values) {
		this.values = values;
	}

	public Map<Variable, AbstractValue> getBindings() {
		return Collections.unmodifiableMap(values);
	}

	public Optional<AbstractValue> lookup(Variable var) {
		return Optional.optional(values.get(var));
	}

	/**
	 * @return The value set of a register variable, top if unbound.
	 * @throws IllegalStateException if the variable is bound to memory.
	 */
	public ValueSet lookupScalar(Variable var) {
		Optional<ValueSet> vs = lookupScalarIfPresent(var);
		return vs.hasValue() ? vs.getValue() : ValueSet.top(var.getType().getBitWidth());
	}

	public Optional<ValueSet> lookupScalarIfPresent(Variable var) {
		AbstractValue v = values.get(var);
		if (v == null) {
			return Optional.none();
		}
		if (!v.isScalar()) {
			throw new IllegalStateException("Variable " + var + " is bound to memory, expected a value set");
		}
		return new Optional<>(v.getValueSet());
	}

	/**
	 * @return The abstract memory of a memory variable, top if unbound.
	 * @throws IllegalStateException if the variable is bound to a value set.
	 */
	public AbstractMemory lookupMemory(Variable var) {
		Optional<AbstractMemory> m = lookupMemoryIfPresent(var);
		return m.hasValue() ? m.getValue() : AbstractMemory.TOP;
	}

	public Optional<AbstractMemory> lookupMemoryIfPresent(Variable var) {
		AbstractValue v = values.get(var);
		if (v == null) {
			return Optional.none();
		}
		if (v.isScalar()) {
			throw new IllegalStateException("Variable " + var + " is bound to a value set, expected memory");
		}
		return new Optional<>(v.getMemory());
	}

	public AbstractEnvironment bind(Variable var, AbstractValue value) {
		if (value.equals(values.get(var))) {
			return this;
		}
		SortedMap<Variable, AbstractValue> result = new TreeMap<>(values);
		result.put(var, value);
		return new AbstractEnvironment(result);
	}

	public AbstractEnvironment bind(Variable var, ValueSet vs) {
		return bind(var, AbstractValue.scalar(vs));
	}

	public AbstractEnvironment bind(Variable var, AbstractMemory memory) {
		return bind(var, AbstractValue.array(memory));
	}

	/**
	 * Join two environments. A variable bound on one side only keeps its binding: in SSA
	 * form, merging definitions happens at phi nodes only.
	 */
	public AbstractEnvironment join(AbstractEnvironment other) {
		if (equals(other)) {
			return this;
		}
		SortedMap<Variable, AbstractValue> result = new TreeMap<>(values);
		for (Entry<Variable, AbstractValue> e : other.values.entrySet()) {
			AbstractValue mine = result.get(e.getKey());
			result.put(e.getKey(), mine == null ? e.getValue() : mine.union(e.getValue()));
		}
		return new AbstractEnvironment(result);
	}

	/**
	 * Widen this environment by a newer one, variable by variable.
	 */
	public AbstractEnvironment widen(AbstractEnvironment newer) {
		if (equals(newer)) {
			return this;
		}
		SortedMap<Variable, AbstractValue> result = new TreeMap<>(values);
		for (Entry<Variable, AbstractValue> e : newer.values.entrySet()) {
			AbstractValue mine = result.get(e.getKey());
			result.put(e.getKey(), mine == null ? e.getValue() : mine.widen(e.getValue()));
		}
		return new AbstractEnvironment(result);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof AbstractEnvironment && values.equals(((AbstractEnvironment) obj).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder res = new StringBuilder();
		for (Entry<Variable, AbstractValue> e : values.entrySet()) {
			res.append(e.getKey().getName()).append(" = ").append(e.getValue()).append('\n');
		}
		return res.toString();
	}
}
