package org.binvsa.analysis.vsa;

import org.binvsa.analysis.InvalidConfigurationException;
import org.binvsa.ssa.Type;
import org.binvsa.ssa.Variable;
import org.binvsa.util.Optional;
import org.binvsa.util.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable configuration of a value-set analysis. Build instances with
 * {@link #builder()} or {@link #forArchitecture(Architecture)}.
 */
public final class VsaOptions {

	/** Placeholder for variables that must be configured. Rejected by {@link #validate()}. */
	public static final Variable UNSET = new Variable("<unset>", Type.reg(1));

	public static final int DEFAULT_REGION_LIMIT = 1 << 16;
	public static final int DEFAULT_MAX_ITERATIONS = 1000000;

	private final Variable stackPointer;
	private final Variable memory;
	private final List<Pair<Long, Byte>> initialMemory;
	private final Optional<Integer> regionLimit;
	private final boolean unsignedComparisons;
	private final boolean widening;
	private final int wideningDelay;
	private final int maxIterations;

	private VsaOptions(Builder b) {
		this.stackPointer = b.stackPointer;
		this.memory = b.memory;
		this.initialMemory = Collections.unmodifiableList(new ArrayList<>(b.initialMemory));
		this.regionLimit = b.regionLimit;
		this.unsignedComparisons = b.unsignedComparisons;
		this.widening = b.widening;
		this.wideningDelay = b.wideningDelay;
		this.maxIterations = b.maxIterations;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return A builder with the stack pointer and memory variables of the architecture.
	 */
	public static Builder forArchitecture(Architecture arch) {
		return builder().stackPointer(arch.getStackPointer()).memory(arch.getMemory());
	}

	/**
	 * Check that the options describe a runnable analysis.
	 *
	 * @throws InvalidConfigurationException if not.
	 */
	public void validate() throws InvalidConfigurationException {
		if (stackPointer.equals(UNSET)) {
			throw new InvalidConfigurationException("Non-default stack pointer must be given");
		}
		if (!stackPointer.getType().isRegister()) {
			throw new InvalidConfigurationException("Stack pointer " + stackPointer + " is not a register");
		}
		if (memory.equals(UNSET)) {
			throw new InvalidConfigurationException("Non-default memory variable must be given");
		}
		if (!memory.getType().isMemory()) {
			throw new InvalidConfigurationException("Memory variable " + memory + " has no memory type");
		}
		if (memory.getType().getValueWidth() != 8) {
			throw new InvalidConfigurationException("VSA assumes memory is byte addressable, but " + memory + " stores "
					+ memory.getType().getValueWidth() + " bit values");
		}
		if (regionLimit.hasValue() && regionLimit.getValue() < 1) {
			throw new InvalidConfigurationException("Region limit must be positive: " + regionLimit.getValue());
		}
		if (wideningDelay < 0) {
			throw new InvalidConfigurationException("Widening delay must not be negative: " + wideningDelay);
		}
		if (maxIterations < 1) {
			throw new InvalidConfigurationException("Iteration limit must be positive: " + maxIterations);
		}
	}

	public Variable getStackPointer() {
		return stackPointer;
	}

	public Variable getMemory() {
		return memory;
	}

	/**
	 * @return Known bytes of the initial memory as (address, value) pairs.
	 */
	public List<Pair<Long, Byte>> getInitialMemory() {
		return initialMemory;
	}

	/**
	 * @return Maximum number of entries per memory region, nothing if unlimited.
	 */
	public Optional<Integer> getRegionLimit() {
		return regionLimit;
	}

	/**
	 * @return Whether unsigned comparisons in edge conditions are used like signed ones.
	 */
	public boolean isUnsignedComparisons() {
		return unsignedComparisons;
	}

	public boolean isWidening() {
		return widening;
	}

	/**
	 * @return Number of joins at a loop head before widening starts.
	 */
	public int getWideningDelay() {
		return wideningDelay;
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	@Override
	public String toString() {
		return "VsaOptions[sp=" + stackPointer + ", mem=" + memory + ", initial bytes=" + initialMemory.size()
				+ ", region limit=" + regionLimit + ", unsigned comparisons=" + unsignedComparisons
				+ ", widening=" + widening + ", widening delay=" + wideningDelay + ", max iterations=" + maxIterations + "]";
	}

	public static final class Builder {
		private Variable stackPointer = UNSET;
		private Variable memory = UNSET;
		private final List<Pair<Long, Byte>> initialMemory = new ArrayList<>();
		private Optional<Integer> regionLimit = new Optional<>(DEFAULT_REGION_LIMIT);
		private boolean unsignedComparisons = false;
		private boolean widening = true;
		private int wideningDelay = 0;
		private int maxIterations = DEFAULT_MAX_ITERATIONS;

		private Builder() {
		}

		public Builder stackPointer(Variable sp) {
			this.stackPointer = sp;
			return this;
		}

		public Builder memory(Variable mem) {
			this.memory = mem;
			return this;
		}

		public Builder initialByte(long address, byte value) {
			initialMemory.add(Pair.create(address, value));
			return this;
		}

		public Builder initialMemory(List<Pair<Long, Byte>> bytes) {
			initialMemory.addAll(bytes);
			return this;
		}

		public Builder regionLimit(int limit) {
			this.regionLimit = new Optional<>(limit);
			return this;
		}

		public Builder unlimitedRegions() {
			this.regionLimit = Optional.none();
			return this;
		}

		public Builder unsignedComparisons(boolean enabled) {
			this.unsignedComparisons = enabled;
			return this;
		}

		public Builder widening(boolean enabled) {
			this.widening = enabled;
			return this;
		}

		public Builder wideningDelay(int joins) {
			this.wideningDelay = joins;
			return this;
		}

		public Builder maxIterations(int iterations) {
			this.maxIterations = iterations;
			return this;
		}

		public VsaOptions build() {
			return new VsaOptions(this);
		}
	}
}
