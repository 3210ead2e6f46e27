package org.binvsa.analysis.vsa;

import org.binvsa.ssa.Type;
import org.binvsa.ssa.Variable;

/**
 * Stack pointer and memory variables of the supported architectures.
 */
public enum Architecture {
	X86("R_ESP", 32), X86_64("R_RSP", 64);

	private final Variable stackPointer;
	private final Variable memory;

	Architecture(String stackPointerName, int addressWidth) {
		this.stackPointer = new Variable(stackPointerName, Type.reg(addressWidth));
		this.memory = new Variable("mem", Type.mem(addressWidth, 8));
	}

	public Variable getStackPointer() {
		return stackPointer;
	}

	public Variable getMemory() {
		return memory;
	}
}
