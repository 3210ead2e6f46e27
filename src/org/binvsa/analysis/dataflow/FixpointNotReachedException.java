package org.binvsa.analysis.dataflow;

/**
 * Thrown when the fixpoint iteration does not stabilize within the iteration limit.
 */
public class FixpointNotReachedException extends RuntimeException {

	private static final long serialVersionUID = -4127383505186093772L;

	private final int iterations;

	public FixpointNotReachedException(int iterations) {
		super("No fixpoint reached after " + iterations + " iterations");
		this.iterations = iterations;
	}

	public int getIterations() {
		return iterations;
	}
}
