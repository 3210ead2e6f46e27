package org.binvsa.analysis.vsa;

/**
 * Thrown by the abstract domains for operations they have no transfer function for.
 * The evaluator recovers by using top for the offending expression.
 */
public class UnimplementedOperationException extends RuntimeException {

	private static final long serialVersionUID = -2877614853471091093L;

	public UnimplementedOperationException(String message) {
		super(message);
	}
}
