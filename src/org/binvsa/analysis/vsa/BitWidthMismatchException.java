package org.binvsa.analysis.vsa;

/**
 * Thrown if abstract values of different bit widths are combined.
 */
public class BitWidthMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 7043198825172239402L;

	public BitWidthMismatchException(int expected, int actual) {
		super("Incompatible bit widths: " + expected + " and " + actual);
	}

	public BitWidthMismatchException(String message) {
		super(message);
	}
}
