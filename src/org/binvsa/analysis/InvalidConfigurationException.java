package org.binvsa.analysis;

/**
 * Thrown if an analysis is started with a configuration or an input graph it cannot
 * work with.
 */
public class InvalidConfigurationException extends Exception {

	private static final long serialVersionUID = 4236790528473622187L;

	public InvalidConfigurationException(String message) {
		super(message);
	}
}
