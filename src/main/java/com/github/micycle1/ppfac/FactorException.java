package com.github.micycle1.ppfac;

/**
 * Root of the failures raised while computing interpolation factors.
 */
public class FactorException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public FactorException(String message) {
		super(message);
	}

	public FactorException(String message, Throwable cause) {
		super(message, cause);
	}
}
