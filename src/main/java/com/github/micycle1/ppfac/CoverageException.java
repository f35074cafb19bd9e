package com.github.micycle1.ppfac;

/**
 * The zone or structure assignment does not cover every mesh node.
 */
public class CoverageException extends FactorException {

	private static final long serialVersionUID = 1L;

	public CoverageException(String message) {
		super(message);
	}
}
