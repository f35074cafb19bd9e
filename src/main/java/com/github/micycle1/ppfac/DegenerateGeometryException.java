package com.github.micycle1.ppfac;

/**
 * Two pilot points share the same coordinates.
 */
public class DegenerateGeometryException extends FactorException {

	private static final long serialVersionUID = 1L;

	private final String firstId;
	private final String secondId;

	public DegenerateGeometryException(String firstId, String secondId, double x, double y) {
		super("Pilot points '" + firstId + "' and '" + secondId + "' coincide at (" + x + ", " + y + ")");
		this.firstId = firstId;
		this.secondId = secondId;
	}

	public String getFirstId() {
		return firstId;
	}

	public String getSecondId() {
		return secondId;
	}
}
