package com.github.micycle1.ppfac.linalg;

public class SingularMatrixException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final double pivotRatio;

	public SingularMatrixException(String message, double pivotRatio) {
		super(message);
		this.pivotRatio = pivotRatio;
	}

	/** The pivot ratio observed, 0 for an exactly singular matrix. */
	public double getPivotRatio() {
		return pivotRatio;
	}
}
