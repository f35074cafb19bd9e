package com.github.micycle1.ppfac.linalg;

final class PivotRatio {

	private PivotRatio() {
	}

	// min|d| / max|d| over the diagonal of U; 0 when any pivot is zero or non-finite
	static double of(double[] diagU) {
		double min = Double.POSITIVE_INFINITY;
		double max = 0.0;
		for (double d : diagU) {
			double a = Math.abs(d);
			if (!Double.isFinite(a)) {
				return 0.0;
			}
			min = Math.min(min, a);
			max = Math.max(max, a);
		}
		if (max == 0.0) {
			return 0.0;
		}
		return min / max;
	}

	static void check(double[] diagU, double tolerance, String backend) {
		double r = of(diagU);
		if (r == 0.0) {
			throw new SingularMatrixException(backend + ": matrix is singular", r);
		}
		if (r < tolerance) {
			throw new SingularMatrixException(String.format("%s: pivot ratio %.3e below tolerance %.3e", backend, r, tolerance), r);
		}
	}

	static void requireSquare(double[][] a, double[] b) {
		final int n = a.length;
		if (n == 0) {
			throw new IllegalArgumentException("Empty system");
		}
		if (b.length != n) {
			throw new IllegalArgumentException("RHS length " + b.length + " != " + n);
		}
		for (double[] row : a) {
			if (row.length != n) {
				throw new IllegalArgumentException("Matrix is not square");
			}
		}
	}
}
