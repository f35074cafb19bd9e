package com.github.micycle1.ppfac.linalg;

/**
 * <p>
 * Direct solvers for small dense square systems <code>A x = b</code>, as
 * assembled for kriging. Implementations factorise A by LU with partial
 * pivoting and refuse systems whose factor U has a pivot ratio
 * <code>min|u_ii| / max|u_ii|</code> below the configured tolerance.
 * </p>
 */
public interface DenseSolver {

	/**
	 * @param a square matrix, row-major; not modified
	 * @param b right-hand side, length a.length; not modified
	 * @return the solution x
	 * @throws SingularMatrixException if A is singular or too ill-conditioned
	 */
	double[] solve(double[][] a, double[] b);

	/** Available back ends. */
	enum Backend {
		EJML, OJALGO
	}

	static DenseSolver create(Backend backend, double conditionTolerance) {
		switch (backend) {
			case OJALGO:
				return new OjAlgoDenseSolver(conditionTolerance);
			case EJML:
			default:
				return new EjmlDenseSolver(conditionTolerance);
		}
	}
}
