package com.github.micycle1.ppfac.linalg;

import java.util.Arrays;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.lu.LUDecompositionAlt_DDRM;
import org.ejml.dense.row.linsol.lu.LinearSolverLu_DDRM;

/**
 * Dense LU solve through EJML. The default back end.
 */
public final class EjmlDenseSolver implements DenseSolver {

	private final double tolerance;

	public EjmlDenseSolver(double conditionTolerance) {
		this.tolerance = conditionTolerance;
	}

	@Override
	public double[] solve(double[][] a, double[] b) {
		PivotRatio.requireSquare(a, b);
		final int n = a.length;

		DMatrixRMaj A = new DMatrixRMaj(a);
		LUDecompositionAlt_DDRM lu = new LUDecompositionAlt_DDRM();
		LinearSolverLu_DDRM solver = new LinearSolverLu_DDRM(lu);
		if (!solver.setA(A) || lu.isSingular()) {
			throw new SingularMatrixException("EJML: LU decomposition failed (singular matrix)", 0.0);
		}

		DMatrixRMaj U = lu.getUpper(null);
		double[] diag = new double[n];
		for (int i = 0; i < n; i++) {
			diag[i] = U.get(i, i);
		}
		PivotRatio.check(diag, tolerance, "EJML");

		DMatrixRMaj rhs = new DMatrixRMaj(n, 1, true, b);
		DMatrixRMaj x = new DMatrixRMaj(n, 1);
		solver.solve(rhs, x);
		return Arrays.copyOf(x.data, n);
	}
}
