package com.github.micycle1.ppfac.linalg;

import org.ojalgo.matrix.decomposition.LU;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.R064Store;

/**
 * Dense LU solve through ojAlgo. Interchangeable with {@link EjmlDenseSolver}.
 */
public final class OjAlgoDenseSolver implements DenseSolver {

	private final double tolerance;

	public OjAlgoDenseSolver(double conditionTolerance) {
		this.tolerance = conditionTolerance;
	}

	@Override
	public double[] solve(double[][] a, double[] b) {
		PivotRatio.requireSquare(a, b);
		final int n = a.length;

		final R064Store A = R064Store.FACTORY.make(n, n);
		final R064Store B = R064Store.FACTORY.make(n, 1);
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				A.set(i, j, a[i][j]);
			}
			B.set(i, 0, b[i]);
		}

		final LU<Double> lu = LU.R064.make();
		if (!lu.decompose(A) || !lu.isSolvable()) {
			throw new SingularMatrixException("ojAlgo: LU decomposition failed (singular matrix)", 0.0);
		}

		final MatrixStore<Double> U = lu.getU();
		double[] diag = new double[n];
		for (int i = 0; i < n; i++) {
			diag[i] = U.doubleValue(i, i);
		}
		PivotRatio.check(diag, tolerance, "ojAlgo");

		final MatrixStore<Double> X = lu.getSolution(B);
		double[] x = new double[n];
		for (int i = 0; i < n; i++) {
			x[i] = X.doubleValue(i, 0);
		}
		return x;
	}
}
