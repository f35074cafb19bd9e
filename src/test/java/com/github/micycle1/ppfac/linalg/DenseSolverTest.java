package com.github.micycle1.ppfac.linalg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class DenseSolverTest {

	@ParameterizedTest
	@EnumSource(DenseSolver.Backend.class)
	public void testSolvesKnownSystem(DenseSolver.Backend backend) {
		double[][] a = { { 4, 1, 2 }, { 1, 5, 3 }, { 2, 3, 6 } };
		double[] expected = { 1, -2, 3 };
		double[] b = multiply(a, expected);

		double[] x = DenseSolver.create(backend, 1e-12).solve(a, b);
		for (int i = 0; i < 3; i++) {
			assertEquals(expected[i], x[i], 1e-12);
		}
	}

	@Test
	public void testBackendsAgree() {
		Random r = new Random(99);
		DenseSolver ejml = DenseSolver.create(DenseSolver.Backend.EJML, 1e-12);
		DenseSolver oj = DenseSolver.create(DenseSolver.Backend.OJALGO, 1e-12);
		for (int trial = 0; trial < 25; trial++) {
			int n = 2 + r.nextInt(12);
			double[][] a = new double[n][n];
			double[] b = new double[n];
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < n; j++) {
					a[i][j] = r.nextDouble() - 0.5;
				}
				a[i][i] += n; // diagonally dominant
				b[i] = r.nextDouble();
			}
			double[] x1 = ejml.solve(a, b);
			double[] x2 = oj.solve(a, b);
			for (int i = 0; i < n; i++) {
				assertEquals(x1[i], x2[i], 1e-9);
			}
		}
	}

	@ParameterizedTest
	@EnumSource(DenseSolver.Backend.class)
	public void testRejectsSingular(DenseSolver.Backend backend) {
		double[][] a = { { 1, 2, 3 }, { 2, 4, 6 }, { 1, 0, 1 } };
		SingularMatrixException e = assertThrows(SingularMatrixException.class,
				() -> DenseSolver.create(backend, 1e-12).solve(a, new double[] { 1, 2, 3 }));
		assertTrue(e.getPivotRatio() < 1e-12);
	}

	@ParameterizedTest
	@EnumSource(DenseSolver.Backend.class)
	public void testRejectsIllConditioned(DenseSolver.Backend backend) {
		double[][] a = { { 1, 0 }, { 0, 1e-9 } };
		assertThrows(SingularMatrixException.class, () -> DenseSolver.create(backend, 1e-6).solve(a, new double[] { 1, 1 }));
		// accepted under a looser tolerance
		double[] x = DenseSolver.create(backend, 1e-12).solve(a, new double[] { 1, 1 });
		assertEquals(1e9, x[1], 1e-3);
	}

	@ParameterizedTest
	@EnumSource(DenseSolver.Backend.class)
	public void testInputsNotModified(DenseSolver.Backend backend) {
		double[][] a = { { 2, 1 }, { 1, 3 } };
		double[] b = { 1, 2 };
		DenseSolver.create(backend, 1e-12).solve(a, b);
		assertEquals(2.0, a[0][0]);
		assertEquals(1.0, a[1][0]);
		assertEquals(2.0, b[1]);
	}

	@Test
	public void testShapeChecks() {
		DenseSolver s = DenseSolver.create(DenseSolver.Backend.EJML, 1e-12);
		assertThrows(IllegalArgumentException.class, () -> s.solve(new double[0][0], new double[0]));
		assertThrows(IllegalArgumentException.class, () -> s.solve(new double[][] { { 1, 2 }, { 3, 4 } }, new double[] { 1 }));
		assertThrows(IllegalArgumentException.class, () -> s.solve(new double[][] { { 1, 2 }, { 3 } }, new double[] { 1, 2 }));
	}

	@Test
	public void testPivotRatio() {
		assertEquals(0.5, PivotRatio.of(new double[] { 2, -1, 1.5 }), 1e-15);
		assertEquals(0.0, PivotRatio.of(new double[] { 2, 0 }));
		assertEquals(0.0, PivotRatio.of(new double[] { 1, Double.NaN }));
	}

	private static double[] multiply(double[][] a, double[] x) {
		double[] b = new double[a.length];
		for (int i = 0; i < a.length; i++) {
			for (int j = 0; j < x.length; j++) {
				b[i] += a[i][j] * x[j];
			}
		}
		return b;
	}
}
