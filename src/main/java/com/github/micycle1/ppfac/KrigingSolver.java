package com.github.micycle1.ppfac;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.github.micycle1.ppfac.linalg.DenseSolver;
import com.github.micycle1.ppfac.linalg.SingularMatrixException;
import com.github.micycle1.ppfac.model.Contributor;
import com.github.micycle1.ppfac.model.GridNode;
import com.github.micycle1.ppfac.model.KrigingType;
import com.github.micycle1.ppfac.model.Structure;
import com.github.micycle1.ppfac.variogram.CovarianceFunction;

/**
 * <p>
 * Kriging weights for one zone's {@link Structure}.
 * </p>
 *
 * <p>
 * For n candidate pilot points the solver assembles the symmetric covariance
 * matrix K (n x n) and the pilot-to-node covariance vector k. Ordinary kriging
 * borders K with a row and column of ones and a zero corner, adding the
 * unbiasedness constraint <code>Σw = 1</code>; the trailing Lagrange multiplier
 * of the solution is dropped. Simple kriging solves <code>K w = k</code>
 * directly and the weights need not sum to one (the known-mean term is applied
 * by whoever combines values).
 * </p>
 *
 * <p>
 * Both systems are assembled on covariances divided by the structure's sill.
 * The weights are unchanged by that scaling, and the conditioning check then
 * sees the same pivots whatever the magnitude of the sill.
 * </p>
 *
 * <p>
 * The structure's transform is not used here: it acts on values, not on
 * covariances.
 * </p>
 */
public final class KrigingSolver {

	private final int zone;
	private final Structure structure;
	private final CovarianceFunction cov;
	private final double sill;
	private final KrigingType type;
	private final DenseSolver solver;

	public KrigingSolver(int zone, Structure structure, KrigingType type, DenseSolver solver) {
		this.zone = zone;
		this.structure = structure;
		this.cov = new CovarianceFunction(structure);
		this.sill = cov.sill();
		this.type = type;
		this.solver = solver;
	}

	/**
	 * @param node       the target
	 * @param neighbours candidate pilot points (at least one)
	 * @return one contributor per candidate, ascending pilot-point index
	 * @throws SingularKrigingSystemException if the system cannot be solved
	 */
	public List<Contributor> solve(GridNode node, List<Neighbour> neighbours) {
		final int n = neighbours.size();
		if (n == 0) {
			throw new IllegalArgumentException("No candidate pilot points for node " + node.id());
		}
		final int m = type == KrigingType.ORDINARY ? n + 1 : n;
		if (!(sill > 0.0) || !Double.isFinite(sill)) {
			throw new SingularKrigingSystemException(zone, node.id(), "structure '" + structure.name() + "' has sill " + sill);
		}

		// covariances are divided by the sill so the unit border is on the same scale
		double[][] K = new double[m][m];
		double[] k = new double[m];
		for (int i = 0; i < n; i++) {
			Neighbour pi = neighbours.get(i);
			K[i][i] = cov.covariance(pi.x(), pi.y(), pi.x(), pi.y()) / sill;
			for (int j = i + 1; j < n; j++) {
				Neighbour pj = neighbours.get(j);
				double c = cov.covariance(pi.x(), pi.y(), pj.x(), pj.y()) / sill;
				K[i][j] = c;
				K[j][i] = c;
			}
			k[i] = cov.covariance(pi.x(), pi.y(), node.x(), node.y()) / sill;
		}
		if (type == KrigingType.ORDINARY) {
			// unbiasedness border; K[n][n] stays 0
			for (int i = 0; i < n; i++) {
				K[i][n] = 1.0;
				K[n][i] = 1.0;
			}
			k[n] = 1.0;
		}

		final double[] w;
		try {
			w = solver.solve(K, k);
		} catch (SingularMatrixException e) {
			throw new SingularKrigingSystemException(zone, node.id(), e.getMessage());
		}

		List<Contributor> out = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(w[i])) {
				throw new SingularKrigingSystemException(zone, node.id(), "non-finite weight");
			}
			out.add(new Contributor(neighbours.get(i).index(), w[i]));
		}
		out.sort(Comparator.comparingInt(Contributor::pilotPointIndex));
		return out;
	}

	/**
	 * Covariance matrix between the given points, without the kriging border.
	 */
	public double[][] covarianceMatrix(List<Neighbour> points) {
		final int n = points.size();
		double[][] c = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = i; j < n; j++) {
				double v = cov.covariance(points.get(i).x(), points.get(i).y(), points.get(j).x(), points.get(j).y());
				c[i][j] = v;
				c[j][i] = v;
			}
		}
		return c;
	}

	public int getZone() {
		return zone;
	}

	public Structure getStructure() {
		return structure;
	}

	public KrigingType getType() {
		return type;
	}
}
