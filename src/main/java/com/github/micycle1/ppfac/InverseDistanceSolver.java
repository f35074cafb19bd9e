package com.github.micycle1.ppfac;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.github.micycle1.ppfac.model.Contributor;

/**
 * Inverse-distance-squared weighting over the {@code n} nearest pilot points.
 * <p>
 * For each target the distances to all pilot points are computed and the
 * {@code n} smallest kept (ties keep pilot-point order). Raw weights are
 * <code>1/d²</code>, normalised to sum to one. A target lying exactly on a
 * pilot point gives that point weight 1 and the other selected points 0.
 * Results keep the distance order of the selection.
 */
public final class InverseDistanceSolver {

	private final int nPoints;

	public InverseDistanceSolver(int nPoints) {
		if (nPoints < 1) {
			throw new IllegalArgumentException("nPoints must be >= 1, was " + nPoints);
		}
		this.nPoints = nPoints;
	}

	public int getPointCount() {
		return nPoints;
	}

	/**
	 * Weights for every row of {@code targets}.
	 *
	 * @param pilots  pilot-point coordinates, n x 2
	 * @param targets target coordinates, m x 2
	 */
	public List<List<Contributor>> solve(double[][] pilots, double[][] targets) {
		List<List<Contributor>> out = new ArrayList<>(targets.length);
		for (double[] t : targets) {
			out.add(weights(pilots, t[0], t[1]));
		}
		return out;
	}

	/** Weights for one target from the {@code nPoints} nearest pilots. */
	public List<Contributor> weights(double[][] pilots, double tx, double ty) {
		if (pilots.length == 0) {
			throw new IllegalArgumentException("No pilot points");
		}
		final double[] d = new double[pilots.length];
		for (int i = 0; i < pilots.length; i++) {
			d[i] = Geometry.distance(tx, ty, pilots[i][0], pilots[i][1]);
		}
		// sorted() on an ordered stream is stable
		List<Neighbour> nearest = IntStream.range(0, pilots.length).boxed() //
				.sorted(Comparator.comparingDouble(i -> d[i])) //
				.limit(nPoints) //
				.map(i -> new Neighbour(i, pilots[i][0], pilots[i][1], d[i])) //
				.collect(Collectors.toList());
		return inverseSquare(nearest);
	}

	/**
	 * Inverse-distance-squared weights over an already selected candidate list.
	 */
	public static List<Contributor> inverseSquare(List<Neighbour> selected) {
		final int k = selected.size();
		List<Contributor> out = new ArrayList<>(k);

		int exact = -1;
		for (int j = 0; j < k; j++) {
			if (selected.get(j).distance() == 0.0) {
				exact = j;
				break;
			}
		}
		if (exact >= 0) {
			for (int j = 0; j < k; j++) {
				out.add(new Contributor(selected.get(j).index(), j == exact ? 1.0 : 0.0));
			}
			return out;
		}

		double dMin = Double.POSITIVE_INFINITY;
		for (Neighbour n : selected) {
			dMin = Math.min(dMin, n.distance());
		}
		// (dMin/d)² instead of 1/d²: same ratios, each term in (0, 1], so no overflow
		double[] w = new double[k];
		double sum = 0.0;
		for (int j = 0; j < k; j++) {
			double r = dMin / selected.get(j).distance();
			w[j] = r * r;
			sum += w[j];
		}
		for (int j = 0; j < k; j++) {
			out.add(new Contributor(selected.get(j).index(), w[j] / sum));
		}
		return out;
	}
}
