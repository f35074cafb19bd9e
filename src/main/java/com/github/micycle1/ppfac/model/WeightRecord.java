package com.github.micycle1.ppfac.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The weights that map pilot-point values onto one target node. A record with
 * no contributors marks a node that could not be interpolated.
 */
public record WeightRecord(int targetId, int zone, Transform transform, List<Contributor> contributors) {

	public WeightRecord {
		Objects.requireNonNull(transform, "transform must not be null");
		contributors = List.copyOf(contributors);
	}

	public static WeightRecord empty(int targetId, int zone) {
		return new WeightRecord(targetId, zone, Transform.NONE, List.of());
	}

	public boolean isEmpty() {
		return contributors.isEmpty();
	}

	public double weightSum() {
		double s = 0.0;
		for (Contributor c : contributors) {
			s += c.weight();
		}
		return s;
	}

	/** Contributors in ascending pilot-point index order. */
	public List<Contributor> sortedContributors() {
		return contributors.stream().sorted(Comparator.comparingInt(Contributor::pilotPointIndex)).toList();
	}

	/**
	 * Applies the weights to a pilot-point value vector (indexed like the
	 * pilot-point list). Log-transformed records are combined in log10 space.
	 *
	 * @return the interpolated value, or NaN when the record is empty
	 */
	public double interpolate(double[] values) {
		if (contributors.isEmpty()) {
			return Double.NaN;
		}
		double sum = 0.0;
		for (Contributor c : contributors) {
			double v = values[c.pilotPointIndex()];
			sum += c.weight() * (transform == Transform.LOG ? Math.log10(v) : v);
		}
		return transform == Transform.LOG ? Math.pow(10.0, sum) : sum;
	}
}
