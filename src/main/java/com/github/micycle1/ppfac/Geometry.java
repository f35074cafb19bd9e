package com.github.micycle1.ppfac;

import java.util.List;

import com.github.micycle1.ppfac.model.PilotPoint;

/**
 * Planar distance helpers for pilot-point sets.
 */
public final class Geometry {

	private Geometry() {
	}

	/** Euclidean distance; no intermediate overflow or underflow. */
	public static double distance(double x1, double y1, double x2, double y2) {
		return Math.hypot(x2 - x1, y2 - y1);
	}

	/**
	 * Smallest Euclidean distance between any two distinct pilot points. O(n²),
	 * which is fine for pilot-point counts.
	 *
	 * @return the minimum distance; exactly 0.0 if two points coincide, and
	 *         {@link Double#POSITIVE_INFINITY} for fewer than two points
	 */
	public static double minPairwiseDistance(List<PilotPoint> points) {
		return scan(points).distance;
	}

	/**
	 * Throws if any two pilot points share coordinates.
	 *
	 * @return the minimum pairwise distance (positive)
	 * @throws DegenerateGeometryException naming the first coincident pair found
	 */
	public static double requireDistinct(List<PilotPoint> points) {
		Closest c = scan(points);
		if (c.distance == 0.0) {
			PilotPoint a = points.get(c.i);
			PilotPoint b = points.get(c.j);
			throw new DegenerateGeometryException(a.id(), b.id(), a.x(), a.y());
		}
		return c.distance;
	}

	private static Closest scan(List<PilotPoint> points) {
		final int n = points.size();
		Closest best = new Closest();
		for (int i = 0; i < n; i++) {
			PilotPoint p = points.get(i);
			for (int j = i + 1; j < n; j++) {
				PilotPoint q = points.get(j);
				double d = distance(p.x(), p.y(), q.x(), q.y());
				if (d < best.distance) {
					best.distance = d;
					best.i = i;
					best.j = j;
					if (d == 0.0) {
						return best; // cannot get any smaller
					}
				}
			}
		}
		return best;
	}

	private static final class Closest {
		double distance = Double.POSITIVE_INFINITY;
		int i = -1;
		int j = -1;
	}
}
