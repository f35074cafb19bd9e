package com.github.micycle1.ppfac;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.github.micycle1.ppfac.model.GridNode;
import com.github.micycle1.ppfac.model.PilotPoint;

/**
 * Selects the pilot points that may influence a node: those in the node's zone
 * that lie within the search radius, nearest first (ties by pilot-point index),
 * at most {@code maxPoints} of them.
 */
public final class PilotPointSearch {

	private final List<PilotPoint> pilotPoints;
	private final double radius;
	private final int minPoints;
	private final int maxPoints;

	public PilotPointSearch(List<PilotPoint> pilotPoints, double radius, int minPoints, int maxPoints) {
		if (maxPoints < minPoints) {
			throw new IllegalArgumentException("maxPoints (" + maxPoints + ") < minPoints (" + minPoints + ")");
		}
		this.pilotPoints = List.copyOf(pilotPoints);
		this.radius = radius;
		this.minPoints = minPoints;
		this.maxPoints = maxPoints;
	}

	/**
	 * @throws InsufficientPilotPointsException if fewer than {@code minPoints}
	 *                                          candidates are found
	 */
	public List<Neighbour> find(GridNode node, int zone) {
		List<Neighbour> found = new ArrayList<>();
		for (int i = 0; i < pilotPoints.size(); i++) {
			PilotPoint p = pilotPoints.get(i);
			if (p.zone() != zone) {
				continue;
			}
			double d = Geometry.distance(node.x(), node.y(), p.x(), p.y());
			if (d <= radius) {
				found.add(new Neighbour(i, p.x(), p.y(), d));
			}
		}
		if (found.size() < minPoints) {
			throw new InsufficientPilotPointsException(node.id(), zone, found.size(), minPoints, radius);
		}
		found.sort(Comparator.comparingDouble(Neighbour::distance)); // List.sort is stable
		return found.size() > maxPoints ? new ArrayList<>(found.subList(0, maxPoints)) : found;
	}

	public double getRadius() {
		return radius;
	}

	public int getMinPoints() {
		return minPoints;
	}

	public int getMaxPoints() {
		return maxPoints;
	}
}
