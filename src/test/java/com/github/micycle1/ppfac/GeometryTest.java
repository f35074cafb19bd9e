package com.github.micycle1.ppfac;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.github.micycle1.ppfac.model.PilotPoint;

public class GeometryTest {

	@Test
	public void testDistance() {
		assertEquals(5.0, Geometry.distance(0, 0, 3, 4), 1e-15);
		assertEquals(0.0, Geometry.distance(2, 2, 2, 2));
		assertEquals(5e200, Geometry.distance(0, 0, 3e200, 4e200), 1e186);
	}

	@Test
	public void testMinPairwiseDistance() {
		List<PilotPoint> pts = List.of(pp("a", 0, 0), pp("b", 3, 4), pp("c", 10, 0));
		assertEquals(5.0, Geometry.minPairwiseDistance(pts), 1e-12);
		assertEquals(Double.POSITIVE_INFINITY, Geometry.minPairwiseDistance(List.of(pp("a", 1, 1))));
		assertEquals(Double.POSITIVE_INFINITY, Geometry.minPairwiseDistance(List.of()));
	}

	@Test
	public void testDistinctRandomPointsArePositive() {
		Random r = new Random(1337);
		for (int trial = 0; trial < 20; trial++) {
			List<PilotPoint> pts = new ArrayList<>();
			for (int i = 0; i < 30; i++) {
				// x columns 10 apart never coincide
				pts.add(pp("p" + i, i * 10 + r.nextDouble(), r.nextDouble() * 100));
			}
			assertTrue(Geometry.minPairwiseDistance(pts) > 0.0);
			assertTrue(Geometry.requireDistinct(pts) > 0.0);
		}
	}

	@Test
	public void testCoincidentPointsGiveZero() {
		List<PilotPoint> pts = List.of(pp("p1", 0, 0), pp("p2", 3.0, 4.0), pp("p3", 3.0, 4.0));
		assertEquals(0.0, Geometry.minPairwiseDistance(pts));

		DegenerateGeometryException e = assertThrows(DegenerateGeometryException.class, () -> Geometry.requireDistinct(pts));
		assertEquals("p2", e.getFirstId());
		assertEquals("p3", e.getSecondId());
		assertTrue(e.getMessage().contains("(3.0, 4.0)"));
	}

	static PilotPoint pp(String id, double x, double y) {
		return new PilotPoint(id, x, y, PilotPoint.DEFAULT_ZONE, 0.0);
	}
}
