package com.github.micycle1.ppfac.variogram;

import java.util.List;

import com.github.micycle1.ppfac.model.NestedVariogram;
import com.github.micycle1.ppfac.model.Structure;
import com.github.micycle1.ppfac.model.VariogramModel;

/**
 * Spatial covariance of a {@link Structure}: the sum of its nested variogram
 * components, each scaled by its contribution and evaluated on its own
 * anisotropic distance, plus the nugget at zero separation.
 * <p>
 * Bearing is measured in degrees clockwise from north and gives the major axis
 * of a component. The offset between two points is expressed in the (major,
 * minor) frame and the minor component is stretched by the anisotropy ratio,
 * so a component with anisotropy 2 decorrelates twice as fast across the
 * bearing as along it.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class CovarianceFunction {

	private final double nugget;
	private final double maxPowerVariance;

	// per component, precomputed
	private final VariogramShape[] shapes;
	private final double[] contribution;
	private final double[] range;
	private final double[] anis;
	private final double[] sinB;
	private final double[] cosB;

	public CovarianceFunction(Structure structure) {
		this.nugget = structure.nugget();
		this.maxPowerVariance = structure.maxPowerVariance();

		List<NestedVariogram> comps = structure.components();
		final int m = comps.size();
		shapes = new VariogramShape[m];
		contribution = new double[m];
		range = new double[m];
		anis = new double[m];
		sinB = new double[m];
		cosB = new double[m];
		for (int i = 0; i < m; i++) {
			VariogramModel v = comps.get(i).variogram();
			shapes[i] = VariogramShape.fromCode(v.vartype());
			contribution[i] = comps.get(i).contribution();
			range[i] = v.rangeA();
			anis[i] = v.anisotropy();
			double b = Math.toRadians(v.bearing());
			sinB[i] = Math.sin(b);
			cosB[i] = Math.cos(b);
		}
	}

	/** Covariance between two locations. */
	public double covariance(double x1, double y1, double x2, double y2) {
		double dx = x2 - x1;
		double dy = y2 - y1;
		if (dx == 0.0 && dy == 0.0) {
			return sill();
		}
		double c = 0.0;
		for (int i = 0; i < shapes.length; i++) {
			double h = anisotropicDistance(i, dx, dy);
			c += contribution[i] * shapes[i].covariance(h, range[i], maxPowerVariance);
		}
		return c;
	}

	/** Covariance at zero separation: nugget plus every component at h = 0. */
	public double sill() {
		double c = nugget;
		for (int i = 0; i < shapes.length; i++) {
			c += contribution[i] * shapes[i].covariance(0.0, range[i], maxPowerVariance);
		}
		return c;
	}

	public int componentCount() {
		return shapes.length;
	}

	/**
	 * Distance seen by component {@code i} for an offset (dx east, dy north).
	 */
	double anisotropicDistance(int i, double dx, double dy) {
		// unit vector of bearing: (sin b, cos b); minor axis is its clockwise normal
		double major = dx * sinB[i] + dy * cosB[i];
		double minor = (dx * cosB[i] - dy * sinB[i]) * anis[i];
		return Math.sqrt(major * major + minor * minor);
	}
}
