package com.github.micycle1.ppfac.model;

import java.util.List;
import java.util.Objects;

/**
 * A geostatistical structure: nugget, value transform and an ordered list of
 * nested variograms whose covariances add up.
 */
public record Structure(String name, double nugget, Transform transform, double maxPowerVariance, List<NestedVariogram> components) {

	public Structure {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(transform, "transform must not be null");
		components = List.copyOf(components);
	}

	/** The variogram models, in declaration order. */
	public List<VariogramModel> variograms() {
		return components.stream().map(NestedVariogram::variogram).toList();
	}
}
