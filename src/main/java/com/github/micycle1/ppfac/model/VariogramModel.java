package com.github.micycle1.ppfac.model;

import java.util.Objects;

/**
 * A named variogram from a structure file.
 *
 * @param name       variogram name, as referenced by structures
 * @param vartype    shape code: 1 spherical, 2 exponential, 3 gaussian, 4 power
 * @param bearing    direction of the major axis, degrees clockwise from north
 * @param rangeA     the {@code A} parameter (range, or exponent for the power
 *                   model)
 * @param anisotropy ratio of the major-axis range to the minor-axis range
 */
public record VariogramModel(String name, int vartype, double bearing, double rangeA, double anisotropy) {

	public VariogramModel {
		Objects.requireNonNull(name, "name must not be null");
	}
}
