package com.github.micycle1.ppfac.model;

import java.util.Objects;

/**
 * Values used for structure keys that a structure block leaves out.
 */
public record StructureDefaults(double nugget, Transform transform, double maxPowerVariance) {

	public static final StructureDefaults STANDARD = new StructureDefaults(0.0, Transform.NONE, 1.0);

	public StructureDefaults {
		Objects.requireNonNull(transform, "transform must not be null");
	}
}
