package com.github.micycle1.ppfac.model;

import java.util.Objects;

/** One component of a structure: a variogram and the sill it contributes. */
public record NestedVariogram(VariogramModel variogram, double contribution) {

	public NestedVariogram {
		Objects.requireNonNull(variogram, "variogram must not be null");
	}
}
