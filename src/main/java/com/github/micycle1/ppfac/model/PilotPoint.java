package com.github.micycle1.ppfac.model;

import java.util.Objects;

/**
 * A calibration pilot point. Identity is the {@code id} string; coordinates must
 * be unique within one run.
 */
public record PilotPoint(String id, double x, double y, int zone, double value) {

	/** Zone assigned when the pilot-point file has no zone column. */
	public static final int DEFAULT_ZONE = 1;

	public PilotPoint {
		Objects.requireNonNull(id, "id must not be null");
	}
}
