package com.github.micycle1.ppfac.model;

/** A pilot point (0-based index into the run's pilot-point list) and its weight. */
public record Contributor(int pilotPointIndex, double weight) {
}
