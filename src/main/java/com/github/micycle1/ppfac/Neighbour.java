package com.github.micycle1.ppfac;

/**
 * A candidate pilot point for one target, with its distance to that target.
 *
 * @param index    0-based index into the run's pilot-point list
 * @param distance Euclidean distance to the target
 */
public record Neighbour(int index, double x, double y, double distance) {
}
