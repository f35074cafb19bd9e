package com.github.micycle1.ppfac.model;

/** A mesh node, read from the model's node file. */
public record GridNode(int id, double x, double y) {
}
