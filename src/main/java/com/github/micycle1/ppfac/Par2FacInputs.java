package com.github.micycle1.ppfac;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Files read and written by one {@link Par2Fac} run. The structure, zone and
 * zone-structure files are only needed for kriging; the regularisation output
 * is optional.
 */
public record Par2FacInputs(Path pilotPoints, Path nodes, Path structures, Path zones, Path zoneStructures, Path factorsOut,
		Path regularisationOut) {

	public Par2FacInputs {
		Objects.requireNonNull(pilotPoints, "pilotPoints must not be null");
		Objects.requireNonNull(nodes, "nodes must not be null");
		Objects.requireNonNull(factorsOut, "factorsOut must not be null");
	}

	/** Inputs of an inverse-distance run: pilot points and nodes only. */
	public static Par2FacInputs idw(Path pilotPoints, Path nodes, Path factorsOut) {
		return new Par2FacInputs(pilotPoints, nodes, null, null, null, factorsOut, null);
	}

	public static Par2FacInputs kriging(Path pilotPoints, Path nodes, Path structures, Path zones, Path zoneStructures, Path factorsOut,
			Path regularisationOut) {
		Objects.requireNonNull(structures, "structures must not be null");
		Objects.requireNonNull(zones, "zones must not be null");
		Objects.requireNonNull(zoneStructures, "zoneStructures must not be null");
		return new Par2FacInputs(pilotPoints, nodes, structures, zones, zoneStructures, factorsOut, regularisationOut);
	}
}
