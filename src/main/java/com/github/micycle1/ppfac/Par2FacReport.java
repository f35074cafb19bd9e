package com.github.micycle1.ppfac;

import java.util.List;

import com.github.micycle1.ppfac.model.FactorTable;

/**
 * Outcome of a {@link Par2Fac} run: the factor table that was written and the
 * per-node problems that did not stop the run.
 */
public record Par2FacReport(FactorTable table, int nodesWritten, List<NodeFailure> failures, int idwFallbacks, double minPilotPointSpacing) {

	public Par2FacReport {
		failures = List.copyOf(failures);
	}

	/** Nodes written without contributors. */
	public int skippedNodes() {
		return table.emptyRecordCount();
	}

	public boolean isComplete() {
		return failures.isEmpty();
	}

	/** A node that was skipped or fell back to IDW. */
	public record NodeFailure(int nodeId, int zone, Reason reason, String message) {
	}

	public enum Reason {
		INSUFFICIENT_PILOT_POINTS, SINGULAR_SYSTEM, SINGULAR_SYSTEM_IDW_FALLBACK
	}
}
