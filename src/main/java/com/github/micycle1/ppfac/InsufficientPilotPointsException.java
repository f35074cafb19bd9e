package com.github.micycle1.ppfac;

/**
 * Fewer than the minimum number of pilot points lie within the search radius of
 * a node. Recoverable: the node is written with no contributors.
 */
public class InsufficientPilotPointsException extends FactorException {

	private static final long serialVersionUID = 1L;

	private final int nodeId;
	private final int found;
	private final int required;

	public InsufficientPilotPointsException(int nodeId, int zone, int found, int required, double radius) {
		super("Node " + nodeId + " (zone " + zone + "): " + found + " pilot point(s) within radius " + radius + ", need " + required);
		this.nodeId = nodeId;
		this.found = found;
		this.required = required;
	}

	public int getNodeId() {
		return nodeId;
	}

	public int getFound() {
		return found;
	}

	public int getRequired() {
		return required;
	}
}
