package com.github.micycle1.ppfac;

/**
 * The kriging matrix for one node is singular or too ill-conditioned to solve.
 */
public class SingularKrigingSystemException extends FactorException {

	private static final long serialVersionUID = 1L;

	private final int zone;
	private final int nodeId;

	public SingularKrigingSystemException(int zone, int nodeId, String detail) {
		super("Kriging system for node " + nodeId + " in zone " + zone + " cannot be solved: " + detail);
		this.zone = zone;
		this.nodeId = nodeId;
	}

	public int getZone() {
		return zone;
	}

	public int getNodeId() {
		return nodeId;
	}
}
