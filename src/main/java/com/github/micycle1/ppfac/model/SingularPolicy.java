package com.github.micycle1.ppfac.model;

/** What the pipeline does with a node whose kriging system cannot be solved. */
public enum SingularPolicy {
	/** Record the node with no contributors and count it as skipped. */
	SKIP,
	/** Stop the run; no output is written. */
	ABORT,
	/** Use inverse-distance-squared weights over the same candidate points. */
	IDW
}
