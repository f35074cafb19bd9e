package com.github.micycle1.ppfac.model;

import java.util.Locale;

public enum KrigingType {
	/** Unknown constant mean; weights are constrained to sum to one. */
	ORDINARY,
	/** Known mean; no unbiasedness row. */
	SIMPLE;

	/**
	 * Accepts {@code o}, {@code ordinary}, {@code s} or {@code simple} in any case.
	 */
	public static KrigingType parse(String text) {
		switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "o":
			case "ordinary":
				return ORDINARY;
			case "s":
			case "simple":
				return SIMPLE;
			default:
				throw new IllegalArgumentException("Unknown kriging type '" + text + "' (expected o or s)");
		}
	}
}
