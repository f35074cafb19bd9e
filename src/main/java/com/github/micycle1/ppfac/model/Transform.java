package com.github.micycle1.ppfac.model;

import java.util.Locale;

/**
 * Value-domain transform declared by a structure. It never changes kriging
 * weights; it changes how pilot-point values are combined with them.
 */
public enum Transform {
	NONE, LOG;

	/**
	 * Parses a structure-file transform keyword ({@code none} or {@code log}, any
	 * case).
	 *
	 * @throws IllegalArgumentException for anything else
	 */
	public static Transform parse(String text) {
		switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "none":
				return NONE;
			case "log":
				return LOG;
			default:
				throw new IllegalArgumentException("Unknown transform '" + text + "' (expected none or log)");
		}
	}
}
