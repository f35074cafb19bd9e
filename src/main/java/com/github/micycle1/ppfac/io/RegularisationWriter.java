package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * Writes the pilot-point covariance matrix of each kriging zone, for use as
 * regularisation prior information:
 *
 * <pre>
 * ZONE zone structure n
 * pp_id c_1 c_2 ... c_n
 * ...
 * </pre>
 *
 * Zones are written in ascending order.
 */
public final class RegularisationWriter {

	private RegularisationWriter() {
	}

	/** Covariance block of one zone. */
	public record ZoneCovariance(String structure, String[] pilotPointIds, double[][] covariance) {
	}

	/**
	 * @return the number of zones written
	 */
	public static int write(Path file, SortedMap<Integer, ZoneCovariance> zones) {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<Integer, ZoneCovariance> e : zones.entrySet()) {
			ZoneCovariance z = e.getValue();
			final int n = z.pilotPointIds().length;
			sb.append(String.format(Locale.ROOT, "ZONE %d %s %d", e.getKey(), z.structure(), n)).append('\n');
			for (int i = 0; i < n; i++) {
				sb.append(z.pilotPointIds()[i]);
				for (int j = 0; j < n; j++) {
					sb.append(String.format(Locale.ROOT, " %15.8E", z.covariance()[i][j]));
				}
				sb.append('\n');
			}
		}
		AtomicTextFile.write(file, sb);
		return zones.size();
	}
}
