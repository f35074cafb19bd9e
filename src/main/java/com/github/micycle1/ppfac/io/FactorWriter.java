package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.model.Contributor;
import com.github.micycle1.ppfac.model.FactorTable;
import com.github.micycle1.ppfac.model.WeightRecord;

/**
 * <p>
 * Writes a {@link FactorTable} as a plain-text factors file:
 * </p>
 *
 * <pre>
 * pilot point file name
 * pilot point count
 * node_id  n  pp_index weight  pp_index weight ...
 * </pre>
 *
 * <p>
 * Nodes appear in ascending id order and contributors in ascending pilot-point
 * index order; pilot-point indices are written 1-based. Formatting uses
 * {@link Locale#ROOT}, so identical tables always give identical bytes. A node
 * that could not be interpolated is written with a count of 0.
 * </p>
 */
public final class FactorWriter {

	private static final Logger LOG = LoggerFactory.getLogger(FactorWriter.class);

	private FactorWriter() {
	}

	/**
	 * @return the number of nodes written with at least one contributor
	 */
	public static int write(Path file, FactorTable table) {
		StringBuilder sb = new StringBuilder();
		sb.append(table.pilotPointFile()).append('\n');
		sb.append(table.pilotPointCount()).append('\n');

		int written = 0;
		for (WeightRecord r : table.records()) {
			formatRecord(sb, r);
			if (!r.isEmpty()) {
				written++;
			}
		}
		AtomicTextFile.write(file, sb);
		LOG.debug("Wrote {} of {} node records to {}", written, table.records().size(), file);
		return written;
	}

	static void formatRecord(StringBuilder sb, WeightRecord r) {
		sb.append(String.format(Locale.ROOT, "%10d %5d", r.targetId(), r.contributors().size()));
		for (Contributor c : r.sortedContributors()) {
			sb.append(String.format(Locale.ROOT, " %8d %15.8E", c.pilotPointIndex() + 1, c.weight()));
		}
		sb.append('\n');
	}
}
