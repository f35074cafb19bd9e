package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.model.PilotPoint;

/**
 * Reads a pilot-points file: one {@code id x y [zone] [value]} record per line,
 * {@code #} comment lines and blank lines skipped. A missing zone column gives
 * {@link PilotPoint#DEFAULT_ZONE}; a missing value gives 0.0.
 */
public final class PilotPointReader {

	private static final Logger LOG = LoggerFactory.getLogger(PilotPointReader.class);

	private PilotPointReader() {
	}

	public static List<PilotPoint> read(Path file) {
		List<String> lines = TextLines.read(file);
		List<PilotPoint> points = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (TextLines.isSkippable(line, "#")) {
				continue;
			}
			int ln = i + 1;
			String[] t = TextLines.tokens(line);
			String id = t[0];
			double x = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, "x"), "x");
			double y = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 2, "y"), "y");
			int zone = t.length > 3 ? TextLines.parseInt(file, ln, t[3], "zone") : PilotPoint.DEFAULT_ZONE;
			double value = t.length > 4 ? TextLines.parseDouble(file, ln, t[4], "value") : 0.0;
			points.add(new PilotPoint(id, x, y, zone, value));
		}
		LOG.debug("Read {} pilot points from {}", points.size(), file);
		return points;
	}
}
