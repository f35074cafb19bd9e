package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.micycle1.ppfac.ParseException;

/**
 * Reads {@code zone_id structure_name} pairs. Comment lines start with
 * {@code C}, {@code c} or {@code #}.
 */
public final class ZoneStructureReader {

	private ZoneStructureReader() {
	}

	public static Map<Integer, String> read(Path file) {
		List<String> lines = TextLines.read(file);
		Map<Integer, String> assignment = new LinkedHashMap<>();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (TextLines.isSkippable(line, "Cc#")) {
				continue;
			}
			int ln = i + 1;
			String[] t = TextLines.tokens(line);
			int zone = TextLines.parseInt(file, ln, t[0], "zone id");
			String name = TextLines.field(file, ln, t, 1, "structure name");
			if (assignment.put(zone, name) != null) {
				throw ParseException.at(file, ln, "zone " + zone + " assigned a structure twice");
			}
		}
		return assignment;
	}
}
