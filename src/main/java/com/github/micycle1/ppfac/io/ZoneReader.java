package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.ParseException;

/**
 * Reads a node zone file. After comment lines ({@code C}, {@code c},
 * {@code #}) the first line is a header and is skipped; every following line
 * holds {@code node_id zone_id}.
 */
public final class ZoneReader {

	private static final Logger LOG = LoggerFactory.getLogger(ZoneReader.class);

	private ZoneReader() {
	}

	/**
	 * @return node id to zone id, in file order
	 */
	public static Map<Integer, Integer> read(Path file) {
		List<String> lines = TextLines.read(file);
		Map<Integer, Integer> zones = new LinkedHashMap<>();
		boolean header = true;
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (TextLines.isSkippable(line, "Cc#")) {
				continue;
			}
			if (header) {
				header = false;
				continue;
			}
			int ln = i + 1;
			String[] t = TextLines.tokens(line);
			int node = TextLines.parseInt(file, ln, t[0], "node id");
			int zone = TextLines.parseInt(file, ln, TextLines.field(file, ln, t, 1, "zone id"), "zone id");
			if (zones.put(node, zone) != null) {
				throw ParseException.at(file, ln, "node " + node + " assigned a zone twice");
			}
		}
		if (header) {
			throw new ParseException(file + ": no header line");
		}
		LOG.debug("Read {} node zone assignments from {}", zones.size(), file);
		return zones;
	}
}
