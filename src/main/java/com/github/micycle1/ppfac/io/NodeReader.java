package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.ParseException;
import com.github.micycle1.ppfac.model.GridNode;

/**
 * Reads mesh node coordinates, {@code id x y} per line. Lines starting with
 * {@code C}, {@code c}, {@code *} or {@code #} are comments; anything after a
 * {@code /} is ignored.
 */
public final class NodeReader {

	private static final Logger LOG = LoggerFactory.getLogger(NodeReader.class);

	private NodeReader() {
	}

	public static List<GridNode> read(Path file) {
		List<String> lines = TextLines.read(file);
		List<GridNode> nodes = new ArrayList<>();
		Set<Integer> seen = new HashSet<>();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			int slash = line.indexOf('/');
			if (slash >= 0) {
				line = line.substring(0, slash);
			}
			if (TextLines.isSkippable(line, "Cc*#")) {
				continue;
			}
			int ln = i + 1;
			String[] t = TextLines.tokens(line);
			int id = TextLines.parseInt(file, ln, t[0], "node id");
			double x = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, "x"), "x");
			double y = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 2, "y"), "y");
			if (!seen.add(id)) {
				throw ParseException.at(file, ln, "duplicate node id " + id);
			}
			nodes.add(new GridNode(id, x, y));
		}
		LOG.debug("Read {} nodes from {}", nodes.size(), file);
		return nodes;
	}
}
