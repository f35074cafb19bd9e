package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.ParseException;

/**
 * Rewrites the node ids of a factors file, for meshes whose node file numbers
 * nodes sequentially while the model uses other ids. The translation file holds
 * {@code sequential_id actual_id} pairs ({@code #} and {@code C} comment
 * lines). The two header lines are copied unchanged; on each node line only
 * the first token is replaced.
 */
public final class NodeIdTranslator {

	private static final Logger LOG = LoggerFactory.getLogger(NodeIdTranslator.class);
	private static final int HEADER_LINES = 2;

	private NodeIdTranslator() {
	}

	/**
	 * @return the number of node lines translated
	 */
	public static int translate(Path factors, Path translation, Path out) {
		Map<String, String> ids = readTranslation(translation);
		List<String> lines = TextLines.read(factors);

		StringBuilder sb = new StringBuilder();
		int count = 0;
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (i < HEADER_LINES || line.isBlank()) {
				sb.append(line).append('\n');
				continue;
			}
			int start = 0;
			while (start < line.length() && Character.isWhitespace(line.charAt(start))) {
				start++;
			}
			int end = start;
			while (end < line.length() && !Character.isWhitespace(line.charAt(end))) {
				end++;
			}
			String id = line.substring(start, end);
			String actual = ids.get(id);
			if (actual == null) {
				throw ParseException.at(factors, i + 1, "node " + id + " has no entry in " + translation);
			}
			// keep the field right-aligned in its original width where it fits
			String padded = actual.length() < end ? " ".repeat(end - actual.length()) + actual : actual;
			sb.append(padded).append(line, end, line.length()).append('\n');
			count++;
		}
		AtomicTextFile.write(out, sb);
		LOG.debug("Translated {} node ids from {} into {}", count, factors, out);
		return count;
	}

	static Map<String, String> readTranslation(Path file) {
		Map<String, String> ids = new HashMap<>();
		List<String> lines = TextLines.read(file);
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (TextLines.isSkippable(line, "#Cc")) {
				continue;
			}
			String[] t = TextLines.tokens(line);
			String to = TextLines.field(file, i + 1, t, 1, "actual id");
			if (ids.put(t[0], to) != null) {
				throw ParseException.at(file, i + 1, "duplicate sequential id " + t[0]);
			}
		}
		return ids;
	}
}
