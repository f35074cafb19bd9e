package com.github.micycle1.ppfac.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import com.github.micycle1.ppfac.ParseException;

/**
 * Line and token helpers shared by the whitespace-delimited readers. Line
 * numbers are 1-based.
 */
final class TextLines {

	private static final Pattern WS = Pattern.compile("\\s+");
	private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

	private TextLines() {
	}

	static List<String> read(Path file) {
		try {
			return Files.readAllLines(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new ParseException("Cannot read " + file + ": " + e.getMessage(), e);
		}
	}

	/** Whitespace tokens of a line (no empty leading token). */
	static String[] tokens(String line) {
		String t = line.trim();
		return t.isEmpty() ? new String[0] : WS.split(t);
	}

	/**
	 * True for blank lines and lines whose first non-blank character is one of
	 * {@code prefixes}.
	 */
	static boolean isSkippable(String line, String prefixes) {
		String t = line.strip();
		return t.isEmpty() || prefixes.indexOf(t.charAt(0)) >= 0;
	}

	static String field(Path file, int line, String[] tokens, int index, String name) {
		if (index >= tokens.length) {
			throw ParseException.at(file, line, "missing field '" + name + "'");
		}
		return tokens[index];
	}

	/**
	 * Plain decimal numbers only: no NaN, Infinity, hex or type suffixes. A value
	 * that overflows to infinity is rejected as well.
	 */
	static double parseDouble(Path file, int line, String token, String name) {
		// Fortran-style exponents (1.0D+03) occur in model input files
		String t = token.replace('D', 'E').replace('d', 'e');
		if (!DECIMAL.matcher(t).matches()) {
			throw ParseException.at(file, line, "field '" + name + "' is not a number: '" + token + "'");
		}
		double v = Double.parseDouble(t);
		if (!Double.isFinite(v)) {
			throw ParseException.at(file, line, "field '" + name + "' is out of range: '" + token + "'");
		}
		return v;
	}

	static int parseInt(Path file, int line, String token, String name) {
		try {
			return Integer.parseInt(token);
		} catch (NumberFormatException e) {
			throw ParseException.at(file, line, "field '" + name + "' is not an integer: '" + token + "'");
		}
	}
}
