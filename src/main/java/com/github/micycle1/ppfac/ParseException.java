package com.github.micycle1.ppfac;

import java.nio.file.Path;

/**
 * An input file could not be opened or holds a malformed record. Always fatal.
 */
public class ParseException extends FactorException {

	private static final long serialVersionUID = 1L;

	public ParseException(String message) {
		super(message);
	}

	public ParseException(String message, Throwable cause) {
		super(message, cause);
	}

	public static ParseException at(Path file, int line, String problem) {
		return new ParseException(file + ":" + line + ": " + problem);
	}
}
