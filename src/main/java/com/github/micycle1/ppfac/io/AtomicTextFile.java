package com.github.micycle1.ppfac.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.github.micycle1.ppfac.FactorException;

/**
 * Writes a whole text file through a temporary sibling and a rename, so readers
 * never see a half-written file.
 */
final class AtomicTextFile {

	private AtomicTextFile() {
	}

	static void write(Path target, CharSequence content) {
		Path abs = target.toAbsolutePath();
		Path dir = abs.getParent();
		Path tmp = null;
		try {
			if (dir != null) {
				Files.createDirectories(dir);
			}
			tmp = Files.createTempFile(dir, abs.getFileName().toString(), ".tmp");
			Files.writeString(tmp, content, StandardCharsets.UTF_8);
			try {
				Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException e) {
			if (tmp != null) {
				try {
					Files.deleteIfExists(tmp);
				} catch (IOException suppressed) {
					e.addSuppressed(suppressed);
				}
			}
			throw new FactorException("Cannot write " + target + ": " + e.getMessage(), e);
		}
	}
}
