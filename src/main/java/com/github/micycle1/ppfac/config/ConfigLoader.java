package com.github.micycle1.ppfac.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the {@code ppfac} configuration. Precedence, highest first: system
 * properties ({@code -Dppfac.threads=4}), an explicit file, {@code ppfac.conf}
 * in the working directory, then the defaults in {@code reference.conf}.
 */
public final class ConfigLoader {

	private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

	public static final String CONFIG_FILE_NAME = "ppfac.conf";

	private ConfigLoader() {
	}

	/**
	 * @param explicitFile a configuration file named on the command line, or null
	 * @throws com.typesafe.config.ConfigException if a file cannot be parsed
	 * @throws IllegalArgumentException            if {@code explicitFile} does not
	 *                                             exist
	 */
	public static Config load(File explicitFile) {
		final Config fileConfig;
		if (explicitFile != null) {
			if (!explicitFile.isFile()) {
				throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
			}
			LOG.info("Using configuration file {}", explicitFile.getAbsolutePath());
			fileConfig = ConfigFactory.parseFile(explicitFile);
		} else {
			File cwd = new File(CONFIG_FILE_NAME);
			if (cwd.isFile()) {
				LOG.info("Using configuration file {}", cwd.getAbsolutePath());
				fileConfig = ConfigFactory.parseFile(cwd);
			} else {
				LOG.debug("No {} in working directory; using defaults", CONFIG_FILE_NAME);
				fileConfig = ConfigFactory.empty();
			}
		}
		return ConfigFactory.systemProperties() //
				.withFallback(fileConfig) //
				.withFallback(ConfigFactory.defaultReference()) //
				.resolve();
	}

	/** Defaults only, from {@code reference.conf}. */
	public static Config defaults() {
		return ConfigFactory.defaultReference().resolve();
	}
}
