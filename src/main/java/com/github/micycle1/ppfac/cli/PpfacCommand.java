package com.github.micycle1.ppfac.cli;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.github.micycle1.ppfac.config.ConfigLoader;
import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
		name = "ppfac",
		mixinStandardHelpOptions = true,
		version = "ppfac 1.0",
		description = "Pilot-point to mesh-node interpolation factors",
		subcommands = { Par2FacCommand.class, IdwCommand.class, TranslateCommand.class, CommandLine.HelpCommand.class })
public class PpfacCommand implements Callable<Integer> {

	/** A fatal input, geometry or coverage error. */
	public static final int EXIT_FAILURE = 1;
	/** A precondition violation: bad arguments or a missing input file. */
	public static final int EXIT_PRECONDITION = 2;

	@Option(names = { "-c", "--config" }, description = "Configuration file (default: ./" + ConfigLoader.CONFIG_FILE_NAME + " if present)")
	private File configFile;

	private Config config;

	@Override
	public Integer call() {
		CommandLine.usage(this, System.out);
		return 0;
	}

	Config getConfig() {
		if (config == null) {
			config = ConfigLoader.load(configFile);
		}
		return config;
	}

	/** Returns the first path that is not a readable regular file, or null. */
	static Path firstMissing(Path... files) {
		for (Path p : files) {
			if (p != null && !Files.isRegularFile(p)) {
				return p;
			}
		}
		return null;
	}

	public static CommandLine newCommandLine() {
		return new CommandLine(new PpfacCommand());
	}

	public static void main(String[] args) {
		System.exit(newCommandLine().execute(args));
	}
}
