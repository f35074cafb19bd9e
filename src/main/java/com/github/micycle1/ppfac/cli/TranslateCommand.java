package com.github.micycle1.ppfac.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.github.micycle1.ppfac.FactorException;
import com.github.micycle1.ppfac.io.NodeIdTranslator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "translate", description = "Replace sequential node ids in a factors file with model node ids")
public class TranslateCommand implements Callable<Integer> {

	@Parameters(index = "0", paramLabel = "FACTORS_FILE")
	private Path factors;

	@Parameters(index = "1", paramLabel = "TRANS_FILE", description = "sequential_id actual_id pairs")
	private Path translation;

	@Parameters(index = "2", paramLabel = "OUT_FILE")
	private Path out;

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		Path missing = PpfacCommand.firstMissing(factors, translation);
		if (missing != null) {
			spec.commandLine().getErr().println("Error: file not found: " + missing);
			return PpfacCommand.EXIT_PRECONDITION;
		}
		try {
			int n = NodeIdTranslator.translate(factors, translation, out);
			spec.commandLine().getOut().printf("Translated %d node ids into %s%n", n, out);
			return 0;
		} catch (FactorException e) {
			spec.commandLine().getErr().println("Error: " + e.getMessage());
			return PpfacCommand.EXIT_FAILURE;
		}
	}
}
