package com.github.micycle1.ppfac.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.FactorException;
import com.github.micycle1.ppfac.Par2Fac;
import com.github.micycle1.ppfac.Par2FacInputs;
import com.github.micycle1.ppfac.Par2FacOptions;
import com.github.micycle1.ppfac.Par2FacReport;
import com.github.micycle1.ppfac.model.InterpolationMethod;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "idw", description = "Compute inverse-distance-squared factors from the nearest pilot points")
public class IdwCommand implements Callable<Integer> {

	private static final Logger LOG = LoggerFactory.getLogger(IdwCommand.class);

	@Parameters(index = "0", paramLabel = "PP_FILE", description = "Pilot points file")
	private Path ppFile;

	@Parameters(index = "1", paramLabel = "NODE_FILE", description = "Mesh node file")
	private Path nodeFile;

	@Parameters(index = "2", paramLabel = "FACTORS_OUTFILE", description = "Factors output file")
	private Path factorsOut;

	@Option(names = { "-n", "--points" }, description = "Pilot points per node (default from config)")
	private Integer points;

	@ParentCommand
	private PpfacCommand parent;

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		Path missing = PpfacCommand.firstMissing(ppFile, nodeFile);
		if (missing != null) {
			spec.commandLine().getErr().println("Error: file not found: " + missing);
			return PpfacCommand.EXIT_PRECONDITION;
		}
		final Par2FacOptions options;
		try {
			Par2FacOptions.Builder b = Par2FacOptions.fromConfig(parent.getConfig()).toBuilder().method(InterpolationMethod.IDW);
			if (points != null) {
				// pin the search bounds to the explicit count
				b.idwPoints(points).minPilotPoints(Math.max(1, points)).maxPilotPoints(Math.max(1, points));
			}
			options = b.build();
			options.validate();
		} catch (IllegalArgumentException | ConfigException e) {
			spec.commandLine().getErr().println("Error: " + e.getMessage());
			return PpfacCommand.EXIT_PRECONDITION;
		}
		try {
			Par2FacReport report = new Par2Fac(options).run(Par2FacInputs.idw(ppFile, nodeFile, factorsOut));
			spec.commandLine().getOut().printf("Wrote factors for %d nodes to %s%n", report.nodesWritten(), factorsOut);
			return 0;
		} catch (FactorException e) {
			LOG.error("idw failed: {}", e.getMessage());
			spec.commandLine().getErr().println("Error: " + e.getMessage());
			return PpfacCommand.EXIT_FAILURE;
		}
	}
}
