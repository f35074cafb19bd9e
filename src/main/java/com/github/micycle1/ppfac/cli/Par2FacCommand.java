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
import com.github.micycle1.ppfac.linalg.DenseSolver;
import com.github.micycle1.ppfac.model.InterpolationMethod;
import com.github.micycle1.ppfac.model.KrigingType;
import com.github.micycle1.ppfac.model.SingularPolicy;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "par2fac", description = "Compute kriging factors from pilot points to mesh nodes, zone by zone")
public class Par2FacCommand implements Callable<Integer> {

	private static final Logger LOG = LoggerFactory.getLogger(Par2FacCommand.class);

	@Parameters(index = "0", paramLabel = "PP_FILE", description = "Pilot points file")
	private Path ppFile;

	@Parameters(index = "1", paramLabel = "NODE_FILE", description = "Mesh node file")
	private Path nodeFile;

	@Parameters(index = "2", paramLabel = "STRUCT_FILE", description = "Structure/variogram file")
	private Path structFile;

	@Parameters(index = "3", paramLabel = "ZONE_FILE", description = "Node zone file")
	private Path zoneFile;

	@Parameters(index = "4", paramLabel = "ZONE_STRUCT_FILE", description = "Zone to structure file")
	private Path zoneStructFile;

	@Parameters(index = "5", paramLabel = "FACTORS_OUTFILE", description = "Factors output file")
	private Path factorsOut;

	@Parameters(index = "6", paramLabel = "REGUL_OUTFILE", description = "Regularisation output file, or - for none")
	private String regulOut;

	@Parameters(index = "7", paramLabel = "KRIGE_TYPE", description = "o (ordinary) or s (simple)")
	private String krigeType;

	@Parameters(index = "8", paramLabel = "KRIGE_RADIUS", description = "Search radius")
	private double radius;

	@Parameters(index = "9", paramLabel = "MIN_PPOINTS", description = "Minimum pilot points per node")
	private int minPoints;

	@Parameters(index = "10", paramLabel = "MAX_PPOINTS", description = "Maximum pilot points per node")
	private int maxPoints;

	@Option(names = "--threads", description = "Worker threads for the per-node stage (default from config)")
	private Integer threads;

	@Option(names = "--on-singular", description = "SKIP, ABORT or IDW (default from config)")
	private SingularPolicy onSingular;

	@Option(names = "--solver", description = "EJML or OJALGO (default from config)")
	private DenseSolver.Backend solver;

	@ParentCommand
	private PpfacCommand parent;

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		if (maxPoints < minPoints) {
			spec.commandLine().getErr().println("Error: MAX_PPOINTS (" + maxPoints + ") < MIN_PPOINTS (" + minPoints + ")");
			return PpfacCommand.EXIT_PRECONDITION;
		}
		Path missing = PpfacCommand.firstMissing(ppFile, nodeFile, structFile, zoneFile, zoneStructFile);
		if (missing != null) {
			spec.commandLine().getErr().println("Error: file not found: " + missing);
			return PpfacCommand.EXIT_PRECONDITION;
		}

		final Par2FacOptions options;
		try {
			Par2FacOptions.Builder b = Par2FacOptions.fromConfig(parent.getConfig()).toBuilder() //
					.method(InterpolationMethod.KRIGING) //
					.krigingType(KrigingType.parse(krigeType)) //
					.searchRadius(radius) //
					.minPilotPoints(minPoints) //
					.maxPilotPoints(maxPoints);
			if (threads != null) {
				b.threads(threads);
			}
			if (onSingular != null) {
				b.singularPolicy(onSingular);
			}
			if (solver != null) {
				b.backend(solver);
			}
			options = b.build();
			options.validate();
		} catch (IllegalArgumentException | ConfigException e) {
			spec.commandLine().getErr().println("Error: " + e.getMessage());
			return PpfacCommand.EXIT_PRECONDITION;
		}

		Path regul = "-".equals(regulOut) ? null : Path.of(regulOut);
		try {
			Par2FacReport report = new Par2Fac(options)
					.run(Par2FacInputs.kriging(ppFile, nodeFile, structFile, zoneFile, zoneStructFile, factorsOut, regul));
			spec.commandLine().getOut().printf("Wrote factors for %d of %d nodes to %s (%d skipped, %d IDW fallback)%n", report.nodesWritten(),
					report.table().records().size(), factorsOut, report.skippedNodes(), report.idwFallbacks());
			return 0;
		} catch (FactorException e) {
			LOG.error("par2fac failed: {}", e.getMessage());
			spec.commandLine().getErr().println("Error: " + e.getMessage());
			return PpfacCommand.EXIT_FAILURE;
		}
	}
}
