package com.github.micycle1.ppfac;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.Par2FacReport.NodeFailure;
import com.github.micycle1.ppfac.Par2FacReport.Reason;
import com.github.micycle1.ppfac.io.FactorWriter;
import com.github.micycle1.ppfac.io.NodeReader;
import com.github.micycle1.ppfac.io.PilotPointReader;
import com.github.micycle1.ppfac.io.RegularisationWriter;
import com.github.micycle1.ppfac.io.RegularisationWriter.ZoneCovariance;
import com.github.micycle1.ppfac.io.StructureReader;
import com.github.micycle1.ppfac.io.ZoneReader;
import com.github.micycle1.ppfac.io.ZoneStructureReader;
import com.github.micycle1.ppfac.linalg.DenseSolver;
import com.github.micycle1.ppfac.model.Contributor;
import com.github.micycle1.ppfac.model.FactorTable;
import com.github.micycle1.ppfac.model.GridNode;
import com.github.micycle1.ppfac.model.InterpolationMethod;
import com.github.micycle1.ppfac.model.PilotPoint;
import com.github.micycle1.ppfac.model.SingularPolicy;
import com.github.micycle1.ppfac.model.Structure;
import com.github.micycle1.ppfac.model.StructureLibrary;
import com.github.micycle1.ppfac.model.Transform;
import com.github.micycle1.ppfac.model.WeightRecord;

/**
 * <p>
 * Computes pilot-point interpolation factors for every node of a mesh and
 * writes them to a factors file (the PPK2FAC workflow).
 * </p>
 *
 * <p>
 * Pipeline, in order:
 * </p>
 * <ol>
 * <li>check options ({@code max >= min} pilot points etc.); nothing is read if
 * this fails;</li>
 * <li>read pilot points and reject coincident ones;</li>
 * <li>read mesh nodes;</li>
 * <li>kriging only: read structures, node zones and zone-structure assignment,
 * then check that every node has a zone and every used zone a structure;</li>
 * <li>compute weights per node, grouped by zone;</li>
 * <li>write the factors file (and optionally the regularisation file).</li>
 * </ol>
 *
 * <p>
 * Parse, geometry and coverage errors abort the run. Per-node problems (too few
 * pilot points in range, singular kriging system under
 * {@link SingularPolicy#SKIP} or {@link SingularPolicy#IDW}) are collected in
 * the {@link Par2FacReport}; such nodes are written with no contributors unless
 * they fell back to IDW.
 * </p>
 *
 * <p>
 * With more than one thread the per-node stage runs on its own
 * {@link ForkJoinPool}. Each node owns one result slot, and results are
 * collected and written in ascending node-id order, so output never depends on
 * scheduling.
 * </p>
 */
public class Par2Fac {

	private static final Logger LOG = LoggerFactory.getLogger(Par2Fac.class);

	/** Zone recorded for nodes of an inverse-distance run, which has no zones. */
	public static final int NO_ZONE = 0;

	private final Par2FacOptions options;

	public Par2Fac(Par2FacOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public Par2FacReport run(Par2FacInputs in) {
		options.validate();
		LOG.info("Computing {} factors: {}", options.getMethod(), options);

		List<PilotPoint> pilotPoints = PilotPointReader.read(in.pilotPoints());
		if (pilotPoints.isEmpty()) {
			throw new ParseException(in.pilotPoints() + ": no pilot points");
		}
		LOG.info("Read {} pilot points from {}", pilotPoints.size(), in.pilotPoints());
		double spacing = Geometry.requireDistinct(pilotPoints);
		LOG.debug("Minimum pilot-point spacing {}", spacing);

		List<GridNode> nodes = new ArrayList<>(NodeReader.read(in.nodes()));
		if (nodes.isEmpty()) {
			throw new ParseException(in.nodes() + ": no nodes");
		}
		nodes.sort(Comparator.comparingInt(GridNode::id));
		LOG.info("Read {} nodes from {}", nodes.size(), in.nodes());

		final NodeTask task;
		SortedMap<Integer, KrigingSolver> solvers = new TreeMap<>();
		if (options.getMethod() == InterpolationMethod.KRIGING) {
			if (in.structures() == null || in.zones() == null || in.zoneStructures() == null) {
				throw new IllegalArgumentException("Kriging needs structure, zone and zone-structure files");
			}
			StructureLibrary library = new StructureReader(options.getStructureDefaults()).read(in.structures());
			Map<Integer, Integer> zones = ZoneReader.read(in.zones());
			Map<Integer, String> zoneStructures = ZoneStructureReader.read(in.zoneStructures());
			LOG.info("Read {} structure(s), {} zone assignments, {} zone-structure pairs", library.size(), zones.size(), zoneStructures.size());

			Map<Integer, Structure> byZone = validateCoverage(nodes, zones, zoneStructures, library);
			DenseSolver dense = DenseSolver.create(options.getBackend(), options.getConditionTolerance());
			byZone.forEach((zone, structure) -> solvers.put(zone, new KrigingSolver(zone, structure, options.getKrigingType(), dense)));

			PilotPointSearch search = new PilotPointSearch(pilotPoints, options.getSearchRadius(), options.getMinPilotPoints(),
					options.getMaxPilotPoints());
			task = node -> krigeNode(node, zones.get(node.id()), solvers.get(zones.get(node.id())), search);
		} else {
			InverseDistanceSolver idw = new InverseDistanceSolver(options.getIdwPoints());
			double[][] coords = new double[pilotPoints.size()][];
			for (int i = 0; i < coords.length; i++) {
				coords[i] = new double[] { pilotPoints.get(i).x(), pilotPoints.get(i).y() };
			}
			task = node -> new NodeOutcome(new WeightRecord(node.id(), NO_ZONE, Transform.NONE, idw.weights(coords, node.x(), node.y())),
					null);
		}

		NodeOutcome[] outcomes = computeAll(nodes, task);

		List<WeightRecord> records = new ArrayList<>(outcomes.length);
		List<NodeFailure> failures = new ArrayList<>();
		int fallbacks = 0;
		for (NodeOutcome o : outcomes) {
			records.add(o.record);
			if (o.failure != null) {
				failures.add(o.failure);
				if (o.failure.reason() == Reason.SINGULAR_SYSTEM_IDW_FALLBACK) {
					fallbacks++;
				}
				LOG.debug("{}", o.failure.message());
			}
		}

		FactorTable table = new FactorTable(in.pilotPoints().toString(), pilotPoints.size(), records);
		int written = FactorWriter.write(in.factorsOut(), table);
		LOG.info("Wrote factors for {} of {} nodes to {}", written, records.size(), in.factorsOut());

		if (in.regularisationOut() != null && !solvers.isEmpty()) {
			int zonesWritten = RegularisationWriter.write(in.regularisationOut(), zoneCovariances(pilotPoints, solvers));
			LOG.info("Wrote regularisation data for {} zone(s) to {}", zonesWritten, in.regularisationOut());
		}

		Par2FacReport report = new Par2FacReport(table, written, failures, fallbacks, spacing);
		if (!report.isComplete()) {
			LOG.warn("{} node(s) skipped, {} node(s) fell back to IDW", report.skippedNodes(), fallbacks);
		}
		return report;
	}

	public Par2FacOptions getOptions() {
		return options;
	}

	/**
	 * Node and zone consistency. Returns the structure of every zone that some
	 * node uses, keyed by zone.
	 */
	static Map<Integer, Structure> validateCoverage(List<GridNode> nodes, Map<Integer, Integer> zones, Map<Integer, String> zoneStructures,
			StructureLibrary library) {
		if (nodes.size() != zones.size()) {
			throw new CoverageException("Mesh has " + nodes.size() + " nodes but the zone file assigns " + zones.size());
		}
		SortedMap<Integer, Structure> byZone = new TreeMap<>();
		for (GridNode node : nodes) {
			Integer zone = zones.get(node.id());
			if (zone == null) {
				throw new CoverageException("Node " + node.id() + " has no zone");
			}
			if (byZone.containsKey(zone)) {
				continue;
			}
			String name = zoneStructures.get(zone);
			if (name == null) {
				throw new CoverageException("Zone " + zone + " (node " + node.id() + ") has no structure assignment");
			}
			Structure s = library.find(name)
					.orElseThrow(() -> new CoverageException("Zone " + zone + " is assigned structure '" + name + "', which is not defined"));
			byZone.put(zone, s);
		}
		return byZone;
	}

	private NodeOutcome krigeNode(GridNode node, int zone, KrigingSolver solver, PilotPointSearch search) {
		final List<Neighbour> candidates;
		try {
			candidates = search.find(node, zone);
		} catch (InsufficientPilotPointsException e) {
			return new NodeOutcome(WeightRecord.empty(node.id(), zone), new NodeFailure(node.id(), zone, Reason.INSUFFICIENT_PILOT_POINTS, e.getMessage()));
		}
		Transform transform = solver.getStructure().transform();
		try {
			List<Contributor> w = solver.solve(node, candidates);
			return new NodeOutcome(new WeightRecord(node.id(), zone, transform, w), null);
		} catch (SingularKrigingSystemException e) {
			switch (options.getSingularPolicy()) {
				case ABORT:
					throw e;
				case IDW:
					List<Contributor> w = InverseDistanceSolver.inverseSquare(candidates);
					return new NodeOutcome(new WeightRecord(node.id(), zone, transform, w),
							new NodeFailure(node.id(), zone, Reason.SINGULAR_SYSTEM_IDW_FALLBACK, e.getMessage()));
				case SKIP:
				default:
					return new NodeOutcome(WeightRecord.empty(node.id(), zone), new NodeFailure(node.id(), zone, Reason.SINGULAR_SYSTEM, e.getMessage()));
			}
		}
	}

	private NodeOutcome[] computeAll(List<GridNode> nodes, NodeTask task) {
		final int n = nodes.size();
		final NodeOutcome[] out = new NodeOutcome[n];
		if (options.getThreads() <= 1) {
			for (int i = 0; i < n; i++) {
				out[i] = task.compute(nodes.get(i));
			}
			return out;
		}

		ForkJoinPool pool = new ForkJoinPool(options.getThreads());
		try {
			pool.submit(() -> IntStream.range(0, n).parallel().forEach(i -> out[i] = task.compute(nodes.get(i)))).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FactorException("Interrupted while computing factors", e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw new FactorException("Factor computation failed", e.getCause());
		} finally {
			pool.shutdown();
		}
		return out;
	}

	private static SortedMap<Integer, ZoneCovariance> zoneCovariances(List<PilotPoint> pilotPoints, SortedMap<Integer, KrigingSolver> solvers) {
		SortedMap<Integer, ZoneCovariance> out = new TreeMap<>();
		solvers.forEach((zone, solver) -> {
			List<Neighbour> members = new ArrayList<>();
			List<String> ids = new ArrayList<>();
			for (int i = 0; i < pilotPoints.size(); i++) {
				PilotPoint p = pilotPoints.get(i);
				if (p.zone() == zone) {
					members.add(new Neighbour(i, p.x(), p.y(), 0.0));
					ids.add(p.id());
				}
			}
			if (!members.isEmpty()) {
				out.put(zone, new ZoneCovariance(solver.getStructure().name(), ids.toArray(new String[0]), solver.covarianceMatrix(members)));
			}
		});
		return out;
	}

	@FunctionalInterface
	private interface NodeTask {
		NodeOutcome compute(GridNode node);
	}

	private static final class NodeOutcome {
		final WeightRecord record;
		final NodeFailure failure;

		NodeOutcome(WeightRecord record, NodeFailure failure) {
			this.record = record;
			this.failure = failure;
		}
	}
}
