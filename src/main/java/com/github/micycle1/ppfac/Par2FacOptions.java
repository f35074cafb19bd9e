package com.github.micycle1.ppfac;

import java.util.Locale;
import java.util.Objects;

import com.github.micycle1.ppfac.linalg.DenseSolver;
import com.github.micycle1.ppfac.model.InterpolationMethod;
import com.github.micycle1.ppfac.model.KrigingType;
import com.github.micycle1.ppfac.model.SingularPolicy;
import com.github.micycle1.ppfac.model.StructureDefaults;
import com.github.micycle1.ppfac.model.Transform;
import com.typesafe.config.Config;

/**
 * Settings of one {@link Par2Fac} run. Immutable; build with {@link #builder()}
 * or read from the {@code ppfac} section of a Typesafe {@link Config} with
 * {@link #fromConfig(Config)}.
 */
public final class Par2FacOptions {

	private final InterpolationMethod method;
	private final KrigingType krigingType;
	private final double searchRadius;
	private final int minPilotPoints;
	private final int maxPilotPoints;
	private final int idwPoints;
	private final SingularPolicy singularPolicy;
	private final DenseSolver.Backend backend;
	private final double conditionTolerance;
	private final int threads;
	private final StructureDefaults structureDefaults;

	private Par2FacOptions(Builder b) {
		this.method = b.method;
		this.krigingType = b.krigingType;
		this.searchRadius = b.searchRadius;
		this.minPilotPoints = b.minPilotPoints;
		this.maxPilotPoints = b.maxPilotPoints;
		this.idwPoints = b.idwPoints;
		this.singularPolicy = b.singularPolicy;
		this.backend = b.backend;
		this.conditionTolerance = b.conditionTolerance;
		this.threads = b.threads;
		this.structureDefaults = b.structureDefaults;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads the {@code ppfac} section (see {@code reference.conf}).
	 */
	public static Par2FacOptions fromConfig(Config root) {
		Config c = root.getConfig("ppfac");
		Config k = c.getConfig("kriging");
		Config d = c.getConfig("structure-defaults");
		return builder() //
				.method(InterpolationMethod.valueOf(c.getString("method").toUpperCase(Locale.ROOT))) //
				.krigingType(KrigingType.parse(k.getString("type"))) //
				.searchRadius(k.getDouble("search-radius")) //
				.minPilotPoints(k.getInt("min-pilot-points")) //
				.maxPilotPoints(k.getInt("max-pilot-points")) //
				.conditionTolerance(k.getDouble("condition-tolerance")) //
				.singularPolicy(k.getEnum(SingularPolicy.class, "on-singular")) //
				.backend(k.getEnum(DenseSolver.Backend.class, "solver")) //
				.idwPoints(c.getInt("idw.points")) //
				.threads(c.getInt("threads")) //
				.structureDefaults(new StructureDefaults(d.getDouble("nugget"), Transform.parse(d.getString("transform")),
						d.getDouble("max-power-variance"))) //
				.build();
	}

	/** A copy with a different method. */
	public Par2FacOptions withMethod(InterpolationMethod m) {
		return toBuilder().method(m).build();
	}

	public Builder toBuilder() {
		return builder().method(method).krigingType(krigingType).searchRadius(searchRadius).minPilotPoints(minPilotPoints)
				.maxPilotPoints(maxPilotPoints).idwPoints(idwPoints).singularPolicy(singularPolicy).backend(backend)
				.conditionTolerance(conditionTolerance).threads(threads).structureDefaults(structureDefaults);
	}

	/**
	 * Checks the preconditions that must hold before any input is read.
	 *
	 * @throws IllegalArgumentException on the first violation
	 */
	public void validate() {
		if (maxPilotPoints < minPilotPoints) {
			throw new IllegalArgumentException("max pilot points (" + maxPilotPoints + ") < min pilot points (" + minPilotPoints + ")");
		}
		if (minPilotPoints < 1) {
			throw new IllegalArgumentException("min pilot points must be >= 1, was " + minPilotPoints);
		}
		if (!(searchRadius > 0.0)) {
			throw new IllegalArgumentException("search radius must be positive, was " + searchRadius);
		}
		if (method == InterpolationMethod.IDW && (idwPoints < minPilotPoints || idwPoints > maxPilotPoints)) {
			throw new IllegalArgumentException("IDW point count " + idwPoints + " is outside " + minPilotPoints + ".." + maxPilotPoints);
		}
		if (threads < 1) {
			throw new IllegalArgumentException("threads must be >= 1, was " + threads);
		}
		if (conditionTolerance < 0.0) {
			throw new IllegalArgumentException("condition tolerance must be >= 0");
		}
	}

	public InterpolationMethod getMethod() {
		return method;
	}

	public KrigingType getKrigingType() {
		return krigingType;
	}

	public double getSearchRadius() {
		return searchRadius;
	}

	public int getMinPilotPoints() {
		return minPilotPoints;
	}

	public int getMaxPilotPoints() {
		return maxPilotPoints;
	}

	public int getIdwPoints() {
		return idwPoints;
	}

	public SingularPolicy getSingularPolicy() {
		return singularPolicy;
	}

	public DenseSolver.Backend getBackend() {
		return backend;
	}

	public double getConditionTolerance() {
		return conditionTolerance;
	}

	public int getThreads() {
		return threads;
	}

	public StructureDefaults getStructureDefaults() {
		return structureDefaults;
	}

	@Override
	public String toString() {
		return "Par2FacOptions{method=" + method + ", krigingType=" + krigingType + ", searchRadius=" + searchRadius + ", minPilotPoints="
				+ minPilotPoints + ", maxPilotPoints=" + maxPilotPoints + ", idwPoints=" + idwPoints + ", singularPolicy=" + singularPolicy
				+ ", backend=" + backend + ", threads=" + threads + "}";
	}

	public static final class Builder {
		private InterpolationMethod method = InterpolationMethod.KRIGING;
		private KrigingType krigingType = KrigingType.ORDINARY;
		private double searchRadius = 1.0e30;
		private int minPilotPoints = 1;
		private int maxPilotPoints = 50;
		private int idwPoints = 3;
		private SingularPolicy singularPolicy = SingularPolicy.SKIP;
		private DenseSolver.Backend backend = DenseSolver.Backend.EJML;
		private double conditionTolerance = 1.0e-12;
		private int threads = 1;
		private StructureDefaults structureDefaults = StructureDefaults.STANDARD;

		private Builder() {
		}

		public Builder method(InterpolationMethod method) {
			this.method = Objects.requireNonNull(method);
			return this;
		}

		public Builder krigingType(KrigingType krigingType) {
			this.krigingType = Objects.requireNonNull(krigingType);
			return this;
		}

		public Builder searchRadius(double searchRadius) {
			this.searchRadius = searchRadius;
			return this;
		}

		public Builder minPilotPoints(int minPilotPoints) {
			this.minPilotPoints = minPilotPoints;
			return this;
		}

		public Builder maxPilotPoints(int maxPilotPoints) {
			this.maxPilotPoints = maxPilotPoints;
			return this;
		}

		public Builder idwPoints(int idwPoints) {
			this.idwPoints = idwPoints;
			return this;
		}

		public Builder singularPolicy(SingularPolicy singularPolicy) {
			this.singularPolicy = Objects.requireNonNull(singularPolicy);
			return this;
		}

		public Builder backend(DenseSolver.Backend backend) {
			this.backend = Objects.requireNonNull(backend);
			return this;
		}

		public Builder conditionTolerance(double conditionTolerance) {
			this.conditionTolerance = conditionTolerance;
			return this;
		}

		public Builder threads(int threads) {
			this.threads = threads;
			return this;
		}

		public Builder structureDefaults(StructureDefaults structureDefaults) {
			this.structureDefaults = Objects.requireNonNull(structureDefaults);
			return this;
		}

		public Par2FacOptions build() {
			return new Par2FacOptions(this);
		}
	}
}
