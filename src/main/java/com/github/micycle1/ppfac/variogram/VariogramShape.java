package com.github.micycle1.ppfac.variogram;

/**
 * Variogram shape functions, keyed by the structure file's {@code VARTYPE}
 * code. Each returns the covariance of a unit-sill component at (anisotropic)
 * lag {@code h}.
 */
public enum VariogramShape {

	SPHERICAL(1) {
		@Override
		public double covariance(double h, double a, double maxPowerVariance) {
			if (h >= a) {
				return 0.0;
			}
			double r = h / a;
			return 1.0 - r * (1.5 - 0.5 * r * r);
		}
	},
	EXPONENTIAL(2) {
		@Override
		public double covariance(double h, double a, double maxPowerVariance) {
			return Math.exp(-h / a);
		}
	},
	GAUSSIAN(3) {
		@Override
		public double covariance(double h, double a, double maxPowerVariance) {
			double r = h / a;
			return Math.exp(-r * r);
		}
	},
	/**
	 * Power variogram {@code h^a}, 0 &lt; a &lt; 2, turned into a covariance by
	 * subtracting it from the structure's maximum power variance.
	 */
	POWER(4) {
		@Override
		public double covariance(double h, double a, double maxPowerVariance) {
			return maxPowerVariance - Math.pow(h, a);
		}
	};

	private final int code;

	VariogramShape(int code) {
		this.code = code;
	}

	public int code() {
		return code;
	}

	public abstract double covariance(double h, double a, double maxPowerVariance);

	/**
	 * @throws IllegalArgumentException for an unknown code
	 */
	public static VariogramShape fromCode(int code) {
		for (VariogramShape s : values()) {
			if (s.code == code) {
				return s;
			}
		}
		throw new IllegalArgumentException("Unknown VARTYPE " + code + " (expected 1-4)");
	}
}
