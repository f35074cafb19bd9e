package com.github.micycle1.ppfac.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The sparse weight table of one run: a header naming the pilot-point source
 * and one {@link WeightRecord} per mesh node, kept in ascending node-id order.
 */
public record FactorTable(String pilotPointFile, int pilotPointCount, List<WeightRecord> records) {

	public FactorTable {
		Objects.requireNonNull(pilotPointFile, "pilotPointFile must not be null");
		records = records.stream().sorted(Comparator.comparingInt(WeightRecord::targetId)).toList();
	}

	public int emptyRecordCount() {
		return (int) records.stream().filter(WeightRecord::isEmpty).count();
	}

	/**
	 * Interpolates a pilot-point value vector onto every node of the table.
	 *
	 * @param values one value per pilot point, in pilot-point file order
	 * @return one value per record, in record order (NaN for empty records)
	 */
	public double[] interpolate(double[] values) {
		if (values.length != pilotPointCount) {
			throw new IllegalArgumentException("Expected " + pilotPointCount + " pilot-point values, got " + values.length);
		}
		double[] out = new double[records.size()];
		for (int i = 0; i < out.length; i++) {
			out[i] = records.get(i).interpolate(values);
		}
		return out;
	}
}
