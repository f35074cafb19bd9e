package com.github.micycle1.ppfac.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.ppfac.io.RegularisationWriter.ZoneCovariance;

public class RegularisationWriterTest {

	@TempDir
	Path tmp;

	@Test
	public void testZonesInAscendingOrder() throws IOException {
		SortedMap<Integer, ZoneCovariance> zones = new TreeMap<>();
		zones.put(3, new ZoneCovariance("late", new String[] { "c" }, new double[][] { { 2.0 } }));
		zones.put(1, new ZoneCovariance("struct1", new String[] { "a", "b" }, new double[][] { { 1.0, 0.5 }, { 0.5, 1.0 } }));

		Path out = tmp.resolve("regul.dat");
		assertEquals(2, RegularisationWriter.write(out, zones));
		assertEquals(List.of( //
				"ZONE 1 struct1 2", //
				"a  1.00000000E+00  5.00000000E-01", //
				"b  5.00000000E-01  1.00000000E+00", //
				"ZONE 3 late 1", //
				"c  2.00000000E+00"), Files.readAllLines(out));
	}
}
