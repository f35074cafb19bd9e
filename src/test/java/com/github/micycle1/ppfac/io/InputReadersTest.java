package com.github.micycle1.ppfac.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.ppfac.ParseException;
import com.github.micycle1.ppfac.model.GridNode;
import com.github.micycle1.ppfac.model.PilotPoint;

public class InputReadersTest {

	@TempDir
	Path tmp;

	@Test
	public void testPilotPoints() throws IOException {
		Path f = file("pp.dat", "# id x y zone value\n\npp1 0.0 0.0 1 10.0\n  pp2 1.5D+02 -3 2 2.5E-1\npp3 7 8\n");
		List<PilotPoint> pts = PilotPointReader.read(f);
		assertEquals(3, pts.size());
		assertEquals(new PilotPoint("pp1", 0, 0, 1, 10.0), pts.get(0));
		assertEquals(new PilotPoint("pp2", 150, -3, 2, 0.25), pts.get(1));
		assertEquals(new PilotPoint("pp3", 7, 8, PilotPoint.DEFAULT_ZONE, 0.0), pts.get(2));
	}

	@Test
	public void testPilotPointErrorsNameLine() throws IOException {
		Path f = file("pp.dat", "pp1 0 0\npp2 5\n");
		ParseException e = assertThrows(ParseException.class, () -> PilotPointReader.read(f));
		assertTrue(e.getMessage().startsWith(f + ":2:"), e.getMessage());

		Path g = file("pp2.dat", "pp1 0 0 one\n");
		assertThrows(ParseException.class, () -> PilotPointReader.read(g));
	}

	@Test
	public void testNonFiniteAndNonDecimalNumbersRejected() throws IOException {
		for (String bad : new String[] { "NaN", "Infinity", "-Infinity", "1e400", "0x1p3", "1.0f", "1.0d" }) {
			Path pp = file("pp.dat", "p1 0 0\np2 " + bad + " 10\n");
			ParseException e = assertThrows(ParseException.class, () -> PilotPointReader.read(pp), bad);
			assertTrue(e.getMessage().startsWith(pp + ":2:"), e.getMessage());

			Path nodes = file("nodes.dat", "1 5 " + bad + "\n");
			assertThrows(ParseException.class, () -> NodeReader.read(nodes), bad);
		}
		// signs, bare fractions and Fortran exponents stay valid
		List<PilotPoint> pts = PilotPointReader.read(file("ok.dat", "p1 +.5 -2. 1 3.0D0\n"));
		assertEquals(new PilotPoint("p1", 0.5, -2.0, 1, 3.0), pts.get(0));
	}

	@Test
	public void testNodes() throws IOException {
		Path f = file("nodes.dat", "C header\nc another\n* star\n# hash\n10 1.0 2.0 / trailing note\n  11 3 4\n/ whole line note\n");
		List<GridNode> nodes = NodeReader.read(f);
		assertEquals(List.of(new GridNode(10, 1, 2), new GridNode(11, 3, 4)), nodes);
	}

	@Test
	public void testDuplicateNode() throws IOException {
		Path f = file("nodes.dat", "1 0 0\n2 1 1\n1 2 2\n");
		ParseException e = assertThrows(ParseException.class, () -> NodeReader.read(f));
		assertTrue(e.getMessage().contains(":3:"));
	}

	@Test
	public void testZones() throws IOException {
		Path f = file("zones.dat", "C comment\nnode zone\n3 2\n1 1\n\n2 1\n");
		Map<Integer, Integer> zones = ZoneReader.read(f);
		assertEquals(List.of(3, 1, 2), List.copyOf(zones.keySet()));
		assertEquals(2, zones.get(3));
		assertEquals(1, zones.get(1));
	}

	@Test
	public void testZoneErrors() throws IOException {
		assertThrows(ParseException.class, () -> ZoneReader.read(file("z1.dat", "# only comments\n")));
		assertThrows(ParseException.class, () -> ZoneReader.read(file("z2.dat", "header\n1 1\n1 2\n")));
		assertThrows(ParseException.class, () -> ZoneReader.read(file("z3.dat", "header\n1\n")));
	}

	@Test
	public void testZoneStructures() throws IOException {
		Map<Integer, String> m = ZoneStructureReader.read(file("zs.dat", "# zone structure\n1 struct1\n2 Struct2\n"));
		assertEquals(Map.of(1, "struct1", 2, "Struct2"), m);
		assertThrows(ParseException.class, () -> ZoneStructureReader.read(file("zs2.dat", "1 a\n1 b\n")));
		assertThrows(ParseException.class, () -> ZoneStructureReader.read(file("zs3.dat", "1\n")));
	}

	@Test
	public void testMissingFile() {
		ParseException e = assertThrows(ParseException.class, () -> NodeReader.read(tmp.resolve("absent.dat")));
		assertTrue(e.getMessage().contains("absent.dat"));
	}

	private Path file(String name, String content) throws IOException {
		Path f = tmp.resolve(name);
		Files.writeString(f, content);
		return f;
	}
}
