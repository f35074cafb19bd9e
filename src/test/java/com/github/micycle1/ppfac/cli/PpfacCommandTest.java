package com.github.micycle1.ppfac.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.ppfac.SampleInputs;

import picocli.CommandLine;

public class PpfacCommandTest {

	@TempDir
	Path tmp;

	private final StringWriter out = new StringWriter();
	private final StringWriter err = new StringWriter();

	private int run(String... args) {
		CommandLine cmd = PpfacCommand.newCommandLine();
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd.execute(args);
	}

	private String[] par2fac(SampleInputs in, Path factors, String regul, String min, String max, String... extra) {
		String[] base = { "par2fac", in.pilotPoints.toString(), in.nodes.toString(), in.structures.toString(), in.zones.toString(),
				in.zoneStructures.toString(), factors.toString(), regul, "o", "1e30", min, max };
		String[] all = new String[base.length + extra.length];
		System.arraycopy(base, 0, all, 0, base.length);
		System.arraycopy(extra, 0, all, base.length, extra.length);
		return all;
	}

	@Test
	public void testPar2Fac() throws IOException {
		SampleInputs in = SampleInputs.write(tmp);
		Path factors = tmp.resolve("factors.dat");
		Path regul = tmp.resolve("regul.dat");

		assertEquals(0, run(par2fac(in, factors, regul.toString(), "1", "4", "--threads", "2", "--solver", "OJALGO")));
		assertEquals(5, Files.readAllLines(factors).size());
		assertTrue(Files.exists(regul));
		assertTrue(out.toString().contains("3 of 3 nodes"), out.toString());
	}

	@Test
	public void testDashSkipsRegularisation() {
		SampleInputs in = SampleInputs.write(tmp);
		Path factors = tmp.resolve("factors.dat");
		assertEquals(0, run(par2fac(in, factors, "-", "1", "4")));
		assertTrue(Files.exists(factors));
		assertFalse(Files.exists(tmp.resolve("-")));
	}

	@Test
	public void testMaxBelowMin() {
		SampleInputs in = SampleInputs.write(tmp);
		Path factors = tmp.resolve("factors.dat");
		assertEquals(PpfacCommand.EXIT_PRECONDITION, run(par2fac(in, factors, "-", "5", "2")));
		assertFalse(Files.exists(factors));
		assertTrue(err.toString().contains("MAX_PPOINTS"));
	}

	@Test
	public void testMissingInput() throws IOException {
		SampleInputs in = SampleInputs.write(tmp);
		Files.delete(in.zones);
		assertEquals(PpfacCommand.EXIT_PRECONDITION, run(par2fac(in, tmp.resolve("factors.dat"), "-", "1", "4")));
		assertTrue(err.toString().contains("zones.dat"));
	}

	@Test
	public void testBadKrigingType() {
		SampleInputs in = SampleInputs.write(tmp);
		String[] args = par2fac(in, tmp.resolve("factors.dat"), "-", "1", "4");
		args[8] = "u";
		assertEquals(PpfacCommand.EXIT_PRECONDITION, run(args));
	}

	@Test
	public void testFatalInputError() {
		SampleInputs in = SampleInputs.write(tmp).pilotPoints("a 3.0 4.0\nb 3.0 4.0\n");
		Path factors = tmp.resolve("factors.dat");
		assertEquals(PpfacCommand.EXIT_FAILURE, run(par2fac(in, factors, "-", "1", "4")));
		assertTrue(err.toString().contains("coincide"));
		assertFalse(Files.exists(factors));
	}

	@Test
	public void testSingularPolicyOption() {
		SampleInputs in = SampleInputs.write(tmp).structures(SampleInputs.ZERO_SILL_STRUCTURES);
		assertEquals(PpfacCommand.EXIT_FAILURE, run(par2fac(in, tmp.resolve("a.dat"), "-", "1", "4", "--on-singular", "ABORT")));
		assertEquals(0, run(par2fac(in, tmp.resolve("b.dat"), "-", "1", "4", "--on-singular", "SKIP")));
	}

	@Test
	public void testBadConfigurationIsPrecondition() throws IOException {
		SampleInputs in = SampleInputs.write(tmp);
		Path badValue = tmp.resolve("bad-value.conf");
		Files.writeString(badValue, "ppfac.kriging.on-singular = MAYBE\n");
		Path malformed = tmp.resolve("malformed.conf");
		Files.writeString(malformed, "ppfac { threads = \n");

		for (Path conf : List.of(badValue, malformed)) {
			String[] p2f = par2fac(in, tmp.resolve("factors.dat"), "-", "1", "4");
			String[] args = new String[p2f.length + 2];
			args[0] = "-c";
			args[1] = conf.toString();
			System.arraycopy(p2f, 0, args, 2, p2f.length);
			assertEquals(PpfacCommand.EXIT_PRECONDITION, run(args));
			assertEquals(PpfacCommand.EXIT_PRECONDITION,
					run("-c", conf.toString(), "idw", in.pilotPoints.toString(), in.nodes.toString(), tmp.resolve("idw.dat").toString()));
		}
		assertFalse(Files.exists(tmp.resolve("factors.dat")));
		assertFalse(Files.exists(tmp.resolve("idw.dat")));
	}

	@Test
	public void testUsageErrorKeepsPicocliCode() {
		assertEquals(CommandLine.ExitCode.USAGE, run("par2fac", "only-one-arg"));
	}

	@Test
	public void testIdw() throws IOException {
		SampleInputs in = SampleInputs.write(tmp);
		Path factors = tmp.resolve("idw.dat");
		assertEquals(0, run("idw", in.pilotPoints.toString(), in.nodes.toString(), factors.toString(), "-n", "4"));
		List<String> lines = Files.readAllLines(factors);
		assertEquals("         3     4        1  2.50000000E-01        2  2.50000000E-01        3  2.50000000E-01        4  2.50000000E-01",
				lines.get(4));
	}

	@Test
	public void testTranslate() throws IOException {
		SampleInputs in = SampleInputs.write(tmp);
		Path factors = tmp.resolve("idw.dat");
		assertEquals(0, run("idw", in.pilotPoints.toString(), in.nodes.toString(), factors.toString()));

		Path trans = tmp.resolve("trans.dat");
		Files.writeString(trans, "1 101\n2 102\n3 103\n");
		Path translated = tmp.resolve("translated.dat");
		assertEquals(0, run("translate", factors.toString(), trans.toString(), translated.toString()));
		assertTrue(Files.readAllLines(translated).get(2).startsWith("       101     3"));

		Files.writeString(trans, "1 101\n");
		assertEquals(PpfacCommand.EXIT_FAILURE, run("translate", factors.toString(), trans.toString(), translated.toString()));
	}
}
