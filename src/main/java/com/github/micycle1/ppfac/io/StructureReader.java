package com.github.micycle1.ppfac.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.ppfac.ParseException;
import com.github.micycle1.ppfac.model.NestedVariogram;
import com.github.micycle1.ppfac.model.Structure;
import com.github.micycle1.ppfac.model.StructureDefaults;
import com.github.micycle1.ppfac.model.StructureLibrary;
import com.github.micycle1.ppfac.model.Transform;
import com.github.micycle1.ppfac.model.VariogramModel;
import com.github.micycle1.ppfac.variogram.VariogramShape;

/**
 * <p>
 * Parser for structure files made of keyword blocks:
 * </p>
 *
 * <pre>
 * STRUCTURE struct1
 *   NUGGET      0.1
 *   TRANSFORM   log
 *   NUMVARIOGRAM 1
 *   VARIOGRAM   vario1  1.0
 * END STRUCTURE
 *
 * VARIOGRAM vario1
 *   VARTYPE     2
 *   BEARING     0.0
 *   A           500.0
 *   ANISOTROPY  1.0
 * END VARIOGRAM
 * </pre>
 *
 * <p>
 * Keys are case-insensitive and unknown keys are ignored. The reader is a
 * three-state machine (seeking a block, inside a structure, inside a
 * variogram); {@code END} closes the open block and returns to seeking.
 * Variogram references are resolved after the whole file is read, so blocks
 * may appear in any order. Keys a structure leaves out take their values from
 * the {@link StructureDefaults} given to the constructor.
 * </p>
 */
public final class StructureReader {

	private static final Logger LOG = LoggerFactory.getLogger(StructureReader.class);

	private enum State {
		SEEK_BLOCK, IN_STRUCTURE, IN_VARIOGRAM
	}

	private final StructureDefaults defaults;

	public StructureReader(StructureDefaults defaults) {
		this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
	}

	public StructureLibrary read(Path file) {
		List<String> lines = TextLines.read(file);

		List<StructureDraft> structures = new ArrayList<>();
		Map<String, VariogramModel> variograms = new LinkedHashMap<>();

		State state = State.SEEK_BLOCK;
		StructureDraft s = null;
		VariogramDraft v = null;
		int blockStart = 0;

		for (int i = 0; i < lines.size(); i++) {
			final int ln = i + 1;
			String line = lines.get(i);
			if (TextLines.isSkippable(line, "#")) {
				continue;
			}
			String[] t = TextLines.tokens(line);
			String key = t[0].toUpperCase(Locale.ROOT);

			switch (state) {
				case SEEK_BLOCK:
					if (key.equals("STRUCTURE")) {
						s = new StructureDraft(TextLines.field(file, ln, t, 1, "structure name"), ln);
						state = State.IN_STRUCTURE;
						blockStart = ln;
					} else if (key.equals("VARIOGRAM")) {
						v = new VariogramDraft(TextLines.field(file, ln, t, 1, "variogram name"), ln);
						state = State.IN_VARIOGRAM;
						blockStart = ln;
					} else if (key.equals("END")) {
						throw ParseException.at(file, ln, "END without an open STRUCTURE or VARIOGRAM block");
					} else {
						LOG.debug("{}:{}: ignoring '{}' outside a block", file, ln, t[0]);
					}
					break;

				case IN_STRUCTURE:
					if (key.equals("END")) {
						requireEndOf(file, ln, t, "STRUCTURE");
						structures.add(s);
						s = null;
						state = State.SEEK_BLOCK;
					} else {
						structureKey(file, ln, key, t, s);
					}
					break;

				case IN_VARIOGRAM:
					if (key.equals("END")) {
						requireEndOf(file, ln, t, "VARIOGRAM");
						VariogramModel model = v.build(file);
						if (variograms.putIfAbsent(model.name().toLowerCase(Locale.ROOT), model) != null) {
							throw ParseException.at(file, v.line, "duplicate variogram '" + model.name() + "'");
						}
						v = null;
						state = State.SEEK_BLOCK;
					} else {
						variogramKey(file, ln, key, t, v);
					}
					break;
			}
		}

		if (state != State.SEEK_BLOCK) {
			throw ParseException.at(file, blockStart, "block is not closed with END");
		}

		List<Structure> resolved = new ArrayList<>(structures.size());
		for (StructureDraft d : structures) {
			resolved.add(d.resolve(file, variograms, defaults));
		}
		StructureLibrary library;
		try {
			library = new StructureLibrary(resolved);
		} catch (IllegalArgumentException e) {
			throw new ParseException(file + ": " + e.getMessage(), e);
		}
		LOG.debug("Read {} structure(s) and {} variogram(s) from {}", library.size(), variograms.size(), file);
		return library;
	}

	private static void requireEndOf(Path file, int ln, String[] t, String block) {
		if (t.length > 1 && !t[1].equalsIgnoreCase(block)) {
			throw ParseException.at(file, ln, "END " + t[1] + " inside a " + block + " block");
		}
	}

	private static void structureKey(Path file, int ln, String key, String[] t, StructureDraft s) {
		switch (key) {
			case "NUGGET":
				s.nugget = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "TRANSFORM":
				try {
					s.transform = Transform.parse(TextLines.field(file, ln, t, 1, key));
				} catch (IllegalArgumentException e) {
					throw ParseException.at(file, ln, e.getMessage());
				}
				break;
			case "MAXPOWERVAR":
				s.maxPowerVariance = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "NUMVARIOGRAM":
				s.numVariogram = TextLines.parseInt(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "VARIOGRAM":
				String name = TextLines.field(file, ln, t, 1, "variogram name");
				double contribution = t.length > 2 ? TextLines.parseDouble(file, ln, t[2], "contribution") : 1.0;
				s.references.add(new Reference(name, contribution, ln));
				break;
			case "STRUCTURE":
				throw ParseException.at(file, ln, "STRUCTURE inside structure '" + s.name + "' (missing END?)");
			default:
				LOG.debug("{}:{}: ignoring structure key '{}'", file, ln, t[0]);
		}
	}

	private static void variogramKey(Path file, int ln, String key, String[] t, VariogramDraft v) {
		switch (key) {
			case "VARTYPE":
				v.vartype = TextLines.parseInt(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "BEARING":
				v.bearing = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "A":
				v.a = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "ANISOTROPY":
				v.anisotropy = TextLines.parseDouble(file, ln, TextLines.field(file, ln, t, 1, key), key);
				break;
			case "STRUCTURE":
			case "VARIOGRAM":
				throw ParseException.at(file, ln, t[0] + " inside variogram '" + v.name + "' (missing END?)");
			default:
				LOG.debug("{}:{}: ignoring variogram key '{}'", file, ln, t[0]);
		}
	}

	private static final class Reference {
		final String name;
		final double contribution;
		final int line;

		Reference(String name, double contribution, int line) {
			this.name = name;
			this.contribution = contribution;
			this.line = line;
		}
	}

	private static final class StructureDraft {
		final String name;
		final int line;
		Double nugget;
		Transform transform;
		Double maxPowerVariance;
		Integer numVariogram;
		final List<Reference> references = new ArrayList<>();

		StructureDraft(String name, int line) {
			this.name = name;
			this.line = line;
		}

		Structure resolve(Path file, Map<String, VariogramModel> variograms, StructureDefaults defaults) {
			if (numVariogram != null && numVariogram != references.size()) {
				throw ParseException.at(file, line,
						"structure '" + name + "' declares NUMVARIOGRAM " + numVariogram + " but lists " + references.size());
			}
			if (references.isEmpty()) {
				throw ParseException.at(file, line, "structure '" + name + "' has no VARIOGRAM");
			}
			List<NestedVariogram> comps = new ArrayList<>(references.size());
			for (Reference r : references) {
				VariogramModel vm = variograms.get(r.name.toLowerCase(Locale.ROOT));
				if (vm == null) {
					throw ParseException.at(file, r.line, "structure '" + name + "' references undefined variogram '" + r.name + "'");
				}
				comps.add(new NestedVariogram(vm, r.contribution));
			}
			return new Structure(name, nugget != null ? nugget : defaults.nugget(), transform != null ? transform : defaults.transform(),
					maxPowerVariance != null ? maxPowerVariance : defaults.maxPowerVariance(), comps);
		}
	}

	private static final class VariogramDraft {
		final String name;
		final int line;
		Integer vartype;
		double bearing = 0.0;
		Double a;
		double anisotropy = 1.0;

		VariogramDraft(String name, int line) {
			this.name = name;
			this.line = line;
		}

		VariogramModel build(Path file) {
			if (vartype == null) {
				throw ParseException.at(file, line, "variogram '" + name + "' has no VARTYPE");
			}
			if (a == null) {
				throw ParseException.at(file, line, "variogram '" + name + "' has no A");
			}
			VariogramShape shape;
			try {
				shape = VariogramShape.fromCode(vartype);
			} catch (IllegalArgumentException e) {
				throw ParseException.at(file, line, "variogram '" + name + "': " + e.getMessage());
			}
			if (shape == VariogramShape.POWER ? !(a > 0.0 && a < 2.0) : !(a > 0.0)) {
				throw ParseException.at(file, line, "variogram '" + name + "': invalid A " + a);
			}
			if (!(anisotropy > 0.0)) {
				throw ParseException.at(file, line, "variogram '" + name + "': ANISOTROPY must be positive");
			}
			return new VariogramModel(name, vartype, bearing, a, anisotropy);
		}
	}
}
