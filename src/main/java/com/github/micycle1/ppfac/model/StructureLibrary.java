package com.github.micycle1.ppfac.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structures read from one structure file, looked up by name without regard to
 * case.
 */
public final class StructureLibrary {

	private final Map<String, Structure> byName;

	public StructureLibrary(Collection<Structure> structures) {
		Map<String, Structure> m = new LinkedHashMap<>();
		for (Structure s : structures) {
			if (m.putIfAbsent(key(s.name()), s) != null) {
				throw new IllegalArgumentException("Duplicate structure '" + s.name() + "'");
			}
		}
		this.byName = Collections.unmodifiableMap(m);
	}

	public Optional<Structure> find(String name) {
		return Optional.ofNullable(byName.get(key(name)));
	}

	public Collection<Structure> all() {
		return byName.values();
	}

	public int size() {
		return byName.size();
	}

	private static String key(String name) {
		return name.toLowerCase(Locale.ROOT);
	}
}
