package com.github.micycle1.ppfac.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ModelParsingTest {

	@Test
	public void testKrigingType() {
		assertEquals(KrigingType.ORDINARY, KrigingType.parse("o"));
		assertEquals(KrigingType.ORDINARY, KrigingType.parse(" Ordinary "));
		assertEquals(KrigingType.SIMPLE, KrigingType.parse("S"));
		assertEquals(KrigingType.SIMPLE, KrigingType.parse("simple"));
		assertThrows(IllegalArgumentException.class, () -> KrigingType.parse("universal"));
	}

	@Test
	public void testTransform() {
		assertEquals(Transform.LOG, Transform.parse("LOG"));
		assertEquals(Transform.NONE, Transform.parse("none"));
		assertThrows(IllegalArgumentException.class, () -> Transform.parse("sqrt"));
	}

	@Test
	public void testStructureLibrary() {
		VariogramModel v = new VariogramModel("v", 1, 0, 10, 1);
		Structure a = new Structure("Alpha", 0, Transform.NONE, 1, List.of(new NestedVariogram(v, 1)));
		Structure b = new Structure("beta", 0, Transform.NONE, 1, List.of(new NestedVariogram(v, 1)));
		StructureLibrary lib = new StructureLibrary(List.of(a, b));

		assertEquals(2, lib.size());
		assertSame(a, lib.find("ALPHA").orElseThrow());
		assertSame(b, lib.find("Beta").orElseThrow());
		assertFalse(lib.find("gamma").isPresent());
		assertEquals(List.of(v), a.variograms());

		Structure dup = new Structure("alpha", 0, Transform.NONE, 1, List.of(new NestedVariogram(v, 1)));
		assertThrows(IllegalArgumentException.class, () -> new StructureLibrary(List.of(a, dup)));
	}
}
