/**
 **
 ** FieldReferenceTest.java - Field reference parsing tests
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldReferenceTest.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package com.elphel.twopoint.stores;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class FieldReferenceTest {
	private static final String [] EXTENSIONS = {".tif", ".tiff"};

	private static FieldReference parse(String text) {
		return FieldReference.parse(text, EXTENSIONS, "H1");
	}

	@Test
	public void containerAndArray() {
		assertEquals(new FieldReference("/data/run1/sample.tif", "phase"), parse("/data/run1/sample.tif/phase"));
		assertEquals(new FieldReference("/data/run1/sample.tiff", "phase"), parse("/data/run1/sample.tiff/phase"));
	}

	@Test
	public void defaultArrayWhenNoneGiven() {
		assertEquals(new FieldReference("/data/sample.tif", "H1"), parse("/data/sample.tif"));
		assertEquals(new FieldReference("/data/sample.tif", "H1"), parse("/data/sample.tif/"));
	}

	@Test
	public void wholeTextWithoutMarker() {
		assertEquals(new FieldReference("/data/sample.raw/phase", "H1"), parse("/data/sample.raw/phase"));
	}

	@Test
	public void lastMarkerWins() {
		assertEquals(new FieldReference("/data/a.tif.d/b.tif", "c"), parse("/data/a.tif.d/b.tif/c"));
	}

	@Test
	public void customMarkers() {
		FieldReference ref = FieldReference.parse("/d/x.mat/H2", new String [] {".mat"}, "H1");
		assertEquals("/d/x.mat", ref.getContainer());
		assertEquals("H2", ref.getArrayName());
		assertEquals("/d/x.mat/H2", ref.toString());
	}
}
