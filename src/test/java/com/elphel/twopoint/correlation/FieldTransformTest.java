/**
 **
 ** FieldTransformTest.java - N-d FFT tests
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldTransformTest.java is free software: you can redistribute it and/or modify
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

package com.elphel.twopoint.correlation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class FieldTransformTest {

	@Test
	public void paddedSizes() {
		assertEquals(1, FieldTransform.paddedSize(1));
		assertEquals(2, FieldTransform.paddedSize(2));
		assertEquals(4, FieldTransform.paddedSize(3));
		assertEquals(16, FieldTransform.paddedSize(16));
		assertEquals(32, FieldTransform.paddedSize(17));
		assertArrayEquals(new int [] {8, 16, 1}, FieldTransform.paddedShape(new int [] {5, 9, 1}));
	}

	@Test
	public void rejectsNonPowerOfTwo() {
		assertThrows(IllegalArgumentException.class, () -> new FieldTransform(new int [] {4, 6}));
	}

	@Test
	public void inverseRestoresData() {
		Field field = ReferenceCounts.random(11, 5, 3, 6);
		FieldTransform transform = new FieldTransform(FieldTransform.paddedShape(field.getShape()));
		transform.load(field, null, null).forward().inverse();
		for (int z = 0; z < 5; z++) {
			for (int y = 0; y < 3; y++) {
				for (int x = 0; x < 6; x++) {
					assertEquals(field.get(z, y, x), transform.getCircular(new int [] {z, y, x}), 1E-9);
				}
			}
		}
		assertEquals(0.0, transform.getCircular(new int [] {-1, -1, -1}), 1E-9);
	}

	@Test
	public void constantTransformsToDcOnly() {
		FieldTransform transform = new FieldTransform(new int [] {4, 8});
		transform.load(Field.filled(1.0, 4, 8), null, null).forward();
		for (int y = 0; y < 4; y++) {
			for (int x = 0; x < 8; x++) {
				assertEquals(((y == 0) && (x == 0)) ? 32.0 : 0.0, transform.getCircular(new int [] {y, x}), 1E-9);
			}
		}
	}

	@Test
	public void maskKeepsOnlyBox() {
		FieldTransform transform = new FieldTransform(new int [] {8, 8});
		transform.load(Field.filled(1.0, 6, 6), new int [] {1, 2}, new int [] {3, 2});
		double total = 0;
		for (int y = 0; y < 8; y++) {
			for (int x = 0; x < 8; x++) {
				total += transform.getCircular(new int [] {y, x});
			}
		}
		assertEquals(6.0, total);
		assertEquals(1.0, transform.getCircular(new int [] {1, 2}));
		assertEquals(0.0, transform.getCircular(new int [] {1, 1}));
		assertEquals(1.0, transform.getCircular(new int [] {3, 3}));
		assertEquals(0.0, transform.getCircular(new int [] {4, 3}));
	}
}
