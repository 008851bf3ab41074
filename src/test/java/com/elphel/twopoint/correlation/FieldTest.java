/**
 **
 ** FieldTest.java - Field tests
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldTest.java is free software: you can redistribute it and/or modify
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

public class FieldTest {

	@Test
	public void rowsAreRowMajor() {
		Field field = Field.of(new double [][] {{1, 2, 3}, {4, 5, 6}});
		assertArrayEquals(new int [] {2, 3}, field.getShape());
		assertEquals(6.0, field.get(1, 2));
		assertEquals(4.0, field.getData()[3]);
		Field volume = Field.of(new double [][][] {{{1, 2}, {3, 4}}, {{5, 6}, {7, 8}}});
		assertEquals(7.0, volume.get(1, 1, 0));
		assertEquals(36.0, volume.sum());
	}

	@Test
	public void subFieldCopiesRange() {
		Field field = ReferenceCounts.random(3, 5, 6, 7);
		Field sub = field.subField(new int [] {1, 2, 3}, new int [] {3, 2, 4});
		assertArrayEquals(new int [] {3, 2, 4}, sub.getShape());
		for (int z = 0; z < 3; z++) {
			for (int y = 0; y < 2; y++) {
				for (int x = 0; x < 4; x++) {
					assertEquals(field.get(z + 1, y + 2, x + 3), sub.get(z, y, x));
				}
			}
		}
		assertThrows(IndexOutOfBoundsException.class, () -> field.subField(new int [] {3, 0, 0}, new int [] {3, 1, 1}));
	}

	@Test
	public void zeroPadSurroundsWithZeros() {
		Field field = Field.filled(2.0, 3, 4);
		Field padded = field.zeroPad(2);
		assertArrayEquals(new int [] {7, 8}, padded.getShape());
		assertEquals(field.sum(), padded.sum());
		assertEquals(0.0, padded.get(1, 1));
		assertEquals(2.0, padded.get(2, 2));
		assertEquals(2.0, padded.get(4, 5));
		assertEquals(0.0, padded.get(5, 5));
	}

	@Test
	public void periodicPadWraps() {
		Field field = Field.of(new double [][] {{1, 2, 3}, {4, 5, 6}, {7, 8, 9}});
		Field padded = field.periodicPad(1);
		assertArrayEquals(new int [] {5, 5}, padded.getShape());
		assertEquals(9.0, padded.get(0, 0));
		assertEquals(7.0, padded.get(0, 4));
		assertEquals(5.0, padded.get(2, 2));
		assertEquals(1.0, padded.get(4, 4));
		assertThrows(IllegalArgumentException.class, () -> field.periodicPad(4));
	}

	@Test
	public void dataMustMatchShape() {
		assertThrows(IllegalArgumentException.class, () -> new Field(new int [] {2, 2}, new double [5]));
		assertThrows(IllegalArgumentException.class, () -> Field.of(new double [][] {{1, 2}, {3}}));
	}
}
