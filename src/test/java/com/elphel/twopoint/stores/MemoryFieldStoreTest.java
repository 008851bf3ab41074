/**
 **
 ** MemoryFieldStoreTest.java - In-memory store tests
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MemoryFieldStoreTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.elphel.twopoint.correlation.Field;

public class MemoryFieldStoreTest {

	@Test
	public void readsChunksAndCountsReads() throws IOException {
		Field field = Field.of(new double [][] {{1, 2, 3}, {4, 5, 6}, {7, 8, 9}});
		MemoryFieldStore store = new MemoryFieldStore("test").put("H1", field);
		assertArrayEquals(new int [] {3, 3}, store.getShape("H1"));
		assertArrayEquals(new double [] {5, 6, 8, 9}, store.read("H1", new int [] {1, 1}, new int [] {2, 2}).getData(), 0.0);
		assertEquals(1, store.getReads());
		assertThrows(IOException.class, () -> store.read("H1", new int [] {2, 2}, new int [] {2, 2}));
		assertThrows(IOException.class, () -> store.getShape("H2"));
		assertEquals(1, store.getReads());
	}
}
