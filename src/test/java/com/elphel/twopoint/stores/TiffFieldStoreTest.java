/**
 **
 ** TiffFieldStoreTest.java - TIFF field store tests
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TiffFieldStoreTest.java is free software: you can redistribute it and/or modify
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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elphel.twopoint.correlation.CorrelationKind;
import com.elphel.twopoint.correlation.CorrelationParameters;
import com.elphel.twopoint.correlation.Field;
import com.elphel.twopoint.correlation.StoreAccessException;
import com.elphel.twopoint.correlation.TwoPointCorrelation;

public class TiffFieldStoreTest {
	@TempDir
	File tmp;

	private static Field random(long seed, int ... shape) {
		Random rnd = new Random(seed);
		Field field = new Field(shape);
		double [] data = field.getData();
		for (int i = 0; i < data.length; i++) {
			data[i] = rnd.nextInt(5) - 1;
		}
		return field;
	}

	@Test
	public void readsChunksOf2DField() throws IOException {
		Field field = random(1, 17, 23);
		File file = new File(tmp, "plane.tif");
		TiffFieldStore.write(file, "phase", field);
		try (TiffFieldStore store = new TiffFieldStore(file, "H1")) {
			assertEquals("phase", store.getArrayName());
			assertArrayEquals(new int [] {17, 23}, store.getShape("phase"));
			int [] origin = {3, 5};
			int [] size =   {9, 11};
			assertArrayEquals(field.subField(origin, size).getData(), store.read("phase", origin, size).getData(), 0.0);
		}
	}

	@Test
	public void readsChunksOf3DField() throws IOException {
		Field field = random(2, 6, 9, 8);
		File file = new File(tmp, "volume.tif");
		TiffFieldStore.write(file, "H1", field);
		try (TiffFieldStore store = new TiffFieldStore(file, "H1")) {
			assertArrayEquals(new int [] {6, 9, 8}, store.getShape("H1"));
			int [] origin = {2, 1, 3};
			int [] size =   {3, 7, 4};
			assertArrayEquals(field.subField(origin, size).getData(), store.read("H1", origin, size).getData(), 0.0);
			assertArrayEquals(field.getData(), store.read("H1", new int [3], field.getShape()).getData(), 0.0);
		}
	}

	@Test
	public void missingArrayAndBadRange() throws IOException {
		File file = new File(tmp, "plane.tif");
		TiffFieldStore.write(file, "phase", random(3, 8, 8));
		try (TiffFieldStore store = new TiffFieldStore(file, "H1")) {
			assertThrows(IOException.class, () -> store.getShape("H1"));
			assertThrows(IOException.class, () -> store.read("phase", new int [] {4, 4}, new int [] {5, 2}));
		}
		assertThrows(IOException.class, () -> new TiffFieldStore(new File(tmp, "absent.tif"), "H1"));
	}

	@Test
	public void patchedRunFromReferences() throws IOException {
		int cutoff = 2;
		Field field1 = random(4, 20, 16).zeroPad(cutoff);
		Field field2 = random(5, 20, 16).zeroPad(cutoff);
		File file1 = new File(tmp, "first.tif");
		File file2 = new File(tmp, "second.tiff");
		TiffFieldStore.write(file1, "rho", field1);
		TiffFieldStore.write(file2, "H1", field2);

		CorrelationParameters params = new CorrelationParameters();
		TwoPointCorrelation correlation = new TwoPointCorrelation(cutoff);
		Field auto = correlation.computePatched(CorrelationKind.AUTO, 2, params, file1.getPath()+"/rho");
		assertArrayEquals(correlation.fullAuto(field1).getData(), auto.getData(), 1E-6);

		Field cross = correlation.computePatched(CorrelationKind.CROSS, 1, params, file1.getPath()+"/rho", file2.getPath());
		assertArrayEquals(correlation.fullCross(field1, field2).getData(), cross.getData(), 1E-6);

		assertThrows(StoreAccessException.class,
				() -> correlation.computePatched(CorrelationKind.AUTO, 1, params, file1.getPath()+"/density"));
	}

	@Test
	public void unsupportedContainer() {
		CorrelationParameters params = new CorrelationParameters();
		assertThrows(IOException.class, () -> FieldStores.open(new FieldReference(tmp.getPath()+"/x.h5", "H1"), params));
	}

	@Test
	public void configuredExtensionOpens() throws IOException {
		Field field = random(6, 7, 9);
		File written = new File(tmp, "plane.tif");
		TiffFieldStore.write(written, "phase", field);
		File file = new File(tmp, "plane.ftif");
		Files.move(written.toPath(), file.toPath());
		CorrelationParameters params = new CorrelationParameters();
		assertThrows(IOException.class, () -> FieldStores.open(new FieldReference(file.getPath(), "phase"), params));

		params.container_extensions = ".tif,.tiff,.ftif";
		FieldReference reference = FieldStores.parse(file.getPath()+"/phase", params);
		assertEquals(file.getPath(), reference.getContainer());
		StoredField stored = FieldStores.open(reference, params);
		try {
			assertArrayEquals(new int [] {7, 9}, stored.getShape());
			assertArrayEquals(field.getData(), stored.read(new int [2], new int [] {7, 9}).getData(), 0.0);
		} finally {
			stored.getStore().close();
		}
	}
}
