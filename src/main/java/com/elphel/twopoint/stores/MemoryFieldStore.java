/**
 **
 ** MemoryFieldStore.java - Field store keeping arrays in memory
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MemoryFieldStore.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.elphel.twopoint.correlation.Field;

public class MemoryFieldStore implements FieldStore {
	private final String             name;
	private final Map<String, Field> arrays = new LinkedHashMap<String, Field>();
	private int                      reads = 0;

	public MemoryFieldStore(String name) {
		this.name = name;
	}

	public MemoryFieldStore put(String array_name, Field field) {
		arrays.put(array_name, field);
		return this;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public int [] getShape(String array_name) throws IOException {
		return getArray(array_name).getShape();
	}

	@Override
	public synchronized Field read(
			String array_name,
			int [] origin,
			int [] shape) throws IOException {
		Field field = getArray(array_name);
		try {
			Field chunk = field.subField(origin, shape);
			reads++;
			return chunk;
		} catch (IndexOutOfBoundsException | IllegalArgumentException e) {
			throw new IOException(e.getMessage(), e);
		}
	}

	/** Number of chunks read so far. */
	public synchronized int getReads() {
		return reads;
	}

	private Field getArray(String array_name) throws IOException {
		Field field = arrays.get(array_name);
		if (field == null) {
			throw new IOException("Array \""+array_name+"\" not found in "+name+", available: "+arrays.keySet());
		}
		return field;
	}

	@Override
	public void close() {
	}
}
