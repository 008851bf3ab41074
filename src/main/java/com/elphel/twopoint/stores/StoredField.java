/**
 **
 ** StoredField.java - Array identifier together with the store holding it
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StoredField.java is free software: you can redistribute it and/or modify
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

import com.elphel.twopoint.correlation.Field;
import com.elphel.twopoint.correlation.StoreAccessException;

/**
 * Handle of one stored array: the store plus the array identifier inside it.
 */
public class StoredField {
	private final FieldStore store;
	private final String     array_name;

	public StoredField(
			FieldStore store,
			String     array_name) {
		this.store =      store;
		this.array_name = array_name;
	}

	public FieldStore getStore() {
		return store;
	}

	public String getArrayName() {
		return array_name;
	}

	/**
	 * @return array extent along each axis
	 * @throws StoreAccessException if the store can not provide the array
	 */
	public int [] getShape() {
		try {
			return store.getShape(array_name);
		} catch (IOException e) {
			throw new StoreAccessException(array_name, "shape in "+store.getName(), e);
		}
	}

	public Field read(
			int [] origin,
			int [] shape) throws IOException {
		return store.read(array_name, origin, shape);
	}

	@Override
	public String toString() {
		return store.getName()+"/"+array_name;
	}
}
