/**
 **
 ** FieldStore.java - Random access storage of named 2D/3D arrays
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldStore.java is free software: you can redistribute it and/or modify
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

import java.io.Closeable;
import java.io.IOException;

import com.elphel.twopoint.correlation.Field;

/**
 * Container of named arrays that can be read in rectangular chunks, without loading
 * a whole array into memory. Stores are read-only for the duration of a correlation run.
 */
public interface FieldStore extends Closeable {

	/** Human-readable container name for messages. */
	String getName();

	/**
	 * @param array_name array identifier inside the container
	 * @return array extent along each axis
	 * @throws IOException if the array is missing or the container can not be read
	 */
	int [] getShape(String array_name) throws IOException;

	/**
	 * Read a chunk of an array.
	 * @param array_name array identifier inside the container
	 * @param origin     first element along each axis
	 * @param shape      chunk extent along each axis
	 * @return chunk data
	 * @throws IOException on read failure or a missing array
	 */
	Field read(
			String array_name,
			int [] origin,
			int [] shape) throws IOException;
}
