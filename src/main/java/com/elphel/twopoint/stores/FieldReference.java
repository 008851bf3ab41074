/**
 **
 ** FieldReference.java - Container path and array identifier of a stored field
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldReference.java is free software: you can redistribute it and/or modify
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

import java.util.Objects;

/**
 * Reference to an array in a container file, parsed from the "/path/file.ext/ArrayName"
 * text form. The container path ends with the last recognized extension marker, the rest
 * (after one separator character) is the array identifier.
 */
public class FieldReference {
	private final String container;
	private final String array_name;

	public FieldReference(
			String container,
			String array_name) {
		this.container =  Objects.requireNonNull(container,  "container");
		this.array_name = Objects.requireNonNull(array_name, "array_name");
	}

	/**
	 * @param text          reference text
	 * @param extensions    recognized container extension markers (e.g. ".tif")
	 * @param default_array array identifier to use when the text names none
	 * @return parsed reference; without a recognized marker the whole text is the container
	 */
	public static FieldReference parse(
			String    text,
			String [] extensions,
			String    default_array) {
		int marker_end = -1;
		for (String ext : extensions) {
			if (ext.isEmpty()) continue;
			int pos = text.lastIndexOf(ext);
			if ((pos >= 0) && (pos + ext.length() > marker_end)) {
				marker_end = pos + ext.length();
			}
		}
		if (marker_end < 0) {
			return new FieldReference(text, default_array);
		}
		String container = text.substring(0, marker_end);
		if (text.length() > marker_end + 1) {
			return new FieldReference(container, text.substring(marker_end + 1));
		}
		return new FieldReference(container, default_array);
	}

	public String getContainer() {
		return container;
	}

	public String getArrayName() {
		return array_name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FieldReference)) return false;
		FieldReference other = (FieldReference) o;
		return container.equals(other.container) && array_name.equals(other.array_name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(container, array_name);
	}

	@Override
	public String toString() {
		return container+"/"+array_name;
	}
}
