/**
 **
 ** FieldStores.java - Opening field stores for parsed field references
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldStores.java is free software: you can redistribute it and/or modify
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

import java.io.File;
import java.io.IOException;

import com.elphel.twopoint.correlation.CorrelationParameters;

public class FieldStores {

	/**
	 * Parse a "/path/file.ext/ArrayName" reference with the configured extension markers
	 * and default array identifier.
	 */
	public static FieldReference parse(
			String                text,
			CorrelationParameters params) {
		return FieldReference.parse(text, params.getContainerExtensions(), params.default_array);
	}

	/**
	 * Open the container of a reference. Every configured extension names a TIFF container,
	 * the same list is used by {@link #parse(String, CorrelationParameters)}.
	 * @throws IOException if the container can not be opened or has an unknown type
	 */
	public static StoredField open(
			FieldReference        reference,
			CorrelationParameters params) throws IOException {
		String container = reference.getContainer();
		for (String extension : params.getContainerExtensions()) {
			if (!extension.isEmpty() && container.endsWith(extension)) {
				TiffFieldStore store = new TiffFieldStore(new File(container), params.default_array);
				return new StoredField(store, reference.getArrayName());
			}
		}
		throw new IOException("Unsupported container type: "+container);
	}
}
