/**
 **
 ** EProperties.java - Properties loaded from the classpath
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EProperties.java is free software: you can redistribute it and/or modify
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

package com.elphel.twopoint.common;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = 2177420316615309826L;

	/** Load a classpath resource, empty properties if there is none. */
	public static EProperties loadResource(String name) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = EProperties.class.getClassLoader().getResourceAsStream(name)) {
			if (is != null) {
				properties.load(is);
			}
		}
		return properties;
	}
}
