/**
 **
 ** ShapeMismatchException.java - Cross-correlated fields differ in shape
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShapeMismatchException.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

public class ShapeMismatchException extends CorrelationException {
	private static final long serialVersionUID = 8803870318407402455L;

	public ShapeMismatchException(int [] shape1, int [] shape2) {
		super("Cross-correlated fields must have identical shapes, got "+Arrays.toString(shape1)+" and "+Arrays.toString(shape2));
	}

	public static void check(int [] shape1, int [] shape2) {
		if (!Arrays.equals(shape1, shape2)) {
			throw new ShapeMismatchException(shape1, shape2);
		}
	}
}
