/**
 **
 ** DimensionalityException.java - Field is neither 2D nor 3D
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DimensionalityException.java is free software: you can redistribute it and/or modify
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

public class DimensionalityException extends CorrelationException {
	private static final long serialVersionUID = -2129573406213094163L;
	private final int [] shape;

	public DimensionalityException(int [] shape) {
		super("Incorrect number of dimensions: "+shape.length+" (shape "+Arrays.toString(shape)+"), only 2D and 3D fields are supported");
		this.shape = shape.clone();
	}

	public int [] getShape() {
		return shape.clone();
	}

	public static void check(int [] shape) {
		if ((shape.length != 2) && (shape.length != 3)) {
			throw new DimensionalityException(shape);
		}
	}
}
