/**
 **
 ** DegenerateAxisException.java - Cutoff/multiplier leave no complete window along an axis
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DegenerateAxisException.java is free software: you can redistribute it and/or modify
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

public class DegenerateAxisException extends CorrelationException {
	private static final long serialVersionUID = -6870121541738522151L;
	private final int axis;
	private final int axis_length;
	private final int window_count;

	/**
	 * @param axis         offending axis
	 * @param axis_length  length used for planning (core length in patched mode, field length in full mode)
	 * @param cutoff       maximal lag
	 * @param window_count number of windows that fit (less than 1)
	 */
	public DegenerateAxisException(
			int axis,
			int axis_length,
			int cutoff,
			int window_count) {
		super("Axis "+axis+" of length "+axis_length+" is too short for cutoff "+cutoff+
				" (window count = "+window_count+")");
		this.axis =         axis;
		this.axis_length =  axis_length;
		this.window_count = window_count;
	}

	public int getAxis() {
		return axis;
	}

	public int getAxisLength() {
		return axis_length;
	}

	public int getWindowCount() {
		return window_count;
	}
}
