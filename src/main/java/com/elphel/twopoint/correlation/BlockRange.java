/**
 **
 ** BlockRange.java - Store index range of one window block
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BlockRange.java is free software: you can redistribute it and/or modify
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

/**
 * Inclusive per-axis store range [start, end] of a window block: the window core plus
 * a cutoff-wide halo on each side.
 */
public class BlockRange {
	private final int [] start;
	private final int [] end;
	private final int [] core;
	private final int    cutoff;

	public BlockRange(
			int [] start,
			int [] end,
			int [] core,
			int    cutoff) {
		this.start =  start.clone();
		this.end =    end.clone();
		this.core =   core.clone();
		this.cutoff = cutoff;
	}

	public int [] getStart() {
		return start.clone();
	}

	public int [] getEnd() {
		return end.clone();
	}

	/** Block extent, core + 2*cutoff along each axis. */
	public int [] getShape() {
		int [] shape = new int [start.length];
		for (int i = 0; i < shape.length; i++) {
			shape[i] = end[i] - start[i] + 1;
		}
		return shape;
	}

	/** Window core extent. */
	public int [] getCore() {
		return core.clone();
	}

	public int getCutoff() {
		return cutoff;
	}

	public boolean fits(int [] store_shape) {
		if (store_shape.length != start.length) {
			return false;
		}
		for (int i = 0; i < start.length; i++) {
			if ((start[i] < 0) || (end[i] >= store_shape[i])) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < start.length; i++) {
			if (i > 0) sb.append(", ");
			sb.append(start[i]).append(':').append(end[i]);
		}
		return sb.append("] core=").append(Arrays.toString(core)).toString();
	}
}
