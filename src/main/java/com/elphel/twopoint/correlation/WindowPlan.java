/**
 **
 ** WindowPlan.java - Partition of one axis core into correlation windows
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WindowPlan.java is free software: you can redistribute it and/or modify
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
 * Ordered window core sizes along one axis. The sizes tile the axis core (axis length minus
 * a cutoff-wide halo on each side) without gaps or overlaps.
 */
public class WindowPlan {
	private final int    axis;
	private final int    cutoff;
	private final int [] sizes;
	private final int [] starts; // start of each window core, relative to the core

	WindowPlan(
			int    axis,
			int    cutoff,
			int [] sizes) {
		this.axis =   axis;
		this.cutoff = cutoff;
		this.sizes =  sizes;
		this.starts = new int [sizes.length];
		for (int i = 1; i < sizes.length; i++) {
			starts[i] = starts[i - 1] + sizes[i - 1];
		}
	}

	/**
	 * Split an axis core into windows of nominal size winmulti*(cutoff+1). The division
	 * remainder is shared equally by all windows, what is left after equal sharing goes
	 * to the last window.
	 * @param axis        axis index, only used in error reports
	 * @param core_length axis length minus 2*cutoff
	 * @param cutoff      maximal lag
	 * @param winmulti    window size multiplier (memory/speed tradeoff), >= 1
	 * @return window plan whose sizes sum to core_length
	 * @throws DegenerateAxisException if not even one nominal window fits
	 */
	public static WindowPlan plan(
			int axis,
			int core_length,
			int cutoff,
			int winmulti) {
		if (cutoff < 0) {
			throw new IllegalArgumentException("Cutoff should be non-negative, got "+cutoff);
		}
		if (winmulti < 1) {
			throw new IllegalArgumentException("Window multiplier should be positive, got "+winmulti);
		}
		int nominal = winmulti * (cutoff + 1);
		int count = Math.max(core_length, 0) / nominal;
		if (count < 1) {
			throw new DegenerateAxisException(axis, core_length, cutoff, count);
		}
		int remainder = core_length % nominal;
		int buffer =    remainder / count;
		int leftover =  remainder - buffer * count;
		int [] sizes = new int [count];
		Arrays.fill(sizes, nominal + buffer);
		sizes[count - 1] += leftover;
		return new WindowPlan(axis, cutoff, sizes);
	}

	public int getAxis() {
		return axis;
	}

	public int getCutoff() {
		return cutoff;
	}

	public int getWindowCount() {
		return sizes.length;
	}

	public int getSize(int window) {
		return sizes[window];
	}

	public int [] getSizes() {
		return sizes.clone();
	}

	/** First core element of the window, relative to the axis core. */
	public int getStart(int window) {
		return starts[window];
	}

	public int getCoreLength() {
		return starts[sizes.length - 1] + sizes[sizes.length - 1];
	}

	/** First element of the window block (core plus halo) in store coordinates. */
	public int getBlockStart(int window) {
		return starts[window];
	}

	/** Last element (inclusive) of the window block in store coordinates. */
	public int getBlockEnd(int window) {
		return starts[window] + sizes[window] - 1 + 2 * cutoff;
	}

	@Override
	public String toString() {
		return "WindowPlan[axis="+axis+", cutoff="+cutoff+", sizes="+Arrays.toString(sizes)+"]";
	}
}
