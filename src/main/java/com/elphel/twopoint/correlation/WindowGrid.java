/**
 **
 ** WindowGrid.java - Cartesian product of per-axis window plans
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WindowGrid.java is free software: you can redistribute it and/or modify
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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * All window coordinates of a patched run, one window plan per axis. Iteration is
 * row-major (last axis fastest) and may be repeated, coordinates are generated lazily.
 */
public class WindowGrid implements Iterable<int []> {
	private final WindowPlan [] plans;
	private final int           cutoff;

	public WindowGrid(WindowPlan ... plans) {
		if (plans.length == 0) {
			throw new IllegalArgumentException("Window grid needs at least one axis");
		}
		this.plans =  plans.clone();
		this.cutoff = plans[0].getCutoff();
		for (WindowPlan plan : plans) {
			if (plan.getCutoff() != cutoff) {
				throw new IllegalArgumentException("All window plans should use the same cutoff: "+plan);
			}
		}
	}

	/**
	 * Plan windows for every axis of a store array.
	 * @param store_shape full extent of the stored field (halo included)
	 * @param cutoff      maximal lag
	 * @param winmulti    window size multiplier
	 * @return grid of windows covering the field core
	 */
	public static WindowGrid plan(
			int [] store_shape,
			int    cutoff,
			int    winmulti) {
		DimensionalityException.check(store_shape);
		WindowPlan [] plans = new WindowPlan [store_shape.length];
		for (int axis = 0; axis < store_shape.length; axis++) {
			plans[axis] = WindowPlan.plan(axis, store_shape[axis] - 2 * cutoff, cutoff, winmulti);
		}
		return new WindowGrid(plans);
	}

	public int numDimensions() {
		return plans.length;
	}

	public int getCutoff() {
		return cutoff;
	}

	public WindowPlan getPlan(int axis) {
		return plans[axis];
	}

	/** Total number of windows. */
	public int size() {
		long n = 1;
		for (WindowPlan plan : plans) n *= plan.getWindowCount();
		if (n > Integer.MAX_VALUE) {
			throw new IllegalStateException("Too many windows: "+n);
		}
		return (int) n;
	}

	/**
	 * Largest block extent (core plus halo) along each axis. Blocks are transformed on grids
	 * padded to powers of two, see {@link FieldTransform#paddedShape(int[])}.
	 */
	public int [] getMaxBlockShape() {
		int [] shape = new int [plans.length];
		for (int axis = 0; axis < plans.length; axis++) {
			for (int i = 0; i < plans[axis].getWindowCount(); i++) {
				shape[axis] = Math.max(shape[axis], plans[axis].getSize(i) + 2 * cutoff);
			}
		}
		return shape;
	}

	/**
	 * Store range of the block (core plus halo) for a window coordinate.
	 */
	public BlockRange getBlockRange(int [] window) {
		int [] start = new int [plans.length];
		int [] end =   new int [plans.length];
		int [] core =  new int [plans.length];
		for (int axis = 0; axis < plans.length; axis++) {
			start[axis] = plans[axis].getBlockStart(window[axis]);
			end[axis] =   plans[axis].getBlockEnd(window[axis]);
			core[axis] =  plans[axis].getSize(window[axis]);
		}
		return new BlockRange(start, end, core, cutoff);
	}

	@Override
	public Iterator<int []> iterator() {
		return new Iterator<int []>() {
			private final int [] next = new int [plans.length];
			private boolean has_next = true;

			@Override
			public boolean hasNext() {
				return has_next;
			}

			@Override
			public int [] next() {
				if (!has_next) {
					throw new NoSuchElementException();
				}
				int [] current = next.clone();
				has_next = false;
				for (int axis = plans.length - 1; axis >= 0; axis--) {
					if (++next[axis] < plans[axis].getWindowCount()) {
						has_next = true;
						break;
					}
					next[axis] = 0;
				}
				return current;
			}
		};
	}
}
