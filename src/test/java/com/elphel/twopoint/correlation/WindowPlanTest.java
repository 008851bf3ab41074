/**
 **
 ** WindowPlanTest.java - Window planning tests
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WindowPlanTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class WindowPlanTest {

	@Test
	public void exactDivisionGivesNominalWindows() {
		// nominal = 2*(1+1) = 4
		assertArrayEquals(new int [] {4, 4, 4}, WindowPlan.plan(0, 12, 1, 2).getSizes());
	}

	@Test
	public void remainderIsSharedAndLeftoverGoesToLastWindow() {
		// nominal 4, count 3, remainder 3: buffer 1 each
		assertArrayEquals(new int [] {5, 5, 5}, WindowPlan.plan(0, 15, 1, 2).getSizes());
		// nominal 4, count 2, remainder 3: buffer 1, leftover 1
		assertArrayEquals(new int [] {5, 6}, WindowPlan.plan(0, 11, 1, 2).getSizes());
	}

	@Test
	public void remainderSmallerThanCountGoesToLastWindow() {
		// nominal 2, count 4, remainder 1: buffer 0
		assertArrayEquals(new int [] {2, 2, 2, 3}, WindowPlan.plan(0, 9, 1, 1).getSizes());
	}

	@Test
	public void leftoverKeepsTilingGapFree() {
		// nominal 9, count 3, remainder 8: buffer 2, 2 elements left after equal sharing
		WindowPlan plan = WindowPlan.plan(1, 35, 2, 3);
		assertArrayEquals(new int [] {11, 11, 13}, plan.getSizes());
		assertEquals(35, plan.getCoreLength());
	}

	@Test
	public void singleWindowTakesWholeCore() {
		assertArrayEquals(new int [] {7}, WindowPlan.plan(0, 7, 2, 2).getSizes());
	}

	@Test
	public void zeroCutoffUsesMultiplierAsWindow() {
		assertArrayEquals(new int [] {3, 3, 4}, WindowPlan.plan(0, 10, 0, 3).getSizes());
	}

	@Test
	public void startsAndBlockRanges() {
		WindowPlan plan = WindowPlan.plan(0, 11, 1, 2); // {5, 6}
		assertEquals(0, plan.getStart(0));
		assertEquals(5, plan.getStart(1));
		assertEquals(0, plan.getBlockStart(0));
		assertEquals(6, plan.getBlockEnd(0));  // 5 + 2 - 1
		assertEquals(5, plan.getBlockStart(1));
		assertEquals(12, plan.getBlockEnd(1)); // last element of a 13-long axis
	}

	@Test
	public void tooShortAxisIsDegenerate() {
		DegenerateAxisException e = assertThrows(DegenerateAxisException.class, () -> WindowPlan.plan(2, 5, 2, 2));
		assertEquals(2, e.getAxis());
		assertEquals(0, e.getWindowCount());
		assertThrows(DegenerateAxisException.class, () -> WindowPlan.plan(0, -3, 2, 1));
		assertThrows(DegenerateAxisException.class, () -> WindowPlan.plan(0, 0, 0, 1));
	}

	@Test
	public void invalidParametersAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> WindowPlan.plan(0, 10, -1, 1));
		assertThrows(IllegalArgumentException.class, () -> WindowPlan.plan(0, 10, 1, 0));
	}

	@Test
	public void plansTileEveryValidCore() {
		for (int cutoff = 0; cutoff <= 5; cutoff++) {
			for (int winmulti = 1; winmulti <= 4; winmulti++) {
				int nominal = winmulti * (cutoff + 1);
				for (int core = nominal; core <= 200; core++) {
					int [] sizes = WindowPlan.plan(0, core, cutoff, winmulti).getSizes();
					String what = "core="+core+", cutoff="+cutoff+", winmulti="+winmulti;
					int sum = 0;
					for (int i = 0; i < sizes.length; i++) {
						assertTrue(sizes[i] >= nominal, what);
						if (i < sizes.length - 1) {
							assertEquals(sizes[0], sizes[i], what);
						}
						sum += sizes[i];
					}
					assertTrue(sizes[sizes.length - 1] >= sizes[0], what);
					assertEquals(core, sum, what);
					assertEquals(core / nominal, sizes.length, what);
				}
			}
		}
	}
}
