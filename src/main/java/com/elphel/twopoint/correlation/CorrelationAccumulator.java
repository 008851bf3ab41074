/**
 **
 ** CorrelationAccumulator.java - Sum of per-window vector counts
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrelationAccumulator.java is free software: you can redistribute it and/or modify
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
 * Running total of the lag-indexed counts of one run. Owned by a single run, never shared.
 */
public class CorrelationAccumulator {
	private final int []    lag_shape;
	private final double [] total;

	public CorrelationAccumulator(int cutoff, int num_dimensions) {
		this.lag_shape = new MaskedCorrelation(cutoff).getLagShape(num_dimensions);
		this.total =     new double [Field.length(lag_shape)];
	}

	public void add(double [] contribution) {
		if (contribution.length != total.length) {
			throw new IllegalArgumentException("Contribution length "+contribution.length+
					" does not match lag array "+Arrays.toString(lag_shape));
		}
		for (int i = 0; i < total.length; i++) {
			total[i] += contribution[i];
		}
	}

	/** Copy of the accumulated counts shaped (2*cutoff+1)^N. */
	public Field toField() {
		return new Field(lag_shape, total.clone());
	}
}
