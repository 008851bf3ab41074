/**
 **
 ** CorrelationCounts.java - Operations on vector count arrays
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrelationCounts.java is free software: you can redistribute it and/or modify
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

public class CorrelationCounts {

	/**
	 * Two-point probabilities from two runs over the same geometry: counts of the field
	 * divided by counts of the reference (indicator) field. Lags without reference pairs
	 * get 0.
	 */
	public static Field normalize(
			Field counts,
			Field reference_counts) {
		ShapeMismatchException.check(counts.getShape(), reference_counts.getShape());
		double [] num = counts.getData();
		double [] den = reference_counts.getData();
		double [] prob = new double [num.length];
		for (int i = 0; i < prob.length; i++) {
			prob[i] = (den[i] != 0.0) ? (num[i] / den[i]) : 0.0;
		}
		return new Field(counts.getShape(), prob);
	}

	/** Cutoff of a (2*cutoff+1)^N count array. */
	public static int getCutoff(Field counts) {
		return (counts.getSize(0) - 1) / 2;
	}

	/**
	 * Count for a lag vector, each component in [-cutoff, cutoff].
	 */
	public static double getLag(
			Field  counts,
			int ... lag) {
		int cutoff = getCutoff(counts);
		int [] coord = new int [lag.length];
		for (int i = 0; i < lag.length; i++) {
			if (Math.abs(lag[i]) > cutoff) {
				throw new IndexOutOfBoundsException("Lag "+lag[i]+" exceeds cutoff "+cutoff);
			}
			coord[i] = lag[i] + cutoff;
		}
		return counts.get(coord);
	}
}
