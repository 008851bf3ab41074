/**
 **
 ** MaskedCorrelation.java - FFT correlation of one window block, origins limited to the window core
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MaskedCorrelation.java is free software: you can redistribute it and/or modify
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
 * Correlation kernel for a single block (window core plus a cutoff-wide halo).
 * Element k of the result (lags -cutoff..+cutoff along each axis, stored with lag 0 at
 * index cutoff) is the sum over origins x inside the core of origin(x) * shifted(x + k).
 * Only the origin operand is masked, so the halo supplies lag partners but never origins
 * and adjacent windows never count the same pair twice.
 */
public class MaskedCorrelation {
	private final int cutoff;

	public MaskedCorrelation(int cutoff) {
		if (cutoff < 0) {
			throw new IllegalArgumentException("Cutoff should be non-negative, got "+cutoff);
		}
		this.cutoff = cutoff;
	}

	public int getCutoff() {
		return cutoff;
	}

	/** Shape of the cropped lag array, 2*cutoff+1 along every axis. */
	public int [] getLagShape(int num_dimensions) {
		int [] lag_shape = new int [num_dimensions];
		Arrays.fill(lag_shape, 2 * cutoff + 1);
		return lag_shape;
	}

	/**
	 * Auto-correlation of a block.
	 * @param block block data, core + 2*cutoff along each axis
	 * @param core  window core extent
	 * @return cropped counts, (2*cutoff+1)^N values, row-major
	 */
	public double [] correlate(
			Field  block,
			int [] core) {
		return correlate(block, block, core);
	}

	/**
	 * Cross-correlation of two co-located blocks.
	 * @param origin_block  field providing origin values (masked to the core)
	 * @param shifted_block field providing values at origin + lag
	 * @param core          window core extent
	 * @return cropped counts, (2*cutoff+1)^N values, row-major
	 */
	public double [] correlate(
			Field  origin_block,
			Field  shifted_block,
			int [] core) {
		int [] block_shape = origin_block.getShape();
		DimensionalityException.check(block_shape);
		ShapeMismatchException.check(block_shape, shifted_block.getShape());
		if (core.length != block_shape.length) {
			throw new DimensionalityException(core);
		}
		int [] mask_from = new int [core.length];
		for (int i = 0; i < core.length; i++) {
			if ((core[i] < 1) || (core[i] + 2 * cutoff != block_shape[i])) {
				throw new IllegalArgumentException("Block "+Arrays.toString(block_shape)+" does not match core "+
						Arrays.toString(core)+" with cutoff "+cutoff);
			}
			mask_from[i] = cutoff;
		}
		int [] fft_shape = FieldTransform.paddedShape(block_shape);
		FieldTransform origin_spectrum = new FieldTransform(fft_shape).load(origin_block, mask_from, core).forward();
		FieldTransform product = new FieldTransform(fft_shape).load(shifted_block, null, null).forward();
		product.multiplyConjugate(origin_spectrum).inverse();

		int [] lag_shape = getLagShape(block_shape.length);
		double [] counts = new double [Field.length(lag_shape)];
		int [] coord = new int [lag_shape.length];
		int [] lag =   new int [lag_shape.length];
		for (int indx = 0; indx < counts.length; indx++) {
			for (int i = 0; i < lag.length; i++) {
				lag[i] = coord[i] - cutoff;
			}
			counts[indx] = product.getCircular(lag);
			Field.increment(coord, lag_shape);
		}
		return counts;
	}
}
