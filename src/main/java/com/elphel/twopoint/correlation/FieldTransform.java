/**
 **
 ** FieldTransform.java - N-dimensional complex FFT over power-of-two grids
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldTransform.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Complex N-d array with power-of-two extents, transformed in place axis by axis with
 * the commons-math radix-2 FFT. Forward transform is not scaled, inverse is scaled by 1/N.
 */
public class FieldTransform {
	private final int []    shape;
	private final int []    strides;
	private final double [] re;
	private final double [] im;

	public FieldTransform(int [] shape) {
		for (int n : shape) {
			if (!ArithmeticUtils.isPowerOfTwo(n)) {
				throw new IllegalArgumentException("Transform extent "+n+" is not a power of 2");
			}
		}
		this.shape =   shape.clone();
		this.strides = Field.strides(shape);
		int len = Field.length(shape);
		this.re = new double[len];
		this.im = new double[len];
	}

	/** Smallest power of two not less than n (n >= 1). */
	public static int paddedSize(int n) {
		return (n <= 1) ? 1 : Integer.highestOneBit(n - 1) << 1;
	}

	public static int [] paddedShape(int [] shape) {
		int [] padded = new int [shape.length];
		for (int i = 0; i < shape.length; i++) {
			padded[i] = paddedSize(shape[i]);
		}
		return padded;
	}

	public int [] getShape() {
		return shape.clone();
	}

	/**
	 * Load real values into the origin corner, optionally multiplied by a box mask that is 1
	 * inside [mask_from, mask_from + mask_size) and 0 elsewhere. Everything else is zeroed.
	 * @param field     real data, each extent not exceeding the transform extent
	 * @param mask_from first masked-in element along each axis, null for no mask
	 * @param mask_size extent of the masked-in box
	 * @return this
	 */
	public FieldTransform load(
			Field  field,
			int [] mask_from,
			int [] mask_size) {
		int [] fshape = field.getShape();
		if (fshape.length != shape.length) {
			throw new DimensionalityException(fshape);
		}
		for (int i = 0; i < shape.length; i++) {
			if (fshape[i] > shape[i]) {
				throw new IllegalArgumentException("Field extent "+fshape[i]+" along axis "+i+" exceeds transform extent "+shape[i]);
			}
		}
		Arrays.fill(re, 0.0);
		Arrays.fill(im, 0.0);
		double [] data = field.getData();
		int [] coord = new int [shape.length];
		for (int indx = 0; indx < data.length; indx++) {
			boolean inside = true;
			if (mask_from != null) {
				for (int i = 0; i < shape.length; i++) {
					if ((coord[i] < mask_from[i]) || (coord[i] >= mask_from[i] + mask_size[i])) {
						inside = false;
						break;
					}
				}
			}
			if (inside) {
				int dst = 0;
				for (int i = 0; i < shape.length; i++) {
					dst += coord[i] * strides[i];
				}
				re[dst] = data[indx];
			}
			Field.increment(coord, fshape);
		}
		return this;
	}

	public FieldTransform forward() {
		transform(TransformType.FORWARD);
		return this;
	}

	public FieldTransform inverse() {
		transform(TransformType.INVERSE);
		return this;
	}

	/**
	 * Replace this spectrum with this * conj(other), element-wise.
	 */
	public FieldTransform multiplyConjugate(FieldTransform other) {
		if (!Arrays.equals(shape, other.shape)) {
			throw new IllegalArgumentException("Spectra shapes differ");
		}
		for (int i = 0; i < re.length; i++) {
			double a = re[i], b = im[i];
			double c = other.re[i], d = other.im[i];
			re[i] = a * c + b * d;
			im[i] = b * c - a * d;
		}
		return this;
	}

	/** Real part at the (possibly negative) circular index, each coordinate taken modulo the extent. */
	public double getCircular(int [] coord) {
		int indx = 0;
		for (int i = 0; i < shape.length; i++) {
			indx += Math.floorMod(coord[i], shape[i]) * strides[i];
		}
		return re[indx];
	}

	private void transform(TransformType type) {
		int len = re.length;
		for (int axis = 0; axis < shape.length; axis++) {
			int n = shape[axis];
			if (n == 1) continue;
			int stride = strides[axis];
			double [][] line = new double [2][n];
			// every line along this axis starts at an index whose coordinate on the axis is 0
			for (int base = 0; base < len; base++) {
				if ((base / stride) % n != 0) continue;
				for (int k = 0, indx = base; k < n; k++, indx += stride) {
					line[0][k] = re[indx];
					line[1][k] = im[indx];
				}
				FastFourierTransformer.transformInPlace(line, DftNormalization.STANDARD, type);
				for (int k = 0, indx = base; k < n; k++, indx += stride) {
					re[indx] = line[0][k];
					im[indx] = line[1][k];
				}
			}
		}
	}
}
