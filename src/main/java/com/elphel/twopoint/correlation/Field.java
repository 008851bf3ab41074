/**
 **
 ** Field.java - 2D/3D real array (indicator or property field) used by
 ** two-point correlation
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Field.java is free software: you can redistribute it and/or modify
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
 * Row-major N-dimensional array of doubles, last axis is the fastest. For the 2D
 * fields axis 0 is the row (y), axis 1 the column (x); 3D fields prepend the slice (z).
 */
public class Field {
	private final int []    shape;
	private final int []    strides;
	private final double [] data;

	public Field(int ... shape) {
		this(shape, new double[length(shape)]);
	}

	public Field(
			int []    shape,
			double [] data) {
		if (data.length != length(shape)) {
			throw new IllegalArgumentException("Data length "+data.length+" does not match shape "+Arrays.toString(shape));
		}
		this.shape =   shape.clone();
		this.strides = strides(shape);
		this.data =    data;
	}

	public static Field of(double [][] rows) {
		int height = rows.length;
		int width =  rows[0].length;
		Field field = new Field(height, width);
		for (int y = 0; y < height; y++) {
			if (rows[y].length != width) {
				throw new IllegalArgumentException("Row "+y+" has length "+rows[y].length+", expected "+width);
			}
			System.arraycopy(rows[y], 0, field.data, y * width, width);
		}
		return field;
	}

	public static Field of(double [][][] slices) {
		int depth =  slices.length;
		int height = slices[0].length;
		int width =  slices[0][0].length;
		Field field = new Field(depth, height, width);
		for (int z = 0; z < depth; z++) {
			for (int y = 0; y < height; y++) {
				if (slices[z][y].length != width) {
					throw new IllegalArgumentException("Row "+z+":"+y+" has length "+slices[z][y].length+", expected "+width);
				}
				System.arraycopy(slices[z][y], 0, field.data, (z * height + y) * width, width);
			}
		}
		return field;
	}

	public static Field filled(double value, int ... shape) {
		Field field = new Field(shape);
		Arrays.fill(field.data, value);
		return field;
	}

	public static int length(int [] shape) {
		long len = 1;
		for (int n : shape) {
			if (n < 0) {
				throw new IllegalArgumentException("Negative extent in shape "+Arrays.toString(shape));
			}
			len *= n;
		}
		if (len > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("Shape "+Arrays.toString(shape)+" is too large for an in-memory field");
		}
		return (int) len;
	}

	static int [] strides(int [] shape) {
		int [] strides = new int [shape.length];
		int stride = 1;
		for (int i = shape.length - 1; i >= 0; i--) {
			strides[i] = stride;
			stride *= shape[i];
		}
		return strides;
	}

	public int numDimensions() {
		return shape.length;
	}

	public int [] getShape() {
		return shape.clone();
	}

	public int getSize(int axis) {
		return shape[axis];
	}

	/** Backing array, not a copy. */
	public double [] getData() {
		return data;
	}

	public int index(int ... coord) {
		int indx = 0;
		for (int i = 0; i < shape.length; i++) {
			indx += coord[i] * strides[i];
		}
		return indx;
	}

	public double get(int ... coord) {
		return data[index(coord)];
	}

	public void set(double value, int ... coord) {
		data[index(coord)] = value;
	}

	/**
	 * Copy of the sub-array starting at origin (inclusive) with the given extent.
	 * @param origin first element along each axis
	 * @param size   extent along each axis
	 * @return new field of shape size
	 */
	public Field subField(
			int [] origin,
			int [] size) {
		if ((origin.length != shape.length) || (size.length != shape.length)) {
			throw new IllegalArgumentException("Range "+Arrays.toString(origin)+"+"+Arrays.toString(size)+
					" does not match "+shape.length+"-dimensional field");
		}
		for (int i = 0; i < shape.length; i++) {
			if ((origin[i] < 0) || (size[i] < 0) || (origin[i] + size[i] > shape[i])) {
				throw new IndexOutOfBoundsException("Range "+Arrays.toString(origin)+"+"+Arrays.toString(size)+
						" exceeds field shape "+Arrays.toString(shape));
			}
		}
		Field sub = new Field(size);
		int last = shape.length - 1;
		int run = size[last];
		int [] coord = new int [shape.length];
		int [] src = new int [shape.length];
		for (int dst_row = 0; dst_row < sub.data.length; dst_row += run) {
			for (int i = 0; i < shape.length; i++) {
				src[i] = origin[i] + coord[i];
			}
			System.arraycopy(data, index(src), sub.data, dst_row, run);
			// advance all but the last axis
			for (int i = last - 1; i >= 0; i--) {
				if (++coord[i] < size[i]) break;
				coord[i] = 0;
			}
		}
		return sub;
	}

	/**
	 * Surround the field with a zero border of the given width on every side.
	 * Two-point counts of the padded field do not depend on periodic wrap-around
	 * for lags up to the border width.
	 */
	public Field zeroPad(int border) {
		int [] padded_shape = new int [shape.length];
		for (int i = 0; i < shape.length; i++) {
			padded_shape[i] = shape[i] + 2 * border;
		}
		Field padded = new Field(padded_shape);
		int [] coord = new int [shape.length];
		int [] dst = new int [shape.length];
		for (int indx = 0; indx < data.length; indx++) {
			for (int i = 0; i < shape.length; i++) {
				dst[i] = coord[i] + border;
			}
			padded.data[padded.index(dst)] = data[indx];
			increment(coord, shape);
		}
		return padded;
	}

	/**
	 * Surround the field with a periodic (wrapped around) border of the given width.
	 * Border may not exceed the field extent along any axis.
	 */
	public Field periodicPad(int border) {
		int [] padded_shape = new int [shape.length];
		for (int i = 0; i < shape.length; i++) {
			if (border > shape[i]) {
				throw new IllegalArgumentException("Periodic border "+border+" exceeds axis "+i+" length "+shape[i]);
			}
			padded_shape[i] = shape[i] + 2 * border;
		}
		Field padded = new Field(padded_shape);
		int [] coord = new int [shape.length];
		int [] src = new int [shape.length];
		for (int indx = 0; indx < padded.data.length; indx++) {
			for (int i = 0; i < shape.length; i++) {
				src[i] = Math.floorMod(coord[i] - border, shape[i]);
			}
			padded.data[indx] = data[index(src)];
			increment(coord, padded_shape);
		}
		return padded;
	}

	/** Row-major increment of an N-d coordinate, wraps to all zeros after the last element. */
	static void increment(int [] coord, int [] shape) {
		for (int i = shape.length - 1; i >= 0; i--) {
			if (++coord[i] < shape[i]) return;
			coord[i] = 0;
		}
	}

	public double sum() {
		double s = 0.0;
		for (double d : data) s += d;
		return s;
	}

	@Override
	public String toString() {
		return "Field"+Arrays.toString(shape);
	}
}
