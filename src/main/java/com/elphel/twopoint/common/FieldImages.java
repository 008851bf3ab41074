/**
 **
 ** FieldImages.java - Conversion between ImageJ images and correlation fields
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FieldImages.java is free software: you can redistribute it and/or modify
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

package com.elphel.twopoint.common;

import com.elphel.twopoint.correlation.DimensionalityException;
import com.elphel.twopoint.correlation.Field;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

public class FieldImages {

	/**
	 * Single image becomes a 2D field [height, width], a stack of more than one slice
	 * a 3D field [slices, height, width].
	 */
	public static Field fromImage(ImagePlus imp) {
		ImageStack stack = imp.getStack();
		int width =  stack.getWidth();
		int height = stack.getHeight();
		int depth =  stack.getSize();
		Field field = (depth > 1) ? new Field(depth, height, width) : new Field(height, width);
		double [] data = field.getData();
		int slice_len = width * height;
		for (int z = 0; z < depth; z++) {
			ImageProcessor ip = stack.getProcessor(z + 1);
			for (int i = 0; i < slice_len; i++) {
				data[z * slice_len + i] = ip.getf(i);
			}
		}
		return field;
	}

	/**
	 * 32-bit image (2D field) or stack (3D field). Values are rounded to float.
	 */
	public static ImagePlus toImage(
			Field  field,
			String title) {
		int [] shape = field.getShape();
		DimensionalityException.check(shape);
		int depth =  (shape.length == 3) ? shape[0] : 1;
		int height = shape[shape.length - 2];
		int width =  shape[shape.length - 1];
		double [] data = field.getData();
		ImageStack stack = new ImageStack(width, height);
		int slice_len = width * height;
		for (int z = 0; z < depth; z++) {
			float [] pixels = new float [slice_len];
			for (int i = 0; i < slice_len; i++) {
				pixels[i] = (float) data[z * slice_len + i];
			}
			stack.addSlice((shape.length == 3) ? ("z="+z) : null, new FloatProcessor(width, height, pixels));
		}
		return new ImagePlus(title, stack);
	}
}
