/**
 **
 ** TiffFieldStore.java - Out-of-core field store backed by an uncompressed TIFF file
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TiffFieldStore.java is free software: you can redistribute it and/or modify
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

package com.elphel.twopoint.stores;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.twopoint.common.FieldImages;
import com.elphel.twopoint.correlation.Field;

import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.FileSaver;
import ij.io.TiffDecoder;

/**
 * Reads rectangular chunks of a field stored as an uncompressed TIFF image (2D field,
 * [height, width]) or stack (3D field, [slices, height, width]). Only the rows inside
 * a requested chunk are read from disk.
 * <p>
 * A TIFF container holds one array. Its identifier is the "array=" line of the ImageJ
 * "Info" property, or the default identifier when there is no such line.
 */
public class TiffFieldStore implements FieldStore {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(TiffFieldStore.class);

	public static final String INFO_ARRAY_KEY = "array";

	private final File             file;
	private final String           array_name;
	private final int []           shape;
	private final long []          slice_offsets;
	private final int              bytes_per_pixel;
	private final int              file_type;
	private final ByteOrder        byte_order;
	private final RandomAccessFile raf;

	public TiffFieldStore(
			File   file,
			String default_array) throws IOException {
		this.file = file;
		if (!file.isFile()) {
			throw new IOException("TIFF container "+file+" does not exist");
		}
		String dir = file.getAbsoluteFile().getParent();
		if (!dir.endsWith(File.separator)) {
			dir += File.separator;
		}
		FileInfo [] info = new TiffDecoder(dir, file.getName()).getTiffInfo();
		if ((info == null) || (info.length == 0)) {
			throw new IOException("No images found in "+file);
		}
		FileInfo fi = info[0];
		if (fi.compression > FileInfo.COMPRESSION_NONE) {
			throw new IOException("Compressed TIFF "+file+" can not be read by chunks (compression="+fi.compression+")");
		}
		this.file_type =       fi.fileType;
		this.bytes_per_pixel = bytesPerPixel(fi.fileType);
		this.byte_order =      fi.intelByteOrder ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
		this.array_name =      arrayName(fi.info, default_array);

		long slice_bytes = (long) fi.width * fi.height * bytes_per_pixel;
		int depth;
		if (info.length > 1) { // one IFD per slice
			depth = info.length;
			slice_offsets = new long [depth];
			for (int z = 0; z < depth; z++) {
				if ((info[z].width != fi.width) || (info[z].height != fi.height) || (info[z].fileType != fi.fileType) ||
						(info[z].compression > FileInfo.COMPRESSION_NONE)) {
					throw new IOException("Slice "+z+" of "+file+" differs in size, type or compression from the first one");
				}
				slice_offsets[z] = info[z].getOffset();
			}
		} else {
			depth = Math.max(fi.nImages, 1);
			long gap = fi.gapBetweenImages;
			slice_offsets = new long [depth];
			for (int z = 0; z < depth; z++) {
				slice_offsets[z] = fi.getOffset() + z * (slice_bytes + gap);
			}
		}
		this.shape = (depth > 1) ? new int [] {depth, fi.height, fi.width} : new int [] {fi.height, fi.width};
		if (slice_offsets[depth - 1] + slice_bytes > file.length()) {
			throw new IOException("TIFF "+file+" is truncated: expected at least "+(slice_offsets[depth - 1] + slice_bytes)+
					" bytes, got "+file.length());
		}
		this.raf = new RandomAccessFile(file, "r");
		LOGGER.debug("Opened "+file+": array \""+array_name+"\", shape "+Arrays.toString(shape)+", file type "+file_type);
	}

	/**
	 * Save a field so that it can be opened as a TIFF store.
	 * @param file       destination, should have a .tif or .tiff extension
	 * @param array_name identifier recorded in the ImageJ "Info" property
	 * @param field      2D field or 3D field with at least 2 slices
	 * @throws IOException if ImageJ fails to write the file
	 */
	public static void write(
			File   file,
			String array_name,
			Field  field) throws IOException {
		int [] shape = field.getShape();
		if ((shape.length == 3) && (shape[0] < 2)) {
			throw new IllegalArgumentException("3D field "+Arrays.toString(shape)+" needs at least 2 slices to be stored as a stack");
		}
		ImagePlus imp = FieldImages.toImage(field, file.getName());
		imp.setProperty("Info", INFO_ARRAY_KEY+"="+array_name+"\n");
		FileSaver fs = new FileSaver(imp);
		boolean ok = (imp.getStackSize() > 1) ? fs.saveAsTiffStack(file.getPath()) : fs.saveAsTiff(file.getPath());
		if (!ok) {
			throw new IOException("Failed to save "+file);
		}
		LOGGER.debug("Saved array \""+array_name+"\" "+Arrays.toString(shape)+" to "+file);
	}

	static String arrayName(
			String info,
			String default_array) {
		if (info != null) {
			for (String line : info.split("\n")) {
				int eq = line.indexOf('=');
				if ((eq > 0) && line.substring(0, eq).trim().equals(INFO_ARRAY_KEY)) {
					String name = line.substring(eq + 1).trim();
					if (!name.isEmpty()) {
						return name;
					}
				}
			}
		}
		return default_array;
	}

	static int bytesPerPixel(int file_type) throws IOException {
		switch (file_type) {
		case FileInfo.GRAY8:           return 1;
		case FileInfo.GRAY16_SIGNED:
		case FileInfo.GRAY16_UNSIGNED: return 2;
		case FileInfo.GRAY32_INT:
		case FileInfo.GRAY32_UNSIGNED:
		case FileInfo.GRAY32_FLOAT:    return 4;
		case FileInfo.GRAY64_FLOAT:    return 8;
		default:
			throw new IOException("Unsupported TIFF pixel type "+file_type+", only grayscale images can be used as fields");
		}
	}

	@Override
	public String getName() {
		return file.getPath();
	}

	public String getArrayName() {
		return array_name;
	}

	@Override
	public int [] getShape(String array_name) throws IOException {
		checkArray(array_name);
		return shape.clone();
	}

	@Override
	public synchronized Field read(
			String array_name,
			int [] origin,
			int [] size) throws IOException {
		checkArray(array_name);
		if ((origin.length != shape.length) || (size.length != shape.length)) {
			throw new IOException("Chunk "+Arrays.toString(origin)+"+"+Arrays.toString(size)+" does not match "+
					shape.length+"-dimensional array \""+array_name+"\"");
		}
		for (int i = 0; i < shape.length; i++) {
			if ((origin[i] < 0) || (size[i] < 1) || (origin[i] + size[i] > shape[i])) {
				throw new IOException("Chunk "+Arrays.toString(origin)+"+"+Arrays.toString(size)+" is outside of "+
						Arrays.toString(shape)+" in "+file);
			}
		}
		boolean stack = shape.length == 3;
		int z0 =     stack ? origin[0] : 0;
		int depth =  stack ? size[0]   : 1;
		int y0 =     origin[shape.length - 2];
		int height = size[shape.length - 2];
		int x0 =     origin[shape.length - 1];
		int width =  size[shape.length - 1];
		int image_width = shape[shape.length - 1];

		Field chunk = new Field(size);
		double [] data = chunk.getData();
		byte [] row = new byte [width * bytes_per_pixel];
		ByteBuffer bb = ByteBuffer.wrap(row).order(byte_order);
		int indx = 0;
		for (int z = 0; z < depth; z++) {
			for (int y = 0; y < height; y++) {
				long pos = slice_offsets[z0 + z] + ((long) (y0 + y) * image_width + x0) * bytes_per_pixel;
				raf.seek(pos);
				raf.readFully(row);
				bb.rewind();
				for (int x = 0; x < width; x++) {
					data[indx++] = decode(bb);
				}
			}
		}
		return chunk;
	}

	private double decode(ByteBuffer bb) {
		switch (file_type) {
		case FileInfo.GRAY8:           return bb.get() & 0xff;
		case FileInfo.GRAY16_SIGNED:   return bb.getShort();
		case FileInfo.GRAY16_UNSIGNED: return bb.getShort() & 0xffff;
		case FileInfo.GRAY32_INT:      return bb.getInt();
		case FileInfo.GRAY32_UNSIGNED: return bb.getInt() & 0xffffffffL;
		case FileInfo.GRAY32_FLOAT:    return bb.getFloat();
		default:                       return bb.getDouble(); // GRAY64_FLOAT
		}
	}

	private void checkArray(String requested) throws IOException {
		if (!array_name.equals(requested)) {
			throw new IOException("Array \""+requested+"\" not found in "+file+", it contains \""+array_name+"\"");
		}
	}

	@Override
	public synchronized void close() throws IOException {
		raf.close();
	}
}
