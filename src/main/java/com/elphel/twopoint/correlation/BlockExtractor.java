/**
 **
 ** BlockExtractor.java - Reads window blocks (core plus halo) from a stored field
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BlockExtractor.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;

import com.elphel.twopoint.stores.StoredField;

public class BlockExtractor {
	private final StoredField source;
	private final int []      store_shape;

	public BlockExtractor(StoredField source) {
		this.source =      source;
		this.store_shape = source.getShape();
	}

	public int [] getStoreShape() {
		return store_shape.clone();
	}

	/**
	 * @param range block range produced by the window grid
	 * @return block data, shaped core + 2*cutoff along each axis
	 * @throws BlockOutOfRangeException if the range does not fit the store
	 * @throws StoreAccessException if the store fails to provide the data
	 */
	public Field extract(BlockRange range) {
		if (!range.fits(store_shape)) {
			throw new BlockOutOfRangeException(range, store_shape);
		}
		try {
			return source.read(range.getStart(), range.getShape());
		} catch (IOException e) {
			throw new StoreAccessException(source.getArrayName(), "block "+range+" in "+source.getStore().getName(), e);
		}
	}
}
