/**
 **
 ** BlockOutOfRangeException.java - Extraction range outside of the backing store
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BlockOutOfRangeException.java is free software: you can redistribute it and/or modify
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
 * Block range exceeds the store extent. Window plans always tile the core, so this
 * indicates a planning defect rather than bad input.
 */
public class BlockOutOfRangeException extends CorrelationException {
	private static final long serialVersionUID = 2975003711484627411L;

	public BlockOutOfRangeException(BlockRange range, int [] store_shape) {
		super("Block "+range+" exceeds store shape "+Arrays.toString(store_shape));
	}
}
