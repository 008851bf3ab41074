/**
 **
 ** StoreAccessException.java - Failure reading a block from a field store
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StoreAccessException.java is free software: you can redistribute it and/or modify
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

public class StoreAccessException extends CorrelationException {
	private static final long serialVersionUID = -3312498905514866317L;
	private final String array_name;

	public StoreAccessException(
			String    array_name,
			String    what,
			Throwable cause) {
		super("Failed to read "+what+" of array \""+array_name+"\": "+cause.getMessage(), cause);
		this.array_name = array_name;
	}

	public String getArrayName() {
		return array_name;
	}
}
