/**
 **
 ** CorrelationException.java - Base class for the fatal two-point correlation errors
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrelationException.java is free software: you can redistribute it and/or modify
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

/**
 * Unrecoverable condition detected while computing vector counts. The run is aborted,
 * no partial counts are returned.
 */
public class CorrelationException extends RuntimeException {
	private static final long serialVersionUID = 4630155275137125377L;

	public CorrelationException(String message) {
		super(message);
	}

	public CorrelationException(String message, Throwable cause) {
		super(message, cause);
	}
}
