/**
 **
 ** CorrelationProgress.java - Observer of patched correlation runs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrelationProgress.java is free software: you can redistribute it and/or modify
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
 * Notified after each completed window of a patched run.
 */
public interface CorrelationProgress {
	CorrelationProgress NONE = (completed, total, first_window_seconds) -> {};

	/**
	 * @param completed            windows done so far (1..total)
	 * @param total                number of windows in the run
	 * @param first_window_seconds time spent on the first window
	 */
	void windowDone(
			int    completed,
			int    total,
			double first_window_seconds);
}
