/**
 **
 ** LoggingProgress.java - Reports patched run progress and ETA to the log
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LoggingProgress.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgress implements CorrelationProgress {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(LoggingProgress.class);
	private final int report_percent; // log every this many percent

	public LoggingProgress() {
		this(10);
	}

	public LoggingProgress(int report_percent) {
		this.report_percent = Math.max(report_percent, 1);
	}

	@Override
	public void windowDone(
			int    completed,
			int    total,
			double first_window_seconds) {
		if (completed == 1) {
			LOGGER.info(String.format("Estimated completion = %.2f minutes (%d windows)",
					(total - 1) * first_window_seconds / 60, total));
		}
		int percent =      (int) (100L * completed / total);
		int prev_percent = (int) (100L * (completed - 1) / total);
		if ((completed == total) || (percent / report_percent != prev_percent / report_percent)) {
			LOGGER.info(String.format("Progress = %.2f %%", 100.0 * completed / total));
		}
	}
}
