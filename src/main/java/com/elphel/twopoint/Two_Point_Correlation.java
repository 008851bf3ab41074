/**
 **
 ** Two_Point_Correlation.java - ImageJ plugin computing two-point correlation vector counts
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Two_Point_Correlation.java is free software: you can redistribute it and/or modify
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

package com.elphel.twopoint;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.twopoint.common.FieldImages;
import com.elphel.twopoint.correlation.CancellationToken;
import com.elphel.twopoint.correlation.CorrelationException;
import com.elphel.twopoint.correlation.CorrelationKind;
import com.elphel.twopoint.correlation.CorrelationMode;
import com.elphel.twopoint.correlation.CorrelationParameters;
import com.elphel.twopoint.correlation.CorrelationProgress;
import com.elphel.twopoint.correlation.Field;
import com.elphel.twopoint.correlation.LoggingProgress;
import com.elphel.twopoint.correlation.TwoPointCorrelation;

import ij.IJ;
import ij.ImagePlus;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;

/**
 * Full mode correlates open images (single images as 2D fields, stacks as 3D fields),
 * patched mode correlates TIFF files given as "/path/file.tif/ArrayName" references.
 * Escape cancels a patched run.
 */
public class Two_Point_Correlation implements PlugIn {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(Two_Point_Correlation.class);

	private static CorrelationParameters PARAMS =     null;
	private static String                REFERENCE1 = "";
	private static String                REFERENCE2 = "";

	@Override
	public void run(String arg) {
		try {
			if (PARAMS == null) {
				PARAMS = CorrelationParameters.loadDefaults();
			}
		} catch (IOException e) {
			IJ.error("Two-Point Correlation", "Failed to load defaults: "+e.getMessage());
			return;
		}
		GenericDialog gd = new GenericDialog("Two-Point Correlation");
		PARAMS.dialogQuestions(gd);
		gd.showDialog();
		if (gd.wasCanceled()) return;
		PARAMS.dialogAnswers(gd);
		try {
			CorrelationMode mode = PARAMS.getMode();
			CorrelationKind kind = PARAMS.getKind();
			Field counts = (mode == CorrelationMode.FULL) ? runFull(kind) : runPatched(kind);
			if (counts == null) return; // dialog canceled
			ImagePlus imp = FieldImages.toImage(counts, "counts-"+PARAMS.mode+"-"+PARAMS.kind+"-c"+PARAMS.cutoff);
			imp.show();
		} catch (CorrelationException | IllegalArgumentException | IOException e) {
			LOGGER.error("Two-point correlation failed: "+e.getMessage());
			IJ.error("Two-Point Correlation", e.getMessage());
		}
	}

	private Field runFull(CorrelationKind kind) {
		int [] ids = WindowManager.getIDList();
		if (ids == null) {
			IJ.noImage();
			return null;
		}
		String [] titles = new String [ids.length];
		for (int i = 0; i < ids.length; i++) {
			titles[i] = WindowManager.getImage(ids[i]).getTitle();
		}
		GenericDialog gd = new GenericDialog("Full "+PARAMS.kind+"-correlation");
		gd.addChoice("Field", titles, titles[0]);
		if (kind == CorrelationKind.CROSS) {
			gd.addChoice("Second field", titles, titles[Math.min(1, titles.length - 1)]);
		}
		gd.showDialog();
		if (gd.wasCanceled()) return null;
		Field field1 = FieldImages.fromImage(WindowManager.getImage(ids[gd.getNextChoiceIndex()]));
		TwoPointCorrelation correlation = new TwoPointCorrelation(PARAMS.cutoff);
		if (kind == CorrelationKind.AUTO) {
			return correlation.computeFull(kind, field1);
		}
		Field field2 = FieldImages.fromImage(WindowManager.getImage(ids[gd.getNextChoiceIndex()]));
		return correlation.computeFull(kind, field1, field2);
	}

	private Field runPatched(CorrelationKind kind) throws IOException {
		GenericDialog gd = new GenericDialog("Patched "+PARAMS.kind+"-correlation");
		gd.addStringField("Field reference",        REFERENCE1, 60);
		if (kind == CorrelationKind.CROSS) {
			gd.addStringField("Second field reference", REFERENCE2, 60);
		}
		gd.showDialog();
		if (gd.wasCanceled()) return null;
		REFERENCE1 = gd.getNextString().trim();
		if (kind == CorrelationKind.CROSS) {
			REFERENCE2 = gd.getNextString().trim();
		}
		final CancellationToken cancellation = new CancellationToken();
		final CorrelationProgress log_progress = PARAMS.log_progress ? new LoggingProgress() : CorrelationProgress.NONE;
		TwoPointCorrelation correlation = new TwoPointCorrelation(PARAMS.cutoff)
				.setCancellation(cancellation)
				.setProgress((completed, total, first_window_seconds) -> {
					log_progress.windowDone(completed, total, first_window_seconds);
					IJ.showProgress(completed, total);
					if (IJ.escapePressed()) {
						cancellation.cancel();
					}
				});
		IJ.resetEscape();
		if (kind == CorrelationKind.AUTO) {
			return correlation.computePatched(kind, PARAMS.winmulti, PARAMS, REFERENCE1);
		}
		return correlation.computePatched(kind, PARAMS.winmulti, PARAMS, REFERENCE1, REFERENCE2);
	}
}
