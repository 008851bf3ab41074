/**
 **
 ** TwoPointCorrelation.java - Vector counts for two-point statistics, full (in-memory) and patched (out-of-core)
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TwoPointCorrelation.java is free software: you can redistribute it and/or modify
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
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.twopoint.stores.FieldStores;
import com.elphel.twopoint.stores.StoredField;

/**
 * Computes vector counts: for every lag vector k with |k_i| &lt;= cutoff, the sum over origins
 * x of f1(x) * f2(x + k) (f1 == f2 for auto-correlation). The result has 2*cutoff+1 elements
 * along each axis, lag 0 at index cutoff. Two-point probabilities are the ratio of the counts
 * of a field and of its indicator/reference field, see {@link CorrelationCounts#normalize}.
 * <p>
 * Full mode correlates whole in-memory fields with periodic boundaries. Patched mode reads the
 * field from a store window by window, counting only origins in the field core (the field
 * without a cutoff-wide border) so memory use is limited by the window size. Both modes produce
 * the same counts for fields with a zero border of cutoff width (see {@link Field#zeroPad}).
 */
public class TwoPointCorrelation {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(TwoPointCorrelation.class);

	private final int               cutoff;
	private final MaskedCorrelation kernel;
	private CorrelationProgress     progress =     CorrelationProgress.NONE;
	private CancellationToken       cancellation = null;

	public TwoPointCorrelation(int cutoff) {
		this.kernel = new MaskedCorrelation(cutoff); // validates cutoff
		this.cutoff = cutoff;
	}

	/** Correlation with cutoff and progress reporting from the parameters. */
	public static TwoPointCorrelation fromParameters(CorrelationParameters params) {
		TwoPointCorrelation correlation = new TwoPointCorrelation(params.cutoff);
		if (params.log_progress) {
			correlation.setProgress(new LoggingProgress());
		}
		return correlation;
	}

	public int getCutoff() {
		return cutoff;
	}

	public TwoPointCorrelation setProgress(CorrelationProgress progress) {
		this.progress = (progress == null) ? CorrelationProgress.NONE : progress;
		return this;
	}

	public TwoPointCorrelation setCancellation(CancellationToken cancellation) {
		this.cancellation = cancellation;
		return this;
	}

	/**
	 * In-memory computation.
	 * @param kind   auto (one field) or cross (two fields of the same shape)
	 * @param fields correlated fields
	 * @return vector counts shaped (2*cutoff+1)^N
	 */
	public Field computeFull(
			CorrelationKind kind,
			Field ...       fields) {
		checkFieldCount(kind, fields.length);
		return (kind == CorrelationKind.AUTO) ? fullAuto(fields[0]) : fullCross(fields[0], fields[1]);
	}

	/**
	 * Out-of-core computation.
	 * @param kind     auto (one source) or cross (two sources of the same shape)
	 * @param winmulti window size multiplier, nominal window core is winmulti*(cutoff+1).
	 *                 Each block (core plus 2*cutoff) is padded to the next power of two along
	 *                 every axis for the FFT, so a block just above a power of two takes up to
	 *                 2^N times its own size. Sizes with core + 2*cutoff at or below a power
	 *                 of two use memory best.
	 * @param sources  stored fields
	 * @return vector counts shaped (2*cutoff+1)^N
	 */
	public Field computePatched(
			CorrelationKind kind,
			int             winmulti,
			StoredField ... sources) {
		checkFieldCount(kind, sources.length);
		return (kind == CorrelationKind.AUTO) ? patchedAuto(sources[0], winmulti) : patchedCross(sources[0], winmulti, sources[1]);
	}

	/**
	 * Out-of-core computation for "/path/file.tif/ArrayName" references, stores are opened
	 * for the run and closed afterwards.
	 */
	public Field computePatched(
			CorrelationKind       kind,
			int                   winmulti,
			CorrelationParameters params,
			String ...            references) throws IOException {
		checkFieldCount(kind, references.length);
		StoredField [] sources = new StoredField [references.length];
		Exception failure = null;
		try {
			for (int i = 0; i < references.length; i++) {
				sources[i] = FieldStores.open(FieldStores.parse(references[i], params), params);
			}
			return computePatched(kind, winmulti, sources);
		} catch (IOException | RuntimeException e) {
			failure = e;
			throw e;
		} finally {
			closeSources(sources, failure);
		}
	}

	/**
	 * Close all opened stores. Close failures are added as suppressed to the run failure, if any,
	 * otherwise the first of them is thrown after all stores are closed.
	 */
	static void closeSources(
			StoredField [] sources,
			Exception      failure) throws IOException {
		IOException close_failure = null;
		for (StoredField source : sources) {
			if (source == null) continue;
			try {
				source.getStore().close();
			} catch (IOException e) {
				if (failure != null) {
					LOGGER.warn("Failed to close "+source+" after an aborted run: "+e.getMessage());
					failure.addSuppressed(e);
				} else if (close_failure == null) {
					close_failure = e;
				} else {
					close_failure.addSuppressed(e);
				}
			}
		}
		if (close_failure != null) {
			throw close_failure;
		}
	}

	public Field fullAuto(Field field) {
		checkFull(field);
		Field block = field.periodicPad(cutoff);
		return new Field(kernel.getLagShape(block.numDimensions()), kernel.correlate(block, field.getShape()));
	}

	/**
	 * @param field1 provides values at the origins
	 * @param field2 provides values at origin + lag
	 */
	public Field fullCross(
			Field field1,
			Field field2) {
		ShapeMismatchException.check(field1.getShape(), field2.getShape());
		checkFull(field1);
		Field block1 = field1.periodicPad(cutoff);
		Field block2 = field2.periodicPad(cutoff);
		return new Field(kernel.getLagShape(block1.numDimensions()), kernel.correlate(block1, block2, field1.getShape()));
	}

	public Field patchedAuto(
			StoredField source,
			int         winmulti) {
		return patched(source, null, winmulti);
	}

	/**
	 * @param source1 provides values at the origins
	 * @param source2 provides values at origin + lag
	 */
	public Field patchedCross(
			StoredField source1,
			int         winmulti,
			StoredField source2) {
		return patched(source1, source2, winmulti);
	}

	private Field patched(
			StoredField origin_source,
			StoredField shifted_source, // null for auto-correlation
			int         winmulti) {
		BlockExtractor origin_extractor = new BlockExtractor(origin_source);
		int [] shape = origin_extractor.getStoreShape();
		DimensionalityException.check(shape);
		BlockExtractor shifted_extractor = null;
		if (shifted_source != null) {
			shifted_extractor = new BlockExtractor(shifted_source);
			ShapeMismatchException.check(shape, shifted_extractor.getStoreShape());
		}
		WindowGrid grid = WindowGrid.plan(shape, cutoff, winmulti);
		int total = grid.size();
		if (LOGGER.isDebugEnabled()) {
			for (int axis = 0; axis < grid.numDimensions(); axis++) {
				LOGGER.debug(grid.getPlan(axis).toString());
			}
		}
		LOGGER.info("Patched "+((shifted_source == null) ? "auto" : "cross")+"-correlation of "+origin_source+
				((shifted_source == null) ? "" : (" and "+shifted_source))+", shape "+Arrays.toString(shape)+
				", cutoff "+cutoff+", winmulti "+winmulti+": "+total+" windows");
		int [] transform_shape = FieldTransform.paddedShape(grid.getMaxBlockShape());
		LOGGER.info(String.format("Largest block %s is transformed as %s, %.1f MB per window",
				Arrays.toString(grid.getMaxBlockShape()), Arrays.toString(transform_shape),
				getTransformBytes(transform_shape) / 1048576.0));

		CorrelationAccumulator accumulator = new CorrelationAccumulator(cutoff, shape.length);
		int    completed = 0;
		double first_window_seconds = 0.0;
		for (int [] window : grid) {
			if ((cancellation != null) && cancellation.isCancelled()) {
				throw new CorrelationCancelledException(completed, total);
			}
			long start_time = System.nanoTime();
			BlockRange range = grid.getBlockRange(window);
			Field origin_block =  origin_extractor.extract(range);
			Field shifted_block = (shifted_extractor == null) ? origin_block : shifted_extractor.extract(range);
			accumulator.add(kernel.correlate(origin_block, shifted_block, range.getCore()));
			completed++;
			if (completed == 1) {
				first_window_seconds = (System.nanoTime() - start_time) * 1E-9;
			}
			progress.windowDone(completed, total, first_window_seconds);
		}
		return accumulator.toField();
	}

	/**
	 * Memory used by the transforms of one window: two complex double arrays (origin spectrum
	 * and product) on the padded grid.
	 */
	static long getTransformBytes(int [] transform_shape) {
		long len = 1;
		for (int n : transform_shape) len *= n;
		return 2 * 2 * 8 * len;
	}

	private void checkFull(Field field) {
		int [] shape = field.getShape();
		DimensionalityException.check(shape);
		for (int axis = 0; axis < shape.length; axis++) {
			if (shape[axis] <= 2 * cutoff) {
				throw new DegenerateAxisException(axis, shape[axis], cutoff, 0);
			}
		}
	}

	private static void checkFieldCount(
			CorrelationKind kind,
			int             count) {
		int needed = (kind == CorrelationKind.AUTO) ? 1 : 2;
		if (count != needed) {
			throw new IllegalArgumentException(kind+" correlation needs "+needed+" field(s), got "+count);
		}
	}
}
