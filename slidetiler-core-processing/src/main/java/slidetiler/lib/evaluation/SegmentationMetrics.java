/*-
 * #%L
 * This file is part of SlideTiler.
 * %%
 * Copyright (C) 2024 - 2026 SlideTiler developers
 * %%
 * SlideTiler is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SlideTiler is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SlideTiler.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package slidetiler.lib.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.images.BinaryMask;
import slidetiler.lib.reconstruction.ProbabilityMap;

/**
 * Static methods to score predicted masks against ground truth.
 * 
 * @author SlideTiler developers
 */
public final class SegmentationMetrics {

	private static final Logger logger = LoggerFactory.getLogger(SegmentationMetrics.class);

	/**
	 * Thresholds tried by {@link #tweakThreshold(ProbabilityMap, BinaryMask)}: 0.2 to 0.6 in steps of 0.05.
	 */
	public static final List<Double> DEFAULT_THRESHOLDS;

	static {
		List<Double> thresholds = new ArrayList<>();
		for (int i = 0; i <= 8; i++)
			thresholds.add(0.2 + i * 0.05);
		DEFAULT_THRESHOLDS = Collections.unmodifiableList(thresholds);
	}

	// Suppress default constructor for non-instantiability
	private SegmentationMetrics() {
		throw new AssertionError();
	}

	/**
	 * Compute the Dice coefficient {@code 2|A ∩ B| / (|A| + |B|)}.
	 * @param truth
	 * @param predicted
	 * @return the Dice coefficient, or 1 if both masks are empty
	 */
	public static double dice(BinaryMask truth, BinaryMask predicted) {
		checkSize(truth.getHeight(), truth.getWidth(), predicted.getHeight(), predicted.getWidth());
		long intersection = 0;
		for (int x = 0; x < truth.getHeight(); x++) {
			for (int y = truth.nextPositive(x, 0); y >= 0; y = truth.nextPositive(x, y + 1)) {
				if (predicted.isPositive(x, y))
					intersection++;
			}
		}
		return dice(intersection, truth.countPositive(), predicted.countPositive());
	}

	/**
	 * Find the threshold giving the best Dice score, trying {@link #DEFAULT_THRESHOLDS}.
	 * @param probabilities
	 * @param truth
	 * @return
	 */
	public static ThresholdScore tweakThreshold(ProbabilityMap probabilities, BinaryMask truth) {
		return tweakThreshold(probabilities, truth, DEFAULT_THRESHOLDS);
	}

	/**
	 * Find the threshold giving the best Dice score.
	 * Pixels are predicted positive if their probability is strictly greater than the threshold.
	 * If several thresholds give the same score, the first is returned.
	 * @param probabilities
	 * @param truth
	 * @param thresholds thresholds to try; must not be empty
	 * @return
	 */
	public static ThresholdScore tweakThreshold(ProbabilityMap probabilities, BinaryMask truth, List<Double> thresholds) {
		if (thresholds.isEmpty())
			throw new IllegalArgumentException("At least one threshold is required!");
		int height = probabilities.getHeight();
		int width = probabilities.getWidth();
		checkSize(truth.getHeight(), truth.getWidth(), height, width);

		int n = thresholds.size();
		long[] intersection = new long[n];
		long[] predictedCount = new long[n];
		for (int x = 0; x < height; x++) {
			for (int y = 0; y < width; y++) {
				float p = probabilities.getValue(x, y);
				boolean positive = truth.isPositive(x, y);
				for (int t = 0; t < n; t++) {
					if (p > thresholds.get(t)) {
						predictedCount[t]++;
						if (positive)
							intersection[t]++;
					}
				}
			}
		}
		long truthCount = truth.countPositive();
		ThresholdScore best = null;
		for (int t = 0; t < n; t++) {
			double score = dice(intersection[t], truthCount, predictedCount[t]);
			logger.trace("Threshold {}: dice {}", thresholds.get(t), score);
			if (best == null || score > best.getScore())
				best = new ThresholdScore(thresholds.get(t), score);
		}
		logger.debug("Best threshold {}", best);
		return best;
	}

	private static double dice(long intersection, long truthCount, long predictedCount) {
		if (truthCount + predictedCount == 0)
			return 1.0;
		return 2.0 * intersection / (truthCount + predictedCount);
	}

	private static void checkSize(int h1, int w1, int h2, int w2) {
		if (h1 != h2 || w1 != w2)
			throw new IllegalArgumentException(String.format("Sizes %d x %d and %d x %d do not match", h1, w1, h2, w2));
	}

}
