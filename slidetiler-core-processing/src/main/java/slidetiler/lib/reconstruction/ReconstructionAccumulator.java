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

package slidetiler.lib.reconstruction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.regions.TileRect;
import slidetiler.lib.tiling.WeightKernel;

/**
 * Accumulates weighted tile predictions into a full-resolution probability map.
 * <p>
 * Two buffers covering the whole image are maintained: the sum of weighted predictions and the sum of weights.
 * Adding a tile updates both buffers inside the tile rectangle; finalizing divides the sums by the 
 * weights (floored at {@link #EPSILON}), so pixels never covered by a tile are 0 rather than NaN.
 * <p>
 * This class is not thread-safe. When tiles are predicted in parallel, each worker should use its own 
 * accumulator and the results should be combined with {@link #merge(ReconstructionAccumulator)}.
 *
 * @author SlideTiler developers
 */
public class ReconstructionAccumulator {

	private static final Logger logger = LoggerFactory.getLogger(ReconstructionAccumulator.class);

	/**
	 * Minimum denominator used when finalizing.
	 */
	public static final float EPSILON = 1e-6f;

	private final int height;
	private final int width;
	private final int expectedTiles;

	private final float[][] sum;
	private final float[][] weightTotal;

	private int tileCount = 0;

	/**
	 * Create an accumulator for an image, without checking the number of tiles when finalizing.
	 * @param height image height
	 * @param width image width
	 */
	public ReconstructionAccumulator(int height, int width) {
		this(height, width, -1);
	}

	/**
	 * Create an accumulator for an image that requires a fixed number of tiles before it can be finalized.
	 * @param height image height
	 * @param width image width
	 * @param expectedTiles number of tiles that must be added before {@link #finalizeMap()}, or -1 if this should not be checked
	 */
	public ReconstructionAccumulator(int height, int width, int expectedTiles) {
		if (height <= 0 || width <= 0)
			throw new IllegalArgumentException(String.format("Invalid accumulator size %d x %d", height, width));
		this.height = height;
		this.width = width;
		this.expectedTiles = expectedTiles;
		this.sum = new float[height][width];
		this.weightTotal = new float[height][width];
	}

	/**
	 * Add a tile prediction.
	 * @param rect rectangle of the tile within the image
	 * @param prediction foreground probabilities of the tile, indexed {@code [row][column]}
	 * @param kernel weights with the same size as the tile
	 * @throws slidetiler.lib.regions.InvalidRegionException if the rectangle is outside the image
	 * @throws IllegalArgumentException if the prediction or kernel size doesn't match the rectangle
	 */
	public void addTile(TileRect rect, float[][] prediction, WeightKernel kernel) {
		rect.checkWithin(height, width);
		int h = rect.getHeight();
		int w = rect.getWidth();
		if (prediction.length != h || prediction[0].length != w)
			throw new IllegalArgumentException(String.format("Prediction size %d x %d does not match %s", prediction.length, prediction[0].length, rect));
		if (kernel.getSize() != h || kernel.getSize() != w)
			throw new IllegalArgumentException("Kernel size " + kernel.getSize() + " does not match " + rect);
		for (int i = 0; i < h; i++) {
			float[] predRow = prediction[i];
			float[] sumRow = sum[rect.getX0() + i];
			float[] weightRow = weightTotal[rect.getX0() + i];
			int y0 = rect.getY0();
			for (int j = 0; j < w; j++) {
				float weight = kernel.getWeight(i, j);
				sumRow[y0 + j] += predRow[j] * weight;
				weightRow[y0 + j] += weight;
			}
		}
		tileCount++;
		logger.trace("Added tile {} ({} total)", rect, tileCount);
	}

	/**
	 * Add the sums and weights of another accumulator for the same image to this one.
	 * The other accumulator is unchanged.
	 * @param other
	 */
	public void merge(ReconstructionAccumulator other) {
		if (other.height != height || other.width != width)
			throw new IllegalArgumentException(String.format("Cannot merge accumulator of size %d x %d into %d x %d", other.height, other.width, height, width));
		for (int x = 0; x < height; x++) {
			float[] sumRow = sum[x];
			float[] weightRow = weightTotal[x];
			float[] otherSum = other.sum[x];
			float[] otherWeight = other.weightTotal[x];
			for (int y = 0; y < width; y++) {
				sumRow[y] += otherSum[y];
				weightRow[y] += otherWeight[y];
			}
		}
		tileCount += other.tileCount;
	}

	/**
	 * Number of tiles added so far, including those from merged accumulators.
	 * @return
	 */
	public int getTileCount() {
		return tileCount;
	}

	/**
	 * Query whether all expected tiles have been added.
	 * Always true if no expected tile count was given.
	 * @return
	 */
	public boolean isComplete() {
		return expectedTiles < 0 || tileCount >= expectedTiles;
	}

	/**
	 * Get the total weight accumulated for a pixel.
	 * @param x row
	 * @param y column
	 * @return
	 */
	public float getWeightTotal(int x, int y) {
		return weightTotal[x][y];
	}

	/**
	 * Get the sum of weighted predictions accumulated for a pixel.
	 * @param x row
	 * @param y column
	 * @return
	 */
	public float getSum(int x, int y) {
		return sum[x][y];
	}

	/**
	 * Image height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Image width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Compute the normalized probability map.
	 * @return
	 * @throws IllegalStateException if fewer tiles than expected have been added
	 */
	public ProbabilityMap finalizeMap() throws IllegalStateException {
		if (!isComplete())
			throw new IllegalStateException("Cannot finalize reconstruction after " + tileCount + " of " + expectedTiles + " tiles");
		float[][] values = new float[height][width];
		for (int x = 0; x < height; x++) {
			float[] sumRow = sum[x];
			float[] weightRow = weightTotal[x];
			float[] row = values[x];
			for (int y = 0; y < width; y++)
				row[y] = sumRow[y] / Math.max(weightRow[y], EPSILON);
		}
		logger.debug("Finalized {} x {} map from {} tiles", height, width, tileCount);
		return new ProbabilityMap(values);
	}

}
