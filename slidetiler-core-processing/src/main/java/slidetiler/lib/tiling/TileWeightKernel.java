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

package slidetiler.lib.tiling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.common.GeneralTools;

/**
 * Static methods to build {@link WeightKernel} instances for blending tile predictions.
 * <p>
 * The kernel is derived from a pyramidal distance-to-border field: for a pixel in row {@code i} and column {@code j}
 * of a tile of size {@code n}, the distance along each axis is {@code min(i+1, n-i)} and the field value is the
 * minimum of both distances.
 * The field is then
 * <ol>
 *   <li>normalized so that its maximum is 1, and raised to the power {@code sigma}</li>
 *   <li>rescaled into {@code [eps, 1]} with {@code (w - min + eps) / (max - min + eps)}</li>
 *   <li>saturated to 1 wherever it exceeds {@code alpha}, then divided by {@code alpha}</li>
 *   <li>clipped to {@code [1e-3, 1]} and rounded to 3 decimal places</li>
 * </ol>
 * Lower values of {@code alpha} create a larger flat plateau in the tile interior.
 *
 * @author SlideTiler developers
 */
public final class TileWeightKernel {

	private static final Logger logger = LoggerFactory.getLogger(TileWeightKernel.class);

	/**
	 * Default exponent applied to the normalized distance field.
	 */
	public static final double DEFAULT_SIGMA = 1.0;

	/**
	 * Default plateau threshold (1 means no plateau beyond the center).
	 */
	public static final double DEFAULT_ALPHA = 1.0;

	/**
	 * Default offset used when rescaling, to avoid zero weights.
	 */
	public static final double DEFAULT_EPS = 1e-6;

	/**
	 * Minimum weight in any kernel.
	 */
	public static final double MIN_WEIGHT = 1e-3;

	private static final int DECIMAL_PLACES = 3;

	// Suppress default constructor for non-instantiability
	private TileWeightKernel() {
		throw new AssertionError();
	}

	/**
	 * Build a kernel using the default parameters.
	 * @param size
	 * @return
	 */
	public static WeightKernel build(int size) {
		return build(size, DEFAULT_SIGMA, DEFAULT_ALPHA, DEFAULT_EPS);
	}

	/**
	 * Build a kernel.
	 * @param size side length of the kernel (the tile size)
	 * @param sigma exponent controlling how sharply the weights fall off towards the border
	 * @param alpha values above this are saturated to form a plateau; must be in {@code (0, 1]}
	 * @param eps small positive offset used when rescaling
	 * @return
	 * @throws IllegalArgumentException if any parameter is out of range
	 */
	public static WeightKernel build(int size, double sigma, double alpha, double eps) throws IllegalArgumentException {
		if (size <= 0)
			throw new IllegalArgumentException("Kernel size must be positive, but was " + size);
		if (!(sigma > 0))
			throw new IllegalArgumentException("Sigma must be > 0, but was " + sigma);
		if (!(alpha > 0 && alpha <= 1))
			throw new IllegalArgumentException("Alpha must be in (0, 1], but was " + alpha);
		if (!(eps > 0))
			throw new IllegalArgumentException("Eps must be > 0, but was " + eps);

		int[] distance = new int[size];
		int maxDistance = 0;
		for (int i = 0; i < size; i++) {
			distance[i] = Math.min(i + 1, size - i);
			maxDistance = Math.max(maxDistance, distance[i]);
		}

		double[][] w = new double[size][size];
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int x = 0; x < size; x++) {
			for (int y = 0; y < size; y++) {
				double value = Math.pow(Math.min(distance[x], distance[y]) / (double)maxDistance, sigma);
				value = Math.min(value, 1.0);
				w[x][y] = value;
				min = Math.min(min, value);
				max = Math.max(max, value);
			}
		}

		float[][] weights = new float[size][size];
		for (int x = 0; x < size; x++) {
			for (int y = 0; y < size; y++) {
				double value = (w[x][y] - min + eps) / (max - min + eps);
				if (value > alpha)
					value = 1.0;
				value /= alpha;
				value = GeneralTools.clipValue(value, MIN_WEIGHT, 1.0);
				weights[x][y] = (float)GeneralTools.round(value, DECIMAL_PLACES);
			}
		}
		logger.debug("Built weight kernel of size {} (sigma={}, alpha={}, eps={})", size, sigma, alpha, eps);
		return new WeightKernel(weights);
	}

}
