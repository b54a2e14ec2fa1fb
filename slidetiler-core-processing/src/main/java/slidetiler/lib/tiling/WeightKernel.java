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

import java.util.Arrays;

/**
 * A square array of weights used to blend overlapping tile predictions.
 * <p>
 * Weights are highest in the tile interior and decrease towards the borders, so that pixels predicted 
 * with little surrounding context contribute less to the final map.
 * Instances are immutable.
 *
 * @author SlideTiler developers
 * @see TileWeightKernel
 */
public final class WeightKernel {

	private final float[][] weights;

	WeightKernel(float[][] weights) {
		this.weights = weights;
	}

	/**
	 * Create a kernel with all weights equal to 1.
	 * @param size
	 * @return
	 */
	public static WeightKernel uniform(int size) {
		float[][] weights = new float[size][size];
		for (float[] row : weights)
			Arrays.fill(row, 1f);
		return new WeightKernel(weights);
	}

	/**
	 * Side length of the kernel.
	 * @return
	 */
	public int getSize() {
		return weights.length;
	}

	/**
	 * Get a single weight.
	 * @param x row
	 * @param y column
	 * @return
	 */
	public float getWeight(int x, int y) {
		return weights[x][y];
	}

	/**
	 * Get a copy of the weights, indexed {@code [row][column]}.
	 * @return
	 */
	public float[][] toArray() {
		float[][] copy = new float[weights.length][];
		for (int i = 0; i < weights.length; i++)
			copy[i] = weights[i].clone();
		return copy;
	}

}
