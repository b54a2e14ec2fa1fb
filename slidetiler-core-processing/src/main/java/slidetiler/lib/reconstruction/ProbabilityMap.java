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

import slidetiler.lib.images.BinaryMask;

/**
 * A full-resolution map of foreground probabilities for a whole image.
 * Instances are immutable.
 *
 * @author SlideTiler developers
 */
public final class ProbabilityMap {

	private final float[][] values;

	ProbabilityMap(float[][] values) {
		this.values = values;
	}

	/**
	 * Create a map from a copy of the provided values.
	 * @param values probabilities indexed {@code [row][column]}; all rows must have the same length
	 * @return
	 */
	public static ProbabilityMap create(float[][] values) {
		float[][] copy = new float[values.length][];
		for (int i = 0; i < values.length; i++) {
			if (values[i].length != values[0].length)
				throw new IllegalArgumentException("All rows must have the same length!");
			copy[i] = values[i].clone();
		}
		return new ProbabilityMap(copy);
	}

	/**
	 * Map height.
	 * @return
	 */
	public int getHeight() {
		return values.length;
	}

	/**
	 * Map width.
	 * @return
	 */
	public int getWidth() {
		return values[0].length;
	}

	/**
	 * Get the probability for a pixel.
	 * @param x row
	 * @param y column
	 * @return
	 */
	public float getValue(int x, int y) {
		return values[x][y];
	}

	/**
	 * Get a copy of the values, indexed {@code [row][column]}.
	 * @return
	 */
	public float[][] toArray() {
		float[][] copy = new float[values.length][];
		for (int i = 0; i < values.length; i++)
			copy[i] = values[i].clone();
		return copy;
	}

	/**
	 * Create a mask containing all pixels with a probability strictly greater than a threshold.
	 * @param threshold
	 * @return
	 */
	public BinaryMask threshold(double threshold) {
		var builder = BinaryMask.builder(getHeight(), getWidth());
		for (int x = 0; x < values.length; x++) {
			float[] row = values[x];
			for (int y = 0; y < row.length; y++) {
				if (row[y] > threshold)
					builder.set(x, y);
			}
		}
		return builder.build();
	}

	@Override
	public String toString() {
		return String.format("ProbabilityMap (height=%d, width=%d)", getHeight(), getWidth());
	}

}
