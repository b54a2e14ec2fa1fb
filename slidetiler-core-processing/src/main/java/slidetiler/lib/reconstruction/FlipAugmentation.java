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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import slidetiler.lib.images.ImageTile;

/**
 * Test-time augmentation using flips.
 * <p>
 * A prediction is averaged with the predictions of flipped copies of the same tiles, 
 * after each of these has been flipped back to the original orientation.
 *
 * @author SlideTiler developers
 */
public final class FlipAugmentation {

	/**
	 * Axes along which a tile can be flipped.
	 */
	public enum FlipAxis {
		/**
		 * Reverse the column order.
		 */
		HORIZONTAL,
		/**
		 * Reverse the row order.
		 */
		VERTICAL,
		/**
		 * Reverse both the row and column order.
		 */
		BOTH
	}

	/**
	 * The flips used by default: horizontal, vertical and both.
	 */
	public static final Set<FlipAxis> DEFAULT_FLIPS = EnumSet.allOf(FlipAxis.class);

	// Suppress default constructor for non-instantiability
	private FlipAugmentation() {
		throw new AssertionError();
	}

	/**
	 * Flip an image tile.
	 * @param tile
	 * @param axis
	 * @return
	 */
	public static ImageTile flip(ImageTile tile, FlipAxis axis) {
		switch (axis) {
		case HORIZONTAL:
			return tile.flipHorizontal();
		case VERTICAL:
			return tile.flipVertical();
		case BOTH:
			return tile.flipHorizontal().flipVertical();
		default:
			throw new IllegalArgumentException("Unknown flip axis " + axis);
		}
	}

	/**
	 * Flip a prediction. All flips are their own inverse, so this is also used to undo a flip.
	 * @param values values indexed {@code [row][column]}
	 * @param axis
	 * @return a new array
	 */
	public static float[][] flip(float[][] values, FlipAxis axis) {
		int h = values.length;
		int w = values[0].length;
		boolean flipRows = axis == FlipAxis.VERTICAL || axis == FlipAxis.BOTH;
		boolean flipCols = axis == FlipAxis.HORIZONTAL || axis == FlipAxis.BOTH;
		float[][] output = new float[h][w];
		for (int x = 0; x < h; x++) {
			float[] source = values[flipRows ? h - 1 - x : x];
			float[] target = output[x];
			for (int y = 0; y < w; y++)
				target[y] = source[flipCols ? w - 1 - y : y];
		}
		return output;
	}

	/**
	 * Predict a batch of tiles, averaging with the predictions of flipped tiles.
	 * @param tiles the tiles to predict
	 * @param predictFunction function returning one prediction per tile, in the same order
	 * @param flips the flips to apply; if empty, the prediction is returned unchanged
	 * @return the mean of {@code 1 + flips.size()} predictions for each tile
	 */
	public static List<float[][]> predictWithFlips(List<ImageTile> tiles, Function<List<ImageTile>, List<float[][]>> predictFunction, Collection<FlipAxis> flips) {
		List<float[][]> predictions = copyAll(predictFunction.apply(tiles));
		if (flips.isEmpty())
			return predictions;
		for (var axis : flips) {
			var flippedTiles = tiles.stream().map(t -> flip(t, axis)).collect(Collectors.toList());
			var flippedPredictions = predictFunction.apply(flippedTiles);
			for (int i = 0; i < predictions.size(); i++)
				add(predictions.get(i), flip(flippedPredictions.get(i), axis));
		}
		float n = flips.size() + 1;
		for (var prediction : predictions) {
			for (float[] row : prediction) {
				for (int y = 0; y < row.length; y++)
					row[y] /= n;
			}
		}
		return predictions;
	}

	private static List<float[][]> copyAll(List<float[][]> predictions) {
		List<float[][]> copies = new ArrayList<>(predictions.size());
		for (var prediction : predictions) {
			float[][] copy = new float[prediction.length][];
			for (int i = 0; i < prediction.length; i++)
				copy[i] = prediction[i].clone();
			copies.add(copy);
		}
		return copies;
	}

	private static void add(float[][] target, float[][] values) {
		for (int x = 0; x < target.length; x++) {
			for (int y = 0; y < target[x].length; y++)
				target[x][y] += values[x][y];
		}
	}

}
