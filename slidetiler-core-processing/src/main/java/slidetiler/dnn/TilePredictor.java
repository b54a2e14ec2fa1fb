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

package slidetiler.dnn;

import java.util.List;

import slidetiler.lib.images.ImageTile;

/**
 * A segmentation model that predicts per-pixel class scores for batches of tiles.
 * <p>
 * This is the point where a deep learning framework is integrated. 
 * Implementations used with more than one inference thread must be thread-safe.
 * 
 * @author SlideTiler developers
 * @see slidetiler.lib.inference.WholeImagePredictor
 */
public interface TilePredictor {

	/**
	 * Number of output classes declared by the model.
	 * The foreground is read from the first output channel, which requires this to be 1 or 2.
	 * @return
	 */
	int getNumClasses();

	/**
	 * Predict a batch of tiles.
	 * @param tiles tiles of identical size
	 * @return one output per tile, in the same order, indexed {@code [class][row][column]} 
	 *         with the same height and width as the tile
	 */
	List<float[][][]> predict(List<ImageTile> tiles);

}
