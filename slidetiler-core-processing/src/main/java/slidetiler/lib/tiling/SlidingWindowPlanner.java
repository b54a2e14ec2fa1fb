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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.regions.TileRect;

/**
 * Plans the overlapping grid of square tiles needed to cover a whole image.
 * <p>
 * Tiles start at {@code 0, step, 2*step, ...} along each axis while the start is inside the image, 
 * where {@code step = floor(tileSize / overlapFactor)}.
 * A tile that would extend beyond the image is shifted back so that its far edge touches the image boundary; 
 * tiles are never padded or dropped, which can result in duplicate rectangles near the edges.
 * <p>
 * Rectangles are returned in row-major order (x outer, y inner) and are identical for identical inputs.
 *
 * @author SlideTiler developers
 */
public final class SlidingWindowPlanner {

	private static final Logger logger = LoggerFactory.getLogger(SlidingWindowPlanner.class);

	// Suppress default constructor for non-instantiability
	private SlidingWindowPlanner() {
		throw new AssertionError();
	}

	/**
	 * Compute the step between tile starts.
	 * @param tileSize
	 * @param overlapFactor
	 * @return
	 * @throws IllegalArgumentException if the tile size is not positive or the overlap factor is less than 1
	 */
	public static int getStep(int tileSize, double overlapFactor) throws IllegalArgumentException {
		if (tileSize <= 0)
			throw new IllegalArgumentException("Tile size must be positive, but was " + tileSize);
		if (!(overlapFactor >= 1))
			throw new IllegalArgumentException("Overlap factor must be >= 1, but was " + overlapFactor);
		return Math.max(1, (int)Math.floor(tileSize / overlapFactor));
	}

	/**
	 * Compute the start coordinates of tiles along a single axis, after shifting tiles back inside the image.
	 * @param length axis length
	 * @param tileSize
	 * @param step
	 * @return
	 */
	static int[] getStarts(int length, int tileSize, int step) {
		int n = (length + step - 1) / step;
		int[] starts = new int[n];
		for (int i = 0; i < n; i++) {
			int c = i * step;
			int space = length - (c + tileSize);
			starts[i] = space >= 0 ? c : c + space;
		}
		return starts;
	}

	/**
	 * Plan the tiles for an image.
	 * @param height image height
	 * @param width image width
	 * @param tileSize side length of each square tile
	 * @param overlapFactor overlap factor, at least 1 (1 means no overlap, 2 means tiles start every half tile)
	 * @return an unmodifiable list of rectangles covering every pixel of the image
	 * @throws IllegalArgumentException if the tile is larger than the image or the parameters are invalid
	 */
	public static List<TileRect> plan(int height, int width, int tileSize, double overlapFactor) throws IllegalArgumentException {
		int step = getStep(tileSize, overlapFactor);
		if (tileSize > height || tileSize > width)
			throw new IllegalArgumentException(String.format("Tile size %d exceeds image size %d x %d", tileSize, height, width));

		int[] xStarts = getStarts(height, tileSize, step);
		int[] yStarts = getStarts(width, tileSize, step);
		List<TileRect> rects = new ArrayList<>(xStarts.length * yStarts.length);
		for (int x : xStarts) {
			for (int y : yStarts)
				rects.add(TileRect.square(x, y, tileSize).checkWithin(height, width));
		}
		logger.debug("Planned {} tiles ({} x {}) of size {} with step {} for image {} x {}",
				rects.size(), xStarts.length, yStarts.length, tileSize, step, height, width);
		return Collections.unmodifiableList(rects);
	}

}
