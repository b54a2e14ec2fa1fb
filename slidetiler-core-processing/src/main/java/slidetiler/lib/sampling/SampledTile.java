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

package slidetiler.lib.sampling;

import java.util.Objects;

import slidetiler.lib.images.TilePair;
import slidetiler.lib.regions.TileRect;

/**
 * A tile returned by a {@link TileSampler}, with the region it was cropped from.
 * 
 * @author SlideTiler developers
 */
public final class SampledTile {

	private final String imageId;
	private final TileRect rect;
	private final TileSource source;
	private final TilePair tilePair;

	private SampledTile(String imageId, TileRect rect, TileSource source, TilePair tilePair) {
		this.imageId = Objects.requireNonNull(imageId);
		this.rect = Objects.requireNonNull(rect);
		this.source = Objects.requireNonNull(source);
		this.tilePair = Objects.requireNonNull(tilePair);
	}

	/**
	 * Create a sampled tile.
	 * @param imageId id of the image the tile was cropped from
	 * @param rect region of the tile within the image
	 * @param source
	 * @param tilePair the pixels and labels inside the region
	 * @return
	 */
	public static SampledTile create(String imageId, TileRect rect, TileSource source, TilePair tilePair) {
		if (tilePair.getImage().getHeight() != rect.getHeight() || tilePair.getImage().getWidth() != rect.getWidth())
			throw new IllegalArgumentException("Tile " + tilePair + " does not match region " + rect);
		return new SampledTile(imageId, rect, source, tilePair);
	}

	/**
	 * Id of the image the tile was cropped from.
	 * @return
	 */
	public String getImageId() {
		return imageId;
	}

	/**
	 * Region of the tile within the image.
	 * @return
	 */
	public TileRect getRect() {
		return rect;
	}

	/**
	 * @return
	 */
	public TileSource getSource() {
		return source;
	}

	/**
	 * Query whether the labels are pseudo-labels or external labels.
	 * @return
	 * @see TileSource#isSynthetic()
	 */
	public boolean isSynthetic() {
		return source.isSynthetic();
	}

	/**
	 * @return
	 */
	public TilePair getTilePair() {
		return tilePair;
	}

	@Override
	public String toString() {
		return "SampledTile [" + imageId + ", " + rect + ", " + source + "]";
	}

}
