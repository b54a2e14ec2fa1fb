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

/**
 * One epoch of training or validation tiles, each of the final tile size.
 * <p>
 * Each call to {@link #get(int)} samples a new oversized crop, applies the optional transform and 
 * then crops the center to {@link SamplingConfig#getTileSize()}.
 * 
 * @author SlideTiler developers
 */
public class TrainingTileDataset {

	private final TileSampler sampler;
	private final TileTransform transform;

	/**
	 * Create a dataset without augmentation.
	 * @param sampler
	 */
	public TrainingTileDataset(TileSampler sampler) {
		this(sampler, null);
	}

	/**
	 * Create a dataset with augmentation.
	 * @param sampler
	 * @param transform transform applied before the center crop, or null
	 */
	public TrainingTileDataset(TileSampler sampler, TileTransform transform) {
		this.sampler = Objects.requireNonNull(sampler);
		this.transform = transform;
	}

	/**
	 * Number of tiles in an epoch.
	 * @return
	 */
	public int size() {
		return sampler.getConfig().getIterationsPerEpoch();
	}

	/**
	 * Get a tile.
	 * @param index index within the epoch
	 * @return a pair of the final tile size
	 * @throws IndexOutOfBoundsException if the index is outside the epoch
	 */
	public TilePair get(int index) {
		if (index < 0 || index >= size())
			throw new IndexOutOfBoundsException("Index " + index + " out of range for " + size() + " tiles");
		var pair = sampler.sample(index).getTilePair();
		if (transform != null)
			pair = transform.apply(pair);
		return pair.centerCrop(sampler.getConfig().getTileSize());
	}

	/**
	 * The sampler providing the tiles.
	 * @return
	 */
	public TileSampler getSampler() {
		return sampler;
	}

}
