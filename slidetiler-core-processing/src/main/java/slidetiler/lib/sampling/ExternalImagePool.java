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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.random.RandomGenerator;

import slidetiler.lib.images.TilePair;
import slidetiler.lib.regions.TileRect;

/**
 * An {@link ExternalTileSource} holding a fixed collection of image and label pairs in memory.
 * Each draw returns a whole pair, chosen uniformly.
 * 
 * @author SlideTiler developers
 */
public class ExternalImagePool implements ExternalTileSource {

	private final List<String> ids;
	private final Map<String, TilePair> pairs;
	private final int minimumSize;

	private ExternalImagePool(Map<String, TilePair> pairs) {
		this.pairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
		this.ids = Collections.unmodifiableList(new ArrayList<>(pairs.keySet()));
		int min = Integer.MAX_VALUE;
		for (var pair : pairs.values())
			min = Math.min(min, Math.min(pair.getImage().getHeight(), pair.getImage().getWidth()));
		this.minimumSize = min;
	}

	/**
	 * Create a pool from image and label pairs.
	 * @param pairs map of image ids to pairs; must not be empty
	 * @return
	 */
	public static ExternalImagePool create(Map<String, TilePair> pairs) {
		if (pairs.isEmpty())
			throw new IllegalArgumentException("External image pool must contain at least one image");
		return new ExternalImagePool(pairs);
	}

	/**
	 * Ids of the images in the pool.
	 * @return
	 */
	public List<String> getIds() {
		return ids;
	}

	/**
	 * Smallest height or width of any pair in the pool.
	 * A sampler rejects the pool if this is less than its tile size.
	 * @return
	 */
	@Override
	public int getMinimumSize() {
		return minimumSize;
	}

	@Override
	public SampledTile sample(RandomGenerator random) {
		var id = ids.get(random.nextInt(ids.size()));
		var pair = pairs.get(id);
		var rect = TileRect.fullImage(pair.getImage().getHeight(), pair.getImage().getWidth());
		return SampledTile.create(id, rect, TileSource.EXTERNAL, pair);
	}

	@Override
	public String toString() {
		return "ExternalImagePool (" + ids.size() + " images)";
	}

}
