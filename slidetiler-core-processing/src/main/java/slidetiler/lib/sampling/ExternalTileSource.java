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

import org.apache.commons.math3.random.RandomGenerator;

/**
 * A source of labelled tiles from outside the whole image store.
 * <p>
 * When a {@link TileSampler} draws from an external source the tile is returned directly, 
 * without applying any acceptance policy.
 * 
 * @author SlideTiler developers
 */
@FunctionalInterface
public interface ExternalTileSource {

	/**
	 * Draw a tile.
	 * @param random the random generator of the calling sampler; implementations should use this for 
	 *               all random choices, so that sampling is reproducible
	 * @return
	 */
	SampledTile sample(RandomGenerator random);

	/**
	 * Smallest height or width of any tile this source can return.
	 * @return the size, or -1 if it is not known in advance
	 */
	default int getMinimumSize() {
		return -1;
	}

}
