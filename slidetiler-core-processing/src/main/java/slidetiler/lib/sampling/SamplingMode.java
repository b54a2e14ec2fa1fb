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

/**
 * Policies for accepting a proposed training tile.
 * 
 * @author SlideTiler developers
 * @see TileSampler#acceptTilePolicy(String, slidetiler.lib.regions.TileRect, boolean)
 */
public enum SamplingMode {

	/**
	 * Accept every proposal.
	 */
	RANDOM,

	/**
	 * Accept if the label mask is positive at the center of the proposal.
	 */
	CENTERED,

	/**
	 * Accept if the convex hull of the label mask contains the center of the proposal.
	 * Tiles from pseudo-labelled or external images have no hull, and are always accepted.
	 */
	CONVEX_HULL,

	/**
	 * Accept if the proposal contains more than a minimum number of positive label pixels.
	 */
	VISIBLE;

	/**
	 * Query whether the mode needs convex hull masks for every training image.
	 * @return
	 */
	public boolean requiresConvexHulls() {
		return this == CONVEX_HULL;
	}

}
