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

import slidetiler.lib.images.TilePair;

/**
 * Augmentation applied to a sampled tile and its labels, before the center crop to the final tile size.
 * 
 * @author SlideTiler developers
 */
@FunctionalInterface
public interface TileTransform {

	/**
	 * Transform a tile pair. The same spatial transform must be applied to the image and labels.
	 * @param pair
	 * @return
	 */
	TilePair apply(TilePair pair);

}
