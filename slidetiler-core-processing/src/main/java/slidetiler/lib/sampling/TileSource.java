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
 * Where a sampled tile came from.
 * 
 * @author SlideTiler developers
 */
public enum TileSource {

	/**
	 * A labelled image from the training subset of the active fold.
	 */
	TRAINING,

	/**
	 * A labelled image from the validation subset of the active fold.
	 */
	VALIDATION,

	/**
	 * An unlabelled image with labels predicted by a model trained on the active fold.
	 */
	PSEUDO_LABEL,

	/**
	 * An image from an external dataset.
	 */
	EXTERNAL;

	/**
	 * Query whether the labels of the tile were not manually annotated for the images in the store.
	 * @return
	 */
	public boolean isSynthetic() {
		return this == PSEUDO_LABEL || this == EXTERNAL;
	}

}
