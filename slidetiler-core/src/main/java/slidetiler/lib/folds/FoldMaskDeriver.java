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

package slidetiler.lib.folds;

import java.io.IOException;

import slidetiler.lib.images.LabelCollection;

/**
 * Function that derives label masks that depend upon the current fold.
 * <p>
 * This is used for pseudo-labels, which are predicted by a model trained without the validation images 
 * of the fold and so must be recomputed whenever the fold changes to avoid leakage.
 * Implementations must return a new collection for each call, and never modify a previous one.
 *
 * @author SlideTiler developers
 */
@FunctionalInterface
public interface FoldMaskDeriver {

	/**
	 * Derive the masks to use for a fold.
	 * @param fold the validation fold
	 * @return
	 * @throws IOException if the masks need to be read, and reading fails
	 */
	LabelCollection deriveMasks(int fold) throws IOException;

}
