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

import java.util.HashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods to partition images into cross-validation folds.
 *
 * @author SlideTiler developers
 */
public final class FoldSplitter {

	private static final Logger logger = LoggerFactory.getLogger(FoldSplitter.class);

	/**
	 * Default number of folds.
	 */
	public static final int DEFAULT_NUM_FOLDS = 5;

	// Suppress default constructor for non-instantiability
	private FoldSplitter() {
		throw new AssertionError();
	}

	/**
	 * Assign images to folds using {@code index mod numFolds}.
	 * @param ids image identifiers, in a fixed order; must be unique
	 * @param numFolds number of folds, at least 2
	 * @return
	 * @throws IllegalArgumentException if there are fewer than 2 folds or ids are duplicated
	 */
	public static FoldAssignment assignFolds(List<String> ids, int numFolds) throws IllegalArgumentException {
		if (numFolds < 2)
			throw new IllegalArgumentException("At least 2 folds are required, but requested " + numFolds);
		if (new HashSet<>(ids).size() != ids.size())
			throw new IllegalArgumentException("Image ids must be unique!");
		if (ids.size() < numFolds)
			logger.warn("Only {} images for {} folds - some folds will have no validation images", ids.size(), numFolds);
		return new FoldAssignment(ids, numFolds);
	}

	/**
	 * Assign images to {@link #DEFAULT_NUM_FOLDS} folds.
	 * @param ids
	 * @return
	 */
	public static FoldAssignment assignFolds(List<String> ids) {
		return assignFolds(ids, DEFAULT_NUM_FOLDS);
	}

}
