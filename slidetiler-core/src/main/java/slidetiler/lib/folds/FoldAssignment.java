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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable assignment of images to cross-validation folds.
 * <p>
 * Image {@code i} (in the original image order) is assigned to fold {@code i mod numFolds}, 
 * so the assignment can always be recreated from the image order alone.
 *
 * @author SlideTiler developers
 * @see FoldSplitter
 */
public final class FoldAssignment {

	private final List<String> ids;
	private final int numFolds;

	FoldAssignment(List<String> ids, int numFolds) {
		this.ids = Collections.unmodifiableList(new ArrayList<>(ids));
		this.numFolds = numFolds;
	}

	/**
	 * Number of folds.
	 * @return
	 */
	public int getNumFolds() {
		return numFolds;
	}

	/**
	 * All image identifiers, in their original order.
	 * @return
	 */
	public List<String> getIds() {
		return ids;
	}

	/**
	 * Get the fold of the image at a specified index.
	 * @param index
	 * @return
	 */
	public int getFold(int index) {
		if (index < 0 || index >= ids.size())
			throw new IndexOutOfBoundsException("Index " + index + " out of range for " + ids.size() + " images");
		return index % numFolds;
	}

	/**
	 * Get the fold of an image.
	 * @param id
	 * @return
	 * @throws IllegalArgumentException if the image is not part of the assignment
	 */
	public int getFold(String id) throws IllegalArgumentException {
		int index = ids.indexOf(id);
		if (index < 0)
			throw new IllegalArgumentException("Image " + id + " is not part of the fold assignment");
		return getFold(index);
	}

	/**
	 * Split the images into training and validation subsets for one fold.
	 * Images in fold {@code k} are used for validation, all others for training.
	 * @param k the validation fold
	 * @return
	 * @throws IllegalArgumentException if {@code k} is not in {@code [0, numFolds)}
	 */
	public FoldSelection selectFold(int k) throws IllegalArgumentException {
		if (k < 0 || k >= numFolds)
			throw new IllegalArgumentException("Fold must be between 0 and " + (numFolds - 1) + ", but was " + k);
		List<String> train = new ArrayList<>();
		List<String> valid = new ArrayList<>();
		for (int i = 0; i < ids.size(); i++) {
			if (getFold(i) == k)
				valid.add(ids.get(i));
			else
				train.add(ids.get(i));
		}
		return new FoldSelection(k, train, valid);
	}

	@Override
	public String toString() {
		return "FoldAssignment (" + ids.size() + " images, " + numFolds + " folds)";
	}

}
