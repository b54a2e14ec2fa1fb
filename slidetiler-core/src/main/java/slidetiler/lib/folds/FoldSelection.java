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
 * Disjoint training and validation image subsets for a single fold.
 *
 * @author SlideTiler developers
 */
public final class FoldSelection {

	private final int fold;
	private final List<String> trainIds;
	private final List<String> validIds;

	FoldSelection(int fold, List<String> trainIds, List<String> validIds) {
		this.fold = fold;
		this.trainIds = Collections.unmodifiableList(new ArrayList<>(trainIds));
		this.validIds = Collections.unmodifiableList(new ArrayList<>(validIds));
	}

	/**
	 * The validation fold.
	 * @return
	 */
	public int getFold() {
		return fold;
	}

	/**
	 * Images used for training, in their original order.
	 * @return
	 */
	public List<String> getTrainIds() {
		return trainIds;
	}

	/**
	 * Images used for validation, in their original order.
	 * @return
	 */
	public List<String> getValidIds() {
		return validIds;
	}

	@Override
	public String toString() {
		return "FoldSelection [fold=" + fold + ", train=" + trainIds + ", valid=" + validIds + "]";
	}

	@Override
	public int hashCode() {
		return 31 * (31 * fold + trainIds.hashCode()) + validIds.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FoldSelection))
			return false;
		FoldSelection other = (FoldSelection) obj;
		return fold == other.fold && trainIds.equals(other.trainIds) && validIds.equals(other.validIds);
	}

}
