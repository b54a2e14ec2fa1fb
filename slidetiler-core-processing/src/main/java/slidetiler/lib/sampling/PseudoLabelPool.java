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

import java.io.IOException;
import java.util.Objects;

import slidetiler.lib.folds.FoldMaskDeriver;
import slidetiler.lib.images.ImageNotFoundException;
import slidetiler.lib.images.LabelCollection;
import slidetiler.lib.images.WholeImageStore;

/**
 * Unlabelled whole images together with a way to derive their pseudo-labels for a fold.
 * <p>
 * The pseudo-labels depend on the fold because they must come from a model that did not see 
 * the validation images of that fold. They are therefore recomputed whenever the fold changes, 
 * and the masks held by the image store are never used.
 * 
 * @author SlideTiler developers
 */
public class PseudoLabelPool {

	private final WholeImageStore images;
	private final FoldMaskDeriver deriver;

	/**
	 * Constructor.
	 * @param images the unlabelled images
	 * @param deriver function providing masks for every image in the store, for a given fold
	 */
	public PseudoLabelPool(WholeImageStore images, FoldMaskDeriver deriver) {
		this.images = Objects.requireNonNull(images);
		this.deriver = Objects.requireNonNull(deriver);
	}

	/**
	 * The unlabelled images.
	 * @return
	 */
	public WholeImageStore getImages() {
		return images;
	}

	/**
	 * Derive the pseudo-labels for a fold, checking that there is a mask of the right size for every image.
	 * @param fold
	 * @return
	 * @throws IOException if the masks cannot be read
	 * @throws ImageNotFoundException if there is no mask for one of the images
	 */
	public LabelCollection deriveLabels(int fold) throws IOException, ImageNotFoundException {
		var labels = deriver.deriveMasks(fold);
		for (var id : images.getIds()) {
			var mask = labels.get(id);
			var image = images.getImage(id);
			if (mask.getHeight() != image.getHeight() || mask.getWidth() != image.getWidth())
				throw new IllegalArgumentException("Pseudo-label " + mask + " does not match " + image);
		}
		return labels;
	}

	@Override
	public String toString() {
		return "PseudoLabelPool (" + images.size() + " images)";
	}

}
