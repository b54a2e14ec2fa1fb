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

package slidetiler.lib.images;

import java.util.Objects;

import slidetiler.lib.regions.TileRect;

/**
 * An image tile together with the matching crop of its label mask.
 *
 * @author SlideTiler developers
 */
public final class TilePair {

	private final ImageTile image;
	private final BinaryMask label;

	private TilePair(ImageTile image, BinaryMask label) {
		this.image = Objects.requireNonNull(image);
		this.label = Objects.requireNonNull(label);
		if (image.getHeight() != label.getHeight() || image.getWidth() != label.getWidth())
			throw new IllegalArgumentException("Image " + image + " and label " + label + " sizes differ");
	}

	/**
	 * Create a pair from an image tile and label of the same size.
	 * @param image
	 * @param label
	 * @return
	 */
	public static TilePair of(ImageTile image, BinaryMask label) {
		return new TilePair(image, label);
	}

	/**
	 * The pixel tile.
	 * @return
	 */
	public ImageTile getImage() {
		return image;
	}

	/**
	 * The label tile.
	 * @return
	 */
	public BinaryMask getLabel() {
		return label;
	}

	/**
	 * Crop the pair to the square of the specified size at its center.
	 * @param size
	 * @return
	 */
	public TilePair centerCrop(int size) {
		if (size == image.getHeight() && size == image.getWidth())
			return this;
		var rect = TileRect.fullImage(image.getHeight(), image.getWidth()).centerCrop(size);
		byte[] bytes = image.getBytes();
		int n = image.nChannels();
		int rowLength = size * n;
		byte[] cropped = new byte[size * rowLength];
		for (int i = 0; i < size; i++)
			System.arraycopy(bytes, ((rect.getX0() + i) * image.getWidth() + rect.getY0()) * n, cropped, i * rowLength, rowLength);
		return new TilePair(new ImageTile(size, size, n, cropped), label.crop(rect));
	}

	@Override
	public String toString() {
		return "TilePair [" + image + ", " + label + "]";
	}

}
