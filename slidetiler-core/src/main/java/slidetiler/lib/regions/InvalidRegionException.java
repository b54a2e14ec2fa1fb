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

package slidetiler.lib.regions;

/**
 * Exception thrown when a tile rectangle falls (even partially) outside the image it refers to.
 * <p>
 * This indicates a broken invariant in the code that produced the rectangle,
 * and so the rectangle is never clamped silently.
 *
 * @author SlideTiler developers
 */
public class InvalidRegionException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final TileRect rect;
	private final int imageHeight;
	private final int imageWidth;

	/**
	 * Constructor.
	 * @param rect the invalid rectangle
	 * @param imageHeight height of the image the rectangle should be inside
	 * @param imageWidth width of the image the rectangle should be inside
	 */
	public InvalidRegionException(TileRect rect, int imageHeight, int imageWidth) {
		super(String.format("%s is outside image bounds (height=%d, width=%d)", rect, imageHeight, imageWidth));
		this.rect = rect;
		this.imageHeight = imageHeight;
		this.imageWidth = imageWidth;
	}

	/**
	 * Get the rectangle that caused the exception.
	 * @return
	 */
	public TileRect getRect() {
		return rect;
	}

	/**
	 * Height of the image the rectangle was checked against.
	 * @return
	 */
	public int getImageHeight() {
		return imageHeight;
	}

	/**
	 * Width of the image the rectangle was checked against.
	 * @return
	 */
	public int getImageWidth() {
		return imageWidth;
	}

}
