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
 * A half-open rectangle in image pixel coordinates, used to describe tiles cut from a whole image.
 * <p>
 * Coordinates follow the array-indexing convention of the masks: <b>x indexes rows</b>
 * (the image height) and <b>y indexes columns</b> (the image width).
 * The rectangle covers rows {@code [x0, x1)} and columns {@code [y0, y1)}.
 * <p>
 * Instances are immutable.
 *
 * @author SlideTiler developers
 */
public final class TileRect {

	private final int x0, x1, y0, y1;

	private TileRect(int x0, int x1, int y0, int y1) {
		if (x1 <= x0 || y1 <= y0)
			throw new IllegalArgumentException("Tile rectangle must have a positive size! Requested " + toString(x0, x1, y0, y1));
		this.x0 = x0;
		this.x1 = x1;
		this.y0 = y0;
		this.y1 = y1;
	}

	/**
	 * Create a rectangle from its row and column bounds.
	 * @param x0 first row (inclusive)
	 * @param x1 last row (exclusive)
	 * @param y0 first column (inclusive)
	 * @param y1 last column (exclusive)
	 * @return
	 */
	public static TileRect create(int x0, int x1, int y0, int y1) {
		return new TileRect(x0, x1, y0, y1);
	}

	/**
	 * Create a square rectangle with the specified top-left corner.
	 * @param x0 first row
	 * @param y0 first column
	 * @param size side length in pixels
	 * @return
	 */
	public static TileRect square(int x0, int y0, int size) {
		return new TileRect(x0, x0 + size, y0, y0 + size);
	}

	/**
	 * Create a rectangle covering an entire image.
	 * @param height
	 * @param width
	 * @return
	 */
	public static TileRect fullImage(int height, int width) {
		return new TileRect(0, height, 0, width);
	}

	/**
	 * First row (inclusive).
	 * @return
	 */
	public int getX0() {
		return x0;
	}

	/**
	 * Last row (exclusive).
	 * @return
	 */
	public int getX1() {
		return x1;
	}

	/**
	 * First column (inclusive).
	 * @return
	 */
	public int getY0() {
		return y0;
	}

	/**
	 * Last column (exclusive).
	 * @return
	 */
	public int getY1() {
		return y1;
	}

	/**
	 * Number of rows covered by the rectangle.
	 * @return
	 */
	public int getHeight() {
		return x1 - x0;
	}

	/**
	 * Number of columns covered by the rectangle.
	 * @return
	 */
	public int getWidth() {
		return y1 - y0;
	}

	/**
	 * Row of the center pixel, {@code (x0 + x1) / 2} rounded down.
	 * @return
	 */
	public int getCenterX() {
		return (x0 + x1) / 2;
	}

	/**
	 * Column of the center pixel, {@code (y0 + y1) / 2} rounded down.
	 * @return
	 */
	public int getCenterY() {
		return (y0 + y1) / 2;
	}

	/**
	 * Total number of pixels covered by the rectangle.
	 * @return
	 */
	public long getArea() {
		return (long)getHeight() * getWidth();
	}

	/**
	 * Query whether the rectangle lies entirely inside an image of the specified size.
	 * @param height image height
	 * @param width image width
	 * @return
	 */
	public boolean isWithin(int height, int width) {
		return x0 >= 0 && y0 >= 0 && x1 <= height && y1 <= width;
	}

	/**
	 * Check that the rectangle lies entirely inside an image of the specified size.
	 * @param height image height
	 * @param width image width
	 * @return this rectangle, to support chaining
	 * @throws InvalidRegionException if any part of the rectangle is outside the image
	 */
	public TileRect checkWithin(int height, int width) throws InvalidRegionException {
		if (!isWithin(height, width))
			throw new InvalidRegionException(this, height, width);
		return this;
	}

	/**
	 * Query whether the rectangle contains a pixel.
	 * @param x row
	 * @param y column
	 * @return
	 */
	public boolean contains(int x, int y) {
		return x >= x0 && x < x1 && y >= y0 && y < y1;
	}

	/**
	 * Get the square rectangle of the specified size centered within this one.
	 * @param size side length of the centered square; must not exceed the height or width
	 * @return
	 */
	public TileRect centerCrop(int size) {
		if (size > getHeight() || size > getWidth())
			throw new IllegalArgumentException("Cannot center crop " + size + " pixels from " + this);
		int dx = (getHeight() - size) / 2;
		int dy = (getWidth() - size) / 2;
		return square(x0 + dx, y0 + dy, size);
	}

	@Override
	public String toString() {
		return toString(x0, x1, y0, y1);
	}

	private static String toString(int x0, int x1, int y0, int y1) {
		return String.format("TileRect (x=[%d, %d), y=[%d, %d))", x0, x1, y0, y1);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + x0;
		result = prime * result + x1;
		result = prime * result + y0;
		result = prime * result + y1;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof TileRect))
			return false;
		TileRect other = (TileRect) obj;
		return x0 == other.x0 && x1 == other.x1 && y0 == other.y0 && y1 == other.y1;
	}

}
