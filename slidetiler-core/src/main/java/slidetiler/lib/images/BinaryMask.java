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

import java.util.Arrays;
import java.util.BitSet;

import slidetiler.lib.regions.TileRect;

/**
 * An immutable binary raster, storing one bit of 'positive' per pixel.
 * <p>
 * Pixels are addressed by row ({@code x}) and column ({@code y}), consistent with {@link TileRect}.
 * Each row is stored as a separate {@link BitSet}, so masks can exceed the size limits of a single array.
 *
 * @author SlideTiler developers
 */
public final class BinaryMask {

	private final int height;
	private final int width;
	private final BitSet[] rows;

	private BinaryMask(int height, int width, BitSet[] rows) {
		this.height = height;
		this.width = width;
		this.rows = rows;
	}

	/**
	 * Create an empty mask (no positive pixels).
	 * @param height
	 * @param width
	 * @return
	 */
	public static BinaryMask empty(int height, int width) {
		return builder(height, width).build();
	}

	/**
	 * Create a builder for a mask of the specified size.
	 * @param height
	 * @param width
	 * @return
	 */
	public static Builder builder(int height, int width) {
		return new Builder(height, width);
	}

	/**
	 * Mask height (number of rows).
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Mask width (number of columns).
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Query whether a pixel is positive.
	 * @param x row
	 * @param y column
	 * @return
	 * @throws IndexOutOfBoundsException if the pixel is outside the mask
	 */
	public boolean isPositive(int x, int y) throws IndexOutOfBoundsException {
		checkPixel(x, y);
		return rows[x].get(y);
	}

	/**
	 * Count the positive pixels inside a rectangle.
	 * @param rect the rectangle, which must lie inside the mask
	 * @return
	 * @throws slidetiler.lib.regions.InvalidRegionException if the rectangle is outside the mask
	 */
	public long countPositive(TileRect rect) {
		rect.checkWithin(height, width);
		long count = 0;
		int y0 = rect.getY0();
		int y1 = rect.getY1();
		for (int x = rect.getX0(); x < rect.getX1(); x++) {
			BitSet row = rows[x];
			for (int y = row.nextSetBit(y0); y >= 0 && y < y1; y = row.nextSetBit(y + 1))
				count++;
		}
		return count;
	}

	/**
	 * Count all positive pixels in the mask.
	 * @return
	 */
	public long countPositive() {
		long count = 0;
		for (BitSet row : rows)
			count += row.cardinality();
		return count;
	}

	/**
	 * Query whether the mask contains no positive pixels.
	 * @return
	 */
	public boolean isEmpty() {
		for (BitSet row : rows) {
			if (!row.isEmpty())
				return false;
		}
		return true;
	}

	/**
	 * Get a new mask containing only the pixels inside a rectangle.
	 * @param rect
	 * @return
	 */
	public BinaryMask crop(TileRect rect) {
		rect.checkWithin(height, width);
		BitSet[] cropped = new BitSet[rect.getHeight()];
		for (int i = 0; i < cropped.length; i++)
			cropped[i] = rows[rect.getX0() + i].get(rect.getY0(), rect.getY1());
		return new BinaryMask(rect.getHeight(), rect.getWidth(), cropped);
	}

	/**
	 * Get the index of the first positive pixel in a row at or after a column.
	 * @param x row
	 * @param fromY first column to check
	 * @return the column, or -1 if there are no further positive pixels in the row
	 */
	public int nextPositive(int x, int fromY) {
		int y = rows[x].nextSetBit(fromY);
		return y >= width ? -1 : y;
	}

	/**
	 * Get the index of the last positive pixel in a row at or before a column.
	 * @param x row
	 * @param fromY last column to check
	 * @return the column, or -1 if there are no positive pixels in the row up to this column
	 */
	public int previousPositive(int x, int fromY) {
		return rows[x].previousSetBit(fromY);
	}

	private void checkPixel(int x, int y) {
		if (x < 0 || x >= height || y < 0 || y >= width)
			throw new IndexOutOfBoundsException(String.format("Pixel (%d, %d) is outside mask of size %d x %d", x, y, height, width));
	}

	@Override
	public String toString() {
		return String.format("BinaryMask (height=%d, width=%d)", height, width);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * height + width) + Arrays.hashCode(rows);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof BinaryMask))
			return false;
		BinaryMask other = (BinaryMask) obj;
		return height == other.height && width == other.width && Arrays.equals(rows, other.rows);
	}


	/**
	 * Builder for {@link BinaryMask}. A builder should not be used after {@link #build()} has been called.
	 */
	public static class Builder {

		private final int height;
		private final int width;
		private BitSet[] rows;

		private Builder(int height, int width) {
			if (height <= 0 || width <= 0)
				throw new IllegalArgumentException(String.format("Mask size must be positive! Requested %d x %d", height, width));
			this.height = height;
			this.width = width;
			this.rows = new BitSet[height];
			for (int x = 0; x < height; x++)
				rows[x] = new BitSet(width);
		}

		/**
		 * Set a single pixel to be positive.
		 * @param x row
		 * @param y column
		 * @return this builder
		 */
		public Builder set(int x, int y) {
			if (x < 0 || x >= height || y < 0 || y >= width)
				throw new IndexOutOfBoundsException(String.format("Pixel (%d, %d) is outside mask of size %d x %d", x, y, height, width));
			rows[x].set(y);
			return this;
		}

		/**
		 * Set a range of pixels in a row to be positive.
		 * @param x row
		 * @param fromY first column (inclusive)
		 * @param toY last column (exclusive)
		 * @return this builder
		 */
		public Builder setRange(int x, int fromY, int toY) {
			if (x < 0 || x >= height || fromY < 0 || toY > width || fromY > toY)
				throw new IndexOutOfBoundsException(String.format("Range [%d, %d) in row %d is outside mask of size %d x %d", fromY, toY, x, height, width));
			rows[x].set(fromY, toY);
			return this;
		}

		/**
		 * Set all pixels inside a rectangle to be positive.
		 * @param rect
		 * @return this builder
		 */
		public Builder setRect(TileRect rect) {
			rect.checkWithin(height, width);
			for (int x = rect.getX0(); x < rect.getX1(); x++)
				rows[x].set(rect.getY0(), rect.getY1());
			return this;
		}

		/**
		 * Build the mask.
		 * @return
		 */
		public BinaryMask build() {
			if (rows == null)
				throw new IllegalStateException("Builder has already been used!");
			var mask = new BinaryMask(height, width, rows);
			rows = null;
			return mask;
		}

	}

}
