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
import java.util.Objects;

import slidetiler.lib.regions.TileRect;

/**
 * A decoded whole image, held in memory for the lifetime of a {@link WholeImageStore}.
 * <p>
 * Pixels are 8-bit, stored one array per row with channels interleaved, so that images are not
 * limited by the maximum length of a single Java array.
 * Instances are immutable.
 *
 * @author SlideTiler developers
 */
public final class WholeImage {

	private final String id;
	private final int height;
	private final int width;
	private final int nChannels;
	private final byte[][] rows;

	private WholeImage(String id, int height, int width, int nChannels, byte[][] rows) {
		this.id = id;
		this.height = height;
		this.width = width;
		this.nChannels = nChannels;
		this.rows = rows;
	}

	/**
	 * Create a whole image from its rows.
	 * <p>
	 * The row arrays are used directly, and must not be modified by the caller afterwards.
	 *
	 * @param id unique image identifier
	 * @param width image width
	 * @param nChannels number of interleaved channels
	 * @param rows one array per row, each of length {@code width * nChannels}
	 * @return
	 */
	public static WholeImage create(String id, int width, int nChannels, byte[][] rows) {
		Objects.requireNonNull(id, "Image id must not be null!");
		if (rows.length == 0 || width <= 0 || nChannels <= 0)
			throw new IllegalArgumentException(String.format("Invalid image shape %d x %d x %d for %s", rows.length, width, nChannels, id));
		for (byte[] row : rows) {
			if (row.length != width * nChannels)
				throw new IllegalArgumentException("Row length " + row.length + " does not match width " + width + " and " + nChannels + " channel(s)");
		}
		return new WholeImage(id, rows.length, width, nChannels, rows);
	}

	/**
	 * Create an image where every pixel of every channel has the same value.
	 * @param id
	 * @param height
	 * @param width
	 * @param nChannels
	 * @param value unsigned value in the range 0-255
	 * @return
	 */
	public static WholeImage constant(String id, int height, int width, int nChannels, int value) {
		byte[][] rows = new byte[height][width * nChannels];
		for (byte[] row : rows)
			Arrays.fill(row, (byte)value);
		return create(id, width, nChannels, rows);
	}

	/**
	 * Unique identifier of the image.
	 * @return
	 */
	public String getId() {
		return id;
	}

	/**
	 * Image height (number of rows).
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Image width (number of columns).
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Number of channels.
	 * @return
	 */
	public int nChannels() {
		return nChannels;
	}

	/**
	 * Total number of pixels ({@code height * width}).
	 * @return
	 */
	public long getArea() {
		return (long)height * width;
	}

	/**
	 * Get an unsigned pixel value.
	 * @param x row
	 * @param y column
	 * @param c channel
	 * @return value in the range 0-255
	 */
	public int getValue(int x, int y, int c) {
		if (y < 0 || y >= width || c < 0 || c >= nChannels)
			throw new IndexOutOfBoundsException(String.format("Pixel (%d, %d, %d) is outside image %s", x, y, c, this));
		return rows[x][y * nChannels + c] & 0xFF;
	}

	/**
	 * Copy the pixels inside a rectangle to a new tile.
	 * @param rect rectangle that must lie inside the image
	 * @return
	 * @throws slidetiler.lib.regions.InvalidRegionException if the rectangle is outside the image
	 */
	public ImageTile crop(TileRect rect) {
		rect.checkWithin(height, width);
		int h = rect.getHeight();
		int rowLength = rect.getWidth() * nChannels;
		byte[] data = new byte[h * rowLength];
		for (int i = 0; i < h; i++)
			System.arraycopy(rows[rect.getX0() + i], rect.getY0() * nChannels, data, i * rowLength, rowLength);
		return new ImageTile(h, rect.getWidth(), nChannels, data);
	}

	@Override
	public String toString() {
		return String.format("WholeImage (%s, height=%d, width=%d, channels=%d)", id, height, width, nChannels);
	}

}
