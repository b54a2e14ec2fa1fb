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

/**
 * A small 8-bit pixel buffer cut from a {@link WholeImage}, used as the unit of model input.
 * <p>
 * Pixels are stored row-major with channels interleaved (channels last).
 * Instances are immutable; all transforms return a new tile.
 *
 * @author SlideTiler developers
 */
public final class ImageTile {

	private final int height;
	private final int width;
	private final int nChannels;
	private final byte[] data;

	ImageTile(int height, int width, int nChannels, byte[] data) {
		this.height = height;
		this.width = width;
		this.nChannels = nChannels;
		this.data = data;
	}

	/**
	 * Create a tile backed by a copy of the provided row-major, channels-last bytes.
	 * @param height
	 * @param width
	 * @param nChannels
	 * @param data
	 * @return
	 */
	public static ImageTile create(int height, int width, int nChannels, byte[] data) {
		if (height <= 0 || width <= 0 || nChannels <= 0)
			throw new IllegalArgumentException(String.format("Invalid tile shape %d x %d x %d", height, width, nChannels));
		if (data.length != height * width * nChannels)
			throw new IllegalArgumentException("Expected " + (height * width * nChannels) + " values, but array length is " + data.length);
		return new ImageTile(height, width, nChannels, data.clone());
	}

	/**
	 * Create a tile where every pixel of every channel has the same value.
	 * @param height
	 * @param width
	 * @param nChannels
	 * @param value unsigned value in the range 0-255
	 * @return
	 */
	public static ImageTile constant(int height, int width, int nChannels, int value) {
		byte[] data = new byte[height * width * nChannels];
		Arrays.fill(data, (byte)value);
		return new ImageTile(height, width, nChannels, data);
	}

	/**
	 * Tile height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Tile width.
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
	 * Get an unsigned pixel value.
	 * @param x row
	 * @param y column
	 * @param c channel
	 * @return value in the range 0-255
	 */
	public int getValue(int x, int y, int c) {
		if (x < 0 || x >= height || y < 0 || y >= width || c < 0 || c >= nChannels)
			throw new IndexOutOfBoundsException(String.format("Pixel (%d, %d, %d) is outside tile of shape %d x %d x %d", x, y, c, height, width, nChannels));
		return data[(x * width + y) * nChannels + c] & 0xFF;
	}

	/**
	 * Get the values of a single channel as floats, in the range 0-1, indexed {@code [row][column]}.
	 * @param c channel
	 * @return
	 */
	public float[][] getChannel(int c) {
		float[][] values = new float[height][width];
		for (int x = 0; x < height; x++) {
			for (int y = 0; y < width; y++)
				values[x][y] = (data[(x * width + y) * nChannels + c] & 0xFF) / 255f;
		}
		return values;
	}

	/**
	 * Get a copy of the row-major, channels-last pixel bytes.
	 * @return
	 */
	public byte[] getBytes() {
		return data.clone();
	}

	/**
	 * Mirror the tile left-to-right (reverse the column order).
	 * @return
	 */
	public ImageTile flipHorizontal() {
		byte[] flipped = new byte[data.length];
		for (int x = 0; x < height; x++) {
			for (int y = 0; y < width; y++) {
				System.arraycopy(data, (x * width + y) * nChannels,
						flipped, (x * width + width - 1 - y) * nChannels, nChannels);
			}
		}
		return new ImageTile(height, width, nChannels, flipped);
	}

	/**
	 * Mirror the tile top-to-bottom (reverse the row order).
	 * @return
	 */
	public ImageTile flipVertical() {
		byte[] flipped = new byte[data.length];
		int rowLength = width * nChannels;
		for (int x = 0; x < height; x++)
			System.arraycopy(data, x * rowLength, flipped, (height - 1 - x) * rowLength, rowLength);
		return new ImageTile(height, width, nChannels, flipped);
	}

	/**
	 * Downsample by averaging non-overlapping blocks of pixels (area interpolation).
	 * @param factor integer downsample factor; the tile height and width must both be divisible by this
	 * @return the downsampled tile, or this tile if the factor is 1
	 */
	public ImageTile downsample(int factor) {
		if (factor == 1)
			return this;
		if (factor < 1 || height % factor != 0 || width % factor != 0)
			throw new IllegalArgumentException(String.format("Cannot downsample %d x %d tile by %d", height, width, factor));
		int h = height / factor;
		int w = width / factor;
		int n = factor * factor;
		byte[] output = new byte[h * w * nChannels];
		for (int x = 0; x < h; x++) {
			for (int y = 0; y < w; y++) {
				for (int c = 0; c < nChannels; c++) {
					int sum = 0;
					for (int dx = 0; dx < factor; dx++) {
						int row = x * factor + dx;
						for (int dy = 0; dy < factor; dy++)
							sum += data[(row * width + y * factor + dy) * nChannels + c] & 0xFF;
					}
					output[(x * w + y) * nChannels + c] = (byte)Math.round(sum / (double)n);
				}
			}
		}
		return new ImageTile(h, w, nChannels, output);
	}

	@Override
	public String toString() {
		return String.format("ImageTile (%d x %d x %d)", height, width, nChannels);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * (31 * height + width) + nChannels) + Arrays.hashCode(data);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageTile))
			return false;
		ImageTile other = (ImageTile) obj;
		return height == other.height && width == other.width && nChannels == other.nChannels && Arrays.equals(data, other.data);
	}

}
