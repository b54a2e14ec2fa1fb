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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import slidetiler.lib.regions.InvalidRegionException;
import slidetiler.lib.regions.TileRect;

@SuppressWarnings("javadoc")
public class TestImageTile {

	private static WholeImage createGradient(String id, int height, int width) {
		byte[][] rows = new byte[height][width * 2];
		for (int x = 0; x < height; x++) {
			for (int y = 0; y < width; y++) {
				rows[x][y * 2] = (byte)x;
				rows[x][y * 2 + 1] = (byte)y;
			}
		}
		return WholeImage.create(id, width, 2, rows);
	}

	@Test
	public void testWholeImage() {
		var image = createGradient("gradient", 30, 40);
		assertEquals("gradient", image.getId());
		assertEquals(30, image.getHeight());
		assertEquals(40, image.getWidth());
		assertEquals(2, image.nChannels());
		assertEquals(1200L, image.getArea());
		assertEquals(12, image.getValue(12, 20, 0));
		assertEquals(20, image.getValue(12, 20, 1));
		assertThrows(IndexOutOfBoundsException.class, () -> image.getValue(0, 40, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> image.getValue(0, 0, 2));

		assertThrows(IllegalArgumentException.class, () -> WholeImage.create("bad", 10, 3, new byte[][] {new byte[29]}));
		assertEquals(200, WholeImage.constant("c", 3, 4, 3, 200).getValue(2, 3, 2));
	}

	@Test
	public void testCrop() {
		var image = createGradient("gradient", 30, 40);
		var tile = image.crop(TileRect.create(10, 14, 20, 26));
		assertEquals(4, tile.getHeight());
		assertEquals(6, tile.getWidth());
		assertEquals(2, tile.nChannels());
		assertEquals(10, tile.getValue(0, 0, 0));
		assertEquals(20, tile.getValue(0, 0, 1));
		assertEquals(13, tile.getValue(3, 5, 0));
		assertEquals(25, tile.getValue(3, 5, 1));
		assertThrows(InvalidRegionException.class, () -> image.crop(TileRect.create(20, 31, 0, 10)));
	}

	@Test
	public void testFlips() {
		var tile = createGradient("gradient", 5, 7).crop(TileRect.fullImage(5, 7));
		var horizontal = tile.flipHorizontal();
		assertEquals(1, horizontal.getValue(1, 0, 0));
		assertEquals(6, horizontal.getValue(1, 0, 1));
		assertEquals(0, horizontal.getValue(1, 6, 1));

		var vertical = tile.flipVertical();
		assertEquals(4, vertical.getValue(0, 2, 0));
		assertEquals(2, vertical.getValue(0, 2, 1));

		assertEquals(tile, horizontal.flipHorizontal());
		assertEquals(tile, vertical.flipVertical());
		assertEquals(tile.flipHorizontal().flipVertical(), tile.flipVertical().flipHorizontal());
	}

	@Test
	public void testDownsample() {
		byte[] data = {
				0, 2, 10, 10,
				4, 6, 20, 30,
				1, 1, (byte)255, (byte)255,
				1, 2, (byte)255, (byte)255
		};
		var tile = ImageTile.create(4, 4, 1, data);
		var down = tile.downsample(2);
		assertEquals(2, down.getHeight());
		assertEquals(2, down.getWidth());
		assertEquals(3, down.getValue(0, 0, 0));
		assertEquals(18, down.getValue(0, 1, 0));
		assertEquals(1, down.getValue(1, 0, 0));
		assertEquals(255, down.getValue(1, 1, 0));
		assertSame(tile, tile.downsample(1));
		assertThrows(IllegalArgumentException.class, () -> tile.downsample(3));
	}

	@Test
	public void testChannel() {
		var tile = ImageTile.constant(3, 3, 3, 51);
		float[][] channel = tile.getChannel(1);
		assertEquals(3, channel.length);
		assertEquals(0.2f, channel[2][2], 1e-6);
	}

	@Test
	public void testCreateCopies() {
		byte[] data = new byte[4];
		var tile = ImageTile.create(2, 2, 1, data);
		data[0] = 100;
		assertEquals(0, tile.getValue(0, 0, 0));
		assertThrows(IllegalArgumentException.class, () -> ImageTile.create(2, 2, 2, data));
	}

	@Test
	public void testTilePair() {
		var image = createGradient("gradient", 30, 30);
		var rect = TileRect.square(3, 3, 15);
		var label = BinaryMask.builder(15, 15).set(7, 7).set(0, 0).build();
		var pair = TilePair.of(image.crop(rect), label);
		var cropped = pair.centerCrop(5);
		assertEquals(5, cropped.getImage().getHeight());
		assertEquals(5, cropped.getLabel().getWidth());
		// Center crop starts at offset 5 within the tile
		assertEquals(8, cropped.getImage().getValue(0, 0, 0));
		assertTrue(cropped.getLabel().isPositive(2, 2));
		assertEquals(1, cropped.getLabel().countPositive());
		assertSame(pair, pair.centerCrop(15));
		assertThrows(IllegalArgumentException.class, () -> TilePair.of(image.crop(rect), BinaryMask.empty(14, 15)));
	}

}
