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
public class TestBinaryMask {

	@Test
	public void testBuilder() {
		var mask = BinaryMask.builder(10, 20)
				.set(0, 0)
				.setRange(2, 5, 10)
				.setRect(TileRect.create(6, 8, 18, 20))
				.build();
		assertEquals(10, mask.getHeight());
		assertEquals(20, mask.getWidth());
		assertTrue(mask.isPositive(0, 0));
		assertFalse(mask.isPositive(0, 1));
		assertTrue(mask.isPositive(2, 5));
		assertTrue(mask.isPositive(2, 9));
		assertFalse(mask.isPositive(2, 10));
		assertTrue(mask.isPositive(7, 19));
		assertEquals(1 + 5 + 4, mask.countPositive());
		assertFalse(mask.isEmpty());

		assertThrows(IndexOutOfBoundsException.class, () -> mask.isPositive(10, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> mask.isPositive(0, 20));
		assertThrows(IllegalArgumentException.class, () -> BinaryMask.builder(0, 10));
	}

	@Test
	public void testBuilderSingleUse() {
		var builder = BinaryMask.builder(2, 2);
		builder.build();
		assertThrows(IllegalStateException.class, () -> builder.build());
	}

	@Test
	public void testCountInRect() {
		var mask = BinaryMask.builder(100, 100)
				.setRect(TileRect.create(10, 60, 10, 60))
				.build();
		assertEquals(2500, mask.countPositive());
		assertEquals(2500, mask.countPositive(TileRect.fullImage(100, 100)));
		assertEquals(100, mask.countPositive(TileRect.create(0, 20, 0, 20)));
		assertEquals(0, mask.countPositive(TileRect.create(60, 100, 0, 100)));
		assertThrows(InvalidRegionException.class, () -> mask.countPositive(TileRect.create(90, 110, 0, 10)));
	}

	@Test
	public void testCrop() {
		var mask = BinaryMask.builder(8, 8)
				.set(3, 3)
				.set(4, 5)
				.build();
		var cropped = mask.crop(TileRect.create(2, 6, 3, 7));
		assertEquals(4, cropped.getHeight());
		assertEquals(4, cropped.getWidth());
		assertTrue(cropped.isPositive(1, 0));
		assertTrue(cropped.isPositive(2, 2));
		assertEquals(2, cropped.countPositive());
		assertThrows(InvalidRegionException.class, () -> mask.crop(TileRect.create(0, 9, 0, 8)));
	}

	@Test
	public void testSearchRows() {
		var mask = BinaryMask.builder(3, 10)
				.setRange(1, 2, 4)
				.set(1, 8)
				.build();
		assertEquals(-1, mask.nextPositive(0, 0));
		assertEquals(2, mask.nextPositive(1, 0));
		assertEquals(3, mask.nextPositive(1, 3));
		assertEquals(8, mask.nextPositive(1, 4));
		assertEquals(-1, mask.nextPositive(1, 9));
		assertEquals(8, mask.previousPositive(1, 9));
		assertEquals(3, mask.previousPositive(1, 7));
		assertEquals(-1, mask.previousPositive(1, 1));
	}

	@Test
	public void testEmpty() {
		var mask = BinaryMask.empty(5, 6);
		assertTrue(mask.isEmpty());
		assertEquals(0, mask.countPositive());
		assertEquals(mask, BinaryMask.empty(5, 6));
		assertNotEquals(mask, BinaryMask.empty(6, 5));
	}

}
