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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestTileRect {

	@Test
	public void testCreate() {
		var rect = TileRect.create(10, 30, 5, 45);
		assertEquals(10, rect.getX0());
		assertEquals(30, rect.getX1());
		assertEquals(5, rect.getY0());
		assertEquals(45, rect.getY1());
		assertEquals(20, rect.getHeight());
		assertEquals(40, rect.getWidth());
		assertEquals(800L, rect.getArea());
		assertEquals(20, rect.getCenterX());
		assertEquals(25, rect.getCenterY());

		assertEquals(TileRect.create(3, 13, 4, 14), TileRect.square(3, 4, 10));
		assertEquals(TileRect.create(0, 100, 0, 200), TileRect.fullImage(100, 200));

		assertThrows(IllegalArgumentException.class, () -> TileRect.create(10, 10, 0, 5));
		assertThrows(IllegalArgumentException.class, () -> TileRect.create(0, 5, 8, 2));
		assertThrows(IllegalArgumentException.class, () -> TileRect.square(0, 0, 0));
	}

	@Test
	public void testCenterPixelRoundsDown() {
		var rect = TileRect.create(0, 5, 2, 9);
		assertEquals(2, rect.getCenterX());
		assertEquals(5, rect.getCenterY());
	}

	@Test
	public void testWithin() {
		var rect = TileRect.square(744, 744, 256);
		assertTrue(rect.isWithin(1000, 1000));
		assertFalse(rect.isWithin(999, 1000));
		assertFalse(rect.isWithin(1000, 999));
		assertSame(rect, rect.checkWithin(1000, 1000));

		var e = assertThrows(InvalidRegionException.class, () -> rect.checkWithin(1000, 900));
		assertEquals(rect, e.getRect());
		assertEquals(1000, e.getImageHeight());
		assertEquals(900, e.getImageWidth());

		// Invalid regions are programming errors, not bad arguments
		assertTrue(e instanceof IllegalStateException);
		assertFalse(TileRect.square(-1, 0, 10).isWithin(100, 100));
	}

	@Test
	public void testContains() {
		var rect = TileRect.create(10, 20, 30, 40);
		assertTrue(rect.contains(10, 30));
		assertTrue(rect.contains(19, 39));
		assertFalse(rect.contains(20, 30));
		assertFalse(rect.contains(10, 40));
		assertFalse(rect.contains(9, 35));
	}

	@Test
	public void testCenterCrop() {
		var rect = TileRect.square(100, 200, 384);
		var cropped = rect.centerCrop(256);
		assertEquals(TileRect.square(164, 264, 256), cropped);
		assertEquals(rect, rect.centerCrop(384));
		assertThrows(IllegalArgumentException.class, () -> rect.centerCrop(385));

		var odd = TileRect.create(0, 5, 0, 7).centerCrop(2);
		assertEquals(TileRect.create(1, 3, 2, 4), odd);
	}

	@Test
	public void testEquality() {
		assertEquals(TileRect.create(1, 2, 3, 4), TileRect.create(1, 2, 3, 4));
		assertEquals(TileRect.create(1, 2, 3, 4).hashCode(), TileRect.create(1, 2, 3, 4).hashCode());
		assertNotEquals(TileRect.create(1, 2, 3, 4), TileRect.create(3, 4, 1, 2));
	}

}
