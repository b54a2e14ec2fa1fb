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

import slidetiler.lib.regions.TileRect;

@SuppressWarnings("javadoc")
public class TestConvexHulls {

	@Test
	public void testEmpty() {
		var hull = ConvexHulls.computeConvexHull(BinaryMask.empty(20, 30));
		assertEquals(20, hull.getHeight());
		assertEquals(30, hull.getWidth());
		assertTrue(hull.isEmpty());
	}

	@Test
	public void testSinglePixel() {
		var mask = BinaryMask.builder(10, 10).set(4, 7).build();
		assertEquals(mask, ConvexHulls.computeConvexHull(mask));
	}

	@Test
	public void testRectangle() {
		var mask = BinaryMask.builder(50, 40)
				.setRect(TileRect.create(5, 25, 10, 35))
				.build();
		assertEquals(mask, ConvexHulls.computeConvexHull(mask));
	}

	@Test
	public void testSingleRow() {
		var mask = BinaryMask.builder(5, 20)
				.set(2, 3)
				.set(2, 15)
				.build();
		var hull = ConvexHulls.computeConvexHull(mask);
		assertEquals(13, hull.countPositive());
		for (int y = 3; y <= 15; y++)
			assertTrue(hull.isPositive(2, y));
	}

	@Test
	public void testTriangle() {
		// An L-shape along the left and bottom borders has a triangular hull
		int n = 10;
		var builder = BinaryMask.builder(n, n);
		for (int x = 0; x < n; x++)
			builder.set(x, 0);
		builder.setRange(n - 1, 0, n);
		var mask = builder.build();
		var hull = ConvexHulls.computeConvexHull(mask);

		assertEquals(n * (n + 1) / 2, hull.countPositive());
		for (int x = 0; x < n; x++) {
			for (int y = 0; y < n; y++)
				assertEquals(y <= x, hull.isPositive(x, y), "Unexpected value at " + x + ", " + y);
		}
	}

	@Test
	public void testContainsMask() {
		var mask = BinaryMask.builder(60, 60)
				.set(5, 30)
				.set(30, 5)
				.set(55, 40)
				.set(20, 50)
				.setRect(TileRect.create(25, 35, 25, 35))
				.build();
		var hull = ConvexHulls.computeConvexHull(mask);
		assertTrue(hull.countPositive() > mask.countPositive());
		for (int x = 0; x < 60; x++) {
			for (int y = 0; y < 60; y++) {
				if (mask.isPositive(x, y))
					assertTrue(hull.isPositive(x, y));
			}
		}
		// Corners are well outside the hull
		assertFalse(hull.isPositive(0, 0));
		assertFalse(hull.isPositive(59, 0));
		assertFalse(hull.isPositive(0, 59));
		assertFalse(hull.isPositive(59, 59));
	}

}
