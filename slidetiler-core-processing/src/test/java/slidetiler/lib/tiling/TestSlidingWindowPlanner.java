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

package slidetiler.lib.tiling;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import slidetiler.lib.regions.TileRect;

@SuppressWarnings("javadoc")
public class TestSlidingWindowPlanner {

	@Test
	public void testStep() {
		assertEquals(128, SlidingWindowPlanner.getStep(256, 2));
		assertEquals(256, SlidingWindowPlanner.getStep(256, 1));
		assertEquals(85, SlidingWindowPlanner.getStep(256, 3));
		assertEquals(170, SlidingWindowPlanner.getStep(256, 1.5));
		assertEquals(1, SlidingWindowPlanner.getStep(4, 100));
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.getStep(256, 0.5));
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.getStep(0, 2));
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.getStep(256, Double.NaN));
	}

	@Test
	public void testStarts() {
		assertArrayEquals(new int[] {0, 128, 256, 384, 512, 640, 744, 744}, SlidingWindowPlanner.getStarts(1000, 256, 128));
		assertArrayEquals(new int[] {0, 256, 512, 744}, SlidingWindowPlanner.getStarts(1000, 256, 256));
		assertArrayEquals(new int[] {0, 256}, SlidingWindowPlanner.getStarts(512, 256, 256));
		assertArrayEquals(new int[] {0}, SlidingWindowPlanner.getStarts(256, 256, 256));
	}

	@Test
	public void testPlan1000() {
		var rects = SlidingWindowPlanner.plan(1000, 1000, 256, 2);
		assertEquals(64, rects.size());
		assertEquals(TileRect.square(0, 0, 256), rects.get(0));
		// x-major order, so the second rectangle moves along y
		assertEquals(TileRect.square(0, 128, 256), rects.get(1));
		assertEquals(TileRect.square(128, 0, 256), rects.get(8));
		var last = rects.get(rects.size() - 1);
		assertEquals(744, last.getX0());
		assertEquals(1000, last.getX1());
		assertEquals(1000, last.getY1());

		var xStarts = rects.stream().map(TileRect::getX0).distinct().collect(Collectors.toList());
		assertEquals(List.of(0, 128, 256, 384, 512, 640, 744), xStarts);
	}

	@Test
	public void testDeterministic() {
		var first = SlidingWindowPlanner.plan(1234, 987, 200, 2.5);
		var second = SlidingWindowPlanner.plan(1234, 987, 200, 2.5);
		assertEquals(first, second);
		assertThrows(UnsupportedOperationException.class, () -> first.add(TileRect.square(0, 0, 1)));
	}

	@ParameterizedTest
	@CsvSource({
		"1000, 1000, 256, 2",
		"256, 256, 256, 1",
		"300, 257, 256, 1",
		"517, 1031, 64, 1",
		"517, 1031, 64, 3",
		"100, 90, 7, 1.7",
		"50, 50, 10, 20"
	})
	public void testCoverage(int height, int width, int tileSize, double overlap) {
		var rects = SlidingWindowPlanner.plan(height, width, tileSize, overlap);
		int[][] counts = new int[height][width];
		for (var rect : rects) {
			assertTrue(rect.isWithin(height, width));
			assertEquals(tileSize, rect.getHeight());
			assertEquals(tileSize, rect.getWidth());
			for (int x = rect.getX0(); x < rect.getX1(); x++) {
				for (int y = rect.getY0(); y < rect.getY1(); y++)
					counts[x][y]++;
			}
		}
		for (int x = 0; x < height; x++) {
			for (int y = 0; y < width; y++)
				assertTrue(counts[x][y] > 0, "Pixel " + x + ", " + y + " is not covered");
		}
	}

	@Test
	public void testInvalid() {
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.plan(100, 300, 256, 2));
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.plan(300, 100, 256, 2));
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.plan(300, 300, 256, 0.9));
		assertThrows(IllegalArgumentException.class, () -> SlidingWindowPlanner.plan(300, 300, -1, 1));
	}

}
