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

package slidetiler.lib.folds;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import slidetiler.lib.images.ImageNotFoundException;

@SuppressWarnings("javadoc")
public class TestPseudoLabelFiles {

	private static void writeProbabilities(Path path, int... values) throws IOException {
		var img = new BufferedImage(values.length, 1, BufferedImage.TYPE_BYTE_GRAY);
		for (int y = 0; y < values.length; y++)
			img.getRaster().setSample(y, 0, 0, values[y]);
		ImageIO.write(img, "png", path.toFile());
	}

	@Test
	public void testDeriveMasks(@TempDir Path dir) throws IOException {
		// 0.4 * 255 = 102
		writeProbabilities(dir.resolve("a_0.png"), 0, 102, 103, 255);
		writeProbabilities(dir.resolve("a_1.png"), 255, 255, 0, 0);

		var files = new PseudoLabelFiles(dir, List.of("a"));
		assertEquals(dir.resolve("a_1.png"), files.getPath("a", 1));

		var fold0 = files.deriveMasks(0);
		var mask0 = fold0.get("a");
		assertFalse(mask0.isPositive(0, 0));
		assertFalse(mask0.isPositive(0, 1));
		assertTrue(mask0.isPositive(0, 2));
		assertTrue(mask0.isPositive(0, 3));

		var fold1 = files.deriveMasks(1);
		assertTrue(fold1.get("a").isPositive(0, 0));
		assertFalse(fold1.get("a").isPositive(0, 3));

		// Deriving masks for another fold never changes an earlier collection
		assertTrue(mask0.isPositive(0, 3));
		assertNotEquals(fold0.getName(), fold1.getName());
		assertThrows(ImageNotFoundException.class, () -> fold0.get("b"));
	}

	@Test
	public void testThreshold(@TempDir Path dir) throws IOException {
		writeProbabilities(dir.resolve("a_0.png"), 100, 200);
		var mask = new PseudoLabelFiles(dir, List.of("a"), 0.5).deriveMasks(0).get("a");
		assertFalse(mask.isPositive(0, 0));
		assertTrue(mask.isPositive(0, 1));
		assertThrows(IllegalArgumentException.class, () -> new PseudoLabelFiles(dir, List.of("a"), 1.5));
	}

	@Test
	public void testMissingFile(@TempDir Path dir) {
		var files = new PseudoLabelFiles(dir, List.of("a"));
		assertThrows(IOException.class, () -> files.deriveMasks(0));
	}

}
