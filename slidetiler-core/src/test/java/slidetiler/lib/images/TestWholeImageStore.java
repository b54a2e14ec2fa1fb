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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import slidetiler.lib.regions.TileRect;

@SuppressWarnings("javadoc")
public class TestWholeImageStore {

	private static WholeImageStore createStore(boolean computeHulls) {
		var maskA = BinaryMask.builder(100, 80)
				.setRect(TileRect.create(10, 20, 10, 20))
				.set(50, 70)
				.build();
		return new WholeImageStore.Builder("test")
				.computeConvexHulls(computeHulls)
				.addImage(WholeImage.constant("a", 100, 80, 3, 10), maskA)
				.addImage(WholeImage.constant("b", 40, 50, 3, 20), BinaryMask.empty(40, 50))
				.build();
	}

	@Test
	public void testLookup() {
		var store = createStore(false);
		assertEquals("test", store.getName());
		assertEquals(List.of("a", "b"), store.getIds());
		assertEquals(2, store.size());
		assertTrue(store.contains("a"));
		assertFalse(store.contains("c"));
		assertEquals(8000L, store.getArea("a"));
		assertEquals(2000L, store.getArea("b"));
		assertEquals(101, store.getMask("a").countPositive());
		assertEquals(20, store.getImage("b").getValue(0, 0, 0));
		assertTrue(store.getHull("a").isEmpty());

		var e = assertThrows(ImageNotFoundException.class, () -> store.getImage("c"));
		assertEquals("c", e.getId());
		assertThrows(ImageNotFoundException.class, () -> store.getMask("c"));
		assertThrows(ImageNotFoundException.class, () -> store.getHull("c"));
		assertThrows(ImageNotFoundException.class, () -> store.getArea("c"));
	}

	@Test
	public void testHulls() {
		var store = createStore(true);
		var hull = store.getHull("a").orElseThrow();
		assertTrue(hull.isPositive(15, 15));
		assertTrue(hull.isPositive(35, 45));
		assertFalse(hull.isPositive(90, 5));
		assertTrue(store.getHull("b").orElseThrow().isEmpty());
	}

	@Test
	public void testTilePair() {
		var store = createStore(false);
		var pair = store.getTilePair("a", TileRect.create(5, 25, 5, 25));
		assertEquals(20, pair.getImage().getHeight());
		assertEquals(10, pair.getImage().getValue(0, 0, 2));
		assertEquals(100, pair.getLabel().countPositive());
	}

	@Test
	public void testBuilderChecks() {
		var builder = new WholeImageStore.Builder("test")
				.addImage(WholeImage.constant("a", 10, 10, 1, 0), BinaryMask.empty(10, 10));
		assertThrows(IllegalArgumentException.class, () -> builder.addImage(WholeImage.constant("a", 10, 10, 1, 0), BinaryMask.empty(10, 10)));
		assertThrows(IllegalArgumentException.class, () -> builder.addImage(WholeImage.constant("b", 10, 10, 1, 0), BinaryMask.empty(10, 11)));
		assertThrows(IllegalArgumentException.class, () -> builder.addImage(WholeImage.constant("b", 10, 10, 1, 0), BinaryMask.empty(10, 10), BinaryMask.empty(9, 10)));
	}

	@Test
	public void testMasks() {
		var store = createStore(false);
		var masks = store.getMasks();
		assertEquals("test", masks.getName());
		assertEquals(2, masks.size());
		assertSame(store.getMask("a"), masks.get("a"));
		assertThrows(ImageNotFoundException.class, () -> masks.get("c"));

		var labels = LabelCollection.create("other", Map.of("x", BinaryMask.empty(2, 2)));
		assertTrue(labels.contains("x"));
		assertFalse(labels.contains("a"));
	}

	@Test
	public void testLoad(@TempDir Path dir) throws IOException {
		var img = new BufferedImage(30, 20, BufferedImage.TYPE_3BYTE_BGR);
		img.getRaster().setSample(4, 2, 0, 200);
		ImageIO.write(img, "png", dir.resolve("first.png").toFile());

		var config = new ImageStoreConfig.Builder(dir)
				.imageExtension(".png")
				.computeConvexHulls(true)
				// Rows 0-3 of column 0, then rows 0-1 of column 1
				.addImage("first", "1 4 21 2")
				.build();
		var store = WholeImageStore.load(config, new ImageIoWholeImageReader());
		var image = store.getImage("first");
		assertEquals(20, image.getHeight());
		assertEquals(30, image.getWidth());
		assertEquals(3, image.nChannels());
		assertEquals(200, image.getValue(2, 4, 0));
		assertEquals(0, image.getValue(2, 4, 1));
		assertEquals(6, store.getMask("first").countPositive());
		assertTrue(store.getMask("first").isPositive(3, 0));
		assertTrue(store.getMask("first").isPositive(1, 1));
		assertTrue(store.getHull("first").isPresent());
	}

	@Test
	public void testLoadMissingFile(@TempDir Path dir) {
		var config = new ImageStoreConfig.Builder(dir)
				.addImage("missing", "")
				.build();
		assertThrows(IOException.class, () -> WholeImageStore.load(config, new ImageIoWholeImageReader()));
	}

}
