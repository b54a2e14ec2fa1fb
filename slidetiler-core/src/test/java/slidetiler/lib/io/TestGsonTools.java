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

package slidetiler.lib.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestGsonTools {

	@Test
	public void testPrettyPrinting() {
		var settings = new Settings();
		assertFalse(GsonTools.getInstance().toJson(settings).contains("\n"));
		assertTrue(GsonTools.getInstance(true).toJson(settings).contains("\n"));
	}

	@Test
	public void testReadWrite(@TempDir Path dir) throws IOException {
		var path = dir.resolve("settings.json");
		var settings = new Settings();
		settings.name = "fold-2";
		settings.sizes = List.of(256, 512);
		settings.scale = Double.NaN;
		GsonTools.writeJson(path, settings);

		var read = GsonTools.readJson(path, Settings.class);
		assertEquals("fold-2", read.name);
		assertEquals(List.of(256, 512), read.sizes);
		assertTrue(Double.isNaN(read.scale));
	}

	@Test
	public void testMissingFieldsKeepDefaults(@TempDir Path dir) throws IOException {
		var path = dir.resolve("partial.json");
		Files.writeString(path, "{\"name\": \"partial\"}");
		var read = GsonTools.readJson(path, Settings.class);
		assertEquals("partial", read.name);
		assertEquals(1.5, read.scale);
		assertNull(read.sizes);
	}

	@Test
	public void testInvalidFiles(@TempDir Path dir) throws IOException {
		var empty = dir.resolve("empty.json");
		Files.writeString(empty, "");
		assertThrows(IOException.class, () -> GsonTools.readJson(empty, Settings.class));

		var malformed = dir.resolve("malformed.json");
		Files.writeString(malformed, "{\"name\": [1, 2");
		assertThrows(IOException.class, () -> GsonTools.readJson(malformed, Settings.class));

		assertThrows(IOException.class, () -> GsonTools.readJson(dir.resolve("missing.json"), Settings.class));
	}

	static class Settings {

		private String name = "default";
		private double scale = 1.5;
		private List<Integer> sizes;

	}

}
