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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes a whole image from a file.
 *
 * @author SlideTiler developers
 */
@FunctionalInterface
public interface WholeImageReader {

	/**
	 * Read the image at a path.
	 * @param id identifier to assign to the image
	 * @param path file path
	 * @return
	 * @throws IOException if the image cannot be read
	 */
	WholeImage read(String id, Path path) throws IOException;

}
