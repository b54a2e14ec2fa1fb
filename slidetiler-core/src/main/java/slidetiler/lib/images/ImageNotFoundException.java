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

import java.util.NoSuchElementException;

/**
 * Exception thrown when an image identifier is requested that is not known to a store or label collection.
 *
 * @author SlideTiler developers
 */
public class ImageNotFoundException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;

	private final String id;

	/**
	 * Constructor.
	 * @param id the unknown image identifier
	 * @param source name of the store or collection that was queried
	 */
	public ImageNotFoundException(String id, String source) {
		super("No image with id '" + id + "' in " + source);
		this.id = id;
	}

	/**
	 * Get the identifier that could not be found.
	 * @return
	 */
	public String getId() {
		return id;
	}

}
