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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable, named collection of label masks keyed by image identifier.
 * <p>
 * Label data that changes (e.g. pseudo-labels that depend upon the current fold) is represented by
 * creating a new collection, never by modifying an existing one.
 *
 * @author SlideTiler developers
 */
public final class LabelCollection {

	private final String name;
	private final Map<String, BinaryMask> masks;

	private LabelCollection(String name, Map<String, BinaryMask> masks) {
		this.name = name;
		this.masks = Collections.unmodifiableMap(new LinkedHashMap<>(masks));
	}

	/**
	 * Create a collection from a map of masks. The map is copied.
	 * @param name name used for logging and error messages
	 * @param masks masks keyed by image identifier
	 * @return
	 */
	public static LabelCollection create(String name, Map<String, BinaryMask> masks) {
		return new LabelCollection(name, masks);
	}

	/**
	 * Name of the collection.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get the mask for an image.
	 * @param id
	 * @return
	 * @throws ImageNotFoundException if the collection has no mask for the image
	 */
	public BinaryMask get(String id) throws ImageNotFoundException {
		var mask = masks.get(id);
		if (mask == null)
			throw new ImageNotFoundException(id, "label collection '" + name + "'");
		return mask;
	}

	/**
	 * Query whether the collection contains a mask for an image.
	 * @param id
	 * @return
	 */
	public boolean contains(String id) {
		return masks.containsKey(id);
	}

	/**
	 * Identifiers of all images in the collection, in insertion order.
	 * @return
	 */
	public Set<String> getIds() {
		return masks.keySet();
	}

	/**
	 * Number of masks in the collection.
	 * @return
	 */
	public int size() {
		return masks.size();
	}

	@Override
	public String toString() {
		return "LabelCollection '" + name + "' (" + masks.size() + " masks)";
	}

}
