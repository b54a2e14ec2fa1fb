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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.regions.TileRect;

/**
 * Immutable in-memory cache of whole images, their label masks and (optionally) convex hull masks.
 * <p>
 * Everything is loaded eagerly when the store is created; afterwards all methods are free of side effects,
 * and so the store can be shared between threads without locking.
 *
 * @author SlideTiler developers
 */
public final class WholeImageStore {

	private static final Logger logger = LoggerFactory.getLogger(WholeImageStore.class);

	private final String name;
	private final Map<String, Entry> entries;
	private final List<String> ids;

	private WholeImageStore(String name, Map<String, Entry> entries) {
		this.name = name;
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
		this.ids = Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
	}

	/**
	 * Load all images and masks listed in a config.
	 * @param config the config listing images and their mask encodings
	 * @param reader reader used to decode each image file
	 * @return
	 * @throws IOException if any image cannot be read
	 */
	public static WholeImageStore load(ImageStoreConfig config, WholeImageReader reader) throws IOException {
		long startTime = System.currentTimeMillis();
		var builder = new Builder("images")
				.computeConvexHulls(config.computeConvexHulls());
		for (var entry : config.getImages()) {
			var image = reader.read(entry.getId(), config.getImagePath(entry.getId()));
			var mask = RunLengthEncoding.decode(entry.getEncoding(), image.getHeight(), image.getWidth());
			builder.addImage(image, mask);
		}
		var store = builder.build();
		logger.info("Loaded {} in {} ms", store, System.currentTimeMillis() - startTime);
		return store;
	}

	/**
	 * Name of the store, used for logging and error messages.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get an image.
	 * @param id
	 * @return
	 * @throws ImageNotFoundException if the id is unknown
	 */
	public WholeImage getImage(String id) throws ImageNotFoundException {
		return getEntry(id).image;
	}

	/**
	 * Get the label mask of an image.
	 * @param id
	 * @return
	 * @throws ImageNotFoundException if the id is unknown
	 */
	public BinaryMask getMask(String id) throws ImageNotFoundException {
		return getEntry(id).mask;
	}

	/**
	 * Get the convex hull mask of an image, if it was computed.
	 * @param id
	 * @return
	 * @throws ImageNotFoundException if the id is unknown
	 */
	public Optional<BinaryMask> getHull(String id) throws ImageNotFoundException {
		return Optional.ofNullable(getEntry(id).hull);
	}

	/**
	 * Get the number of pixels in an image.
	 * @param id
	 * @return
	 * @throws ImageNotFoundException if the id is unknown
	 */
	public long getArea(String id) throws ImageNotFoundException {
		return getEntry(id).image.getArea();
	}

	/**
	 * Crop an image and its mask.
	 * @param id
	 * @param rect
	 * @return
	 * @throws ImageNotFoundException if the id is unknown
	 */
	public TilePair getTilePair(String id, TileRect rect) throws ImageNotFoundException {
		var entry = getEntry(id);
		return TilePair.of(entry.image.crop(rect), entry.mask.crop(rect));
	}

	/**
	 * Query whether the store contains an image.
	 * @param id
	 * @return
	 */
	public boolean contains(String id) {
		return entries.containsKey(id);
	}

	/**
	 * Image identifiers, in the order the images were added.
	 * @return
	 */
	public List<String> getIds() {
		return ids;
	}

	/**
	 * Number of images in the store.
	 * @return
	 */
	public int size() {
		return ids.size();
	}

	/**
	 * Get the label masks of all images as a collection.
	 * @return
	 */
	public LabelCollection getMasks() {
		Map<String, BinaryMask> masks = new LinkedHashMap<>();
		for (var entry : entries.values())
			masks.put(entry.image.getId(), entry.mask);
		return LabelCollection.create(name, masks);
	}

	private Entry getEntry(String id) {
		var entry = entries.get(id);
		if (entry == null)
			throw new ImageNotFoundException(id, "store '" + name + "'");
		return entry;
	}

	@Override
	public String toString() {
		return "WholeImageStore '" + name + "' (" + ids.size() + " images)";
	}


	private static class Entry {

		private final WholeImage image;
		private final BinaryMask mask;
		private final BinaryMask hull;

		private Entry(WholeImage image, BinaryMask mask, BinaryMask hull) {
			this.image = image;
			this.mask = mask;
			this.hull = hull;
		}

	}


	/**
	 * Builder for a {@link WholeImageStore} from images already in memory.
	 */
	public static class Builder {

		private final String name;
		private boolean computeConvexHulls = false;
		private Map<String, Entry> entries = new LinkedHashMap<>();

		/**
		 * Constructor.
		 * @param name name of the store
		 */
		public Builder(String name) {
			this.name = name;
		}

		/**
		 * Request that convex hulls are computed for every image that doesn't have one already.
		 * @param compute
		 * @return
		 */
		public Builder computeConvexHulls(boolean compute) {
			this.computeConvexHulls = compute;
			return this;
		}

		/**
		 * Add an image and its mask.
		 * @param image
		 * @param mask mask of the same size as the image
		 * @return
		 */
		public Builder addImage(WholeImage image, BinaryMask mask) {
			return addImage(image, mask, null);
		}

		/**
		 * Add an image, its mask and its convex hull mask.
		 * @param image
		 * @param mask mask of the same size as the image
		 * @param hull convex hull mask of the same size as the image, or null
		 * @return
		 */
		public Builder addImage(WholeImage image, BinaryMask mask, BinaryMask hull) {
			checkSize(image, mask);
			if (hull != null)
				checkSize(image, hull);
			if (entries.containsKey(image.getId()))
				throw new IllegalArgumentException("Duplicate image id " + image.getId());
			entries.put(image.getId(), new Entry(image, mask, hull));
			return this;
		}

		private static void checkSize(WholeImage image, BinaryMask mask) {
			if (image.getHeight() != mask.getHeight() || image.getWidth() != mask.getWidth())
				throw new IllegalArgumentException("Mask " + mask + " does not match " + image);
		}

		/**
		 * Build the store, computing any requested convex hulls.
		 * @return
		 */
		public WholeImageStore build() {
			if (computeConvexHulls) {
				for (var key : new ArrayList<>(entries.keySet())) {
					var entry = entries.get(key);
					if (entry.hull == null) {
						logger.debug("Computing convex hull for {}", key);
						entries.put(key, new Entry(entry.image, entry.mask, ConvexHulls.computeConvexHull(entry.mask)));
					}
				}
			}
			return new WholeImageStore(name, entries);
		}

	}

}
