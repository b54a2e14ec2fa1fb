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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import slidetiler.lib.io.GsonTools;

/**
 * Configuration for loading a {@link WholeImageStore} from disk.
 * <p>
 * This lists the images to load along with their run-length encoded masks, and states where the image files are.
 * It can be read from JSON, e.g.
 * <pre>
 * {
 *   "imageDirectory": "/data/train",
 *   "imageExtension": ".tiff",
 *   "computeConvexHulls": true,
 *   "images": [ {"id": "2f6ecfcdf", "encoding": "296084587 4 296115835 6"} ]
 * }
 * </pre>
 *
 * @author SlideTiler developers
 */
public class ImageStoreConfig {

	private String imageDirectory;
	private String imageExtension = ".tiff";
	private boolean computeConvexHulls = false;
	private List<ImageEntry> images = new ArrayList<>();

	private ImageStoreConfig() {}

	/**
	 * Directory containing the image files.
	 * @return
	 */
	public Path getImageDirectory() {
		return Paths.get(imageDirectory);
	}

	/**
	 * File extension (including the dot) appended to each image id to find its file.
	 * @return
	 */
	public String getImageExtension() {
		return imageExtension;
	}

	/**
	 * Whether convex hull masks should be computed while loading.
	 * @return
	 */
	public boolean computeConvexHulls() {
		return computeConvexHulls;
	}

	/**
	 * Images to load, in order.
	 * @return
	 */
	public List<ImageEntry> getImages() {
		return Collections.unmodifiableList(images);
	}

	/**
	 * Get the file path of an image.
	 * @param id
	 * @return
	 */
	public Path getImagePath(String id) {
		return getImageDirectory().resolve(id + imageExtension);
	}

	/**
	 * Read a config from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static ImageStoreConfig readJson(Path path) throws IOException {
		var config = GsonTools.readJson(path, ImageStoreConfig.class);
		config.validate();
		return config;
	}

	private void validate() {
		if (imageDirectory == null)
			throw new IllegalArgumentException("Image directory must be specified!");
		if (images == null)
			images = new ArrayList<>();
		for (var entry : images) {
			if (entry.id == null)
				throw new IllegalArgumentException("Every image entry needs an id!");
		}
	}

	@Override
	public String toString() {
		return "ImageStoreConfig [imageDirectory=" + imageDirectory + ", imageExtension=" + imageExtension
				+ ", computeConvexHulls=" + computeConvexHulls + ", images=" + images.size() + "]";
	}


	/**
	 * An image id together with the run-length encoding of its mask.
	 */
	public static class ImageEntry {

		private String id;
		private String encoding;

		private ImageEntry() {}

		/**
		 * Create an entry.
		 * @param id
		 * @param encoding run-length encoding, see {@link RunLengthEncoding}
		 * @return
		 */
		public static ImageEntry create(String id, String encoding) {
			var entry = new ImageEntry();
			entry.id = id;
			entry.encoding = encoding;
			return entry;
		}

		/**
		 * Image identifier.
		 * @return
		 */
		public String getId() {
			return id;
		}

		/**
		 * Run-length encoded mask; may be null or empty if the image has no positive pixels.
		 * @return
		 */
		public String getEncoding() {
			return encoding;
		}

	}


	/**
	 * Builder for {@link ImageStoreConfig}.
	 */
	public static class Builder {

		private ImageStoreConfig config = new ImageStoreConfig();

		/**
		 * Constructor.
		 * @param imageDirectory directory containing the image files
		 */
		public Builder(Path imageDirectory) {
			config.imageDirectory = imageDirectory.toString();
		}

		/**
		 * File extension (including the dot) for the image files.
		 * @param extension
		 * @return
		 */
		public Builder imageExtension(String extension) {
			config.imageExtension = extension;
			return this;
		}

		/**
		 * Request that convex hull masks are computed while loading.
		 * @param compute
		 * @return
		 */
		public Builder computeConvexHulls(boolean compute) {
			config.computeConvexHulls = compute;
			return this;
		}

		/**
		 * Add an image to load.
		 * @param id
		 * @param encoding
		 * @return
		 */
		public Builder addImage(String id, String encoding) {
			config.images.add(ImageEntry.create(id, encoding));
			return this;
		}

		/**
		 * Build the config.
		 * @return
		 */
		public ImageStoreConfig build() {
			config.validate();
			var built = config;
			config = null;
			return built;
		}

	}

}
