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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.common.GeneralTools;
import slidetiler.lib.images.BinaryMask;
import slidetiler.lib.images.LabelCollection;

/**
 * {@link FoldMaskDeriver} that reads per-fold pseudo-label probability images from a directory.
 * <p>
 * For image {@code id} and fold {@code k}, the file {@code {directory}/{id}_{k}.png} is read as an 8-bit 
 * single-channel probability map (0-255 representing 0-1), and thresholded to create a mask.
 *
 * @author SlideTiler developers
 */
public class PseudoLabelFiles implements FoldMaskDeriver {

	private static final Logger logger = LoggerFactory.getLogger(PseudoLabelFiles.class);

	/**
	 * Default probability above which a pixel is considered positive.
	 */
	public static final double DEFAULT_THRESHOLD = 0.4;

	private final Path directory;
	private final List<String> ids;
	private final double threshold;

	/**
	 * Constructor using {@link #DEFAULT_THRESHOLD}.
	 * @param directory directory containing the probability images
	 * @param ids pseudo-labelled image identifiers
	 */
	public PseudoLabelFiles(Path directory, Collection<String> ids) {
		this(directory, ids, DEFAULT_THRESHOLD);
	}

	/**
	 * Constructor.
	 * @param directory directory containing the probability images
	 * @param ids pseudo-labelled image identifiers
	 * @param threshold probability above which a pixel is considered positive
	 */
	public PseudoLabelFiles(Path directory, Collection<String> ids, double threshold) {
		this.directory = directory;
		this.ids = new ArrayList<>(ids);
		this.threshold = GeneralTools.requireProbability("Pseudo-label threshold", threshold);
	}

	/**
	 * Get the file storing the pseudo-label probabilities for an image and fold.
	 * @param id
	 * @param fold
	 * @return
	 */
	public Path getPath(String id, int fold) {
		return directory.resolve(id + "_" + fold + ".png");
	}

	@Override
	public LabelCollection deriveMasks(int fold) throws IOException {
		Map<String, BinaryMask> masks = new LinkedHashMap<>();
		for (var id : ids) {
			var path = getPath(id, fold);
			if (!Files.isRegularFile(path))
				throw new IOException("No pseudo-label file found at " + path);
			var img = ImageIO.read(path.toFile());
			if (img == null)
				throw new IOException("Unable to read pseudo-labels from " + path);
			int height = img.getHeight();
			int width = img.getWidth();
			var raster = img.getRaster();
			var builder = BinaryMask.builder(height, width);
			int[] samples = new int[width];
			for (int x = 0; x < height; x++) {
				raster.getSamples(0, x, width, 1, 0, samples);
				for (int y = 0; y < width; y++) {
					if (samples[y] / 255.0 > threshold)
						builder.set(x, y);
				}
			}
			masks.put(id, builder.build());
		}
		logger.info("Loaded {} pseudo-label masks for fold {}", masks.size(), fold);
		return LabelCollection.create("pseudo-labels (fold " + fold + ")", masks);
	}

}
