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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WholeImageReader} that decodes images using ImageIO.
 * <p>
 * Only 8-bit images are supported. Any alpha channel is discarded.
 *
 * @author SlideTiler developers
 */
public class ImageIoWholeImageReader implements WholeImageReader {

	private static final Logger logger = LoggerFactory.getLogger(ImageIoWholeImageReader.class);

	@Override
	public WholeImage read(String id, Path path) throws IOException {
		long startTime = System.currentTimeMillis();
		var img = ImageIO.read(path.toFile());
		if (img == null)
			throw new IOException("No ImageIO reader found for " + path);
		var image = fromBufferedImage(id, img);
		logger.debug("Read {} from {} in {} ms", image, path, System.currentTimeMillis() - startTime);
		return image;
	}

	/**
	 * Convert a {@link BufferedImage} to a {@link WholeImage}.
	 * @param id identifier to assign to the image
	 * @param img 8-bit image
	 * @return
	 * @throws IOException if the image does not have 8 bits per sample
	 */
	public static WholeImage fromBufferedImage(String id, BufferedImage img) throws IOException {
		var raster = img.getRaster();
		int bitDepth = raster.getSampleModel().getSampleSize(0);
		if (bitDepth != 8)
			throw new IOException("Only 8-bit images are supported, but " + id + " has " + bitDepth + " bits per sample");
		int nChannels = raster.getNumBands();
		if (img.getColorModel().hasAlpha())
			nChannels--;
		int width = img.getWidth();
		int height = img.getHeight();
		byte[][] rows = new byte[height][width * nChannels];
		int[] samples = new int[width];
		for (int x = 0; x < height; x++) {
			byte[] row = rows[x];
			for (int c = 0; c < nChannels; c++) {
				raster.getSamples(0, x, width, 1, c, samples);
				for (int y = 0; y < width; y++)
					row[y * nChannels + c] = (byte)samples[y];
			}
		}
		return WholeImage.create(id, width, nChannels, rows);
	}

}
