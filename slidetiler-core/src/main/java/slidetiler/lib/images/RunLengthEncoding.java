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

import java.util.Collection;
import java.util.List;

import slidetiler.lib.common.GeneralTools;

/**
 * Static methods to convert between {@link BinaryMask} and run-length encoded strings.
 * <p>
 * The encoding is a whitespace-separated list of {@code start length} pairs.
 * Starts are 1-based indices into the mask flattened in column-major order
 * (i.e. running down each column before moving to the next column).
 *
 * @author SlideTiler developers
 */
public class RunLengthEncoding {

	// Suppress default constructor for non-instantiability
	private RunLengthEncoding() {
		throw new AssertionError();
	}

	/**
	 * Decode a single run-length encoding.
	 * @param encoding the encoding; null or blank strings result in an empty mask
	 * @param height mask height
	 * @param width mask width
	 * @return
	 * @throws IllegalArgumentException if the encoding is malformed or refers to pixels outside the mask
	 */
	public static BinaryMask decode(String encoding, int height, int width) throws IllegalArgumentException {
		return decode(encoding == null ? List.of() : List.of(encoding), height, width);
	}

	/**
	 * Decode the union of several run-length encodings of the same mask.
	 * @param encodings the encodings; null or blank strings are skipped
	 * @param height mask height
	 * @param width mask width
	 * @return
	 * @throws IllegalArgumentException if an encoding is malformed or refers to pixels outside the mask
	 */
	public static BinaryMask decode(Collection<String> encodings, int height, int width) throws IllegalArgumentException {
		var builder = BinaryMask.builder(height, width);
		long nPixels = (long)height * width;
		for (String encoding : encodings) {
			if (GeneralTools.blankString(encoding, true))
				continue;
			String[] tokens = encoding.trim().split("\\s+");
			if (tokens.length % 2 != 0)
				throw new IllegalArgumentException("Run-length encoding must contain an even number of values, but found " + tokens.length);
			for (int i = 0; i < tokens.length; i += 2) {
				long start = Long.parseLong(tokens[i]) - 1;
				long length = Long.parseLong(tokens[i+1]);
				if (start < 0 || length < 0 || start + length > nPixels)
					throw new IllegalArgumentException(String.format("Run (%d, %d) is outside mask of size %d x %d", start + 1, length, height, width));
				for (long p = start; p < start + length; p++)
					builder.set((int)(p % height), (int)(p / height));
			}
		}
		return builder.build();
	}

	/**
	 * Encode a mask, using the same format accepted by {@link #decode(String, int, int)}.
	 * @param mask
	 * @return the encoding, which is an empty string if the mask has no positive pixels
	 */
	public static String encode(BinaryMask mask) {
		int height = mask.getHeight();
		int width = mask.getWidth();
		var sb = new StringBuilder();
		long runStart = -1;
		for (int y = 0; y < width; y++) {
			for (int x = 0; x < height; x++) {
				long p = (long)y * height + x;
				boolean positive = mask.isPositive(x, y);
				if (positive && runStart < 0) {
					runStart = p;
				} else if (!positive && runStart >= 0) {
					appendRun(sb, runStart, p - runStart);
					runStart = -1;
				}
			}
		}
		if (runStart >= 0)
			appendRun(sb, runStart, (long)height * width - runStart);
		return sb.toString();
	}

	private static void appendRun(StringBuilder sb, long start, long length) {
		if (sb.length() > 0)
			sb.append(' ');
		sb.append(start + 1).append(' ').append(length);
	}

}
