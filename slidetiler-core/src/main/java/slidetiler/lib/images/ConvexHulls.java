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

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods to compute convex hull masks, used as a coarse region of interest when sampling tiles.
 * <p>
 * The hull is computed with Java Topology Suite from the centers of positive pixels, using JTS coordinates
 * where {@code x} is the mask column and {@code y} is the mask row.
 * A pixel belongs to the hull mask if its center is covered by the hull.
 *
 * @author SlideTiler developers
 */
public class ConvexHulls {

	private static final Logger logger = LoggerFactory.getLogger(ConvexHulls.class);

	private static final GeometryFactory factory = new GeometryFactory();

	/**
	 * Tolerance when converting hull boundaries back to pixel centers.
	 */
	private static final double TOLERANCE = 1e-6;

	// Suppress default constructor for non-instantiability
	private ConvexHulls() {
		throw new AssertionError();
	}

	/**
	 * Compute the convex hull of the positive pixels of a mask.
	 * @param mask
	 * @return a mask of the same size, which is empty if the input mask is empty
	 */
	public static BinaryMask computeConvexHull(BinaryMask mask) {
		int height = mask.getHeight();
		int width = mask.getWidth();

		// Only the first and last positive pixel in each row can be hull vertices
		List<Coordinate> coords = new ArrayList<>();
		for (int x = 0; x < height; x++) {
			int first = mask.nextPositive(x, 0);
			if (first < 0)
				continue;
			int last = mask.previousPositive(x, width - 1);
			coords.add(new Coordinate(first + 0.5, x + 0.5));
			if (last != first)
				coords.add(new Coordinate(last + 0.5, x + 0.5));
		}
		var builder = BinaryMask.builder(height, width);
		if (coords.isEmpty())
			return builder.build();

		Geometry hull = factory.createMultiPointFromCoords(coords.toArray(Coordinate[]::new)).convexHull();
		Envelope envelope = hull.getEnvelopeInternal();
		logger.trace("Convex hull computed from {} points: {}", coords.size(), hull.getGeometryType());

		int xStart = (int)Math.max(0, Math.floor(envelope.getMinY()));
		int xEnd = (int)Math.min(height - 1, Math.floor(envelope.getMaxY()));
		for (int x = xStart; x <= xEnd; x++) {
			double rowCenter = x + 0.5;
			var line = factory.createLineString(new Coordinate[] {
					new Coordinate(envelope.getMinX() - 1, rowCenter),
					new Coordinate(envelope.getMaxX() + 1, rowCenter)
			});
			var span = hull.intersection(line);
			if (span.isEmpty())
				continue;
			var spanEnvelope = span.getEnvelopeInternal();
			int y0 = (int)Math.ceil(spanEnvelope.getMinX() - 0.5 - TOLERANCE);
			int y1 = (int)Math.floor(spanEnvelope.getMaxX() - 0.5 + TOLERANCE);
			y0 = Math.max(0, y0);
			y1 = Math.min(width - 1, y1);
			if (y1 >= y0)
				builder.setRange(x, y0, y1 + 1);
		}
		return builder.build();
	}

}
