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

package slidetiler.lib.evaluation;

/**
 * A probability threshold and the Dice score obtained with it.
 * 
 * @author SlideTiler developers
 */
public final class ThresholdScore {

	private final double threshold;
	private final double score;

	ThresholdScore(double threshold, double score) {
		this.threshold = threshold;
		this.score = score;
	}

	/**
	 * @return
	 */
	public double getThreshold() {
		return threshold;
	}

	/**
	 * @return
	 */
	public double getScore() {
		return score;
	}

	@Override
	public String toString() {
		return String.format("ThresholdScore [threshold=%.2f, score=%.4f]", threshold, score);
	}

}
