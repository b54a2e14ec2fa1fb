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

package slidetiler.lib.sampling;

import java.io.IOException;
import java.nio.file.Path;

import slidetiler.lib.common.GeneralTools;
import slidetiler.lib.io.GsonTools;

/**
 * Parameters controlling how training tiles are sampled.
 * <p>
 * Instances are immutable, and are created either with a {@link Builder} or by reading JSON.
 * 
 * @author SlideTiler developers
 */
public class SamplingConfig {

	/**
	 * Default minimum number of positive pixels for {@link SamplingMode#VISIBLE}.
	 */
	public static final int DEFAULT_VISIBLE_PIXEL_THRESHOLD = 2000;

	/**
	 * Default ratio between the size of the sampled crop and the final tile size.
	 */
	public static final double DEFAULT_CROP_SCALE = 1.5;

	/**
	 * Default maximum number of rejected proposals before a tile is accepted anyway.
	 */
	public static final int DEFAULT_MAX_ATTEMPTS = 1000;

	private int tileSize = 256;
	private SamplingMode mode = SamplingMode.RANDOM;
	private double acceptanceThreshold = 0;
	private int visiblePixelThreshold = DEFAULT_VISIBLE_PIXEL_THRESHOLD;
	private double cropScale = DEFAULT_CROP_SCALE;
	private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
	private int iterationsPerEpoch = 1000;
	private double pExternal = 0;
	private double pPseudo = 0;
	private Long seed;

	private SamplingConfig() {}

	private SamplingConfig(SamplingConfig config) {
		this.tileSize = config.tileSize;
		this.mode = config.mode;
		this.acceptanceThreshold = config.acceptanceThreshold;
		this.visiblePixelThreshold = config.visiblePixelThreshold;
		this.cropScale = config.cropScale;
		this.maxAttempts = config.maxAttempts;
		this.iterationsPerEpoch = config.iterationsPerEpoch;
		this.pExternal = config.pExternal;
		this.pPseudo = config.pPseudo;
		this.seed = config.seed;
	}

	/**
	 * Side length of the tiles returned for training.
	 * @return
	 */
	public int getTileSize() {
		return tileSize;
	}

	/**
	 * Side length of the square cropped from the whole image, before any augmentation and center crop.
	 * This is {@code (int)(tileSize * cropScale)}.
	 * @return
	 */
	public int getCropSize() {
		return (int)(tileSize * cropScale);
	}

	/**
	 * @return
	 */
	public double getCropScale() {
		return cropScale;
	}

	/**
	 * @return
	 */
	public SamplingMode getMode() {
		return mode;
	}

	/**
	 * Probability of rejecting a proposal that fails the {@link SamplingMode} condition.
	 * 0 means every proposal is accepted.
	 * @return
	 */
	public double getAcceptanceThreshold() {
		return acceptanceThreshold;
	}

	/**
	 * Minimum number of positive pixels (exclusive) for {@link SamplingMode#VISIBLE}.
	 * @return
	 */
	public int getVisiblePixelThreshold() {
		return visiblePixelThreshold;
	}

	/**
	 * Maximum number of proposals for one tile before the last proposal is accepted regardless.
	 * @return
	 */
	public int getMaxAttempts() {
		return maxAttempts;
	}

	/**
	 * Number of tiles in one training epoch.
	 * @return
	 */
	public int getIterationsPerEpoch() {
		return iterationsPerEpoch;
	}

	/**
	 * Probability of drawing a training tile from an external source.
	 * @return
	 */
	public double getExternalProbability() {
		return pExternal;
	}

	/**
	 * Probability of drawing a training tile from a pseudo-labelled image.
	 * @return
	 */
	public double getPseudoLabelProbability() {
		return pPseudo;
	}

	/**
	 * Seed for the random generator, or null if the generator should be seeded from the clock.
	 * @return
	 */
	public Long getSeed() {
		return seed;
	}

	/**
	 * Create a builder initialized with the values of this config.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(this);
	}

	/**
	 * Read a config from a JSON file.
	 * Missing values take their defaults.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or parsed
	 * @throws IllegalArgumentException if the values are invalid
	 */
	public static SamplingConfig readJson(Path path) throws IOException {
		var config = GsonTools.readJson(path, SamplingConfig.class);
		config.validate();
		return config;
	}

	/**
	 * Write this config to a JSON file.
	 * @param path
	 * @throws IOException
	 */
	public void writeJson(Path path) throws IOException {
		GsonTools.writeJson(path, this);
	}

	private void validate() throws IllegalArgumentException {
		if (tileSize <= 0)
			throw new IllegalArgumentException("Tile size must be > 0, but was " + tileSize);
		if (mode == null)
			throw new IllegalArgumentException("Sampling mode must be specified!");
		if (!(cropScale >= 1))
			throw new IllegalArgumentException("Crop scale must be >= 1, but was " + cropScale);
		if (maxAttempts < 1)
			throw new IllegalArgumentException("Max attempts must be >= 1, but was " + maxAttempts);
		if (iterationsPerEpoch < 1)
			throw new IllegalArgumentException("Iterations per epoch must be >= 1, but was " + iterationsPerEpoch);
		if (visiblePixelThreshold < 0)
			throw new IllegalArgumentException("Visible pixel threshold must be >= 0, but was " + visiblePixelThreshold);
		GeneralTools.requireProbability("Acceptance threshold", acceptanceThreshold);
		GeneralTools.requireProbability("External probability", pExternal);
		GeneralTools.requireProbability("Pseudo-label probability", pPseudo);
	}

	@Override
	public String toString() {
		return "SamplingConfig [tileSize=" + tileSize + ", mode=" + mode + ", acceptanceThreshold=" + acceptanceThreshold
				+ ", cropScale=" + cropScale + ", maxAttempts=" + maxAttempts + ", iterationsPerEpoch=" + iterationsPerEpoch 
				+ ", pExternal=" + pExternal + ", pPseudo=" + pPseudo + ", seed=" + seed + "]";
	}


	/**
	 * Builder for {@link SamplingConfig}.
	 */
	public static class Builder {

		private SamplingConfig config;

		/**
		 * Constructor.
		 * @param tileSize side length of the training tiles
		 */
		public Builder(int tileSize) {
			config = new SamplingConfig();
			config.tileSize = tileSize;
		}

		private Builder(SamplingConfig config) {
			this.config = new SamplingConfig(config);
		}

		/**
		 * Set the acceptance policy.
		 * @param mode
		 * @return
		 */
		public Builder mode(SamplingMode mode) {
			config.mode = mode;
			return this;
		}

		/**
		 * Set the probability of rejecting proposals that fail the acceptance policy.
		 * @param threshold value between 0 and 1
		 * @return
		 */
		public Builder acceptanceThreshold(double threshold) {
			config.acceptanceThreshold = threshold;
			return this;
		}

		/**
		 * Set the minimum number of positive pixels (exclusive) for {@link SamplingMode#VISIBLE}.
		 * @param nPixels
		 * @return
		 */
		public Builder visiblePixelThreshold(int nPixels) {
			config.visiblePixelThreshold = nPixels;
			return this;
		}

		/**
		 * Set the ratio between the size of the sampled crop and the tile size.
		 * @param scale value &geq; 1
		 * @return
		 */
		public Builder cropScale(double scale) {
			config.cropScale = scale;
			return this;
		}

		/**
		 * Set the maximum number of proposals before accepting one regardless of the policy.
		 * @param maxAttempts
		 * @return
		 */
		public Builder maxAttempts(int maxAttempts) {
			config.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * Set the number of tiles per training epoch.
		 * @param iterations
		 * @return
		 */
		public Builder iterationsPerEpoch(int iterations) {
			config.iterationsPerEpoch = iterations;
			return this;
		}

		/**
		 * Set the probability of drawing tiles from an external source during training.
		 * @param probability
		 * @return
		 */
		public Builder externalProbability(double probability) {
			config.pExternal = probability;
			return this;
		}

		/**
		 * Set the probability of drawing tiles from pseudo-labelled images during training.
		 * @param probability
		 * @return
		 */
		public Builder pseudoLabelProbability(double probability) {
			config.pPseudo = probability;
			return this;
		}

		/**
		 * Set the seed for the random generator.
		 * @param seed
		 * @return
		 */
		public Builder seed(long seed) {
			config.seed = seed;
			return this;
		}

		/**
		 * Build the config.
		 * @return
		 * @throws IllegalArgumentException if any value is invalid
		 */
		public SamplingConfig build() throws IllegalArgumentException {
			config.validate();
			var built = config;
			config = null;
			return built;
		}

	}

}
