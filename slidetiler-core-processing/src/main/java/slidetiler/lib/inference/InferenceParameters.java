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

package slidetiler.lib.inference;

import java.io.IOException;
import java.nio.file.Path;

import slidetiler.lib.io.GsonTools;
import slidetiler.lib.tiling.TileWeightKernel;

/**
 * Parameters for predicting a whole image tile by tile.
 * <p>
 * Instances are immutable, and are created either with a {@link Builder} or by reading JSON.
 * 
 * @author SlideTiler developers
 */
public class InferenceParameters {

	/**
	 * Function applied to the foreground output of the model.
	 */
	public enum Activation {
		/**
		 * Use the model output unchanged.
		 */
		NONE,
		/**
		 * Apply the logistic sigmoid, for models that output logits.
		 */
		SIGMOID;

		/**
		 * Apply the activation to a value.
		 * @param value
		 * @return
		 */
		public float apply(float value) {
			return switch (this) {
				case NONE -> value;
				case SIGMOID -> (float)(1.0 / (1.0 + Math.exp(-value)));
			};
		}
	}

	private int tileSize = 256;
	private int reduceFactor = 1;
	private double overlapFactor = 1.0;
	private int batchSize = 32;
	private boolean tta = false;
	private Activation activation = Activation.SIGMOID;
	private double kernelSigma = TileWeightKernel.DEFAULT_SIGMA;
	private double kernelAlpha = TileWeightKernel.DEFAULT_ALPHA;
	private int nThreads = 1;

	private InferenceParameters() {}

	/**
	 * Side length of the tiles passed to the model.
	 * @return
	 */
	public int getTileSize() {
		return tileSize;
	}

	/**
	 * Factor by which tiles are downsampled before prediction.
	 * @return
	 */
	public int getReduceFactor() {
		return reduceFactor;
	}

	/**
	 * Side length of the tiles cut from the full-resolution image, {@code tileSize * reduceFactor}.
	 * @return
	 */
	public int getFullResolutionTileSize() {
		return tileSize * reduceFactor;
	}

	/**
	 * Number of tiles overlapping each pixel along each axis (approximately), away from the image border.
	 * @return
	 */
	public double getOverlapFactor() {
		return overlapFactor;
	}

	/**
	 * Maximum number of tiles passed to the model in one call.
	 * @return
	 */
	public int getBatchSize() {
		return batchSize;
	}

	/**
	 * Whether predictions are averaged with predictions of flipped tiles.
	 * @return
	 */
	public boolean useTTA() {
		return tta;
	}

	/**
	 * @return
	 */
	public Activation getActivation() {
		return activation;
	}

	/**
	 * @return
	 * @see TileWeightKernel#build(int, double, double, double)
	 */
	public double getKernelSigma() {
		return kernelSigma;
	}

	/**
	 * @return
	 * @see TileWeightKernel#build(int, double, double, double)
	 */
	public double getKernelAlpha() {
		return kernelAlpha;
	}

	/**
	 * Number of threads used to predict batches.
	 * @return
	 */
	public int getNumThreads() {
		return nThreads;
	}

	/**
	 * Read parameters from a JSON file.
	 * Missing values take their defaults.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or parsed
	 * @throws IllegalArgumentException if the values are invalid
	 */
	public static InferenceParameters readJson(Path path) throws IOException {
		var params = GsonTools.readJson(path, InferenceParameters.class);
		params.validate();
		return params;
	}

	private void validate() throws IllegalArgumentException {
		if (tileSize <= 0)
			throw new IllegalArgumentException("Tile size must be > 0, but was " + tileSize);
		if (reduceFactor < 1)
			throw new IllegalArgumentException("Reduce factor must be >= 1, but was " + reduceFactor);
		if (!(overlapFactor >= 1))
			throw new IllegalArgumentException("Overlap factor must be >= 1, but was " + overlapFactor);
		if (batchSize < 1)
			throw new IllegalArgumentException("Batch size must be >= 1, but was " + batchSize);
		if (activation == null)
			throw new IllegalArgumentException("Activation must be specified!");
		if (nThreads < 1)
			throw new IllegalArgumentException("Number of threads must be >= 1, but was " + nThreads);
		// Check the kernel parameters early
		TileWeightKernel.build(1, kernelSigma, kernelAlpha, TileWeightKernel.DEFAULT_EPS);
	}

	@Override
	public String toString() {
		return "InferenceParameters [tileSize=" + tileSize + ", reduceFactor=" + reduceFactor + ", overlapFactor="
				+ overlapFactor + ", batchSize=" + batchSize + ", tta=" + tta + ", activation=" + activation
				+ ", kernelSigma=" + kernelSigma + ", kernelAlpha=" + kernelAlpha + ", nThreads=" + nThreads + "]";
	}


	/**
	 * Builder for {@link InferenceParameters}.
	 */
	public static class Builder {

		private InferenceParameters params = new InferenceParameters();

		/**
		 * Constructor.
		 * @param tileSize side length of the tiles passed to the model
		 */
		public Builder(int tileSize) {
			params.tileSize = tileSize;
		}

		/**
		 * Downsample tiles by this factor before prediction, and upsample the predictions afterwards.
		 * @param factor
		 * @return
		 */
		public Builder reduceFactor(int factor) {
			params.reduceFactor = factor;
			return this;
		}

		/**
		 * Set the overlap factor; the step between tiles is {@code floor(tileSize / overlapFactor)}.
		 * @param overlapFactor
		 * @return
		 */
		public Builder overlapFactor(double overlapFactor) {
			params.overlapFactor = overlapFactor;
			return this;
		}

		/**
		 * @param batchSize
		 * @return
		 */
		public Builder batchSize(int batchSize) {
			params.batchSize = batchSize;
			return this;
		}

		/**
		 * Request test-time augmentation with flips.
		 * @param tta
		 * @return
		 */
		public Builder tta(boolean tta) {
			params.tta = tta;
			return this;
		}

		/**
		 * @param activation
		 * @return
		 */
		public Builder activation(Activation activation) {
			params.activation = activation;
			return this;
		}

		/**
		 * Set the parameters for the blending kernel.
		 * @param sigma
		 * @param alpha
		 * @return
		 */
		public Builder kernel(double sigma, double alpha) {
			params.kernelSigma = sigma;
			params.kernelAlpha = alpha;
			return this;
		}

		/**
		 * @param nThreads
		 * @return
		 */
		public Builder nThreads(int nThreads) {
			params.nThreads = nThreads;
			return this;
		}

		/**
		 * Build the parameters.
		 * @return
		 * @throws IllegalArgumentException if any value is invalid
		 */
		public InferenceParameters build() throws IllegalArgumentException {
			params.validate();
			var built = params;
			params = null;
			return built;
		}

	}

}
