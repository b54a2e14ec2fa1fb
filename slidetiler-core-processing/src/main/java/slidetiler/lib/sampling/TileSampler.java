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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.lib.folds.FoldAssignment;
import slidetiler.lib.folds.FoldSelection;
import slidetiler.lib.images.BinaryMask;
import slidetiler.lib.images.LabelCollection;
import slidetiler.lib.images.TilePair;
import slidetiler.lib.images.WholeImage;
import slidetiler.lib.images.WholeImageStore;
import slidetiler.lib.regions.TileRect;

/**
 * Samples square training and validation tiles from the images of a {@link WholeImageStore}.
 * <p>
 * In training mode, an image is chosen with probability proportional to its area 
 * (optionally replaced by a draw from an external source or a pseudo-labelled image), 
 * and random crops are proposed until one is accepted by {@link #acceptTilePolicy(String, TileRect, boolean)}.
 * In validation mode, images from the validation subset are visited in turn and every proposal is accepted.
 * An acceptance threshold of 0 disables rejection but leaves the choice of image unchanged.
 * <p>
 * A sampler owns its random generator and is not thread-safe. 
 * Use {@link #forWorker(long)} to create an independent sampler for each worker thread; 
 * the image store and labels are immutable and shared.
 * 
 * @author SlideTiler developers
 */
public class TileSampler {

	private static final Logger logger = LoggerFactory.getLogger(TileSampler.class);

	private final WholeImageStore store;
	private final FoldAssignment folds;
	private final SamplingConfig config;
	private final ExternalTileSource externalSource;
	private final PseudoLabelPool pseudoLabelPool;
	private final RandomGenerator random;

	private FoldSelection selection;
	private LabelCollection pseudoLabels;
	private EnumeratedIntegerDistribution trainDistribution;
	private boolean training = true;

	private long fallbackCount = 0;

	private TileSampler(Builder builder, RandomGenerator random) {
		this.store = builder.store;
		this.folds = builder.folds;
		this.config = builder.config;
		this.externalSource = builder.externalSource;
		this.pseudoLabelPool = builder.pseudoLabelPool;
		this.random = random;
	}

	/**
	 * Create a new sampler sharing the images, labels, fold and mode of this one, but with its own random generator.
	 * @param seed seed for the new random generator
	 * @return
	 */
	public TileSampler forWorker(long seed) {
		var builder = new Builder(store, folds, config)
				.externalSource(externalSource)
				.pseudoLabelPool(pseudoLabelPool);
		var sampler = new TileSampler(builder, new MersenneTwister(seed));
		sampler.training = training;
		sampler.updateFold(selection, pseudoLabels);
		return sampler;
	}

	/**
	 * Change the active fold.
	 * This updates the training and validation subsets, and derives new pseudo-labels if a pseudo-label pool is used.
	 * @param fold
	 * @throws IOException if pseudo-labels for the fold cannot be read
	 * @throws IllegalArgumentException if the fold is outside the range of the fold assignment
	 */
	public void setFold(int fold) throws IOException, IllegalArgumentException {
		var newSelection = folds.selectFold(fold);
		LabelCollection newPseudoLabels = null;
		if (pseudoLabelPool != null)
			newPseudoLabels = pseudoLabelPool.deriveLabels(fold);
		updateFold(newSelection, newPseudoLabels);
		logger.info("Active fold {}: {} training images, {} validation images", fold, 
				selection.getTrainIds().size(), selection.getValidIds().size());
	}

	private void updateFold(FoldSelection selection, LabelCollection pseudoLabels) {
		var trainIds = selection.getTrainIds();
		EnumeratedIntegerDistribution distribution = null;
		if (!trainIds.isEmpty()) {
			int[] indices = new int[trainIds.size()];
			double[] areas = new double[trainIds.size()];
			for (int i = 0; i < indices.length; i++) {
				indices[i] = i;
				areas[i] = store.getArea(trainIds.get(i));
			}
			distribution = new EnumeratedIntegerDistribution(random, indices, areas);
		}
		this.selection = selection;
		this.pseudoLabels = pseudoLabels;
		this.trainDistribution = distribution;
	}

	/**
	 * Index of the active fold.
	 * @return
	 */
	public int getFold() {
		return selection.getFold();
	}

	/**
	 * Training and validation ids of the active fold.
	 * @return
	 */
	public FoldSelection getFoldSelection() {
		return selection;
	}

	/**
	 * Pseudo-labels of the active fold, or null if no pseudo-label pool is used.
	 * @return
	 */
	public LabelCollection getPseudoLabels() {
		return pseudoLabels;
	}

	/**
	 * Switch between training and validation mode.
	 * In validation mode the acceptance threshold is 0, and tiles come from the validation subset only.
	 * @param training
	 */
	public void setTraining(boolean training) {
		this.training = training;
	}

	/**
	 * Query whether the sampler is in training mode.
	 * @return
	 */
	public boolean isTraining() {
		return training;
	}

	/**
	 * The acceptance threshold that is currently applied.
	 * This is always 0 in validation mode.
	 * @return
	 */
	public double getEffectiveThreshold() {
		return training ? config.getAcceptanceThreshold() : 0;
	}

	/**
	 * The config used by this sampler.
	 * @return
	 */
	public SamplingConfig getConfig() {
		return config;
	}

	/**
	 * Number of tiles that were accepted because the maximum number of attempts was reached.
	 * @return
	 */
	public long getFallbackCount() {
		return fallbackCount;
	}

	/**
	 * Get the probability of choosing each training image of the active fold, which is 
	 * the image area divided by the total area of all training images.
	 * @return
	 */
	public Map<String, Double> getSamplingProbabilities() {
		var trainIds = selection.getTrainIds();
		double total = 0;
		for (var id : trainIds)
			total += store.getArea(id);
		Map<String, Double> map = new LinkedHashMap<>();
		for (var id : trainIds)
			map.put(id, store.getArea(id) / total);
		return Collections.unmodifiableMap(map);
	}

	private List<String> getActiveIds() {
		return training ? selection.getTrainIds() : selection.getValidIds();
	}

	/**
	 * Sample a tile.
	 * <p>
	 * In validation mode, the tile comes from image {@code index % n} of the validation subset.
	 * In training mode the index is ignored: the tile comes from the external source or a pseudo-labelled 
	 * image with their configured probabilities, and otherwise from a training image chosen with probability 
	 * proportional to its area. This applies for any acceptance threshold, including 0.
	 * @param index index of the tile within the epoch
	 * @return
	 * @throws IllegalStateException if there are no images in the active subset
	 */
	public SampledTile sample(int index) throws IllegalStateException {
		if (index < 0)
			throw new IndexOutOfBoundsException("Tile index must be >= 0, but was " + index);
		var ids = getActiveIds();
		if (ids.isEmpty())
			throw new IllegalStateException("No " + (training ? "training" : "validation") + " images for fold " + getFold());

		if (!training)
			return sampleFromImage(ids.get(index % ids.size()), TileSource.VALIDATION);

		if (externalSource != null && config.getExternalProbability() > 0 && random.nextDouble() < config.getExternalProbability()) {
			var tile = externalSource.sample(random);
			int tileSize = config.getTileSize();
			if (tile.getRect().getHeight() < tileSize || tile.getRect().getWidth() < tileSize)
				throw new IllegalStateException("External tile " + tile + " is smaller than the tile size " + tileSize);
			logger.trace("Sampled external tile {}", tile);
			return tile;
		}
		if (pseudoLabels != null && config.getPseudoLabelProbability() > 0 && random.nextDouble() < config.getPseudoLabelProbability()) {
			var pseudoIds = pseudoLabelPool.getImages().getIds();
			if (!pseudoIds.isEmpty())
				return sampleFromImage(pseudoIds.get(random.nextInt(pseudoIds.size())), TileSource.PSEUDO_LABEL);
		}
		return sampleFromImage(ids.get(trainDistribution.sample()), TileSource.TRAINING);
	}

	private SampledTile sampleFromImage(String id, TileSource source) {
		boolean isSynthetic = source.isSynthetic();
		var image = getImage(id, isSynthetic);
		var rect = proposeTile(id, image.getHeight(), image.getWidth(), isSynthetic);
		var pair = TilePair.of(image.crop(rect), getLabels(id, isSynthetic).crop(rect));
		return SampledTile.create(id, rect, source, pair);
	}

	private TileRect proposeTile(String id, int height, int width, boolean isSynthetic) {
		int cropSize = config.getCropSize();
		if (cropSize > height || cropSize > width)
			throw new IllegalArgumentException(String.format("Image %s (%d x %d) is smaller than the crop size %d", id, height, width, cropSize));
		TileRect rect = null;
		int maxAttempts = config.getMaxAttempts();
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			int x0 = random.nextInt(height - cropSize + 1);
			int y0 = random.nextInt(width - cropSize + 1);
			rect = TileRect.square(x0, y0, cropSize);
			if (acceptTilePolicy(id, rect, isSynthetic)) {
				logger.trace("Accepted {} in {} after {} attempt(s)", rect, id, attempt);
				return rect;
			}
		}
		fallbackCount++;
		logger.warn("No tile accepted in {} after {} attempts - using last proposal {}", id, maxAttempts, rect);
		return rect;
	}

	/**
	 * Decide whether to accept a proposed tile.
	 * <p>
	 * Tiles are always accepted if the effective threshold is 0 or the mode is {@link SamplingMode#RANDOM}.
	 * Otherwise a tile passing the condition of the mode is accepted, and a tile failing it is still 
	 * accepted with probability {@code 1 - threshold}.
	 * 
	 * @param id id of the image
	 * @param rect proposed region
	 * @param isSynthetic true if the image is pseudo-labelled, false if it is from the image store
	 * @return
	 * @throws slidetiler.lib.regions.InvalidRegionException if the region is outside the image
	 */
	public boolean acceptTilePolicy(String id, TileRect rect, boolean isSynthetic) {
		double threshold = getEffectiveThreshold();
		if (threshold == 0)
			return true;
		var labels = getLabels(id, isSynthetic);
		rect.checkWithin(labels.getHeight(), labels.getWidth());
		boolean condition = switch (config.getMode()) {
			case RANDOM -> true;
			case CENTERED -> labels.isPositive(rect.getCenterX(), rect.getCenterY());
			case CONVEX_HULL -> isSynthetic || getHull(id).isPositive(rect.getCenterX(), rect.getCenterY());
			case VISIBLE -> labels.countPositive(rect) > config.getVisiblePixelThreshold();
		};
		if (condition)
			return true;
		return random.nextDouble() > threshold;
	}

	private WholeImage getImage(String id, boolean isSynthetic) {
		return isSynthetic ? pseudoLabelPool.getImages().getImage(id) : store.getImage(id);
	}

	private BinaryMask getLabels(String id, boolean isSynthetic) {
		if (!isSynthetic)
			return store.getMask(id);
		if (pseudoLabels == null)
			throw new IllegalStateException("No pseudo-labels available for " + id);
		return pseudoLabels.get(id);
	}

	private BinaryMask getHull(String id) {
		return store.getHull(id).orElseThrow(() -> new IllegalStateException("No convex hull computed for " + id));
	}

	@Override
	public String toString() {
		return "TileSampler [fold=" + getFold() + ", training=" + training + ", " + config + "]";
	}


	/**
	 * Builder for a {@link TileSampler}.
	 */
	public static class Builder {

		private final WholeImageStore store;
		private final FoldAssignment folds;
		private final SamplingConfig config;

		private ExternalTileSource externalSource;
		private PseudoLabelPool pseudoLabelPool;
		private int fold = 0;

		/**
		 * Constructor.
		 * @param store labelled images
		 * @param folds fold assignment for the ids in the store
		 * @param config sampling parameters
		 */
		public Builder(WholeImageStore store, FoldAssignment folds, SamplingConfig config) {
			this.store = Objects.requireNonNull(store);
			this.folds = Objects.requireNonNull(folds);
			this.config = Objects.requireNonNull(config);
		}

		/**
		 * Set a source of external tiles, used with probability {@link SamplingConfig#getExternalProbability()}.
		 * @param source
		 * @return
		 */
		public Builder externalSource(ExternalTileSource source) {
			this.externalSource = source;
			return this;
		}

		/**
		 * Set pseudo-labelled images, used with probability {@link SamplingConfig#getPseudoLabelProbability()}.
		 * @param pool
		 * @return
		 */
		public Builder pseudoLabelPool(PseudoLabelPool pool) {
			this.pseudoLabelPool = pool;
			return this;
		}

		/**
		 * Set the initial fold (default 0).
		 * @param fold
		 * @return
		 */
		public Builder fold(int fold) {
			this.fold = fold;
			return this;
		}

		/**
		 * Build the sampler and activate the initial fold.
		 * @return
		 * @throws IOException if pseudo-labels cannot be read
		 * @throws IllegalArgumentException if an image in the fold assignment is not in the store, 
		 *                                  convex hulls are required but missing, 
		 *                                  or the external source has tiles smaller than the tile size
		 */
		public TileSampler build() throws IOException, IllegalArgumentException {
			for (var id : folds.getIds()) {
				if (!store.contains(id))
					throw new IllegalArgumentException("Image " + id + " is not in " + store);
				if (config.getMode().requiresConvexHulls() && store.getHull(id).isEmpty())
					throw new IllegalArgumentException("Sampling mode " + config.getMode() + " requires a convex hull for " + id);
			}
			if (externalSource != null) {
				int minSize = externalSource.getMinimumSize();
				if (minSize >= 0 && minSize < config.getTileSize())
					throw new IllegalArgumentException("External source " + externalSource + " has tiles of size " + minSize 
							+ ", smaller than the tile size " + config.getTileSize());
			}
			var seed = config.getSeed();
			var random = seed == null ? new MersenneTwister() : new MersenneTwister(seed);
			var sampler = new TileSampler(this, random);
			sampler.setFold(fold);
			return sampler;
		}

	}

}
