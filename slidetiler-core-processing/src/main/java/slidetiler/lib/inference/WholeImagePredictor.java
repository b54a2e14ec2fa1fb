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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slidetiler.dnn.TilePredictor;
import slidetiler.lib.common.ThreadTools;
import slidetiler.lib.images.ImageTile;
import slidetiler.lib.images.WholeImage;
import slidetiler.lib.reconstruction.FlipAugmentation;
import slidetiler.lib.reconstruction.ProbabilityMap;
import slidetiler.lib.reconstruction.ReconstructionAccumulator;
import slidetiler.lib.regions.TileRect;
import slidetiler.lib.tiling.SlidingWindowPlanner;
import slidetiler.lib.tiling.TileWeightKernel;
import slidetiler.lib.tiling.WeightKernel;

/**
 * Predict a foreground probability map for a whole image by blending overlapping tile predictions.
 * <p>
 * Tiles are planned with a {@link SlidingWindowPlanner}, passed to the model in batches (in planning order), 
 * weighted with a {@link TileWeightKernel} and accumulated in a {@link ReconstructionAccumulator}.
 * When more than one thread is requested, each worker accumulates its own batches and 
 * the accumulators are merged once all batches are complete.
 * 
 * @author SlideTiler developers
 */
public class WholeImagePredictor {

	private static final Logger logger = LoggerFactory.getLogger(WholeImagePredictor.class);

	private final InferenceParameters params;
	private final WeightKernel kernel;

	/**
	 * Constructor.
	 * @param params
	 */
	public WholeImagePredictor(InferenceParameters params) {
		this.params = Objects.requireNonNull(params);
		this.kernel = TileWeightKernel.build(params.getFullResolutionTileSize(), 
				params.getKernelSigma(), params.getKernelAlpha(), TileWeightKernel.DEFAULT_EPS);
	}

	/**
	 * The parameters used for prediction.
	 * @return
	 */
	public InferenceParameters getParameters() {
		return params;
	}

	/**
	 * Predict the foreground probability of every pixel in an image.
	 * @param image the image
	 * @param model the model; must be thread-safe if more than one thread is used
	 * @return a map with the same size as the image
	 * @throws IllegalArgumentException if the model declares an unsupported number of classes, 
	 *                                  or the image is smaller than a tile
	 */
	public ProbabilityMap predict(WholeImage image, TilePredictor model) throws IllegalArgumentException {
		int nClasses = model.getNumClasses();
		if (nClasses != 1 && nClasses != 2)
			throw new IllegalArgumentException("Model must have 1 or 2 output classes, but has " + nClasses);

		long startTime = System.currentTimeMillis();
		int height = image.getHeight();
		int width = image.getWidth();
		var rects = SlidingWindowPlanner.plan(height, width, params.getFullResolutionTileSize(), params.getOverlapFactor());
		var batches = partition(rects, params.getBatchSize());
		int nWorkers = Math.min(params.getNumThreads(), batches.size());

		var accumulator = new ReconstructionAccumulator(height, width, rects.size());
		if (nWorkers <= 1) {
			for (var batch : batches)
				predictBatch(image, batch, model, accumulator);
		} else {
			for (var workerAccumulator : predictParallel(image, batches, model, nWorkers))
				accumulator.merge(workerAccumulator);
		}
		var map = accumulator.finalizeMap();
		logger.info("Predicted {} from {} tiles in {} batches ({} ms)", image.getId(), rects.size(), 
				batches.size(), System.currentTimeMillis() - startTime);
		return map;
	}

	private List<ReconstructionAccumulator> predictParallel(WholeImage image, List<List<TileRect>> batches, TilePredictor model, int nWorkers) {
		var pool = Executors.newFixedThreadPool(nWorkers, ThreadTools.createThreadFactory("tile-predictor-", true));
		try {
			List<Future<ReconstructionAccumulator>> futures = new ArrayList<>();
			for (int w = 0; w < nWorkers; w++) {
				int worker = w;
				futures.add(pool.submit(() -> {
					var accumulator = new ReconstructionAccumulator(image.getHeight(), image.getWidth());
					for (int b = worker; b < batches.size(); b += nWorkers)
						predictBatch(image, batches.get(b), model, accumulator);
					return accumulator;
				}));
			}
			List<ReconstructionAccumulator> accumulators = new ArrayList<>();
			for (var future : futures)
				accumulators.add(future.get());
			return accumulators;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while predicting " + image.getId(), e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException)
				throw (RuntimeException)e.getCause();
			throw new IllegalStateException("Prediction failed for " + image.getId(), e.getCause());
		} finally {
			pool.shutdownNow();
		}
	}

	private void predictBatch(WholeImage image, List<TileRect> batch, TilePredictor model, ReconstructionAccumulator accumulator) {
		int reduceFactor = params.getReduceFactor();
		List<ImageTile> tiles = batch.stream()
				.map(rect -> image.crop(rect).downsample(reduceFactor))
				.collect(Collectors.toList());
		List<float[][]> predictions;
		if (params.useTTA())
			predictions = FlipAugmentation.predictWithFlips(tiles, t -> predictForeground(model, t), FlipAugmentation.DEFAULT_FLIPS);
		else
			predictions = predictForeground(model, tiles);
		for (int i = 0; i < batch.size(); i++)
			accumulator.addTile(batch.get(i), upsample(predictions.get(i), reduceFactor), kernel);
		logger.debug("Predicted batch of {} tiles for {}", batch.size(), image.getId());
	}

	/**
	 * Run the model and extract the activated foreground channel.
	 */
	private List<float[][]> predictForeground(TilePredictor model, List<ImageTile> tiles) {
		var outputs = model.predict(tiles);
		if (outputs.size() != tiles.size())
			throw new IllegalStateException("Model returned " + outputs.size() + " outputs for " + tiles.size() + " tiles");
		var activation = params.getActivation();
		List<float[][]> foreground = new ArrayList<>(outputs.size());
		for (int i = 0; i < outputs.size(); i++) {
			var tile = tiles.get(i);
			var output = outputs.get(i);
			if (output.length == 0 || output[0].length != tile.getHeight() || output[0][0].length != tile.getWidth())
				throw new IllegalStateException("Model output does not match " + tile);
			float[][] channel = output[0];
			float[][] values = new float[channel.length][];
			for (int x = 0; x < channel.length; x++) {
				values[x] = new float[channel[x].length];
				for (int y = 0; y < channel[x].length; y++)
					values[x][y] = activation.apply(channel[x][y]);
			}
			foreground.add(values);
		}
		return foreground;
	}

	/**
	 * Upsample by replicating each value in a {@code factor x factor} block.
	 */
	static float[][] upsample(float[][] values, int factor) {
		if (factor == 1)
			return values;
		int h = values.length;
		int w = values[0].length;
		float[][] output = new float[h * factor][w * factor];
		for (int x = 0; x < h * factor; x++) {
			float[] source = values[x / factor];
			float[] target = output[x];
			for (int y = 0; y < w * factor; y++)
				target[y] = source[y / factor];
		}
		return output;
	}

	private static <T> List<List<T>> partition(List<T> list, int size) {
		List<List<T>> batches = new ArrayList<>();
		for (int i = 0; i < list.size(); i += size)
			batches.add(list.subList(i, Math.min(list.size(), i + size)));
		return batches;
	}

}
