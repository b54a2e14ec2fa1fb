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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import slidetiler.lib.inference.InferenceParameters.Activation;
import slidetiler.lib.tiling.TileWeightKernel;

@SuppressWarnings("javadoc")
public class TestInferenceParameters {

	@Test
	public void testDefaults() {
		var params = new InferenceParameters.Builder(256).build();
		assertEquals(256, params.getTileSize());
		assertEquals(1, params.getReduceFactor());
		assertEquals(256, params.getFullResolutionTileSize());
		assertEquals(1.0, params.getOverlapFactor());
		assertFalse(params.useTTA());
		assertEquals(Activation.SIGMOID, params.getActivation());
		assertEquals(TileWeightKernel.DEFAULT_SIGMA, params.getKernelSigma());
		assertEquals(TileWeightKernel.DEFAULT_ALPHA, params.getKernelAlpha());
		assertEquals(1, params.getNumThreads());
	}

	@Test
	public void testInvalid() {
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(0).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).reduceFactor(0).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).overlapFactor(0.5).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).batchSize(0).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).nThreads(0).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).activation(null).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).kernel(1, 0).build());
		assertThrows(IllegalArgumentException.class, () -> new InferenceParameters.Builder(256).kernel(-1, 1).build());
	}

	@Test
	public void testJson(@TempDir Path dir) throws IOException {
		var path = dir.resolve("inference.json");
		Files.writeString(path, "{\"tileSize\": 128, \"reduceFactor\": 4, \"overlapFactor\": 2, \"tta\": true, \"activation\": \"NONE\"}");
		var params = InferenceParameters.readJson(path);
		assertEquals(512, params.getFullResolutionTileSize());
		assertEquals(2.0, params.getOverlapFactor());
		assertTrue(params.useTTA());
		assertEquals(Activation.NONE, params.getActivation());
		assertEquals(32, params.getBatchSize());

		var invalid = dir.resolve("invalid.json");
		Files.writeString(invalid, "{\"tileSize\": 128, \"kernelAlpha\": 2}");
		assertThrows(IllegalArgumentException.class, () -> InferenceParameters.readJson(invalid));
	}

}
