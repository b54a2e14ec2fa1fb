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

package slidetiler.lib.common;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {

	@Test
	public void testBlankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("", false));
		assertFalse(GeneralTools.blankString("  ", false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertFalse(GeneralTools.blankString(" a ", true));
	}

	@Test
	public void testClipValue() {
		assertEquals(5, GeneralTools.clipValue(5, 0, 10));
		assertEquals(0, GeneralTools.clipValue(-5, 0, 10));
		assertEquals(10, GeneralTools.clipValue(15, 0, 10));
		assertEquals(1e-3, GeneralTools.clipValue(1e-6, 1e-3, 1.0));
		assertEquals(1.0, GeneralTools.clipValue(1.5, 1e-3, 1.0));
		assertEquals(0.5, GeneralTools.clipValue(0.5, 1e-3, 1.0));
	}

	@Test
	public void testRound() {
		assertEquals(0.333, GeneralTools.round(1.0 / 3.0, 3));
		assertEquals(0.667, GeneralTools.round(2.0 / 3.0, 3));
		assertEquals(1.0, GeneralTools.round(0.99999, 3));
		assertEquals(0.001, GeneralTools.round(0.001, 3));
		assertEquals(2.0, GeneralTools.round(2.5, 0));
		assertEquals(4.0, GeneralTools.round(3.5, 0));
	}

	@Test
	public void testRequireProbability() {
		assertEquals(0.0, GeneralTools.requireProbability("p", 0));
		assertEquals(1.0, GeneralTools.requireProbability("p", 1));
		assertThrows(IllegalArgumentException.class, () -> GeneralTools.requireProbability("p", -0.1));
		assertThrows(IllegalArgumentException.class, () -> GeneralTools.requireProbability("p", 1.1));
		assertThrows(IllegalArgumentException.class, () -> GeneralTools.requireProbability("p", Double.NaN));
	}

}
