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

/**
 * A collection of generally-useful static methods.
 * 
 * @author SlideTiler developers
 */
public final class GeneralTools {

	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Check if a string is null or empty, optionally ignoring whitespace.
	 * 
	 * @param s The string to check.
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}

	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Round a value to a fixed number of decimal places.
	 * <p>
	 * The value is scaled, rounded with {@link Math#rint(double)} (so ties go to the even neighbor) and scaled back.
	 * 
	 * @param value
	 * @param nDecimalPlaces
	 * @return
	 */
	public static double round(final double value, final int nDecimalPlaces) {
		double scale = Math.pow(10, nDecimalPlaces);
		return Math.rint(value * scale) / scale;
	}

	/**
	 * Check that a probability is within the range [0, 1].
	 * @param name name of the parameter, used in the exception message
	 * @param probability
	 * @return the probability
	 * @throws IllegalArgumentException if the value is outside [0, 1] or NaN
	 */
	public static double requireProbability(final String name, final double probability) throws IllegalArgumentException {
		if (!(probability >= 0 && probability <= 1))
			throw new IllegalArgumentException(name + " must be between 0 and 1, but was " + probability);
		return probability;
	}

}
