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

package slidetiler.lib.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Helper class providing shared Gson instances, and reading and writing configuration files.
 * <p>
 * Configuration classes are read by reflection. Fields missing from a file keep the values
 * assigned by the no-argument constructor of the class.
 * 
 * @author SlideTiler developers
 */
public final class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient();

	// Suppress default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Get the default Gson instance.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 * 
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

	/**
	 * Read an object from a JSON file.
	 * @param <T>
	 * @param path the file to read
	 * @param cls the class of the object
	 * @return
	 * @throws IOException if the file cannot be read, is empty or does not contain valid JSON
	 */
	public static <T> T readJson(Path path, Class<T> cls) throws IOException {
		logger.debug("Reading {} from {}", cls.getSimpleName(), path);
		try (var reader = Files.newBufferedReader(path)) {
			T result = getInstance().fromJson(reader, cls);
			if (result == null)
				throw new IOException("No " + cls.getSimpleName() + " found in " + path);
			return result;
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse " + path, e);
		}
	}

	/**
	 * Write an object to a JSON file, using pretty printing.
	 * @param path the file to write
	 * @param object the object to write
	 * @throws IOException if the file cannot be written
	 */
	public static void writeJson(Path path, Object object) throws IOException {
		logger.debug("Writing {} to {}", object.getClass().getSimpleName(), path);
		try (var writer = Files.newBufferedWriter(path)) {
			getInstance(true).toJson(object, writer);
		}
	}

}
