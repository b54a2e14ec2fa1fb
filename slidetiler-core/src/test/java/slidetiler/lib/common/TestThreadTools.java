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
public class TestThreadTools {

	@Test
	public void testThreadFactory() {
		var factory = ThreadTools.createThreadFactory("worker-", true);
		var first = factory.newThread(() -> {});
		var second = factory.newThread(() -> {});
		assertEquals("worker-1", first.getName());
		assertEquals("worker-2", second.getName());
		assertTrue(first.isDaemon());
		assertEquals(Thread.NORM_PRIORITY, first.getPriority());

		var low = ThreadTools.createThreadFactory("low-", false, Thread.MIN_PRIORITY - 5).newThread(() -> {});
		assertFalse(low.isDaemon());
		assertEquals(Thread.MIN_PRIORITY, low.getPriority());
	}

}
