package org.snomap.util;

/*
 * This file is part of SnoMap.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * SnoMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SnoMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SnoMap.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoggerTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();
	private Logger.Level prior;

	@BeforeEach
	void capture() {
		prior = Logger.getLevel();
		Logger.redirect(new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void restore() {
		Logger.redirect(null, null);
		Logger.setLevel(prior);
	}

	@Test
	void placeholders_are_filled_in_order() {
		assertEquals("a 1 b 2", Logger.format("a {} b {}", 1, 2));
		assertEquals("a 1 {}", Logger.format("a {} {}", 1));
		assertEquals("a 1 extra", Logger.format("a {}", 1, "extra"));
		assertEquals("a null", Logger.format("a {}", (Object) null));
		assertEquals("plain", Logger.format("plain"));
	}

	@Test
	void warnings_go_to_the_error_stream() {
		Logger.setLevel(Logger.Level.INFO);

		Logger.info("loaded {} releases", 2);
		Logger.warn("blank {}", "RELEASE_VARIANT");

		assertTrue(out.toString(StandardCharsets.UTF_8).contains("INFO loaded 2 releases"));
		assertTrue(err.toString(StandardCharsets.UTF_8).contains("WARN blank RELEASE_VARIANT"));
	}

	@Test
	void levels_below_the_threshold_are_dropped() {
		Logger.setLevel(Logger.Level.WARN);

		Logger.info("hidden");
		Logger.debug("hidden");

		assertEquals("", out.toString(StandardCharsets.UTF_8));
		assertFalse(Logger.isEnabled(Logger.Level.INFO));
		assertTrue(Logger.isEnabled(Logger.Level.ERROR));
	}

	@Test
	void trailing_throwable_prints_its_stack_trace() {
		Logger.error("failed {}", "load", new IllegalStateException("boom"));

		String text = err.toString(StandardCharsets.UTF_8);
		assertTrue(text.contains("ERROR failed load"));
		assertTrue(text.contains("java.lang.IllegalStateException: boom"));
	}
}
