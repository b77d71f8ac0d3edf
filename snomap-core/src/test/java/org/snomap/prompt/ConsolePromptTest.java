package org.snomap.prompt;

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

class ConsolePromptTest {

	private final ByteArrayOutputStream printed = new ByteArrayOutputStream();

	private ConsolePrompt prompt(String typed) {
		return new ConsolePrompt(new ByteArrayInputStream(typed.getBytes(StandardCharsets.UTF_8)),
				new PrintStream(printed, true, StandardCharsets.UTF_8));
	}

	private String output() {
		return printed.toString(StandardCharsets.UTF_8);
	}

	@Test
	void options_are_numbered_and_invalid_answers_asked_again() {
		ConsolePrompt p = prompt("x\n7\n1\n");

		OptionalInt idx = p.presentOptions("Pick one", List.of("Asthma (1)", "Fever (4)"));

		assertEquals(OptionalInt.of(1), idx);
		String out = output();
		assertTrue(out.contains("Pick one"));
		assertTrue(out.contains("  [0] Asthma (1)"));
		assertTrue(out.contains("  [1] Fever (4)"));
		assertTrue(out.contains("Not a number: x"));
		assertTrue(out.contains("Index out of range: 7"));
	}

	@Test
	void blank_line_or_end_of_input_declines() {
		assertEquals(OptionalInt.empty(), prompt("   \n").presentOptions("Pick", List.of("a")));
		assertEquals(OptionalInt.empty(), prompt("").presentOptions("Pick", List.of("a")));
		assertEquals(Optional.empty(), prompt("").readLine("CUI?"));
	}

	@Test
	void empty_option_list_asks_nothing() {
		ConsolePrompt p = prompt("0\n");

		assertEquals(OptionalInt.empty(), p.presentOptions("Pick", List.of()));
		assertEquals(Optional.of("0"), p.readLine("still unread"));
	}

	@Test
	void lines_are_trimmed() {
		assertEquals(Optional.of("195967001"), prompt("  195967001 \n").readLine("CUI?"));
	}

	@Test
	void confirmation_needs_an_explicit_yes() {
		assertTrue(prompt("y\n").confirm("Sure?"));
		assertTrue(prompt("YES\n").confirm("Sure?"));
		assertFalse(prompt("no\n").confirm("Sure?"));
		assertFalse(prompt("\n").confirm("Sure?"));
		assertTrue(output().contains("Sure? (y/N)"));
	}
}
