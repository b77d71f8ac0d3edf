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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

import org.apache.commons.lang3.StringUtils;

/**
 * {@link OperatorPrompt} on a text terminal. Options are printed as a numbered
 * list; the operator types an index or presses Enter to decline. End of input
 * counts as declining.
 */
public class ConsolePrompt implements OperatorPrompt {

	private final BufferedReader in;
	private final PrintStream out;

	public ConsolePrompt() {
		this(System.in, System.out);
	}

	public ConsolePrompt(InputStream in, PrintStream out) {
		this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		this.out = out;
	}

	@Override
	public OptionalInt presentOptions(String title, List<String> options) {
		if (options.isEmpty()) {
			return OptionalInt.empty();
		}
		out.println();
		out.println(title);
		for (int i = 0; i < options.size(); i++) {
			out.printf("  [%d] %s%n", i, options.get(i));
		}
		while (true) {
			Optional<String> answer = readLine("Enter an index, or press Enter to skip:");
			if (answer.isEmpty()) {
				return OptionalInt.empty();
			}
			try {
				int idx = Integer.parseInt(answer.get());
				if (idx >= 0 && idx < options.size()) {
					return OptionalInt.of(idx);
				}
				out.println("Index out of range: " + idx);
			} catch (NumberFormatException nfe) {
				out.println("Not a number: " + answer.get());
			}
		}
	}

	@Override
	public Optional<String> readLine(String message) {
		out.print(message + " ");
		out.flush();
		String line;
		try {
			line = in.readLine();
		} catch (IOException ioe) {
			throw new UncheckedIOException("Unable to read operator input", ioe);
		}
		return StringUtils.isBlank(line) ? Optional.empty() : Optional.of(line.trim());
	}

	@Override
	public boolean confirm(String question) {
		return readLine(question + " (y/N)")
				.map(s -> s.toLowerCase(Locale.ROOT))
				.map(s -> s.equals("y") || s.equals("yes"))
				.orElse(false);
	}

	@Override
	public void show(String message) {
		out.println(message);
	}
}
