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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * {@link OperatorPrompt} test double fed from a script. Each call consumes the
 * next scripted answer; {@code null} (or an exhausted script) means the
 * operator declined. Every title and question asked is recorded.
 */
public class ScriptedPrompt implements OperatorPrompt {

	private final Deque<Object> answers = new ArrayDeque<>();
	private final List<String> asked = new ArrayList<>();
	private final List<List<String>> optionLists = new ArrayList<>();
	private final List<String> shown = new ArrayList<>();

	/** Answer for the next {@link #presentOptions}: an index, or {@code null} to decline. */
	public ScriptedPrompt pick(Integer index) {
		answers.add(index == null ? Skip.INSTANCE : index);
		return this;
	}

	/** Answer for the next {@link #readLine}: text, or {@code null} for blank input. */
	public ScriptedPrompt type(String text) {
		answers.add(text == null ? Skip.INSTANCE : text);
		return this;
	}

	/** Answer for the next {@link #confirm}. */
	public ScriptedPrompt answer(boolean yes) {
		answers.add(yes);
		return this;
	}

	@Override
	public OptionalInt presentOptions(String title, List<String> options) {
		asked.add(title);
		optionLists.add(List.copyOf(options));
		Object next = next();
		return (next instanceof Integer) ? OptionalInt.of((Integer) next) : OptionalInt.empty();
	}

	@Override
	public Optional<String> readLine(String message) {
		asked.add(message);
		Object next = next();
		return (next instanceof String) ? Optional.of((String) next) : Optional.empty();
	}

	@Override
	public boolean confirm(String question) {
		asked.add(question);
		Object next = next();
		return Boolean.TRUE.equals(next);
	}

	@Override
	public void show(String message) {
		shown.add(message);
	}

	public List<String> getAsked() {
		return asked;
	}

	public List<List<String>> getOptionLists() {
		return optionLists;
	}

	public List<String> getShown() {
		return shown;
	}

	public boolean isExhausted() {
		return answers.isEmpty();
	}

	private Object next() {
		return answers.isEmpty() ? Skip.INSTANCE : answers.poll();
	}

	private enum Skip {
		INSTANCE
	}
}
