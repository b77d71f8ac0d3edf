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

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Port between the mapping workflow and whoever makes the decisions: a
 * terminal, a scripted test double, a future UI. Workflow code depends on this
 * interface only.
 */
public interface OperatorPrompt {

	/**
	 * Shows {@code options} under {@code title} and returns the zero-based
	 * index the operator picked, or empty if they declined.
	 */
	OptionalInt presentOptions(String title, List<String> options);

	/** Asks for free text; empty when the operator enters nothing. */
	Optional<String> readLine(String message);

	/** Yes/no question. Anything but an explicit yes is a no. */
	boolean confirm(String question);

	/** Informational output that needs no answer. */
	void show(String message);
}
