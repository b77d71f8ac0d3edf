package org.snomap.snomed;

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

import lombok.Data;

/**
 * Primary row of an ancestor together with its distance, in is-a hops, from
 * the concept the traversal started at.
 */
@Data
public class AncestorConcept {

	private final Concept concept;
	private final int level;

	public long getCui() {
		return concept.getCui();
	}

	public String getName() {
		return concept.getName();
	}
}
