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
 * One naming row of a SNOMED concept: a concept id joined with one of its
 * active descriptions. A concept has exactly one {@link NameStatus#PRIMARY}
 * row and any number of {@link NameStatus#ALTERNATE} rows, possibly spread
 * over several releases.
 */
@Data
public class Concept {

	/** Concept id. */
	private final long cui;

	/** Id of the description row this name came from. */
	private final long descriptionId;

	private final String name;

	private final NameStatus nameStatus;

	/**
	 * Semantic tag taken from the trailing parenthetical of a primary name, e.g.
	 * {@code disorder} for "Asthma (disorder)". Empty for alternates and for
	 * primary names without a tag.
	 */
	private final String descriptionType;

	/** Release (directory name) the row was loaded from. */
	private final String release;

	public boolean isPrimary() {
		return nameStatus == NameStatus.PRIMARY;
	}
}
