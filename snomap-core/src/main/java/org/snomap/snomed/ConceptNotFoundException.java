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

/**
 * Raised only by the by-name convenience lookups, where the caller asked for a
 * single concept and the name does not resolve to exactly one.
 */
public class ConceptNotFoundException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String name;

	public ConceptNotFoundException(String name) {
		super("No unique concept found with name " + name);
		this.name = name;
	}

	public String getName() {
		return name;
	}
}
