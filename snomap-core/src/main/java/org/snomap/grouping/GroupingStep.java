package org.snomap.grouping;

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

/** Where in the grouping procedure a decision was reached. */
public enum GroupingStep {

	/** The condition is already used as a grouping; it groups itself. */
	ALREADY_A_GROUPING,

	/** Operator picked an ancestor that is already a grouping. */
	KNOWN_ANCESTOR,

	/** Operator picked from the full ancestor list (or the condition itself). */
	ANCESTOR,

	/** Operator picked an existing grouping outside the ancestry. */
	EXISTING_GROUPING,

	/** Operator typed a cui. */
	MANUAL,

	/** Operator declined every step. */
	NONE
}
