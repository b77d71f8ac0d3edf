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

import java.util.Optional;

/** Outcome of grouping one condition. */
public final class GroupingDecision {

	private static final GroupingDecision NONE = new GroupingDecision(GroupingStep.NONE, null);

	private final GroupingStep step;
	private final Long groupingCui;

	private GroupingDecision(GroupingStep step, Long groupingCui) {
		this.step = step;
		this.groupingCui = groupingCui;
	}

	static GroupingDecision assigned(GroupingStep step, long groupingCui) {
		return new GroupingDecision(step, groupingCui);
	}

	static GroupingDecision none() {
		return NONE;
	}

	public GroupingStep getStep() {
		return step;
	}

	/** The chosen grouping; empty when the operator declined. */
	public Optional<Long> getGroupingCui() {
		return Optional.ofNullable(groupingCui);
	}

	public boolean isAssigned() {
		return groupingCui != null;
	}

	@Override
	public String toString() {
		return isAssigned() ? step + "(" + groupingCui + ")" : step.toString();
	}
}
