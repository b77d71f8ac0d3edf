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

import java.util.Objects;

import org.snomap.mapping.MappingState;
import org.snomap.prompt.OperatorPrompt;
import org.snomap.snomed.SnomedQueryEngine;
import org.snomap.util.Logger;

/**
 * Groups every mapped condition that has no grouping yet, one at a time, in
 * ascending cui order.
 *
 * A condition whose workflow ends without a choice is left ungrouped and the
 * operator is asked whether to abort the whole session. Only completed
 * decisions are written, so aborting leaves the state exactly as it was
 * before the aborted condition.
 */
public class GroupingSession {

	private final MappingState state;
	private final GroupingWorkflow workflow;
	private final OperatorPrompt prompt;

	public GroupingSession(MappingState state, SnomedQueryEngine snomed, OperatorPrompt prompt) {
		this(state, new GroupingWorkflow(snomed, prompt), prompt);
	}

	GroupingSession(MappingState state, GroupingWorkflow workflow, OperatorPrompt prompt) {
		this.state = Objects.requireNonNull(state, "state must not be null");
		this.workflow = workflow;
		this.prompt = prompt;
	}

	public GroupingSummary groupConditions() {
		int groupingsBefore = state.knownGroupingCuis().size();
		int assigned = 0;
		int skipped = 0;
		boolean aborted = false;

		for (long cui : state.ungroupedConditionCuis()) {
			GroupingDecision decision = workflow.selectGrouping(cui, state);
			if (decision.isAssigned()) {
				long grouping = decision.getGroupingCui().get();
				state.assignGrouping(cui, grouping);
				assigned++;
				Logger.debug("Condition {} grouped under {} ({})", cui, grouping, decision.getStep());
			} else {
				skipped++;
				if (prompt.confirm("Abort grouping?")) {
					aborted = true;
					break;
				}
			}
		}

		int created = state.knownGroupingCuis().size() - groupingsBefore;
		Logger.info("{} new groupings created.", created);
		Logger.info("{} new condition -> grouping mappings created.", assigned);
		return new GroupingSummary(created, assigned, skipped, aborted);
	}
}
