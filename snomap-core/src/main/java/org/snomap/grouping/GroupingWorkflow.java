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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import org.snomap.mapping.MappingState;
import org.snomap.prompt.OperatorPrompt;
import org.snomap.snomed.AncestorConcept;
import org.snomap.snomed.Concept;
import org.snomap.snomed.SnomedQueryEngine;

/**
 * Chooses a grouping for one condition.
 *
 * <ol>
 * <li>If the condition is already used as a grouping, it groups itself; the
 * operator is not asked.</li>
 * <li>Ancestors that are already groupings are offered as suggestions. Being
 * an existing grouping is not enough to pick one automatically: an operator
 * may want Bronchiolitis on its own even though Lower respiratory tract
 * infection is an ancestor and a grouping.</li>
 * <li>The full ancestor list is offered, with the condition itself at level
 * 0.</li>
 * <li>All existing groupings are offered, ancestors or not.</li>
 * <li>The operator may type any cui.</li>
 * </ol>
 *
 * Each step ends the procedure when the operator picks something and falls
 * through to the next when they decline. The workflow only reads the mapping
 * state; recording the decision is up to the caller.
 */
public class GroupingWorkflow {

	private final SnomedQueryEngine snomed;
	private final OperatorPrompt prompt;

	public GroupingWorkflow(SnomedQueryEngine snomed, OperatorPrompt prompt) {
		this.snomed = Objects.requireNonNull(snomed, "snomed must not be null");
		this.prompt = Objects.requireNonNull(prompt, "prompt must not be null");
	}

	public GroupingDecision selectGrouping(long cui, MappingState state) {
		// 1
		if (state.isKnownGrouping(cui)) {
			return GroupingDecision.assigned(GroupingStep.ALREADY_A_GROUPING, cui);
		}

		Concept condition = snomed.primaryConcept(cui);
		List<AncestorConcept> ancestors = snomed.ancestors(cui);

		// 2
		List<AncestorConcept> knownAncestors = ancestors.stream()
				.filter(a -> state.isKnownGrouping(a.getCui()))
				.collect(Collectors.toList());
		if (!knownAncestors.isEmpty()) {
			OptionalInt idx = prompt.presentOptions(
					"Select grouping for " + condition.getName() + ". Ancestors already used as groupings:",
					labels(knownAncestors));
			if (idx.isPresent()) {
				return GroupingDecision.assigned(GroupingStep.KNOWN_ANCESTOR, knownAncestors.get(idx.getAsInt()).getCui());
			}
		}

		// 3
		List<AncestorConcept> withSelf = new ArrayList<>(ancestors.size() + 1);
		withSelf.add(new AncestorConcept(condition, 0));
		withSelf.addAll(ancestors);
		OptionalInt idx = prompt.presentOptions("Select grouping for " + condition.getName()
				+ ". All ancestors (index 0 is the concept itself):", labels(withSelf));
		if (idx.isPresent()) {
			return GroupingDecision.assigned(GroupingStep.ANCESTOR, withSelf.get(idx.getAsInt()).getCui());
		}

		// 4
		List<Long> groupings = new ArrayList<>(state.knownGroupingCuis());
		if (!groupings.isEmpty()) {
			List<String> labels = groupings.stream().map(this::label).collect(Collectors.toList());
			idx = prompt.presentOptions("Select grouping for " + condition.getName() + ". All existing groupings:",
					labels);
			if (idx.isPresent()) {
				return GroupingDecision.assigned(GroupingStep.EXISTING_GROUPING, groupings.get(idx.getAsInt()));
			}
		}

		// 5
		return readManualCui(condition)
				.map(g -> GroupingDecision.assigned(GroupingStep.MANUAL, g))
				.orElse(GroupingDecision.none());
	}

	// ---- Internals ----------------------------------------------------------

	private Optional<Long> readManualCui(Concept condition) {
		while (true) {
			Optional<String> answer = prompt.readLine(
					"Manual grouping entry for " + condition.getName() + ". Enter a grouping CUI, or press Enter to skip:");
			if (answer.isEmpty()) {
				return Optional.empty();
			}
			try {
				long g = Long.parseLong(answer.get().trim());
				if (snomed.contains(g)) {
					return Optional.of(g);
				}
				prompt.show(g + " is not a concept in the loaded releases");
			} catch (NumberFormatException nfe) {
				prompt.show(answer.get() + " is not a valid CUI");
			}
		}
	}

	private static List<String> labels(List<AncestorConcept> ancestors) {
		return ancestors.stream()
				.map(a -> a.getName() + " (" + a.getCui() + ") level " + a.getLevel())
				.collect(Collectors.toList());
	}

	private String label(long cui) {
		String name = snomed.contains(cui) ? snomed.primaryConcept(cui).getName() : "Unknown";
		return name + " (" + cui + ")";
	}
}
