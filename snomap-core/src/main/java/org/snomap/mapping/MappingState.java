package org.snomap.mapping;

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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The three-tier mapping of one freetext input list:
 *
 * <pre>
 *   string --(string to condition)--> condition cui --(condition to grouping)--> grouping cui
 * </pre>
 *
 * <ul>
 * <li>Every input string is either unresolved or mapped to a condition, never
 * both.</li>
 * <li>Only mapped conditions can be grouped.</li>
 * <li>The known groupings are exactly the values of the condition-to-grouping
 * map; a condition may be its own grouping.</li>
 * </ul>
 *
 * Not thread-safe: a state belongs to a single mapping session.
 */
public class MappingState {

	private final Set<String> unresolved;
	private final Map<String, Long> stringToCondition;
	private final Map<Long, Long> conditionToGrouping;

	/** Fresh state: every input string unresolved. */
	public MappingState(Collection<String> strings) {
		this(strings, Map.of(), Map.of());
	}

	/**
	 * Restores a state, e.g. from a snapshot.
	 *
	 * @throws IllegalArgumentException if the inputs break the partition or
	 *                                  grouping invariants
	 */
	public MappingState(Collection<String> unresolved, Map<String, Long> stringToCondition,
			Map<Long, Long> conditionToGrouping) {
		this.unresolved = new LinkedHashSet<>(unresolved);
		this.stringToCondition = new LinkedHashMap<>(stringToCondition);
		this.conditionToGrouping = new LinkedHashMap<>(conditionToGrouping);

		for (String s : this.stringToCondition.keySet()) {
			if (this.unresolved.contains(s)) {
				throw new IllegalArgumentException("String is both unresolved and mapped: '" + s + "'");
			}
		}
		Set<Long> conditions = knownConditionCuis();
		for (Long c : this.conditionToGrouping.keySet()) {
			if (!conditions.contains(c)) {
				throw new IllegalArgumentException("Grouped cui " + c + " is not a mapped condition");
			}
		}
	}

	// ---- Transitions --------------------------------------------------------

	/**
	 * Moves {@code string} from unresolved to mapped. The cui is not checked
	 * against any terminology; that is the caller's job.
	 *
	 * @throws UnknownStringException if {@code string} is not unresolved
	 */
	public void resolve(String string, long cui) {
		if (!unresolved.remove(string)) {
			throw new UnknownStringException(string);
		}
		stringToCondition.put(string, cui);
	}

	/**
	 * Sets (or replaces) the grouping of a mapped condition. The grouping need
	 * not itself be a mapped condition.
	 *
	 * @throws IllegalArgumentException if {@code conditionCui} is not mapped
	 *                                  from any string
	 */
	public void assignGrouping(long conditionCui, long groupingCui) {
		if (!stringToCondition.containsValue(conditionCui)) {
			throw new IllegalArgumentException("Cui " + conditionCui + " is not a mapped condition");
		}
		conditionToGrouping.put(conditionCui, groupingCui);
	}

	// ---- Queries ------------------------------------------------------------

	public boolean isUnresolved(String string) {
		return unresolved.contains(string);
	}

	public boolean isKnownGrouping(long cui) {
		return conditionToGrouping.containsValue(cui);
	}

	public boolean isGrouped(long conditionCui) {
		return conditionToGrouping.containsKey(conditionCui);
	}

	/** Unresolved strings in input order. */
	public Set<String> getUnresolved() {
		return Collections.unmodifiableSet(unresolved);
	}

	public Map<String, Long> getStringToCondition() {
		return Collections.unmodifiableMap(stringToCondition);
	}

	public Map<Long, Long> getConditionToGrouping() {
		return Collections.unmodifiableMap(conditionToGrouping);
	}

	/** Distinct mapped condition cuis, ascending. */
	public SortedSet<Long> knownConditionCuis() {
		return new TreeSet<>(stringToCondition.values());
	}

	/** Distinct grouping cuis, ascending. */
	public SortedSet<Long> knownGroupingCuis() {
		return new TreeSet<>(conditionToGrouping.values());
	}

	/** Mapped conditions with no grouping yet, ascending. */
	public SortedSet<Long> ungroupedConditionCuis() {
		SortedSet<Long> out = knownConditionCuis();
		out.removeAll(conditionToGrouping.keySet());
		return out;
	}

	public Map<Long, List<String>> conditionToStrings() {
		Map<Long, List<String>> out = new TreeMap<>();
		stringToCondition.forEach((s, c) -> out.computeIfAbsent(c, k -> new ArrayList<>()).add(s));
		return out;
	}

	public Map<Long, List<Long>> groupingToConditions() {
		Map<Long, List<Long>> out = new TreeMap<>();
		conditionToGrouping.forEach((c, g) -> out.computeIfAbsent(g, k -> new ArrayList<>()).add(c));
		return out;
	}

	public Map<Long, List<String>> groupingToStrings() {
		Map<Long, List<String>> byCondition = conditionToStrings();
		Map<Long, List<String>> out = new TreeMap<>();
		groupingToConditions().forEach((g, conditions) -> {
			List<String> strings = out.computeIfAbsent(g, k -> new ArrayList<>());
			conditions.forEach(c -> strings.addAll(byCondition.getOrDefault(c, List.of())));
		});
		return out;
	}

	/** Grouping of every mapped string; {@code -1} where the condition is ungrouped. */
	public Map<String, Long> stringToGrouping() {
		Map<String, Long> out = new LinkedHashMap<>();
		stringToCondition.forEach((s, c) -> out.put(s, conditionToGrouping.getOrDefault(c, -1L)));
		return out;
	}

	public MappingState copy() {
		return new MappingState(unresolved, stringToCondition, conditionToGrouping);
	}

	// ---- Object -------------------------------------------------------------

	/** Equal when the unresolved set and both maps are equal; order is ignored. */
	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof MappingState))
			return false;
		MappingState other = (MappingState) o;
		return unresolved.equals(other.unresolved) && stringToCondition.equals(other.stringToCondition)
				&& conditionToGrouping.equals(other.conditionToGrouping);
	}

	@Override
	public int hashCode() {
		return Objects.hash(unresolved, stringToCondition, conditionToGrouping);
	}

	@Override
	public String toString() {
		return "MappingState with " + unresolved.size() + " unknown strings, " + stringToCondition.size()
				+ " known strings, " + knownConditionCuis().size() + " conditions and "
				+ knownGroupingCuis().size() + " groupings";
	}
}
