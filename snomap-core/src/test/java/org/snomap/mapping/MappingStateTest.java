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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class MappingStateTest {

	/** "asthma" and "wheezy chest" both map to 1, grouped under 3; "fever" maps to 2 and is ungrouped. */
	private static MappingState sample() {
		Map<String, Long> strings = new LinkedHashMap<>();
		strings.put("asthma", 1L);
		strings.put("wheezy chest", 1L);
		strings.put("fever", 2L);
		return new MappingState(List.of("sore thing"), strings, Map.of(1L, 3L));
	}

	@Test
	void fresh_state_has_everything_unresolved() {
		MappingState s = new MappingState(List.of("asthma", "wheeze"));

		assertEquals(Set.of("asthma", "wheeze"), s.getUnresolved());
		assertTrue(s.getStringToCondition().isEmpty());
		assertTrue(s.getConditionToGrouping().isEmpty());
		assertTrue(s.knownGroupingCuis().isEmpty());
	}

	@Test
	void resolving_moves_a_string_out_of_unresolved() {
		MappingState s = new MappingState(List.of("asthma", "wheeze"));

		s.resolve("asthma", 1L);

		assertEquals(Set.of("wheeze"), s.getUnresolved());
		assertEquals(Map.of("asthma", 1L), s.getStringToCondition());
		assertFalse(s.isUnresolved("asthma"));
	}

	@Test
	void resolving_an_unknown_or_mapped_string_fails() {
		MappingState s = new MappingState(List.of("asthma"));
		s.resolve("asthma", 1L);

		UnknownStringException ex = assertThrows(UnknownStringException.class, () -> s.resolve("asthma", 2L));
		assertEquals("asthma", ex.getString());
		assertThrows(UnknownStringException.class, () -> s.resolve("never seen", 2L));
		assertEquals(Map.of("asthma", 1L), s.getStringToCondition(), "failed resolve changes nothing");
	}

	@Test
	void grouping_a_condition_records_it_as_a_known_grouping() {
		MappingState s = new MappingState(List.of("asthma"));
		s.resolve("asthma", 1L);

		s.assignGrouping(1L, 3L);

		assertEquals(Map.of(1L, 3L), s.getConditionToGrouping());
		assertEquals(Set.of(3L), s.knownGroupingCuis());
		assertTrue(s.isKnownGrouping(3L));
		assertTrue(s.isGrouped(1L));
		assertFalse(s.isKnownGrouping(1L));
	}

	@Test
	void a_condition_may_be_its_own_grouping() {
		MappingState s = new MappingState(List.of("asthma"));
		s.resolve("asthma", 1L);

		s.assignGrouping(1L, 1L);

		assertTrue(s.isKnownGrouping(1L));
		assertTrue(s.ungroupedConditionCuis().isEmpty());
	}

	@Test
	void assignGrouping_isIdempotentAndSharesGroupings() {
		MappingState once = new MappingState(List.of("asthma", "bronchial asthma"));
		once.resolve("asthma", 1L);
		once.resolve("bronchial asthma", 2L);
		MappingState twice = once.copy();

		once.assignGrouping(1L, 1L);
		twice.assignGrouping(1L, 1L);
		twice.assignGrouping(1L, 1L);
		assertEquals(once, twice);

		twice.assignGrouping(2L, 1L);
		assertEquals(Set.of(1L), twice.knownGroupingCuis());
		assertEquals(Map.of(1L, 1L, 2L, 1L), twice.getConditionToGrouping());
		assertEquals(Map.of(1L, List.of(1L, 2L)), twice.groupingToConditions());
	}

	@Test
	void assignGrouping_replacesAnEarlierGrouping() {
		MappingState s = new MappingState(List.of("asthma", "fever"));
		s.resolve("asthma", 1L);
		s.resolve("fever", 2L);
		s.assignGrouping(1L, 3L);
		s.assignGrouping(2L, 3L);

		s.assignGrouping(1L, 5L);

		assertEquals(Map.of(1L, 5L, 2L, 3L), s.getConditionToGrouping());
		assertEquals(Set.of(3L, 5L), s.knownGroupingCuis());
		assertFalse(s.isKnownGrouping(4L));
	}

	@Test
	void only_mapped_conditions_can_be_grouped() {
		MappingState s = new MappingState(List.of("asthma"));

		assertThrows(IllegalArgumentException.class, () -> s.assignGrouping(1L, 3L));
		assertTrue(s.getConditionToGrouping().isEmpty());
	}

	@Test
	void restoring_rejects_broken_invariants() {
		assertThrows(IllegalArgumentException.class,
				() -> new MappingState(List.of("asthma"), Map.of("asthma", 1L), Map.of()));
		assertThrows(IllegalArgumentException.class,
				() -> new MappingState(List.of(), Map.of("asthma", 1L), Map.of(2L, 3L)));
	}

	@Test
	void derived_views_follow_the_maps() {
		MappingState s = sample();

		assertEquals(Set.of(1L, 2L), s.knownConditionCuis());
		assertEquals(Set.of(3L), s.knownGroupingCuis());
		assertEquals(Set.of(2L), s.ungroupedConditionCuis());
		assertEquals(Map.of(1L, List.of("asthma", "wheezy chest"), 2L, List.of("fever")), s.conditionToStrings());
		assertEquals(Map.of(3L, List.of(1L)), s.groupingToConditions());
		assertEquals(Map.of(3L, List.of("asthma", "wheezy chest")), s.groupingToStrings());
		assertEquals(Map.of("asthma", 3L, "wheezy chest", 3L, "fever", -1L), s.stringToGrouping());
	}

	@Test
	void copies_are_independent_and_equality_ignores_order() {
		MappingState s = sample();
		MappingState copy = s.copy();
		assertEquals(s, copy);
		assertEquals(s.hashCode(), copy.hashCode());

		copy.resolve("sore thing", 9L);
		assertNotEquals(s, copy);
		assertTrue(s.isUnresolved("sore thing"));

		Map<String, Long> reversed = new LinkedHashMap<>();
		reversed.put("fever", 2L);
		reversed.put("wheezy chest", 1L);
		reversed.put("asthma", 1L);
		assertEquals(s, new MappingState(List.of("sore thing"), reversed, Map.of(1L, 3L)));
	}

	@Test
	void views_cannot_be_modified() {
		MappingState s = sample();

		assertThrows(UnsupportedOperationException.class, () -> s.getUnresolved().clear());
		assertThrows(UnsupportedOperationException.class, () -> s.getStringToCondition().clear());
		assertThrows(UnsupportedOperationException.class, () -> s.getConditionToGrouping().clear());
	}
}
