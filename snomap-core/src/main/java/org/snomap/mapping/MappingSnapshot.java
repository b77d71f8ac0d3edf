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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * JSON form of a {@link MappingState}. JSON object keys are text, so the
 * condition-to-grouping map is written with string keys and parsed back to
 * cuis on load.
 */
@Data
@JsonPropertyOrder({ "unknown_strings", "string_to_condition_cui", "condition_cui_to_grouping_cui" })
public class MappingSnapshot {

	@JsonProperty("unknown_strings")
	private List<String> unknownStrings = new ArrayList<>();

	@JsonProperty("string_to_condition_cui")
	private Map<String, Long> stringToConditionCui = new LinkedHashMap<>();

	@JsonProperty("condition_cui_to_grouping_cui")
	private Map<String, Long> conditionCuiToGroupingCui = new LinkedHashMap<>();

	public static MappingSnapshot of(MappingState state) {
		MappingSnapshot s = new MappingSnapshot();
		s.setUnknownStrings(new ArrayList<>(state.getUnresolved()));
		s.setStringToConditionCui(new LinkedHashMap<>(state.getStringToCondition()));
		Map<String, Long> grouping = new LinkedHashMap<>();
		state.getConditionToGrouping().forEach((c, g) -> grouping.put(Long.toString(c), g));
		s.setConditionCuiToGroupingCui(grouping);
		return s;
	}

	/**
	 * @throws IOException if a grouping key is not a cui or the content breaks
	 *                     the mapping invariants
	 */
	public MappingState toState() throws IOException {
		Map<Long, Long> grouping = new LinkedHashMap<>();
		for (Map.Entry<String, Long> e : nz(conditionCuiToGroupingCui).entrySet()) {
			try {
				grouping.put(Long.parseLong(e.getKey().trim()), e.getValue());
			} catch (NumberFormatException nfe) {
				throw new IOException("Condition cui key is not a number: '" + e.getKey() + "'", nfe);
			}
		}
		try {
			return new MappingState(unknownStrings == null ? List.of() : unknownStrings, nz(stringToConditionCui),
					grouping);
		} catch (IllegalArgumentException iae) {
			throw new IOException("Inconsistent mapping snapshot: " + iae.getMessage(), iae);
		}
	}

	private static Map<String, Long> nz(Map<String, Long> m) {
		return (m == null) ? Map.of() : m;
	}
}
