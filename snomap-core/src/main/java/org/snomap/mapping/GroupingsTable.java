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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.snomap.snomed.SnomedQueryEngine;
import org.snomap.util.Logger;

import lombok.Data;

/**
 * Flat view of a mapping: one row per input string, resolved or not, with its
 * condition and grouping. Missing cuis are {@value #UNKNOWN_CUI} and missing
 * names {@value #UNKNOWN_NAME}.
 */
public class GroupingsTable {

	public static final long UNKNOWN_CUI = -1L;
	public static final String UNKNOWN_NAME = "Unknown";

	static final String[] HEADER = { "string", "condition_cui", "condition_name", "grouping_cui", "grouping_name" };

	@Data
	public static class Row {
		private final String string;
		private final long conditionCui;
		private final String conditionName;
		private final long groupingCui;
		private final String groupingName;
	}

	private final List<Row> rows;

	private GroupingsTable(List<Row> rows) {
		this.rows = Collections.unmodifiableList(rows);
	}

	/** Mapped strings first (input order), then the unresolved ones. */
	public static GroupingsTable build(MappingState state, SnomedQueryEngine snomed) {
		Map<Long, String> names = new LinkedHashMap<>();
		List<Row> rows = new ArrayList<>();

		state.getStringToCondition().forEach((s, condition) -> {
			long grouping = state.getConditionToGrouping().getOrDefault(condition, UNKNOWN_CUI);
			rows.add(new Row(s, condition, nameOf(condition, snomed, names), grouping,
					nameOf(grouping, snomed, names)));
		});
		for (String s : state.getUnresolved()) {
			rows.add(new Row(s, UNKNOWN_CUI, UNKNOWN_NAME, UNKNOWN_CUI, UNKNOWN_NAME));
		}
		return new GroupingsTable(rows);
	}

	public List<Row> getRows() {
		return rows;
	}

	/** Grouping name to the strings clustered under it, ungrouped strings excluded. */
	public Map<String, List<String>> stringsByGroupingName() {
		Map<String, List<String>> out = new LinkedHashMap<>();
		for (Row r : rows) {
			if (r.getGroupingCui() != UNKNOWN_CUI) {
				out.computeIfAbsent(r.getGroupingName(), k -> new ArrayList<>()).add(r.getString());
			}
		}
		return out;
	}

	@SuppressWarnings("deprecation")
	public void writeCsv(Path out) throws IOException {
		if (out.getParent() != null) {
			Files.createDirectories(out.getParent());
		}
		try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
				CSVPrinter printer = new CSVPrinter(w, CSVFormat.DEFAULT.withHeader(HEADER))) {
			for (Row r : rows) {
				printer.printRecord(r.getString(), r.getConditionCui(), r.getConditionName(), r.getGroupingCui(),
						r.getGroupingName());
			}
		} catch (IOException ioe) {
			Logger.error("Error writing groupings table {}: {}", out, ioe.getMessage());
			throw ioe;
		}
		Logger.info("Groupings table written to {} ({} rows)", out, rows.size());
	}

	private static String nameOf(long cui, SnomedQueryEngine snomed, Map<Long, String> cache) {
		if (cui == UNKNOWN_CUI || !snomed.contains(cui)) {
			return UNKNOWN_NAME;
		}
		return cache.computeIfAbsent(cui, c -> snomed.primaryConcept(c).getName());
	}
}
