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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.snomap.prompt.ScriptedPrompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class MappingSnapshotStoreTest {

	@TempDir
	Path dir;

	private MappingState grouped() {
		MappingState s = new MappingState(List.of("asthma", "wheeze"));
		s.resolve("asthma", 195967001L);
		s.assignGrouping(195967001L, 50043002L);
		return s;
	}

	@Test
	void snapshots_are_named_after_the_input_base_name() {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));

		assertEquals(dir.resolve("conditions_mapped_3.json").toAbsolutePath(), store.snapshotPath(3));
		assertEquals("conditions", store.getBaseName());
		assertEquals("archive.tar", MappingSnapshotStore.stripExtension("archive.tar.gz"));
		assertEquals("noext", MappingSnapshotStore.stripExtension("noext"));
	}

	@Test
	void save_then_load_restores_the_state() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		MappingState state = grouped();

		int n = store.save(state);

		assertEquals(1, n);
		assertEquals(state, store.load(1));
		assertEquals(state, store.loadLatest());
	}

	@Test
	void each_save_writes_a_new_number() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		MappingState state = grouped();
		assertEquals(0, store.latestSnapshotNumber());

		store.save(new MappingState(List.of("asthma", "wheeze")));
		store.save(state);
		Files.writeString(dir.resolve("other_mapped_7.json"), "{}");

		assertEquals(List.of(1, 2), store.snapshotNumbers());
		assertEquals(2, store.latestSnapshotNumber());
		assertEquals(state, store.loadLatest());
		assertEquals(Set.of("asthma", "wheeze"), store.load(1).getUnresolved());
	}

	@Test
	void gaps_are_respected_and_existing_files_never_overwritten() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		Files.writeString(dir.resolve("conditions_mapped_5.json"), "{}");

		assertEquals(6, store.save(grouped()));
		assertEquals("{}", Files.readString(store.snapshotPath(5)));
	}

	@Test
	void json_uses_text_keys_for_cuis() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		store.save(grouped());

		JsonNode json = new ObjectMapper().readTree(Files.readString(store.snapshotPath(1)));

		assertEquals("wheeze", json.get("unknown_strings").get(0).asText());
		assertEquals(195967001L, json.get("string_to_condition_cui").get("asthma").asLong());
		assertEquals(50043002L, json.get("condition_cui_to_grouping_cui").get("195967001").asLong());
	}

	@Test
	void hand_written_snapshot_is_readable() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		Files.writeString(store.snapshotPath(1), "{\"unknown_strings\": [\"wheeze\"],"
				+ " \"string_to_condition_cui\": {\"asthma\": 1},"
				+ " \"condition_cui_to_grouping_cui\": {\"1\": 3}}", StandardCharsets.UTF_8);

		MappingState s = store.loadLatest();

		assertEquals(Map.of("asthma", 1L), s.getStringToCondition());
		assertEquals(Map.of(1L, 3L), s.getConditionToGrouping());
	}

	@Test
	void inconsistent_or_malformed_snapshot_is_rejected() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		Files.writeString(store.snapshotPath(1), "{\"unknown_strings\": [],"
				+ " \"string_to_condition_cui\": {\"asthma\": 1},"
				+ " \"condition_cui_to_grouping_cui\": {\"2\": 3}}");
		Files.writeString(store.snapshotPath(2), "{\"condition_cui_to_grouping_cui\": {\"abc\": 3}}");

		assertThrows(IOException.class, () -> store.load(1));
		assertThrows(IOException.class, () -> store.load(2));
	}

	@Test
	void missing_snapshots_are_reported() {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));

		assertThrows(NoSnapshotFoundException.class, store::loadLatest);
		assertThrows(NoSnapshotFoundException.class, () -> store.load(4));
	}

	@Test
	void clearing_requires_confirmation() throws Exception {
		MappingSnapshotStore store = new MappingSnapshotStore(dir.resolve("conditions.txt"));
		store.save(grouped());
		store.save(grouped());

		assertEquals(0, store.clearSnapshots(new ScriptedPrompt().answer(false)));
		assertEquals(2, store.latestSnapshotNumber());

		assertEquals(2, store.clearSnapshots(new ScriptedPrompt().answer(true)));
		assertEquals(0, store.latestSnapshotNumber());
		assertFalse(Files.exists(store.snapshotPath(1)));
		assertTrue(Files.isDirectory(dir));
	}
}
