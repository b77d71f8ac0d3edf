package org.snomap;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.snomap.conf.ConfigLoader;
import org.snomap.conf.ConfigurationMissingException;
import org.snomap.mapping.MappingSnapshotStore;
import org.snomap.mapping.MappingState;
import org.snomap.prompt.ScriptedPrompt;
import org.snomap.snomed.Rf2Fixture;

class SnoMapMainTest {

	@TempDir
	Path tmp;

	private Path input;
	private ConfigLoader cfg;

	@BeforeEach
	void setUp() throws Exception {
		new Rf2Fixture("core")
				.concept(1L).fsn(1L, "Asthma (disorder)").synonym(1L, "Bronchial asthma")
				.concept(3L).fsn(3L, "Disorder of respiratory system (disorder)")
				.isA(1L, 3L)
				.writeTo(tmp.resolve("snomed"));
		input = tmp.resolve("conditions.txt");
		Files.writeString(input, "asthma\nwheeze\n");

		Properties p = new Properties();
		p.setProperty(ConfigLoader.K_SNOMED_DEFINITIONS, tmp.resolve("snomed").toString());
		p.setProperty(ConfigLoader.K_INPUT_FILE, input.toString());
		cfg = ConfigLoader.fromProperties(p);
	}

	@Test
	void session_maps_groups_and_saves() throws Exception {
		ScriptedPrompt prompt = new ScriptedPrompt()
				.type(null) // wheeze: no manual cui
				.pick(1); // asthma grouped under its parent

		new SnoMapMain(cfg, prompt).run(null);

		MappingState saved = new MappingSnapshotStore(input).load(1);
		assertEquals(Map.of("asthma", 1L), saved.getStringToCondition());
		assertEquals(Map.of(1L, 3L), saved.getConditionToGrouping());
		assertEquals(Set.of("wheeze"), saved.getUnresolved());

		List<String> csv = Files.readAllLines(tmp.resolve("conditions_groupings.csv"));
		assertEquals("asthma,1,Asthma (disorder),3,Disorder of respiratory system (disorder)", csv.get(1));
		assertEquals("wheeze,-1,Unknown,-1,Unknown", csv.get(2));
	}

	@Test
	void second_session_resumes_and_writes_the_next_snapshot() throws Exception {
		new SnoMapMain(cfg, new ScriptedPrompt().type(null).pick(1)).run(null);
		ScriptedPrompt prompt = new ScriptedPrompt().type("1");

		new SnoMapMain(cfg, prompt).run(null);

		MappingSnapshotStore store = new MappingSnapshotStore(input);
		assertEquals(2, store.latestSnapshotNumber());
		MappingState latest = store.loadLatest();
		assertEquals(Map.of("asthma", 1L, "wheeze", 1L), latest.getStringToCondition());
		assertTrue(latest.getUnresolved().isEmpty());
		assertTrue(prompt.isExhausted(), "already grouped conditions are not offered again");
	}

	@Test
	void input_argument_overrides_the_configuration() throws Exception {
		Path other = tmp.resolve("other.txt");
		Files.writeString(other, "bronchial asthma\n");

		new SnoMapMain(cfg, new ScriptedPrompt().pick(0)).run(other);

		MappingState saved = new MappingSnapshotStore(other).loadLatest();
		assertEquals(Map.of("bronchial asthma", 1L), saved.getStringToCondition());
		assertEquals(Map.of(1L, 1L), saved.getConditionToGrouping());
		assertTrue(Files.exists(tmp.resolve("other_groupings.csv")));
	}

	@Test
	void missing_release_root_is_fatal() {
		ConfigLoader empty = ConfigLoader.fromProperties(new Properties());

		assertThrows(ConfigurationMissingException.class, () -> new SnoMapMain(empty, new ScriptedPrompt()).run(input));
	}
}
