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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.snomap.conf.ConfigLoader;
import org.snomap.grouping.GroupingSession;
import org.snomap.grouping.GroupingSummary;
import org.snomap.mapping.ConditionMapper;
import org.snomap.prompt.ConsolePrompt;
import org.snomap.prompt.OperatorPrompt;
import org.snomap.snomed.SnomedQueryEngine;
import org.snomap.util.Logger;

/**
 * Command-line entry point: one interactive mapping session over a freetext
 * condition list.
 *
 * <pre>
 *   java org.snomap.SnoMapMain [input-file]
 * </pre>
 *
 * The input file argument overrides {@code INPUT_FILE} from the
 * configuration.
 */
public class SnoMapMain {

	private final ConfigLoader cfg;
	private final OperatorPrompt prompt;

	public SnoMapMain(ConfigLoader cfg, OperatorPrompt prompt) {
		this.cfg = cfg;
		this.prompt = prompt;
	}

	public static void main(String[] args) {
		SnoMapMain app = new SnoMapMain(new ConfigLoader(), new ConsolePrompt());
		try {
			app.run(args.length > 0 ? Path.of(args[0]) : null);
		} catch (IOException ioe) {
			Logger.error("Mapping session failed: {}", ioe.getMessage(), ioe);
			System.exit(1);
		}
	}

	/**
	 * Loads the releases, resumes (or starts) the mapping, runs automatic and
	 * manual matching and the grouping session, then saves a new snapshot and
	 * the groupings table.
	 */
	void run(Path inputOverride) throws IOException {
		List<String> issues = cfg.validate();
		issues.forEach(i -> Logger.warn("Config: {}", i));

		Path input = (inputOverride != null) ? inputOverride : cfg.getInputFile();

		SnomedQueryEngine snomed = SnomedQueryEngine.load(cfg);
		Logger.info("SNOMED load completed: {}", snomed.getStore());

		ConditionMapper mapper = ConditionMapper.resume(input, snomed);
		Logger.info("{}", mapper);

		mapper.autoMatchAll();
		mapper.promptManualMatches(prompt);

		GroupingSummary summary = new GroupingSession(mapper.getState(), snomed, prompt).groupConditions();
		if (summary.isAborted()) {
			Logger.info("Grouping aborted by operator");
		}

		int n = mapper.save();
		Logger.info("Saved mapping snapshot {}", n);

		mapper.groupingsTable().writeCsv(cfg.getGroupingsOutput(input));
		Logger.info("End");
	}
}
