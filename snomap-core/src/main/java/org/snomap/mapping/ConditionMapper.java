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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.snomap.prompt.OperatorPrompt;
import org.snomap.snomed.Concept;
import org.snomap.snomed.SnomedQueryEngine;
import org.snomap.util.Logger;

/**
 * Maps a freetext condition list to SNOMED codes.
 *
 * <p>
 * Binds a {@link MappingState} to its input file, its numbered snapshots and,
 * optionally, a {@link SnomedQueryEngine}. Strings are resolved to conditions
 * either automatically (the name identifies exactly one concept) or by the
 * operator; grouping is driven separately by the grouping session.
 * </p>
 *
 * <p>
 * Terminology: a <i>string</i> is a freetext condition name, a
 * <i>condition</i> the cui it was mapped to, a <i>grouping</i> the (usually
 * coarser) cui a condition is clustered under.
 * </p>
 */
public class ConditionMapper {

	private final Path inputFile;
	private final MappingSnapshotStore snapshots;
	private final SnomedQueryEngine snomed;
	private MappingState state;

	private ConditionMapper(Path inputFile, MappingState state, MappingSnapshotStore snapshots,
			SnomedQueryEngine snomed) {
		this.inputFile = inputFile;
		this.state = state;
		this.snapshots = snapshots;
		this.snomed = snomed;
	}

	// ---- Factories ----------------------------------------------------------

	/** New mapping with every line of the input list unresolved. */
	public static ConditionMapper fresh(Path inputFile, SnomedQueryEngine snomed) throws IOException {
		return new ConditionMapper(inputFile, new MappingState(readInputList(inputFile)),
				new MappingSnapshotStore(inputFile), snomed);
	}

	/** Mapping restored from snapshot {@code n}. */
	public static ConditionMapper fromSnapshot(Path inputFile, int n, SnomedQueryEngine snomed) throws IOException {
		requireInput(inputFile);
		MappingSnapshotStore store = new MappingSnapshotStore(inputFile);
		return new ConditionMapper(inputFile, store.load(n), store, snomed);
	}

	/**
	 * Mapping restored from the most recent snapshot.
	 *
	 * @throws NoSnapshotFoundException if none exists
	 */
	public static ConditionMapper fromLatestSnapshot(Path inputFile, SnomedQueryEngine snomed) throws IOException {
		requireInput(inputFile);
		MappingSnapshotStore store = new MappingSnapshotStore(inputFile);
		return new ConditionMapper(inputFile, store.loadLatest(), store, snomed);
	}

	/** Latest snapshot if there is one, otherwise a fresh mapping. */
	public static ConditionMapper resume(Path inputFile, SnomedQueryEngine snomed) throws IOException {
		try {
			return fromLatestSnapshot(inputFile, snomed);
		} catch (NoSnapshotFoundException e) {
			Logger.info("No saved mapping for {}; starting from the input list", inputFile.getFileName());
			return fresh(inputFile, snomed);
		}
	}

	// ---- String -> condition ------------------------------------------------

	/**
	 * Resolves {@code string} if its name identifies exactly one concept.
	 *
	 * @return the cui it was mapped to, empty if absent or ambiguous (state is
	 *         then unchanged)
	 * @throws UnknownStringException if {@code string} is not unresolved
	 */
	public Optional<Long> attemptAutoMatch(String string) {
		if (!state.isUnresolved(string)) {
			throw new UnknownStringException(string);
		}
		Optional<Long> cui = requireSnomed().findUniqueCui(string);
		if (cui.isPresent()) {
			// name first: a broken primary row must leave the string unresolved
			String name = snomed.primaryConcept(cui.get()).getName();
			state.resolve(string, cui.get());
			Logger.info("\t{} mapped to {}", string, name);
		}
		return cui;
	}

	/**
	 * Attempts {@link #attemptAutoMatch(String)} on every unresolved string.
	 *
	 * @return the strings matched in this pass and their cuis
	 */
	public Map<String, Long> autoMatchAll() {
		requireSnomed();
		Map<String, Long> matched = new LinkedHashMap<>();
		if (state.getUnresolved().isEmpty()) {
			Logger.info("All conditions already mapped to SNOMED-CT");
			return matched;
		}
		Logger.info("Automatically mapping conditions to SNOMED-CT...");
		for (String s : new ArrayList<>(state.getUnresolved())) {
			attemptAutoMatch(s).ifPresent(c -> matched.put(s, c));
		}
		if (state.getUnresolved().isEmpty()) {
			Logger.info("All {} conditions mapped to SNOMED-CT", state.getStringToCondition().size());
		} else {
			Logger.info("{} conditions mapped to SNOMED-CT, {} not mapped: {}", state.getStringToCondition().size(),
					state.getUnresolved().size(), state.getUnresolved());
		}
		return matched;
	}

	/**
	 * Maps {@code string} to {@code cui} without consulting the terminology.
	 *
	 * @throws UnknownStringException if {@code string} is not unresolved
	 */
	public void recordManualMatch(String string, long cui) {
		state.resolve(string, cui);
	}

	/**
	 * Walks the unresolved strings, shows the primary names of candidate
	 * concepts and asks the operator for a cui. Blank input skips the string;
	 * input that is not a number or not a concept in the loaded releases is
	 * rejected and the string stays unresolved.
	 *
	 * @return number of strings mapped
	 */
	public int promptManualMatches(OperatorPrompt prompt) {
		SnomedQueryEngine engine = requireSnomed();
		if (state.getUnresolved().isEmpty()) {
			prompt.show("All conditions already mapped to SNOMED-CT");
			return 0;
		}

		int mapped = 0;
		List<String> skipped = new ArrayList<>();
		for (String s : new ArrayList<>(state.getUnresolved())) {
			List<Concept> candidates = engine.findPrimaryConcepts(s);
			if (candidates.isEmpty()) {
				prompt.show("No partial matches found for " + s);
			} else {
				prompt.show("Candidates for " + s + ":");
				candidates.forEach(c -> prompt.show("  " + c.getCui() + "  " + c.getName()));
			}

			Optional<String> answer = prompt
					.readLine("Enter the CUI for " + s + " (any CUI is accepted; press Enter to skip):");
			Optional<Long> cui = answer.flatMap(a -> parseKnownCui(a, engine, prompt));
			if (cui.isPresent()) {
				String name = engine.primaryConcept(cui.get()).getName();
				state.resolve(s, cui.get());
				prompt.show(s + " mapped to " + name + " (" + cui.get() + ")");
				mapped++;
			} else {
				skipped.add(s);
			}
		}
		Logger.info("Manually mapped {} conditions to SNOMED-CT; {} skipped", mapped, skipped.size());
		return mapped;
	}

	// ---- Condition -> grouping ----------------------------------------------

	public void assignGrouping(long conditionCui, long groupingCui) {
		state.assignGrouping(conditionCui, groupingCui);
	}

	// ---- Persistence --------------------------------------------------------

	/** Saves a new snapshot; returns its number. */
	public int save() throws IOException {
		return snapshots.save(state);
	}

	/** Replaces the current state with snapshot {@code n}. */
	public void load(int n) throws IOException {
		this.state = snapshots.load(n);
	}

	/** Replaces the current state with the latest snapshot. */
	public void loadLatest() throws IOException {
		this.state = snapshots.loadLatest();
	}

	public int clearSnapshots(OperatorPrompt prompt) throws IOException {
		return snapshots.clearSnapshots(prompt);
	}

	// ---- Views --------------------------------------------------------------

	public GroupingsTable groupingsTable() {
		return GroupingsTable.build(state, requireSnomed());
	}

	public MappingState getState() {
		return state;
	}

	public MappingSnapshotStore getSnapshots() {
		return snapshots;
	}

	public Path getInputFile() {
		return inputFile;
	}

	public Optional<SnomedQueryEngine> getSnomed() {
		return Optional.ofNullable(snomed);
	}

	@Override
	public String toString() {
		return "ConditionMapper for " + inputFile + " with " + state.getUnresolved().size() + " unknown conditions and "
				+ state.getStringToCondition().size() + " known conditions";
	}

	// ---- Internals ----------------------------------------------------------

	private SnomedQueryEngine requireSnomed() {
		if (snomed == null) {
			throw new IllegalStateException("ConditionMapper was created without a SNOMED query engine");
		}
		return snomed;
	}

	private static Optional<Long> parseKnownCui(String raw, SnomedQueryEngine engine, OperatorPrompt prompt) {
		long cui;
		try {
			cui = Long.parseLong(raw.trim());
		} catch (NumberFormatException nfe) {
			prompt.show(raw + " is not a valid CUI");
			return Optional.empty();
		}
		if (!engine.contains(cui)) {
			prompt.show(cui + " is not a concept in the loaded releases");
			return Optional.empty();
		}
		return Optional.of(cui);
	}

	/** Non-blank lines of the input list, trimmed, first occurrence kept. */
	static Set<String> readInputList(Path inputFile) throws IOException {
		requireInput(inputFile);
		return Files.readAllLines(inputFile, StandardCharsets.UTF_8).stream()
				.filter(StringUtils::isNotBlank)
				.map(String::trim)
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	private static void requireInput(Path inputFile) throws FileNotFoundException {
		if (inputFile == null || !Files.isRegularFile(inputFile)) {
			throw new FileNotFoundException("File not found: " + inputFile);
		}
	}
}
