package org.snomap.snomed;

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
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.snomap.util.Logger;

/**
 * Parses SNOMED CT RF2 release directories into concept rows and is-a edges.
 *
 * <p>
 * Each release is a subdirectory of the definitions root holding exactly one
 * concept, description and relationship file of the configured variant. Rows
 * whose {@code active} flag is not {@code 1} are dropped before anything else
 * happens. Concepts are inner-joined with their descriptions, so a concept
 * with no active description disappears silently. Only relationships of type
 * {@value #IS_A_TYPE_ID} are kept.
 * </p>
 *
 * <p>
 * Loading several releases runs the per-release procedure for each and
 * concatenates the results. Any failure aborts the whole load.
 * </p>
 */
public class ReleaseLoader {

	/** RF2 "Is a" attribute (child to parent). */
	public static final long IS_A_TYPE_ID = 116680003L;

	private static final String ACTIVE = "1";

	// RF2 columns we read; the rest are ignored
	private static final String COL_ID = "id";
	private static final String COL_ACTIVE = "active";
	private static final String COL_CONCEPT_ID = "conceptId";
	private static final String COL_TYPE_ID = "typeId";
	private static final String COL_TERM = "term";
	private static final String COL_SOURCE_ID = "sourceId";
	private static final String COL_DESTINATION_ID = "destinationId";

	/** Trailing semantic tag, e.g. "Asthma (disorder)" -> "disorder". */
	private static final Pattern DESCRIPTION_TYPE = Pattern.compile("\\(([^()]+)\\)\\s*$");

	/**
	 * RF2 is tab separated with no quoting: terms may legitimately contain
	 * double quotes, so quote handling is disabled.
	 */
	@SuppressWarnings("deprecation")
	private static final CSVFormat RF2 = CSVFormat.DEFAULT.withDelimiter('\t').withQuote(null).withHeader()
			.withIgnoreHeaderCase().withIgnoreEmptyLines();

	private final Path definitionsPath;
	private final ReleaseFileLocator locator;

	public ReleaseLoader(Path definitionsPath, String variant) {
		this.definitionsPath = Objects.requireNonNull(definitionsPath, "definitions path must not be null");
		this.locator = new ReleaseFileLocator(variant);
	}

	// ---- Public API ---------------------------------------------------------

	/** Release names: the immediate subdirectories of the root, sorted. */
	public List<String> listReleases() {
		if (!Files.isDirectory(definitionsPath)) {
			throw new ReleaseLoadException("SNOMED definitions path is not a directory: " + definitionsPath);
		}
		try (Stream<Path> children = Files.list(definitionsPath)) {
			return children.filter(Files::isDirectory)
					.map(p -> p.getFileName().toString())
					.sorted()
					.collect(Collectors.toList());
		} catch (IOException ioe) {
			throw new ReleaseLoadException("Unable to list releases under " + definitionsPath, ioe);
		}
	}

	/** Loads every release under the root into one store. */
	public ConceptStore loadAll() {
		return load(listReleases());
	}

	/** Loads the named releases, in order, into one store. */
	public ConceptStore load(List<String> releases) {
		if (releases.isEmpty()) {
			throw new ReleaseLoadException("No releases found under " + definitionsPath);
		}
		List<Concept> concepts = new ArrayList<>();
		List<HierarchyEdge> edges = new ArrayList<>();
		for (String release : releases) {
			LoadedRelease loaded = loadRelease(release);
			concepts.addAll(loaded.getConcepts());
			edges.addAll(loaded.getEdges());
		}
		Logger.info("Loaded {} releases: {} concept rows, {} is-a edges", releases.size(), concepts.size(),
				edges.size());
		return new ConceptStore(releases, concepts, edges);
	}

	/** Parses one release directory. */
	public LoadedRelease loadRelease(String release) {
		Path releaseDir = definitionsPath.resolve(release);
		if (!Files.isDirectory(releaseDir)) {
			throw new ReleaseLoadException("Release " + release + " not found in " + definitionsPath);
		}

		Path conceptFile = locator.locate(release, releaseDir, ReleaseFileType.CONCEPT);
		Path descriptionFile = locator.locate(release, releaseDir, ReleaseFileType.DESCRIPTION);
		Path relationshipFile = locator.locate(release, releaseDir, ReleaseFileType.RELATIONSHIP);

		Logger.info("Loading release {}", release);
		Set<Long> activeConcepts = readActiveConceptIds(conceptFile);
		List<Concept> concepts = readConcepts(descriptionFile, activeConcepts, release);
		List<HierarchyEdge> edges = readIsAEdges(relationshipFile, release);
		Logger.info("Release {}: {} active concepts, {} named rows, {} is-a edges", release, activeConcepts.size(),
				concepts.size(), edges.size());

		return new LoadedRelease(release, List.copyOf(concepts), List.copyOf(edges));
	}

	// ---- Parsing ------------------------------------------------------------

	private Set<Long> readActiveConceptIds(Path file) {
		Set<Long> ids = new HashSet<>();
		forEachActiveRecord(file, r -> ids.add(parseId(file, r, COL_ID)));
		return ids;
	}

	private List<Concept> readConcepts(Path file, Set<Long> activeConcepts, String release) {
		List<Concept> rows = new ArrayList<>();
		int active = forEachActiveRecord(file, r -> {
			long cui = parseId(file, r, COL_CONCEPT_ID);
			if (activeConcepts.contains(cui)) {
				NameStatus status = NameStatus.fromTypeId(parseId(file, r, COL_TYPE_ID));
				String term = column(file, r, COL_TERM);
				String descriptionType = (status == NameStatus.PRIMARY) ? extractDescriptionType(term) : "";
				rows.add(new Concept(cui, parseId(file, r, COL_ID), term, status, descriptionType, release));
			}
		});
		if (active > rows.size()) {
			Logger.debug("{}: {} active descriptions of inactive or absent concepts dropped", file.getFileName(),
					active - rows.size());
		}
		return rows;
	}

	private List<HierarchyEdge> readIsAEdges(Path file, String release) {
		List<HierarchyEdge> edges = new ArrayList<>();
		forEachActiveRecord(file, r -> {
			if (parseId(file, r, COL_TYPE_ID) == IS_A_TYPE_ID) {
				edges.add(new HierarchyEdge(parseId(file, r, COL_SOURCE_ID), parseId(file, r, COL_DESTINATION_ID),
						release));
			}
		});
		return edges;
	}

	/** Feeds every active record to {@code handler}; returns how many there were. */
	private int forEachActiveRecord(Path file, Consumer<CSVRecord> handler) {
		int active = 0;
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
				CSVParser parser = new CSVParser(reader, RF2)) {
			for (CSVRecord record : parser) {
				if (ACTIVE.equals(column(file, record, COL_ACTIVE))) {
					handler.accept(record);
					active++;
				}
			}
		} catch (IOException ioe) {
			throw new ReleaseLoadException("Unable to read release file " + file, ioe);
		}
		return active;
	}

	private static String column(Path file, CSVRecord record, String name) {
		try {
			return record.get(name);
		} catch (IllegalArgumentException | IllegalStateException ex) {
			throw new ReleaseLoadException(
					file.getFileName() + " line " + record.getRecordNumber() + ": missing column " + name, ex);
		}
	}

	private static long parseId(Path file, CSVRecord record, String name) {
		String raw = column(file, record, name);
		try {
			return Long.parseLong(raw.trim());
		} catch (NumberFormatException nfe) {
			throw new ReleaseLoadException(file.getFileName() + " line " + record.getRecordNumber() + ": column "
					+ name + " is not an id: '" + raw + "'", nfe);
		}
	}

	static String extractDescriptionType(String name) {
		if (name == null) {
			return "";
		}
		Matcher m = DESCRIPTION_TYPE.matcher(name);
		return m.find() ? m.group(1).trim() : "";
	}

	public Path getDefinitionsPath() {
		return definitionsPath;
	}
}
