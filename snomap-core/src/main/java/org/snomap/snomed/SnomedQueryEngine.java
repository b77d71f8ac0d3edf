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

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.snomap.conf.ConfigLoader;

/**
 * Read-only queries over a {@link ConceptStore}: name search, direct parents
 * and children, and ancestor enumeration.
 */
public class SnomedQueryEngine {

	/** Qualifiers tried, in order, by the second search tier. */
	private static final List<String> NAME_QUALIFIERS = List.of(" (disorder)", " (finding)");

	private static final Comparator<AncestorConcept> BY_LEVEL_THEN_CUI = Comparator
			.comparingInt(AncestorConcept::getLevel).thenComparingLong(AncestorConcept::getCui);

	private final ConceptStore store;

	public SnomedQueryEngine(ConceptStore store) {
		this.store = Objects.requireNonNull(store, "store must not be null");
	}

	/** Loads every release under {@code definitionsPath}. */
	public static SnomedQueryEngine load(Path definitionsPath, String variant) {
		return new SnomedQueryEngine(new ReleaseLoader(definitionsPath, variant).loadAll());
	}

	/** Loads the release root named by the configuration. */
	public static SnomedQueryEngine load(ConfigLoader config) {
		return load(config.getSnomedDefinitionsPath(), config.getReleaseVariant());
	}

	// =========================================================================
	// Name search
	// =========================================================================

	/**
	 * Finds concepts by name, ignoring case. The first tier that matches
	 * anything wins:
	 * <ol>
	 * <li>the whole name equals {@code text}</li>
	 * <li>the name equals {@code text} followed by " (disorder)" or "
	 * (finding)"</li>
	 * <li>the name contains {@code text}</li>
	 * </ol>
	 * The result holds every row (primary and alternates) of each CUI the
	 * winning tier hit, CUIs in the order they were hit. Empty if nothing
	 * matched or {@code text} is blank. {@code text} is matched as given;
	 * surrounding whitespace is not trimmed.
	 */
	public List<Concept> findConcepts(String text) {
		if (StringUtils.isBlank(text)) {
			return List.of();
		}

		List<Concept> hits = new ArrayList<>(store.conceptsNamed(text));
		if (hits.isEmpty()) {
			for (String qualifier : NAME_QUALIFIERS) {
				hits.addAll(store.conceptsNamed(text + qualifier));
			}
		}
		if (hits.isEmpty()) {
			hits = filter(c -> StringUtils.containsIgnoreCase(c.getName(), text));
		}

		Set<Long> cuis = new LinkedHashSet<>();
		hits.forEach(c -> cuis.add(c.getCui()));
		return cuis.stream().flatMap(cui -> store.conceptsFor(cui).stream()).collect(Collectors.toList());
	}

	/**
	 * The CUI {@code text} names, if {@link #findConcepts(String)} hits exactly
	 * one CUI. Absent and ambiguous both yield empty.
	 */
	public Optional<Long> findUniqueCui(String text) {
		Set<Long> cuis = findConcepts(text).stream().map(Concept::getCui).collect(Collectors.toSet());
		return (cuis.size() == 1) ? Optional.of(cuis.iterator().next()) : Optional.empty();
	}

	/** Primary rows of {@link #findConcepts(String)}, for presenting candidates. */
	public List<Concept> findPrimaryConcepts(String text) {
		return findConcepts(text).stream().filter(Concept::isPrimary).collect(Collectors.toList());
	}

	// =========================================================================
	// Lookup
	// =========================================================================

	public List<Concept> conceptsFor(long cui) {
		return store.conceptsFor(cui);
	}

	public Concept primaryConcept(long cui) {
		return store.primaryConcept(cui);
	}

	public boolean contains(long cui) {
		return store.contains(cui);
	}

	public List<String> releases() {
		return store.releases();
	}

	public ConceptStore getStore() {
		return store;
	}

	// =========================================================================
	// Hierarchy
	// =========================================================================

	/** Primary rows of the direct parents of {@code cui}. */
	public List<Concept> parents(long cui) {
		return parents(cui, true);
	}

	/** Rows of the concepts {@code cui} is-a, ordered by CUI. */
	public List<Concept> parents(long cui, boolean primaryOnly) {
		return rowsOf(store.parentCuis(cui), primaryOnly);
	}

	/** Primary rows of the direct children of {@code cui}. */
	public List<Concept> children(long cui) {
		return children(cui, true);
	}

	/** Rows of the concepts that are-a {@code cui}, ordered by CUI. */
	public List<Concept> children(long cui, boolean primaryOnly) {
		return rowsOf(store.childCuis(cui), primaryOnly);
	}

	/**
	 * Every ancestor of {@code cui} with its minimum is-a distance.
	 *
	 * Breadth-first over parent edges with a visited set, so each CUI is
	 * reported once at its shortest level and cycles terminate. The start
	 * concept is not its own ancestor, even when a cycle leads back to it.
	 * Ancestors with no rows in the store are traversed but not reported.
	 *
	 * @return primary rows sorted by level, then CUI
	 * @throws PrimaryConceptException if a reported ancestor breaks the
	 *                                 primary-name rule
	 */
	public List<AncestorConcept> ancestors(long cui) {
		Map<Long, Integer> levels = new HashMap<>();
		Deque<Long> queue = new ArrayDeque<>();
		levels.put(cui, 0);
		queue.add(cui);

		while (!queue.isEmpty()) {
			long current = queue.poll();
			int next = levels.get(current) + 1;
			for (long parent : store.parentCuis(current)) {
				if (!levels.containsKey(parent)) {
					levels.put(parent, next);
					queue.add(parent);
				}
			}
		}

		List<AncestorConcept> out = new ArrayList<>(levels.size());
		levels.forEach((ancestor, level) -> {
			if (ancestor != cui && store.contains(ancestor)) {
				out.add(new AncestorConcept(store.primaryConcept(ancestor), level));
			}
		});
		out.sort(BY_LEVEL_THEN_CUI);
		return out;
	}

	// ---- By-name conveniences ----------------------------------------------

	public List<Concept> parentsByName(String name, boolean primaryOnly) {
		return parents(requireUniqueCui(name), primaryOnly);
	}

	public List<Concept> childrenByName(String name, boolean primaryOnly) {
		return children(requireUniqueCui(name), primaryOnly);
	}

	public List<AncestorConcept> ancestorsByName(String name) {
		return ancestors(requireUniqueCui(name));
	}

	// ---- Internals ----------------------------------------------------------

	private long requireUniqueCui(String name) {
		return findUniqueCui(name).orElseThrow(() -> new ConceptNotFoundException(name));
	}

	private List<Concept> rowsOf(Set<Long> cuis, boolean primaryOnly) {
		List<Concept> rows = new ArrayList<>();
		for (long c : cuis) {
			for (Concept row : store.conceptsFor(c)) {
				if (!primaryOnly || row.isPrimary()) {
					rows.add(row);
				}
			}
		}
		return rows;
	}

	private List<Concept> filter(Predicate<Concept> p) {
		return store.allConcepts().stream().filter(p).collect(Collectors.toList());
	}
}
