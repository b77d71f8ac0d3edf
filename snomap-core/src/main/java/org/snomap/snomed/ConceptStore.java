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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable in-memory view of one or more loaded releases.
 *
 * Concept rows are indexed by CUI and by lower-cased name; is-a edges are
 * indexed in both directions. Nothing can be changed after construction, so a
 * store may be shared between threads without locking.
 */
public final class ConceptStore {

	private final List<String> releases;
	private final List<Concept> concepts;
	private final List<HierarchyEdge> edges;

	private final Map<Long, List<Concept>> byCui;
	private final Map<String, List<Concept>> byLowerName;
	private final Map<Long, Set<Long>> parentsOf;
	private final Map<Long, Set<Long>> childrenOf;

	public ConceptStore(List<String> releases, List<Concept> concepts, List<HierarchyEdge> edges) {
		this.releases = List.copyOf(releases);
		this.concepts = List.copyOf(concepts);
		this.edges = List.copyOf(edges);

		Map<Long, List<Concept>> cuiIndex = new LinkedHashMap<>();
		Map<String, List<Concept>> nameIndex = new HashMap<>();
		for (Concept c : this.concepts) {
			cuiIndex.computeIfAbsent(c.getCui(), k -> new ArrayList<>()).add(c);
			nameIndex.computeIfAbsent(lower(c.getName()), k -> new ArrayList<>()).add(c);
		}

		Map<Long, Set<Long>> up = new HashMap<>();
		Map<Long, Set<Long>> down = new HashMap<>();
		for (HierarchyEdge e : this.edges) {
			up.computeIfAbsent(e.getSourceCui(), k -> new TreeSet<>()).add(e.getDestinationCui());
			down.computeIfAbsent(e.getDestinationCui(), k -> new TreeSet<>()).add(e.getSourceCui());
		}

		this.byCui = freezeLists(cuiIndex);
		this.byLowerName = freezeLists(nameIndex);
		this.parentsOf = freezeSets(up);
		this.childrenOf = freezeSets(down);
	}

	// ---- Concepts -----------------------------------------------------------

	/** All rows (primary and alternates, any release) for a CUI; empty if unknown. */
	public List<Concept> conceptsFor(long cui) {
		return byCui.getOrDefault(cui, List.of());
	}

	public boolean contains(long cui) {
		return byCui.containsKey(cui);
	}

	/**
	 * The single primary row of a CUI.
	 *
	 * @throws NoPrimaryConceptException        if there is none
	 * @throws AmbiguousPrimaryConceptException if there is more than one
	 */
	public Concept primaryConcept(long cui) {
		Concept primary = null;
		int count = 0;
		for (Concept c : conceptsFor(cui)) {
			if (c.isPrimary()) {
				primary = c;
				count++;
			}
		}
		if (count == 0) {
			throw new NoPrimaryConceptException(cui);
		}
		if (count > 1) {
			throw new AmbiguousPrimaryConceptException(cui, count);
		}
		return primary;
	}

	/** Rows whose name equals {@code name}, ignoring case. */
	public List<Concept> conceptsNamed(String name) {
		return byLowerName.getOrDefault(lower(name), List.of());
	}

	/** Every row in load order. */
	public List<Concept> allConcepts() {
		return concepts;
	}

	/** Distinct CUIs in load order. */
	public Set<Long> cuis() {
		return byCui.keySet();
	}

	// ---- Hierarchy ----------------------------------------------------------

	/** Destination CUIs of is-a edges leaving {@code cui}, ascending. */
	public Set<Long> parentCuis(long cui) {
		return parentsOf.getOrDefault(cui, Set.of());
	}

	/** Source CUIs of is-a edges arriving at {@code cui}, ascending. */
	public Set<Long> childCuis(long cui) {
		return childrenOf.getOrDefault(cui, Set.of());
	}

	public List<HierarchyEdge> edges() {
		return edges;
	}

	public List<String> releases() {
		return releases;
	}

	@Override
	public String toString() {
		return "ConceptStore(releases=" + releases + ", concepts=" + byCui.size() + ", rows=" + concepts.size()
				+ ", edges=" + edges.size() + ")";
	}

	// ---- Internals ----------------------------------------------------------

	static String lower(String s) {
		return (s == null) ? "" : s.toLowerCase(Locale.ROOT);
	}

	private static <K> Map<K, List<Concept>> freezeLists(Map<K, List<Concept>> m) {
		Map<K, List<Concept>> out = new LinkedHashMap<>(m.size() * 2);
		m.forEach((k, v) -> out.put(k, List.copyOf(v)));
		return Collections.unmodifiableMap(out);
	}

	private static Map<Long, Set<Long>> freezeSets(Map<Long, Set<Long>> m) {
		Map<Long, Set<Long>> out = new HashMap<>(m.size() * 2);
		m.forEach((k, v) -> out.put(k, Collections.unmodifiableSet(v)));
		return Collections.unmodifiableMap(out);
	}
}
