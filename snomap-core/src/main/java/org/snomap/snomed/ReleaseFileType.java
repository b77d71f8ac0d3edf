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

/**
 * The three RF2 tables a release must provide, with the file-name marker used
 * to find each one.
 */
public enum ReleaseFileType {

	CONCEPT("_Concept_", "concept"),
	DESCRIPTION("_Description_", "description"),
	RELATIONSHIP("_Relationship_", "relationship");

	private final String marker;
	private final String label;

	ReleaseFileType(String marker, String label) {
		this.marker = marker;
		this.label = label;
	}

	public String getMarker() {
		return marker;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * True when {@code fileName} carries this type's marker, the requested
	 * release variant (e.g. {@code Snapshot}) and a {@code .txt} extension.
	 * {@code sct2_StatedRelationship_...} and
	 * {@code sct2_RelationshipConcreteValues_...} do not match
	 * {@link #RELATIONSHIP}.
	 */
	public boolean matches(String fileName, String variant) {
		if (fileName == null || !fileName.endsWith(".txt") || !fileName.contains(marker)) {
			return false;
		}
		return variant == null || variant.isEmpty() || fileName.contains(variant);
	}
}
