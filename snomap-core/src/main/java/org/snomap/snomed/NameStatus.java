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
 * Naming role of a description row. RF2 encodes it in the description
 * {@code typeId}; only the fully specified name and the synonym codes are
 * recognised.
 */
public enum NameStatus {

	/** Fully specified name. Exactly one per concept. */
	PRIMARY(900000000000003001L, "P"),

	/** Synonym. */
	ALTERNATE(900000000000013009L, "A");

	private final long typeId;
	private final String code;

	NameStatus(long typeId, String code) {
		this.typeId = typeId;
		this.code = code;
	}

	public long getTypeId() {
		return typeId;
	}

	/** One-letter code used in exports. */
	public String getCode() {
		return code;
	}

	/**
	 * @throws UnknownNameStatusCodeException for any other type id
	 */
	public static NameStatus fromTypeId(long typeId) {
		for (NameStatus s : values()) {
			if (s.typeId == typeId) {
				return s;
			}
		}
		throw new UnknownNameStatusCodeException(typeId);
	}
}
