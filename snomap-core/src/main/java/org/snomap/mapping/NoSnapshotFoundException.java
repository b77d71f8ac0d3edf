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

/**
 * The requested mapping snapshot does not exist. Callers asking for the
 * latest snapshot may treat this as "start fresh".
 */
public class NoSnapshotFoundException extends FileNotFoundException {

	private static final long serialVersionUID = 1L;

	public NoSnapshotFoundException(String message) {
		super(message);
	}
}
