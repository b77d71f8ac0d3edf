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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the single concept, description and relationship file of a release.
 * The release directory is searched recursively, so both the flat layout and
 * the distribution layout ({@code Snapshot/Terminology/...}) work.
 */
public class ReleaseFileLocator {

	private final String variant;

	public ReleaseFileLocator(String variant) {
		this.variant = variant;
	}

	/**
	 * @throws ReleaseFileMissingException   when no file matches
	 * @throws ReleaseFileAmbiguousException when more than one file matches
	 */
	public Path locate(String release, Path releaseDir, ReleaseFileType type) {
		List<Path> matches;
		try (Stream<Path> files = Files.walk(releaseDir)) {
			matches = files.filter(Files::isRegularFile)
					.filter(p -> type.matches(p.getFileName().toString(), variant))
					.sorted()
					.collect(Collectors.toList());
		} catch (IOException ioe) {
			throw new ReleaseLoadException("Unable to scan release directory " + releaseDir, ioe);
		}

		if (matches.isEmpty()) {
			throw new ReleaseFileMissingException(release, type, releaseDir);
		}
		if (matches.size() > 1) {
			throw new ReleaseFileAmbiguousException(release, type, matches);
		}
		return matches.get(0);
	}

	public String getVariant() {
		return variant;
	}
}
