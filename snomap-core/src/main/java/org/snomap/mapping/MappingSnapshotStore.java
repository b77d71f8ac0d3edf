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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.snomap.prompt.OperatorPrompt;
import org.snomap.util.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Numbered JSON snapshots of a {@link MappingState}, stored beside the input
 * list as {@code <base>_mapped_<n>.json}.
 *
 * <p>
 * Snapshots are never overwritten: {@link #save(MappingState)} always writes
 * {@code latest + 1} and refuses to replace an existing file. A snapshot file
 * is a single-writer checkpoint; concurrent sessions on the same input list
 * are not supported.
 * </p>
 */
public class MappingSnapshotStore {

	private static final String SUFFIX = ".json";
	private static final String INFIX = "_mapped_";

	private final Path directory;
	private final String baseName;
	private final Pattern snapshotName;
	private final ObjectMapper mapper;

	/** Snapshots for {@code inputFile}, next to it, named after its base name. */
	public MappingSnapshotStore(Path inputFile) {
		Objects.requireNonNull(inputFile, "input file must not be null");
		Path abs = inputFile.toAbsolutePath();
		this.directory = abs.getParent();
		this.baseName = stripExtension(abs.getFileName().toString());
		this.snapshotName = Pattern.compile(Pattern.quote(baseName + INFIX) + "(\\d+)" + Pattern.quote(SUFFIX));
		this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	}

	// ---- Public API ---------------------------------------------------------

	public Path snapshotPath(int n) {
		return directory.resolve(baseName + INFIX + n + SUFFIX);
	}

	/** Existing snapshot numbers, ascending. */
	public List<Integer> snapshotNumbers() throws IOException {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(directory)) {
			return files.map(p -> snapshotName.matcher(p.getFileName().toString()))
					.filter(Matcher::matches)
					.map(m -> Integer.parseInt(m.group(1)))
					.sorted()
					.collect(Collectors.toList());
		}
	}

	/** Highest existing snapshot number, 0 if there are none. */
	public int latestSnapshotNumber() throws IOException {
		List<Integer> numbers = snapshotNumbers();
		return numbers.isEmpty() ? 0 : numbers.get(numbers.size() - 1);
	}

	/**
	 * Writes {@code state} as snapshot {@code latest + 1}.
	 *
	 * @return the number written
	 */
	public int save(MappingState state) throws IOException {
		int n = latestSnapshotNumber() + 1;
		Path out = snapshotPath(n);
		Logger.info("Saving mapping to {}", out);
		try (OutputStream os = Files.newOutputStream(out, StandardOpenOption.CREATE_NEW,
				StandardOpenOption.WRITE)) {
			mapper.writeValue(os, MappingSnapshot.of(state));
		} catch (IOException ioe) {
			Logger.error("Error writing mapping snapshot {}: {}", out, ioe.getMessage());
			throw ioe;
		}
		return n;
	}

	/**
	 * @throws NoSnapshotFoundException if snapshot {@code n} does not exist
	 */
	public MappingState load(int n) throws IOException {
		Path in = snapshotPath(n);
		Logger.info("Loading mapping file {}", in);
		MappingSnapshot snapshot;
		try {
			snapshot = mapper.readValue(Files.readAllBytes(in), MappingSnapshot.class);
		} catch (NoSuchFileException nsfe) {
			throw new NoSnapshotFoundException("No mapping snapshot " + n + " at " + in);
		}
		return snapshot.toState();
	}

	/**
	 * @throws NoSnapshotFoundException if no snapshot exists yet
	 */
	public MappingState loadLatest() throws IOException {
		int n = latestSnapshotNumber();
		if (n == 0) {
			throw new NoSnapshotFoundException("No mapping files found for " + baseName + " in " + directory);
		}
		return load(n);
	}

	/**
	 * Deletes every snapshot, but only after the operator explicitly confirms.
	 *
	 * @return number of files removed (0 if not confirmed)
	 */
	public int clearSnapshots(OperatorPrompt prompt) throws IOException {
		if (!prompt.confirm("Are you sure you want to clear all mapping files?")) {
			Logger.info("Clearing mapping files cancelled");
			return 0;
		}
		int removed = 0;
		for (int n : snapshotNumbers()) {
			if (Files.deleteIfExists(snapshotPath(n))) {
				removed++;
			}
		}
		Logger.info("{} mapping files removed", removed);
		return removed;
	}

	public Path getDirectory() {
		return directory;
	}

	public String getBaseName() {
		return baseName;
	}

	// ---- Internals ----------------------------------------------------------

	static String stripExtension(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return (dot > 0) ? fileName.substring(0, dot) : fileName;
	}
}
