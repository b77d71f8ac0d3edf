package org.snomap.conf;

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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.snomap.util.Logger;

/**
 * Loads SnoMap configuration from a {@code .properties} file.
 * <p>
 * By default the loader reads <code>config/snomap.properties</code> from the
 * classpath. Setting the system property <code>snomap.config</code> to a file
 * path takes precedence, and {@link #ConfigLoader(Path)} reads a specific file.
 * <p>
 * The release root may also be discovered from the
 * <code>SNOMED_DEFINITIONS</code> environment variable when the file does not
 * set it. This is the only place the environment is consulted; everything
 * downstream receives explicit values.
 *
 * <h3>Keys</h3>
 * <ul>
 * <li><code>SNOMED_DEFINITIONS</code> directory holding one subdirectory per
 * release (required by the ontology engine)</li>
 * <li><code>INPUT_FILE</code> freetext condition list, one per line (required by
 * the mapping workflow)</li>
 * <li><code>RELEASE_VARIANT</code> release file variant to accept (default
 * <code>Snapshot</code>)</li>
 * <li><code>GROUPINGS_OUTPUT</code> CSV export of the groupings table
 * (optional)</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/snomap.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "snomap.config";

	public static final String K_SNOMED_DEFINITIONS = "SNOMED_DEFINITIONS";
	public static final String K_INPUT_FILE = "INPUT_FILE";
	public static final String K_RELEASE_VARIANT = "RELEASE_VARIANT";
	public static final String K_GROUPINGS_OUTPUT = "GROUPINGS_OUTPUT";

	public static final String DEFAULT_RELEASE_VARIANT = "Snapshot";

	private final Properties properties = new Properties();
	private final Map<String, String> environment;

	/**
	 * Reads {@value #SYS_PROP_CONFIG_PATH} if set and readable, otherwise the
	 * classpath resource {@value #DEFAULT_CLASSPATH_RESOURCE}.
	 */
	public ConfigLoader() {
		this.environment = System.getenv();
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (StringUtils.isNotBlank(external)) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Reads a specific file on disk.
	 *
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		this(filePath, System.getenv());
	}

	/** Visible for tests: explicit file and environment. */
	ConfigLoader(Path filePath, Map<String, String> environment) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		this.environment = (environment == null) ? Map.of() : environment;
		loadFromFile(filePath);
	}

	/** Visible for tests and embedding: configuration from in-memory values. */
	public static ConfigLoader fromProperties(Properties values) {
		return new ConfigLoader(values, Map.of());
	}

	private ConfigLoader(Properties values, Map<String, String> environment) {
		this.environment = environment;
		if (values != null) {
			properties.putAll(values);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Reports missing or inconsistent keys without throwing, so the caller can
	 * decide whether to fail fast.
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		if (getOptional(K_SNOMED_DEFINITIONS, null) == null) {
			issues.add("Missing required property: " + K_SNOMED_DEFINITIONS);
		} else if (!Files.isDirectory(getSnomedDefinitionsPath())) {
			issues.add(K_SNOMED_DEFINITIONS + " is not a directory: " + getSnomedDefinitionsPath());
		}
		if (getOptional(K_INPUT_FILE, null) == null) {
			issues.add("Missing required property: " + K_INPUT_FILE);
		}
		String variant = properties.getProperty(K_RELEASE_VARIANT);
		if (variant != null && variant.isBlank()) {
			issues.add("Warning: " + K_RELEASE_VARIANT + " is blank; using " + DEFAULT_RELEASE_VARIANT);
		}
		return issues;
	}

	/** Root directory with one subdirectory per release. */
	public Path getSnomedDefinitionsPath() {
		return Path.of(getRequired(K_SNOMED_DEFINITIONS));
	}

	/** Freetext condition list driving the mapping workflow. */
	public Path getInputFile() {
		return Path.of(getRequired(K_INPUT_FILE));
	}

	public String getReleaseVariant() {
		return getOptional(K_RELEASE_VARIANT, DEFAULT_RELEASE_VARIANT);
	}

	/**
	 * CSV export of the groupings table; defaults to
	 * {@code <input-base>_groupings.csv} beside the input file.
	 */
	public Path getGroupingsOutput(Path inputFile) {
		String v = getOptional(K_GROUPINGS_OUTPUT, null);
		if (v != null) {
			return Path.of(v);
		}
		String base = inputFile.getFileName().toString();
		int dot = base.lastIndexOf('.');
		if (dot > 0) {
			base = base.substring(0, dot);
		}
		return inputFile.resolveSibling(base + "_groupings.csv");
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.warn("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from classpath: {}", resource, ex);
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from file: {}", file, ex);
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new ConfigurationMissingException(key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (StringUtils.isBlank(v) && K_SNOMED_DEFINITIONS.equals(key)) {
			v = environment.get(key);
		}
		return StringUtils.isBlank(v) ? defaultVal : v.trim();
	}
}
