package org.oncolens.engine.conf;

/*
 * This file is part of OncoLens.
 *
 * Copyright (C) 2026 OncoLens contributors
 *
 * OncoLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * OncoLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with OncoLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.oncolens.engine.util.Logger;

/**
 * Loads engine configuration from a {@code .properties} file.
 * <p>
 * By default the loader reads <code>config/oncolens.properties</code> from the
 * classpath. Set the system property <code>oncolens.config</code> to an
 * absolute path to use an external file instead, or call
 * {@link #ConfigLoader(Path)} directly.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Clinical thresholds and model coefficients are constants in code. Only
 * deployment concerns (lookup table location, parallelism) live here.</li>
 * <li>{@link #getParallelTrialLimit()} never exceeds the core count.</li>
 * <li>Call {@link #validate()} at startup to list missing keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/oncolens.properties";

	/** System property pointing to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "oncolens.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_PGX_TABLE_RESOURCE = "PGX_TABLE_RESOURCE";
	private static final String K_PARALLEL_TRIAL_LIMIT = "PARALLEL_TRIAL_LIMIT";
	private static final String K_ENGINE_VERSION = "ENGINE_VERSION";

	private static final String DEFAULT_ENGINE_VERSION = "1.0";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Reads {@value #SYS_PROP_CONFIG_PATH} when it names a readable file,
	 * otherwise the classpath resource {@value #DEFAULT_CLASSPATH_RESOURCE}.
	 */
	public ConfigLoader() {
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
	 * @param filePath path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks the keys the engine needs. Never throws; the caller decides whether
	 * an issue is fatal.
	 *
	 * @return human-readable issues, empty when the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		requireNonBlank(K_PGX_TABLE_RESOURCE, issues);

		String limit = properties.getProperty(K_PARALLEL_TRIAL_LIMIT);
		if (StringUtils.isNotBlank(limit) && !StringUtils.isNumeric(limit.trim())) {
			issues.add(K_PARALLEL_TRIAL_LIMIT + " must be a positive integer: '" + limit.trim() + "'");
		}
		return issues;
	}

	/**
	 * Location of the PGx toxicity CSV. Tried as a classpath resource first, then
	 * as a filesystem path.
	 */
	public String getPgxTableResource() {
		return getRequired(K_PGX_TABLE_RESOURCE);
	}

	/**
	 * Worker count for batch trial scoring. Defaults to ~25% of available cores,
	 * never more than the core count.
	 */
	public int getParallelTrialLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));

		String raw = getOptional(K_PARALLEL_TRIAL_LIMIT, null);
		if (raw == null)
			return defaultLimit;
		try {
			int val = Integer.parseInt(raw);
			if (val <= 0)
				return defaultLimit;
			return Math.min(val, cores);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_PARALLEL_TRIAL_LIMIT, raw, defaultLimit);
			return defaultLimit;
		}
	}

	/** Version string stamped into score provenance. */
	public String getEngineVersion() {
		return getOptional(K_ENGINE_VERSION, DEFAULT_ENGINE_VERSION);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from classpath: {}", ex, resource);
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from file: {}", ex, file);
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (StringUtils.isBlank(properties.getProperty(key))) {
			issues.add("Missing required property: " + key);
		}
	}
}
