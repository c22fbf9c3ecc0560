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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@BeforeEach
	void rememberSysProp() {
		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
	}

	@AfterEach
	void restoreSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	private Properties minimalRequiredProps() {
		Properties p = new Properties();
		p.setProperty("PGX_TABLE_RESOURCE", "pgx/pgx_toxicity.csv");
		return p;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void default_constructor_reads_classpath_resource() {
		System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		ConfigLoader loader = new ConfigLoader();

		assertEquals("pgx/pgx_toxicity.csv", loader.getPgxTableResource());
		assertEquals("1.0", loader.getEngineVersion());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void loads_from_file() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("ENGINE_VERSION", "2.1");
		Path f = writePropsFile(p, "conf1.properties");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals("pgx/pgx_toxicity.csv", loader.getPgxTableResource());
		assertEquals("2.1", loader.getEngineVersion());
	}

	@Test
	void validate_reports_missing_required_keys() throws Exception {
		Path f = writePropsFile(new Properties(), "conf_missing.properties");

		List<String> issues = new ConfigLoader(f).validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: PGX_TABLE_RESOURCE")));
	}

	@Test
	void validate_flags_non_numeric_parallel_limit() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("PARALLEL_TRIAL_LIMIT", "lots");
		Path f = writePropsFile(p, "bad_limit.properties");

		List<String> issues = new ConfigLoader(f).validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("PARALLEL_TRIAL_LIMIT")));
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("PGX_TABLE_RESOURCE", "/data/custom_pgx.csv");
		Path f = writePropsFile(p, "override.properties");

		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();
		assertEquals("/data/custom_pgx.csv", loader.getPgxTableResource());
	}

	@Test
	void unreadable_system_property_falls_back_to_classpath() {
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, tmp.resolve("nope.properties").toString());

		ConfigLoader loader = new ConfigLoader();
		assertEquals("pgx/pgx_toxicity.csv", loader.getPgxTableResource());
	}

	@Test
	void parallel_limit_caps_at_cores() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("PARALLEL_TRIAL_LIMIT", "9999");
		Path f = writePropsFile(p, "parallel.properties");

		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		assertEquals(cores, new ConfigLoader(f).getParallelTrialLimit());
	}

	@Test
	void parallel_limit_defaults_when_blank_or_invalid() throws Exception {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int expected = Math.max(1, (int) Math.floor(cores / 4.0));

		Properties blank = minimalRequiredProps();
		blank.setProperty("PARALLEL_TRIAL_LIMIT", "");
		assertEquals(expected, new ConfigLoader(writePropsFile(blank, "blank.properties")).getParallelTrialLimit());

		Properties zero = minimalRequiredProps();
		zero.setProperty("PARALLEL_TRIAL_LIMIT", "0");
		assertEquals(expected, new ConfigLoader(writePropsFile(zero, "zero.properties")).getParallelTrialLimit());

		Properties junk = minimalRequiredProps();
		junk.setProperty("PARALLEL_TRIAL_LIMIT", "x");
		assertEquals(expected, new ConfigLoader(writePropsFile(junk, "junk.properties")).getParallelTrialLimit());
	}

	@Test
	void required_getter_throws_when_missing() throws Exception {
		ConfigLoader loader = new ConfigLoader(writePropsFile(new Properties(), "empty.properties"));
		assertThrows(IllegalStateException.class, loader::getPgxTableResource);
	}

	@Test
	void constructor_rejects_unreadable_file() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("missing.properties")));
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(null));
	}
}
