package org.oncolens.engine.pgx;

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
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.ToxicityTier;
import org.oncolens.engine.util.Logger;

/**
 * Read-only PGx table loaded once from CSV.
 *
 * <p>Columns: {@code drug, gene, variant, toxicity_tier, adjustment_factor}.
 * A variant of {@code *} matches any variant of that gene for the drug; an
 * exact variant row wins over the wildcard. Drug and variant match
 * case-insensitively, genes are upper-cased.</p>
 */
public final class PgxToxicityTable implements PgxLookup {

	public static final String WILDCARD = "*";

	private static final String COL_DRUG = "drug";
	private static final String COL_GENE = "gene";
	private static final String COL_VARIANT = "variant";
	private static final String COL_TIER = "toxicity_tier";
	private static final String COL_FACTOR = "adjustment_factor";

	private final Map<String, PgxLookupResult> entries;

	PgxToxicityTable(Map<String, PgxLookupResult> entries) {
		this.entries = Collections.unmodifiableMap(new HashMap<>(entries));
	}

	/**
	 * Loads from the classpath, or from the filesystem when no such resource
	 * exists.
	 *
	 * @throws IllegalStateException if neither location is readable or the CSV
	 *                               cannot be parsed
	 */
	public static PgxToxicityTable load(String location) {
		if (StringUtils.isBlank(location)) {
			throw new IllegalStateException("PGx table location is blank");
		}
		try (InputStream in = PgxToxicityTable.class.getClassLoader().getResourceAsStream(location)) {
			if (in != null) {
				return read(new InputStreamReader(in, StandardCharsets.UTF_8), location);
			}
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read PGx table from classpath: " + location, ex);
		}
		Path p = Path.of(location);
		if (!Files.isReadable(p)) {
			throw new IllegalStateException("PGx table not found on classpath or filesystem: " + location);
		}
		try (Reader reader = Files.newBufferedReader(p, StandardCharsets.UTF_8)) {
			return read(reader, location);
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read PGx table: " + p, ex);
		}
	}

	static PgxToxicityTable read(Reader reader, String source) throws IOException {
		CSVFormat csvFormat = CSVFormat.DEFAULT.withDelimiter(',').withHeader().withIgnoreHeaderCase().withTrim();
		Map<String, PgxLookupResult> rows = new HashMap<>();
		int skipped = 0;

		try (CSVParser csvParser = new CSVParser(reader, csvFormat)) {
			for (CSVRecord r : csvParser) {
				if (!r.isConsistent()) {
					Logger.warn("Skipping short PGx row {} in {}", r.getRecordNumber(), source);
					skipped++;
					continue;
				}
				String drug = r.get(COL_DRUG);
				String gene = r.get(COL_GENE);
				String variant = StringUtils.defaultIfBlank(r.get(COL_VARIANT), WILDCARD);
				ToxicityTier tier = ToxicityTier.parse(r.get(COL_TIER));
				Double factor = parseFactor(r.get(COL_FACTOR));

				if (StringUtils.isAnyBlank(drug, gene) || tier == null || factor == null) {
					Logger.warn("Skipping malformed PGx row {} in {}", r.getRecordNumber(), source);
					skipped++;
					continue;
				}
				rows.put(key(drug, gene, variant), new PgxLookupResult(tier, factor));
			}
		}
		Logger.info("Loaded {} PGx rows from {} ({} skipped)", rows.size(), source, skipped);
		return new PgxToxicityTable(rows);
	}

	@Override
	public PgxLookupResult lookup(String drugName, String gene, String variant) {
		if (StringUtils.isAnyBlank(drugName, gene))
			return PgxLookupResult.NO_KNOWN_RISK;

		String v = StringUtils.defaultIfBlank(variant, WILDCARD);
		PgxLookupResult exact = entries.get(key(drugName, gene, v));
		if (exact != null)
			return exact;
		return entries.getOrDefault(key(drugName, gene, WILDCARD), PgxLookupResult.NO_KNOWN_RISK);
	}

	public int size() {
		return entries.size();
	}

	private static String key(String drug, String gene, String variant) {
		return drug.trim().toLowerCase(Locale.ROOT) + "|" + gene.trim().toUpperCase(Locale.ROOT) + "|"
				+ variant.trim().toLowerCase(Locale.ROOT);
	}

	private static Double parseFactor(String raw) {
		if (StringUtils.isBlank(raw))
			return null;
		try {
			double f = Double.parseDouble(raw.trim());
			if (Double.isNaN(f) || f < 0.0 || f > 1.0)
				return null;
			return f;
		} catch (NumberFormatException nfe) {
			return null;
		}
	}
}
