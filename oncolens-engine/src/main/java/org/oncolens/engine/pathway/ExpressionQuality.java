package org.oncolens.engine.pathway;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import lombok.Value;

/**
 * How much of each pathway's gene set an expression profile covers.
 */
@Value
public class ExpressionQuality {

	/** Below this average coverage the profile is not trusted. */
	public static final double MIN_PATHWAY_COVERAGE = 0.3;

	/** Profiles smaller than this get a warning but are not rejected. */
	public static final int MIN_TOTAL_GENES = 1000;

	int totalGenes;
	Map<String, Double> pathwayCoverage;
	double averageCoverage;
	boolean acceptable;
	List<String> warnings;

	/**
	 * @param expressedGenes upper-cased symbols present in the profile
	 * @param pathways       pathway name to gene set, only those that matter
	 */
	public static ExpressionQuality assess(Set<String> expressedGenes, Map<String, List<String>> pathways) {
		Map<String, Double> coverage = new LinkedHashMap<>();
		List<String> warnings = new ArrayList<>();

		double sum = 0.0;
		for (Map.Entry<String, List<String>> e : pathways.entrySet()) {
			List<String> genes = e.getValue();
			long found = genes.stream().filter(expressedGenes::contains).count();
			double cov = genes.isEmpty() ? 0.0 : (double) found / genes.size();
			coverage.put(e.getKey(), cov);
			sum += cov;
			if (cov < MIN_PATHWAY_COVERAGE) {
				warnings.add(String.format(Locale.ROOT, "%s: only %d/%d genes found (%.1f%% coverage, minimum %.1f%%)",
						e.getKey(), found, genes.size(), cov * 100, MIN_PATHWAY_COVERAGE * 100));
			}
		}
		double avg = pathways.isEmpty() ? 0.0 : sum / pathways.size();
		boolean acceptable = avg >= MIN_PATHWAY_COVERAGE;
		if (!acceptable) {
			warnings.add(String.format(Locale.ROOT, "Average pathway coverage (%.1f%%) below minimum (%.1f%%)", avg * 100,
					MIN_PATHWAY_COVERAGE * 100));
		}
		if (expressedGenes.size() < MIN_TOTAL_GENES) {
			warnings.add("Low gene count (" + expressedGenes.size() + " genes). Expression data may be incomplete.");
		}
		return new ExpressionQuality(expressedGenes.size(), Collections.unmodifiableMap(coverage), avg, acceptable,
				Collections.unmodifiableList(warnings));
	}
}
