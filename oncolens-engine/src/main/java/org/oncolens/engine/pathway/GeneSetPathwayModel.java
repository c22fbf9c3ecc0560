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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.oncolens.engine.util.Logger;
import org.oncolens.engine.util.Scores;

/**
 * Base for models that score a pathway as the mean of log2(value + 1) over the
 * pathway genes present in the profile.
 */
public abstract class GeneSetPathwayModel implements PathwayScoreProvider {

	private final Map<String, List<String>> pathways;

	protected GeneSetPathwayModel(Map<String, List<String>> pathways) {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		pathways.forEach((k, v) -> copy.put(k, List.copyOf(v)));
		this.pathways = Collections.unmodifiableMap(copy);
	}

	public Map<String, List<String>> getPathways() {
		return pathways;
	}

	/** Score reported for a pathway with no covered genes. */
	protected abstract double emptyPathwayScore();

	/** Pathways whose coverage decides whether the profile is usable. */
	protected Map<String, List<String>> qualityPathways() {
		return pathways;
	}

	@Override
	public Map<String, Double> computePathwayScores(Map<String, Double> expression) {
		Map<String, Double> byGene = upperCased(expression);
		Map<String, Double> scores = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> e : pathways.entrySet()) {
			double sum = 0.0;
			int n = 0;
			for (String gene : e.getValue()) {
				Double v = byGene.get(gene);
				if (v == null || v.isNaN())
					continue;
				sum += Scores.log2p1(v);
				n++;
			}
			double score = n == 0 ? emptyPathwayScore() : sum / n;
			scores.put(e.getKey(), score);
			Logger.trace("Pathway {}: {}/{} genes, score={}", e.getKey(), n, e.getValue().size(), score);
		}
		return Collections.unmodifiableMap(scores);
	}

	@Override
	public ExpressionQuality assessQuality(Map<String, Double> expression) {
		return ExpressionQuality.assess(upperCased(expression).keySet(), qualityPathways());
	}

	protected static Map<String, Double> upperCased(Map<String, Double> expression) {
		Map<String, Double> out = new HashMap<>();
		if (expression == null)
			return out;
		for (Map.Entry<String, Double> e : expression.entrySet()) {
			if (e.getKey() != null && e.getValue() != null && !e.getValue().isNaN()) {
				out.put(e.getKey().trim().toUpperCase(Locale.ROOT), e.getValue());
			}
		}
		return out;
	}
}
