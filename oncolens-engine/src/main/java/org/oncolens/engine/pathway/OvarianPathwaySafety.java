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

import org.apache.commons.lang3.StringUtils;
import org.oncolens.engine.om.BiomarkerRecord;

/**
 * Guards the ovarian resistance composite. The validation cohort is small, so
 * every adjusted score carries a sample-size penalty.
 */
public final class OvarianPathwaySafety {

	public static final Set<String> VALIDATED_CANCER_TYPES = Set.of("ovarian", "ovarian_cancer", "hgsoc");

	public static final double MIN_RELIABLE_COMPOSITE = 0.10;
	public static final double SAMPLE_SIZE_FACTOR = 0.85;

	private static final String DISCLAIMER = "Research Use Only (RUO): Ovarian cancer pathway-based resistance "
			+ "prediction is validated on " + OvarianPathwayModel.COHORT + " (n=" + OvarianPathwayModel.COHORT_SIZE
			+ " HGSOC patients, AUC=0.750). Not validated for clinical decision-making.";

	public static boolean isValidated(String cancerType) {
		return cancerType != null && VALIDATED_CANCER_TYPES.contains(cancerType.trim().toLowerCase(Locale.ROOT));
	}

	public PathwayDecision decide(double rawComposite, String cancerType, ExpressionQuality quality,
			BiomarkerRecord record) {
		if (StringUtils.isNotBlank(cancerType) && !isValidated(cancerType)) {
			return PathwayDecision.fallback("Cancer type '" + cancerType
					+ "' not validated for ovarian pathway prediction. Validated types: ovarian, ovarian_cancer, hgsoc ("
					+ OvarianPathwayModel.COHORT + ").");
		}
		if (quality != null && !quality.isAcceptable()) {
			return PathwayDecision.fallback(String.format(Locale.ROOT,
					"Low pathway coverage (%.1f%% < 30.0%%). Insufficient genes for reliable pathway prediction.",
					quality.getAverageCoverage() * 100));
		}
		if (rawComposite < MIN_RELIABLE_COMPOSITE && record != null && record.getHrdScore() != null) {
			return PathwayDecision.fallback(String.format(Locale.ROOT,
					"Very low composite score (%.3f < 0.10). Prefer HRD-based PARP logic.", rawComposite));
		}
		return PathwayDecision.use();
	}

	public PathwayConfidence adjust(double rawComposite, String cancerType, ExpressionQuality quality) {
		Map<String, Double> factors = new LinkedHashMap<>();
		List<String> warnings = new ArrayList<>();
		double multiplier = 1.0;

		double typeFactor;
		if (StringUtils.isBlank(cancerType)) {
			typeFactor = 0.6;
			warnings.add("Cancer type not specified. Confidence degraded by 40%.");
		} else if (isValidated(cancerType)) {
			typeFactor = 1.0;
		} else {
			typeFactor = 0.7;
			warnings.add("Cancer type '" + cancerType + "' not validated. Confidence degraded by 30%.");
		}
		factors.put("cancer_type", typeFactor);
		multiplier *= typeFactor;

		if (quality != null) {
			double avg = quality.getAverageCoverage();
			double qualityFactor = 1.0;
			if (avg < ExpressionQuality.MIN_PATHWAY_COVERAGE) {
				qualityFactor = Math.max(0.5, avg / ExpressionQuality.MIN_PATHWAY_COVERAGE);
				warnings.add(String.format(Locale.ROOT, "Low pathway coverage (%.1f%% < 30.0%%).", avg * 100));
			}
			factors.put("expression_quality", qualityFactor);
			multiplier *= qualityFactor;
			if (quality.getTotalGenes() < ExpressionQuality.MIN_TOTAL_GENES) {
				warnings.add("Low gene count (" + quality.getTotalGenes() + " < " + ExpressionQuality.MIN_TOTAL_GENES
						+ "). Pathway prediction may be unreliable.");
			}
		}

		factors.put("sample_size", SAMPLE_SIZE_FACTOR);
		multiplier *= SAMPLE_SIZE_FACTOR;
		warnings.add(OvarianPathwayModel.COHORT + " validation cohort is small (n=" + OvarianPathwayModel.COHORT_SIZE
				+ "). Confidence degraded by 15%.");

		return new PathwayConfidence(rawComposite, rawComposite * multiplier, multiplier,
				Collections.unmodifiableMap(factors), Collections.unmodifiableList(warnings));
	}

	public String disclaimer() {
		return DISCLAIMER;
	}
}
