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
import org.oncolens.engine.util.Scores;

/**
 * Guards the IO pathway composite: decides whether it may be used instead of
 * TMB/MSI and degrades it for out-of-distribution inputs.
 */
public final class IoPathwaySafety {

	public static final Set<String> VALIDATED_CANCER_TYPES = Set.of("melanoma");

	/** Tumor types with IO data but no validation of this model. */
	public static final Set<String> KNOWN_UNVALIDATED_CANCER_TYPES = Set.of("nsclc", "lung", "renal", "rcc",
			"bladder", "colorectal", "ovarian", "breast", "gastric", "hcc", "liver", "pancreatic", "prostate");

	public static final double MIN_RELIABLE_COMPOSITE = 0.1;
	public static final double ADJUSTED_FLOOR = 0.1;
	public static final double ADJUSTED_CEILING = 0.9;

	private static final String DISCLAIMER = "RESEARCH USE ONLY (RUO): IO pathway predictions are based on "
			+ "retrospective analysis of " + IoPathwayModel.COHORT + " (n=" + IoPathwayModel.COHORT_SIZE
			+ " melanoma samples, nivolumab). Not validated for clinical decision-making.";

	public static boolean isValidated(String cancerType) {
		return cancerType != null && VALIDATED_CANCER_TYPES.contains(cancerType.trim().toLowerCase(Locale.ROOT));
	}

	/**
	 * Pathway output is set aside for TMB/MSI only when TMB/MSI exists to fall
	 * back to. Without a fallback signal the pathway is always used.
	 */
	public PathwayDecision decide(double rawComposite, String cancerType, ExpressionQuality quality,
			BiomarkerRecord record) {
		boolean fallbackAvailable = record != null && (record.isTmbMeasured() || record.isMsiHigh());
		if (!fallbackAvailable) {
			return PathwayDecision.use();
		}
		if (StringUtils.isNotBlank(cancerType) && !isValidated(cancerType)) {
			return PathwayDecision.fallback("Pathway prediction not validated for " + cancerType
					+ ". Fallback to TMB/MSI (validated only for melanoma).");
		}
		if (quality != null && !quality.isAcceptable()) {
			return PathwayDecision
					.fallback("Expression data quality insufficient. Fallback to TMB/MSI (pathway coverage too low).");
		}
		if (rawComposite < MIN_RELIABLE_COMPOSITE) {
			return PathwayDecision.fallback(String.format(Locale.ROOT,
					"Very low pathway composite (%.3f < 0.1). Fallback to TMB/MSI (more reliable for very low scores).",
					rawComposite));
		}
		return PathwayDecision.use();
	}

	public PathwayConfidence adjust(double rawComposite, String cancerType, ExpressionQuality quality) {
		Map<String, Double> factors = new LinkedHashMap<>();
		List<String> warnings = new ArrayList<>();
		double multiplier = 1.0;

		// cancer type
		double typeFactor;
		if (StringUtils.isBlank(cancerType)) {
			typeFactor = 0.6;
			warnings.add("Cancer type not specified. IO pathway prediction confidence degraded by 40%.");
		} else if (isValidated(cancerType)) {
			typeFactor = 1.0;
		} else if (matchesKnownUnvalidated(cancerType)) {
			typeFactor = 0.7;
			warnings.add("IO pathway prediction not validated for " + cancerType
					+ ". Confidence degraded by 30%. Validated only for melanoma (" + IoPathwayModel.COHORT + ").");
		} else {
			typeFactor = 0.5;
			warnings.add("IO pathway prediction not validated for " + cancerType
					+ ". Confidence degraded by 50%. Use with extreme caution.");
		}
		factors.put("cancer_type", typeFactor);
		multiplier *= typeFactor;

		// expression quality and pathway coverage
		if (quality != null) {
			double avg = quality.getAverageCoverage();
			double qualityFactor = 1.0;
			if (avg < ExpressionQuality.MIN_PATHWAY_COVERAGE) {
				qualityFactor = Math.max(0.5, avg / ExpressionQuality.MIN_PATHWAY_COVERAGE);
				warnings.add(String.format(Locale.ROOT, "Low pathway gene coverage (%.1f%% < 30.0%%).", avg * 100));
			}
			factors.put("expression_quality", qualityFactor);
			multiplier *= qualityFactor;

			double coverageFactor = avg < 0.5 ? Math.max(0.6, avg) : 1.0;
			factors.put("pathway_coverage", coverageFactor);
			multiplier *= coverageFactor;

			if (quality.getTotalGenes() < ExpressionQuality.MIN_TOTAL_GENES) {
				warnings.add("Low gene count (" + quality.getTotalGenes()
						+ " genes). Pathway scores may be unreliable.");
			}
		} else {
			factors.put("expression_quality", 0.8);
			factors.put("pathway_coverage", 0.85);
			multiplier *= 0.8 * 0.85;
			warnings.add("Expression data quality not assessed. Confidence degraded by 20%.");
		}

		// extreme raw scores are the least reliable
		double extremeFactor = 1.0;
		if (rawComposite < 0.1 || rawComposite > 0.9) {
			extremeFactor = 0.9;
			warnings.add(String.format(Locale.ROOT, "Extreme composite score (%.3f). Confidence degraded by 10%%.",
					rawComposite));
		}
		factors.put("score_uncertainty", extremeFactor);
		multiplier *= extremeFactor;

		double adjusted = Scores.clamp(rawComposite * multiplier, ADJUSTED_FLOOR, ADJUSTED_CEILING);
		return new PathwayConfidence(rawComposite, adjusted, multiplier, Collections.unmodifiableMap(factors),
				Collections.unmodifiableList(warnings));
	}

	public String disclaimer(String cancerType) {
		if (StringUtils.isNotBlank(cancerType) && !isValidated(cancerType)) {
			return DISCLAIMER + " NOT VALIDATED for " + cancerType
					+ ". Validated only for melanoma. Use with extreme caution.";
		}
		return DISCLAIMER;
	}

	private static boolean matchesKnownUnvalidated(String cancerType) {
		String lower = cancerType.toLowerCase(Locale.ROOT);
		return KNOWN_UNVALIDATED_CANCER_TYPES.stream().anyMatch(lower::contains);
	}
}
