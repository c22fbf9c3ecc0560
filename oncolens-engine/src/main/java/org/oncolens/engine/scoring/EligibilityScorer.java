package org.oncolens.engine.scoring;

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
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.oncolens.engine.om.EligibilityAssessment;
import org.oncolens.engine.om.PatientProfile;
import org.oncolens.engine.om.SomaticMutation;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.om.TrialLocation;
import org.oncolens.engine.util.Scores;

/**
 * Rule-based eligibility checklist. Recruiting status and age are hard gates;
 * disease, location and biomarker coverage are soft.
 */
public final class EligibilityScorer {

	public static final String HARD_FAIL_LINE = "⛔ HARD CRITERIA FAILED";

	static final int DEFAULT_MIN_AGE = 0;
	static final int DEFAULT_MAX_AGE = 120;

	public EligibilityAssessment assess(PatientProfile patient, TrialDescriptor trial) {
		List<String> breakdown = new ArrayList<>();
		List<Double> components = new ArrayList<>();
		boolean hardFail = false;

		// 1. recruiting status
		String status = StringUtils.defaultString(trial.getOverallStatus()).toUpperCase(Locale.ROOT);
		if (status.contains("RECRUITING") || status.contains("ACTIVE")) {
			breakdown.add("✅ Recruiting/Active");
			components.add(1.0);
		} else {
			breakdown.add("❌ Not recruiting");
			components.add(0.0);
			hardFail = true;
		}

		// 2. disease
		String disease = StringUtils.defaultString(patient.getDisease()).trim().toLowerCase(Locale.ROOT);
		List<String> conditions = trial.getConditions() == null ? List.of()
				: trial.getConditions().stream().filter(Objects::nonNull)
						.map(c -> c.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toList());
		if (conditions.isEmpty()) {
			breakdown.add("⚠️ No conditions listed");
			components.add(0.7);
		} else if (!disease.isEmpty() && conditions.stream().anyMatch(c -> c.contains(disease) || disease.contains(c))) {
			breakdown.add("✅ Disease match");
			components.add(1.0);
		} else {
			breakdown.add("⚠️ Disease match uncertain");
			components.add(0.5);
		}

		// 3. age
		Integer age = patient.getAge();
		if (age == null) {
			breakdown.add("⚠️ Patient age not provided");
			components.add(0.7);
		} else {
			Integer min = parseAge(trial.getMinimumAge(), DEFAULT_MIN_AGE);
			Integer max = parseAge(trial.getMaximumAge(), DEFAULT_MAX_AGE);
			if (min == null || max == null) {
				breakdown.add("⚠️ Age criteria unclear");
				components.add(0.7);
			} else if (age >= min && age <= max) {
				breakdown.add("✅ Age eligible (" + age + " in " + min + "-" + max + ")");
				components.add(1.0);
			} else {
				breakdown.add("❌ Age ineligible (" + age + " not in " + min + "-" + max + ")");
				components.add(0.0);
				hardFail = true;
			}
		}

		// 4. location, only when both sides are known
		TrialLocation home = patient.getLocation();
		List<TrialLocation> sites = trial.getLocations();
		if (home != null && StringUtils.isNotBlank(home.getState()) && sites != null && !sites.isEmpty()) {
			String state = home.getState().trim().toUpperCase(Locale.ROOT);
			boolean match = sites.stream().filter(Objects::nonNull).map(TrialLocation::getState)
					.filter(StringUtils::isNotBlank).anyMatch(s -> s.trim().toUpperCase(Locale.ROOT).equals(state));
			if (match) {
				breakdown.add("✅ Location match (" + state + ")");
				components.add(1.0);
			} else {
				breakdown.add("⚠️ Location distant (patient: " + state + ")");
				components.add(0.5);
			}
		}

		// 5. biomarker requirements
		List<String> required = trial.getBiomarkerRequirements();
		if (required != null && !required.isEmpty()) {
			Set<String> genes = patientGenes(patient);
			long matched = required.stream().filter(Objects::nonNull)
					.filter(r -> genes.contains(r.trim().toUpperCase(Locale.ROOT))).count();
			double coverage = (double) matched / required.size();
			String counts = "(" + matched + "/" + required.size() + ")";
			if (coverage >= 0.8) {
				breakdown.add("✅ Biomarkers match " + counts);
			} else if (coverage >= 0.5) {
				breakdown.add("⚠️ Partial biomarker match " + counts);
			} else {
				breakdown.add("❌ Biomarker mismatch " + counts);
			}
			components.add(coverage);
		}

		double score;
		if (hardFail) {
			score = 0.0;
			breakdown.add(HARD_FAIL_LINE);
		} else {
			score = components.stream().mapToDouble(Double::doubleValue).average().orElse(0.5);
		}
		return new EligibilityAssessment(Scores.round3(score), List.copyOf(breakdown), hardFail);
	}

	/**
	 * Registry age bound such as "18 Years". Blank uses the default; anything
	 * that is not a whole number of years is {@code null}.
	 */
	static Integer parseAge(String raw, int defaultAge) {
		if (StringUtils.isBlank(raw))
			return defaultAge;
		String s = raw.replace("Years", "").replace("years", "").replace("Year", "").replace("year", "").trim();
		try {
			return Integer.parseInt(s);
		} catch (NumberFormatException nfe) {
			return null;
		}
	}

	private static Set<String> patientGenes(PatientProfile patient) {
		if (patient.getMutations() == null)
			return Set.of();
		return patient.getMutations().stream().filter(Objects::nonNull).map(SomaticMutation::getGene)
				.filter(StringUtils::isNotBlank).map(g -> g.trim().toUpperCase(Locale.ROOT))
				.collect(Collectors.toSet());
	}
}
