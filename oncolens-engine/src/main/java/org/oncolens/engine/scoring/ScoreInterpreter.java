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

import org.oncolens.engine.om.Interpretation;
import org.oncolens.engine.om.PgxSafetyAssessment;

/**
 * Bands a holistic score and writes the recommendation that goes with it.
 * Contraindication and ineligibility override the numeric bands.
 */
public final class ScoreInterpreter {

	public static final double HIGH = 0.8;
	public static final double MEDIUM = 0.6;
	public static final double LOW = 0.4;

	public ScoreInterpretation interpret(String trialId, double holistic, double mechanismFit, double eligibility,
			double pgxSafety, PgxSafetyAssessment pgx) {
		if (pgx != null && pgx.isContraindicated()) {
			return new ScoreInterpretation(Interpretation.CONTRAINDICATED, "⛔ CONTRAINDICATED for " + trialId + ": "
					+ pgx.getReason() + ". Consider an alternative trial without this drug class or enroll "
					+ "with a modified protocol (pre-approved dose adjustment).");
		}
		if (eligibility <= 0.0) {
			return new ScoreInterpretation(Interpretation.INELIGIBLE, "❌ INELIGIBLE for " + trialId
					+ ": Patient does not meet hard eligibility criteria (recruiting status, age, or other "
					+ "requirements). Consider alternative trials.");
		}
		if (holistic >= HIGH) {
			return new ScoreInterpretation(Interpretation.HIGH, fmt(
					"✅ HIGH PROBABILITY for %s (score: %.2f). Strong mechanism alignment (%.2f), meets eligibility "
							+ "(%.2f), and no significant PGx concerns (%.2f). Recommend proceeding with enrollment.",
					trialId, holistic, mechanismFit, eligibility, pgxSafety));
		}
		if (holistic >= MEDIUM) {
			List<String> concerns = new ArrayList<>();
			if (mechanismFit < 0.6)
				concerns.add(fmt("moderate mechanism fit (%.2f)", mechanismFit));
			if (eligibility < 0.8)
				concerns.add(fmt("eligibility concerns (%.2f)", eligibility));
			if (pgxSafety < 0.8)
				concerns.add(fmt("dose adjustment may be needed (%.2f)", pgxSafety));
			String why = concerns.isEmpty() ? "borderline scores" : String.join(", ", concerns);
			return new ScoreInterpretation(Interpretation.MEDIUM,
					fmt("⚠️ MODERATE PROBABILITY for %s (score: %.2f). Proceed with caution due to: %s. "
							+ "Consider additional workup before enrollment.", trialId, holistic, why));
		}
		if (holistic >= LOW) {
			return new ScoreInterpretation(Interpretation.LOW, fmt(
					"⚠️ LOW PROBABILITY for %s (score: %.2f). Significant concerns: mechanism fit=%.2f, "
							+ "eligibility=%.2f, PGx safety=%.2f. Consider alternative trials with better alignment.",
					trialId, holistic, mechanismFit, eligibility, pgxSafety));
		}
		return new ScoreInterpretation(Interpretation.VERY_LOW,
				fmt("❌ VERY LOW PROBABILITY for %s (score: %.2f). Poor alignment across multiple dimensions. "
						+ "Recommend alternative trial search.", trialId, holistic));
	}

	private static String fmt(String template, Object... args) {
		return String.format(Locale.ROOT, template, args);
	}
}
