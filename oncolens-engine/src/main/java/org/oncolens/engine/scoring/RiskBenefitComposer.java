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
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.oncolens.engine.om.DrugEfficacy;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.RankedDrug;
import org.oncolens.engine.om.RiskBenefitAction;
import org.oncolens.engine.om.RiskBenefitResult;
import org.oncolens.engine.om.ToxicityTier;
import org.oncolens.engine.util.Scores;

/**
 * Folds PGx toxicity into an efficacy score for drug ranking.
 * <ul>
 * <li>no PGx data: efficacy as is, flagged unscreened</li>
 * <li>HIGH tier or factor &le; 0.1: hard veto, 0.0</li>
 * <li>MODERATE tier or factor &lt; 0.8: efficacy x factor</li>
 * <li>otherwise: efficacy as is</li>
 * </ul>
 */
public final class RiskBenefitComposer {

	public static final double VETO_FACTOR = 0.1;
	public static final double PENALTY_FACTOR = 0.8;

	public RiskBenefitResult composeRiskBenefit(double efficacy, ToxicityTier tier, Double adjustmentFactor) {
		double eff = Scores.clamp01(efficacy);
		RiskBenefitResult.RiskBenefitResultBuilder out = RiskBenefitResult.builder().efficacyScore(eff);

		if (tier == null || adjustmentFactor == null) {
			return out.compositeScore(eff)
					.action(RiskBenefitAction.PREFERRED_UNSCREENED)
					.rationale("No PGx screening data available - using efficacy score only")
					.provenanceEntry("pgx_screened", false)
					.provenanceEntry("composition_method", "efficacy_only")
					.build();
		}

		double factor = Scores.clamp01(adjustmentFactor);
		out.toxicityTier(tier).adjustmentFactor(factor).provenanceEntry("pgx_screened", true);

		if (tier == ToxicityTier.HIGH || factor <= VETO_FACTOR) {
			return out.compositeScore(0.0)
					.action(RiskBenefitAction.AVOID)
					.rationale(String.format(Locale.ROOT,
							"High toxicity risk (%s, adjustment=%.2f) - hard veto applied", tier, factor))
					.provenanceEntry("composition_method", "hard_veto")
					.provenanceEntry("veto_reason", "high_toxicity")
					.build();
		}

		if (tier == ToxicityTier.MODERATE || factor < PENALTY_FACTOR) {
			double composite = Scores.round3(eff * factor);
			return out.compositeScore(composite)
					.action(RiskBenefitAction.CONSIDER_WITH_MONITORING)
					.rationale(String.format(Locale.ROOT,
							"Moderate toxicity risk (%s, adjustment=%.2f) - score penalized: %.3f × %.2f = %.3f", tier,
							factor, eff, factor, composite))
					.provenanceEntry("composition_method", "penalized")
					.provenanceEntry("penalty_factor", factor)
					.build();
		}

		return out.compositeScore(eff)
				.action(RiskBenefitAction.PREFERRED)
				.rationale(String.format(Locale.ROOT, "Low toxicity risk (%s, adjustment=%.2f) - no penalty applied",
						tier, factor))
				.provenanceEntry("composition_method", "no_penalty")
				.build();
	}

	/**
	 * Composes each drug against its PGx result (looked up by drug name) and
	 * sorts by composite, highest first. Ties keep input order.
	 */
	public List<RankedDrug> composeDrugRanking(List<DrugEfficacy> drugs, Map<String, PgxLookupResult> screening) {
		List<RankedDrug> ranked = new ArrayList<>();
		if (drugs == null)
			return ranked;
		Map<String, PgxLookupResult> byDrug = screening == null ? Map.of() : screening;

		for (DrugEfficacy d : drugs) {
			if (d == null)
				continue;
			PgxLookupResult pgx = d.getName() == null ? null : byDrug.get(d.getName());
			RiskBenefitResult rb = pgx == null ? composeRiskBenefit(d.getEfficacyScore(), null, null)
					: composeRiskBenefit(d.getEfficacyScore(), pgx.getToxicityTier(), pgx.getAdjustmentFactor());
			ranked.add(new RankedDrug(d.getName(), d.getEfficacyScore(), rb));
		}
		ranked.sort(Comparator.comparingDouble(RankedDrug::getCompositeScore).reversed());
		return ranked;
	}
}
