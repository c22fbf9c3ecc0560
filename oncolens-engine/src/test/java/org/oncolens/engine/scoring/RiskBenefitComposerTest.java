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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.oncolens.engine.om.DrugEfficacy;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.RankedDrug;
import org.oncolens.engine.om.RiskBenefitAction;
import org.oncolens.engine.om.RiskBenefitResult;
import org.oncolens.engine.om.ToxicityTier;

class RiskBenefitComposerTest {

	private final RiskBenefitComposer composer = new RiskBenefitComposer();

	@Test
	void high_tier_vetoes_any_efficacy() {
		for (double eff : new double[] { 0.0, 0.3, 0.7, 1.0 }) {
			RiskBenefitResult r = composer.composeRiskBenefit(eff, ToxicityTier.HIGH, 0.9);

			assertEquals(0.0, r.getCompositeScore(), 0.0);
			assertEquals(RiskBenefitAction.AVOID, r.getAction());
		}
		RiskBenefitResult r = composer.composeRiskBenefit(0.85, ToxicityTier.HIGH, 0.0);
		assertEquals("AVOID / HIGH-RISK", r.getActionLabel());
		assertEquals("High toxicity risk (HIGH, adjustment=0.00) - hard veto applied", r.getRationale());
		assertEquals("high_toxicity", r.getProvenance().get("veto_reason"));
	}

	@Test
	void very_low_factor_vetoes_even_when_tier_low() {
		assertEquals(RiskBenefitAction.AVOID, composer.composeRiskBenefit(0.9, ToxicityTier.LOW, 0.05).getAction());
	}

	@Test
	void unscreened_passes_efficacy_through() {
		RiskBenefitResult r = composer.composeRiskBenefit(0.65, null, null);

		assertEquals(0.65, r.getCompositeScore(), 0.0);
		assertEquals(RiskBenefitAction.PREFERRED_UNSCREENED, r.getAction());
		assertEquals("PREFERRED (PGx UNSCREENED)", r.getActionLabel());
		assertNull(r.getToxicityTier());
		assertEquals(Boolean.FALSE, r.getProvenance().get("pgx_screened"));
	}

	@Test
	void moderate_tier_is_penalized() {
		RiskBenefitResult r = composer.composeRiskBenefit(0.8, ToxicityTier.MODERATE, 0.5);

		assertEquals(0.4, r.getCompositeScore(), 0.0);
		assertEquals(RiskBenefitAction.CONSIDER_WITH_MONITORING, r.getAction());
		assertEquals("Moderate toxicity risk (MODERATE, adjustment=0.50) - score penalized: 0.800 × 0.50 = 0.400",
				r.getRationale());
		assertEquals(0.5, r.getProvenance().get("penalty_factor"));
	}

	@Test
	void low_tier_with_reduced_factor_is_penalized() {
		RiskBenefitResult r = composer.composeRiskBenefit(0.6, ToxicityTier.LOW, 0.75);

		assertEquals(0.45, r.getCompositeScore(), 0.0);
		assertEquals(RiskBenefitAction.CONSIDER_WITH_MONITORING, r.getAction());
	}

	@Test
	void low_tier_full_factor_is_preferred() {
		RiskBenefitResult r = composer.composeRiskBenefit(0.9, ToxicityTier.LOW, 1.0);

		assertEquals(0.9, r.getCompositeScore(), 0.0);
		assertEquals(RiskBenefitAction.PREFERRED, r.getAction());
		assertEquals("no_penalty", r.getProvenance().get("composition_method"));
	}

	@Test
	void efficacy_is_clamped() {
		assertEquals(1.0, composer.composeRiskBenefit(1.4, null, null).getCompositeScore(), 0.0);
		assertEquals(0.0, composer.composeRiskBenefit(-0.2, ToxicityTier.LOW, 1.0).getCompositeScore(), 0.0);
	}

	@Test
	void ranking_sorts_by_composite_and_keeps_ties_stable() {
		List<DrugEfficacy> drugs = List.of(new DrugEfficacy("capecitabine", 0.9), new DrugEfficacy("olaparib", 0.6),
				new DrugEfficacy("irinotecan", 0.8), new DrugEfficacy("carboplatin", 0.6));
		Map<String, PgxLookupResult> screening = Map.of(
				"capecitabine", new PgxLookupResult(ToxicityTier.HIGH, 0.0),
				"irinotecan", new PgxLookupResult(ToxicityTier.MODERATE, 0.5),
				"carboplatin", new PgxLookupResult(ToxicityTier.LOW, 1.0));

		List<RankedDrug> ranked = composer.composeDrugRanking(drugs, screening);

		assertEquals(List.of("olaparib", "carboplatin", "irinotecan", "capecitabine"),
				ranked.stream().map(RankedDrug::getName).collect(Collectors.toList()));
		assertEquals(RiskBenefitAction.PREFERRED_UNSCREENED, ranked.get(0).getRiskBenefit().getAction());
		assertEquals(0.0, ranked.get(3).getCompositeScore(), 0.0);
	}

	@Test
	void ranking_of_nothing_is_empty() {
		assertTrue(composer.composeDrugRanking(null, null).isEmpty());
	}

	@Test
	void ranking_skips_null_rows() {
		List<DrugEfficacy> drugs = Arrays.asList(new DrugEfficacy("olaparib", 0.6), null,
				new DrugEfficacy("carboplatin", 0.7));

		List<RankedDrug> ranked = composer.composeDrugRanking(drugs, Map.of());

		assertEquals(List.of("carboplatin", "olaparib"),
				ranked.stream().map(RankedDrug::getName).collect(Collectors.toList()));
	}
}
