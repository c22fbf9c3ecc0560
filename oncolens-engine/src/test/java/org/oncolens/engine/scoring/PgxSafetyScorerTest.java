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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.PgxSafetyAssessment;
import org.oncolens.engine.om.PgxScreeningStatus;
import org.oncolens.engine.om.PharmacogeneVariant;
import org.oncolens.engine.om.ToxicityTier;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.pgx.PgxLookup;

class PgxSafetyScorerTest {

	private PgxLookup lookup;
	private PgxSafetyScorer scorer;

	@BeforeEach
	void setUp() {
		lookup = mock(PgxLookup.class);
		scorer = new PgxSafetyScorer(lookup);
	}

	// --- helpers -------------------------------------------------------------

	private static TrialDescriptor trialWith(String... drugs) {
		TrialDescriptor t = new TrialDescriptor();
		t.setInterventionDrugs(List.of(drugs));
		return t;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void no_variants_is_not_screened() {
		PgxSafetyAssessment a = scorer.assess(List.of(), "capecitabine", null);

		assertEquals(PgxScreeningStatus.NOT_SCREENED, a.getStatus());
		assertEquals(1.0, a.getScore(), 0.0);
		verifyNoInteractions(lookup);
	}

	@Test
	void no_drug_is_not_screened() {
		PgxSafetyAssessment a = scorer.assess(List.of(new PharmacogeneVariant("DPYD", "*2A")), null,
				new TrialDescriptor());

		assertEquals(PgxScreeningStatus.NOT_SCREENED, a.getStatus());
		assertEquals("No drug specified for PGx screening", a.getReason());
	}

	@Test
	void contraindicated_variant_zeroes_score() {
		when(lookup.lookup("capecitabine", "DPYD", "*2A")).thenReturn(new PgxLookupResult(ToxicityTier.HIGH, 0.0));

		PgxSafetyAssessment a = scorer.assess(List.of(new PharmacogeneVariant("DPYD", "*2A")), null,
				trialWith("capecitabine", "oxaliplatin"));

		assertEquals(PgxScreeningStatus.SCREENED, a.getStatus());
		assertTrue(a.isContraindicated());
		assertEquals(0.0, a.getScore(), 0.0);
		assertEquals("DPYD *2A: Contraindicated for capecitabine", a.getReason());
		assertEquals("capecitabine", a.getDrug());
	}

	@Test
	void explicit_drug_overrides_trial_intervention() {
		scorer.assess(List.of(new PharmacogeneVariant("UGT1A1", "*28")), "irinotecan", trialWith("capecitabine"));

		verify(lookup).lookup("irinotecan", "UGT1A1", "*28");
	}

	@Test
	void score_is_minimum_factor_with_dose_notes() {
		when(lookup.lookup("irinotecan", "UGT1A1", "*28")).thenReturn(new PgxLookupResult(ToxicityTier.MODERATE, 0.7));
		when(lookup.lookup("irinotecan", "TPMT", "*3A")).thenReturn(new PgxLookupResult(ToxicityTier.MODERATE, 0.5));

		PgxSafetyAssessment a = scorer.assess(
				List.of(new PharmacogeneVariant("UGT1A1", "*28"), new PharmacogeneVariant("TPMT", "*3A")),
				"irinotecan", null);

		assertEquals(0.5, a.getScore(), 0.0);
		assertFalse(a.isContraindicated());
		assertEquals(List.of("UGT1A1 *28: 30% dose reduction for irinotecan",
				"TPMT *3A: 50% dose reduction for irinotecan"), a.getDoseAdjustments());
		assertEquals(2, a.getVariantsScreened().size());
	}

	@Test
	void unknown_variants_screen_clean() {
		PgxSafetyAssessment a = scorer.assess(List.of(new PharmacogeneVariant("CYP2C19", "*17")), "olaparib", null);

		assertEquals(PgxScreeningStatus.SCREENED, a.getStatus());
		assertEquals(1.0, a.getScore(), 0.0);
		assertEquals(ToxicityTier.LOW, a.getVariantsScreened().get(0).getToxicityTier());
	}

	@Test
	void blank_gene_entries_are_skipped() {
		scorer.assess(List.of(new PharmacogeneVariant(" ", "*2A")), "capecitabine", null);

		verifyNoInteractions(lookup);
	}

	@Test
	void lookup_failure_reports_error_with_neutral_score() {
		when(lookup.lookup(anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

		PgxSafetyAssessment a = scorer.assess(List.of(new PharmacogeneVariant("DPYD", "*2A")), "capecitabine", null);

		assertEquals(PgxScreeningStatus.ERROR, a.getStatus());
		assertEquals(1.0, a.getScore(), 0.0);
		assertEquals("PGx screening failed: boom", a.getReason());
	}

	@Test
	void lookup_is_required() {
		assertThrows(IllegalArgumentException.class, () -> new PgxSafetyScorer(null));
	}
}
