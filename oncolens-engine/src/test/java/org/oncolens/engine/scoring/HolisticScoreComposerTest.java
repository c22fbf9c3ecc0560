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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.oncolens.engine.om.HolisticScoreResult;
import org.oncolens.engine.om.Interpretation;
import org.oncolens.engine.om.MechanismVector;
import org.oncolens.engine.om.PatientProfile;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.PgxScreeningStatus;
import org.oncolens.engine.om.PharmacogeneVariant;
import org.oncolens.engine.om.ToxicityTier;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.pgx.PgxLookup;

class HolisticScoreComposerTest {

	private PgxLookup lookup;
	private HolisticScoreComposer composer;

	@BeforeEach
	void setUp() {
		lookup = mock(PgxLookup.class);
		composer = new HolisticScoreComposer(new MechanismFitScorer(), new EligibilityScorer(),
				new PgxSafetyScorer(lookup), new ScoreInterpreter(), "1.0");
	}

	// --- helpers -------------------------------------------------------------

	private static PatientProfile patient(MechanismVector v) {
		PatientProfile p = new PatientProfile();
		p.setMechanismVector(v);
		p.setDisease("colorectal cancer");
		p.setAge(61);
		return p;
	}

	private static TrialDescriptor trial(MechanismVector moa) {
		TrialDescriptor t = new TrialDescriptor();
		t.setNctId("NCT05000001");
		t.setOverallStatus("RECRUITING");
		t.setConditions(new ArrayList<>(List.of("Colorectal Cancer")));
		t.setMinimumAge("18 Years");
		t.setMoaVector(moa);
		t.setInterventionDrugs(new ArrayList<>(List.of("capecitabine")));
		return t;
	}

	private static final MechanismVector DDR = MechanismVector.of(1, 0, 0, 0, 0, 0, 0);

	// --- tests ---------------------------------------------------------------

	@Test
	void perfect_inputs_score_one() {
		HolisticScoreResult r = composer.computeHolisticScore(patient(DDR), trial(DDR), null, null);

		assertEquals(1.0, r.getHolisticScore(), 0.0);
		assertEquals(Interpretation.HIGH, r.getInterpretation());
		assertEquals(PgxScreeningStatus.NOT_SCREENED, r.getPgxDetails().getStatus());
		assertEquals(0.5, r.getWeights().get("mechanism_fit"), 0.0);
		assertEquals(HolisticScoreComposer.FORMULA, r.getProvenance().get("formula"));
		assertEquals("1.0", r.getProvenance().get("version"));
		assertTrue(r.getCaveats().isEmpty());
	}

	@Test
	void missing_mechanism_vector_uses_neutral_default() {
		HolisticScoreResult r = composer.computeHolisticScore(patient(null), trial(DDR), null, null);

		assertEquals(0.5, r.getMechanismFitScore(), 0.0);
		assertEquals(0.75, r.getHolisticScore(), 0.0);
		assertEquals(Interpretation.MEDIUM, r.getInterpretation());
		assertTrue(r.getCaveats().contains("Mechanism vector not available - using default 0.5"));
		assertTrue(r.getRecommendation().contains("moderate mechanism fit (0.50)"));
		assertTrue(r.getMechanismAlignment().isEmpty());
	}

	@Test
	void patient_germline_variants_are_screened_by_default() {
		when(lookup.lookup("capecitabine", "DPYD", "*2A")).thenReturn(new PgxLookupResult(ToxicityTier.HIGH, 0.0));
		PatientProfile p = patient(DDR);
		p.setGermlineVariants(List.of(new PharmacogeneVariant("DPYD", "*2A")));

		HolisticScoreResult r = composer.computeHolisticScore(p, trial(DDR), null, null);

		assertEquals(0.0, r.getPgxSafetyScore(), 0.0);
		assertEquals(0.8, r.getHolisticScore(), 0.0);
		assertEquals(Interpretation.CONTRAINDICATED, r.getInterpretation());
		assertTrue(r.getCaveats().contains("CONTRAINDICATED: DPYD *2A: Contraindicated for capecitabine"));
		verify(lookup).lookup("capecitabine", "DPYD", "*2A");
	}

	@Test
	void explicit_empty_pharmacogenes_skip_screening() {
		PatientProfile p = patient(DDR);
		p.setGermlineVariants(List.of(new PharmacogeneVariant("DPYD", "*2A")));

		HolisticScoreResult r = composer.computeHolisticScore(p, trial(DDR), List.of(), null);

		assertEquals(PgxScreeningStatus.NOT_SCREENED, r.getPgxDetails().getStatus());
		verifyNoInteractions(lookup);
	}

	@Test
	void ineligible_trial_is_flagged_whatever_the_score() {
		TrialDescriptor t = trial(DDR);
		t.setOverallStatus("TERMINATED");

		HolisticScoreResult r = composer.computeHolisticScore(patient(DDR), t, null, null);

		assertEquals(0.0, r.getEligibilityScore(), 0.0);
		assertEquals(0.7, r.getHolisticScore(), 0.0);
		assertEquals(Interpretation.INELIGIBLE, r.getInterpretation());
		assertTrue(r.getEligibilityBreakdown().contains("⛔ HARD CRITERIA FAILED"));
	}

	@Test
	void screening_error_adds_caveat_and_keeps_neutral_safety() {
		when(lookup.lookup(anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

		HolisticScoreResult r = composer.computeHolisticScore(patient(DDR), trial(DDR),
				List.of(new PharmacogeneVariant("DPYD", "*2A")), null);

		assertEquals(1.0, r.getPgxSafetyScore(), 0.0);
		assertTrue(r.getCaveats().contains("PGx unscreened: PGx screening failed: boom"));
	}

	@Test
	void patient_and_trial_are_required() {
		assertThrows(IllegalArgumentException.class,
				() -> composer.computeHolisticScore(patient(DDR), null, null, null));
	}
}
