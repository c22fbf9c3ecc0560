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

import java.util.List;

import org.oncolens.engine.om.EligibilityAssessment;
import org.oncolens.engine.om.HolisticScoreResult;
import org.oncolens.engine.om.MechanismFit;
import org.oncolens.engine.om.PatientProfile;
import org.oncolens.engine.om.PgxSafetyAssessment;
import org.oncolens.engine.om.PgxScreeningStatus;
import org.oncolens.engine.om.PharmacogeneVariant;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.util.Scores;

/**
 * Patient-trial-drug feasibility:
 * {@code 0.5 x mechanism fit + 0.3 x eligibility + 0.2 x PGx safety}.
 */
public final class HolisticScoreComposer {

	public static final double MECHANISM_FIT_WEIGHT = 0.5;
	public static final double ELIGIBILITY_WEIGHT = 0.3;
	public static final double PGX_SAFETY_WEIGHT = 0.2;

	static final String FORMULA = "0.5×mechanism + 0.3×eligibility + 0.2×pgx_safety";

	private final MechanismFitScorer mechanismScorer;
	private final EligibilityScorer eligibilityScorer;
	private final PgxSafetyScorer pgxScorer;
	private final ScoreInterpreter interpreter;
	private final String engineVersion;

	public HolisticScoreComposer(MechanismFitScorer mechanismScorer, EligibilityScorer eligibilityScorer,
			PgxSafetyScorer pgxScorer, ScoreInterpreter interpreter, String engineVersion) {
		this.mechanismScorer = mechanismScorer;
		this.eligibilityScorer = eligibilityScorer;
		this.pgxScorer = pgxScorer;
		this.interpreter = interpreter;
		this.engineVersion = engineVersion;
	}

	/**
	 * @param pharmacogenes germline variants to screen; the patient's own
	 *                      germline variants when {@code null}
	 * @param drug          drug to screen; the trial's first intervention when
	 *                      blank
	 */
	public HolisticScoreResult computeHolisticScore(PatientProfile patient, TrialDescriptor trial,
			List<PharmacogeneVariant> pharmacogenes, String drug) {
		if (patient == null || trial == null) {
			throw new IllegalArgumentException("patient and trial are required");
		}
		HolisticScoreResult.HolisticScoreResultBuilder out = HolisticScoreResult.builder().nctId(trial.getNctId());

		List<PharmacogeneVariant> variants = pharmacogenes != null ? pharmacogenes : patient.getGermlineVariants();

		MechanismFit fit = mechanismScorer.score(patient.getMechanismVector(), trial.getMoaVector());
		double mechanism;
		if (fit.isDetermined()) {
			mechanism = Scores.clamp01(fit.getScore());
			out.mechanismAlignment(fit.getAlignment());
		} else {
			mechanism = MechanismFitScorer.UNDETERMINED_DEFAULT;
			out.caveat("Mechanism vector not available - using default 0.5");
		}

		EligibilityAssessment eligibility = eligibilityScorer.assess(patient, trial);
		double elig = Scores.clamp01(eligibility.getScore());

		PgxSafetyAssessment pgx = pgxScorer.assess(variants, drug, trial);
		double safety = Scores.clamp01(pgx.getScore());
		if (pgx.isContraindicated()) {
			out.caveat("CONTRAINDICATED: " + pgx.getReason());
		} else if (pgx.getStatus() == PgxScreeningStatus.ERROR) {
			out.caveat("PGx unscreened: " + pgx.getReason());
		}

		double holistic = MECHANISM_FIT_WEIGHT * mechanism + ELIGIBILITY_WEIGHT * elig + PGX_SAFETY_WEIGHT * safety;
		double rounded = Scores.round3(Scores.clamp01(holistic));

		ScoreInterpretation interpretation = interpreter.interpret(trial.displayId(), rounded, mechanism, elig,
				safety, pgx);

		return out.holisticScore(rounded)
				.mechanismFitScore(Scores.round3(mechanism))
				.eligibilityScore(Scores.round3(elig))
				.pgxSafetyScore(Scores.round3(safety))
				.weight("mechanism_fit", MECHANISM_FIT_WEIGHT)
				.weight("eligibility", ELIGIBILITY_WEIGHT)
				.weight("pgx_safety", PGX_SAFETY_WEIGHT)
				.eligibilityBreakdown(eligibility.getBreakdown())
				.pgxDetails(pgx)
				.interpretation(interpretation.getInterpretation())
				.recommendation(interpretation.getRecommendation())
				.provenanceEntry("service", "HolisticScoreComposer")
				.provenanceEntry("version", engineVersion)
				.provenanceEntry("formula", FORMULA)
				.provenanceEntry("ruo", "Research Use Only")
				.build();
	}
}
