package org.oncolens.engine;

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
import java.util.Map;

import org.oncolens.engine.conf.ConfigLoader;
import org.oncolens.engine.gates.GateOrchestrator;
import org.oncolens.engine.om.BiomarkerRecord;
import org.oncolens.engine.om.DrugDescriptor;
import org.oncolens.engine.om.DrugEfficacy;
import org.oncolens.engine.om.GateResult;
import org.oncolens.engine.om.GermlineStatus;
import org.oncolens.engine.om.HolisticScoreResult;
import org.oncolens.engine.om.PatientProfile;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.PharmacogeneVariant;
import org.oncolens.engine.om.RankedDrug;
import org.oncolens.engine.om.RiskBenefitResult;
import org.oncolens.engine.om.ToxicityTier;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.om.TrialScoreSummary;
import org.oncolens.engine.pgx.PgxLookup;
import org.oncolens.engine.pgx.PgxToxicityTable;
import org.oncolens.engine.scoring.EligibilityScorer;
import org.oncolens.engine.scoring.HolisticScoreComposer;
import org.oncolens.engine.scoring.MechanismFitScorer;
import org.oncolens.engine.scoring.PgxSafetyScorer;
import org.oncolens.engine.scoring.RiskBenefitComposer;
import org.oncolens.engine.scoring.ScoreInterpreter;
import org.oncolens.engine.scoring.TrialBatchScorer;
import org.oncolens.engine.util.Logger;

/**
 * Entry point for callers: efficacy gating, holistic trial scoring (single and
 * batch) and risk-benefit composition.
 * <p>
 * The engine holds no mutable state after construction and may be shared
 * across threads.
 */
public final class OncoLensEngine {

	private final GateOrchestrator gates;
	private final HolisticScoreComposer holistic;
	private final TrialBatchScorer batch;
	private final RiskBenefitComposer riskBenefit;

	public OncoLensEngine(GateOrchestrator gates, HolisticScoreComposer holistic, TrialBatchScorer batch,
			RiskBenefitComposer riskBenefit) {
		this.gates = gates;
		this.holistic = holistic;
		this.batch = batch;
		this.riskBenefit = riskBenefit;
	}

	/** Wires the default components around the given PGx lookup. */
	public static OncoLensEngine create(PgxLookup pgxLookup, int parallelTrialLimit, String engineVersion) {
		HolisticScoreComposer composer = new HolisticScoreComposer(new MechanismFitScorer(), new EligibilityScorer(),
				new PgxSafetyScorer(pgxLookup), new ScoreInterpreter(), engineVersion);
		return new OncoLensEngine(new GateOrchestrator(), composer, new TrialBatchScorer(composer, parallelTrialLimit),
				new RiskBenefitComposer());
	}

	/**
	 * Builds an engine from configuration.
	 *
	 * @throws IllegalStateException if the configuration is incomplete or the PGx
	 *                               table cannot be loaded
	 */
	public static OncoLensEngine fromConfig(ConfigLoader config) {
		List<String> issues = config.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Config: {}", i));
			throw new IllegalStateException("Invalid configuration: " + String.join("; ", issues));
		}
		PgxToxicityTable table = PgxToxicityTable.load(config.getPgxTableResource());
		int workers = config.getParallelTrialLimit();
		Logger.info("OncoLens engine {} ready ({} PGx rows, {} batch worker(s))", config.getEngineVersion(),
				table.size(), workers);
		return create(table, workers, config.getEngineVersion());
	}

	public GateResult applyGates(DrugDescriptor drug, double efficacy, double confidence, GermlineStatus germline,
			BiomarkerRecord record, String cancerType) {
		return gates.applyGates(drug, efficacy, confidence, germline, record, cancerType);
	}

	public HolisticScoreResult computeHolisticScore(PatientProfile patient, TrialDescriptor trial,
			List<PharmacogeneVariant> pharmacogenes, String drug) {
		return holistic.computeHolisticScore(patient, trial, pharmacogenes, drug);
	}

	public List<TrialScoreSummary> computeBatch(PatientProfile patient, List<TrialDescriptor> trials,
			List<PharmacogeneVariant> pharmacogenes) {
		return batch.computeBatch(patient, trials, pharmacogenes);
	}

	public RiskBenefitResult composeRiskBenefit(double efficacy, ToxicityTier tier, Double adjustmentFactor) {
		return riskBenefit.composeRiskBenefit(efficacy, tier, adjustmentFactor);
	}

	public List<RankedDrug> composeDrugRanking(List<DrugEfficacy> drugs, Map<String, PgxLookupResult> screening) {
		return riskBenefit.composeDrugRanking(drugs, screening);
	}
}
