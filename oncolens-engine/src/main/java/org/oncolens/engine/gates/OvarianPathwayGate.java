package org.oncolens.engine.gates;

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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.oncolens.engine.om.BiomarkerRecord;
import org.oncolens.engine.om.GateId;
import org.oncolens.engine.om.GateOutcome;
import org.oncolens.engine.om.GateVerdict;
import org.oncolens.engine.pathway.ExpressionQuality;
import org.oncolens.engine.pathway.OvarianPathwayModel;
import org.oncolens.engine.pathway.OvarianPathwayModel.ResistanceRisk;
import org.oncolens.engine.pathway.OvarianPathwaySafety;
import org.oncolens.engine.pathway.PathwayConfidence;
import org.oncolens.engine.pathway.PathwayDecision;
import org.oncolens.engine.pathway.PathwayScoreProvider;
import org.oncolens.engine.util.Logger;

/**
 * Expression-based platinum/PARP resistance for ovarian tumors. Without
 * expression data it never changes efficacy.
 */
public final class OvarianPathwayGate implements Gate {

	public static final double HIGH_RISK_MULTIPLIER = 0.7;
	public static final double MODERATE_RISK_MULTIPLIER = 0.85;
	public static final double VERY_LOW_RISK_MULTIPLIER = 1.05;
	public static final double VERY_LOW_COMPOSITE = 0.10;

	static final String NO_EXPRESSION_REASON = "No expression data available for pathway-based prediction. "
			+ "HRD-based PARP logic (PARP_GERMLINE/PARP_HRD_RESCUE gates) is the sole determinant.";

	private final PathwayScoreProvider model;
	private final OvarianPathwaySafety safety;

	public OvarianPathwayGate() {
		this(new OvarianPathwayModel(), new OvarianPathwaySafety());
	}

	public OvarianPathwayGate(PathwayScoreProvider model, OvarianPathwaySafety safety) {
		this.model = model;
		this.safety = safety;
	}

	@Override
	public boolean appliesTo(GateContext ctx) {
		return DrugClassifier.isParpInhibitor(ctx.getDrug()) || DrugClassifier.isPlatinum(ctx.getDrug());
	}

	@Override
	public GateOutcome evaluate(GateContext ctx) {
		BiomarkerRecord record = ctx.getRecord();
		if (!record.hasExpression()) {
			return GateOutcome.of(GateId.OVARIAN_PATHWAY, GateVerdict.NO_EXPRESSION, 1.0, NO_EXPRESSION_REASON);
		}

		Map<String, Double> scores;
		double raw;
		ExpressionQuality quality;
		try {
			scores = model.computePathwayScores(record.getExpression());
			raw = model.composite(scores);
			quality = model.assessQuality(record.getExpression());
		} catch (RuntimeException ex) {
			Logger.warn("Ovarian pathway computation failed for {}", ex, ctx.getDrug().getName());
			return new GateOutcome(GateId.OVARIAN_PATHWAY, GateVerdict.FALLBACK, 1.0,
					"Pathway prediction failed: " + ex.getMessage() + ". HRD-based PARP logic is the sole determinant.",
					Map.of("fallback_reason", String.valueOf(ex.getMessage())));
		}

		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("pathway_scores", scores);
		meta.put("composite_raw", raw);
		meta.put("average_coverage", quality.getAverageCoverage());
		meta.put("ruo_disclaimer", safety.disclaimer());

		PathwayDecision decision = safety.decide(raw, ctx.getCancerType(), quality, record);
		if (!decision.isUsePathway()) {
			Logger.info("Ovarian pathway prediction not used for {}: {}", ctx.getDrug().getName(),
					decision.getReason());
			meta.put("fallback_reason", decision.getReason());
			return new GateOutcome(GateId.OVARIAN_PATHWAY, GateVerdict.FALLBACK, 1.0,
					"Pathway prediction computed but not used: " + decision.getReason(), meta);
		}

		PathwayConfidence conf = safety.adjust(raw, ctx.getCancerType(), quality);
		double adjusted = conf.getAdjustedComposite();
		ResistanceRisk risk = OvarianPathwayModel.classify(adjusted);

		meta.put("composite_adjusted", adjusted);
		meta.put("resistance_risk", risk.name());
		meta.put("confidence_factors", conf.getFactors());
		meta.put("warnings", conf.getWarnings());

		double multiplier;
		GateVerdict verdict;
		switch (risk) {
		case HIGH:
			multiplier = HIGH_RISK_MULTIPLIER;
			verdict = GateVerdict.REDUCED;
			break;
		case MODERATE:
			multiplier = MODERATE_RISK_MULTIPLIER;
			verdict = GateVerdict.MODERATELY_REDUCED;
			break;
		default:
			if (adjusted < VERY_LOW_COMPOSITE) {
				multiplier = VERY_LOW_RISK_MULTIPLIER;
				verdict = GateVerdict.SLIGHTLY_BOOSTED;
			} else {
				multiplier = 1.0;
				verdict = GateVerdict.NO_CHANGE;
			}
			break;
		}

		if (!conf.getWarnings().isEmpty()) {
			Logger.debug("Ovarian pathway warnings for {}: {}", ctx.getDrug().getName(), conf.getWarnings());
		}
		String rationale = String.format(Locale.ROOT,
				"Ovarian pathway resistance (%s): composite=%.3f, adjusted=%.3f → %s risk, efficacy %.2fx",
				OvarianPathwayModel.COHORT, raw, adjusted, risk, multiplier);
		return new GateOutcome(GateId.OVARIAN_PATHWAY, verdict, multiplier, rationale, meta);
	}
}
