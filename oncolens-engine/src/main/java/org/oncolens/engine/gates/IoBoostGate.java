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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.oncolens.engine.om.BiomarkerRecord;
import org.oncolens.engine.om.GateId;
import org.oncolens.engine.om.GateOutcome;
import org.oncolens.engine.om.GateVerdict;
import org.oncolens.engine.pathway.ExpressionQuality;
import org.oncolens.engine.pathway.IoPathwayModel;
import org.oncolens.engine.pathway.IoPathwaySafety;
import org.oncolens.engine.pathway.PathwayConfidence;
import org.oncolens.engine.pathway.PathwayDecision;
import org.oncolens.engine.pathway.PathwayScoreProvider;
import org.oncolens.engine.util.Logger;

/**
 * Checkpoint-inhibitor boost from expression, TMB and MSI.
 * <p>
 * Rules are held in a priority table and tried in order. The first rule that
 * reaches a decision wins; boosts never stack. A pathway rule that ran but did
 * not boost (fallback or low band) is reported only if no later rule decides.
 */
public final class IoBoostGate implements Gate {

	public static final double TMB_HIGH = 20.0;
	public static final double TMB_INTERMEDIATE = 10.0;

	public static final double TMB_HIGH_BOOST = 1.35;
	public static final double MSI_HIGH_BOOST = 1.30;
	public static final double TMB_INTERMEDIATE_BOOST = 1.25;

	public static final Set<String> HYPERMUTATOR_GENES = Set.of("MBD4", "POLE", "POLD1");

	/** One row of the priority table. Empty means "not applicable". */
	@FunctionalInterface
	interface Rule {
		Optional<GateOutcome> apply(GateContext ctx);
	}

	private final PathwayScoreProvider model;
	private final IoPathwaySafety safety;
	private final Map<String, Rule> priorityTable;

	public IoBoostGate() {
		this(new IoPathwayModel(), new IoPathwaySafety());
	}

	public IoBoostGate(PathwayScoreProvider model, IoPathwaySafety safety) {
		this.model = model;
		this.safety = safety;

		Map<String, Rule> table = new LinkedHashMap<>();
		table.put("PATHWAY_COMPOSITE", this::pathwayRule);
		table.put("TMB_HIGH", IoBoostGate::tmbHighRule);
		table.put("MSI_HIGH", IoBoostGate::msiHighRule);
		table.put("TMB_INTERMEDIATE", IoBoostGate::tmbIntermediateRule);
		table.put("HYPERMUTATOR_FLAG", IoBoostGate::hypermutatorRule);
		this.priorityTable = Collections.unmodifiableMap(table);
	}

	/** Rule names in evaluation order. */
	public List<String> priorityOrder() {
		return new ArrayList<>(priorityTable.keySet());
	}

	@Override
	public boolean appliesTo(GateContext ctx) {
		return DrugClassifier.isCheckpointInhibitor(ctx.getDrug());
	}

	@Override
	public GateOutcome evaluate(GateContext ctx) {
		GateOutcome pending = null;
		for (Map.Entry<String, Rule> row : priorityTable.entrySet()) {
			Optional<GateOutcome> outcome = row.getValue().apply(ctx);
			if (outcome.isEmpty())
				continue;
			GateOutcome o = outcome.get();
			if (isDecisive(o)) {
				Logger.debug("IO rule {} decided {} for {}", row.getKey(), o.getVerdict(), ctx.getDrug().getName());
				return o;
			}
			if (pending == null)
				pending = o;
		}
		if (pending != null)
			return pending;
		return GateOutcome.of(GateId.IO_NO_BOOST, GateVerdict.NO_BOOST, 1.0, "No IO boost signals detected");
	}

	private static boolean isDecisive(GateOutcome o) {
		return o.isBoost() || o.getVerdict() == GateVerdict.SUSPECTED_HYPERMUTATION;
	}

	// --- rules ---------------------------------------------------------------

	private Optional<GateOutcome> pathwayRule(GateContext ctx) {
		BiomarkerRecord record = ctx.getRecord();
		if (!record.hasExpression())
			return Optional.empty();

		Map<String, Double> scores;
		double raw;
		ExpressionQuality quality;
		try {
			scores = model.computePathwayScores(record.getExpression());
			raw = model.composite(scores);
			quality = model.assessQuality(record.getExpression());
		} catch (RuntimeException ex) {
			Logger.warn("IO pathway computation failed for {}, using TMB/MSI rules", ex, ctx.getDrug().getName());
			return Optional.empty();
		}
		String cancerType = ctx.getCancerType();

		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("pathway_scores", scores);
		meta.put("pathway_composite_raw", raw);
		meta.put("ruo_disclaimer", safety.disclaimer(cancerType));

		PathwayDecision decision = safety.decide(raw, cancerType, quality, record);
		if (!decision.isUsePathway()) {
			Logger.info("IO pathway prediction not used: {}", decision.getReason());
			meta.put("fallback_reason", decision.getReason());
			return Optional.of(new GateOutcome(GateId.IO_PATHWAY_BOOST, GateVerdict.FALLBACK, 1.0,
					"Pathway prediction computed but not used: " + decision.getReason()
							+ " Falling back to TMB/MSI logic.",
					meta));
		}

		PathwayConfidence conf = safety.adjust(raw, cancerType, quality);
		double adjusted = conf.getAdjustedComposite();
		double boost = pathwayBoost(adjusted);

		meta.put("pathway_composite_adjusted", adjusted);
		meta.put("confidence_factors", conf.getFactors());
		meta.put("warnings", conf.getWarnings());
		if (!conf.getWarnings().isEmpty()) {
			Logger.warn("IO pathway prediction warnings: {}", conf.getWarnings());
		}

		String rationale = String.format(Locale.ROOT,
				"Pathway-based IO prediction (%s, AUC=%.3f): raw_composite=%.3f, confidence_adjusted=%.3f → "
						+ "Checkpoint inhibitor boost %.2fx",
				IoPathwayModel.COHORT, IoPathwayModel.COHORT_AUC, raw, adjusted, boost);
		GateVerdict verdict = boost > 1.0 ? GateVerdict.BOOSTED : GateVerdict.NO_BOOST;
		return Optional.of(new GateOutcome(GateId.IO_PATHWAY_BOOST, verdict, boost, rationale, meta));
	}

	static double pathwayBoost(double adjustedComposite) {
		if (adjustedComposite >= 0.7)
			return 1.40;
		if (adjustedComposite >= 0.5)
			return 1.30;
		if (adjustedComposite >= 0.3)
			return 1.15;
		return 1.0;
	}

	private static Optional<GateOutcome> tmbHighRule(GateContext ctx) {
		BiomarkerRecord r = ctx.getRecord();
		if (!r.isTmbMeasured() || r.getTmb() < TMB_HIGH)
			return Optional.empty();
		return Optional.of(new GateOutcome(GateId.IO_TMB_BOOST, GateVerdict.BOOSTED, TMB_HIGH_BOOST,
				String.format(Locale.ROOT, "TMB-high (≥20): %.1f mut/Mb → Checkpoint inhibitor boost 1.35x",
						r.getTmb()),
				Map.of("tmb", r.getTmb())));
	}

	private static Optional<GateOutcome> msiHighRule(GateContext ctx) {
		if (!ctx.getRecord().isMsiHigh())
			return Optional.empty();
		return Optional.of(new GateOutcome(GateId.IO_MSI_BOOST, GateVerdict.BOOSTED, MSI_HIGH_BOOST,
				"MSI-High → Checkpoint inhibitor boost 1.30x", Map.of("msi_status", "MSI-High")));
	}

	private static Optional<GateOutcome> tmbIntermediateRule(GateContext ctx) {
		BiomarkerRecord r = ctx.getRecord();
		if (!r.isTmbMeasured() || r.getTmb() < TMB_INTERMEDIATE || r.getTmb() >= TMB_HIGH)
			return Optional.empty();
		return Optional.of(new GateOutcome(GateId.IO_TMB_BOOST, GateVerdict.BOOSTED, TMB_INTERMEDIATE_BOOST,
				String.format(Locale.ROOT, "TMB-intermediate (≥10): %.1f mut/Mb → Checkpoint inhibitor boost 1.25x",
						r.getTmb()),
				Map.of("tmb", r.getTmb())));
	}

	private static Optional<GateOutcome> hypermutatorRule(GateContext ctx) {
		BiomarkerRecord r = ctx.getRecord();
		if (r.isTmbMeasured())
			return Optional.empty();

		Set<String> hits = new TreeSet<>(r.mutatedGenes());
		hits.retainAll(HYPERMUTATOR_GENES);
		if (hits.isEmpty())
			return Optional.empty();

		Logger.info("Hypermutator genes present with unknown TMB: {}", hits);
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("hypermutator_genes", List.copyOf(hits));
		meta.put("action", "MEASURE_TMB_MSI");
		return Optional.of(new GateOutcome(GateId.IO_HYPERMUTATOR_FLAG, GateVerdict.SUSPECTED_HYPERMUTATION, 1.0,
				"Hypermutator gene mutation (" + String.join(", ", hits) + ") with unknown TMB. "
						+ "Suspect hypermutation; measure TMB/MSI before treating as an IO-positive signal.",
				meta));
	}
}
