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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.oncolens.engine.om.BiomarkerRecord;
import org.oncolens.engine.om.CompletenessTier;
import org.oncolens.engine.om.DrugDescriptor;
import org.oncolens.engine.om.GateId;
import org.oncolens.engine.om.GateOutcome;
import org.oncolens.engine.om.GateResult;
import org.oncolens.engine.om.GateVerdict;
import org.oncolens.engine.om.GermlineStatus;
import org.oncolens.engine.util.Logger;
import org.oncolens.engine.util.Scores;

/**
 * Runs the efficacy gates for one drug in fixed order:
 * <ol>
 * <li>PARP germline/HRD</li>
 * <li>ovarian pathway resistance, only after a PARP penalty or for platinum
 * drugs</li>
 * <li>IO boost, checkpoint inhibitors only</li>
 * <li>confidence cap by completeness tier</li>
 * </ol>
 * Each gate multiplies into a running efficacy and appends its outcome. Both
 * values are clamped to [0,1] and a summary entry closes the rationale.
 */
public final class GateOrchestrator {

	private final ParpGermlineGate parpGate;
	private final OvarianPathwayGate ovarianGate;
	private final IoBoostGate ioGate;
	private final ConfidenceCapper capper;
	private final CompletenessClassifier classifier;

	public GateOrchestrator() {
		this(new ParpGermlineGate(), new OvarianPathwayGate(), new IoBoostGate(), new ConfidenceCapper(),
				new CompletenessClassifier());
	}

	public GateOrchestrator(ParpGermlineGate parpGate, OvarianPathwayGate ovarianGate, IoBoostGate ioGate,
			ConfidenceCapper capper, CompletenessClassifier classifier) {
		this.parpGate = parpGate;
		this.ovarianGate = ovarianGate;
		this.ioGate = ioGate;
		this.capper = capper;
		this.classifier = classifier;
	}

	public GateResult applyGates(DrugDescriptor drug, double efficacy, double confidence, GermlineStatus germline,
			BiomarkerRecord record, String cancerType) {
		if (drug == null) {
			throw new IllegalArgumentException("drug descriptor is required");
		}
		GateContext ctx = GateContext.of(drug, germline, record, cancerType);

		final double originalEfficacy = Scores.clamp01(efficacy);
		final double originalConfidence = Scores.clamp01(confidence);
		double eff = originalEfficacy;
		double conf = originalConfidence;
		List<GateOutcome> rationale = new ArrayList<>();

		// 1) PARP
		GateOutcome parp = parpGate.evaluate(ctx);
		if (parp.getVerdict() != GateVerdict.NOT_PARP) {
			eff *= parp.getMultiplier();
			rationale.add(parp);
		}

		// 2) ovarian pathway
		if (parp.isPenalty() || DrugClassifier.isPlatinum(drug)) {
			GateOutcome ovarian = ovarianGate.evaluate(ctx);
			eff *= ovarian.getMultiplier();
			rationale.add(ovarian);
		}

		// 3) IO
		if (ioGate.appliesTo(ctx)) {
			GateOutcome io = ioGate.evaluate(ctx);
			eff *= io.getMultiplier();
			rationale.add(io);
		}

		// 4) confidence cap
		Double rawCompleteness = ctx.getRecord().getCompletenessScore();
		double completeness = rawCompleteness == null ? 0.0 : Scores.clamp01(rawCompleteness);
		CompletenessTier tier = classifier.classify(completeness);
		double capped = capper.cap(conf, tier);
		rationale.add(capper.describe(conf, capped, tier, completeness));
		conf = capped;

		eff = Scores.clamp01(eff);
		conf = Scores.clamp01(conf);

		rationale.add(summary(ctx, tier, completeness, originalEfficacy, eff, originalConfidence, conf, rationale));

		if (eff != originalEfficacy || conf != originalConfidence) {
			Logger.info("Gates for {}: efficacy {} -> {}, confidence {} -> {} ({})", drug.getName(),
					Scores.round3(originalEfficacy), Scores.round3(eff), Scores.round3(originalConfidence),
					Scores.round3(conf), tier);
		}
		return new GateResult(drug.getName(), originalEfficacy, originalConfidence, eff, conf, tier,
				List.copyOf(rationale));
	}

	private static GateOutcome summary(GateContext ctx, CompletenessTier tier, double completeness, double effIn,
			double effOut, double confIn, double confOut, List<GateOutcome> applied) {
		List<String> ids = applied.stream().map(o -> o.getGateId().name()).collect(Collectors.toList());

		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("germline_status", ctx.getGermlineStatus().label());
		meta.put("tier", tier.name());
		meta.put("completeness", completeness);
		meta.put("original_efficacy", effIn);
		meta.put("final_efficacy", effOut);
		meta.put("efficacy_delta", effOut - effIn);
		meta.put("original_confidence", confIn);
		meta.put("final_confidence", confOut);
		meta.put("confidence_delta", confOut - confIn);
		meta.put("gates_applied", ids);

		String text = String.format(Locale.ROOT, "Efficacy %.3f → %.3f, confidence %.3f → %.3f (%s); gates: %s",
				effIn, effOut, confIn, confOut, tier, String.join(", ", ids));
		return new GateOutcome(GateId.GATES_SUMMARY, GateVerdict.SUMMARY, 1.0, text, meta);
	}
}
