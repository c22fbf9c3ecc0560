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

import org.oncolens.engine.om.GateId;
import org.oncolens.engine.om.GateOutcome;
import org.oncolens.engine.om.GateVerdict;
import org.oncolens.engine.om.GermlineStatus;

/**
 * PARP inhibitor efficacy by germline status, with HRD rescue for germline
 * negative tumors.
 * <ol>
 * <li>germline positive: full effect</li>
 * <li>negative, HRD &ge; 42: rescued, full effect</li>
 * <li>negative, HRD &lt; 42: 0.6x</li>
 * <li>negative, HRD unknown: 0.8x</li>
 * <li>germline unknown: 0.8x</li>
 * </ol>
 */
public final class ParpGermlineGate implements Gate {

	public static final double HRD_RESCUE_THRESHOLD = 42.0;
	public static final double REDUCED_MULTIPLIER = 0.6;
	public static final double CONSERVATIVE_MULTIPLIER = 0.8;

	@Override
	public boolean appliesTo(GateContext ctx) {
		return DrugClassifier.isParpInhibitor(ctx.getDrug());
	}

	@Override
	public GateOutcome evaluate(GateContext ctx) {
		if (!appliesTo(ctx)) {
			return GateOutcome.of(GateId.PARP_NOT_APPLICABLE, GateVerdict.NOT_PARP, 1.0, "Not a PARP inhibitor");
		}

		GermlineStatus germline = ctx.getGermlineStatus();
		Double hrd = ctx.getRecord().getHrdScore();

		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("germline_status", germline.label());
		meta.put("hrd_score", hrd);
		meta.put("hrd_threshold", HRD_RESCUE_THRESHOLD);

		switch (germline) {
		case POSITIVE:
			return new GateOutcome(GateId.PARP_GERMLINE, GateVerdict.FULL_EFFECT, 1.0,
					"Germline positive → PARP inhibitor full effect", meta);
		case NEGATIVE:
			if (hrd == null) {
				return new GateOutcome(GateId.PARP_UNKNOWN_HRD, GateVerdict.CONSERVATIVE, CONSERVATIVE_MULTIPLIER,
						"Germline negative, HRD unknown → PARP conservative 0.8x (order HRD testing)", meta);
			}
			if (hrd >= HRD_RESCUE_THRESHOLD) {
				return new GateOutcome(GateId.PARP_HRD_RESCUE, GateVerdict.RESCUED, 1.0,
						String.format(Locale.ROOT,
								"Germline negative BUT HRD-high (score=%.1f ≥ 42) → PARP rescued, full effect", hrd),
						meta);
			}
			return new GateOutcome(GateId.PARP_HRD_LOW, GateVerdict.REDUCED, REDUCED_MULTIPLIER,
					String.format(Locale.ROOT, "Germline negative, HRD<42 (score=%.1f) → PARP reduced to 0.6x", hrd),
					meta);
		default:
			return new GateOutcome(GateId.PARP_UNKNOWN_GERMLINE, GateVerdict.CONSERVATIVE, CONSERVATIVE_MULTIPLIER,
					"Germline status unknown → PARP conservative 0.8x (order germline testing)", meta);
		}
	}
}
