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

import org.oncolens.engine.om.CompletenessTier;
import org.oncolens.engine.om.GateId;
import org.oncolens.engine.om.GateOutcome;
import org.oncolens.engine.om.GateVerdict;

/**
 * Limits confidence to what the record's completeness tier supports.
 */
public final class ConfidenceCapper {

	public double cap(double confidence, CompletenessTier tier) {
		return Math.min(confidence, tier.getConfidenceCeiling());
	}

	/**
	 * Audit entry for a cap. Efficacy multiplier is always 1.0; the confidence
	 * change is in the metadata.
	 */
	public GateOutcome describe(double before, double after, CompletenessTier tier, double completeness) {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("tier", tier.name());
		meta.put("completeness", completeness);
		meta.put("ceiling", tier.getConfidenceCeiling());
		meta.put("confidence_before", before);
		meta.put("confidence_after", after);

		if (after < before) {
			return new GateOutcome(GateId.CONFIDENCE_CAP, GateVerdict.CAPPED, 1.0,
					String.format(Locale.ROOT,
							"%s data completeness (%.2f) → confidence capped at %.1f (was %.2f)", tier, completeness,
							tier.getConfidenceCeiling(), before),
					meta);
		}
		return new GateOutcome(GateId.CONFIDENCE_CAP, GateVerdict.NO_CAP, 1.0,
				String.format(Locale.ROOT, "%s data completeness (%.2f) → confidence %.2f not capped", tier,
						completeness, before),
				meta);
	}
}
