package org.oncolens.engine.om;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;

/**
 * One gate's decision: what it concluded, by how much it scales efficacy and
 * why. Instances are immutable; the orchestrator only ever appends them.
 */
@Value
public class GateOutcome {

	GateId gateId;
	GateVerdict verdict;

	/** Efficacy multiplier; values above 1.0 are boosts. */
	double multiplier;

	String rationale;

	/** Structured details (scores, thresholds, warnings), insertion ordered. */
	Map<String, Object> metadata;

	public GateOutcome(GateId gateId, GateVerdict verdict, double multiplier, String rationale,
			Map<String, Object> metadata) {
		this.gateId = gateId;
		this.verdict = verdict;
		this.multiplier = multiplier;
		this.rationale = rationale;
		this.metadata = metadata == null ? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public static GateOutcome of(GateId gateId, GateVerdict verdict, double multiplier, String rationale) {
		return new GateOutcome(gateId, verdict, multiplier, rationale, null);
	}

	public boolean isPenalty() {
		return multiplier < 1.0;
	}

	public boolean isBoost() {
		return multiplier > 1.0;
	}
}
