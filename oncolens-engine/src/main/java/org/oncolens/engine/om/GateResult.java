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

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/** Output of the gate orchestrator for one drug. */
@Value
public class GateResult {

	String drugName;
	double originalEfficacy;
	double originalConfidence;
	double efficacy;
	double confidence;
	CompletenessTier tier;

	/** Ordered rationale; the last entry is always the summary. */
	List<GateOutcome> rationale;

	public List<GateId> gateIds() {
		return rationale.stream().map(GateOutcome::getGateId).collect(Collectors.toList());
	}

	public GateOutcome find(GateId id) {
		return rationale.stream().filter(o -> o.getGateId() == id).findFirst().orElse(null);
	}
}
