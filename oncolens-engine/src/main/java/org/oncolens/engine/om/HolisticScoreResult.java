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
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Patient-trial-drug feasibility. All scores are rounded to three decimals.
 */
@Value
@Builder
public class HolisticScoreResult {

	String nctId;

	double holisticScore;
	double mechanismFitScore;
	double eligibilityScore;
	double pgxSafetyScore;

	@Singular("weight")
	Map<String, Double> weights;

	Interpretation interpretation;
	String recommendation;

	@Singular("caveat")
	List<String> caveats;

	@Singular("mechanismAlignmentEntry")
	Map<String, Double> mechanismAlignment;

	@Singular("eligibilityLine")
	List<String> eligibilityBreakdown;

	PgxSafetyAssessment pgxDetails;

	@Singular("provenanceEntry")
	Map<String, String> provenance;
}
