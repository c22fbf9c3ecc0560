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

import lombok.Builder;
import lombok.Value;

/** One row of a batch ranking. {@code error} is set only for failed trials. */
@Value
@Builder
public class TrialScoreSummary {
	String nctId;
	String title;
	double holisticScore;
	Double mechanismFitScore;
	Double eligibilityScore;
	Double pgxSafetyScore;
	Interpretation interpretation;
	String recommendation;
	List<String> caveats;
	String error;

	public static TrialScoreSummary of(HolisticScoreResult r, String title) {
		return TrialScoreSummary.builder()
				.nctId(r.getNctId())
				.title(title)
				.holisticScore(r.getHolisticScore())
				.mechanismFitScore(r.getMechanismFitScore())
				.eligibilityScore(r.getEligibilityScore())
				.pgxSafetyScore(r.getPgxSafetyScore())
				.interpretation(r.getInterpretation())
				.recommendation(r.getRecommendation())
				.caveats(r.getCaveats())
				.build();
	}

	public static TrialScoreSummary failed(TrialDescriptor trial, String error) {
		return TrialScoreSummary.builder()
				.nctId(trial == null ? null : trial.getNctId())
				.title(trial == null ? null : trial.getTitle())
				.holisticScore(0.0)
				.caveats(List.of())
				.error(error)
				.build();
	}

	public boolean isFailed() {
		return error != null;
	}
}
