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

import org.oncolens.engine.om.CompletenessTier;

/**
 * Maps a completeness score to a tier. Absent scores count as 0.0.
 */
public final class CompletenessClassifier {

	public static final double L1_THRESHOLD = 0.3;
	public static final double L2_THRESHOLD = 0.7;

	public CompletenessTier classify(Double completenessScore) {
		double c = completenessScore == null || completenessScore.isNaN() ? 0.0 : completenessScore;
		if (c >= L2_THRESHOLD)
			return CompletenessTier.L2;
		if (c >= L1_THRESHOLD)
			return CompletenessTier.L1;
		return CompletenessTier.L0;
	}
}
