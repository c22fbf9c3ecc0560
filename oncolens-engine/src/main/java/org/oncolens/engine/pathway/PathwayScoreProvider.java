package org.oncolens.engine.pathway;

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

import java.util.Map;

/**
 * Turns an expression profile into named pathway scores and a single composite.
 * Implementations hold fixed gene sets and coefficients and keep no state
 * between calls.
 */
public interface PathwayScoreProvider {

	/**
	 * @param expression gene symbol to expression value; never {@code null}
	 * @return pathway name to score, in the model's pathway order
	 */
	Map<String, Double> computePathwayScores(Map<String, Double> expression);

	/** Combines pathway scores into the model's composite. */
	double composite(Map<String, Double> pathwayScores);

	/** Gene coverage of the pathways the composite depends on. */
	ExpressionQuality assessQuality(Map<String, Double> expression);
}
