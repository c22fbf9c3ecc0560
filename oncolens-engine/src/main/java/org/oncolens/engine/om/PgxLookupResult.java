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

import lombok.Value;

/** Toxicity tier and dose adjustment factor for one (drug, gene, variant). */
@Value
public class PgxLookupResult {

	/** Returned when the table has no entry: no known risk, full dose. */
	public static final PgxLookupResult NO_KNOWN_RISK = new PgxLookupResult(ToxicityTier.LOW, 1.0);

	ToxicityTier toxicityTier;

	/** Fraction of standard dose, in [0,1]; 1.0 means no adjustment. */
	double adjustmentFactor;
}
