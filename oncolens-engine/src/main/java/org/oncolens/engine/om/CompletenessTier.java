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

/**
 * Data-quality bucket derived from a tumor record's completeness score. Each
 * tier carries the highest confidence a score may claim.
 */
public enum CompletenessTier {
	/** Fewer than 30% of the key biomarkers known. */
	L0(0.4),
	/** Partial record. */
	L1(0.6),
	/** Full record; confidence is left alone. */
	L2(1.0);

	private final double confidenceCeiling;

	CompletenessTier(double confidenceCeiling) {
		this.confidenceCeiling = confidenceCeiling;
	}

	public double getConfidenceCeiling() {
		return confidenceCeiling;
	}
}
