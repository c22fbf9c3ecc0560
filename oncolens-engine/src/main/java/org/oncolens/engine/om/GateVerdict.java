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

/** Every verdict a gate can reach, grouped by gate. */
public enum GateVerdict {
	// PARP germline/HRD
	FULL_EFFECT, RESCUED, REDUCED, CONSERVATIVE, NOT_PARP,
	// Ovarian pathway resistance
	MODERATELY_REDUCED, SLIGHTLY_BOOSTED, NO_CHANGE, FALLBACK, NO_EXPRESSION,
	// IO boost
	BOOSTED, NO_BOOST, SUSPECTED_HYPERMUTATION,
	// Confidence cap
	CAPPED, NO_CAP,
	// Orchestrator audit line
	SUMMARY
}
