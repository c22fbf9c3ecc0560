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

/** Display label attached to a risk-benefit composite. */
public enum RiskBenefitAction {
	PREFERRED_UNSCREENED("PREFERRED (PGx UNSCREENED)"),
	AVOID("AVOID / HIGH-RISK"),
	CONSIDER_WITH_MONITORING("CONSIDER WITH MONITORING"),
	PREFERRED("PREFERRED");

	private final String label;

	RiskBenefitAction(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
