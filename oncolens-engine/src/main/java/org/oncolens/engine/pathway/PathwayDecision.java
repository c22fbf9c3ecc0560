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

import lombok.Value;

/** Whether a pathway prediction may drive a gate, and why. */
@Value
public class PathwayDecision {
	boolean usePathway;
	String reason;

	public static PathwayDecision use() {
		return new PathwayDecision(true, "Pathway prediction validated and acceptable");
	}

	public static PathwayDecision fallback(String reason) {
		return new PathwayDecision(false, reason);
	}
}
