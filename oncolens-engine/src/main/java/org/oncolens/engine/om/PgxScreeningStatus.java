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

/** Whether a PGx safety score came from an actual screen. */
public enum PgxScreeningStatus {
	SCREENED("screened"),
	/** No variants or no drug; distinct from screened-and-safe. */
	NOT_SCREENED("not_screened"),
	/** The lookup failed; the score is the unscreened default. */
	ERROR("error");

	private final String label;

	PgxScreeningStatus(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
