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

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/** Germline result for the DNA-repair genes relevant to PARP inhibition. */
public enum GermlineStatus {
	POSITIVE, NEGATIVE, UNKNOWN;

	public static GermlineStatus parse(String raw) {
		if (StringUtils.isBlank(raw))
			return UNKNOWN;
		switch (raw.trim().toLowerCase(Locale.ROOT)) {
		case "positive":
			return POSITIVE;
		case "negative":
			return NEGATIVE;
		default:
			return UNKNOWN;
		}
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
