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

/**
 * Microsatellite instability call reported with a tumor record.
 */
public enum MsiStatus {
	MSI_HIGH, MSI_STABLE, UNKNOWN;

	/**
	 * Accepts the spellings seen in lab reports: "MSI-H", "MSI-High", "MSI_HIGH",
	 * "MSI-Stable", "MSS". Anything else is {@link #UNKNOWN}.
	 */
	public static MsiStatus parse(String raw) {
		if (StringUtils.isBlank(raw))
			return UNKNOWN;
		String s = raw.trim().toUpperCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
		switch (s) {
		case "MSI-H":
		case "MSI-HIGH":
			return MSI_HIGH;
		case "MSS":
		case "MSI-S":
		case "MSI-STABLE":
			return MSI_STABLE;
		default:
			return UNKNOWN;
		}
	}

	public boolean isHigh() {
		return this == MSI_HIGH;
	}
}
