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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A candidate drug as the gates see it: name, class and mechanism text. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DrugDescriptor {

	private String name;

	/** Free-text class, e.g. "PARP inhibitor". */
	private String drugClass;

	/** Free-text mechanism of action, e.g. "anti-PD-1 antibody". */
	private String mechanism;

	public String nameLower() {
		return lower(name);
	}

	public String classLower() {
		return lower(drugClass);
	}

	public String mechanismLower() {
		return lower(mechanism);
	}

	private static String lower(String s) {
		return StringUtils.defaultString(s).toLowerCase(Locale.ROOT);
	}
}
