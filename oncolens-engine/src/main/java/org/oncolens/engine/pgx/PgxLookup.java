package org.oncolens.engine.pgx;

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

import org.oncolens.engine.om.PgxLookupResult;

/**
 * Toxicity lookup for one drug and one germline variant. Implementations must
 * be idempotent and side-effect free.
 */
@FunctionalInterface
public interface PgxLookup {

	/**
	 * @return never {@code null}; {@link PgxLookupResult#NO_KNOWN_RISK} when
	 *         nothing is known
	 */
	PgxLookupResult lookup(String drugName, String gene, String variant);
}
