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

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class PgxSafetyAssessment {

	/** Minimum adjustment factor over screened variants, 0.0 if contraindicated. */
	double score;

	PgxScreeningStatus status;

	boolean contraindicated;

	String reason;

	/** Drug screened, when one was resolved. */
	String drug;

	@Singular("variantScreened")
	List<ScreenedVariant> variantsScreened;

	@Singular("doseAdjustment")
	List<String> doseAdjustments;
}
