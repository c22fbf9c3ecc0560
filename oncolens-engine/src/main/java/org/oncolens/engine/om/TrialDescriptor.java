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

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Registry metadata for one clinical trial, reduced to the fields scoring
 * reads.
 */
@Data
public class TrialDescriptor {

	private String nctId;
	private String title;

	/** Registry status text, e.g. "RECRUITING", "ACTIVE_NOT_RECRUITING". */
	private String overallStatus;

	private List<String> conditions = new ArrayList<>();

	/** Age bounds as printed by the registry, e.g. "18 Years". */
	private String minimumAge;
	private String maximumAge;

	private List<TrialLocation> locations = new ArrayList<>();

	/** Gene symbols the trial requires. */
	private List<String> biomarkerRequirements = new ArrayList<>();

	/** Mechanism-of-action profile of the trial's intervention. */
	private MechanismVector moaVector;

	/** Intervention drug names in registry order. */
	private List<String> interventionDrugs = new ArrayList<>();

	/** First listed intervention drug, or {@code null}. */
	public String primaryDrug() {
		if (interventionDrugs == null)
			return null;
		return interventionDrugs.stream().filter(d -> d != null && !d.isBlank()).findFirst().orElse(null);
	}

	public String displayId() {
		return nctId == null ? "this trial" : nctId;
	}
}
