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
 * What trial matching knows about a patient.
 */
@Data
public class PatientProfile {

	/** Seven-dimension pathway profile; {@code null} when not computed. */
	private MechanismVector mechanismVector;

	private String disease;

	private Integer age;

	/** Home location; only the state is compared. */
	private TrialLocation location;

	private List<SomaticMutation> mutations = new ArrayList<>();

	/** Germline pharmacogene calls used for PGx screening. */
	private List<PharmacogeneVariant> germlineVariants = new ArrayList<>();
}
