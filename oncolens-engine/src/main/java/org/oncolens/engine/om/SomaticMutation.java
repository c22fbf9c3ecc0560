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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reported variant. Used for both somatic calls and germline findings on
 * a tumor record, and for the patient's mutation list in trial matching.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SomaticMutation {

	/** HGNC gene symbol, e.g. BRCA1. */
	private String gene;

	/** Protein change in HGVS p. notation, e.g. p.V600E. Optional. */
	private String proteinChange;

	/** heterozygous / homozygous / hemizygous, when known. */
	private String zygosity;

	public SomaticMutation(String gene) {
		this.gene = gene;
	}
}
