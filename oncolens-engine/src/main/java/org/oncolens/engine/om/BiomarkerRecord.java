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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import lombok.Data;

/**
 * Tumor context for one patient: the biomarkers the gates read.
 * <p>
 * Every field is optional. A {@code null} number means "not measured" and is
 * never read as zero.
 */
@Data
public class BiomarkerRecord {

	/** Homologous-recombination deficiency score (0-100). */
	private Double hrdScore;

	/** Tumor mutational burden, mutations per megabase. */
	private Double tmb;

	private MsiStatus msiStatus;

	private List<SomaticMutation> somaticMutations = new ArrayList<>();

	/** Germline variants reported alongside the tumor panel. */
	private List<SomaticMutation> germlineMutations = new ArrayList<>();

	/** Gene symbol to expression value (TPM or counts). */
	private Map<String, Double> expression;

	/** Fraction of key biomarkers populated, in [0,1]. */
	private Double completenessScore;

	public boolean hasExpression() {
		return expression != null && !expression.isEmpty();
	}

	public boolean isTmbMeasured() {
		return tmb != null && !tmb.isNaN();
	}

	public boolean isMsiHigh() {
		return msiStatus != null && msiStatus.isHigh();
	}

	/**
	 * Upper-cased gene symbols from somatic and germline mutations, in report
	 * order without duplicates.
	 */
	public Set<String> mutatedGenes() {
		Set<String> genes = new LinkedHashSet<>();
		addGenes(somaticMutations, genes);
		addGenes(germlineMutations, genes);
		return genes;
	}

	private static void addGenes(List<SomaticMutation> mutations, Set<String> out) {
		if (mutations == null)
			return;
		for (SomaticMutation m : mutations) {
			if (m != null && StringUtils.isNotBlank(m.getGene())) {
				out.add(m.getGene().trim().toUpperCase(Locale.ROOT));
			}
		}
	}
}
