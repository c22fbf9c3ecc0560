package org.oncolens.engine.scoring;

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

import org.apache.commons.lang3.StringUtils;
import org.oncolens.engine.om.PgxLookupResult;
import org.oncolens.engine.om.PgxSafetyAssessment;
import org.oncolens.engine.om.PgxScreeningStatus;
import org.oncolens.engine.om.PharmacogeneVariant;
import org.oncolens.engine.om.ScreenedVariant;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.pgx.PgxLookup;
import org.oncolens.engine.util.Logger;

/**
 * Screens germline pharmacogene variants against a drug. The safety score is
 * the smallest adjustment factor found; a factor at or below
 * {@link #CONTRAINDICATION_THRESHOLD} makes the drug contraindicated and the
 * score 0.0.
 */
public final class PgxSafetyScorer {

	public static final double CONTRAINDICATION_THRESHOLD = 0.1;

	private final PgxLookup lookup;

	public PgxSafetyScorer(PgxLookup lookup) {
		if (lookup == null) {
			throw new IllegalArgumentException("PGx lookup is required");
		}
		this.lookup = lookup;
	}

	/**
	 * @param drug explicit drug; when blank the trial's first intervention is
	 *             used
	 */
	public PgxSafetyAssessment assess(List<PharmacogeneVariant> variants, String drug, TrialDescriptor trial) {
		String resolved = StringUtils.isNotBlank(drug) ? drug.trim() : trial == null ? null : trial.primaryDrug();

		if (variants == null || variants.isEmpty()) {
			return notScreened("No germline variants provided", resolved);
		}
		if (StringUtils.isBlank(resolved)) {
			return notScreened("No drug specified for PGx screening", null);
		}

		PgxSafetyAssessment.PgxSafetyAssessmentBuilder out = PgxSafetyAssessment.builder()
				.status(PgxScreeningStatus.SCREENED).drug(resolved);
		double min = 1.0;
		boolean contraindicated = false;
		String reason = null;

		try {
			for (PharmacogeneVariant v : variants) {
				if (v == null || StringUtils.isBlank(v.getGene()))
					continue;
				String gene = v.getGene().trim();
				String variant = StringUtils.defaultString(v.getVariant()).trim();

				PgxLookupResult hit = lookup.lookup(resolved, gene, variant);
				if (hit == null)
					hit = PgxLookupResult.NO_KNOWN_RISK;
				double factor = hit.getAdjustmentFactor();
				out.variantScreened(new ScreenedVariant(gene, variant, hit.getToxicityTier(), factor));

				if (factor <= CONTRAINDICATION_THRESHOLD) {
					contraindicated = true;
					reason = gene + " " + variant + ": Contraindicated for " + resolved;
					min = 0.0;
				} else if (factor < min) {
					min = factor;
					out.doseAdjustment(gene + " " + variant + ": " + Math.round((1.0 - factor) * 100)
							+ "% dose reduction for " + resolved);
				}
			}
		} catch (RuntimeException ex) {
			Logger.warn("PGx screening failed for {}: {}", resolved, ex.getMessage());
			return PgxSafetyAssessment.builder().score(1.0).status(PgxScreeningStatus.ERROR).drug(resolved)
					.reason("PGx screening failed: " + ex.getMessage()).build();
		}

		return out.score(min).contraindicated(contraindicated).reason(reason).build();
	}

	private static PgxSafetyAssessment notScreened(String reason, String drug) {
		return PgxSafetyAssessment.builder().score(1.0).status(PgxScreeningStatus.NOT_SCREENED).drug(drug)
				.reason(reason).build();
	}
}
