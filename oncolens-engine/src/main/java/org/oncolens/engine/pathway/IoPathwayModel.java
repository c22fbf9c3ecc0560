package org.oncolens.engine.pathway;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.oncolens.engine.util.Scores;

/**
 * Eight-pathway logistic model of checkpoint-inhibitor response.
 * <p>
 * Fitted on GSE91061 (51 pre-treatment melanoma samples, nivolumab; AUC
 * 0.780). Coefficients are unstandardized and apply to raw log2(TPM+1)
 * pathway means. A pathway with no covered genes scores NaN and is left out of
 * the linear predictor.
 */
public final class IoPathwayModel extends GeneSetPathwayModel {

	public static final String TIL_INFILTRATION = "TIL_INFILTRATION";
	public static final String T_EFFECTOR = "T_EFFECTOR";
	public static final String ANGIOGENESIS = "ANGIOGENESIS";
	public static final String TGFB_RESISTANCE = "TGFB_RESISTANCE";
	public static final String MYELOID_INFLAMMATION = "MYELOID_INFLAMMATION";
	public static final String PROLIFERATION = "PROLIFERATION";
	public static final String IMMUNOPROTEASOME = "IMMUNOPROTEASOME";
	public static final String EXHAUSTION = "EXHAUSTION";

	public static final String COHORT = "GSE91061";
	public static final int COHORT_SIZE = 51;
	public static final double COHORT_AUC = 0.780;

	public static final double INTERCEPT = 4.038603;

	private static final Map<String, Double> COEFFICIENTS = new LinkedHashMap<>();
	static {
		COEFFICIENTS.put(EXHAUSTION, 0.747468);
		COEFFICIENTS.put(TIL_INFILTRATION, 0.513477);
		COEFFICIENTS.put(ANGIOGENESIS, 0.365093);
		COEFFICIENTS.put(MYELOID_INFLAMMATION, 0.077617);
		COEFFICIENTS.put(TGFB_RESISTANCE, -0.369679);
		COEFFICIENTS.put(T_EFFECTOR, -0.145055);
		COEFFICIENTS.put(PROLIFERATION, -0.357712);
		COEFFICIENTS.put(IMMUNOPROTEASOME, -0.819168);
	}

	public IoPathwayModel() {
		super(geneSets());
	}

	private static Map<String, List<String>> geneSets() {
		Map<String, List<String>> p = new LinkedHashMap<>();
		p.put(TIL_INFILTRATION, List.of("CD8A", "CD8B", "CD3D", "CD3E", "CD3G", "CD4", "CD2", "GZMA", "GZMB",
				"PRF1", "IFNG", "TNF", "IL2"));
		p.put(T_EFFECTOR, List.of("CD274", "PDCD1LG2", "IDO1", "IDO2", "CXCL9", "CXCL10", "CXCL11", "HLA-DRA",
				"HLA-DRB1", "STAT1", "IRF1", "IFNG"));
		p.put(ANGIOGENESIS, List.of("VEGFA", "VEGFB", "VEGFC", "VEGFD", "KDR", "FLT1", "FLT4", "ANGPT1", "ANGPT2",
				"TEK", "PECAM1", "VWF"));
		p.put(TGFB_RESISTANCE, List.of("TGFB1", "TGFB2", "TGFB3", "TGFBR1", "TGFBR2", "TGFBR3", "SMAD2", "SMAD3",
				"SMAD4", "SMAD7"));
		p.put(MYELOID_INFLAMMATION, List.of("IL6", "IL1B", "IL8", "CXCL8", "CXCL1", "CXCL2", "CXCL3", "PTGS2",
				"CCL2", "CCL3", "CCL4", "S100A8", "S100A9", "S100A12"));
		p.put(PROLIFERATION, List.of("MKI67", "PCNA", "TOP2A", "CCNA2", "CCNB1", "CCNB2", "CDK1", "CDK2", "CDK4",
				"CDC20", "AURKA", "AURKB"));
		p.put(IMMUNOPROTEASOME, List.of("PSMB8", "PSMB9", "PSMB10", "TAP1", "TAP2", "B2M", "HLA-A", "HLA-B",
				"HLA-C"));
		p.put(EXHAUSTION, List.of("PDCD1", "CTLA4", "LAG3", "TIGIT", "HAVCR2", "BTLA", "CD96", "VSIR"));
		return p;
	}

	public static Map<String, Double> coefficients() {
		return Collections.unmodifiableMap(COEFFICIENTS);
	}

	@Override
	protected double emptyPathwayScore() {
		return Double.NaN;
	}

	/** sigmoid(intercept + sum of coefficient x score), skipping NaN pathways. */
	@Override
	public double composite(Map<String, Double> pathwayScores) {
		double logit = INTERCEPT;
		for (Map.Entry<String, Double> c : COEFFICIENTS.entrySet()) {
			Double score = pathwayScores.get(c.getKey());
			if (score == null || score.isNaN())
				continue;
			logit += c.getValue() * score;
		}
		return Scores.sigmoid(logit);
	}
}
