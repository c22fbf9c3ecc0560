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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Platinum/PARP resistance model for high-grade serous ovarian cancer.
 * <p>
 * Composite is the weighted sum 0.4 DDR + 0.3 PI3K + 0.3 VEGF of raw
 * log2(TPM+1) pathway means (GSE165897, n=11, AUC 0.750). Higher means more
 * resistant. MAPK and EFFLUX are scored for reporting only.
 */
public final class OvarianPathwayModel extends GeneSetPathwayModel {

	public static final String DDR = "DDR";
	public static final String PI3K = "PI3K";
	public static final String VEGF = "VEGF";
	public static final String MAPK = "MAPK";
	public static final String EFFLUX = "EFFLUX";

	public static final String COHORT = "GSE165897";
	public static final int COHORT_SIZE = 11;
	public static final double COHORT_AUC = 0.750;

	public static final double WEIGHT_DDR = 0.4;
	public static final double WEIGHT_PI3K = 0.3;
	public static final double WEIGHT_VEGF = 0.3;

	public static final double HIGH_RESISTANCE = 0.25;
	public static final double MODERATE_RESISTANCE = 0.20;

	/** Resistance risk band for an adjusted composite. */
	public enum ResistanceRisk {
		HIGH, MODERATE, LOW
	}

	public OvarianPathwayModel() {
		super(geneSets());
	}

	private static Map<String, List<String>> geneSets() {
		Map<String, List<String>> p = new LinkedHashMap<>();
		p.put(DDR, List.of("BRCA1", "BRCA2", "PALB2", "RAD51C", "RAD51D", "BRIP1", "BARD1", "ATM", "ATR", "CHEK1",
				"CHEK2", "RAD51", "RAD52", "RAD54L", "FANCA", "FANCB", "FANCC", "FANCD2", "FANCE", "FANCF", "FANCG",
				"MRE11A", "RAD50", "NBN", "XRCC2", "XRCC3"));
		p.put(PI3K, List.of("PIK3CA", "PIK3CB", "PIK3CD", "PIK3CG", "PIK3R1", "PIK3R2", "PIK3R3", "AKT1", "AKT2",
				"AKT3", "PTEN", "TSC1", "TSC2", "MTOR", "PDK1", "RPS6KB1", "RPS6KB2", "EIF4EBP1", "RHEB", "RICTOR",
				"RPTOR"));
		p.put(VEGF, List.of("VEGFA", "VEGFB", "VEGFC", "VEGFD", "KDR", "FLT1", "FLT4", "ANGPT1", "ANGPT2", "TEK",
				"TIE1", "PECAM1", "VWF", "ENG", "KIT", "PDGFRA", "PDGFRB"));
		p.put(MAPK, List.of("KRAS", "NRAS", "HRAS", "BRAF", "RAF1", "MAP2K1", "MAP2K2", "MAPK1", "MAPK3", "NF1",
				"RASA1", "RASA2", "SPRED1", "SPRED2"));
		p.put(EFFLUX, List.of("ABCB1", "ABCC1", "ABCC2", "ABCC3", "ABCC4", "ABCC5", "ABCC6", "ABCG2", "SLC22A1",
				"SLC22A2", "SLC22A3"));
		return p;
	}

	@Override
	protected double emptyPathwayScore() {
		return 0.0;
	}

	@Override
	protected Map<String, List<String>> qualityPathways() {
		Map<String, List<String>> q = new LinkedHashMap<>();
		q.put(DDR, getPathways().get(DDR));
		q.put(PI3K, getPathways().get(PI3K));
		q.put(VEGF, getPathways().get(VEGF));
		return q;
	}

	@Override
	public double composite(Map<String, Double> pathwayScores) {
		return WEIGHT_DDR * pathwayScores.getOrDefault(DDR, 0.0)
				+ WEIGHT_PI3K * pathwayScores.getOrDefault(PI3K, 0.0)
				+ WEIGHT_VEGF * pathwayScores.getOrDefault(VEGF, 0.0);
	}

	public static ResistanceRisk classify(double composite) {
		if (composite >= HIGH_RESISTANCE)
			return ResistanceRisk.HIGH;
		if (composite >= MODERATE_RESISTANCE)
			return ResistanceRisk.MODERATE;
		return ResistanceRisk.LOW;
	}
}
