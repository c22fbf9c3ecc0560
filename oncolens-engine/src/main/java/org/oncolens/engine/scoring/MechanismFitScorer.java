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

import java.util.LinkedHashMap;
import java.util.Map;

import org.oncolens.engine.om.MechanismFit;
import org.oncolens.engine.om.MechanismVector;
import org.oncolens.engine.util.Logger;
import org.oncolens.engine.util.Scores;

/**
 * Cosine similarity between the patient's pathway profile and the trial's
 * mechanism of action.
 */
public final class MechanismFitScorer {

	/** Score the composer substitutes when the fit is undetermined. */
	public static final double UNDETERMINED_DEFAULT = 0.5;

	public MechanismFit score(MechanismVector patient, MechanismVector trial) {
		if (patient == null || trial == null) {
			return MechanismFit.undetermined();
		}
		if (patient.size() != trial.size() || patient.size() == 0) {
			Logger.warn("Mechanism vector length mismatch: patient={}, trial={}", patient.size(), trial.size());
			return MechanismFit.undetermined();
		}

		double[] p = l2Normalize(patient.toArray());
		double[] t = l2Normalize(trial.toArray());

		double dot = 0.0;
		Map<String, Double> alignment = new LinkedHashMap<>();
		for (int i = 0; i < p.length; i++) {
			double product = p[i] * t[i];
			dot += product;
			alignment.put(dimensionName(i), Scores.round3(product));
		}
		return new MechanismFit(Scores.round3(Scores.clamp01(dot)), alignment);
	}

	static double[] l2Normalize(double[] v) {
		double sumSq = 0.0;
		for (double x : v)
			sumSq += x * x;
		double magnitude = Math.sqrt(sumSq);
		double[] out = new double[v.length];
		if (magnitude == 0.0)
			return out;
		for (int i = 0; i < v.length; i++)
			out[i] = v[i] / magnitude;
		return out;
	}

	private static String dimensionName(int i) {
		return i < MechanismVector.DIMENSIONS.size() ? MechanismVector.DIMENSIONS.get(i) : "DIM_" + i;
	}
}
