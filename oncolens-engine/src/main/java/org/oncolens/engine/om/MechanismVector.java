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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pathway-activity profile used to match a patient against a trial's mechanism
 * of action. The canonical form has seven dimensions in the order of
 * {@link #DIMENSIONS}; a vector built from a list keeps whatever length it was
 * given so callers can detect a shape mismatch.
 */
public final class MechanismVector {

	public static final List<String> DIMENSIONS = Collections
			.unmodifiableList(Arrays.asList("DDR", "MAPK", "PI3K", "VEGF", "HER2", "IO", "Efflux"));

	private final double[] values;

	private MechanismVector(double[] values) {
		this.values = values;
	}

	public static MechanismVector of(double... values) {
		return new MechanismVector(values == null ? new double[0] : values.clone());
	}

	public static MechanismVector fromList(List<? extends Number> values) {
		double[] v = new double[values.size()];
		for (int i = 0; i < v.length; i++) {
			Number n = values.get(i);
			v[i] = n == null ? 0.0 : n.doubleValue();
		}
		return new MechanismVector(v);
	}

	/**
	 * Builds the canonical seven-dimension vector. Keys match case-insensitively;
	 * absent keys are 0.0.
	 */
	public static MechanismVector fromMap(Map<String, ? extends Number> byDimension) {
		double[] v = new double[DIMENSIONS.size()];
		if (byDimension != null) {
			for (Map.Entry<String, ? extends Number> e : byDimension.entrySet()) {
				if (e.getKey() == null || e.getValue() == null)
					continue;
				int idx = indexOf(e.getKey());
				if (idx >= 0) {
					v[idx] = e.getValue().doubleValue();
				}
			}
		}
		return new MechanismVector(v);
	}

	private static int indexOf(String key) {
		String k = key.trim().toUpperCase(Locale.ROOT);
		for (int i = 0; i < DIMENSIONS.size(); i++) {
			if (DIMENSIONS.get(i).toUpperCase(Locale.ROOT).equals(k))
				return i;
		}
		return -1;
	}

	public int size() {
		return values.length;
	}

	public double get(int i) {
		return values[i];
	}

	public double[] toArray() {
		return values.clone();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof MechanismVector && Arrays.equals(values, ((MechanismVector) o).values);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(values);
	}

	@Override
	public String toString() {
		return "MechanismVector" + Arrays.toString(values);
	}
}
