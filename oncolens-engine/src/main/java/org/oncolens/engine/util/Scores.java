package org.oncolens.engine.util;

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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Numeric helpers shared by gates and scorers.
 */
public final class Scores {

	private Scores() {
	}

	/** Clamps to [0,1]. NaN maps to 0. */
	public static double clamp01(double v) {
		return clamp(v, 0.0, 1.0);
	}

	public static double clamp(double v, double lo, double hi) {
		if (Double.isNaN(v))
			return lo;
		return Math.max(lo, Math.min(hi, v));
	}

	/** Half-up rounding to 3 decimals, the precision every reported score uses. */
	public static double round3(double v) {
		if (Double.isNaN(v) || Double.isInfinite(v))
			return v;
		return BigDecimal.valueOf(v).setScale(3, RoundingMode.HALF_UP).doubleValue();
	}

	public static double round2(double v) {
		if (Double.isNaN(v) || Double.isInfinite(v))
			return v;
		return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
	}

	/** log2(v + 1), negative inputs floored at 0. */
	public static double log2p1(double v) {
		return Math.log(Math.max(0.0, v) + 1.0) / Math.log(2.0);
	}

	public static double sigmoid(double x) {
		return 1.0 / (1.0 + Math.exp(-x));
	}

	public static String pct(double fraction) {
		return Math.round(fraction * 100.0) + "%";
	}
}
