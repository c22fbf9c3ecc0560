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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ScoresTest {

	@Test
	void clamp01_bounds_and_is_idempotent() {
		double[] inputs = { -3.0, -0.0001, 0.0, 0.42, 1.0, 1.0001, 7.5 };
		for (double v : inputs) {
			double once = Scores.clamp01(v);
			assertEquals(once, Scores.clamp01(once), 0.0);
			assertEquals(true, once >= 0.0 && once <= 1.0);
		}
		assertEquals(0.0, Scores.clamp01(Double.NaN), 0.0);
	}

	@Test
	void round3_is_half_up() {
		assertEquals(0.56, Scores.round3(0.7 * 0.8), 0.0);
		assertEquals(0.334, Scores.round3(0.3335), 0.0);
		assertEquals(0.333, Scores.round3(1.0 / 3.0), 0.0);
	}

	@Test
	void log2p1_matches_definition() {
		assertEquals(0.0, Scores.log2p1(0.0), 1e-12);
		assertEquals(1.0, Scores.log2p1(1.0), 1e-12);
		assertEquals(3.0, Scores.log2p1(7.0), 1e-12);
		assertEquals(0.0, Scores.log2p1(-4.0), 1e-12);
	}

	@Test
	void sigmoid_midpoint() {
		assertEquals(0.5, Scores.sigmoid(0.0), 1e-12);
	}
}
