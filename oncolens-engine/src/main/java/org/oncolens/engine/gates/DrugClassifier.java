package org.oncolens.engine.gates;

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

import org.oncolens.engine.om.DrugDescriptor;

/**
 * Substring rules that place a drug in the classes the gates care about.
 * Matching is case-insensitive on class and mechanism text.
 */
public final class DrugClassifier {

	private static final List<String> PLATINUM_TOKENS = List.of("platinum", "carboplatin", "cisplatin",
			"oxaliplatin");

	private static final List<String> CHECKPOINT_MECHANISM_TOKENS = List.of("pd-1", "pd-l1", "ctla-4");

	private static final List<String> CHECKPOINT_NAME_TOKENS = List.of("anti-pd1", "anti-pdl1");

	private DrugClassifier() {
	}

	public static boolean isParpInhibitor(DrugDescriptor drug) {
		return drug != null && (drug.classLower().contains("parp") || drug.mechanismLower().contains("parp"));
	}

	public static boolean isPlatinum(DrugDescriptor drug) {
		if (drug == null)
			return false;
		String cls = drug.classLower();
		String moa = drug.mechanismLower();
		return PLATINUM_TOKENS.stream().anyMatch(t -> cls.contains(t) || moa.contains(t));
	}

	public static boolean isCheckpointInhibitor(DrugDescriptor drug) {
		if (drug == null)
			return false;
		String cls = drug.classLower();
		String moa = drug.mechanismLower();
		String name = drug.nameLower();
		if (cls.contains("checkpoint") || moa.contains("checkpoint"))
			return true;
		if (CHECKPOINT_MECHANISM_TOKENS.stream().anyMatch(t -> cls.contains(t) || moa.contains(t)))
			return true;
		return CHECKPOINT_NAME_TOKENS.stream().anyMatch(name::contains);
	}
}
