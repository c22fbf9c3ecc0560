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

import org.oncolens.engine.om.BiomarkerRecord;
import org.oncolens.engine.om.DrugDescriptor;
import org.oncolens.engine.om.GermlineStatus;

import lombok.Value;

/** Inputs shared by every gate for one drug evaluation. */
@Value
public class GateContext {
	DrugDescriptor drug;
	GermlineStatus germlineStatus;

	/** Never {@code null}; an empty record stands in for "nothing known". */
	BiomarkerRecord record;

	/** Optional tumor type, e.g. "melanoma" or "hgsoc". */
	String cancerType;

	public static GateContext of(DrugDescriptor drug, GermlineStatus germline, BiomarkerRecord record,
			String cancerType) {
		return new GateContext(drug, germline == null ? GermlineStatus.UNKNOWN : germline,
				record == null ? new BiomarkerRecord() : record, cancerType);
	}
}
