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

/** Identifier stamped on each rationale entry. */
public enum GateId {
	PARP_GERMLINE,
	PARP_HRD_RESCUE,
	PARP_HRD_LOW,
	PARP_UNKNOWN_HRD,
	PARP_UNKNOWN_GERMLINE,
	PARP_NOT_APPLICABLE,
	OVARIAN_PATHWAY,
	IO_PATHWAY_BOOST,
	IO_TMB_BOOST,
	IO_MSI_BOOST,
	IO_HYPERMUTATOR_FLAG,
	IO_NO_BOOST,
	CONFIDENCE_CAP,
	GATES_SUMMARY
}
