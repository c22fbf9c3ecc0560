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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.oncolens.engine.om.BiomarkerRecord;
import org.oncolens.engine.om.DrugDescriptor;
import org.oncolens.engine.om.GateId;
import org.oncolens.engine.om.GateOutcome;
import org.oncolens.engine.om.GateVerdict;
import org.oncolens.engine.om.GermlineStatus;
import org.oncolens.engine.om.MsiStatus;
import org.oncolens.engine.om.SomaticMutation;
import org.oncolens.engine.pathway.ExpressionQuality;
import org.oncolens.engine.pathway.IoPathwaySafety;
import org.oncolens.engine.pathway.PathwayScoreProvider;

class IoBoostGateTest {

	private static final DrugDescriptor PEMBROLIZUMAB = new DrugDescriptor("Pembrolizumab", "checkpoint_inhibitor",
			"anti-PD-1 antibody");

	private final IoBoostGate gate = new IoBoostGate();

	// --- helpers -------------------------------------------------------------

	private static BiomarkerRecord record(Double tmb, MsiStatus msi) {
		BiomarkerRecord r = new BiomarkerRecord();
		r.setTmb(tmb);
		r.setMsiStatus(msi);
		return r;
	}

	private static GateContext ctx(BiomarkerRecord r, String cancerType) {
		return GateContext.of(PEMBROLIZUMAB, GermlineStatus.UNKNOWN, r, cancerType);
	}

	private static IoBoostGate pathwayGate(double rawComposite) {
		PathwayScoreProvider p = mock(PathwayScoreProvider.class);
		when(p.computePathwayScores(anyMap())).thenReturn(Map.of("EXHAUSTION", 2.0));
		when(p.composite(anyMap())).thenReturn(rawComposite);
		when(p.assessQuality(anyMap())).thenReturn(new ExpressionQuality(20000, Map.of(), 0.9, true, List.of()));
		return new IoBoostGate(p, new IoPathwaySafety());
	}

	private static BiomarkerRecord withExpression(BiomarkerRecord r) {
		r.setExpression(Map.of("PDCD1", 4.0));
		return r;
	}

	private static IoBoostGate failingPathwayGate() {
		PathwayScoreProvider p = mock(PathwayScoreProvider.class);
		when(p.computePathwayScores(anyMap())).thenThrow(new IllegalStateException("model offline"));
		return new IoBoostGate(p, new IoPathwaySafety());
	}

	// --- TMB / MSI -----------------------------------------------------------

	@Test
	void tmb_high_boosts() {
		GateOutcome o = gate.evaluate(ctx(record(25.0, MsiStatus.MSI_STABLE), null));

		assertEquals(GateId.IO_TMB_BOOST, o.getGateId());
		assertEquals(1.35, o.getMultiplier(), 0.0);
		assertEquals("TMB-high (≥20): 25.0 mut/Mb → Checkpoint inhibitor boost 1.35x", o.getRationale());
	}

	@Test
	void msi_high_boosts_with_low_tmb() {
		GateOutcome o = gate.evaluate(ctx(record(5.0, MsiStatus.MSI_HIGH), null));

		assertEquals(GateId.IO_MSI_BOOST, o.getGateId());
		assertEquals(1.30, o.getMultiplier(), 0.0);
	}

	@Test
	@DisplayName("TMB-high wins over MSI-High; boosts are mutually exclusive")
	void tmb_high_and_msi_high_do_not_stack() {
		// multiplying both would give 1.755x; only the higher-priority rule applies
		GateOutcome o = gate.evaluate(ctx(record(25.0, MsiStatus.MSI_HIGH), null));

		assertEquals(GateId.IO_TMB_BOOST, o.getGateId());
		assertEquals(1.35, o.getMultiplier(), 0.0);
	}

	@Test
	void msi_outranks_intermediate_tmb() {
		assertEquals(1.25, gate.evaluate(ctx(record(12.0, MsiStatus.MSI_STABLE), null)).getMultiplier(), 0.0);
		assertEquals(1.30, gate.evaluate(ctx(record(12.0, MsiStatus.MSI_HIGH), null)).getMultiplier(), 0.0);
	}

	@Test
	void tmb_boundaries() {
		assertEquals(1.35, gate.evaluate(ctx(record(20.0, null), null)).getMultiplier(), 0.0);
		assertEquals(1.25, gate.evaluate(ctx(record(19.99, null), null)).getMultiplier(), 0.0);
		assertEquals(1.25, gate.evaluate(ctx(record(10.0, null), null)).getMultiplier(), 0.0);
		assertEquals(1.0, gate.evaluate(ctx(record(9.99, null), null)).getMultiplier(), 0.0);
	}

	@Test
	void no_signal_is_no_boost() {
		GateOutcome o = gate.evaluate(ctx(new BiomarkerRecord(), null));

		assertEquals(GateId.IO_NO_BOOST, o.getGateId());
		assertEquals(GateVerdict.NO_BOOST, o.getVerdict());
		assertEquals(1.0, o.getMultiplier(), 0.0);
	}

	// --- hypermutator --------------------------------------------------------

	@Test
	@DisplayName("POLE mutation with unknown TMB flags for measurement, no boost")
	void hypermutator_gene_with_unknown_tmb_is_flagged_not_boosted() {
		BiomarkerRecord r = new BiomarkerRecord();
		r.setSomaticMutations(List.of(new SomaticMutation("POLE", "p.P286R", null)));

		GateOutcome o = gate.evaluate(ctx(r, null));

		assertEquals(GateId.IO_HYPERMUTATOR_FLAG, o.getGateId());
		assertEquals(GateVerdict.SUSPECTED_HYPERMUTATION, o.getVerdict());
		assertEquals(1.0, o.getMultiplier(), 0.0);
		assertEquals("MEASURE_TMB_MSI", o.getMetadata().get("action"));
		assertEquals(List.of("POLE"), o.getMetadata().get("hypermutator_genes"));
	}

	@Test
	void germline_mbd4_also_flags() {
		BiomarkerRecord r = new BiomarkerRecord();
		r.setGermlineMutations(List.of(new SomaticMutation("mbd4")));

		assertEquals(GateId.IO_HYPERMUTATOR_FLAG, gate.evaluate(ctx(r, null)).getGateId());
	}

	@Test
	void hypermutator_ignored_once_tmb_measured() {
		BiomarkerRecord r = record(5.0, null);
		r.setSomaticMutations(List.of(new SomaticMutation("POLD1")));

		assertEquals(GateId.IO_NO_BOOST, gate.evaluate(ctx(r, null)).getGateId());
	}

	// --- pathway -------------------------------------------------------------

	@Test
	void validated_pathway_takes_priority_over_tmb() {
		GateOutcome o = pathwayGate(0.8).evaluate(ctx(withExpression(record(25.0, null)), "melanoma"));

		assertEquals(GateId.IO_PATHWAY_BOOST, o.getGateId());
		assertEquals(GateVerdict.BOOSTED, o.getVerdict());
		assertEquals(1.40, o.getMultiplier(), 0.0);
	}

	@Test
	void unvalidated_type_falls_back_to_tmb() {
		GateOutcome o = pathwayGate(0.8).evaluate(ctx(withExpression(record(25.0, null)), "nsclc"));

		assertEquals(GateId.IO_TMB_BOOST, o.getGateId());
		assertEquals(1.35, o.getMultiplier(), 0.0);
	}

	@Test
	@DisplayName("Pathway fallback is reported when TMB/MSI give nothing")
	void fallback_reported_when_no_later_rule_decides() {
		GateOutcome o = pathwayGate(0.8).evaluate(ctx(withExpression(record(5.0, MsiStatus.MSI_STABLE)), "nsclc"));

		assertEquals(GateId.IO_PATHWAY_BOOST, o.getGateId());
		assertEquals(GateVerdict.FALLBACK, o.getVerdict());
		assertEquals(1.0, o.getMultiplier(), 0.0);
		assertTrue(o.getRationale().contains("Falling back to TMB/MSI"));
	}

	@Test
	@DisplayName("A non-boosting pathway result defers to later rules")
	void low_pathway_band_defers_to_msi() {
		GateOutcome alone = pathwayGate(0.2).evaluate(ctx(withExpression(new BiomarkerRecord()), "melanoma"));
		GateOutcome withMsi = pathwayGate(0.2)
				.evaluate(ctx(withExpression(record(null, MsiStatus.MSI_HIGH)), "melanoma"));

		assertEquals(GateId.IO_PATHWAY_BOOST, alone.getGateId());
		assertEquals(GateVerdict.NO_BOOST, alone.getVerdict());
		assertEquals(GateId.IO_MSI_BOOST, withMsi.getGateId());
		assertEquals(1.30, withMsi.getMultiplier(), 0.0);
	}

	@Test
	void missing_cancer_type_degrades_pathway_boost() {
		// 0.8 * 0.6 = 0.48 → 1.15x
		GateOutcome o = pathwayGate(0.8).evaluate(ctx(withExpression(new BiomarkerRecord()), null));

		assertEquals(1.15, o.getMultiplier(), 0.0);
	}

	@Test
	void pathway_boost_bands() {
		assertEquals(1.40, IoBoostGate.pathwayBoost(0.7), 0.0);
		assertEquals(1.30, IoBoostGate.pathwayBoost(0.5), 0.0);
		assertEquals(1.15, IoBoostGate.pathwayBoost(0.3), 0.0);
		assertEquals(1.0, IoBoostGate.pathwayBoost(0.29), 0.0);
	}

	@Test
	void priority_order_is_fixed() {
		assertEquals(List.of("PATHWAY_COMPOSITE", "TMB_HIGH", "MSI_HIGH", "TMB_INTERMEDIATE", "HYPERMUTATOR_FLAG"),
				gate.priorityOrder());
	}

	@Test
	@DisplayName("Pathway model failure falls through to the TMB rule")
	void pathway_failure_uses_tmb_rules() {
		GateOutcome o = failingPathwayGate().evaluate(ctx(withExpression(record(25.0, null)), "melanoma"));

		assertEquals(GateId.IO_TMB_BOOST, o.getGateId());
		assertEquals(1.35, o.getMultiplier(), 0.0);
	}

	@Test
	void pathway_failure_without_other_signals_is_no_boost() {
		GateOutcome o = failingPathwayGate().evaluate(ctx(withExpression(new BiomarkerRecord()), "melanoma"));

		assertEquals(GateId.IO_NO_BOOST, o.getGateId());
		assertEquals(1.0, o.getMultiplier(), 0.0);
	}
}
