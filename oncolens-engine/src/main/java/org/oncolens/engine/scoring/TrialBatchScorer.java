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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.oncolens.engine.om.HolisticScoreResult;
import org.oncolens.engine.om.PatientProfile;
import org.oncolens.engine.om.PharmacogeneVariant;
import org.oncolens.engine.om.TrialDescriptor;
import org.oncolens.engine.om.TrialScoreSummary;
import org.oncolens.engine.util.Logger;

/**
 * Scores one patient against many trials on a small worker pool, then ranks
 * by holistic score. The sort is stable, so ties keep input order and a rerun
 * on the same inputs yields the same ranking.
 */
public final class TrialBatchScorer {

	private final HolisticScoreComposer composer;
	private final int poolSize;

	public TrialBatchScorer(HolisticScoreComposer composer, int poolSize) {
		this.composer = composer;
		this.poolSize = Math.max(1, poolSize);
	}

	public List<TrialScoreSummary> computeBatch(PatientProfile patient, List<TrialDescriptor> trials,
			List<PharmacogeneVariant> pharmacogenes) {
		if (trials == null || trials.isEmpty())
			return new ArrayList<>();

		int threads = Math.min(poolSize, trials.size());
		AtomicInteger seq = new AtomicInteger();
		ExecutorService exec = Executors.newFixedThreadPool(threads, r -> {
			Thread t = new Thread(r, "trial-scorer-" + seq.incrementAndGet());
			t.setDaemon(true);
			return t;
		});

		List<TrialScoreSummary> results = new ArrayList<>(trials.size());
		try {
			List<Future<TrialScoreSummary>> futures = new ArrayList<>(trials.size());
			for (TrialDescriptor trial : trials) {
				futures.add(exec.submit(() -> scoreOne(patient, trial, pharmacogenes)));
			}
			// collect in submission order
			for (int i = 0; i < futures.size(); i++) {
				results.add(await(futures.get(i), trials.get(i)));
			}
		} finally {
			exec.shutdownNow();
		}

		results.sort(Comparator.comparingDouble(TrialScoreSummary::getHolisticScore).reversed());
		Logger.info("Scored {} trials on {} worker(s)", results.size(), threads);
		return results;
	}

	private TrialScoreSummary scoreOne(PatientProfile patient, TrialDescriptor trial,
			List<PharmacogeneVariant> pharmacogenes) {
		try {
			HolisticScoreResult r = composer.computeHolisticScore(patient, trial, pharmacogenes, null);
			return TrialScoreSummary.of(r, trial.getTitle());
		} catch (RuntimeException ex) {
			Logger.error("Failed to score trial {}", ex, trial == null ? null : trial.getNctId());
			return TrialScoreSummary.failed(trial, String.valueOf(ex.getMessage()));
		}
	}

	private static TrialScoreSummary await(Future<TrialScoreSummary> f, TrialDescriptor trial) {
		try {
			return f.get();
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			return TrialScoreSummary.failed(trial, "Interrupted");
		} catch (ExecutionException ee) {
			Throwable cause = ee.getCause() == null ? ee : ee.getCause();
			Logger.error("Trial scoring task failed", cause);
			return TrialScoreSummary.failed(trial, String.valueOf(cause.getMessage()));
		}
	}
}
