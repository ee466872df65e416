/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.RecalcStopReason;
import com.ammann.captionbox.model.AdaptiveRecalcResult;
import com.ammann.captionbox.model.RescoreOutcome;
import com.ammann.captionbox.model.ScoredCandidate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Re-scores change candidates in batches until re-scoring stops paying off.
 *
 * <p>Candidates are expected in descending change-probability order. Each batch is handed to a
 * {@link BatchPredictor}; the reversal flags of the outcomes feed a bounded sliding window.
 * A run stops when:
 * <ol>
 *   <li>the window is full, holds at least {@code minBoxesBeforeCheck} entries, and its reversal
 *       rate is below {@code targetReversalRate} ({@link RecalcStopReason#REVERSAL_RATE})</li>
 *   <li>{@code maxBoxesPerUpdate} boxes were processed ({@link RecalcStopReason#MAX_BOXES})</li>
 *   <li>no candidates are left ({@link RecalcStopReason#EXHAUSTED_CANDIDATES})</li>
 * </ol>
 *
 * <p>The asynchronous variant runs every batch as its own {@link Uni} on the
 * {@code recalculation-executor}. Batch boundaries are the only points where the run yields, and
 * cancelling the returned {@link Uni} abandons the run without a result.
 */
@ApplicationScoped
public class AdaptiveRecalculationService {

    private static final Logger LOG = Logger.getLogger(AdaptiveRecalculationService.class);

    @ConfigProperty(name = "captionbox.recalc.batch-size", defaultValue = "50")
    int batchSize;

    @ConfigProperty(name = "captionbox.recalc.max-boxes-per-update", defaultValue = "2000")
    int maxBoxesPerUpdate;

    @ConfigProperty(name = "captionbox.recalc.reversal-window-size", defaultValue = "100")
    int reversalWindowSize;

    @ConfigProperty(name = "captionbox.recalc.min-boxes-before-check", defaultValue = "50")
    int minBoxesBeforeCheck;

    @ConfigProperty(name = "captionbox.recalc.target-reversal-rate", defaultValue = "0.02")
    double targetReversalRate;

    @Inject MeterRegistry meterRegistry;

    @Inject
    @Named("recalculation-executor")
    ManagedExecutor executor;

    /**
     * Runs the adaptive recalculation on the calling thread.
     *
     * @param candidates boxes to re-score, most likely to change first
     * @param predictor  re-scores one batch and reports the outcomes
     * @return statistics of the completed run
     */
    public AdaptiveRecalcResult runAdaptiveRecalculation(
            List<ScoredCandidate> candidates, BatchPredictor predictor) {
        RecalculationRun run = newRun(candidates);
        while (run.hasNextBatch()) {
            run.processNextBatch(predictor);
        }
        return complete(run);
    }

    /**
     * Runs the adaptive recalculation one batch at a time on the recalculation executor.
     *
     * <p>Makes the same decisions as {@link #runAdaptiveRecalculation(List, BatchPredictor)}.
     *
     * @param candidates boxes to re-score, most likely to change first
     * @param predictor  re-scores one batch and reports the outcomes
     * @return lazy run; nothing is processed until subscription
     */
    public Uni<AdaptiveRecalcResult> runAdaptiveRecalculationAsync(
            List<ScoredCandidate> candidates, BatchPredictor predictor) {
        return Uni.createFrom()
                .item(() -> newRun(candidates))
                .chain(run -> nextBatch(run, predictor))
                .onCancellation()
                .invoke(() -> LOG.info("Adaptive recalculation cancelled, partial result discarded"));
    }

    RecalculationRun newRun(List<ScoredCandidate> candidates) {
        return new RecalculationRun(
                candidates, batchSize, maxBoxesPerUpdate, reversalWindowSize, minBoxesBeforeCheck,
                targetReversalRate);
    }

    private Uni<AdaptiveRecalcResult> nextBatch(RecalculationRun run, BatchPredictor predictor) {
        if (!run.hasNextBatch()) {
            return Uni.createFrom().item(() -> complete(run));
        }
        return Uni.createFrom()
                .item(
                        () -> {
                            run.processNextBatch(predictor);
                            return run;
                        })
                .runSubscriptionOn(batchExecutor())
                .chain(r -> nextBatch(r, predictor));
    }

    private Executor batchExecutor() {
        return executor != null ? executor : Infrastructure.getDefaultWorkerPool();
    }

    private AdaptiveRecalcResult complete(RecalculationRun run) {
        AdaptiveRecalcResult result = run.result();

        LOG.infof(
                "Adaptive recalculation finished: processed=%d of %d, reversals=%d, rate=%.3f, reason=%s",
                result.totalProcessed(),
                run.candidateCount(),
                result.totalReversals(),
                result.finalReversalRate(),
                result.reason().getValue());

        if (meterRegistry != null) {
            Counter.builder("adaptive_recalculation_total")
                    .description("Completed adaptive recalculation runs by stop reason")
                    .tag("reason", result.reason().getValue())
                    .register(meterRegistry)
                    .increment();
        }
        return result;
    }

    /**
     * Mutable state of one in-flight run: the batch cursor, the reversal window and its counters.
     *
     * <p>Owned by exactly one run; not thread-safe. The asynchronous variant hands it from batch
     * to batch sequentially.
     */
    static final class RecalculationRun {

        private final List<ScoredCandidate> candidates;
        private final int batchSize;
        private final int limit;
        private final int maxBoxes;
        private final int windowSize;
        private final int minBoxesBeforeCheck;
        private final double targetRate;

        private final Deque<Boolean> window = new ArrayDeque<>();
        private int reversalsInWindow;
        private int processed;
        private int cursor;
        private boolean belowTargetRate;

        RecalculationRun(
                List<ScoredCandidate> candidates,
                int batchSize,
                int maxBoxes,
                int windowSize,
                int minBoxesBeforeCheck,
                double targetRate) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
            this.candidates = List.copyOf(candidates);
            this.batchSize = batchSize;
            this.maxBoxes = maxBoxes;
            this.limit = Math.min(candidates.size(), maxBoxes);
            this.windowSize = windowSize;
            this.minBoxesBeforeCheck = minBoxesBeforeCheck;
            this.targetRate = targetRate;
        }

        boolean hasNextBatch() {
            return !belowTargetRate && cursor < limit;
        }

        void processNextBatch(BatchPredictor predictor) {
            int end = Math.min(cursor + batchSize, limit);
            List<ScoredCandidate> batch = candidates.subList(cursor, end);

            List<RescoreOutcome> outcomes = predictor.predictAndUpdate(batch);
            for (RescoreOutcome outcome : outcomes) {
                record(outcome.reversed());
            }

            processed += batch.size();
            cursor = end;

            if (window.size() >= minBoxesBeforeCheck && window.size() >= windowSize) {
                double rate = currentRate();
                if (rate < targetRate) {
                    LOG.debugf(
                            "Reversal rate %.3f below target %.3f after %d boxes, stopping early",
                            rate, targetRate, processed);
                    belowTargetRate = true;
                }
            }
        }

        private void record(boolean reversed) {
            window.addLast(reversed);
            if (reversed) {
                reversalsInWindow++;
            }
            if (window.size() > windowSize && window.removeFirst()) {
                reversalsInWindow--;
            }
        }

        private double currentRate() {
            return window.isEmpty()
                    ? (double) reversalsInWindow / Math.max(1, processed)
                    : (double) reversalsInWindow / window.size();
        }

        int candidateCount() {
            return candidates.size();
        }

        AdaptiveRecalcResult result() {
            if (hasNextBatch()) {
                throw new IllegalStateException("Run has not reached a stopping state");
            }
            RecalcStopReason reason;
            if (belowTargetRate) {
                reason = RecalcStopReason.REVERSAL_RATE;
            } else if (processed >= maxBoxes && cursor < candidates.size()) {
                // a cap that coincides with the last candidate left nothing behind
                reason = RecalcStopReason.MAX_BOXES;
            } else {
                reason = RecalcStopReason.EXHAUSTED_CANDIDATES;
            }
            return new AdaptiveRecalcResult(
                    processed, reversalsInWindow, currentRate(), belowTargetRate, reason);
        }
    }
}
