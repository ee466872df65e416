/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * Summary of the incremental update that follows one annotation.
 *
 * @param success              false if the update could not run (no covariance available)
 * @param retrained            whether the annotation triggered a full retrain
 * @param modelVersion         version of the model used for re-scoring
 * @param candidatesIdentified boxes at or above the change-probability threshold
 * @param boxesProcessed       boxes actually re-scored
 * @param predictionsChanged   reversals counted in the final window
 * @param finalReversalRate    rolling reversal rate at the stop
 * @param stopReason           adaptive stop reason, or {@link #NO_COVARIANCE}
 * @param stale                true if the run hit the per-update box cap
 */
public record StreamingUpdateResult(
        boolean success,
        boolean retrained,
        String modelVersion,
        int candidatesIdentified,
        int boxesProcessed,
        int predictionsChanged,
        double finalReversalRate,
        String stopReason,
        boolean stale) {

    public static final String NO_COVARIANCE = "no_covariance";

    public static StreamingUpdateResult noCovariance(boolean retrained, String modelVersion) {
        return new StreamingUpdateResult(
                false, retrained, modelVersion, 0, 0, 0, 0.0, NO_COVARIANCE, false);
    }

    public static StreamingUpdateResult from(
            boolean retrained, String modelVersion, int candidates, AdaptiveRecalcResult recalc) {
        return new StreamingUpdateResult(
                true,
                retrained,
                modelVersion,
                candidates,
                recalc.totalProcessed(),
                recalc.totalReversals(),
                recalc.finalReversalRate(),
                recalc.reason().getValue(),
                recalc.isStale());
    }
}
