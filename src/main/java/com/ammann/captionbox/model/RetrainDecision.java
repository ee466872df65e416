/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.RetrainReason;

/**
 * Result of a full-retrain trigger check.
 */
public record RetrainDecision(
        RetrainReason reason,
        int newAnnotations,
        double secondsSinceRetrain,
        double annotationRatePerMinute) {

    public boolean shouldRetrain() {
        return reason.triggersRetrain();
    }

    /**
     * Single-line description for logging.
     */
    public String describe() {
        return String.format(
                "%s: %s (new=%d, elapsed=%ds, rate=%.1f/min)",
                shouldRetrain() ? "TRIGGERED" : "Not triggered",
                reason.getValue(),
                newAnnotations,
                Math.round(secondsSinceRetrain),
                annotationRatePerMinute);
    }
}
