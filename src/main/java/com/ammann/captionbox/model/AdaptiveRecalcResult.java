/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.RecalcStopReason;

/**
 * Statistics of a completed adaptive recalculation run.
 *
 * <p>Only produced for runs that reached a defined stopping state; abandoned runs
 * yield no result.
 */
public record AdaptiveRecalcResult(
        int totalProcessed,
        int totalReversals,
        double finalReversalRate,
        boolean stoppedEarly,
        RecalcStopReason reason) {

    /**
     * Whether some candidates were skipped because of the per-update box cap.
     */
    public boolean isStale() {
        return reason == RecalcStopReason.MAX_BOXES;
    }
}
