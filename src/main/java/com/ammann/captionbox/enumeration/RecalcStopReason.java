/* (C)2026 */
package com.ammann.captionbox.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason an adaptive recalculation run stopped.
 */
public enum RecalcStopReason {
    /** Rolling reversal rate dropped below the target. */
    REVERSAL_RATE("reversal_rate"),
    /** Hard cap on boxes per update was reached; distant boxes were never re-checked. */
    MAX_BOXES("max_boxes"),
    /** Every candidate was processed. */
    EXHAUSTED_CANDIDATES("exhausted_candidates");

    private final String value;

    RecalcStopReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
