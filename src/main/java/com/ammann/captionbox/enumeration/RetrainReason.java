/* (C)2026 */
package com.ammann.captionbox.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason attached to a full-retrain decision.
 */
public enum RetrainReason {
    INSUFFICIENT_TOTAL_ANNOTATIONS("insufficient_total_annotations", false),
    NO_NEW_ANNOTATIONS("no_new_annotations", false),
    MIN_INTERVAL_NOT_REACHED("min_interval_not_reached", false),
    FIRST_TRAINING("first_training", true),
    ANNOTATION_COUNT_THRESHOLD("annotation_count_threshold", true),
    HIGH_ANNOTATION_RATE("high_annotation_rate", true),
    MAX_INTERVAL_EXCEEDED("max_interval_exceeded", true),
    NO_TRIGGER_CONDITIONS_MET("no_trigger_conditions_met", false);

    private final String value;
    private final boolean triggers;

    RetrainReason(String value, boolean triggers) {
        this.value = value;
        this.triggers = triggers;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean triggersRetrain() {
        return triggers;
    }
}
