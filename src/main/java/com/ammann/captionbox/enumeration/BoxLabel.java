/* (C)2026 */
package com.ammann.captionbox.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Binary classification label for an OCR box: caption character ("in") or noise ("out").
 */
public enum BoxLabel {
    IN("in"),
    OUT("out");

    private final String value;

    BoxLabel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses the wire representation of a label.
     *
     * @param value "in" or "out" (case-insensitive)
     * @return matching label
     * @throws IllegalArgumentException if the value is not a known label
     */
    @JsonCreator
    public static BoxLabel fromValue(String value) {
        if (value != null) {
            for (BoxLabel label : values()) {
                if (label.value.equalsIgnoreCase(value.trim())) {
                    return label;
                }
            }
        }
        throw new IllegalArgumentException("Unknown box label: " + value);
    }
}
