/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.BoxLabel;

/**
 * Predicted label and the posterior probability of that label.
 */
public record Prediction(BoxLabel label, double confidence) {

    /** Maximally uncertain prediction used when no model is available. */
    public static Prediction uncertain() {
        return new Prediction(BoxLabel.IN, 0.5);
    }
}
