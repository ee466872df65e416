/* (C)2026 */
package com.ammann.captionbox.enumeration;

/**
 * Outcome of a model training attempt.
 */
public enum TrainingStatus {
    /** A new model was computed and stored. */
    TRAINED,
    /** Not enough labeled data; the previous model stays in place. */
    INSUFFICIENT_DATA
}
