/* (C)2026 */
package com.ammann.captionbox.model;

import java.time.Instant;

/**
 * Inputs of the full-retrain decision.
 *
 * @param lastRetrainTime            when the current model was trained, {@link Instant#EPOCH} if never
 * @param lastRetrainAnnotationCount annotation count the current model was trained on
 * @param currentAnnotationCount     annotations stored right now
 */
public record RetrainState(
        Instant lastRetrainTime, int lastRetrainAnnotationCount, int currentAnnotationCount) {

    public int newAnnotations() {
        return currentAnnotationCount - lastRetrainAnnotationCount;
    }
}
