/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.TrainingStatus;
import java.util.Optional;

/**
 * Outcome of a training attempt: either a freshly stored model or an insufficient-data signal.
 *
 * <p>When data is insufficient and the currently stored model was trained on at least the
 * retrain minimum, {@link #resetToSeedRequired()} tells the caller to revert to the seed model
 * (annotations were removed since that model was trained).
 */
public record TrainingResult(
        TrainingStatus status,
        BoxClassificationModel model,
        int annotationCount,
        int inCount,
        int outCount,
        boolean resetToSeedRequired,
        String message) {

    public static TrainingResult trained(BoxClassificationModel model, int inCount, int outCount) {
        return new TrainingResult(
                TrainingStatus.TRAINED,
                model,
                model.getNTrainingSamples(),
                inCount,
                outCount,
                false,
                String.format("Model trained: %d 'in', %d 'out'", inCount, outCount));
    }

    public static TrainingResult insufficientData(
            int annotationCount, int inCount, int outCount, boolean resetRequired, String message) {
        return new TrainingResult(
                TrainingStatus.INSUFFICIENT_DATA,
                null,
                annotationCount,
                inCount,
                outCount,
                resetRequired,
                message);
    }

    public boolean isTrained() {
        return status == TrainingStatus.TRAINED;
    }

    public Optional<BoxClassificationModel> trainedModel() {
        return Optional.ofNullable(model);
    }
}
