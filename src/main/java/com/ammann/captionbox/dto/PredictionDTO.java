/* (C)2026 */
package com.ammann.captionbox.dto;

import com.ammann.captionbox.model.BoxWithPrediction;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Current prediction of a registered box")
public record PredictionDTO(
        int frameIndex,
        int boxIndex,

        @Schema(description = "Predicted label", example = "in")
        String label,

        @Schema(description = "Posterior probability of the predicted label")
        double confidence
) {
    public static PredictionDTO from(BoxWithPrediction box) {
        return new PredictionDTO(
                box.boxRef().frameIndex(),
                box.boxRef().boxIndex(),
                box.currentPrediction().label().getValue(),
                box.currentPrediction().confidence());
    }
}
