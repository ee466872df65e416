/* (C)2026 */
package com.ammann.captionbox.dto;

import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.TrainingResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of a model training request")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingResultDTO(
        @Schema(description = "Training status", example = "TRAINED")
        String status,

        @Schema(description = "Version of the newly trained model")
        String modelVersion,

        @Schema(description = "Annotations considered")
        Integer annotationCount,

        @Schema(description = "Annotations labeled 'in'")
        Integer inCount,

        @Schema(description = "Annotations labeled 'out'")
        Integer outCount,

        @Schema(description = "Whether the model was reset to the seed model")
        Boolean resetToSeed,

        @Schema(description = "Human-readable outcome")
        String message
) {
    public static TrainingResultDTO from(TrainingResult result, boolean resetToSeed) {
        return new TrainingResultDTO(
                result.status().name(),
                result.trainedModel().map(BoxClassificationModel::getVersion).orElse(null),
                result.annotationCount(),
                result.inCount(),
                result.outCount(),
                resetToSeed,
                result.message());
    }
}
