/* (C)2026 */
package com.ammann.captionbox.dto;

import com.ammann.captionbox.model.BoxClassificationModel;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Summary of the classification model currently in use")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelSummaryDTO(
        @Schema(description = "Model version", example = "naive_bayes_v2-3")
        String version,

        @Schema(description = "False while the hand-tuned seed model is active")
        Boolean trained,

        @Schema(description = "Number of annotations the model was trained on")
        Integer trainingSamples,

        @Schema(description = "Prior probability of the 'in' class")
        Double priorIn,

        @Schema(description = "Prior probability of the 'out' class")
        Double priorOut,

        @Schema(description = "Whether a pooled covariance inverse is available for change estimation")
        Boolean hasCovariance,

        @Schema(description = "Whether the covariance inverse is a diagonal approximation")
        Boolean covarianceDegraded,

        @Schema(description = "When the model was built")
        Instant trainedAt
) {
    public static ModelSummaryDTO from(BoxClassificationModel model) {
        return new ModelSummaryDTO(
                model.getVersion(),
                !model.isSeed(),
                model.getNTrainingSamples(),
                model.getPriorIn(),
                model.getPriorOut(),
                model.hasCovariance(),
                model.isCovarianceDegraded(),
                model.getTrainedAt());
    }
}
