/* (C)2026 */
package com.ammann.captionbox.dto;

import com.ammann.captionbox.model.StreamingUpdateResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Result of the incremental update that followed an annotation")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingUpdateResultDTO(
        @Schema(description = "False if re-scoring could not run")
        Boolean success,

        @Schema(description = "Whether the annotation triggered a full retrain")
        Boolean retrained,

        @Schema(description = "Model version used for re-scoring")
        String modelVersion,

        @Schema(description = "Boxes whose change probability reached the threshold")
        Integer candidatesIdentified,

        @Schema(description = "Boxes re-scored")
        Integer boxesProcessed,

        @Schema(description = "Reversed predictions in the final reversal window")
        Integer predictionsChanged,

        @Schema(description = "Rolling reversal rate when re-scoring stopped")
        Double finalReversalRate,

        @Schema(description = "Why re-scoring stopped",
                enumeration = {"reversal_rate", "max_boxes", "exhausted_candidates", "no_covariance"})
        String stopReason,

        @Schema(description = "True if some candidates were skipped because of the per-update cap")
        Boolean stale
) {
    public static StreamingUpdateResultDTO from(StreamingUpdateResult result) {
        return new StreamingUpdateResultDTO(
                result.success(),
                result.retrained(),
                result.modelVersion(),
                result.candidatesIdentified(),
                result.boxesProcessed(),
                result.predictionsChanged(),
                result.finalReversalRate(),
                result.stopReason(),
                result.stale());
    }
}
