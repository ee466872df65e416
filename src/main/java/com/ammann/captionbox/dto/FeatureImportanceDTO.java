/* (C)2026 */
package com.ammann.captionbox.dto;

import com.ammann.captionbox.model.FisherScore;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Fisher-score importance of a single feature")
public record FeatureImportanceDTO(
        @Schema(description = "Position of the feature in the feature vector")
        int featureIndex,

        @Schema(description = "Feature name", example = "normalizedY")
        String featureName,

        @Schema(description = "Squared mean difference divided by the variance sum")
        double fisherScore,

        @Schema(description = "Absolute difference of the class means")
        double meanDifference,

        @Schema(description = "Score relative to the best feature, in [0, 1]")
        double importanceWeight
) {
    public static FeatureImportanceDTO from(FisherScore score) {
        return new FeatureImportanceDTO(
                score.featureIndex(),
                score.featureName(),
                score.fisherScore(),
                score.meanDifference(),
                score.importanceWeight());
    }
}
