/* (C)2026 */
package com.ammann.captionbox.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Samples available to the next training run")
public record TrainingDataDTO(
        @Schema(description = "Whether a training run would produce a model")
        boolean ready,

        @Schema(description = "Samples in the 'in' class")
        int inSamples,

        @Schema(description = "Samples in the 'out' class")
        int outSamples
) {
    public static TrainingDataDTO of(int inSamples, int outSamples) {
        return new TrainingDataDTO(true, inSamples, outSamples);
    }

    public static TrainingDataDTO notReady() {
        return new TrainingDataDTO(false, 0, 0);
    }
}
