/* (C)2026 */
package com.ammann.captionbox.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "OCR box to register for classification")
public record BoxRegistrationDTO(
        @Schema(description = "Frame the box was detected in", required = true)
        Integer frameIndex,

        @Schema(description = "Index of the box within its frame", required = true)
        Integer boxIndex,

        @Schema(description = "26 feature values in feature order", required = true)
        List<Double> features
) {}
