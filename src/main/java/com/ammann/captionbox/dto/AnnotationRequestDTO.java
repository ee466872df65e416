/* (C)2026 */
package com.ammann.captionbox.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "User annotation of a single OCR box")
public record AnnotationRequestDTO(
        @Schema(description = "Frame the box was detected in", required = true)
        Integer frameIndex,

        @Schema(description = "Index of the box within its frame", required = true)
        Integer boxIndex,

        @Schema(description = "Label chosen by the user", enumeration = {"in", "out"}, required = true)
        String label,

        @Schema(description = "26 feature values; taken from the registered box when omitted")
        List<Double> features
) {}
