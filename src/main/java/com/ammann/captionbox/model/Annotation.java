/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.BoxLabel;
import java.util.Objects;

/**
 * One human judgment on a box. Annotations are the ground truth that drives retraining.
 */
public record Annotation(BoxRef boxRef, BoxLabel label, FeatureVector features) {

    public Annotation {
        Objects.requireNonNull(boxRef, "boxRef");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(features, "features");
    }
}
