/* (C)2026 */
package com.ammann.captionbox.model;

import java.util.List;

/**
 * All labeled feature vectors that belong to one class.
 */
public record ClassSamples(int n, List<FeatureVector> features) {

    public ClassSamples {
        features = List.copyOf(features);
        if (n != features.size()) {
            throw new IllegalArgumentException(
                    "Sample count " + n + " does not match " + features.size() + " feature vectors");
        }
    }

    public static ClassSamples of(List<FeatureVector> features) {
        return new ClassSamples(features.size(), features);
    }
}
