/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.LayoutConfig;

/**
 * Produces the feature vector of a box within its layout context.
 *
 * <p>Implementations must be deterministic and side-effect free.
 */
public interface FeatureExtractor {

    FeatureVector extractFeatures(BoxRef boxRef, LayoutConfig layout);
}
