/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.exception.ValidationException;
import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.LayoutConfig;
import com.ammann.captionbox.repository.BoxPredictionRepository;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Serves the feature vectors that were computed upstream and registered with each box.
 *
 * <p>The layout argument is not consulted: registered vectors were already extracted
 * against the video layout.
 */
@DefaultBean
@ApplicationScoped
public class StoredFeatureExtractor implements FeatureExtractor {

    private final BoxPredictionRepository boxRepository;

    @Inject
    public StoredFeatureExtractor(BoxPredictionRepository boxRepository) {
        this.boxRepository = boxRepository;
    }

    @Override
    public FeatureVector extractFeatures(BoxRef boxRef, LayoutConfig layout) {
        return boxRepository
                .find(boxRef)
                .orElseThrow(() -> ValidationException.unknownResource("box", boxRef))
                .features();
    }
}
