/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * A previously scored box that may be re-evaluated after a model update.
 */
public record BoxWithPrediction(BoxRef boxRef, FeatureVector features, Prediction currentPrediction) {

    public BoxWithPrediction withPrediction(Prediction prediction) {
        return new BoxWithPrediction(boxRef, features, prediction);
    }

    public BoxWithPrediction withFeatures(FeatureVector newFeatures) {
        return new BoxWithPrediction(boxRef, newFeatures, currentPrediction);
    }
}
