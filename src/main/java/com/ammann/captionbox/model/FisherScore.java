/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * Discriminative power of a single feature between the "in" and "out" classes.
 *
 * @param featureIndex     position in the feature vector
 * @param featureName      display name of the feature
 * @param fisherScore      squared mean difference over summed variances
 * @param meanDifference   absolute difference of the class means
 * @param importanceWeight fisher score normalized by the maximum over all features, in [0, 1]
 */
public record FisherScore(
        int featureIndex,
        String featureName,
        double fisherScore,
        double meanDifference,
        double importanceWeight) {

    /**
     * Creates a score whose weight is filled in once the maximum score is known.
     */
    public static FisherScore unweighted(
            int featureIndex, String featureName, double fisherScore, double meanDifference) {
        return new FisherScore(featureIndex, featureName, fisherScore, meanDifference, 0.0);
    }

    public FisherScore normalizedBy(double maxScore) {
        double weight = maxScore > 0 ? fisherScore / maxScore : 0.0;
        return new FisherScore(featureIndex, featureName, fisherScore, meanDifference, weight);
    }
}
