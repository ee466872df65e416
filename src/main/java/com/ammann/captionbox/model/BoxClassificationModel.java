/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.exception.DimensionMismatchException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, versioned snapshot of a two-class Gaussian Naive Bayes model.
 *
 * <p>A new snapshot fully replaces the previous one; instances are never mutated after
 * construction. Array-valued state is copied on the way in and on the way out.
 *
 * <p>Construction enforces three invariants:
 * <ul>
 *   <li>{@code priorIn + priorOut == 1} within {@link #PRIOR_TOLERANCE}</li>
 *   <li>both classes carry exactly {@link FeatureName#COUNT} Gaussian parameters</li>
 *   <li>covariance matrix and inverse are either both present or both absent</li>
 * </ul>
 */
public final class BoxClassificationModel {

    public static final double PRIOR_TOLERANCE = 1e-9;
    public static final int MATRIX_SIZE = FeatureName.COUNT * FeatureName.COUNT;

    private final String version;
    private final int nTrainingSamples;
    private final double priorIn;
    private final double priorOut;
    private final List<GaussianParams> inFeatures;
    private final List<GaussianParams> outFeatures;
    private final List<FisherScore> featureImportance;
    private final double[] covarianceMatrix;
    private final double[] covarianceInverse;
    private final boolean covarianceDegraded;
    private final Instant trainedAt;

    public BoxClassificationModel(
            String version,
            int nTrainingSamples,
            double priorIn,
            double priorOut,
            List<GaussianParams> inFeatures,
            List<GaussianParams> outFeatures,
            List<FisherScore> featureImportance,
            double[] covarianceMatrix,
            double[] covarianceInverse,
            boolean covarianceDegraded,
            Instant trainedAt) {
        if (Math.abs(priorIn + priorOut - 1.0) >= PRIOR_TOLERANCE) {
            throw new IllegalArgumentException(
                    String.format("Priors must sum to 1: in=%.12f out=%.12f", priorIn, priorOut));
        }
        if (inFeatures.size() != FeatureName.COUNT) {
            throw DimensionMismatchException.of("'in' parameters", FeatureName.COUNT, inFeatures.size());
        }
        if (outFeatures.size() != FeatureName.COUNT) {
            throw DimensionMismatchException.of("'out' parameters", FeatureName.COUNT, outFeatures.size());
        }
        if ((covarianceMatrix == null) != (covarianceInverse == null)) {
            throw new IllegalArgumentException(
                    "Covariance matrix and inverse must be both present or both absent");
        }
        if (covarianceMatrix != null && covarianceMatrix.length != MATRIX_SIZE) {
            throw DimensionMismatchException.of("covariance values", MATRIX_SIZE, covarianceMatrix.length);
        }
        if (covarianceInverse != null && covarianceInverse.length != MATRIX_SIZE) {
            throw DimensionMismatchException.of(
                    "covariance inverse values", MATRIX_SIZE, covarianceInverse.length);
        }

        this.version = version;
        this.nTrainingSamples = nTrainingSamples;
        this.priorIn = priorIn;
        this.priorOut = priorOut;
        this.inFeatures = List.copyOf(inFeatures);
        this.outFeatures = List.copyOf(outFeatures);
        this.featureImportance = featureImportance == null ? null : List.copyOf(featureImportance);
        this.covarianceMatrix = covarianceMatrix == null ? null : covarianceMatrix.clone();
        this.covarianceInverse = covarianceInverse == null ? null : covarianceInverse.clone();
        this.covarianceDegraded = covarianceDegraded;
        this.trainedAt = trainedAt;
    }

    public String getVersion() {
        return version;
    }

    public int getNTrainingSamples() {
        return nTrainingSamples;
    }

    public double getPriorIn() {
        return priorIn;
    }

    public double getPriorOut() {
        return priorOut;
    }

    public List<GaussianParams> getInFeatures() {
        return inFeatures;
    }

    public List<GaussianParams> getOutFeatures() {
        return outFeatures;
    }

    public Optional<List<FisherScore>> getFeatureImportance() {
        return Optional.ofNullable(featureImportance);
    }

    public Optional<double[]> getCovarianceMatrix() {
        return Optional.ofNullable(covarianceMatrix).map(double[]::clone);
    }

    public Optional<double[]> getCovarianceInverse() {
        return Optional.ofNullable(covarianceInverse).map(double[]::clone);
    }

    public boolean hasCovariance() {
        return covarianceInverse != null;
    }

    public boolean isCovarianceDegraded() {
        return covarianceDegraded;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    /**
     * Seed models are hand-tuned and have never seen an annotation.
     */
    public boolean isSeed() {
        return nTrainingSamples == 0;
    }

    @Override
    public String toString() {
        return String.format(
                "BoxClassificationModel[version=%s, samples=%d, priorIn=%.3f, covariance=%b]",
                version, nTrainingSamples, priorIn, hasCovariance());
    }
}
