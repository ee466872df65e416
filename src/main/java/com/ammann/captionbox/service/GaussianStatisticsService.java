/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.exception.DimensionMismatchException;
import com.ammann.captionbox.model.ClassSamples;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.FisherScore;
import com.ammann.captionbox.model.GaussianParams;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Class-aware statistics over labeled feature vectors.
 *
 * <p>Computes per-feature means and Gaussian parameters for one class, the unbiased
 * covariance matrix of one class, the sample-weighted pooled covariance of both classes,
 * and Fisher scores measuring single-feature discriminative power.
 *
 * <p>Insufficient data is a policy, not an error: covariance of fewer than two samples is
 * the identity matrix.
 */
@ApplicationScoped
public class GaussianStatisticsService {

    private static final Logger LOG = Logger.getLogger(GaussianStatisticsService.class);

    private static final int N = FeatureName.COUNT;

    private final LinearAlgebraService linearAlgebra;

    @Inject
    public GaussianStatisticsService(LinearAlgebraService linearAlgebra) {
        this.linearAlgebra = linearAlgebra;
    }

    /**
     * Per-feature arithmetic mean.
     *
     * @param samples class samples
     * @return 26 means, all zero for an empty class
     */
    public double[] classMeans(ClassSamples samples) {
        double[] means = new double[N];
        if (samples.n() == 0) {
            return means;
        }
        for (FeatureVector sample : samples.features()) {
            for (int i = 0; i < N; i++) {
                means[i] += sample.get(i);
            }
        }
        for (int i = 0; i < N; i++) {
            means[i] /= samples.n();
        }
        return means;
    }

    /**
     * Unbiased covariance matrix Cov(Xi, Xj) = Σ(xi−μi)(xj−μj) / (n−1).
     *
     * @param samples class samples
     * @return flattened 26×26 matrix, identity when fewer than two samples
     */
    public double[] classCovariance(ClassSamples samples) {
        if (samples.n() < 2) {
            return linearAlgebra.identity(N);
        }

        double[] means = classMeans(samples);
        double[] covariance = new double[N * N];
        double[] deviation = new double[N];

        for (FeatureVector sample : samples.features()) {
            for (int i = 0; i < N; i++) {
                deviation[i] = sample.get(i) - means[i];
            }
            for (int i = 0; i < N; i++) {
                for (int j = 0; j < N; j++) {
                    covariance[i * N + j] += deviation[i] * deviation[j];
                }
            }
        }

        double denominator = samples.n() - 1;
        for (int i = 0; i < covariance.length; i++) {
            covariance[i] /= denominator;
        }
        return covariance;
    }

    /**
     * Pooled covariance (n_in·Σ_in + n_out·Σ_out) / (n_in + n_out).
     *
     * @param inSamples  "in" class samples
     * @param outSamples "out" class samples
     * @return flattened 26×26 matrix, identity when the combined sample count is below two
     */
    public double[] pooledCovariance(ClassSamples inSamples, ClassSamples outSamples) {
        int total = inSamples.n() + outSamples.n();
        if (total < 2) {
            return linearAlgebra.identity(N);
        }

        double[] covIn = classCovariance(inSamples);
        double[] covOut = classCovariance(outSamples);

        double[] pooled = new double[N * N];
        for (int i = 0; i < pooled.length; i++) {
            pooled[i] = (inSamples.n() * covIn[i] + outSamples.n() * covOut[i]) / total;
        }
        return pooled;
    }

    /**
     * Per-feature mean and population standard deviation, floored at {@code minStd}.
     *
     * @param samples class samples
     * @param minStd  lower bound for every standard deviation
     * @return 26 Gaussian parameters
     */
    public List<GaussianParams> gaussianParams(ClassSamples samples, double minStd) {
        List<GaussianParams> params = new ArrayList<>(N);
        double[] means = classMeans(samples);

        for (int i = 0; i < N; i++) {
            double variance = 0.0;
            if (samples.n() > 0) {
                for (FeatureVector sample : samples.features()) {
                    double d = sample.get(i) - means[i];
                    variance += d * d;
                }
                variance /= samples.n();
            }
            params.add(new GaussianParams(means[i], Math.max(Math.sqrt(variance), minStd)));
        }
        return params;
    }

    /**
     * Fisher score per feature: (μ_in − μ_out)² / (σ²_in + σ²_out), zero when the
     * variance sum is zero. Importance weights are scores divided by the maximum score.
     *
     * @param inParams  Gaussian parameters of the "in" class
     * @param outParams Gaussian parameters of the "out" class
     * @return one score per feature, in feature order
     * @throws DimensionMismatchException if either list does not have 26 entries
     */
    public List<FisherScore> fisherScores(List<GaussianParams> inParams, List<GaussianParams> outParams) {
        if (inParams.size() != N || outParams.size() != N) {
            throw new DimensionMismatchException(
                    String.format("Expected %d features, got in=%d, out=%d",
                            N, inParams.size(), outParams.size()));
        }

        List<FisherScore> raw = new ArrayList<>(N);
        double maxScore = 0.0;
        for (int i = 0; i < N; i++) {
            GaussianParams in = inParams.get(i);
            GaussianParams out = outParams.get(i);

            double meanDiff = Math.abs(in.mean() - out.mean());
            double varianceSum = in.std() * in.std() + out.std() * out.std();
            double score = varianceSum > 0 ? (meanDiff * meanDiff) / varianceSum : 0.0;

            raw.add(FisherScore.unweighted(i, FeatureName.ofIndex(i).getDisplayName(), score, meanDiff));
            maxScore = Math.max(maxScore, score);
        }

        List<FisherScore> normalized = new ArrayList<>(N);
        for (FisherScore score : raw) {
            normalized.add(score.normalizedBy(maxScore));
        }

        LOG.debugf("Fisher scores computed, max score %.4f", maxScore);
        return normalized;
    }
}
