/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.GaussianParams;
import com.ammann.captionbox.model.Prediction;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Gaussian Naive Bayes prediction for OCR boxes.
 *
 * <p>Likelihoods are accumulated in log space so that 26 small densities do not underflow,
 * then converted back to posteriors with the max-subtraction trick.
 */
@ApplicationScoped
public class BayesianPredictionService {

    private static final Logger LOG = Logger.getLogger(BayesianPredictionService.class);

    static final double PDF_FLOOR = 1e-300;
    static final double EPSILON = 1e-9;
    static final double DEFAULT_CONFIDENT_THRESHOLD = 0.7;
    static final double DEFAULT_UNCERTAIN_THRESHOLD = 0.6;

    private static final double SQRT_TWO_PI = Math.sqrt(2 * Math.PI);

    // captions typically sit in the bottom quarter and span about 5% of the frame height
    static final double EXPECTED_CAPTION_Y = 0.75;
    static final double EXPECTED_CAPTION_HEIGHT_RATIO = 0.05;
    static final double HEURISTIC_CAPTION_SCORE = 0.6;

    /**
     * Gaussian probability density. A non-positive {@code std} is treated as a point mass.
     */
    public double gaussianPdf(double x, double mean, double std) {
        if (std <= 0) {
            return Math.abs(x - mean) < EPSILON ? 1.0 : 1e-10;
        }
        double z = (x - mean) / std;
        return Math.exp(-0.5 * z * z) / (std * SQRT_TWO_PI);
    }

    /**
     * Predicts the label of a feature vector.
     *
     * @param features 26-dimensional feature vector
     * @param model    model to score with
     * @return label with the higher posterior and that posterior as confidence
     */
    public Prediction predict(FeatureVector features, BoxClassificationModel model) {
        double logLikelihoodIn = 0.0;
        double logLikelihoodOut = 0.0;

        for (int i = 0; i < FeatureName.COUNT; i++) {
            double value = features.get(i);
            GaussianParams in = model.getInFeatures().get(i);
            GaussianParams out = model.getOutFeatures().get(i);

            logLikelihoodIn += Math.log(Math.max(gaussianPdf(value, in.mean(), in.std()), PDF_FLOOR));
            logLikelihoodOut += Math.log(Math.max(gaussianPdf(value, out.mean(), out.std()), PDF_FLOOR));
        }

        double logPosteriorIn = logLikelihoodIn + Math.log(model.getPriorIn());
        double logPosteriorOut = logLikelihoodOut + Math.log(model.getPriorOut());

        double maxLog = Math.max(logPosteriorIn, logPosteriorOut);
        double posteriorIn = Math.exp(logPosteriorIn - maxLog);
        double posteriorOut = Math.exp(logPosteriorOut - maxLog);
        double total = posteriorIn + posteriorOut;

        if (total == 0 || !Double.isFinite(total)) {
            LOG.debugf("Degenerate posterior for model %s, returning uncertain prediction",
                    model.getVersion());
            return Prediction.uncertain();
        }

        double probIn = posteriorIn / total;
        double probOut = posteriorOut / total;

        return probIn > probOut
                ? new Prediction(BoxLabel.IN, probIn)
                : new Prediction(BoxLabel.OUT, probOut);
    }

    /**
     * Predicts with the given model. Without one, falls back to {@link #predictWithHeuristics}
     * when the box has a height, otherwise to an uncertain "in" prediction.
     */
    public Prediction predictFromFeatures(FeatureVector features, Optional<BoxClassificationModel> model) {
        if (model.isPresent()) {
            return predict(features, model.get());
        }
        if (features.get(FeatureName.NORMALIZED_BOTTOM) > features.get(FeatureName.NORMALIZED_TOP)) {
            return predictWithHeuristics(features);
        }
        return Prediction.uncertain();
    }

    /**
     * Scores a box by vertical position and height relative to the frame.
     *
     * <p>Position counts 60%, height 40%. A combined score of at least 0.6 predicts "in".
     * Confidence stays within [0.5, 0.8].
     */
    public Prediction predictWithHeuristics(FeatureVector features) {
        double top = features.get(FeatureName.NORMALIZED_TOP);
        double bottom = features.get(FeatureName.NORMALIZED_BOTTOM);
        double centerY = (top + bottom) / 2;
        double heightRatio = bottom - top;

        // no position credit beyond 40% deviation
        double yScore = Math.max(0.0, 1.0 - Math.abs(centerY - EXPECTED_CAPTION_Y) * 2.5);
        double heightScore =
                Math.max(0.0, 1.0 - Math.abs(heightRatio - EXPECTED_CAPTION_HEIGHT_RATIO)
                        / EXPECTED_CAPTION_HEIGHT_RATIO);
        double captionScore = yScore * 0.6 + heightScore * 0.4;

        if (captionScore >= HEURISTIC_CAPTION_SCORE) {
            return new Prediction(BoxLabel.IN, 0.5 + captionScore * 0.3);
        }
        return new Prediction(BoxLabel.OUT, 0.5 + (1 - captionScore) * 0.3);
    }

    /**
     * Indices of predictions with confidence at or above the threshold.
     */
    public List<Integer> confidentIndices(List<Prediction> predictions, double threshold) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < predictions.size(); i++) {
            if (predictions.get(i).confidence() >= threshold) {
                indices.add(i);
            }
        }
        return indices;
    }

    public List<Integer> confidentIndices(List<Prediction> predictions) {
        return confidentIndices(predictions, DEFAULT_CONFIDENT_THRESHOLD);
    }

    /**
     * Indices of predictions with confidence below the threshold, the natural candidates
     * for the next manual annotation.
     */
    public List<Integer> uncertainIndices(List<Prediction> predictions, double threshold) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < predictions.size(); i++) {
            if (predictions.get(i).confidence() < threshold) {
                indices.add(i);
            }
        }
        return indices;
    }

    public List<Integer> uncertainIndices(List<Prediction> predictions) {
        return uncertainIndices(predictions, DEFAULT_UNCERTAIN_THRESHOLD);
    }
}
