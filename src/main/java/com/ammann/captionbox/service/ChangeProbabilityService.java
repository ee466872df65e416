/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.BoxWithPrediction;
import com.ammann.captionbox.model.ScoredCandidate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Estimates how likely a new annotation is to flip the prediction of an existing box.
 *
 * <p>The estimate blends three factors:
 * <ul>
 *   <li>uncertainty: {@code 1 - confidence}</li>
 *   <li>feature similarity to the annotated box: {@code exp(-d² / 2σ²)} with Mahalanobis distance d</li>
 *   <li>decision-boundary proximity: {@code 1 - 2·|confidence - 0.5|}</li>
 * </ul>
 */
@ApplicationScoped
public class ChangeProbabilityService {

    private static final Logger LOG = Logger.getLogger(ChangeProbabilityService.class);

    @ConfigProperty(name = "captionbox.change.max-mahalanobis-distance", defaultValue = "3.0")
    double maxMahalanobisDistance;

    @ConfigProperty(name = "captionbox.change.uncertainty-weight", defaultValue = "0.4")
    double uncertaintyWeight;

    @ConfigProperty(name = "captionbox.change.similarity-weight", defaultValue = "0.4")
    double similarityWeight;

    @ConfigProperty(name = "captionbox.change.boundary-sensitivity-weight", defaultValue = "0.2")
    double boundarySensitivityWeight;

    @ConfigProperty(name = "captionbox.change.min-change-probability", defaultValue = "0.05")
    double minChangeProbability;

    private final LinearAlgebraService linearAlgebra;

    @Inject
    public ChangeProbabilityService(LinearAlgebraService linearAlgebra) {
        this.linearAlgebra = linearAlgebra;
    }

    /**
     * Probability in [0, 1] that {@code box} changes label after {@code annotation} is learned.
     *
     * @param box               previously scored box
     * @param annotation        the new annotation
     * @param covarianceInverse flattened 26×26 inverse of the pooled covariance
     */
    public double estimate(BoxWithPrediction box, Annotation annotation, double[] covarianceInverse) {
        double confidence = box.currentPrediction().confidence();

        double uncertainty = 1.0 - confidence;

        double distance = linearAlgebra.mahalanobis(box.features(), annotation.features(), covarianceInverse);
        double similarity =
                Math.exp(-(distance * distance) / (2 * maxMahalanobisDistance * maxMahalanobisDistance));

        double boundaryProximity = 1.0 - 2.0 * Math.abs(confidence - 0.5);

        double probability =
                uncertainty * uncertaintyWeight
                        + similarity * similarityWeight
                        + boundaryProximity * boundarySensitivityWeight;

        return Math.min(1.0, Math.max(0.0, probability));
    }

    /**
     * Boxes whose change probability reaches the minimum, most likely to change first.
     *
     * <p>Boxes with equal probability keep their input order.
     *
     * @param annotation        the new annotation
     * @param boxes             boxes to consider
     * @param covarianceInverse flattened 26×26 inverse of the pooled covariance
     * @return scored candidates, sorted by descending change probability
     */
    public List<ScoredCandidate> identifyAffectedBoxes(
            Annotation annotation, List<BoxWithPrediction> boxes, double[] covarianceInverse) {
        List<ScoredCandidate> candidates = new ArrayList<>();

        for (BoxWithPrediction box : boxes) {
            double probability = estimate(box, annotation, covarianceInverse);
            if (probability >= minChangeProbability) {
                candidates.add(new ScoredCandidate(box, probability));
            }
        }

        // List.sort is a stable merge sort
        candidates.sort(Comparator.comparingDouble(ScoredCandidate::changeProbability).reversed());

        LOG.debugf("Annotation on box %s: %d of %d boxes are change candidates",
                annotation.boxRef(), candidates.size(), boxes.size());
        return candidates;
    }
}
