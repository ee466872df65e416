/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.RetrainReason;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.RetrainDecision;
import com.ammann.captionbox.model.RetrainState;
import com.ammann.captionbox.repository.AnnotationRepository;
import com.ammann.captionbox.repository.ModelRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Decides when incremental updates should give way to a full model retrain.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>too few annotations overall: no retrain</li>
 *   <li>no annotations since the last retrain: no retrain</li>
 *   <li>minimum interval not yet elapsed: no retrain</li>
 *   <li>first time the minimum is reached while the seed model is active: retrain</li>
 *   <li>annotation count threshold reached: retrain</li>
 *   <li>high annotation rate with enough new annotations: retrain</li>
 *   <li>maximum interval exceeded: retrain</li>
 * </ol>
 */
@ApplicationScoped
public class RetrainTriggerService {

    private static final Logger LOG = Logger.getLogger(RetrainTriggerService.class);

    @ConfigProperty(name = "captionbox.training.min-annotations-for-retrain", defaultValue = "20")
    int minAnnotationsForRetrain;

    @ConfigProperty(name = "captionbox.retrain.annotation-count-threshold", defaultValue = "100")
    int annotationCountThreshold;

    @ConfigProperty(name = "captionbox.retrain.min-interval-seconds", defaultValue = "20")
    long minIntervalSeconds;

    @ConfigProperty(name = "captionbox.retrain.high-rate-per-minute", defaultValue = "20")
    double highRatePerMinute;

    @ConfigProperty(name = "captionbox.retrain.high-rate-min-annotations", defaultValue = "30")
    int highRateMinAnnotations;

    @ConfigProperty(name = "captionbox.retrain.max-interval-seconds", defaultValue = "300")
    long maxIntervalSeconds;

    private final AnnotationRepository annotationRepository;
    private final ModelRepository modelRepository;

    @Inject
    public RetrainTriggerService(AnnotationRepository annotationRepository, ModelRepository modelRepository) {
        this.annotationRepository = annotationRepository;
        this.modelRepository = modelRepository;
    }

    /**
     * Snapshot of the trigger inputs from the stored model and annotations.
     *
     * <p>While only the seed model exists, the last retrain is {@link Instant#EPOCH} with zero
     * annotations.
     */
    public RetrainState currentState() {
        Optional<BoxClassificationModel> model = modelRepository.loadCurrentModel();
        Instant lastRetrain = modelRepository.lastTrainedAt().orElse(Instant.EPOCH);
        int lastCount = model.map(BoxClassificationModel::getNTrainingSamples).orElse(0);
        return new RetrainState(lastRetrain, lastCount, annotationRepository.count());
    }

    /**
     * Evaluates the retrain rules.
     *
     * @param state trigger inputs
     * @param now   evaluation time
     * @return decision with the matching reason and the inputs it was based on
     */
    public RetrainDecision shouldTriggerFullRetrain(RetrainState state, Instant now) {
        int newAnnotations = state.newAnnotations();
        double secondsSinceRetrain = Duration.between(state.lastRetrainTime(), now).toMillis() / 1000.0;
        double minutesSinceRetrain = secondsSinceRetrain / 60.0;
        double ratePerMinute = minutesSinceRetrain > 0 ? newAnnotations / minutesSinceRetrain : 0.0;

        RetrainReason reason = evaluate(state, newAnnotations, secondsSinceRetrain, ratePerMinute);
        RetrainDecision decision =
                new RetrainDecision(reason, newAnnotations, secondsSinceRetrain, ratePerMinute);

        if (decision.shouldRetrain()) {
            LOG.infof("Full retrain %s", decision.describe());
        } else {
            LOG.debugf("Full retrain %s", decision.describe());
        }
        return decision;
    }

    private RetrainReason evaluate(
            RetrainState state, int newAnnotations, double secondsSinceRetrain, double ratePerMinute) {
        if (state.currentAnnotationCount() < minAnnotationsForRetrain) {
            return RetrainReason.INSUFFICIENT_TOTAL_ANNOTATIONS;
        }
        if (newAnnotations <= 0) {
            return RetrainReason.NO_NEW_ANNOTATIONS;
        }
        if (secondsSinceRetrain < minIntervalSeconds) {
            return RetrainReason.MIN_INTERVAL_NOT_REACHED;
        }
        if (state.lastRetrainAnnotationCount() < minAnnotationsForRetrain) {
            return RetrainReason.FIRST_TRAINING;
        }
        if (newAnnotations >= annotationCountThreshold) {
            return RetrainReason.ANNOTATION_COUNT_THRESHOLD;
        }
        if (ratePerMinute >= highRatePerMinute && newAnnotations >= highRateMinAnnotations) {
            return RetrainReason.HIGH_ANNOTATION_RATE;
        }
        if (secondsSinceRetrain >= maxIntervalSeconds) {
            return RetrainReason.MAX_INTERVAL_EXCEEDED;
        }
        return RetrainReason.NO_TRIGGER_CONDITIONS_MET;
    }
}
