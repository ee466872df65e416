/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.enumeration.RetrainReason;
import com.ammann.captionbox.model.AdaptiveRecalcResult;
import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.BoxWithPrediction;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.Prediction;
import com.ammann.captionbox.model.RetrainDecision;
import com.ammann.captionbox.model.RetrainState;
import com.ammann.captionbox.model.ScoredCandidate;
import com.ammann.captionbox.model.StreamingUpdateResult;
import com.ammann.captionbox.model.TrainingResult;
import com.ammann.captionbox.repository.AnnotationRepository;
import com.ammann.captionbox.repository.BoxPredictionRepository;
import com.ammann.captionbox.repository.ModelRepository;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Incremental model maintenance after each user annotation.
 *
 * <p>Workflow per annotation:
 * <ol>
 *   <li>Store the annotation and flag the box as user-annotated</li>
 *   <li>Run a full retrain if the retrain trigger fires, resetting to the seed model when
 *       annotations fell below the training minimum</li>
 *   <li>Identify boxes likely to change and re-score them adaptively. User-annotated boxes
 *       keep their label and are never re-scored.</li>
 * </ol>
 *
 * <p>Only one annotation-triggered update runs at a time. The asynchronous variant holds the lock
 * while preparing the run; the returned {@link Uni} executes outside it.
 */
@ApplicationScoped
public class StreamingUpdateService {

    private static final Logger LOG = Logger.getLogger(StreamingUpdateService.class);

    private final AnnotationRepository annotationRepository;
    private final ModelRepository modelRepository;
    private final BoxPredictionRepository boxRepository;
    private final ModelTrainingService trainingService;
    private final RetrainTriggerService retrainTrigger;
    private final ChangeProbabilityService changeProbability;
    private final AdaptiveRecalculationService recalculation;
    private final BatchPredictor batchPredictor;

    private final ReentrantLock updateLock = new ReentrantLock();

    @Inject
    public StreamingUpdateService(
            AnnotationRepository annotationRepository,
            ModelRepository modelRepository,
            BoxPredictionRepository boxRepository,
            ModelTrainingService trainingService,
            RetrainTriggerService retrainTrigger,
            ChangeProbabilityService changeProbability,
            AdaptiveRecalculationService recalculation,
            BatchPredictor batchPredictor) {
        this.annotationRepository = annotationRepository;
        this.modelRepository = modelRepository;
        this.boxRepository = boxRepository;
        this.trainingService = trainingService;
        this.retrainTrigger = retrainTrigger;
        this.changeProbability = changeProbability;
        this.recalculation = recalculation;
        this.batchPredictor = batchPredictor;
    }

    /**
     * Applies one annotation and re-scores affected boxes on the calling thread.
     *
     * @param annotation the new user annotation
     * @return summary of the update
     */
    public StreamingUpdateResult applyAnnotation(Annotation annotation) {
        updateLock.lock();
        try {
            PreparedUpdate prepared = prepare(annotation);
            if (prepared.candidates() == null) {
                return prepared.noCovarianceResult();
            }
            AdaptiveRecalcResult recalc =
                    recalculation.runAdaptiveRecalculation(prepared.candidates(), batchPredictor);
            return prepared.toResult(recalc);
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Applies one annotation and re-scores affected boxes batch by batch on the recalculation
     * executor.
     *
     * @param annotation the new user annotation
     * @return lazy re-scoring; the annotation itself is stored before this method returns
     */
    public Uni<StreamingUpdateResult> applyAnnotationAsync(Annotation annotation) {
        PreparedUpdate prepared;
        updateLock.lock();
        try {
            prepared = prepare(annotation);
        } finally {
            updateLock.unlock();
        }

        if (prepared.candidates() == null) {
            return Uni.createFrom().item(prepared.noCovarianceResult());
        }
        return recalculation
                .runAdaptiveRecalculationAsync(prepared.candidates(), batchPredictor)
                .map(prepared::toResult);
    }

    private PreparedUpdate prepare(Annotation annotation) {
        annotationRepository.save(annotation);
        markUserAnnotated(annotation);

        boolean retrained = retrainIfTriggered();

        Optional<BoxClassificationModel> model = modelRepository.loadCurrentModel();
        String version = model.map(BoxClassificationModel::getVersion).orElse(null);
        Optional<double[]> inverse = model.flatMap(BoxClassificationModel::getCovarianceInverse);

        if (inverse.isEmpty()) {
            LOG.infof("No covariance available for model %s, skipping recalculation after annotation on %s",
                    version, annotation.boxRef());
            return new PreparedUpdate(retrained, version, null);
        }

        List<BoxWithPrediction> boxes =
                boxRepository.findAll().stream()
                        .filter(box -> !box.boxRef().equals(annotation.boxRef()))
                        .filter(box -> !isUserAnnotated(box))
                        .toList();

        List<ScoredCandidate> candidates =
                changeProbability.identifyAffectedBoxes(annotation, boxes, inverse.get());
        return new PreparedUpdate(retrained, version, candidates);
    }

    private boolean retrainIfTriggered() {
        RetrainState state = retrainTrigger.currentState();
        RetrainDecision decision = retrainTrigger.shouldTriggerFullRetrain(state, Instant.now());

        if (decision.shouldRetrain()) {
            return trainOrReset();
        }
        if (decision.reason() == RetrainReason.INSUFFICIENT_TOTAL_ANNOTATIONS
                && state.lastRetrainAnnotationCount() > state.currentAnnotationCount()) {
            // annotations were removed since the current model was trained
            trainOrReset();
        }
        return false;
    }

    private boolean trainOrReset() {
        TrainingResult result = trainingService.train();
        if (result.isTrained()) {
            return true;
        }
        if (result.resetToSeedRequired()) {
            trainingService.resetToSeedModel();
        }
        LOG.infof("Retrain not completed: %s", result.message());
        return false;
    }

    private void markUserAnnotated(Annotation annotation) {
        boolean in = annotation.label() == BoxLabel.IN;
        Prediction userLabel = new Prediction(annotation.label(), 1.0);

        Optional<BoxWithPrediction> stored = boxRepository.find(annotation.boxRef());
        FeatureVector base = stored.map(BoxWithPrediction::features).orElse(annotation.features());
        FeatureVector flagged =
                base.with(FeatureName.IS_USER_ANNOTATED_IN, in ? 1.0 : 0.0)
                        .with(FeatureName.IS_USER_ANNOTATED_OUT, in ? 0.0 : 1.0);

        boxRepository.save(new BoxWithPrediction(annotation.boxRef(), flagged, userLabel));
    }

    private static boolean isUserAnnotated(BoxWithPrediction box) {
        return box.features().get(FeatureName.IS_USER_ANNOTATED_IN) == 1.0
                || box.features().get(FeatureName.IS_USER_ANNOTATED_OUT) == 1.0;
    }

    private record PreparedUpdate(boolean retrained, String modelVersion, List<ScoredCandidate> candidates) {

        StreamingUpdateResult noCovarianceResult() {
            return StreamingUpdateResult.noCovariance(retrained, modelVersion);
        }

        StreamingUpdateResult toResult(AdaptiveRecalcResult recalc) {
            return StreamingUpdateResult.from(retrained, modelVersion, candidates.size(), recalc);
        }
    }
}
