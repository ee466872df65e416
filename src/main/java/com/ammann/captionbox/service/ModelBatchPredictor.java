/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.exception.ModelPersistenceException;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.BoxWithPrediction;
import com.ammann.captionbox.model.Prediction;
import com.ammann.captionbox.model.RescoreOutcome;
import com.ammann.captionbox.model.ScoredCandidate;
import com.ammann.captionbox.repository.BoxPredictionRepository;
import com.ammann.captionbox.repository.ModelRepository;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Re-scores boxes with the current model and writes the new predictions back to the box store.
 *
 * <p>The model is read once per batch so that every box in a batch is scored by the same snapshot.
 */
@DefaultBean
@ApplicationScoped
public class ModelBatchPredictor implements BatchPredictor {

    private static final Logger LOG = Logger.getLogger(ModelBatchPredictor.class);

    private final BayesianPredictionService predictionService;
    private final ModelRepository modelRepository;
    private final BoxPredictionRepository boxRepository;

    @Inject
    public ModelBatchPredictor(
            BayesianPredictionService predictionService,
            ModelRepository modelRepository,
            BoxPredictionRepository boxRepository) {
        this.predictionService = predictionService;
        this.modelRepository = modelRepository;
        this.boxRepository = boxRepository;
    }

    @Override
    public List<RescoreOutcome> predictAndUpdate(List<ScoredCandidate> batch) {
        BoxClassificationModel model =
                modelRepository
                        .loadCurrentModel()
                        .orElseThrow(() -> new ModelPersistenceException("No model available for re-scoring"));

        List<RescoreOutcome> outcomes = new ArrayList<>(batch.size());
        int reversals = 0;

        for (ScoredCandidate candidate : batch) {
            BoxWithPrediction box = candidate.box();
            Prediction updated = predictionService.predict(box.features(), model);

            BoxWithPrediction stored =
                    boxRepository.updatePrediction(box.boxRef(), updated)
                            .orElseGet(() -> box.withPrediction(updated));

            RescoreOutcome outcome =
                    RescoreOutcome.of(stored, box.currentPrediction().label(), updated.label());
            if (outcome.reversed()) {
                reversals++;
            }
            outcomes.add(outcome);
        }

        LOG.debugf("Re-scored batch of %d boxes with model %s: %d reversals",
                (Object) batch.size(), model.getVersion(), reversals);
        return outcomes;
    }
}
