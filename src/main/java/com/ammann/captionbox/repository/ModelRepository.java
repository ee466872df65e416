/* (C)2026 */
package com.ammann.captionbox.repository;

import com.ammann.captionbox.model.BoxClassificationModel;
import java.time.Instant;
import java.util.Optional;

/**
 * Holder of the current classification model.
 *
 * <p>Implementations must swap models atomically: a reader sees either the complete
 * previous model or the complete new one.
 */
public interface ModelRepository {

    Optional<BoxClassificationModel> loadCurrentModel();

    /**
     * Replaces the current model.
     *
     * @throws com.ammann.captionbox.exception.ModelPersistenceException if the model could not be stored
     */
    void save(BoxClassificationModel model);

    /**
     * Time the current model was trained from annotations, empty while only the seed model exists.
     */
    default Optional<Instant> lastTrainedAt() {
        return loadCurrentModel()
                .filter(model -> !model.isSeed())
                .map(BoxClassificationModel::getTrainedAt);
    }
}
