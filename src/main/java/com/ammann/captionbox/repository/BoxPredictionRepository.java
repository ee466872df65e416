/* (C)2026 */
package com.ammann.captionbox.repository;

import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.BoxWithPrediction;
import com.ammann.captionbox.model.Prediction;
import java.util.List;
import java.util.Optional;

/**
 * Scored boxes with their feature vectors and current predictions.
 */
public interface BoxPredictionRepository {

    void save(BoxWithPrediction box);

    Optional<BoxWithPrediction> find(BoxRef boxRef);

    /**
     * Returns every stored box ordered by frame index, then box index.
     */
    List<BoxWithPrediction> findAll();

    /**
     * Stores a new prediction for an existing box.
     *
     * @return the updated box, empty if the box is unknown
     */
    Optional<BoxWithPrediction> updatePrediction(BoxRef boxRef, Prediction prediction);
}
