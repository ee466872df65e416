/* (C)2026 */
package com.ammann.captionbox.repository;

import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.BoxWithPrediction;
import com.ammann.captionbox.model.Prediction;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store of scored boxes, active unless another {@link BoxPredictionRepository} bean exists.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryBoxPredictionRepository implements BoxPredictionRepository {

    private static final Comparator<BoxWithPrediction> BY_POSITION =
            Comparator.comparingInt((BoxWithPrediction b) -> b.boxRef().frameIndex())
                    .thenComparingInt(b -> b.boxRef().boxIndex());

    private final Map<BoxRef, BoxWithPrediction> boxes = new ConcurrentHashMap<>();

    @Override
    public void save(BoxWithPrediction box) {
        boxes.put(box.boxRef(), box);
    }

    @Override
    public Optional<BoxWithPrediction> find(BoxRef boxRef) {
        return Optional.ofNullable(boxes.get(boxRef));
    }

    @Override
    public List<BoxWithPrediction> findAll() {
        return boxes.values().stream().sorted(BY_POSITION).toList();
    }

    @Override
    public Optional<BoxWithPrediction> updatePrediction(BoxRef boxRef, Prediction prediction) {
        return Optional.ofNullable(
                boxes.computeIfPresent(boxRef, (ref, box) -> box.withPrediction(prediction)));
    }

    public void clear() {
        boxes.clear();
    }
}
