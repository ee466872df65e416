/* (C)2026 */
package com.ammann.captionbox.repository;

import com.ammann.captionbox.exception.ModelPersistenceException;
import com.ammann.captionbox.model.BoxClassificationModel;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Holds the current model in a single atomic reference, so replacement is one pointer swap.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryModelRepository implements ModelRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryModelRepository.class);

    private final AtomicReference<BoxClassificationModel> current = new AtomicReference<>();

    @Override
    public Optional<BoxClassificationModel> loadCurrentModel() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void save(BoxClassificationModel model) {
        if (model == null) {
            throw new ModelPersistenceException("Refusing to store a null model");
        }
        BoxClassificationModel previous = current.getAndSet(model);
        LOG.debugf("Model replaced: %s -> %s",
                previous == null ? "none" : previous.getVersion(), model.getVersion());
    }

    public void clear() {
        current.set(null);
    }
}
