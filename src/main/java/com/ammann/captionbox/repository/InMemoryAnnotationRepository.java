/* (C)2026 */
package com.ammann.captionbox.repository;

import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.LayoutConfig;
import io.quarkus.arc.DefaultBean;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Process-local annotation store, active unless another {@link AnnotationRepository} bean exists.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryAnnotationRepository implements AnnotationRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAnnotationRepository.class);

    @ConfigProperty(name = "captionbox.layout.frame-width", defaultValue = "1920")
    int defaultFrameWidth;

    @ConfigProperty(name = "captionbox.layout.frame-height", defaultValue = "1080")
    int defaultFrameHeight;

    private final Map<BoxRef, Annotation> annotations = new LinkedHashMap<>();
    private final AtomicReference<LayoutConfig> layout = new AtomicReference<>();

    @PostConstruct
    public void init() {
        layout.set(new LayoutConfig(defaultFrameWidth, defaultFrameHeight));
        LOG.debugf("Default layout %dx%d", defaultFrameWidth, defaultFrameHeight);
    }

    @Override
    public synchronized List<Annotation> loadAnnotations() {
        return new ArrayList<>(annotations.values());
    }

    @Override
    public Optional<LayoutConfig> loadLayoutConfig() {
        return Optional.ofNullable(layout.get());
    }

    public void updateLayoutConfig(LayoutConfig layoutConfig) {
        layout.set(layoutConfig);
    }

    @Override
    public synchronized void save(Annotation annotation) {
        annotations.remove(annotation.boxRef());
        annotations.put(annotation.boxRef(), annotation);
    }

    @Override
    public synchronized int count() {
        return annotations.size();
    }

    public synchronized void clear() {
        annotations.clear();
    }
}
