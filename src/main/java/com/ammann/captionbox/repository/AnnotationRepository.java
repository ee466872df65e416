/* (C)2026 */
package com.ammann.captionbox.repository;

import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.LayoutConfig;
import java.util.List;
import java.util.Optional;

/**
 * Storage of human annotations and the layout context they were made in.
 */
public interface AnnotationRepository {

    /**
     * Returns all user annotations in insertion order. Re-annotating a box replaces
     * its earlier label.
     */
    List<Annotation> loadAnnotations();

    Optional<LayoutConfig> loadLayoutConfig();

    void save(Annotation annotation);

    int count();
}
