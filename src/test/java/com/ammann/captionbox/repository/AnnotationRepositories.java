/* (C)2026 */
package com.ammann.captionbox.repository;

/**
 * Builds annotation repositories the way the container would, with the layout fields set.
 */
public final class AnnotationRepositories {

    private AnnotationRepositories() {}

    public static InMemoryAnnotationRepository withLayout(int frameWidth, int frameHeight) {
        InMemoryAnnotationRepository repository = new InMemoryAnnotationRepository();
        repository.defaultFrameWidth = frameWidth;
        repository.defaultFrameHeight = frameHeight;
        repository.init();
        return repository;
    }

    public static InMemoryAnnotationRepository withDefaultLayout() {
        return withLayout(1920, 1080);
    }
}
