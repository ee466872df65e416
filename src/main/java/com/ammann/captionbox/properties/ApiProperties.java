/* (C)2026 */
package com.ammann.captionbox.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Classification model endpoints
     */
    public static final class Model {
        private Model() {}

        public static final String BASE = "/model";
        public static final String FEATURE_IMPORTANCE = BASE + "/feature-importance";
        public static final String TRAIN = BASE + "/train";
        public static final String SEED = BASE + "/seed";
        public static final String TRAINING_DATA = BASE + "/training-data";
    }

    /**
     * Box registration and annotation endpoints
     */
    public static final class Boxes {
        private Boxes() {}

        public static final String BASE = "/boxes";
        public static final String UNCERTAIN = BASE + "/uncertain";
        public static final String CONFIDENT = BASE + "/confident";
        public static final String ANNOTATIONS = "/annotations";
        public static final String ANNOTATIONS_ASYNC = ANNOTATIONS + "/async";
    }
}
