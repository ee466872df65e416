/* (C)2026 */
package com.ammann.captionbox.model;

import java.util.List;

/**
 * Hand-tuned Gaussian parameters of the seed model, used before any annotation exists.
 *
 * <p>Caption ("in") boxes are well aligned, similar in height, clustered, wide and sit in
 * the lower part of the frame. Noise ("out") boxes are scattered and varied.
 */
public final class SeedModelParameters {

    private SeedModelParameters() {}

    public static final String SEED_VERSION = "seed_v2";

    private static final GaussianParams FLAG = new GaussianParams(0.5, 0.5);

    public static final List<GaussianParams> IN_PARAMS =
            List.of(
                    // Spatial
                    new GaussianParams(0.5, 0.5),
                    new GaussianParams(0.5, 0.5),
                    new GaussianParams(0.5, 0.5),
                    new GaussianParams(0.5, 0.5),
                    new GaussianParams(4.0, 2.0),
                    new GaussianParams(0.8, 0.1),
                    new GaussianParams(0.02, 0.015),
                    // User annotations
                    FLAG,
                    FLAG,
                    // Edge positions
                    new GaussianParams(0.35, 0.15),
                    new GaussianParams(0.75, 0.1),
                    new GaussianParams(0.65, 0.15),
                    new GaussianParams(0.85, 0.1),
                    // Character sets
                    FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG,
                    // Temporal (seconds)
                    new GaussianParams(300.0, 200.0),
                    new GaussianParams(300.0, 200.0));

    public static final List<GaussianParams> OUT_PARAMS =
            List.of(
                    new GaussianParams(1.5, 1.0),
                    new GaussianParams(1.5, 1.0),
                    new GaussianParams(1.5, 1.0),
                    new GaussianParams(1.5, 1.0),
                    new GaussianParams(2.0, 3.0),
                    new GaussianParams(0.5, 0.3),
                    new GaussianParams(0.03, 0.03),
                    FLAG,
                    FLAG,
                    new GaussianParams(0.5, 0.3),
                    new GaussianParams(0.5, 0.3),
                    new GaussianParams(0.5, 0.3),
                    new GaussianParams(0.5, 0.3),
                    FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG, FLAG,
                    new GaussianParams(300.0, 250.0),
                    new GaussianParams(300.0, 250.0));
}
