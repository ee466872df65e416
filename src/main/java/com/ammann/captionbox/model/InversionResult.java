/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * Inverse of a symmetric matrix, tagged with whether it is exact or a degraded approximation.
 *
 * <p>A degraded inverse comes from the diagonal fallback after Cholesky decomposition failed.
 *
 * @param inverse  flattened row-major inverse
 * @param degraded true if the diagonal fallback was used
 * @param reason   why the fallback was needed, null when exact
 */
public record InversionResult(double[] inverse, boolean degraded, String reason) {

    public static InversionResult exact(double[] inverse) {
        return new InversionResult(inverse, false, null);
    }

    public static InversionResult degraded(double[] inverse, String reason) {
        return new InversionResult(inverse, true, reason);
    }
}
