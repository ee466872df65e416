/* (C)2026 */
package com.ammann.captionbox.exception;

/**
 * Vector or matrix size disagrees with the fixed feature count.
 *
 * <p>Signals a programming error; sizes are never coerced. Mapped to HTTP 500 by
 * {@link GlobalExceptionHandler}.
 */
public class DimensionMismatchException extends ApiException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    public static DimensionMismatchException of(String what, int expected, int actual) {
        return new DimensionMismatchException(
                String.format("Expected %d %s, got %d", expected, what, actual));
    }
}
