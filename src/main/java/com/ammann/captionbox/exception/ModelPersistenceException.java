/* (C)2026 */
package com.ammann.captionbox.exception;

/**
 * Failure while storing or loading a classification model.
 *
 * <p>Always propagated: a failed save must never be reported as a successful training run.
 * Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class ModelPersistenceException extends ApiException {

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ModelPersistenceException(String message) {
        super(message);
    }
}
