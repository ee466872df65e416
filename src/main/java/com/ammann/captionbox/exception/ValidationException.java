/* (C)2026 */
package com.ammann.captionbox.exception;

/**
 * Exception indicating that a client-supplied parameter or payload does not meet
 * the required constraints for the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a reference to an unknown resource.
     */
    public static ValidationException unknownResource(String resourceType, Object id) {
        return new ValidationException(String.format("Unknown %s: %s", resourceType, id));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
