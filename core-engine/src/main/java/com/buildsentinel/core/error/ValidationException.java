package com.buildsentinel.core.error;

/**
 * Thrown when a routing rule, maintenance window or configuration value is
 * malformed or clashes with an existing registration.
 *
 * <p>
 * Raised synchronously to the caller; the engine state is left unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends AlertingException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
