package com.buildsentinel.core.error;

/**
 * Base class for every unchecked error raised by the alerting engine.
 *
 * @since 1.0.0
 */
public class AlertingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertingException(String message) {
        super(message);
    }

    public AlertingException(String message, Throwable cause) {
        super(message, cause);
    }
}
