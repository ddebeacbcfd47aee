package com.buildsentinel.core.error;

/**
 * Thrown when a management call names a rule or maintenance window that is not
 * registered.
 *
 * @since 1.0.0
 */
public class NotFoundException extends AlertingException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }
}
