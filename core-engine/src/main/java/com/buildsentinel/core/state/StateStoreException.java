package com.buildsentinel.core.state;

import com.buildsentinel.core.error.AlertingException;

/**
 * Raised when the engine snapshot cannot be read or written.
 *
 * <p>
 * Never fatal: on a failed read the engine starts empty, on a failed write it
 * keeps running with its in-memory state.
 * </p>
 *
 * @since 1.0.0
 */
public class StateStoreException extends AlertingException {

    private static final long serialVersionUID = 1L;

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
