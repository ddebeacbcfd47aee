package com.buildsentinel.core.model;

import com.buildsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery channel kinds. Each channel is served by one
 * {@link com.buildsentinel.core.delivery.AlertSink}.
 *
 * @since 1.0.0
 */
public enum Channel {

    SLACK,
    EMAIL,
    WEBHOOK;

    /**
     * Parse a channel name, ignoring case.
     *
     * @param value channel name such as {@code "slack"}
     * @return the matching channel
     * @throws ValidationException if {@code value} is blank or unknown
     */
    @JsonCreator
    public static Channel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Channel must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown channel: '" + value
                    + "'. Supported: slack, email, webhook", e);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
