package com.buildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of one submitted anomaly.
 *
 * <pre>
 * RECEIVED → SUPPRESSED_MAINTENANCE | SUPPRESSED_DUPLICATE
 *          | SUPPRESSED_SEVERITY | SUPPRESSED_RATE_LIMIT | BATCHED
 * BATCHED  → SENT | DELIVERY_FAILED   (at flush time)
 * </pre>
 *
 * Every state except {@link #RECEIVED} and {@link #BATCHED} is terminal.
 *
 * @since 1.0.0
 */
public enum AlertState {

    RECEIVED("received"),
    SUPPRESSED_MAINTENANCE("maintenance_window"),
    SUPPRESSED_DUPLICATE("duplicate"),
    SUPPRESSED_SEVERITY("below_severity_threshold"),
    SUPPRESSED_RATE_LIMIT("rate_limit"),
    BATCHED("queued_in_batch"),
    SENT("sent"),
    DELIVERY_FAILED("delivery_failed");

    private final String reason;

    AlertState(String reason) {
        this.reason = reason;
    }

    /**
     * @return stable reason code reported to callers, e.g. {@code duplicate}
     */
    public String reason() {
        return reason;
    }

    public boolean isSuppressed() {
        return name().startsWith("SUPPRESSED_");
    }

    public boolean isTerminal() {
        return this != RECEIVED && this != BATCHED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
