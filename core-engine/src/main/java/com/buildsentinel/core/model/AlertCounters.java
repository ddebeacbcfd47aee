package com.buildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Monotonic decision counters, persisted with the engine state.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The engine only touches an instance while holding its
 * lock and hands out {@link #copy() copies}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class AlertCounters {

    @JsonProperty("total_received")
    private long received;

    @JsonProperty("total_sent")
    private long sent;

    @JsonProperty("suppressed_duplicate")
    private long suppressedDuplicate;

    @JsonProperty("suppressed_maintenance")
    private long suppressedMaintenance;

    @JsonProperty("suppressed_rate_limit")
    private long suppressedRateLimit;

    @JsonProperty("suppressed_severity")
    private long suppressedSeverity;

    @JsonProperty("delivery_failed")
    private long deliveryFailed;

    @JsonProperty("batched")
    private long batched;

    @JsonProperty("forced")
    private long forced;

    @JsonProperty("messages_sent")
    private long messagesSent;

    /**
     * Count a terminal or batched submit decision.
     *
     * @param state decision reached by the pipeline
     */
    public void recordDecision(AlertState state) {
        switch (state) {
            case SUPPRESSED_MAINTENANCE -> suppressedMaintenance++;
            case SUPPRESSED_DUPLICATE -> suppressedDuplicate++;
            case SUPPRESSED_SEVERITY -> suppressedSeverity++;
            case SUPPRESSED_RATE_LIMIT -> suppressedRateLimit++;
            case BATCHED -> batched++;
            default -> throw new IllegalArgumentException("Not a submit decision: " + state);
        }
    }

    public void recordReceived() {
        received++;
    }

    public void recordForced() {
        forced++;
    }

    /**
     * Count the outcome of one flushed batch.
     *
     * @param events    number of events in the batch
     * @param delivered {@code true} if at least one channel accepted the message
     */
    public void recordFlush(int events, boolean delivered) {
        if (delivered) {
            sent += events;
            messagesSent++;
        } else {
            deliveryFailed += events;
        }
    }

    public long getReceived() {
        return received;
    }

    public long getSent() {
        return sent;
    }

    public long getSuppressedDuplicate() {
        return suppressedDuplicate;
    }

    public long getSuppressedMaintenance() {
        return suppressedMaintenance;
    }

    public long getSuppressedRateLimit() {
        return suppressedRateLimit;
    }

    public long getSuppressedSeverity() {
        return suppressedSeverity;
    }

    public long getDeliveryFailed() {
        return deliveryFailed;
    }

    public long getBatched() {
        return batched;
    }

    public long getForced() {
        return forced;
    }

    public long getMessagesSent() {
        return messagesSent;
    }

    public long getTotalSuppressed() {
        return suppressedDuplicate + suppressedMaintenance + suppressedRateLimit + suppressedSeverity;
    }

    public AlertCounters copy() {
        AlertCounters c = new AlertCounters();
        c.received = received;
        c.sent = sent;
        c.suppressedDuplicate = suppressedDuplicate;
        c.suppressedMaintenance = suppressedMaintenance;
        c.suppressedRateLimit = suppressedRateLimit;
        c.suppressedSeverity = suppressedSeverity;
        c.deliveryFailed = deliveryFailed;
        c.batched = batched;
        c.forced = forced;
        c.messagesSent = messagesSent;
        return c;
    }

    @Override
    public String toString() {
        return "AlertCounters{" +
                "received=" + received +
                ", sent=" + sent +
                ", suppressed=" + getTotalSuppressed() +
                ", deliveryFailed=" + deliveryFailed +
                ", messagesSent=" + messagesSent +
                '}';
    }
}
