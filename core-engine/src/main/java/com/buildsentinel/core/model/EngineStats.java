package com.buildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Point-in-time view of the engine counters plus derived gauges.
 *
 * @since 1.0.0
 */
public final class EngineStats {

    private final AlertCounters counters;
    private final int pendingInBatch;
    private final int activeMaintenanceWindows;
    private final int registeredRules;
    private final int alertsLastHour;

    public EngineStats(AlertCounters counters, int pendingInBatch, int activeMaintenanceWindows,
            int registeredRules, int alertsLastHour) {
        this.counters = Objects.requireNonNull(counters, "counters must not be null").copy();
        this.pendingInBatch = pendingInBatch;
        this.activeMaintenanceWindows = activeMaintenanceWindows;
        this.registeredRules = registeredRules;
        this.alertsLastHour = alertsLastHour;
    }

    @JsonProperty("total_received")
    public long getTotalReceived() {
        return counters.getReceived();
    }

    @JsonProperty("total_sent")
    public long getTotalSent() {
        return counters.getSent();
    }

    @JsonProperty("suppressed_duplicate")
    public long getSuppressedDuplicate() {
        return counters.getSuppressedDuplicate();
    }

    @JsonProperty("suppressed_maintenance")
    public long getSuppressedMaintenance() {
        return counters.getSuppressedMaintenance();
    }

    @JsonProperty("suppressed_rate_limit")
    public long getSuppressedRateLimit() {
        return counters.getSuppressedRateLimit();
    }

    @JsonProperty("suppressed_severity")
    public long getSuppressedSeverity() {
        return counters.getSuppressedSeverity();
    }

    @JsonProperty("delivery_failed")
    public long getDeliveryFailed() {
        return counters.getDeliveryFailed();
    }

    @JsonProperty("batched")
    public long getBatched() {
        return counters.getBatched();
    }

    @JsonProperty("forced")
    public long getForced() {
        return counters.getForced();
    }

    @JsonProperty("messages_sent")
    public long getMessagesSent() {
        return counters.getMessagesSent();
    }

    @JsonProperty("total_suppressed")
    public long getTotalSuppressed() {
        return counters.getTotalSuppressed();
    }

    /**
     * @return suppressed / received, {@code 0} before anything was received
     */
    @JsonProperty("suppression_rate")
    public double getSuppressionRate() {
        return (double) counters.getTotalSuppressed() / Math.max(counters.getReceived(), 1);
    }

    /**
     * @return events still buffered plus events drained for delivery whose
     *         outcome is not yet recorded, so {@code received} always equals
     *         suppressed + sent + failed + pending
     */
    @JsonProperty("pending_in_batch")
    public int getPendingInBatch() {
        return pendingInBatch;
    }

    @JsonProperty("active_maintenance_windows")
    public int getActiveMaintenanceWindows() {
        return activeMaintenanceWindows;
    }

    @JsonProperty("registered_rules")
    public int getRegisteredRules() {
        return registeredRules;
    }

    @JsonProperty("alerts_last_hour")
    public int getAlertsLastHour() {
        return alertsLastHour;
    }

    @Override
    public String toString() {
        return "EngineStats{" +
                "received=" + getTotalReceived() +
                ", sent=" + getTotalSent() +
                ", suppressed=" + getTotalSuppressed() +
                ", deliveryFailed=" + getDeliveryFailed() +
                ", pending=" + pendingInBatch +
                ", activeWindows=" + activeMaintenanceWindows +
                ", rules=" + registeredRules +
                ", lastHour=" + alertsLastHour +
                '}';
    }
}
