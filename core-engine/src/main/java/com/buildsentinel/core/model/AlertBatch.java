package com.buildsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a drained batch buffer, ready for delivery.
 *
 * @since 1.0.0
 */
public final class AlertBatch {

    private final BatchKey key;
    private final RoutingRule rule;
    private final List<AnomalyEvent> events;
    private final Instant openedAt;

    public AlertBatch(BatchKey key, RoutingRule rule, List<AnomalyEvent> events, Instant openedAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.events = Collections.unmodifiableList(List.copyOf(events));
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt must not be null");
        if (this.events.isEmpty()) {
            throw new IllegalArgumentException("A batch must contain at least one event");
        }
    }

    public BatchKey getKey() {
        return key;
    }

    public RoutingRule getRule() {
        return rule;
    }

    public List<AnomalyEvent> getEvents() {
        return events;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public int size() {
        return events.size();
    }

    /**
     * @return {@code true} when the batch is rendered with the grouped format
     */
    public boolean isGrouped() {
        return events.size() > 1;
    }

    @Override
    public String toString() {
        return "AlertBatch{key=" + key + ", events=" + events.size() + ", openedAt=" + openedAt + '}';
    }
}
