package com.buildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Rendered notification handed to every sink of a batch.
 *
 * <p>
 * {@code text} is Slack-flavoured markdown; sinks that need another format
 * may re-render from {@link #getEvents()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertMessage {

    private final String subject;
    private final String text;
    private final List<AnomalyEvent> events;

    public AlertMessage(String subject, String text, List<AnomalyEvent> events) {
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.events = List.copyOf(events);
    }

    @JsonProperty("subject")
    public String getSubject() {
        return subject;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("events")
    public List<AnomalyEvent> getEvents() {
        return events;
    }

    @JsonProperty("grouped")
    public boolean isGrouped() {
        return events.size() > 1;
    }

    @Override
    public String toString() {
        return "AlertMessage{subject='" + subject + "', events=" + events.size() + '}';
    }
}
