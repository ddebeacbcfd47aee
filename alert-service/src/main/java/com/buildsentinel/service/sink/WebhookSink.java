package com.buildsentinel.service.sink;

import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.Channel;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Posts a machine-readable alert to a generic HTTP endpoint.
 *
 * <pre>
 * {
 *   "type": "anomaly_detected",
 *   "timestamp": "2024-05-01T12:00:00Z",
 *   "subject": "CI/CD Anomaly Alert - deploy-prod",
 *   "text": "...",
 *   "events": [ { "job_name": "deploy-prod", ... } ]
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public class WebhookSink extends HttpJsonSink {

    static final String EVENT_TYPE = "anomaly_detected";

    private final Clock clock;

    public WebhookSink(String webhookUrl, HttpClient httpClient, ObjectMapper mapper, Duration requestTimeout,
                       Clock clock) {
        super(Channel.WEBHOOK, webhookUrl, httpClient, mapper, requestTimeout);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    protected Map<String, Object> payload(AlertMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", EVENT_TYPE);
        body.put("timestamp", clock.instant());
        body.put("subject", message.getSubject());
        body.put("text", message.getText());
        body.put("events", message.getEvents());
        return body;
    }
}
