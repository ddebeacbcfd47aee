package com.buildsentinel.service;

import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.json.JsonMappers;
import com.buildsentinel.core.model.AnomalyEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses upstream anomaly records into {@link AnomalyEvent}s.
 *
 * <p>
 * Accepts a single JSON object or an array of objects. Unknown properties are
 * rejected. A record without {@code timestamp} is stamped with the receive
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEventReader {

    private final ObjectMapper mapper = JsonMappers.strict();
    private final Clock clock;

    public AnomalyEventReader(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param body raw request body
     * @return parsed events in input order
     * @throws ValidationException if the body is empty, not JSON, or any
     *                             record is invalid
     */
    public List<AnomalyEvent> read(byte[] body) {
        if (body == null || body.length == 0) {
            throw new ValidationException("Request body is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ValidationException("Unreadable request body: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ValidationException("Request body is empty");
        }

        List<AnomalyEvent> events = new ArrayList<>();
        if (root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                events.add(toEvent(root.get(i), "record " + i));
            }
        } else {
            events.add(toEvent(root, "record"));
        }
        return events;
    }

    private AnomalyEvent toEvent(JsonNode node, String label) {
        if (!node.isObject()) {
            throw new ValidationException(label + " is not a JSON object");
        }
        ObjectNode record = (ObjectNode) node;
        if (!record.hasNonNull("timestamp")) {
            record.set("timestamp", TextNode.valueOf(clock.instant().toString()));
        }
        try {
            return mapper.treeToValue(record, AnomalyEvent.class);
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ValidationException) {
                throw new ValidationException(label + ": " + cause.getMessage(), cause);
            }
            throw new ValidationException(label + ": " + e.getOriginalMessage(), e);
        }
    }
}
