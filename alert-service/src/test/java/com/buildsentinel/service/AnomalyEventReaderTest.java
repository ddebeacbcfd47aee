package com.buildsentinel.service;

import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyEventReader}.
 */
class AnomalyEventReaderTest {

    private static final Instant RECEIVED_AT = Instant.parse("2024-05-01T12:00:00Z");

    private final AnomalyEventReader reader =
            new AnomalyEventReader(Clock.fixed(RECEIVED_AT, ZoneOffset.UTC));

    @Test
    @DisplayName("Should parse a single anomaly record")
    void shouldParseSingleRecord() {
        List<AnomalyEvent> events = reader.read(bytes("{"
                + "\"job_name\": \"deploy-prod\","
                + "\"timestamp\": \"2024-05-01T10:15:30Z\","
                + "\"severity\": \"high\","
                + "\"max_z_score\": 4.5,"
                + "\"anomaly_features\": [{\"feature\": \"duration\", \"observed\": 800,"
                + " \"expected\": 300, \"z_score\": 4.5}],"
                + "\"data\": {\"duration\": 800, \"result\": \"FAILURE\"}"
                + "}"));

        assertThat(events).hasSize(1);
        AnomalyEvent event = events.get(0);
        assertThat(event.getJobName()).isEqualTo("deploy-prod");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
        assertThat(event.getEffectiveSeverity()).isEqualTo(Severity.HIGH);
        assertThat(event.getFeatures()).extracting("feature").containsExactly("duration");
        assertThat(event.getPayload()).containsEntry("result", "FAILURE");
    }

    @Test
    @DisplayName("Should parse an array and stamp records that carry no timestamp")
    void shouldParseArrayAndDefaultTimestamp() {
        List<AnomalyEvent> events = reader.read(bytes("["
                + "{\"job_name\": \"build-ui\", \"max_z_score\": 2.2},"
                + "{\"job_name\": \"test-api\", \"timestamp\": \"2024-05-01T11:00:00Z\"}"
                + "]"));

        assertThat(events).extracting(AnomalyEvent::getJobName).containsExactly("build-ui", "test-api");
        assertThat(events.get(0).getTimestamp()).isEqualTo(RECEIVED_AT);
        assertThat(events.get(1).getTimestamp()).isEqualTo(Instant.parse("2024-05-01T11:00:00Z"));
    }

    @Test
    @DisplayName("Should reject unknown properties")
    void shouldRejectUnknownProperties() {
        assertThatThrownBy(() -> reader.read(bytes("{\"job_name\": \"x\", \"colour\": \"red\"}")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("record");
    }

    @Test
    @DisplayName("Should reject a record without a job name")
    void shouldRejectMissingJobName() {
        assertThatThrownBy(() -> reader.read(bytes("[{\"severity\": \"low\"}]")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("job_name");
    }

    @Test
    @DisplayName("Should reject empty bodies, malformed JSON and non-object records")
    void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> reader.read(new byte[0]))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> reader.read(bytes("{\"job_name\": ")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed JSON");
        assertThatThrownBy(() -> reader.read(bytes("[42]")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("record 0 is not a JSON object");
    }

    // ---- Helpers

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
