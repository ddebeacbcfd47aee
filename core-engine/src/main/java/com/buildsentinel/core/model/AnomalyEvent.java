package com.buildsentinel.core.model;

import com.buildsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An anomaly record produced by the scoring pipeline and handed to
 * {@link com.buildsentinel.core.engine.AlertEngine#submit(AnomalyEvent)}.
 *
 * <p>
 * Instances are immutable. The feature list keeps the producer's order (used
 * for rendering); the payload map is an opaque bag of build details such as
 * {@code duration} or {@code result} that only the message renderer reads.
 * </p>
 *
 * <h3>JSON shape</h3>
 *
 * <pre>
 * {
 *   "job_name": "deploy-prod",
 *   "timestamp": "2024-05-01T10:15:30Z",
 *   "severity": "high",
 *   "max_z_score": 4.5,
 *   "anomaly_features": [
 *     {"feature": "duration", "observed": 800, "expected": 300, "z_score": 4.5}
 *   ],
 *   "data": {"duration": 800, "result": "FAILURE"}
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = AnomalyEvent.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String jobName;
    private final Instant timestamp;
    private final Severity severity;
    private final Double maxZScore;
    private final List<AnomalousFeature> features;
    private final Map<String, Object> payload;

    private AnomalyEvent(Builder builder) {
        this.jobName = builder.jobName;
        this.timestamp = builder.timestamp;
        this.severity = builder.severity;
        this.maxZScore = builder.maxZScore;
        this.features = Collections.unmodifiableList(new ArrayList<>(builder.features));
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @JsonProperty("job_name")
    public String getJobName() {
        return jobName;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the severity supplied by the producer, or empty if it has to be
     *         derived
     */
    @JsonIgnore
    public Optional<Severity> getExplicitSeverity() {
        return Optional.ofNullable(severity);
    }

    @JsonProperty("severity")
    Severity getSeverityOrNull() {
        return severity;
    }

    @JsonProperty("max_z_score")
    Double getMaxZScoreOrNull() {
        return maxZScore;
    }

    @JsonProperty("anomaly_features")
    public List<AnomalousFeature> getFeatures() {
        return features;
    }

    @JsonProperty("data")
    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Largest absolute z-score across the declared {@code max_z_score} and
     * every anomalous feature.
     *
     * @return maximum z-score, {@code 0} when nothing was supplied
     */
    @JsonIgnore
    public double getMaxZScore() {
        double max = maxZScore != null ? Math.abs(maxZScore) : 0.0;
        for (AnomalousFeature f : features) {
            max = Math.max(max, Math.abs(f.getZScore()));
        }
        return max;
    }

    /**
     * @return the explicit severity, or the one derived from
     *         {@link #getMaxZScore()}
     */
    @JsonIgnore
    public Severity getEffectiveSeverity() {
        return severity != null ? severity : Severity.fromZScore(getMaxZScore());
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnomalyEvent}.
     *
     * <p>
     * {@code jobName} and {@code timestamp} are required.
     * </p>
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String jobName;
        private Instant timestamp;
        private Severity severity;
        private Double maxZScore;
        private final List<AnomalousFeature> features = new ArrayList<>();
        private final Map<String, Object> payload = new LinkedHashMap<>();

        @JsonProperty("job_name")
        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        @JsonProperty("timestamp")
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        @JsonProperty("severity")
        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        @JsonProperty("max_z_score")
        public Builder maxZScore(Double maxZScore) {
            this.maxZScore = maxZScore;
            return this;
        }

        public Builder feature(String name, double observed, double expected, double zScore) {
            this.features.add(new AnomalousFeature(name, observed, expected, zScore));
            return this;
        }

        @JsonProperty("anomaly_features")
        public Builder features(List<AnomalousFeature> features) {
            this.features.clear();
            if (features != null) {
                features.forEach(f -> this.features.add(
                        Objects.requireNonNull(f, "anomaly feature must not be null")));
            }
            return this;
        }

        public Builder payload(String key, Object value) {
            this.payload.put(Objects.requireNonNull(key, "payload key must not be null"), value);
            return this;
        }

        @JsonProperty("data")
        public Builder payload(Map<String, Object> payload) {
            this.payload.clear();
            if (payload != null) {
                this.payload.putAll(payload);
            }
            return this;
        }

        /**
         * @return a new immutable event
         * @throws ValidationException if the job name is blank or the timestamp
         *                             is missing
         */
        public AnomalyEvent build() {
            List<String> errors = new ArrayList<>();
            if (jobName == null || jobName.isBlank()) {
                errors.add("'job_name' is required");
            }
            if (timestamp == null) {
                errors.add("'timestamp' is required");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid anomaly event: " + String.join("; ", errors));
            }
            return new AnomalyEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return jobName.equals(that.jobName)
                && timestamp.equals(that.timestamp)
                && severity == that.severity
                && Objects.equals(maxZScore, that.maxZScore)
                && features.equals(that.features)
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobName, timestamp, severity, maxZScore, features, payload);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" +
                "jobName='" + jobName + '\'' +
                ", timestamp=" + timestamp +
                ", severity=" + getEffectiveSeverity() +
                ", features=" + features.size() +
                '}';
    }
}
