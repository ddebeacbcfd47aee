package com.buildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outcome of {@link com.buildsentinel.core.engine.AlertEngine#submit}.
 *
 * <p>
 * {@code ruleName} is {@code null} when the event was dropped before routing
 * (maintenance window).
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SubmitResult {

    private final AlertState state;
    private final String jobName;
    private final Severity severity;
    private final String fingerprint;
    private final String ruleName;
    private final boolean forced;

    public SubmitResult(AlertState state, String jobName, Severity severity,
            String fingerprint, String ruleName, boolean forced) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.jobName = jobName;
        this.severity = severity;
        this.fingerprint = fingerprint;
        this.ruleName = ruleName;
        this.forced = forced;
    }

    @JsonProperty("state")
    public AlertState getState() {
        return state;
    }

    @JsonProperty("reason")
    public String getReason() {
        return state.reason();
    }

    /**
     * @return {@code true} if the event was accepted into a batch
     */
    @JsonProperty("accepted")
    public boolean isAccepted() {
        return state == AlertState.BATCHED;
    }

    @JsonProperty("job_name")
    public String getJobName() {
        return jobName;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("fingerprint")
    public String getFingerprint() {
        return fingerprint;
    }

    @JsonProperty("rule")
    public String getRuleName() {
        return ruleName;
    }

    @JsonProperty("forced")
    public boolean isForced() {
        return forced;
    }

    @Override
    public String toString() {
        return "SubmitResult{" +
                "state=" + state +
                ", jobName='" + jobName + '\'' +
                ", severity=" + severity +
                ", rule='" + ruleName + '\'' +
                (forced ? ", forced" : "") +
                '}';
    }
}
