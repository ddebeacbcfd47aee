package com.buildsentinel.core.model;

import com.buildsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Routing and filtering rule for a family of jobs.
 *
 * <p>
 * Rules are evaluated in insertion order by the
 * {@link com.buildsentinel.core.engine.Router}; the first one whose
 * {@code jobPattern} matches decides the channels and the severity floor.
 * </p>
 *
 * <ul>
 * <li>{@code jobPattern}: case-insensitive substring; absent matches every
 * job</li>
 * <li>{@code minSeverity}: events strictly below are suppressed</li>
 * <li>{@code channels}: non-empty set of delivery channels</li>
 * <li>{@code targetOverrides}: per-channel destination replacing the sink's
 * default, e.g. a team-specific Slack webhook</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = RoutingRule.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RoutingRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the synthetic rule used when no registered rule matches. */
    public static final String DEFAULT_RULE_NAME = "__default__";

    private final String name;
    private final String jobPattern;
    private final Severity minSeverity;
    private final Set<Channel> channels;
    private final String teamName;
    private final Map<Channel, String> targetOverrides;

    private RoutingRule(Builder b) {
        this.name = b.name;
        this.jobPattern = b.jobPattern;
        this.minSeverity = b.minSeverity;
        this.channels = Collections.unmodifiableSet(EnumSet.copyOf(b.channels));
        this.teamName = b.teamName;
        this.targetOverrides = b.targetOverrides.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(b.targetOverrides));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build the fallback rule applied when nothing registered matches a job.
     *
     * @param channels    default channel set
     * @param minSeverity default severity floor
     * @return rule named {@value #DEFAULT_RULE_NAME} with no job pattern
     */
    public static RoutingRule defaultRule(Collection<Channel> channels, Severity minSeverity) {
        return builder()
                .name(DEFAULT_RULE_NAME)
                .minSeverity(minSeverity)
                .channels(channels)
                .build();
    }

    // ---------------------------------------------------------------
    // Matching
    // ---------------------------------------------------------------

    /**
     * @param jobName job to test
     * @return {@code true} if the pattern is absent or occurs in
     *         {@code jobName}, ignoring case
     */
    public boolean matchesJob(String jobName) {
        if (jobPattern == null) {
            return true;
        }
        return jobName != null
                && jobName.toLowerCase(Locale.ROOT).contains(jobPattern.toLowerCase(Locale.ROOT));
    }

    /**
     * @param severity severity of the candidate alert
     * @return {@code true} unless {@code severity} is strictly below
     *         {@link #getMinSeverity()}
     */
    public boolean passesSeverity(Severity severity) {
        return !severity.isBelow(minSeverity);
    }

    @JsonIgnore
    public boolean isDefaultRule() {
        return DEFAULT_RULE_NAME.equals(name);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonIgnore
    public Optional<String> getJobPattern() {
        return Optional.ofNullable(jobPattern);
    }

    @JsonProperty("job_pattern")
    String getJobPatternOrNull() {
        return jobPattern;
    }

    @JsonProperty("min_severity")
    public Severity getMinSeverity() {
        return minSeverity;
    }

    @JsonProperty("channels")
    public Set<Channel> getChannels() {
        return channels;
    }

    @JsonProperty("team_name")
    public String getTeamName() {
        return teamName;
    }

    @JsonIgnore
    public Map<Channel, String> getTargetOverrides() {
        return targetOverrides;
    }

    /**
     * @param channel channel whose destination is requested
     * @return the override for {@code channel}, or empty to use the sink default
     */
    public Optional<String> targetFor(Channel channel) {
        return Optional.ofNullable(targetOverrides.get(channel));
    }

    @JsonProperty("target_overrides")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, String> getTargetOverridesByName() {
        Map<String, String> byName = new LinkedHashMap<>();
        targetOverrides.forEach((channel, target) -> byName.put(channel.wireName(), target));
        return byName;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RoutingRule}.
     *
     * <p>
     * Defaults: {@code minSeverity = LOW}, {@code channels = {SLACK}}.
     * {@link #build()} validates every field and reports all problems in one
     * {@link ValidationException}.
     * </p>
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String name;
        private String jobPattern;
        private Severity minSeverity = Severity.LOW;
        private final Set<Channel> channels = EnumSet.noneOf(Channel.class);
        private boolean channelsSet;
        private String teamName;
        private final Map<Channel, String> targetOverrides = new EnumMap<>(Channel.class);

        @JsonProperty("name")
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * @param jobPattern substring to match; {@code null} or blank matches all
         *                   jobs
         */
        @JsonProperty("job_pattern")
        public Builder jobPattern(String jobPattern) {
            this.jobPattern = jobPattern == null || jobPattern.isBlank() ? null : jobPattern.trim();
            return this;
        }

        @JsonProperty("min_severity")
        public Builder minSeverity(Severity minSeverity) {
            this.minSeverity = minSeverity;
            return this;
        }

        @JsonProperty("channels")
        public Builder channels(Collection<Channel> channels) {
            this.channels.clear();
            this.channelsSet = true;
            if (channels != null) {
                channels.forEach(c -> this.channels.add(
                        Objects.requireNonNull(c, "channel must not be null")));
            }
            return this;
        }

        public Builder channel(Channel channel) {
            if (!channelsSet) {
                this.channels.clear();
                this.channelsSet = true;
            }
            this.channels.add(Objects.requireNonNull(channel, "channel must not be null"));
            return this;
        }

        @JsonProperty("team_name")
        public Builder teamName(String teamName) {
            this.teamName = teamName;
            return this;
        }

        public Builder targetOverride(Channel channel, String target) {
            this.targetOverrides.put(Objects.requireNonNull(channel, "channel must not be null"), target);
            return this;
        }

        @JsonProperty("target_overrides")
        public Builder targetOverrides(Map<String, String> overrides) {
            this.targetOverrides.clear();
            if (overrides != null) {
                overrides.forEach((channel, target) -> targetOverride(Channel.parse(channel), target));
            }
            return this;
        }

        /**
         * Validate and build the rule.
         *
         * @return a new immutable rule
         * @throws ValidationException if any field is missing or inconsistent
         */
        public RoutingRule build() {
            if (!channelsSet) {
                channels.add(Channel.SLACK);
                channelsSet = true;
            }

            List<String> errors = new ArrayList<>();
            if (name == null || name.isBlank()) {
                errors.add("Rule 'name' is required");
            }
            if (minSeverity == null) {
                errors.add("Rule '" + name + "' requires 'min_severity'");
            }
            if (channels.isEmpty()) {
                errors.add("Rule '" + name + "' requires at least one channel");
            }
            targetOverrides.forEach((channel, target) -> {
                if (target == null || target.isBlank()) {
                    errors.add("Rule '" + name + "' has a blank override for channel '"
                            + channel.wireName() + "'");
                } else if (!channels.contains(channel)) {
                    errors.add("Rule '" + name + "' overrides channel '" + channel.wireName()
                            + "' which is not one of its channels");
                }
            });

            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid RoutingRule: " + String.join("; ", errors));
            }
            return new RoutingRule(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RoutingRule that))
            return false;
        return name.equals(that.name)
                && Objects.equals(jobPattern, that.jobPattern)
                && minSeverity == that.minSeverity
                && channels.equals(that.channels)
                && Objects.equals(teamName, that.teamName)
                && targetOverrides.equals(that.targetOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, jobPattern, minSeverity, channels, teamName, targetOverrides);
    }

    @Override
    public String toString() {
        return "RoutingRule{" +
                "name='" + name + '\'' +
                ", jobPattern='" + jobPattern + '\'' +
                ", minSeverity=" + minSeverity +
                ", channels=" + channels +
                ", teamName='" + teamName + '\'' +
                ", overrides=" + targetOverrides.keySet() +
                '}';
    }
}
