package com.buildsentinel.core.engine;

import com.buildsentinel.core.delivery.Dispatcher;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.Severity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable tuning of the alert engine.
 *
 * <p>
 * Defaults: 60 s batch window, 5 min dedup window, 20 alerts per hour, default
 * route to Slack with a {@code medium} severity floor, 5 s per-sink timeout.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineSettings {

    private final Duration batchWindow;
    private final Duration dedupWindow;
    private final int maxAlertsPerHour;
    private final Duration rateWindow;
    private final Set<Channel> defaultChannels;
    private final Severity defaultMinSeverity;
    private final Duration sinkTimeout;

    private EngineSettings(Builder b) {
        this.batchWindow = b.batchWindow;
        this.dedupWindow = b.dedupWindow;
        this.maxAlertsPerHour = b.maxAlertsPerHour;
        this.rateWindow = b.rateWindow;
        this.defaultChannels = Collections.unmodifiableSet(EnumSet.copyOf(b.defaultChannels));
        this.defaultMinSeverity = b.defaultMinSeverity;
        this.sinkTimeout = b.sinkTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public Duration getBatchWindow() {
        return batchWindow;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public Set<Channel> getDefaultChannels() {
        return defaultChannels;
    }

    public Severity getDefaultMinSeverity() {
        return defaultMinSeverity;
    }

    public Duration getSinkTimeout() {
        return sinkTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineSettings}. {@link #build()} validates
     * every value and reports all problems at once.
     */
    public static class Builder {
        private Duration batchWindow = Duration.ofSeconds(60);
        private Duration dedupWindow = Duration.ofMinutes(5);
        private int maxAlertsPerHour = 20;
        private Duration rateWindow = RateLimiter.DEFAULT_WINDOW;
        private Set<Channel> defaultChannels = EnumSet.of(Channel.SLACK);
        private Severity defaultMinSeverity = Severity.MEDIUM;
        private Duration sinkTimeout = Dispatcher.DEFAULT_SINK_TIMEOUT;

        public Builder batchWindow(Duration v) {
            this.batchWindow = v;
            return this;
        }

        public Builder dedupWindow(Duration v) {
            this.dedupWindow = v;
            return this;
        }

        public Builder maxAlertsPerHour(int v) {
            this.maxAlertsPerHour = v;
            return this;
        }

        public Builder rateWindow(Duration v) {
            this.rateWindow = v;
            return this;
        }

        public Builder defaultChannels(Collection<Channel> v) {
            this.defaultChannels = v == null || v.isEmpty()
                    ? EnumSet.noneOf(Channel.class)
                    : EnumSet.copyOf(v);
            return this;
        }

        public Builder defaultMinSeverity(Severity v) {
            this.defaultMinSeverity = v;
            return this;
        }

        public Builder sinkTimeout(Duration v) {
            this.sinkTimeout = v;
            return this;
        }

        /**
         * @return validated settings
         * @throws ValidationException if any value is out of range
         */
        public EngineSettings build() {
            List<String> errors = new ArrayList<>();
            if (batchWindow == null || batchWindow.isNegative()) {
                errors.add("batchWindow must be >= 0, got: " + batchWindow);
            }
            if (dedupWindow == null || dedupWindow.isNegative() || dedupWindow.isZero()) {
                errors.add("dedupWindow must be > 0, got: " + dedupWindow);
            }
            if (maxAlertsPerHour < 1) {
                errors.add("maxAlertsPerHour must be >= 1, got: " + maxAlertsPerHour);
            }
            if (rateWindow == null || rateWindow.isNegative() || rateWindow.isZero()) {
                errors.add("rateWindow must be > 0, got: " + rateWindow);
            }
            if (defaultChannels.isEmpty()) {
                errors.add("defaultChannels must name at least one channel");
            }
            Objects.requireNonNull(defaultMinSeverity, "defaultMinSeverity required");
            if (sinkTimeout == null || sinkTimeout.isNegative() || sinkTimeout.isZero()) {
                errors.add("sinkTimeout must be > 0, got: " + sinkTimeout);
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid engine settings: " + String.join("; ", errors));
            }
            return new EngineSettings(this);
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "batchWindow=" + batchWindow +
                ", dedupWindow=" + dedupWindow +
                ", maxAlertsPerHour=" + maxAlertsPerHour +
                ", rateWindow=" + rateWindow +
                ", defaultChannels=" + defaultChannels +
                ", defaultMinSeverity=" + defaultMinSeverity +
                ", sinkTimeout=" + sinkTimeout +
                '}';
    }
}
