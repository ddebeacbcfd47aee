package com.buildsentinel.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Destination of a batch: the routing rule together with its channel set and
 * target overrides. Two events share a buffer iff their keys are equal.
 *
 * @since 1.0.0
 */
public final class BatchKey {

    private final String ruleName;
    private final Set<Channel> channels;
    private final Map<Channel, String> targetOverrides;

    private BatchKey(RoutingRule rule) {
        this.ruleName = rule.getName();
        this.channels = rule.getChannels();
        this.targetOverrides = rule.getTargetOverrides();
    }

    /**
     * @param rule matched routing rule
     * @return key identifying the rule's destination
     */
    public static BatchKey of(RoutingRule rule) {
        return new BatchKey(Objects.requireNonNull(rule, "rule must not be null"));
    }

    public String getRuleName() {
        return ruleName;
    }

    public Set<Channel> getChannels() {
        return channels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BatchKey that))
            return false;
        return ruleName.equals(that.ruleName)
                && channels.equals(that.channels)
                && targetOverrides.equals(that.targetOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, channels, targetOverrides);
    }

    @Override
    public String toString() {
        return ruleName + channels.stream()
                .map(Channel::wireName)
                .collect(Collectors.joining(",", "[", "]"));
    }
}
