package com.buildsentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of delivering one message to one channel.
 *
 * @since 1.0.0
 */
public final class DeliveryResult {

    private final Channel channel;
    private final boolean success;
    private final String error;

    private DeliveryResult(Channel channel, boolean success, String error) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.success = success;
        this.error = error;
    }

    public static DeliveryResult ok(Channel channel) {
        return new DeliveryResult(channel, true, null);
    }

    public static DeliveryResult failed(Channel channel, String reason) {
        return new DeliveryResult(channel, false, reason != null ? reason : "unknown error");
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return success ? channel.wireName() + ":ok" : channel.wireName() + ":error(" + error + ")";
    }
}
