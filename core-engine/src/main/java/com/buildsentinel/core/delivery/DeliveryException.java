package com.buildsentinel.core.delivery;

import com.buildsentinel.core.model.Channel;

/**
 * Raised by an {@link AlertSink} when a message could not be delivered.
 *
 * <p>
 * Checked on purpose: the {@link Dispatcher} must catch it per channel so a
 * failing sink never aborts delivery to the others.
 * </p>
 *
 * @since 1.0.0
 */
public class DeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Channel channel;

    public DeliveryException(Channel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public DeliveryException(Channel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }
}
