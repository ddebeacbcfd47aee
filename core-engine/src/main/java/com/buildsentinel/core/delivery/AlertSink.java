package com.buildsentinel.core.delivery;

import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.Channel;

/**
 * Narrow send contract implemented once per channel kind.
 *
 * <p>
 * The engine depends on nothing but this interface; transport details (HTTP,
 * SMTP) stay in the implementations. Implementations may block and are called
 * from the {@link Dispatcher}'s worker threads, never under the engine lock.
 * </p>
 */
public interface AlertSink {

    /**
     * @return the channel this sink serves
     */
    Channel channel();

    /**
     * Deliver a rendered message.
     *
     * @param target  destination override from the routing rule (webhook URL,
     *                e-mail address), or {@code null} for the sink's configured
     *                default
     * @param message rendered message
     * @throws DeliveryException if the message was not accepted by the remote
     *                           end
     */
    void send(String target, AlertMessage message) throws DeliveryException;
}
