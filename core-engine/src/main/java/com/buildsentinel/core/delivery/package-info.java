/**
 * Outbound side of the engine: rendering and per-channel delivery.
 *
 * <p>
 * Implement {@link com.buildsentinel.core.delivery.AlertSink} once per
 * channel and hand the sinks to a
 * {@link com.buildsentinel.core.delivery.Dispatcher}. Sinks signal failure with
 * {@link com.buildsentinel.core.delivery.DeliveryException}; the dispatcher
 * logs it, reports it and moves on.
 * </p>
 *
 * @since 1.0.0
 */
package com.buildsentinel.core.delivery;
