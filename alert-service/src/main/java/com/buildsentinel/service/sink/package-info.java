/**
 * Channel implementations of
 * {@link com.buildsentinel.core.delivery.AlertSink}: Slack and generic
 * webhooks over {@link java.net.http.HttpClient}, email over Jakarta Mail.
 *
 * @since 1.0.0
 */
package com.buildsentinel.service.sink;
