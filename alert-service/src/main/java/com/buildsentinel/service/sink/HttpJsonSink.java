package com.buildsentinel.service.sink;

import com.buildsentinel.core.delivery.AlertSink;
import com.buildsentinel.core.delivery.DeliveryException;
import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.Channel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Base for sinks that POST a JSON document to an HTTP endpoint.
 *
 * <p>
 * The destination is the per-rule target when one is given, otherwise the
 * configured default URL. Any 2xx response counts as delivered; everything
 * else, including I/O errors and request timeouts, raises
 * {@link DeliveryException}. Nothing is retried here.
 * </p>
 *
 * @since 1.0.0
 */
abstract class HttpJsonSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(HttpJsonSink.class);

    private final Channel channel;
    private final String defaultUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    HttpJsonSink(Channel channel, String defaultUrl, HttpClient httpClient, ObjectMapper mapper,
                 Duration requestTimeout) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.defaultUrl = defaultUrl == null || defaultUrl.isBlank() ? null : defaultUrl.trim();
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    /**
     * @return the JSON document to post for {@code message}
     */
    protected abstract Map<String, Object> payload(AlertMessage message);

    @Override
    public Channel channel() {
        return channel;
    }

    @Override
    public void send(String target, AlertMessage message) throws DeliveryException {
        String url = target != null && !target.isBlank() ? target.trim() : defaultUrl;
        if (url == null) {
            throw new DeliveryException(channel, "No " + channel.wireName() + " URL configured");
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload(message))))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DeliveryException(channel, "Cannot build " + channel.wireName() + " request: "
                    + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException(channel, channel.wireName() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(channel, channel.wireName() + " request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DeliveryException(channel, channel.wireName() + " endpoint answered HTTP " + status
                    + ": " + abbreviate(response.body()));
        }
        LOG.debug("{} alert '{}' accepted with HTTP {}", channel.wireName(), message.getSubject(), status);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
