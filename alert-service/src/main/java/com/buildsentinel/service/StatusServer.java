package com.buildsentinel.service;

import com.buildsentinel.core.engine.AlertEngine;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.json.JsonMappers;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.BatchDelivery;
import com.buildsentinel.core.model.DeliveryResult;
import com.buildsentinel.core.model.SubmitResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing health checks, engine statistics and an
 * ingest endpoint for anomaly records.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness}: {@code {"status":"UP"}}</li>
 * <li>{@code GET /stats}: engine counters as JSON</li>
 * <li>{@code POST /anomalies[?force=true]}: submit one record or an array;
 * answers with one decision per record</li>
 * <li>{@code POST /flush}: deliver every pending batch now</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no servlet container is needed.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final AlertEngine engine;
    private final AnomalyEventReader reader;
    private final ObjectMapper mapper = JsonMappers.lenient();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StatusServer(AlertEngine engine, AnomalyEventReader reader) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", get(StatusServer::handleHealthCheck));
            server.createContext("/readiness", get(StatusServer::handleHealthCheck));
            server.createContext("/stats", get(this::handleStats));
            server.createContext("/anomalies", post(this::handleAnomalies));
            server.createContext("/flush", post(this::handleFlush));

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start status server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Status server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} when not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Method guards
    // ---------------------------------------------------------------

    private static HttpHandler get(HttpHandler delegate) {
        return methodGuard("GET", delegate);
    }

    private static HttpHandler post(HttpHandler delegate) {
        return methodGuard("POST", delegate);
    }

    private static HttpHandler methodGuard(String method, HttpHandler delegate) {
        return exchange -> {
            try {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    respond(exchange, 405, errorBody("Method not allowed, use " + method));
                    return;
                }
                delegate.handle(exchange);
            } catch (RuntimeException e) {
                LOG.error("Unhandled error on {} {}: {}",
                        exchange.getRequestMethod(), exchange.getRequestURI(), e.getMessage(), e);
                respond(exchange, 500, errorBody("Internal error"));
            }
        };
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        respond(exchange, 200, mapper.writeValueAsBytes(engine.stats()));
    }

    private void handleAnomalies(HttpExchange exchange) throws IOException {
        boolean force = isForced(exchange.getRequestURI().getRawQuery());
        List<AnomalyEvent> events;
        try (InputStream in = exchange.getRequestBody()) {
            events = reader.read(in.readAllBytes());
        } catch (ValidationException e) {
            LOG.warn("Rejected anomaly payload: {}", e.getMessage());
            respond(exchange, 400, errorBody(e.getMessage()));
            return;
        }

        List<SubmitResult> results = new ArrayList<>(events.size());
        for (AnomalyEvent event : events) {
            results.add(engine.submit(event, force));
        }
        respond(exchange, 200, mapper.writeValueAsBytes(Map.of("results", results)));
    }

    private void handleFlush(HttpExchange exchange) throws IOException {
        List<Map<String, Object>> batches = new ArrayList<>();
        for (BatchDelivery delivery : engine.flushNow()) {
            Map<String, Object> batch = new LinkedHashMap<>();
            batch.put("rule", delivery.getBatch().getKey().getRuleName());
            batch.put("events", delivery.getBatch().size());
            batch.put("state", delivery.getState().reason());
            List<Map<String, Object>> channels = new ArrayList<>();
            for (DeliveryResult result : delivery.getResults()) {
                Map<String, Object> channel = new LinkedHashMap<>();
                channel.put("channel", result.getChannel());
                channel.put("success", result.isSuccess());
                result.getError().ifPresent(error -> channel.put("error", error));
                channels.add(channel);
            }
            batch.put("channels", channels);
            batches.add(batch);
        }
        respond(exchange, 200, mapper.writeValueAsBytes(Map.of("flushed", batches)));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static boolean isForced(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return false;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.equalsIgnoreCase("force=true") || pair.equalsIgnoreCase("force")) {
                return true;
            }
        }
        return false;
    }

    private static byte[] errorBody(String message) {
        try {
            return JsonMappers.lenient().writeValueAsBytes(Map.of("error", message));
        } catch (IOException e) {
            return "{\"error\":\"unserializable\"}".getBytes(StandardCharsets.UTF_8);
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
