package com.buildsentinel.service;

import com.buildsentinel.core.config.AlertingConfig;
import com.buildsentinel.core.config.AlertingConfigLoader;
import com.buildsentinel.core.delivery.AlertSink;
import com.buildsentinel.core.delivery.Dispatcher;
import com.buildsentinel.core.delivery.MessageRenderer;
import com.buildsentinel.core.engine.AlertEngine;
import com.buildsentinel.core.engine.EngineSettings;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.json.JsonMappers;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.state.InMemoryStateStore;
import com.buildsentinel.core.state.JsonFileStateStore;
import com.buildsentinel.core.state.StateStore;
import com.buildsentinel.service.sink.EmailSink;
import com.buildsentinel.service.sink.SlackSink;
import com.buildsentinel.service.sink.WebhookSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the Build Sentinel alert service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   POST /anomalies
 *     → AnomalyEventReader (JSON → AnomalyEvent)
 *     → AlertEngine (maintenance, routing, dedup, severity, rate limit)
 *     → batch per rule, flushed on deadline or by the periodic sweep
 *     → Dispatcher → Slack / email / webhook sinks
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Engine tuning, rules and maintenance windows come from {@code alerting.yml}
 * via {@link AlertingConfigLoader}; process settings (port, state file, sink
 * endpoints) from environment variables via {@link ServiceConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BuildSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(BuildSentinelService.class);

    private BuildSentinelService() {
        // entry point, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Build Sentinel with config: {}", config);
        AlertingConfig alerting = AlertingConfigLoader.load();
        EngineSettings settings = alerting.toEngineSettings();

        // 2. Delivery
        Clock clock = Clock.systemUTC();
        Dispatcher dispatcher = new Dispatcher(buildSinks(config, settings.getSinkTimeout(), clock),
                new MessageRenderer(), settings.getSinkTimeout());

        // 3. Engine with its timer thread
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alert-scheduler");
            t.setDaemon(true);
            return t;
        });
        AlertEngine engine = new AlertEngine(settings, clock, stateStore(config), dispatcher, scheduler);
        registerConfiguredRules(engine, alerting.toRoutingRules());
        registerConfiguredWindows(engine, alerting.toMaintenanceWindows());

        // 4. Periodic sweep for batches whose timer was lost (e.g. after restart)
        scheduler.scheduleAtFixedRate(() -> {
            try {
                engine.flushDue();
            } catch (RuntimeException e) {
                LOG.error("Periodic flush failed: {}", e.getMessage(), e);
            }
        }, config.getFlushIntervalSeconds(), config.getFlushIntervalSeconds(), TimeUnit.SECONDS);

        // 5. Status and ingest server
        StatusServer statusServer = new StatusServer(engine, new AnomalyEventReader(clock));
        statusServer.start(config.getHttpPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Build Sentinel");
            statusServer.stop();
            engine.close();
            scheduler.shutdownNow();
            dispatcher.close();
        }, "sentinel-shutdown"));
    }

    // ---------------------------------------------------------------
    // Assembly (package-private for tests)
    // ---------------------------------------------------------------

    static List<AlertSink> buildSinks(ServiceConfig config, Duration timeout, Clock clock) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        ObjectMapper mapper = JsonMappers.lenient();
        return List.of(
                new SlackSink(config.getSlackWebhookUrl(), httpClient, mapper, timeout),
                new WebhookSink(config.getWebhookUrl(), httpClient, mapper, timeout, clock),
                new EmailSink(config.getSmtpHost(), config.getSmtpPort(), config.getSmtpUser(),
                        config.getSmtpPassword(), config.getAlertEmail(), timeout));
    }

    static StateStore stateStore(ServiceConfig config) {
        String stateFile = config.getStateFile();
        if (stateFile == null) {
            LOG.warn("STATE_FILE not set; dedup and rate-limit history will not survive a restart");
            return new InMemoryStateStore();
        }
        return new JsonFileStateStore(Path.of(stateFile));
    }

    /**
     * Register rules from {@code alerting.yml}. A rule already restored from
     * the state file keeps its persisted definition.
     */
    static void registerConfiguredRules(AlertEngine engine, List<RoutingRule> rules) {
        for (RoutingRule rule : rules) {
            if (engine.hasRule(rule.getName())) {
                LOG.info("Rule '{}' restored from state, keeping persisted definition", rule.getName());
                continue;
            }
            engine.addRule(rule);
        }
    }

    static void registerConfiguredWindows(AlertEngine engine, List<MaintenanceWindow> windows) {
        for (MaintenanceWindow window : windows) {
            try {
                engine.addMaintenanceWindow(window);
            } catch (ValidationException e) {
                LOG.info("Skipping configured maintenance window '{}': {}", window.getName(), e.getMessage());
            }
        }
    }
}
