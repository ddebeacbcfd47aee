package com.buildsentinel.core.engine;

import com.buildsentinel.core.delivery.AlertSink;
import com.buildsentinel.core.delivery.DeliveryException;
import com.buildsentinel.core.delivery.Dispatcher;
import com.buildsentinel.core.delivery.MessageRenderer;
import com.buildsentinel.core.error.NotFoundException;
import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.AlertState;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.BatchDelivery;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.EngineStats;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;
import com.buildsentinel.core.model.SubmitResult;
import com.buildsentinel.core.state.InMemoryStateStore;
import com.buildsentinel.core.state.StateSnapshot;
import com.buildsentinel.core.state.StateStore;
import com.buildsentinel.core.state.StateStoreException;
import com.buildsentinel.core.support.MutableClock;
import com.buildsentinel.core.support.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;

import static com.buildsentinel.core.support.TestEvents.T0;
import static com.buildsentinel.core.support.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AlertEngine}.
 */
class AlertEngineTest {

    private MutableClock clock;
    private InMemoryStateStore store;
    private RecordingSink slack;
    private RecordingSink email;
    private Dispatcher dispatcher;
    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryStateStore();
        slack = new RecordingSink(Channel.SLACK);
        email = new RecordingSink(Channel.EMAIL);
        dispatcher = new Dispatcher(List.of(slack, email), new MessageRenderer(), Duration.ofSeconds(2));
        engine = newEngine(settings().build(), store, null);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should suppress the same job and feature set inside the dedup window")
    void shouldSuppressDuplicate() {
        SubmitResult first = engine.submit(event("deploy-prod", Severity.HIGH, "duration"));
        clock.advance(Duration.ofMinutes(4));
        SubmitResult second = engine.submit(event("deploy-prod", Severity.CRITICAL, "duration"));

        assertThat(first.getState()).isEqualTo(AlertState.BATCHED);
        assertThat(first.getReason()).isEqualTo("queued_in_batch");
        assertThat(second.getState()).isEqualTo(AlertState.SUPPRESSED_DUPLICATE);
        assertThat(second.getReason()).isEqualTo("duplicate");
        assertThat(second.getFingerprint()).isEqualTo(first.getFingerprint());
    }

    @Test
    @DisplayName("Should accept the same anomaly again once the dedup window has passed")
    void shouldAcceptAfterDedupWindow() {
        engine.submit(event("deploy-prod", Severity.HIGH, "duration"));
        clock.advance(Duration.ofMinutes(5));

        assertThat(engine.submit(event("deploy-prod", Severity.HIGH, "duration")).isAccepted()).isTrue();
    }

    @Test
    @DisplayName("Should not remember the fingerprint of an event dropped by the severity gate")
    void shouldNotRecordFingerprintOfSeveritySuppressedEvent() {
        engine.addRule(rule("deploys", "deploy", Severity.HIGH, Channel.SLACK));

        SubmitResult low = engine.submit(event("deploy-prod", Severity.MEDIUM, "duration"));
        SubmitResult high = engine.submit(event("deploy-prod", Severity.CRITICAL, "duration"));

        assertThat(low.getState()).isEqualTo(AlertState.SUPPRESSED_SEVERITY);
        assertThat(high.getState()).isEqualTo(AlertState.BATCHED);
    }

    @Test
    @DisplayName("Should refuse the (N+1)-th alert in an hour and recover when the oldest ages out")
    void shouldRateLimit() {
        engine = newEngine(settings().maxAlertsPerHour(3).build(), store, null);

        for (int i = 0; i < 3; i++) {
            assertThat(engine.submit(event("job-" + i, Severity.HIGH)).isAccepted()).isTrue();
            clock.advance(Duration.ofMinutes(1));
        }
        SubmitResult limited = engine.submit(event("job-3", Severity.HIGH));

        assertThat(limited.getState()).isEqualTo(AlertState.SUPPRESSED_RATE_LIMIT);
        assertThat(limited.getReason()).isEqualTo("rate_limit");

        clock.set(T0.plus(Duration.ofHours(1)));
        assertThat(engine.submit(event("job-3", Severity.HIGH)).isAccepted()).isTrue();
    }

    @Test
    @DisplayName("Should suppress every job during a window without affected jobs until exactly its end")
    void shouldSuppressDuringMaintenance() {
        engine.addMaintenanceWindow(new MaintenanceWindow("upgrade",
                T0.plusSeconds(600), T0.plusSeconds(3600), List.of()));

        assertThat(engine.submit(event("build-ui", Severity.HIGH)).isAccepted()).isTrue();

        clock.set(T0.plusSeconds(600));
        SubmitResult during = engine.submit(event("deploy-prod", Severity.CRITICAL));
        assertThat(during.getState()).isEqualTo(AlertState.SUPPRESSED_MAINTENANCE);
        assertThat(during.getReason()).isEqualTo("maintenance_window");
        assertThat(engine.listActiveMaintenanceWindows()).hasSize(1);

        clock.set(T0.plusSeconds(3600));
        assertThat(engine.submit(event("deploy-prod", Severity.CRITICAL)).isAccepted()).isTrue();
        assertThat(engine.listActiveMaintenanceWindows()).isEmpty();
    }

    @Test
    @DisplayName("Should route by the first matching rule and gate on its severity floor")
    void shouldRouteAndGateSeverity() {
        engine.addRule(rule("A", "deploy", Severity.HIGH, Channel.SLACK));
        engine.addRule(rule("everything", null, Severity.LOW, Channel.SLACK));

        SubmitResult deploy = engine.submit(event("deploy-prod", Severity.MEDIUM));
        SubmitResult build = engine.submit(event("build-ui", Severity.LOW));

        assertThat(deploy.getState()).isEqualTo(AlertState.SUPPRESSED_SEVERITY);
        assertThat(deploy.getReason()).isEqualTo("below_severity_threshold");
        assertThat(deploy.getRuleName()).isEqualTo("A");
        assertThat(build.getState()).isEqualTo(AlertState.BATCHED);
        assertThat(build.getRuleName()).isEqualTo("everything");
    }

    @Test
    @DisplayName("Should apply the default severity floor when no rule matches")
    void shouldApplyDefaultFloor() {
        engine = newEngine(settings().defaultMinSeverity(Severity.MEDIUM).build(), store, null);

        SubmitResult result = engine.submit(event("build-ui", Severity.LOW));

        assertThat(result.getState()).isEqualTo(AlertState.SUPPRESSED_SEVERITY);
        assertThat(result.getRuleName()).isEqualTo(RoutingRule.DEFAULT_RULE_NAME);
    }

    @Test
    @DisplayName("Should let a forced event through maintenance without touching dedup state")
    void shouldBypassSuppressionWhenForced() {
        engine.addMaintenanceWindow(new MaintenanceWindow("freeze", T0, T0.plusSeconds(60), List.of()));

        SubmitResult forced = engine.submit(event("deploy-prod", Severity.LOW, "duration"), true);
        assertThat(forced.getState()).isEqualTo(AlertState.BATCHED);
        assertThat(forced.isForced()).isTrue();

        clock.advance(Duration.ofSeconds(60));
        SubmitResult later = engine.submit(event("deploy-prod", Severity.HIGH, "duration"));
        assertThat(later.getState()).isEqualTo(AlertState.BATCHED);
        assertThat(engine.stats().getForced()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Flushing
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should deliver three events of one key as a single grouped message")
    void shouldGroupThreeEvents() {
        engine.submit(event("build-ui", Severity.HIGH));
        engine.submit(event("build-api", Severity.HIGH));
        engine.submit(event("deploy-prod", Severity.CRITICAL));

        List<BatchDelivery> deliveries = engine.flushNow();

        assertThat(deliveries).hasSize(1);
        assertThat(deliveries.get(0).getState()).isEqualTo(AlertState.SENT);
        assertThat(slack.messages()).hasSize(1);
        AlertMessage message = slack.messages().get(0);
        assertThat(message.isGrouped()).isTrue();
        assertThat(message.getSubject()).isEqualTo("CI/CD Anomaly Alert - 3 anomalies");
        assertThat(message.getText()).startsWith(":rotating_light: *3 Anomalies Detected");
    }

    @Test
    @DisplayName("Should deliver a lone event with the single-alert format")
    void shouldRenderSingleEvent() {
        engine.submit(event("build-ui", Severity.HIGH, "duration"));

        engine.flushNow();

        AlertMessage message = slack.messages().get(0);
        assertThat(message.isGrouped()).isFalse();
        assertThat(message.getSubject()).isEqualTo("CI/CD Anomaly Alert - build-ui");
        assertThat(message.getText()).contains("*Job/Workflow:* build-ui");
    }

    @Test
    @DisplayName("Should flush a batch only once its window has elapsed")
    void shouldFlushDueBatches() {
        engine.submit(event("build-ui", Severity.HIGH));

        clock.advance(Duration.ofSeconds(59));
        assertThat(engine.flushDue()).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        assertThat(engine.flushDue()).hasSize(1);
        assertThat(engine.stats().getPendingInBatch()).isZero();
    }

    @Test
    @DisplayName("Should send to each channel of the rule with its target override")
    void shouldFanOutToRuleChannels() {
        engine.addRule(RoutingRule.builder()
                .name("platform")
                .jobPattern("deploy")
                .channel(Channel.SLACK)
                .channel(Channel.EMAIL)
                .targetOverride(Channel.EMAIL, "platform@example.com")
                .build());
        engine.submit(event("deploy-prod", Severity.HIGH));

        engine.flushNow();

        assertThat(slack.targets()).containsExactly((String) null);
        assertThat(email.targets()).containsExactly("platform@example.com");
    }

    @Test
    @DisplayName("Should count a batch as sent when at least one channel succeeds")
    void shouldCountPartialDeliveryAsSent() {
        engine.addRule(rule("both", null, Severity.LOW, Channel.SLACK, Channel.EMAIL));
        email.setFailing(true);
        engine.submit(event("build-ui", Severity.HIGH));
        engine.submit(event("build-api", Severity.HIGH));

        BatchDelivery delivery = engine.flushNow().get(0);

        assertThat(delivery.getResults()).hasSize(2);
        assertThat(delivery.getState()).isEqualTo(AlertState.SENT);
        EngineStats stats = engine.stats();
        assertThat(stats.getTotalSent()).isEqualTo(2);
        assertThat(stats.getMessagesSent()).isEqualTo(1);
        assertThat(stats.getDeliveryFailed()).isZero();
    }

    @Test
    @DisplayName("Should count every event as failed when all channels fail")
    void shouldCountDeliveryFailure() {
        slack.setFailing(true);
        engine.submit(event("build-ui", Severity.HIGH));
        engine.submit(event("build-api", Severity.HIGH));

        BatchDelivery delivery = engine.flushNow().get(0);

        assertThat(delivery.getState()).isEqualTo(AlertState.DELIVERY_FAILED);
        assertThat(delivery.getResults().get(0).getError()).hasValueSatisfying(
                error -> assertThat(error).contains("unavailable"));
        assertThat(engine.stats().getDeliveryFailed()).isEqualTo(2);
        assertThat(engine.stats().getTotalSent()).isZero();
    }

    @Test
    @DisplayName("Should keep counters reconciled with the number of received events")
    void shouldReconcileCounters() {
        engine = newEngine(settings().maxAlertsPerHour(4).build(), store, null);
        engine.addRule(rule("deploys", "deploy", Severity.HIGH, Channel.SLACK));
        engine.addMaintenanceWindow(new MaintenanceWindow("db", T0, T0.plusSeconds(10), List.of("db-migrate")));

        engine.submit(event("db-migrate", Severity.HIGH));
        engine.submit(event("deploy-prod", Severity.LOW));
        engine.submit(event("build-ui", Severity.HIGH, "duration"));
        engine.submit(event("build-ui", Severity.HIGH, "duration"));
        for (int i = 0; i < 5; i++) {
            engine.submit(event("test-" + i, Severity.MEDIUM));
        }
        engine.submit(event("deploy-prod", Severity.CRITICAL), true);

        assertReconciled(engine.stats());
        assertThat(engine.stats().getPendingInBatch()).isEqualTo(5);

        slack.setFailing(true);
        engine.flushNow();

        EngineStats stats = engine.stats();
        assertReconciled(stats);
        assertThat(stats.getTotalReceived()).isEqualTo(10);
        assertThat(stats.getSuppressedMaintenance()).isEqualTo(1);
        assertThat(stats.getSuppressedSeverity()).isEqualTo(1);
        assertThat(stats.getSuppressedDuplicate()).isEqualTo(1);
        assertThat(stats.getSuppressedRateLimit()).isEqualTo(2);
        assertThat(stats.getDeliveryFailed()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should deliver a batch from its timer without an explicit flush")
    void shouldFlushOnTimer() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            engine = newEngine(settings().batchWindow(Duration.ofMillis(100)).build(), store, scheduler);
            engine.submit(event("build-ui", Severity.HIGH));
            engine.submit(event("build-api", Severity.HIGH));

            await().atMost(Duration.ofSeconds(3)).until(() -> slack.messages().size() == 1);
            await().atMost(Duration.ofSeconds(3)).until(() -> engine.stats().getTotalSent() == 2);
            assertThat(slack.messages().get(0).getEvents()).hasSize(2);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should flush open batches on close")
    void shouldFlushOnClose() {
        engine.submit(event("build-ui", Severity.HIGH));

        engine.close();

        assertThat(slack.messages()).hasSize(1);
        assertThat(engine.stats().getPendingInBatch()).isZero();
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should accept exactly one of many identical events submitted from several threads")
    void shouldDeduplicateConcurrentSubmissions() throws Exception {
        int submissions = 200;

        List<SubmitResult> results = submitConcurrently(submissions,
                i -> event("deploy-prod", Severity.HIGH, "duration"),
                i -> {
                    engine.addRule(rule("nightly-" + i, "nightly-" + i, Severity.LOW, Channel.EMAIL));
                    engine.flushNow();
                    engine.removeRule("nightly-" + i);
                });

        assertThat(results).filteredOn(r -> r.getState() == AlertState.BATCHED).hasSize(1);
        assertThat(results).filteredOn(r -> r.getState() == AlertState.SUPPRESSED_DUPLICATE)
                .hasSize(submissions - 1);
        engine.flushNow();
        assertThat(slack.messages()).hasSize(1);
        assertReconciled(engine.stats());
    }

    @Test
    @DisplayName("Should never exceed the hourly cap when distinct events race")
    void shouldHoldRateCapUnderConcurrency() throws Exception {
        int cap = 10;
        int submissions = 100;
        engine = newEngine(settings().maxAlertsPerHour(cap).build(), store, null);

        List<SubmitResult> results = submitConcurrently(submissions,
                i -> event("job-" + i, Severity.HIGH),
                i -> {
                    engine.addMaintenanceWindow(new MaintenanceWindow("reindex-" + i, T0,
                            T0.plusSeconds(60), List.of("search-reindex")));
                    engine.flushNow();
                    engine.removeMaintenanceWindow("reindex-" + i);
                });

        assertThat(results).filteredOn(SubmitResult::isAccepted).hasSize(cap);
        assertThat(results).filteredOn(r -> r.getState() == AlertState.SUPPRESSED_RATE_LIMIT)
                .hasSize(submissions - cap);
        EngineStats stats = engine.stats();
        assertThat(stats.getAlertsLastHour()).isEqualTo(cap);
        assertReconciled(stats);
    }

    @Test
    @DisplayName("Should count events under delivery as pending while the sink is still sending")
    void shouldCountInFlightEventsAsPending() throws Exception {
        BlockingSink blocking = new BlockingSink(Channel.SLACK);
        Dispatcher slow = new Dispatcher(List.of(blocking), new MessageRenderer(), Duration.ofSeconds(5));
        ExecutorService flusher = Executors.newSingleThreadExecutor();
        try {
            engine = new AlertEngine(settings().build(), clock, store, slow, null);
            engine.submit(event("build-ui", Severity.HIGH));
            engine.submit(event("build-api", Severity.HIGH));

            Future<List<BatchDelivery>> flush = flusher.submit(() -> engine.flushNow());
            assertThat(blocking.entered.await(3, TimeUnit.SECONDS)).isTrue();

            EngineStats during = engine.stats();
            assertThat(during.getPendingInBatch()).isEqualTo(2);
            assertReconciled(during);

            blocking.release.countDown();
            assertThat(flush.get(3, TimeUnit.SECONDS)).singleElement()
                    .extracting(BatchDelivery::getState).isEqualTo(AlertState.SENT);
            EngineStats after = engine.stats();
            assertThat(after.getPendingInBatch()).isZero();
            assertThat(after.getTotalSent()).isEqualTo(2);
            assertReconciled(after);
        } finally {
            blocking.release.countDown();
            flusher.shutdownNow();
            slow.close();
        }
    }

    // ------------------------------------------------------------------
    // Management and state
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should persist after every rule and window change")
    void shouldPersistManagementChanges() {
        int before = store.saveCount();

        engine.addRule(rule("deploys", "deploy", Severity.HIGH, Channel.SLACK));
        engine.addMaintenanceWindow(new MaintenanceWindow("db", T0, T0.plusSeconds(60), List.of()));

        assertThat(store.saveCount()).isEqualTo(before + 2);
        StateSnapshot saved = store.load().orElseThrow();
        assertThat(saved.getRules()).extracting(RoutingRule::getName).containsExactly("deploys");
        assertThat(saved.getMaintenanceWindows()).extracting(MaintenanceWindow::getName).containsExactly("db");

        assertThat(engine.removeRule("deploys").getName()).isEqualTo("deploys");
        assertThat(engine.listRules()).isEmpty();
        assertThatThrownBy(() -> engine.removeRule("deploys")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> engine.removeMaintenanceWindow("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should start empty when the state cannot be read and keep running when it cannot be saved")
    void shouldSurviveStoreFailures() {
        StateStore broken = mock(StateStore.class);
        when(broken.load()).thenThrow(new StateStoreException("corrupt", new IOException("bad json")));
        doThrow(new StateStoreException("disk full", new IOException("ENOSPC"))).when(broken).save(any());

        AlertEngine resilient = newEngine(settings().build(), broken, null);

        assertThat(resilient.submit(event("build-ui", Severity.HIGH)).isAccepted()).isTrue();
        assertThat(resilient.stats().getTotalReceived()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertEngine newEngine(EngineSettings settings, StateStore stateStore,
                                  ScheduledExecutorService scheduler) {
        return new AlertEngine(settings, clock, stateStore, dispatcher, scheduler);
    }

    private static EngineSettings.Builder settings() {
        return EngineSettings.builder().defaultMinSeverity(Severity.LOW);
    }

    private static RoutingRule rule(String name, String pattern, Severity minSeverity, Channel... channels) {
        RoutingRule.Builder builder = RoutingRule.builder()
                .name(name)
                .jobPattern(pattern)
                .minSeverity(minSeverity);
        for (Channel channel : channels) {
            builder.channel(channel);
        }
        return builder.build();
    }

    /**
     * Submits {@code count} events from four threads while a fifth thread runs
     * {@code management} in a loop, all released at the same instant.
     */
    private List<SubmitResult> submitConcurrently(int count, IntFunction<AnomalyEvent> events,
                                                  IntConsumer management) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(5);
        CountDownLatch go = new CountDownLatch(1);
        AtomicBoolean submitting = new AtomicBoolean(true);
        try {
            Future<?> manager = pool.submit(() -> {
                go.await();
                for (int i = 0; submitting.get(); i++) {
                    management.accept(i);
                }
                return null;
            });
            List<Future<SubmitResult>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                AnomalyEvent event = events.apply(i);
                futures.add(pool.submit(() -> {
                    go.await();
                    return engine.submit(event);
                }));
            }
            go.countDown();

            List<SubmitResult> results = new ArrayList<>();
            for (Future<SubmitResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            submitting.set(false);
            manager.get(10, TimeUnit.SECONDS);
            return results;
        } finally {
            submitting.set(false);
            pool.shutdownNow();
        }
    }

    private static void assertReconciled(EngineStats stats) {
        assertThat(stats.getTotalReceived()).isEqualTo(stats.getTotalSuppressed()
                + stats.getTotalSent() + stats.getDeliveryFailed() + stats.getPendingInBatch());
    }

    /**
     * Sink that blocks inside {@code send} until released.
     */
    private static final class BlockingSink implements AlertSink {

        private final Channel channel;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        BlockingSink(Channel channel) {
            this.channel = channel;
        }

        @Override
        public Channel channel() {
            return channel;
        }

        @Override
        public void send(String target, AlertMessage message) throws DeliveryException {
            entered.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new DeliveryException(channel, "never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeliveryException(channel, "interrupted", e);
            }
        }
    }
}
