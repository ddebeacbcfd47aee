package com.buildsentinel.core.engine;

import com.buildsentinel.core.delivery.Dispatcher;
import com.buildsentinel.core.model.AlertBatch;
import com.buildsentinel.core.model.AlertCounters;
import com.buildsentinel.core.model.AlertState;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.BatchDelivery;
import com.buildsentinel.core.model.BatchKey;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.DeliveryResult;
import com.buildsentinel.core.model.EngineStats;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;
import com.buildsentinel.core.model.SubmitResult;
import com.buildsentinel.core.state.StateSnapshot;
import com.buildsentinel.core.state.StateStore;
import com.buildsentinel.core.state.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Decides, for every incoming anomaly event, whether it is suppressed or queued
 * for delivery, and flushes queued batches to their channels.
 *
 * <h3>Pipeline</h3>
 * <p>
 * {@link #submit(AnomalyEvent)} runs, in order: maintenance check, rule match,
 * duplicate check, severity gate, rate limit, enqueue. The first stage that
 * rejects the event determines its {@link AlertState}. A fingerprint and a rate
 * slot are only consumed by events that reach the batch buffer.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * One {@link ReentrantLock} serializes the pipeline and every management call.
 * Flushing drains under the lock, delivers without it, and reacquires it to
 * update counters and persist. {@code submit} never performs network I/O.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * State is loaded once at construction and saved after every mutation. Store
 * failures are logged and never propagate.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final EngineSettings settings;
    private final Clock clock;
    private final StateStore stateStore;
    private final Dispatcher dispatcher;

    private final MaintenanceRegistry maintenance = new MaintenanceRegistry();
    private final Deduplicator deduplicator = new Deduplicator();
    private final RateLimiter rateLimiter;
    private final Router router;
    private final BatchAggregator batches;
    private final AlertCounters counters;

    /** Events drained from their buffer whose delivery outcome is not yet recorded. */
    private int inFlight;

    private volatile boolean closed;

    /**
     * @param settings   validated engine tuning
     * @param clock      time source for every window decision
     * @param stateStore snapshot persistence
     * @param dispatcher channel fan-out used by flushes
     * @param scheduler  executor for batch deadline timers; {@code null} means
     *                   batches only flush through {@link #flushDue()} or
     *                   {@link #flushNow()}
     */
    public AlertEngine(EngineSettings settings, Clock clock, StateStore stateStore,
                       Dispatcher dispatcher, ScheduledExecutorService scheduler) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.rateLimiter = new RateLimiter(settings.getRateWindow());
        this.router = new Router(RoutingRule.defaultRule(
                settings.getDefaultChannels(), settings.getDefaultMinSeverity()));
        this.batches = new BatchAggregator(settings.getBatchWindow(), scheduler, this::onBatchDeadline);

        Optional<StateSnapshot> restored = loadSnapshot();
        this.counters = restored.map(StateSnapshot::getStats).orElseGet(AlertCounters::new);
        restored.ifPresent(this::applySnapshot);

        LOG.info("AlertEngine started with {} ({} rules, {} maintenance windows restored)",
                settings, router.size(), maintenance.size());
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    /**
     * Run the decision pipeline for one event.
     *
     * @param event the anomaly to decide on
     * @return the decision; {@link AlertState#BATCHED} when queued
     */
    public SubmitResult submit(AnomalyEvent event) {
        return submit(event, false);
    }

    /**
     * Run the decision pipeline, or with {@code force} skip every suppression
     * stage and queue the event directly. A forced event leaves dedup and
     * rate-limit state untouched.
     */
    public SubmitResult submit(AnomalyEvent event, boolean force) {
        Objects.requireNonNull(event, "event must not be null");
        return locked(() -> {
            Instant now = clock.instant();
            Severity severity = event.getEffectiveSeverity();
            String fingerprint = Fingerprints.of(event);
            counters.recordReceived();

            SubmitResult result = force
                    ? enqueueForced(event, severity, fingerprint, now)
                    : decide(event, severity, fingerprint, now);
            persist(now);
            return result;
        });
    }

    private SubmitResult decide(AnomalyEvent event, Severity severity, String fingerprint, Instant now) {
        String job = event.getJobName();

        if (maintenance.isSuppressed(job, now)) {
            LOG.info("Suppressed alert for {}: job is under maintenance", job);
            return suppress(AlertState.SUPPRESSED_MAINTENANCE, event, severity, fingerprint, null);
        }

        RoutingRule rule = router.match(job);

        if (deduplicator.isDuplicate(fingerprint, now, settings.getDedupWindow())) {
            LOG.info("Suppressed duplicate alert for {} (fingerprint {})", job, fingerprint);
            return suppress(AlertState.SUPPRESSED_DUPLICATE, event, severity, fingerprint, rule);
        }

        if (!rule.passesSeverity(severity)) {
            LOG.info("Suppressed alert for {}: severity {} is below {} required by rule '{}'",
                    job, severity, rule.getMinSeverity(), rule.getName());
            return suppress(AlertState.SUPPRESSED_SEVERITY, event, severity, fingerprint, rule);
        }

        if (!rateLimiter.accept(now, settings.getMaxAlertsPerHour())) {
            LOG.warn("Rate limit reached ({} alerts per {}), suppressing alert for {}",
                    settings.getMaxAlertsPerHour(), rateLimiter.getWindow(), job);
            return suppress(AlertState.SUPPRESSED_RATE_LIMIT, event, severity, fingerprint, rule);
        }

        deduplicator.record(fingerprint, now, settings.getDedupWindow());
        return enqueue(event, severity, fingerprint, rule, now, false);
    }

    private SubmitResult enqueueForced(AnomalyEvent event, Severity severity, String fingerprint, Instant now) {
        RoutingRule rule = router.match(event.getJobName());
        counters.recordForced();
        LOG.info("Forced alert for {} bypasses suppression", event.getJobName());
        return enqueue(event, severity, fingerprint, rule, now, true);
    }

    private SubmitResult enqueue(AnomalyEvent event, Severity severity, String fingerprint,
                                 RoutingRule rule, Instant now, boolean forced) {
        BatchKey key = BatchKey.of(rule);
        int pending = batches.enqueue(key, rule, event, now);
        counters.recordDecision(AlertState.BATCHED);
        LOG.debug("Queued alert for {} under {} ({} pending)", event.getJobName(), key, pending);
        return new SubmitResult(AlertState.BATCHED, event.getJobName(), severity, fingerprint,
                rule.getName(), forced);
    }

    private SubmitResult suppress(AlertState state, AnomalyEvent event, Severity severity,
                                  String fingerprint, RoutingRule rule) {
        counters.recordDecision(state);
        return new SubmitResult(state, event.getJobName(), severity, fingerprint,
                rule == null ? null : rule.getName(), false);
    }

    // ---------------------------------------------------------------
    // Flushing
    // ---------------------------------------------------------------

    /**
     * Deliver every open batch immediately.
     *
     * @return one entry per delivered batch
     */
    public List<BatchDelivery> flushNow() {
        return deliverAll(locked(() -> markAllInFlight(batches.drainAll())));
    }

    /**
     * Deliver the batch open under {@code key}, if any.
     */
    public Optional<BatchDelivery> flushNow(BatchKey key) {
        Objects.requireNonNull(key, "key must not be null");
        Optional<AlertBatch> drained = locked(() -> batches.drain(key).map(this::markInFlight));
        return drained.map(this::deliverOne);
    }

    /**
     * Deliver every batch whose deadline is at or before the current clock
     * instant. Used by the periodic sweep and by engines without a scheduler.
     */
    public List<BatchDelivery> flushDue() {
        return deliverAll(locked(() -> markAllInFlight(batches.drainDue(clock.instant()))));
    }

    void onBatchDeadline(BatchKey key, long generation) {
        try {
            Optional<AlertBatch> drained = locked(() -> batches.drainGeneration(key, generation)
                    .map(this::markInFlight));
            drained.ifPresent(this::deliverOne);
        } catch (RuntimeException e) {
            LOG.error("Timed flush of {} failed", key, e);
        }
    }

    private List<BatchDelivery> deliverAll(List<AlertBatch> drained) {
        if (drained.isEmpty()) {
            return Collections.emptyList();
        }
        List<BatchDelivery> deliveries = new ArrayList<>(drained.size());
        for (AlertBatch batch : drained) {
            deliveries.add(deliverOne(batch));
        }
        return deliveries;
    }

    private List<AlertBatch> markAllInFlight(List<AlertBatch> drained) {
        drained.forEach(this::markInFlight);
        return drained;
    }

    private AlertBatch markInFlight(AlertBatch batch) {
        inFlight += batch.size();
        return batch;
    }

    private BatchDelivery deliverOne(AlertBatch batch) {
        List<DeliveryResult> results;
        try {
            results = dispatcher.deliver(batch);
        } catch (RuntimeException e) {
            LOG.error("Dispatch of {} failed", batch.getKey(), e);
            results = new ArrayList<>();
            for (Channel channel : batch.getRule().getChannels()) {
                results.add(DeliveryResult.failed(channel, String.valueOf(e.getMessage())));
            }
        }
        BatchDelivery delivery = new BatchDelivery(batch, results);
        if (delivery.isDelivered()) {
            LOG.info("Delivered {} alert(s) for {}", batch.size(), batch.getKey());
        } else {
            LOG.error("Every channel failed for {}; {} alert(s) dropped", batch.getKey(), batch.size());
        }
        locked(() -> {
            inFlight -= batch.size();
            counters.recordFlush(batch.size(), delivery.isDelivered());
            persist(clock.instant());
            return null;
        });
        return delivery;
    }

    // ---------------------------------------------------------------
    // Management
    // ---------------------------------------------------------------

    /**
     * Append a routing rule after the existing ones.
     *
     * @throws com.buildsentinel.core.error.ValidationException on a duplicate
     *                                                          or reserved name
     */
    public void addRule(RoutingRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        locked(() -> {
            router.add(rule);
            persist(clock.instant());
            return null;
        });
    }

    /**
     * @throws com.buildsentinel.core.error.NotFoundException if no rule has that name
     */
    public RoutingRule removeRule(String name) {
        return locked(() -> {
            RoutingRule removed = router.remove(name);
            persist(clock.instant());
            return removed;
        });
    }

    public List<RoutingRule> listRules() {
        return locked(router::list);
    }

    public boolean hasRule(String name) {
        return locked(() -> router.contains(name));
    }

    /**
     * Register a maintenance window. Windows that have already ended are
     * purged first, so their names can be reused.
     *
     * @throws com.buildsentinel.core.error.ValidationException on a duplicate name
     */
    public void addMaintenanceWindow(MaintenanceWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        locked(() -> {
            Instant now = clock.instant();
            maintenance.add(window, now);
            persist(now);
            return null;
        });
    }

    /**
     * @throws com.buildsentinel.core.error.NotFoundException if no window has that name
     */
    public MaintenanceWindow removeMaintenanceWindow(String name) {
        return locked(() -> {
            MaintenanceWindow removed = maintenance.remove(name);
            persist(clock.instant());
            return removed;
        });
    }

    public List<MaintenanceWindow> listActiveMaintenanceWindows() {
        return locked(() -> maintenance.listActive(clock.instant()));
    }

    public EngineStats stats() {
        return locked(() -> {
            Instant now = clock.instant();
            return new EngineStats(
                    counters.copy(),
                    batches.pendingCount() + inFlight,
                    maintenance.listActive(now).size(),
                    router.size(),
                    rateLimiter.countInWindow(now));
        });
    }

    /**
     * Flush every open batch. Timers that fire afterwards find nothing to
     * deliver.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<BatchDelivery> flushed = flushNow();
        LOG.info("AlertEngine closed after flushing {} batch(es)", flushed.size());
    }

    // ---------------------------------------------------------------
    // State
    // ---------------------------------------------------------------

    private Optional<StateSnapshot> loadSnapshot() {
        try {
            return stateStore.load();
        } catch (StateStoreException e) {
            LOG.warn("Could not load alert state, starting empty: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    private void applySnapshot(StateSnapshot snapshot) {
        deduplicator.restore(snapshot.getFingerprints());
        rateLimiter.restore(snapshot.getAlertTimestamps());
        router.restore(snapshot.getRules());
        maintenance.restore(snapshot.getMaintenanceWindows());
        LOG.info("Restored alert state saved at {}", snapshot.getSavedAt());
    }

    private void persist(Instant now) {
        StateSnapshot snapshot = new StateSnapshot();
        snapshot.setSavedAt(now);
        snapshot.setFingerprints(deduplicator.entries(now, settings.getDedupWindow()));
        snapshot.setAlertTimestamps(rateLimiter.timestamps(now));
        snapshot.setRules(router.list());
        snapshot.setMaintenanceWindows(maintenance.all());
        snapshot.setStats(counters);
        try {
            stateStore.save(snapshot);
        } catch (StateStoreException e) {
            LOG.warn("Could not persist alert state: {}", e.getMessage(), e);
        }
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
