package com.buildsentinel.core.engine;

import com.buildsentinel.core.model.AlertBatch;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.BatchKey;
import com.buildsentinel.core.model.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-destination buffers that collapse bursts of accepted alerts into one
 * message.
 *
 * <p>
 * The first event of a buffer opens a new <em>generation</em>: a deadline of
 * {@code now + batchWindow} is recorded and a timer is scheduled. Draining a
 * buffer (by timer, explicit flush or {@link #drainDue(Instant)}) snapshots and
 * clears it and cancels its timer. A timer that fires for a generation that
 * was already drained is ignored, so every generation is flushed at most once.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The engine calls every method under its lock; timer
 * callbacks re-enter through {@link DeadlineListener}, which must take the same
 * lock before calling {@link #drainGeneration(BatchKey, long)}.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAggregator.class);

    /**
     * Callback invoked on the scheduler thread when a buffer's deadline
     * passes.
     */
    @FunctionalInterface
    public interface DeadlineListener {
        void onDeadline(BatchKey key, long generation);
    }

    private final Duration batchWindow;
    private final ScheduledExecutorService scheduler;
    private final DeadlineListener listener;
    private final Map<BatchKey, Buffer> buffers = new LinkedHashMap<>();
    private long nextGeneration = 1;

    /**
     * @param batchWindow time an open buffer waits before it matures; must not
     *                    be negative
     * @param scheduler   executor for deadline timers, or {@code null} to rely
     *                    on {@link #drainDue(Instant)} only
     * @param listener    deadline callback; required when {@code scheduler} is
     *                    set
     */
    public BatchAggregator(Duration batchWindow, ScheduledExecutorService scheduler,
            DeadlineListener listener) {
        Objects.requireNonNull(batchWindow, "Batch window must not be null");
        if (batchWindow.isNegative()) {
            throw new IllegalArgumentException("Batch window must be >= 0, got: " + batchWindow);
        }
        if (scheduler != null) {
            Objects.requireNonNull(listener, "Deadline listener is required with a scheduler");
        }
        this.batchWindow = batchWindow;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    /**
     * Append an event to the buffer for {@code key}, opening a new generation
     * if the buffer is empty.
     *
     * @param key   destination
     * @param rule  rule that produced {@code key}
     * @param event accepted event
     * @param now   current instant
     * @return number of events now waiting under {@code key}
     */
    public int enqueue(BatchKey key, RoutingRule rule, AnomalyEvent event, Instant now) {
        Objects.requireNonNull(key, "Batch key must not be null");
        Objects.requireNonNull(event, "Event must not be null");

        Buffer buffer = buffers.get(key);
        if (buffer == null) {
            buffer = new Buffer(rule, now, now.plus(batchWindow), nextGeneration++);
            buffers.put(key, buffer);
            buffer.timer = scheduleTimer(key, buffer.generation);
            LOG.debug("Opened batch {} generation {} (deadline {})", key, buffer.generation, buffer.deadline);
        }
        buffer.events.add(event);
        return buffer.events.size();
    }

    /**
     * Snapshot, clear and un-schedule the buffer for {@code key}.
     *
     * @return the drained batch, or empty if nothing was buffered
     */
    public Optional<AlertBatch> drain(BatchKey key) {
        Buffer buffer = buffers.remove(key);
        if (buffer == null) {
            return Optional.empty();
        }
        return Optional.of(close(key, buffer));
    }

    /**
     * Drain {@code key} only if its open generation is {@code generation}.
     * Used by timer callbacks so a late timer never flushes a newer buffer.
     *
     * @return the drained batch, or empty if that generation is already gone
     */
    public Optional<AlertBatch> drainGeneration(BatchKey key, long generation) {
        Buffer buffer = buffers.get(key);
        if (buffer == null || buffer.generation != generation) {
            LOG.debug("Ignoring stale deadline for {} generation {}", key, generation);
            return Optional.empty();
        }
        buffers.remove(key);
        return Optional.of(close(key, buffer));
    }

    /**
     * Drain every buffer whose deadline is at or before {@code now}.
     */
    public List<AlertBatch> drainDue(Instant now) {
        List<AlertBatch> due = new ArrayList<>();
        Iterator<Map.Entry<BatchKey, Buffer>> it = buffers.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<BatchKey, Buffer> entry = it.next();
            if (!entry.getValue().deadline.isAfter(now)) {
                it.remove();
                due.add(close(entry.getKey(), entry.getValue()));
            }
        }
        return due;
    }

    /**
     * Drain every open buffer regardless of its deadline.
     */
    public List<AlertBatch> drainAll() {
        List<AlertBatch> all = new ArrayList<>(buffers.size());
        for (Map.Entry<BatchKey, Buffer> entry : buffers.entrySet()) {
            all.add(close(entry.getKey(), entry.getValue()));
        }
        buffers.clear();
        return all;
    }

    /**
     * @return total number of events waiting across all buffers
     */
    public int pendingCount() {
        int count = 0;
        for (Buffer b : buffers.values()) {
            count += b.events.size();
        }
        return count;
    }

    /**
     * @return deadline of the open buffer for {@code key}
     */
    public Optional<Instant> deadlineOf(BatchKey key) {
        Buffer buffer = buffers.get(key);
        return buffer == null ? Optional.empty() : Optional.of(buffer.deadline);
    }

    public List<BatchKey> openKeys() {
        return List.copyOf(buffers.keySet());
    }

    public Duration getBatchWindow() {
        return batchWindow;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AlertBatch close(BatchKey key, Buffer buffer) {
        if (buffer.timer != null) {
            buffer.timer.cancel(false);
        }
        return new AlertBatch(key, buffer.rule, buffer.events, buffer.openedAt);
    }

    private ScheduledFuture<?> scheduleTimer(BatchKey key, long generation) {
        if (scheduler == null) {
            return null;
        }
        try {
            return scheduler.schedule(() -> listener.onDeadline(key, generation),
                    batchWindow.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // scheduler shutting down; drainAll/drainDue still reach the buffer
            LOG.warn("Could not schedule flush timer for {}: {}", key, e.getMessage());
            return null;
        }
    }

    private static final class Buffer {
        private final RoutingRule rule;
        private final Instant openedAt;
        private final Instant deadline;
        private final long generation;
        private final List<AnomalyEvent> events = new ArrayList<>();
        private ScheduledFuture<?> timer;

        private Buffer(RoutingRule rule, Instant openedAt, Instant deadline, long generation) {
            this.rule = rule;
            this.openedAt = openedAt;
            this.deadline = deadline;
            this.generation = generation;
        }
    }
}
