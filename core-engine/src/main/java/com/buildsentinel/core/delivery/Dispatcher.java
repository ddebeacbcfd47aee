package com.buildsentinel.core.delivery;

import com.buildsentinel.core.model.AlertBatch;
import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.DeliveryResult;
import com.buildsentinel.core.model.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers a rendered batch to every channel of its routing rule.
 *
 * <p>
 * Sink calls run concurrently on a worker pool and each one is bounded by
 * {@code sinkTimeout}, measured from the moment the call starts. A failure or
 * timeout on one channel is reported in its {@link DeliveryResult} and never
 * affects the other channels. Failures are not retried.
 * </p>
 *
 * @since 1.0.0
 */
public class Dispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    /** Default per-sink timeout. */
    public static final Duration DEFAULT_SINK_TIMEOUT = Duration.ofSeconds(5);

    /** Workers of the owned pool: room for several batches fanning out at once. */
    static final int MAX_WORKERS = Channel.values().length * 4;

    /** How many sink timeouts a call may wait in the queue before it is dropped. */
    static final int MAX_QUEUED_TIMEOUTS = 4;

    private final Map<Channel, AlertSink> sinks = new EnumMap<>(Channel.class);
    private final MessageRenderer renderer;
    private final Duration sinkTimeout;
    private final ExecutorService workers;
    private final boolean ownsWorkers;

    /**
     * Create a dispatcher with its own worker pool.
     *
     * @param sinks       one sink per channel; later duplicates replace earlier
     *                    ones
     * @param renderer    message renderer
     * @param sinkTimeout upper bound for a single sink call
     */
    public Dispatcher(Collection<? extends AlertSink> sinks, MessageRenderer renderer, Duration sinkTimeout) {
        this(sinks, renderer, sinkTimeout, newWorkerPool(), true);
    }

    /**
     * Create a dispatcher on a caller-managed executor.
     */
    public Dispatcher(Collection<? extends AlertSink> sinks, MessageRenderer renderer, Duration sinkTimeout,
            ExecutorService workers) {
        this(sinks, renderer, sinkTimeout, workers, false);
    }

    private Dispatcher(Collection<? extends AlertSink> sinks, MessageRenderer renderer, Duration sinkTimeout,
            ExecutorService workers, boolean ownsWorkers) {
        Objects.requireNonNull(sinks, "Sinks must not be null");
        this.renderer = Objects.requireNonNull(renderer, "Renderer must not be null");
        this.sinkTimeout = Objects.requireNonNull(sinkTimeout, "Sink timeout must not be null");
        this.workers = Objects.requireNonNull(workers, "Executor must not be null");
        this.ownsWorkers = ownsWorkers;
        if (sinkTimeout.isZero() || sinkTimeout.isNegative()) {
            throw new IllegalArgumentException("Sink timeout must be > 0, got: " + sinkTimeout);
        }
        for (AlertSink sink : sinks) {
            AlertSink previous = this.sinks.put(sink.channel(), sink);
            if (previous != null) {
                LOG.warn("Sink for channel {} replaced by {}", sink.channel().wireName(),
                        sink.getClass().getSimpleName());
            }
        }
    }

    /**
     * Render {@code batch} once and send it to each channel of its rule.
     *
     * @param batch drained batch
     * @return one result per channel of the rule
     */
    public List<DeliveryResult> deliver(AlertBatch batch) {
        Objects.requireNonNull(batch, "Batch must not be null");
        AlertMessage message = renderer.render(batch);
        RoutingRule rule = batch.getRule();

        Map<Channel, SinkCall> calls = new LinkedHashMap<>();
        Map<Channel, Future<Void>> pending = new LinkedHashMap<>();
        List<DeliveryResult> results = new ArrayList<>();
        for (Channel channel : rule.getChannels()) {
            AlertSink sink = sinks.get(channel);
            if (sink == null) {
                LOG.error("No sink registered for channel {} (batch {})", channel.wireName(), batch.getKey());
                results.add(DeliveryResult.failed(channel, "no sink registered"));
                continue;
            }
            SinkCall call = new SinkCall(sink, rule.targetFor(channel).orElse(null), message);
            try {
                pending.put(channel, workers.submit(call));
                calls.put(channel, call);
            } catch (RejectedExecutionException e) {
                LOG.error("Dispatcher is shut down; dropping {} delivery for {}", channel.wireName(), batch.getKey());
                results.add(DeliveryResult.failed(channel, "dispatcher shut down"));
            }
        }

        for (Map.Entry<Channel, Future<Void>> entry : pending.entrySet()) {
            Channel channel = entry.getKey();
            results.add(await(channel, calls.get(channel), entry.getValue(), batch));
        }
        return results;
    }

    /**
     * Wait for one sink call. The per-sink timeout runs from the moment the
     * call starts on a worker, so time spent queued behind another batch does
     * not count against it. Queueing itself is bounded by
     * {@link #MAX_QUEUED_TIMEOUTS} sink timeouts.
     */
    private DeliveryResult await(Channel channel, SinkCall call, Future<Void> future, AlertBatch batch) {
        try {
            if (!call.awaitStart(sinkTimeout.toNanos() * MAX_QUEUED_TIMEOUTS) && future.cancel(false)) {
                LOG.error("Delivery via {} never started; worker pool saturated", channel.wireName());
                return DeliveryResult.failed(channel, "not started within "
                        + sinkTimeout.multipliedBy(MAX_QUEUED_TIMEOUTS).toMillis() + " ms");
            }
            call.awaitStart(Long.MAX_VALUE);
            long remaining = call.startedAt() + sinkTimeout.toNanos() - System.nanoTime();
            future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            LOG.info("Delivered {} alert(s) for {} via {}", batch.size(), batch.getKey().getRuleName(),
                    channel.wireName());
            return DeliveryResult.ok(channel);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.error("Delivery via {} timed out after {} ms", channel.wireName(), sinkTimeout.toMillis());
            return DeliveryResult.failed(channel, "timed out after " + sinkTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Delivery via {} failed: {}", channel.wireName(), cause.getMessage(), cause);
            return DeliveryResult.failed(channel, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted while delivering via {}", channel.wireName());
            return DeliveryResult.failed(channel, "interrupted");
        }
    }

    public Duration getSinkTimeout() {
        return sinkTimeout;
    }

    @Override
    public void close() {
        if (ownsWorkers) {
            workers.shutdownNow();
        }
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(MAX_WORKERS, MAX_WORKERS, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "alert-dispatch-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    // ---------------------------------------------------------------
    // Sink call
    // ---------------------------------------------------------------

    /**
     * One send on a worker thread, recording when it started.
     */
    private static final class SinkCall implements Callable<Void> {

        private final AlertSink sink;
        private final String target;
        private final AlertMessage message;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedAt;

        SinkCall(AlertSink sink, String target, AlertMessage message) {
            this.sink = sink;
            this.target = target;
            this.message = message;
        }

        @Override
        public Void call() throws DeliveryException {
            startedAt = System.nanoTime();
            started.countDown();
            sink.send(target, message);
            return null;
        }

        boolean awaitStart(long timeoutNanos) throws InterruptedException {
            return started.await(timeoutNanos, TimeUnit.NANOSECONDS);
        }

        long startedAt() {
            return startedAt;
        }
    }
}
