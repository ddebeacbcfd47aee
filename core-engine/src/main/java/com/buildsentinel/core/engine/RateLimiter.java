package com.buildsentinel.core.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Sliding-window cap on the number of accepted alerts.
 *
 * <h3>Implementation</h3>
 * <p>
 * Keeps a deque of acceptance instants. Each check first evicts instants that
 * fell out of the window, then accepts iff fewer than {@code cap} remain and
 * appends {@code now}. An alert over the cap is refused, never queued.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; eviction and append are atomic only under the engine lock.
 * </p>
 *
 * @since 1.0.0
 */
public class RateLimiter {

    /** Default trailing window. */
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    private final Duration window;

    /** Acceptance instants, oldest first. */
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    public RateLimiter() {
        this(DEFAULT_WINDOW);
    }

    /**
     * @param window trailing window; must be positive
     * @throws IllegalArgumentException if {@code window} is zero or negative
     */
    public RateLimiter(Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate window must be > 0, got: " + window);
        }
        this.window = window;
    }

    /**
     * @param now current instant
     * @param cap maximum accepted alerts per window
     * @return {@code true} if accepted (and recorded), {@code false} if the cap
     *         is reached
     */
    public boolean accept(Instant now, int cap) {
        evict(now);
        if (timestamps.size() >= cap) {
            return false;
        }
        timestamps.addLast(now);
        return true;
    }

    /**
     * @return number of accepted alerts inside the window ending at {@code now}
     */
    public int countInWindow(Instant now) {
        evict(now);
        return timestamps.size();
    }

    /**
     * @return copy of the live instants, oldest first
     */
    public List<Instant> timestamps(Instant now) {
        evict(now);
        return List.copyOf(timestamps);
    }

    /**
     * Replace the tracked instants with restored ones (sorted, nulls dropped).
     */
    public void restore(Collection<Instant> restored) {
        timestamps.clear();
        if (restored != null) {
            List<Instant> sorted = new ArrayList<>();
            for (Instant t : restored) {
                if (t != null) {
                    sorted.add(t);
                }
            }
            sorted.sort(null);
            timestamps.addAll(sorted);
        }
    }

    public Duration getWindow() {
        return window;
    }

    private void evict(Instant now) {
        Instant windowStart = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(windowStart)) {
            timestamps.pollFirst();
        }
    }
}
