package com.buildsentinel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Suppresses repeats of the same fingerprint inside a dedup window.
 *
 * <p>
 * The window is anchored to the <em>first</em> accepted occurrence: a
 * suppressed duplicate does not refresh the stored timestamp. A permanently
 * failing job therefore alerts once per window instead of silencing itself
 * forever.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; callers hold the engine lock.
 * </p>
 *
 * @since 1.0.0
 */
public class Deduplicator {

    private static final Logger LOG = LoggerFactory.getLogger(Deduplicator.class);

    /** Fingerprint → instant of the last accepted occurrence. */
    private final Map<String, Instant> lastAccepted = new HashMap<>();

    /**
     * Decide whether an occurrence of {@code fingerprint} may pass, recording it
     * if so.
     *
     * @param fingerprint event fingerprint
     * @param now         current instant
     * @param window      dedup window; must be positive
     * @return {@code true} to accept (timestamp recorded), {@code false} to
     *         suppress (timestamp untouched)
     */
    public boolean accept(String fingerprint, Instant now, Duration window) {
        if (isDuplicate(fingerprint, now, window)) {
            return false;
        }
        record(fingerprint, now, window);
        return true;
    }

    /**
     * Check without recording. The engine uses this when later pipeline stages
     * may still reject the event, and calls {@link #record} once it is
     * accepted.
     *
     * @return {@code true} if {@code fingerprint} was accepted less than
     *         {@code window} before {@code now}
     */
    public boolean isDuplicate(String fingerprint, Instant now, Duration window) {
        Objects.requireNonNull(fingerprint, "Fingerprint must not be null");
        Instant last = lastAccepted.get(fingerprint);
        if (last != null && last.isAfter(now.minus(window))) {
            LOG.debug("Fingerprint {} seen at {} is inside the {} window", fingerprint, last, window);
            return true;
        }
        return false;
    }

    /**
     * Record {@code now} as the last accepted occurrence of
     * {@code fingerprint}.
     */
    public void record(String fingerprint, Instant now, Duration window) {
        Objects.requireNonNull(fingerprint, "Fingerprint must not be null");
        lastAccepted.put(fingerprint, now);
        evictExpired(now, window);
    }

    /**
     * Drop entries older than the window. Expired entries are ignored by
     * {@link #accept} anyway; this only bounds memory and snapshot size.
     */
    public void evictExpired(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        Iterator<Map.Entry<String, Instant>> it = lastAccepted.entrySet().iterator();
        while (it.hasNext()) {
            if (!it.next().getValue().isAfter(cutoff)) {
                it.remove();
            }
        }
    }

    /**
     * @return copy of the live entries, for persistence
     */
    public Map<String, Instant> entries(Instant now, Duration window) {
        evictExpired(now, window);
        return Collections.unmodifiableMap(new LinkedHashMap<>(lastAccepted));
    }

    /**
     * Replace the tracked entries with restored ones.
     */
    public void restore(Map<String, Instant> entries) {
        lastAccepted.clear();
        if (entries != null) {
            entries.forEach((fp, at) -> {
                if (fp != null && at != null) {
                    lastAccepted.put(fp, at);
                }
            });
        }
    }

    public int size() {
        return lastAccepted.size();
    }
}
