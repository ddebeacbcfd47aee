package com.buildsentinel.core.engine;

import com.buildsentinel.core.error.NotFoundException;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.MaintenanceWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of named maintenance windows.
 *
 * <p>
 * Overlapping windows combine with OR semantics: a job is suppressed if any
 * active window covers it. Windows that have already ended are purged when a
 * new window is added, which frees their names for reuse.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; callers hold the engine lock.
 * </p>
 *
 * @since 1.0.0
 */
public class MaintenanceRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceRegistry.class);

    private final Map<String, MaintenanceWindow> windows = new LinkedHashMap<>();

    /**
     * @param jobName job to test
     * @param now     current instant
     * @return {@code true} if an active window covers {@code jobName}
     */
    public boolean isSuppressed(String jobName, Instant now) {
        for (MaintenanceWindow w : windows.values()) {
            if (w.isActive(now) && w.affects(jobName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Register a window.
     *
     * @param window window to add; must not be {@code null}
     * @param now    current instant, used to purge ended windows
     * @throws ValidationException if a window with the same name is registered
     */
    public void add(MaintenanceWindow window, Instant now) {
        Objects.requireNonNull(window, "Maintenance window must not be null");
        purgeEnded(now);
        if (windows.containsKey(window.getName())) {
            throw new ValidationException(
                    "Maintenance window '" + window.getName() + "' is already registered");
        }
        windows.put(window.getName(), window);
        LOG.info("Added maintenance window '{}' [{} .. {}) jobs={}", window.getName(),
                window.getStart(), window.getEnd(),
                window.getAffectedJobs().isEmpty() ? "ALL" : window.getAffectedJobs());
    }

    /**
     * @param name window name
     * @return the removed window
     * @throws NotFoundException if no window has that name
     */
    public MaintenanceWindow remove(String name) {
        MaintenanceWindow removed = windows.remove(name);
        if (removed == null) {
            throw new NotFoundException("Maintenance window '" + name + "' is not registered");
        }
        LOG.info("Removed maintenance window '{}'", name);
        return removed;
    }

    /**
     * @return windows active at {@code now}, in registration order
     */
    public List<MaintenanceWindow> listActive(Instant now) {
        List<MaintenanceWindow> active = new ArrayList<>();
        for (MaintenanceWindow w : windows.values()) {
            if (w.isActive(now)) {
                active.add(w);
            }
        }
        return active;
    }

    /**
     * @return every registered window, including future and ended ones
     */
    public List<MaintenanceWindow> all() {
        return List.copyOf(windows.values());
    }

    /**
     * Replace the registry content with restored windows. Duplicated names keep
     * the first occurrence.
     */
    public void restore(Collection<MaintenanceWindow> restored) {
        windows.clear();
        if (restored != null) {
            for (MaintenanceWindow w : restored) {
                if (w != null) {
                    windows.putIfAbsent(w.getName(), w);
                }
            }
        }
    }

    public int size() {
        return windows.size();
    }

    private void purgeEnded(Instant now) {
        windows.values().removeIf(w -> {
            if (w.hasEnded(now)) {
                LOG.debug("Purging ended maintenance window '{}'", w.getName());
                return true;
            }
            return false;
        });
    }
}
