package com.buildsentinel.core.state;

import com.buildsentinel.core.model.AlertCounters;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the engine needs to resume after a restart.
 *
 * <pre>
 * {
 *   "version": 1,
 *   "saved_at": "...",
 *   "fingerprints": {"&lt;md5&gt;": "2024-05-01T10:00:00Z"},
 *   "alert_timestamps": ["..."],
 *   "rules": [ ... ],
 *   "maintenance_windows": [ ... ],
 *   "stats": { ... }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StateSnapshot {

    /** Current layout version. */
    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private Instant savedAt;
    private Map<String, Instant> fingerprints = new LinkedHashMap<>();
    private List<Instant> alertTimestamps = new ArrayList<>();
    private List<RoutingRule> rules = new ArrayList<>();
    private List<MaintenanceWindow> maintenanceWindows = new ArrayList<>();
    private AlertCounters stats = new AlertCounters();

    /** No-arg constructor required by Jackson. */
    public StateSnapshot() {
    }

    @JsonProperty("version")
    public int getVersion() {
        return version;
    }

    @JsonProperty("version")
    public void setVersion(int version) {
        this.version = version;
    }

    @JsonProperty("saved_at")
    public Instant getSavedAt() {
        return savedAt;
    }

    @JsonProperty("saved_at")
    public void setSavedAt(Instant savedAt) {
        this.savedAt = savedAt;
    }

    @JsonProperty("fingerprints")
    public Map<String, Instant> getFingerprints() {
        return Collections.unmodifiableMap(fingerprints);
    }

    @JsonProperty("fingerprints")
    public void setFingerprints(Map<String, Instant> fingerprints) {
        this.fingerprints = fingerprints != null ? new LinkedHashMap<>(fingerprints) : new LinkedHashMap<>();
    }

    @JsonProperty("alert_timestamps")
    public List<Instant> getAlertTimestamps() {
        return Collections.unmodifiableList(alertTimestamps);
    }

    @JsonProperty("alert_timestamps")
    public void setAlertTimestamps(List<Instant> alertTimestamps) {
        this.alertTimestamps = alertTimestamps != null ? new ArrayList<>(alertTimestamps) : new ArrayList<>();
    }

    @JsonProperty("rules")
    public List<RoutingRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    @JsonProperty("rules")
    public void setRules(List<RoutingRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    @JsonProperty("maintenance_windows")
    public List<MaintenanceWindow> getMaintenanceWindows() {
        return Collections.unmodifiableList(maintenanceWindows);
    }

    @JsonProperty("maintenance_windows")
    public void setMaintenanceWindows(List<MaintenanceWindow> maintenanceWindows) {
        this.maintenanceWindows = maintenanceWindows != null
                ? new ArrayList<>(maintenanceWindows)
                : new ArrayList<>();
    }

    @JsonProperty("stats")
    public AlertCounters getStats() {
        return stats.copy();
    }

    @JsonProperty("stats")
    public void setStats(AlertCounters stats) {
        this.stats = stats != null ? stats.copy() : new AlertCounters();
    }

    @Override
    public String toString() {
        return "StateSnapshot{" +
                "version=" + version +
                ", savedAt=" + savedAt +
                ", fingerprints=" + fingerprints.size() +
                ", alertTimestamps=" + alertTimestamps.size() +
                ", rules=" + rules.size() +
                ", maintenanceWindows=" + maintenanceWindows.size() +
                ", stats=" + stats +
                '}';
    }
}
