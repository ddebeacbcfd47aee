package com.buildsentinel.core.config;

import com.buildsentinel.core.engine.EngineSettings;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for {@code alerting.yml}.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * batchWindowSeconds: 60
 * dedupWindowSeconds: 300
 * maxAlertsPerHour: 20
 * defaultChannels: [slack]
 * defaultMinSeverity: medium
 * sinkTimeoutSeconds: 5
 * rules:
 *   - name: deploy-team
 *     jobPattern: deploy
 *     minSeverity: high
 *     channels: [slack, email]
 * maintenanceWindows:
 *   - name: db-migration
 *     start: 2024-06-01T02:00:00Z
 *     end: 2024-06-01T04:00:00Z
 *     affectedJobs: [deploy-prod]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; it reports every problem at once.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingConfig {

    private long batchWindowSeconds = 60;
    private long dedupWindowSeconds = 300;
    private int maxAlertsPerHour = 20;
    private List<String> defaultChannels = new ArrayList<>(List.of("slack"));
    private String defaultMinSeverity = "medium";
    private long sinkTimeoutSeconds = 5;
    private List<RuleConfig> rules = new ArrayList<>();
    private List<MaintenanceWindowConfig> maintenanceWindows = new ArrayList<>();

    public long getBatchWindowSeconds() {
        return batchWindowSeconds;
    }

    public void setBatchWindowSeconds(long batchWindowSeconds) {
        this.batchWindowSeconds = batchWindowSeconds;
    }

    public long getDedupWindowSeconds() {
        return dedupWindowSeconds;
    }

    public void setDedupWindowSeconds(long dedupWindowSeconds) {
        this.dedupWindowSeconds = dedupWindowSeconds;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public void setMaxAlertsPerHour(int maxAlertsPerHour) {
        this.maxAlertsPerHour = maxAlertsPerHour;
    }

    public List<String> getDefaultChannels() {
        return Collections.unmodifiableList(defaultChannels);
    }

    public void setDefaultChannels(List<String> defaultChannels) {
        this.defaultChannels = defaultChannels != null ? new ArrayList<>(defaultChannels) : new ArrayList<>();
    }

    public String getDefaultMinSeverity() {
        return defaultMinSeverity;
    }

    public void setDefaultMinSeverity(String defaultMinSeverity) {
        this.defaultMinSeverity = defaultMinSeverity;
    }

    public long getSinkTimeoutSeconds() {
        return sinkTimeoutSeconds;
    }

    public void setSinkTimeoutSeconds(long sinkTimeoutSeconds) {
        this.sinkTimeoutSeconds = sinkTimeoutSeconds;
    }

    public List<RuleConfig> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleConfig> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<MaintenanceWindowConfig> getMaintenanceWindows() {
        return Collections.unmodifiableList(maintenanceWindows);
    }

    public void setMaintenanceWindows(List<MaintenanceWindowConfig> maintenanceWindows) {
        this.maintenanceWindows = maintenanceWindows != null
                ? new ArrayList<>(maintenanceWindows)
                : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // Validation and conversion
    // ---------------------------------------------------------------

    /**
     * Validate engine tuning, every rule and every maintenance window.
     *
     * @throws ValidationException listing all problems found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            toEngineSettings();
        } catch (ValidationException e) {
            errors.add(e.getMessage());
        }

        Set<String> ruleNames = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            RuleConfig rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            try {
                rule.toRoutingRule();
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !ruleNames.add(rule.getName())) {
                errors.add("Duplicate rule name '" + rule.getName() + "'");
            }
            if (RoutingRule.DEFAULT_RULE_NAME.equals(rule.getName())) {
                errors.add("Rule name '" + RoutingRule.DEFAULT_RULE_NAME + "' is reserved");
            }
        }

        Set<String> windowNames = new HashSet<>();
        for (int i = 0; i < maintenanceWindows.size(); i++) {
            MaintenanceWindowConfig window = maintenanceWindows.get(i);
            if (window == null) {
                errors.add("Maintenance window at index " + i + " is null");
                continue;
            }
            try {
                window.toWindow();
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
            if (window.getName() != null && !windowNames.add(window.getName())) {
                errors.add("Duplicate maintenance window name '" + window.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(
                    "Alerting configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @throws ValidationException if a value is out of range or unknown
     */
    public EngineSettings toEngineSettings() {
        List<Channel> channels = new ArrayList<>();
        for (String channel : defaultChannels) {
            channels.add(Channel.parse(channel));
        }
        return EngineSettings.builder()
                .batchWindow(Duration.ofSeconds(batchWindowSeconds))
                .dedupWindow(Duration.ofSeconds(dedupWindowSeconds))
                .maxAlertsPerHour(maxAlertsPerHour)
                .defaultChannels(channels)
                .defaultMinSeverity(defaultMinSeverity == null
                        ? Severity.MEDIUM
                        : Severity.parse(defaultMinSeverity))
                .sinkTimeout(Duration.ofSeconds(sinkTimeoutSeconds))
                .build();
    }

    public List<RoutingRule> toRoutingRules() {
        List<RoutingRule> result = new ArrayList<>(rules.size());
        for (RuleConfig rule : rules) {
            result.add(rule.toRoutingRule());
        }
        return result;
    }

    public List<MaintenanceWindow> toMaintenanceWindows() {
        List<MaintenanceWindow> result = new ArrayList<>(maintenanceWindows.size());
        for (MaintenanceWindowConfig window : maintenanceWindows) {
            result.add(window.toWindow());
        }
        return result;
    }

    @Override
    public String toString() {
        return "AlertingConfig{" +
                "batchWindowSeconds=" + batchWindowSeconds +
                ", dedupWindowSeconds=" + dedupWindowSeconds +
                ", maxAlertsPerHour=" + maxAlertsPerHour +
                ", defaultChannels=" + defaultChannels +
                ", defaultMinSeverity=" + defaultMinSeverity +
                ", sinkTimeoutSeconds=" + sinkTimeoutSeconds +
                ", rules=" + rules.size() +
                ", maintenanceWindows=" + maintenanceWindows.size() +
                '}';
    }
}
