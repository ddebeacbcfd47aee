package com.buildsentinel.core.config;

import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the {@code rules} list in {@code alerting.yml}.
 *
 * <pre>
 * - name: deploy-team
 *   jobPattern: deploy
 *   minSeverity: high
 *   channels: [slack, email]
 *   teamName: Platform
 *   targetOverrides:
 *     email: platform-oncall@example.com
 * </pre>
 *
 * @since 1.0.0
 */
public class RuleConfig {

    private String name;
    private String jobPattern;
    private String minSeverity = "low";
    private List<String> channels = new ArrayList<>(List.of("slack"));
    private String teamName;
    private Map<String, String> targetOverrides = new LinkedHashMap<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getJobPattern() {
        return jobPattern;
    }

    public void setJobPattern(String jobPattern) {
        this.jobPattern = jobPattern;
    }

    public String getMinSeverity() {
        return minSeverity;
    }

    public void setMinSeverity(String minSeverity) {
        this.minSeverity = minSeverity;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public String getTeamName() {
        return teamName;
    }

    public void setTeamName(String teamName) {
        this.teamName = teamName;
    }

    public Map<String, String> getTargetOverrides() {
        return targetOverrides;
    }

    public void setTargetOverrides(Map<String, String> targetOverrides) {
        this.targetOverrides = targetOverrides != null
                ? new LinkedHashMap<>(targetOverrides)
                : new LinkedHashMap<>();
    }

    /**
     * Convert to the engine's rule type.
     *
     * @throws com.buildsentinel.core.error.ValidationException if a severity or
     *                                                          channel name is
     *                                                          unknown or the
     *                                                          rule is incomplete
     */
    public RoutingRule toRoutingRule() {
        RoutingRule.Builder builder = RoutingRule.builder()
                .name(name)
                .jobPattern(jobPattern)
                .minSeverity(minSeverity == null ? Severity.LOW : Severity.parse(minSeverity))
                .teamName(teamName)
                .targetOverrides(targetOverrides);
        List<Channel> parsed = new ArrayList<>();
        for (String channel : channels) {
            parsed.add(Channel.parse(channel));
        }
        builder.channels(parsed);
        return builder.build();
    }

    @Override
    public String toString() {
        return "RuleConfig{name='" + name + "', jobPattern='" + jobPattern
                + "', minSeverity=" + minSeverity + ", channels=" + channels + '}';
    }
}
