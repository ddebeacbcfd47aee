package com.buildsentinel.core.config;

import com.buildsentinel.core.engine.EngineSettings;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertingConfigLoader}.
 */
class AlertingConfigLoaderTest {

    @Test
    @DisplayName("Should load engine settings, rules and windows from the classpath")
    void shouldLoadFromClasspath() {
        AlertingConfig config = AlertingConfigLoader.fromClasspath("test-alerting.yml");

        EngineSettings settings = config.toEngineSettings();
        assertThat(settings.getBatchWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getDedupWindow()).isEqualTo(Duration.ofMinutes(2));
        assertThat(settings.getMaxAlertsPerHour()).isEqualTo(10);
        assertThat(settings.getDefaultChannels()).containsExactlyInAnyOrder(Channel.SLACK, Channel.WEBHOOK);
        assertThat(settings.getDefaultMinSeverity()).isEqualTo(Severity.HIGH);
        assertThat(settings.getSinkTimeout()).isEqualTo(Duration.ofSeconds(3));

        List<RoutingRule> rules = config.toRoutingRules();
        assertThat(rules).extracting(RoutingRule::getName).containsExactly("deploy-team", "everything-else");
        assertThat(rules.get(0).targetFor(Channel.EMAIL)).contains("platform-oncall@example.com");
        assertThat(rules.get(0).getTeamName()).isEqualTo("Platform");
        assertThat(rules.get(1).getJobPattern()).isEmpty();
        assertThat(rules.get(1).getChannels()).containsExactly(Channel.SLACK);

        MaintenanceWindow window = config.toMaintenanceWindows().get(0);
        assertThat(window.getStart()).isEqualTo(Instant.parse("2024-06-01T02:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(Instant.parse("2024-06-01T04:00:00Z"));
        assertThat(window.getAffectedJobs()).containsExactly("deploy-prod");
    }

    @Test
    @DisplayName("Should report every configuration error in one exception")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> AlertingConfigLoader.fromClasspath("invalid-alerting.yml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("urgent")
                .hasMessageContaining("pager")
                .hasMessageContaining("Duplicate rule name 'broken'")
                .hasMessageContaining("backwards");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("alerting.yml");
        Files.writeString(file, "");

        AlertingConfig config = AlertingConfigLoader.fromFile(file.toString());

        EngineSettings settings = config.toEngineSettings();
        assertThat(settings.getBatchWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.getDedupWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.getMaxAlertsPerHour()).isEqualTo(20);
        assertThat(settings.getDefaultMinSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(config.getRules()).isEmpty();
    }

    @Test
    @DisplayName("Should reject malformed YAML and missing sources")
    void shouldRejectBadSources(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("alerting.yml");
        Files.writeString(file, "maxAlertsPerHour: [not, a, number]\n");

        assertThatThrownBy(() -> AlertingConfigLoader.fromFile(file.toString()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> AlertingConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> AlertingConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
