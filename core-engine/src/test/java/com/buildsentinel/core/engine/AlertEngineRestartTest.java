package com.buildsentinel.core.engine;

import com.buildsentinel.core.delivery.Dispatcher;
import com.buildsentinel.core.delivery.MessageRenderer;
import com.buildsentinel.core.model.AlertState;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.MaintenanceWindow;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;
import com.buildsentinel.core.state.JsonFileStateStore;
import com.buildsentinel.core.support.MutableClock;
import com.buildsentinel.core.support.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static com.buildsentinel.core.support.TestEvents.T0;
import static com.buildsentinel.core.support.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Restart behaviour of {@link AlertEngine} backed by {@link JsonFileStateStore}.
 */
class AlertEngineRestartTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        dispatcher = new Dispatcher(List.of(new RecordingSink(Channel.SLACK)), new MessageRenderer(),
                Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    @DisplayName("Should keep suppressing a duplicate arriving one minute after a restart")
    void shouldPreserveDedupAcrossRestart() {
        AlertEngine first = start();
        assertThat(first.submit(event("deploy-prod", Severity.HIGH, "duration")).isAccepted()).isTrue();
        clock.advance(Duration.ofMinutes(2));
        first.close();

        AlertEngine second = start();
        clock.advance(Duration.ofMinutes(1));

        assertThat(second.submit(event("deploy-prod", Severity.HIGH, "duration")).getState())
                .isEqualTo(AlertState.SUPPRESSED_DUPLICATE);
    }

    @Test
    @DisplayName("Should restore rules, windows, rate history and counters")
    void shouldRestoreManagedState() {
        AlertEngine first = start();
        first.addRule(RoutingRule.builder().name("deploys").jobPattern("deploy")
                .minSeverity(Severity.HIGH).channel(Channel.SLACK).build());
        first.addMaintenanceWindow(new MaintenanceWindow("db", T0, T0.plusSeconds(600), List.of("db-migrate")));
        first.submit(event("build-ui", Severity.HIGH));
        first.close();

        AlertEngine second = start();

        assertThat(second.listRules()).extracting(RoutingRule::getName).containsExactly("deploys");
        assertThat(second.listActiveMaintenanceWindows()).extracting(MaintenanceWindow::getName)
                .containsExactly("db");
        assertThat(second.stats().getAlertsLastHour()).isEqualTo(1);
        assertThat(second.stats().getTotalReceived()).isEqualTo(1);
        assertThat(second.stats().getTotalSent()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertEngine start() {
        return new AlertEngine(EngineSettings.builder().defaultMinSeverity(Severity.LOW).build(),
                clock, new JsonFileStateStore(tempDir.resolve("alert-state.json")), dispatcher, null);
    }
}
