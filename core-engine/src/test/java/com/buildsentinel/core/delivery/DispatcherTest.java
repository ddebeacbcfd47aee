package com.buildsentinel.core.delivery;

import com.buildsentinel.core.model.AlertBatch;
import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.BatchKey;
import com.buildsentinel.core.model.Channel;
import com.buildsentinel.core.model.DeliveryResult;
import com.buildsentinel.core.model.RoutingRule;
import com.buildsentinel.core.model.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.buildsentinel.core.support.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link Dispatcher}.
 */
@ExtendWith(MockitoExtension.class)
class DispatcherTest {

    @Mock
    private AlertSink slack;

    @Mock
    private AlertSink email;

    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        lenient().when(slack.channel()).thenReturn(Channel.SLACK);
        lenient().when(email.channel()).thenReturn(Channel.EMAIL);
        dispatcher = new Dispatcher(List.of(slack, email), new MessageRenderer(), Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    @DisplayName("Should send the rendered message once per channel with the rule's override")
    void shouldSendToEveryChannel() throws Exception {
        RoutingRule rule = RoutingRule.builder()
                .name("platform")
                .channel(Channel.SLACK)
                .channel(Channel.EMAIL)
                .targetOverride(Channel.EMAIL, "platform@example.com")
                .build();

        List<DeliveryResult> results = dispatcher.deliver(batch(rule));

        assertThat(results).allMatch(DeliveryResult::isSuccess);
        ArgumentCaptor<AlertMessage> message = ArgumentCaptor.forClass(AlertMessage.class);
        verify(slack).send(isNull(), message.capture());
        verify(email).send(eq("platform@example.com"), any(AlertMessage.class));
        assertThat(message.getValue().getSubject()).isEqualTo("CI/CD Anomaly Alert - deploy-prod");
    }

    @Test
    @DisplayName("Should isolate a failing channel from the others")
    void shouldIsolateFailures() throws Exception {
        doThrow(new DeliveryException(Channel.EMAIL, "SMTP refused"))
                .when(email).send(any(), any());
        RoutingRule rule = RoutingRule.builder().name("both")
                .channel(Channel.SLACK).channel(Channel.EMAIL).build();

        List<DeliveryResult> results = dispatcher.deliver(batch(rule));

        assertThat(results).filteredOn(DeliveryResult::isSuccess)
                .extracting(DeliveryResult::getChannel).containsExactly(Channel.SLACK);
        assertThat(results).filteredOn(r -> !r.isSuccess()).singleElement()
                .satisfies(r -> assertThat(r.getError()).hasValueSatisfying(
                        error -> assertThat(error).contains("SMTP refused")));
    }

    @Test
    @DisplayName("Should give up on a sink that exceeds the timeout")
    void shouldTimeOutSlowSink() throws Exception {
        doAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        }).when(slack).send(any(), any());
        RoutingRule rule = RoutingRule.builder().name("slow").channel(Channel.SLACK).build();

        long started = System.nanoTime();
        List<DeliveryResult> results = dispatcher.deliver(batch(rule));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(3));
        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.getError()).hasValueSatisfying(
                        error -> assertThat(error).contains("timed out")));
    }

    @Test
    @DisplayName("Should fail a channel that has no registered sink")
    void shouldFailUnregisteredChannel() {
        Dispatcher slackOnly = new Dispatcher(List.of(slack), new MessageRenderer(), Duration.ofMillis(300));
        try {
            RoutingRule rule = RoutingRule.builder().name("hooks").channel(Channel.WEBHOOK).build();

            List<DeliveryResult> results = slackOnly.deliver(batch(rule));

            assertThat(results).singleElement()
                    .satisfies(r -> assertThat(r.getError()).contains("no sink registered"));
        } finally {
            slackOnly.close();
        }
    }

    @Test
    @DisplayName("Should not time out sends that wait in the queue behind a concurrent batch")
    void shouldMeasureTimeoutFromSendStart() throws Exception {
        ExecutorService workers = Executors.newFixedThreadPool(Channel.values().length);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        Dispatcher shared = new Dispatcher(
                List.of(new SleepingSink(Channel.SLACK), new SleepingSink(Channel.EMAIL),
                        new SleepingSink(Channel.WEBHOOK)),
                new MessageRenderer(), Duration.ofMillis(500), workers);
        try {
            RoutingRule rule = RoutingRule.builder().name("all")
                    .channel(Channel.SLACK).channel(Channel.EMAIL).channel(Channel.WEBHOOK).build();

            Future<List<DeliveryResult>> first = callers.submit(() -> shared.deliver(batch(rule)));
            Future<List<DeliveryResult>> second = callers.submit(() -> shared.deliver(batch(rule)));

            assertThat(first.get(5, TimeUnit.SECONDS)).hasSize(3).allMatch(DeliveryResult::isSuccess);
            assertThat(second.get(5, TimeUnit.SECONDS)).hasSize(3).allMatch(DeliveryResult::isSuccess);
        } finally {
            callers.shutdownNow();
            workers.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AlertBatch batch(RoutingRule rule) {
        return new AlertBatch(BatchKey.of(rule), rule,
                List.of(event("deploy-prod", Severity.HIGH, "duration")),
                Instant.parse("2024-05-01T12:00:00Z"));
    }

    /**
     * Sink whose every send takes 300 ms, well inside the 500 ms timeout.
     */
    private static final class SleepingSink implements AlertSink {

        private final Channel channel;

        SleepingSink(Channel channel) {
            this.channel = channel;
        }

        @Override
        public Channel channel() {
            return channel;
        }

        @Override
        public void send(String target, AlertMessage message) {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
