package com.buildsentinel.core.delivery;

import com.buildsentinel.core.model.AlertBatch;
import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.AnomalousFeature;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.RoutingRule;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a drained batch into the text that sinks deliver.
 *
 * <p>
 * A batch of one uses the detailed single-alert layout; larger batches use the
 * grouped summary, capped at {@link #MAX_GROUPED_LINES} lines.
 * </p>
 *
 * @since 1.0.0
 */
public class MessageRenderer {

    /** Number of anomalous metrics listed in a single alert. */
    static final int MAX_FEATURES = 3;

    /** Number of events itemised in a grouped alert. */
    static final int MAX_GROUPED_LINES = 10;

    private static final String SUBJECT_PREFIX = "CI/CD Anomaly Alert - ";
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);

    /**
     * @param batch drained batch; never empty
     * @return rendered message carrying the batch's events
     */
    public AlertMessage render(AlertBatch batch) {
        if (batch.isGrouped()) {
            return new AlertMessage(SUBJECT_PREFIX + batch.size() + " anomalies",
                    renderGrouped(batch.getEvents(), batch.getRule()), batch.getEvents());
        }
        AnomalyEvent event = batch.getEvents().get(0);
        return new AlertMessage(SUBJECT_PREFIX + event.getJobName(),
                renderSingle(event, batch.getRule()), batch.getEvents());
    }

    String renderSingle(AnomalyEvent event, RoutingRule rule) {
        StringBuilder sb = new StringBuilder();
        sb.append(":rotating_light: *Anomaly Detected in CI/CD Pipeline*\n\n");
        sb.append("*Job/Workflow:* ").append(event.getJobName()).append('\n');
        sb.append("*Time:* ").append(TIME_FORMAT.format(event.getTimestamp())).append('\n');
        sb.append("*Severity:* ").append(event.getEffectiveSeverity().name()).append('\n');
        if (rule.getTeamName() != null) {
            sb.append("*Team:* ").append(rule.getTeamName()).append('\n');
        }

        List<AnomalousFeature> features = event.getFeatures();
        if (!features.isEmpty()) {
            sb.append("\n*Anomalous Metrics:*\n");
            for (AnomalousFeature f : features.subList(0, Math.min(MAX_FEATURES, features.size()))) {
                sb.append(String.format(Locale.ROOT, "  • %s: %.2f (expected: %.2f, z-score: %.2f)\n",
                        f.getFeature(), f.getObserved(), f.getExpected(), f.getZScore()));
            }
        }

        Map<String, Object> data = event.getPayload();
        if (data.get("duration") instanceof Number d) {
            sb.append(String.format(Locale.ROOT, "\n*Build Duration:* %.1fs\n", d.doubleValue()));
        }
        if (data.containsKey("result")) {
            sb.append("*Result:* ").append(data.get("result")).append('\n');
        }
        if (data.containsKey("failure_count")) {
            sb.append("*Failures:* ").append(data.get("failure_count")).append('\n');
        }
        return sb.toString();
    }

    String renderGrouped(List<AnomalyEvent> events, RoutingRule rule) {
        StringBuilder sb = new StringBuilder();
        sb.append(":rotating_light: *").append(events.size())
                .append(" Anomalies Detected in CI/CD Pipelines*\n");
        if (rule.getTeamName() != null) {
            sb.append("*Team:* ").append(rule.getTeamName()).append('\n');
        }
        sb.append('\n');

        int shown = Math.min(MAX_GROUPED_LINES, events.size());
        for (int i = 0; i < shown; i++) {
            AnomalyEvent e = events.get(i);
            sb.append(String.format(Locale.ROOT, "%d. *%s* - %s, z-score: %.2f\n",
                    i + 1, e.getJobName(), e.getEffectiveSeverity().name(), e.getMaxZScore()));
        }
        if (events.size() > shown) {
            sb.append("\n... and ").append(events.size() - shown).append(" more\n");
        }
        return sb.toString();
    }
}
