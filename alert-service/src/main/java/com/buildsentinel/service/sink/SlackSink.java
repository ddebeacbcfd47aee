package com.buildsentinel.service.sink;

import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.Channel;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts the rendered text to a Slack incoming webhook.
 *
 * @since 1.0.0
 */
public class SlackSink extends HttpJsonSink {

    static final String USERNAME = "CI/CD Anomaly Detector";
    static final String ICON_EMOJI = ":robot_face:";

    /**
     * @param webhookUrl     default incoming-webhook URL; may be blank when
     *                       every rule supplies its own
     * @param httpClient     shared client
     * @param mapper         JSON mapper
     * @param requestTimeout per-request timeout
     */
    public SlackSink(String webhookUrl, HttpClient httpClient, ObjectMapper mapper, Duration requestTimeout) {
        super(Channel.SLACK, webhookUrl, httpClient, mapper, requestTimeout);
    }

    @Override
    protected Map<String, Object> payload(AlertMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", message.getText());
        body.put("username", USERNAME);
        body.put("icon_emoji", ICON_EMOJI);
        return body;
    }
}
