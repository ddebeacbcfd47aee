package com.buildsentinel.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable process configuration for the alert service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the service
 * can be configured entirely through container env vars.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code STATE_FILE}: JSON snapshot path; blank keeps state in memory</li>
 * <li>{@code HTTP_PORT}: status/ingest server port (8080)</li>
 * <li>{@code FLUSH_INTERVAL_SECONDS}: period of the due-batch sweep (10)</li>
 * <li>{@code SLACK_WEBHOOK_URL}, {@code WEBHOOK_URL}: default HTTP targets</li>
 * <li>{@code SMTP_HOST}, {@code SMTP_PORT} (587), {@code SMTP_USER},
 * {@code SMTP_PASSWORD}, {@code ALERT_EMAIL}: email delivery</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Runtime
    // ---------------------------------------------------------------
    private final String stateFile;
    private final int httpPort;
    private final long flushIntervalSeconds;

    // ---------------------------------------------------------------
    // HTTP sinks
    // ---------------------------------------------------------------
    private final String slackWebhookUrl;
    private final String webhookUrl;

    // ---------------------------------------------------------------
    // Email sink
    // ---------------------------------------------------------------
    private final String smtpHost;
    private final int smtpPort;
    private final String smtpUser;
    private final String smtpPassword;
    private final String alertEmail;

    private ServiceConfig(Builder b) {
        this.stateFile = b.stateFile;
        this.httpPort = b.httpPort;
        this.flushIntervalSeconds = b.flushIntervalSeconds;
        this.slackWebhookUrl = b.slackWebhookUrl;
        this.webhookUrl = b.webhookUrl;
        this.smtpHost = b.smtpHost;
        this.smtpPort = b.smtpPort;
        this.smtpUser = b.smtpUser;
        this.smtpPassword = b.smtpPassword;
        this.alertEmail = b.alertEmail;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from an explicit variable map.
     */
    static ServiceConfig fromEnvironment(Map<String, String> environment) {
        Function<String, String> env = name -> {
            String value = environment.get(name);
            return value != null && !value.isBlank() ? value.trim() : null;
        };
        Builder builder = builder()
                .stateFile(env.apply("STATE_FILE"))
                .slackWebhookUrl(env.apply("SLACK_WEBHOOK_URL"))
                .webhookUrl(env.apply("WEBHOOK_URL"))
                .smtpHost(env.apply("SMTP_HOST"))
                .smtpUser(env.apply("SMTP_USER"))
                .smtpPassword(env.apply("SMTP_PASSWORD"))
                .alertEmail(env.apply("ALERT_EMAIL"));
        try {
            String port = env.apply("HTTP_PORT");
            if (port != null) {
                builder.httpPort(Integer.parseInt(port));
            }
            String flush = env.apply("FLUSH_INTERVAL_SECONDS");
            if (flush != null) {
                builder.flushIntervalSeconds(Long.parseLong(flush));
            }
            String smtpPort = env.apply("SMTP_PORT");
            if (smtpPort != null) {
                builder.smtpPort(Integer.parseInt(smtpPort));
            }
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return snapshot path, or {@code null} to keep state in memory
     */
    public String getStateFile() {
        return stateFile;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public long getFlushIntervalSeconds() {
        return flushIntervalSeconds;
    }

    public String getSlackWebhookUrl() {
        return slackWebhookUrl;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    public String getSmtpUser() {
        return smtpUser;
    }

    public String getSmtpPassword() {
        return smtpPassword;
    }

    public String getAlertEmail() {
        return alertEmail;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}. {@link #build()} checks ports
     * and the flush interval and reports every problem at once.
     */
    public static class Builder {
        private String stateFile;
        private int httpPort = 8080;
        private long flushIntervalSeconds = 10;
        private String slackWebhookUrl;
        private String webhookUrl;
        private String smtpHost;
        private int smtpPort = 587;
        private String smtpUser;
        private String smtpPassword;
        private String alertEmail;

        public Builder stateFile(String v) {
            this.stateFile = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder flushIntervalSeconds(long v) {
            this.flushIntervalSeconds = v;
            return this;
        }

        public Builder slackWebhookUrl(String v) {
            this.slackWebhookUrl = v;
            return this;
        }

        public Builder webhookUrl(String v) {
            this.webhookUrl = v;
            return this;
        }

        public Builder smtpHost(String v) {
            this.smtpHost = v;
            return this;
        }

        public Builder smtpPort(int v) {
            this.smtpPort = v;
            return this;
        }

        public Builder smtpUser(String v) {
            this.smtpUser = v;
            return this;
        }

        public Builder smtpPassword(String v) {
            this.smtpPassword = v;
            return this;
        }

        public Builder alertEmail(String v) {
            this.alertEmail = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public ServiceConfig build() {
            List<String> errors = new ArrayList<>();
            if (httpPort < 0 || httpPort > 65_535) {
                errors.add("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (flushIntervalSeconds < 1) {
                errors.add("flushIntervalSeconds must be >= 1, got: " + flushIntervalSeconds);
            }
            if (smtpPort < 1 || smtpPort > 65_535) {
                errors.add("smtpPort must be in [1, 65535], got: " + smtpPort);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid service configuration: " + String.join("; ", errors));
            }
            return new ServiceConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "stateFile='" + Objects.toString(stateFile, "<memory>") + '\'' +
                ", httpPort=" + httpPort +
                ", flushIntervalSeconds=" + flushIntervalSeconds +
                ", slack=" + (slackWebhookUrl != null ? "configured" : "off") +
                ", webhook=" + (webhookUrl != null ? "configured" : "off") +
                ", smtpHost='" + smtpHost + '\'' +
                ", smtpPort=" + smtpPort +
                ", alertEmail='" + alertEmail + '\'' +
                '}';
    }
}
