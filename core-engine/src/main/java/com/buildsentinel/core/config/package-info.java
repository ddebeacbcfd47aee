/**
 * YAML configuration for the alert engine.
 *
 * <p>
 * {@link com.buildsentinel.core.config.AlertingConfigLoader} reads
 * {@code alerting.yml} into an
 * {@link com.buildsentinel.core.config.AlertingConfig}, validates it, and the
 * config converts itself into engine settings, routing rules and maintenance
 * windows.
 * </p>
 *
 * @since 1.0.0
 */
package com.buildsentinel.core.config;
