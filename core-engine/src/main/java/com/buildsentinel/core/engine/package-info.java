/**
 * The alert decision pipeline.
 *
 * <p>
 * {@link com.buildsentinel.core.engine.AlertEngine} owns one instance of each
 * stage ({@link com.buildsentinel.core.engine.MaintenanceRegistry},
 * {@link com.buildsentinel.core.engine.Deduplicator},
 * {@link com.buildsentinel.core.engine.Router},
 * {@link com.buildsentinel.core.engine.RateLimiter},
 * {@link com.buildsentinel.core.engine.BatchAggregator}) and guards them with a
 * single lock. The stage classes themselves are not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
package com.buildsentinel.core.engine;
