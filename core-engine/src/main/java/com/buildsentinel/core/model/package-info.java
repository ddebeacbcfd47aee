/**
 * Domain model of the alert engine.
 *
 * <ul>
 * <li>{@link com.buildsentinel.core.model.AnomalyEvent}: upstream anomaly
 * record</li>
 * <li>{@link com.buildsentinel.core.model.RoutingRule}: ordered routing and
 * severity floor</li>
 * <li>{@link com.buildsentinel.core.model.MaintenanceWindow}: planned
 * silence</li>
 * <li>{@link com.buildsentinel.core.model.AlertBatch} /
 * {@link com.buildsentinel.core.model.AlertMessage}: what leaves the
 * engine</li>
 * <li>{@link com.buildsentinel.core.model.EngineStats}: counters and
 * gauges</li>
 * </ul>
 *
 * <p>
 * Everything here except {@link com.buildsentinel.core.model.AlertCounters}
 * is immutable. JSON names are snake_case to match the upstream producers.
 * </p>
 *
 * @since 1.0.0
 */
package com.buildsentinel.core.model;
