/**
 * Persistence of dedup fingerprints, rate-limit timestamps, rules,
 * maintenance windows and counters.
 *
 * <p>
 * {@link com.buildsentinel.core.state.JsonFileStateStore} is the production
 * store; {@link com.buildsentinel.core.state.InMemoryStateStore} runs the
 * engine without a state file.
 * </p>
 *
 * @since 1.0.0
 */
package com.buildsentinel.core.state;
