package com.buildsentinel.core.state;

import java.util.Optional;

/**
 * Durable home of the engine's suppression state.
 */
public interface StateStore {

    /**
     * @return the last saved snapshot, or empty if nothing was ever saved
     * @throws StateStoreException if a snapshot exists but cannot be read
     */
    Optional<StateSnapshot> load();

    /**
     * Replace the stored snapshot. Implementations must never leave a partially
     * written snapshot behind.
     *
     * @throws StateStoreException if the snapshot cannot be written
     */
    void save(StateSnapshot snapshot);
}
