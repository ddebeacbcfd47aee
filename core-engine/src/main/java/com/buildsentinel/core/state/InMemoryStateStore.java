package com.buildsentinel.core.state;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the latest snapshot in memory. Used when no state file is configured,
 * and by tests that simulate a restart by handing the same store to a second
 * engine.
 */
public class InMemoryStateStore implements StateStore {

    private final AtomicReference<StateSnapshot> latest = new AtomicReference<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public Optional<StateSnapshot> load() {
        return Optional.ofNullable(latest.get());
    }

    @Override
    public void save(StateSnapshot snapshot) {
        latest.set(snapshot);
        saves.incrementAndGet();
    }

    /**
     * @return number of {@link #save} calls so far
     */
    public int saveCount() {
        return saves.get();
    }
}
