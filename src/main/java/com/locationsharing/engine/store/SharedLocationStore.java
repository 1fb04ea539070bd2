package com.locationsharing.engine.store;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Replicated key-value store shared by every device of the sharing group.
 *
 * Values are opaque payloads. Writes are last-writer-wins by revision: a
 * put carrying a revision lower than or equal to the stored one is rejected.
 * Change callbacks may arrive on any thread and in any order relative to
 * local writes.
 */
public interface SharedLocationStore {

    /**
     * Writes the payload if {@code revision} is newer than the stored one.
     *
     * @return false if the write lost against a newer revision
     * @throws com.locationsharing.engine.exception.PublishFailureException on transport failure
     */
    boolean put(String key, String payload, long revision);

    /**
     * @throws com.locationsharing.engine.exception.PublishFailureException on transport failure
     */
    void remove(String key);

    Optional<String> get(String key);

    /**
     * Registers a listener for changes of keys matching {@code keyPattern}
     * ({@code *} matches any suffix).
     */
    StoreSubscription onValueChanged(String keyPattern, Consumer<StoreChange> listener);
}
