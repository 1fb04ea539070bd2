package com.locationsharing.engine.support;

import com.locationsharing.engine.service.tracking.SharingIntentStore;

import java.util.Optional;

/**
 * {@link SharingIntentStore} that survives "restarts" within one test by
 * being shared between coordinator instances.
 */
public class InMemorySharingIntentStore implements SharingIntentStore {

    private volatile String userId;

    @Override
    public void remember(String userId) {
        this.userId = userId;
    }

    @Override
    public void forget() {
        this.userId = null;
    }

    @Override
    public Optional<String> load() {
        return Optional.ofNullable(userId);
    }
}
