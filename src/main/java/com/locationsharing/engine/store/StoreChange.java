package com.locationsharing.engine.store;

/**
 * One change notification. A null payload means the key was removed.
 */
public record StoreChange(String key, String payload) {

    public boolean isRemoval() {
        return payload == null || payload.isEmpty();
    }
}
