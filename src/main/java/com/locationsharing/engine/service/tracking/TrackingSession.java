package com.locationsharing.engine.service.tracking;

import java.time.Instant;

/**
 * One sharing session of one user on this device. Owned by the
 * {@link TrackingCoordinator}; destroyed, never paused, when sharing stops.
 *
 * The active flag is read by in-flight sampling cycles before they publish,
 * so deactivation takes effect for the caller immediately.
 */
final class TrackingSession {

    private final String userId;
    private final Instant startedAt;
    private volatile boolean active = true;
    private volatile TrackingStrategy activeStrategy;

    TrackingSession(String userId, Instant startedAt) {
        this.userId = userId;
        this.startedAt = startedAt;
    }

    String userId() {
        return userId;
    }

    Instant startedAt() {
        return startedAt;
    }

    boolean isActive() {
        return active;
    }

    void deactivate() {
        active = false;
    }

    TrackingStrategy activeStrategy() {
        return activeStrategy;
    }

    void setActiveStrategy(TrackingStrategy activeStrategy) {
        this.activeStrategy = activeStrategy;
    }
}
