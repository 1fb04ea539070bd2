package com.locationsharing.engine.service.proximity;

import java.time.Duration;

/**
 * @param thresholdMeters distance at or below which a peer counts as nearby
 * @param cooldown        minimum time between two events for the same pair
 */
public record ProximitySettings(double thresholdMeters, Duration cooldown) {

    public ProximitySettings {
        if (thresholdMeters <= 0 || Double.isNaN(thresholdMeters)) {
            throw new IllegalArgumentException("thresholdMeters must be positive");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    public static ProximitySettings defaults() {
        return new ProximitySettings(500.0, Duration.ofMinutes(10));
    }
}
