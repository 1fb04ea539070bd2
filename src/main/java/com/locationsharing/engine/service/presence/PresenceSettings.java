package com.locationsharing.engine.service.presence;

import java.time.Duration;

/**
 * Presence protocol timing.
 *
 * The heartbeat interval must be at most half the staleness threshold so that
 * at least one missed beat is tolerated before a peer is declared offline.
 */
public record PresenceSettings(
    Duration heartbeatInterval,
    Duration stalenessThreshold,
    Duration sweepInterval,
    Duration retryInitialBackoff,
    Duration retryMaxBackoff,
    int maxPublishAttempts,
    String keyPrefix
) {

    public PresenceSettings {
        if (heartbeatInterval == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (stalenessThreshold == null || heartbeatInterval.multipliedBy(2).compareTo(stalenessThreshold) > 0) {
            throw new IllegalArgumentException(String.format(
                "stalenessThreshold (%s) must be at least twice the heartbeat interval (%s)",
                stalenessThreshold, heartbeatInterval));
        }
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        if (retryInitialBackoff == null || retryMaxBackoff == null
            || retryMaxBackoff.compareTo(retryInitialBackoff) < 0) {
            throw new IllegalArgumentException("retryMaxBackoff must be >= retryInitialBackoff");
        }
        if (maxPublishAttempts < 1) {
            throw new IllegalArgumentException("maxPublishAttempts must be >= 1");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            keyPrefix = "presence/";
        }
    }

    public static PresenceSettings defaults() {
        return new PresenceSettings(
            Duration.ofSeconds(30),
            Duration.ofSeconds(120),
            Duration.ofSeconds(10),
            Duration.ofSeconds(2),
            Duration.ofSeconds(30),
            5,
            "presence/"
        );
    }

    public String keyFor(String userId) {
        return keyPrefix + userId;
    }

    /**
     * Delay before retry number {@code attempt} (1-based) of a failed publish.
     */
    public Duration retryBackoff(int attempt) {
        Duration delay = retryInitialBackoff;
        for (int i = 1; i < attempt && delay.compareTo(retryMaxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(retryMaxBackoff) > 0 ? retryMaxBackoff : delay;
    }
}
