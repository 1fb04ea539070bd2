package com.locationsharing.engine.service.tracking;

import java.time.Duration;

/**
 * Timing parameters of the tracking coordinator.
 *
 * @param startupTimeout          time a strategy has to prove it can produce a fix
 * @param sampleTimeout           time a running sampling cycle waits for a fix
 * @param healthCheckInterval     period of the active-strategy health check
 * @param maxConsecutiveTimeouts  timed-out cycles in a row that trigger failover
 * @param strategyBackoff         how long a failed strategy is skipped
 * @param exhaustedBackoffInitial first retry delay once every strategy failed
 * @param exhaustedBackoffMax     cap of the exhausted retry delay
 * @param cadenceToleranceFactor  health check fails when the last fix is older than cadence times this
 */
public record TrackingSettings(
    Duration startupTimeout,
    Duration sampleTimeout,
    Duration healthCheckInterval,
    int maxConsecutiveTimeouts,
    Duration strategyBackoff,
    Duration exhaustedBackoffInitial,
    Duration exhaustedBackoffMax,
    int cadenceToleranceFactor
) {

    public TrackingSettings {
        requirePositive(startupTimeout, "startupTimeout");
        requirePositive(sampleTimeout, "sampleTimeout");
        requirePositive(healthCheckInterval, "healthCheckInterval");
        requirePositive(strategyBackoff, "strategyBackoff");
        requirePositive(exhaustedBackoffInitial, "exhaustedBackoffInitial");
        requirePositive(exhaustedBackoffMax, "exhaustedBackoffMax");
        if (maxConsecutiveTimeouts < 1) {
            throw new IllegalArgumentException("maxConsecutiveTimeouts must be >= 1");
        }
        if (cadenceToleranceFactor < 1) {
            throw new IllegalArgumentException("cadenceToleranceFactor must be >= 1");
        }
        if (exhaustedBackoffMax.compareTo(exhaustedBackoffInitial) < 0) {
            throw new IllegalArgumentException("exhaustedBackoffMax must be >= exhaustedBackoffInitial");
        }
    }

    public static TrackingSettings defaults() {
        return new TrackingSettings(
            Duration.ofSeconds(15),
            Duration.ofSeconds(15),
            Duration.ofSeconds(60),
            3,
            Duration.ofMinutes(5),
            Duration.ofSeconds(30),
            Duration.ofMinutes(10),
            2
        );
    }

    /**
     * Delay before the n-th retry (1-based) after every strategy failed.
     */
    public Duration exhaustedBackoff(int attempt) {
        Duration delay = exhaustedBackoffInitial;
        for (int i = 1; i < attempt && delay.compareTo(exhaustedBackoffMax) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(exhaustedBackoffMax) > 0 ? exhaustedBackoffMax : delay;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
