package com.locationsharing.engine.config;

import com.locationsharing.engine.service.presence.PresenceSettings;
import com.locationsharing.engine.service.proximity.ProximitySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Presence protocol and proximity settings.
 *
 * The heartbeat/staleness pairing is a tunable: the defaults (30s heartbeat,
 * 120s staleness) tolerate two to three missed beats. Start-up fails if the
 * heartbeat is longer than half the staleness threshold.
 */
@Slf4j
@Configuration
public class PresenceConfig {

    @Bean
    public PresenceSettings presenceSettings(
        @Value("${location-sharing.presence.heartbeat-interval-seconds:30}") long heartbeatSeconds,
        @Value("${location-sharing.presence.staleness-threshold-seconds:120}") long stalenessSeconds,
        @Value("${location-sharing.presence.sweep-interval-seconds:10}") long sweepSeconds,
        @Value("${location-sharing.presence.retry.initial-backoff-seconds:2}") long retryInitialSeconds,
        @Value("${location-sharing.presence.retry.max-backoff-seconds:30}") long retryMaxSeconds,
        @Value("${location-sharing.presence.retry.max-attempts:5}") int maxAttempts,
        @Value("${location-sharing.presence.key-prefix:presence/}") String keyPrefix
    ) {
        PresenceSettings settings = new PresenceSettings(
            Duration.ofSeconds(heartbeatSeconds),
            Duration.ofSeconds(stalenessSeconds),
            Duration.ofSeconds(sweepSeconds),
            Duration.ofSeconds(retryInitialSeconds),
            Duration.ofSeconds(retryMaxSeconds),
            maxAttempts,
            keyPrefix
        );
        log.info("Presence settings: heartbeat={}s, staleness={}s, sweep={}s",
            heartbeatSeconds, stalenessSeconds, sweepSeconds);
        return settings;
    }

    @Bean
    public ProximitySettings proximitySettings(
        @Value("${location-sharing.proximity.threshold-meters:500}") double thresholdMeters,
        @Value("${location-sharing.proximity.cooldown-minutes:10}") long cooldownMinutes
    ) {
        return new ProximitySettings(thresholdMeters, Duration.ofMinutes(cooldownMinutes));
    }
}
