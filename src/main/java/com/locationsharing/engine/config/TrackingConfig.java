package com.locationsharing.engine.config;

import com.locationsharing.engine.gateway.DeviceCommandGateway;
import com.locationsharing.engine.gateway.NotificationGateway;
import com.locationsharing.engine.service.power.BatteryAdaptationPolicy;
import com.locationsharing.engine.service.power.DeviceConditionRegistry;
import com.locationsharing.engine.service.power.PowerManagementProperties;
import com.locationsharing.engine.service.presence.PresenceSyncEngine;
import com.locationsharing.engine.service.sampling.DeviceLocationFeed;
import com.locationsharing.engine.service.sampling.LastKnownLocation;
import com.locationsharing.engine.service.tracking.SchedulerTrackingWorker;
import com.locationsharing.engine.service.tracking.SharingIntentStore;
import com.locationsharing.engine.service.tracking.TrackingCoordinator;
import com.locationsharing.engine.service.tracking.TrackingSettings;
import com.locationsharing.engine.service.tracking.TrackingStrategy;
import com.locationsharing.engine.service.tracking.TrackingWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Wiring of the tracking core.
 *
 * Threads:
 * - trackingTaskScheduler: the single tracking worker; sampling cycles,
 *   health checks, heartbeats, staleness sweeps, store callbacks, publish retries
 * - taskScheduler: maintenance (@Scheduled region refresh) and transition
 *   persistence, so the worker never waits on the database
 *
 * Strategy list format ({@code location-sharing.tracking.strategies}), highest
 * priority first: {@code name=provider[:background]}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PowerManagementProperties.class)
public class TrackingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "trackingTaskScheduler")
    public ThreadPoolTaskScheduler trackingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("tracking-worker-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(
        @Value("${location-sharing.maintenance.pool-size:2}") int poolSize
    ) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("maintenance-");
        return scheduler;
    }

    @Bean
    public TrackingWorker trackingWorker(
        @Qualifier("trackingTaskScheduler") ThreadPoolTaskScheduler trackingTaskScheduler,
        Clock clock
    ) {
        return new SchedulerTrackingWorker(trackingTaskScheduler, clock);
    }

    @Bean
    public TrackingSettings trackingSettings(
        @Value("${location-sharing.tracking.startup-timeout-seconds:15}") long startupTimeoutSeconds,
        @Value("${location-sharing.tracking.sample-timeout-seconds:15}") long sampleTimeoutSeconds,
        @Value("${location-sharing.tracking.health-check-interval-seconds:60}") long healthCheckSeconds,
        @Value("${location-sharing.tracking.max-consecutive-timeouts:3}") int maxConsecutiveTimeouts,
        @Value("${location-sharing.tracking.strategy-backoff-minutes:5}") long strategyBackoffMinutes,
        @Value("${location-sharing.tracking.exhausted-backoff-initial-seconds:30}") long exhaustedInitialSeconds,
        @Value("${location-sharing.tracking.exhausted-backoff-max-minutes:10}") long exhaustedMaxMinutes,
        @Value("${location-sharing.tracking.cadence-tolerance-factor:2}") int cadenceToleranceFactor
    ) {
        TrackingSettings settings = new TrackingSettings(
            Duration.ofSeconds(startupTimeoutSeconds),
            Duration.ofSeconds(sampleTimeoutSeconds),
            Duration.ofSeconds(healthCheckSeconds),
            maxConsecutiveTimeouts,
            Duration.ofMinutes(strategyBackoffMinutes),
            Duration.ofSeconds(exhaustedInitialSeconds),
            Duration.ofMinutes(exhaustedMaxMinutes),
            cadenceToleranceFactor
        );
        log.info("Tracking settings: {}", settings);
        return settings;
    }

    @Bean
    public TrackingCoordinator trackingCoordinator(
        @Value("${location-sharing.tracking.strategies:foreground-gps=gps,background-network=network:background,passive-fallback=passive:background}")
        String[] strategyDefinitions,
        DeviceLocationFeed deviceLocationFeed,
        BatteryAdaptationPolicy batteryAdaptationPolicy,
        DeviceConditionRegistry deviceConditionRegistry,
        PresenceSyncEngine presenceSyncEngine,
        LastKnownLocation lastKnownLocation,
        NotificationGateway notificationGateway,
        DeviceCommandGateway deviceCommandGateway,
        TrackingWorker trackingWorker,
        Clock clock,
        TrackingSettings trackingSettings,
        SharingIntentStore sharingIntentStore
    ) {
        List<TrackingStrategy> strategies = Arrays.stream(strategyDefinitions)
            .filter(definition -> !definition.isBlank())
            .map(definition -> TrackingStrategy.fromDefinition(definition, deviceLocationFeed::samplerFor))
            .toList();
        log.info("Tracking strategies (priority order): {}",
            strategies.stream().map(TrackingStrategy::name).toList());

        return new TrackingCoordinator(
            strategies,
            batteryAdaptationPolicy,
            deviceConditionRegistry,
            presenceSyncEngine,
            lastKnownLocation,
            notificationGateway,
            deviceCommandGateway,
            trackingWorker,
            clock,
            trackingSettings,
            sharingIntentStore
        );
    }
}
