package com.locationsharing.engine.service.sampling;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.SamplingPolicy;
import com.locationsharing.engine.exception.ProviderUnavailableException;
import com.locationsharing.engine.gateway.DeviceCommandGateway;
import com.locationsharing.engine.service.proximity.GeoDistance;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * {@link LocationSampler} fed by fixes the device streams in for one provider.
 *
 * A single-fix request is answered from the latest fix while it is younger
 * than the maximum fix age; otherwise the device is asked for a fix and the
 * request completes with the next one that arrives. Subscriptions translate
 * into sampling requests on the device.
 */
@Slf4j
public class DeviceFeedLocationSampler implements LocationSampler {

    private final String provider;
    private final DeviceCommandGateway commands;
    private final Clock clock;
    private final Duration maxFixAge;

    private volatile boolean enabled = true;
    private final AtomicReference<LocationSample> latest = new AtomicReference<>();
    private final List<CompletableFuture<LocationSample>> pendingRequests = new CopyOnWriteArrayList<>();
    private final List<FilteredListener> subscriptions = new CopyOnWriteArrayList<>();

    public DeviceFeedLocationSampler(String provider, DeviceCommandGateway commands, Clock clock, Duration maxFixAge) {
        this.provider = provider;
        this.commands = commands;
        this.clock = clock;
        this.maxFixAge = maxFixAge;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        if (this.enabled != enabled) {
            log.info("Provider '{}' {}", provider, enabled ? "enabled" : "disabled");
        }
        this.enabled = enabled;
        if (!enabled) {
            ProviderUnavailableException failure =
                new ProviderUnavailableException("Provider '" + provider + "' was switched off");
            pendingRequests.forEach(request -> request.completeExceptionally(failure));
        }
    }

    @Override
    public CompletableFuture<LocationSample> currentPosition(AccuracyClass accuracy, Duration timeout) {
        if (!enabled) {
            return CompletableFuture.failedFuture(
                new ProviderUnavailableException("Provider '" + provider + "' is switched off"));
        }

        LocationSample cached = latest.get();
        if (cached != null && cached.age(clock.instant()).compareTo(maxFixAge) <= 0) {
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<LocationSample> request = new CompletableFuture<>();
        pendingRequests.add(request);
        request.whenComplete((sample, error) -> pendingRequests.remove(request));
        commands.requestSingleFix(provider, accuracy, timeout);
        return request;
    }

    @Override
    public SampleSubscription subscribe(SamplingPolicy policy, Consumer<LocationSample> listener) {
        FilteredListener subscription = new FilteredListener(policy, listener);
        subscriptions.add(subscription);
        commands.requestSamplingUpdates(provider, policy);

        return () -> {
            if (subscriptions.remove(subscription) && subscriptions.isEmpty()) {
                commands.cancelSamplingUpdates(provider);
            }
        };
    }

    /**
     * Accepts a fix from the device. Fixes older than the latest one are dropped.
     */
    public void accept(LocationSample sample) {
        LocationSample previous = latest.getAndAccumulate(sample,
            (current, incoming) -> incoming.isNewerThan(current) ? incoming : current);
        if (!sample.isNewerThan(previous)) {
            log.debug("Dropping out-of-order fix for '{}': {}", provider, sample.toLogString());
            return;
        }

        for (CompletableFuture<LocationSample> request : pendingRequests) {
            request.complete(sample);
        }
        for (FilteredListener subscription : subscriptions) {
            subscription.offer(sample);
        }
    }

    /**
     * Applies the interval and displacement filter of one subscription.
     */
    private static final class FilteredListener {

        private final SamplingPolicy policy;
        private final Consumer<LocationSample> listener;
        private LocationSample lastDelivered;

        private FilteredListener(SamplingPolicy policy, Consumer<LocationSample> listener) {
            this.policy = policy;
            this.listener = listener;
        }

        private synchronized void offer(LocationSample sample) {
            if (lastDelivered != null) {
                double moved = GeoDistance.meters(lastDelivered, sample);
                Duration elapsed = Duration.between(lastDelivered.capturedAt(), sample.capturedAt());
                if (moved < policy.minDisplacementMeters() && elapsed.compareTo(policy.sampleInterval()) < 0) {
                    return;
                }
            }
            lastDelivered = sample;
            listener.accept(sample);
        }
    }
}
