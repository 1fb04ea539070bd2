package com.locationsharing.engine.service.sampling;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.SamplingPolicy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * One platform positioning backend seen through a single capability:
 * "get a fix now" and "stream fixes filtered by interval/displacement".
 *
 * Implementations never block the caller. Failures are reported through the
 * returned future, as a {@code ProviderUnavailableException},
 * {@code PermissionDeniedException} or {@code SampleTimeoutException}.
 */
public interface LocationSampler {

    /**
     * Platform provider name (gps, network, passive).
     */
    String provider();

    /**
     * False when the provider is known to be switched off or missing.
     */
    boolean isAvailable();

    /**
     * Requests a single fix. The caller bounds the wait; cancelling the
     * returned future releases any pending request.
     */
    CompletableFuture<LocationSample> currentPosition(AccuracyClass accuracy, Duration timeout);

    /**
     * Streams fixes to {@code listener}, filtered by the policy's interval and
     * minimum displacement.
     */
    SampleSubscription subscribe(SamplingPolicy policy, Consumer<LocationSample> listener);
}
