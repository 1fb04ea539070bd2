package com.locationsharing.engine.service.sampling;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.SamplingPolicy;
import com.locationsharing.engine.exception.ProviderUnavailableException;
import com.locationsharing.engine.gateway.DeviceCommandGateway;
import com.locationsharing.engine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DeviceFeedLocationSamplerTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final DeviceCommandGateway commands = mock(DeviceCommandGateway.class);
    private final DeviceLocationFeed feed = new DeviceLocationFeed(commands, clock, 10);
    private final DeviceFeedLocationSampler gps = feed.samplerFor("gps");

    @Test
    void shouldAnswerFromRecentFixWithoutAskingDevice() throws Exception {
        feed.accept(fix(52.52, 13.405, "gps"));
        clock.advance(Duration.ofSeconds(5));

        LocationSample sample = gps.currentPosition(AccuracyClass.HIGH, Duration.ofSeconds(15)).get();

        assertThat(sample.latitude()).isEqualTo(52.52);
        verify(commands, never()).requestSingleFix("gps", AccuracyClass.HIGH, Duration.ofSeconds(15));
    }

    @Test
    void shouldRequestFixFromDeviceWhenCachedOneIsTooOld() throws Exception {
        feed.accept(fix(52.52, 13.405, "gps"));
        clock.advance(Duration.ofSeconds(30));

        CompletableFuture<LocationSample> request = gps.currentPosition(AccuracyClass.MEDIUM, Duration.ofSeconds(15));
        assertThat(request).isNotDone();
        verify(commands).requestSingleFix("gps", AccuracyClass.MEDIUM, Duration.ofSeconds(15));

        feed.accept(fix(52.53, 13.41, "gps"));

        assertThat(request.get().latitude()).isEqualTo(52.53);
    }

    @Test
    void shouldFailPendingRequestsWhenProviderIsSwitchedOff() {
        CompletableFuture<LocationSample> request = gps.currentPosition(AccuracyClass.HIGH, Duration.ofSeconds(15));

        feed.setProviderEnabled("gps", false);

        assertThatThrownBy(request::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ProviderUnavailableException.class);
        assertThat(gps.isAvailable()).isFalse();
        assertThat(gps.currentPosition(AccuracyClass.HIGH, Duration.ofSeconds(15))).isCompletedExceptionally();
    }

    @Test
    void shouldFilterStreamedFixesByIntervalAndDisplacement() {
        SamplingPolicy policy = new SamplingPolicy(Duration.ofSeconds(15), 10, AccuracyClass.HIGH, false, false);
        List<LocationSample> delivered = new ArrayList<>();
        SampleSubscription subscription = gps.subscribe(policy, delivered::add);
        verify(commands).requestSamplingUpdates("gps", policy);

        feed.accept(fix(52.52, 13.405, "gps"));
        clock.advance(Duration.ofSeconds(5));
        feed.accept(fix(52.52001, 13.405, "gps"));
        clock.advance(Duration.ofSeconds(5));
        feed.accept(fix(52.5210, 13.405, "gps"));
        clock.advance(Duration.ofSeconds(20));
        feed.accept(fix(52.5210, 13.405, "gps"));

        assertThat(delivered).extracting(LocationSample::latitude).containsExactly(52.52, 52.5210, 52.5210);

        subscription.cancel();
        verify(commands).cancelSamplingUpdates("gps");
    }

    @Test
    void shouldDropOutOfOrderFixes() {
        List<LocationSample> delivered = new ArrayList<>();
        gps.subscribe(new SamplingPolicy(Duration.ofSeconds(1), 0, AccuracyClass.HIGH, false, false), delivered::add);

        LocationSample newer = fix(52.53, 13.41, "gps");
        LocationSample older = new LocationSample(52.52, 13.405, 5.0, clock.instant().minusSeconds(30), "gps");
        feed.accept(newer);
        feed.accept(older);

        assertThat(delivered).containsExactly(newer);
    }

    @Test
    void shouldFeedEveryFixToPassiveSampler() throws Exception {
        feed.accept(fix(52.52, 13.405, "network"));

        LocationSample passive = feed.samplerFor(DeviceLocationFeed.PASSIVE_PROVIDER)
            .currentPosition(AccuracyClass.LOW, Duration.ofSeconds(15)).get();

        assertThat(passive.sourceProvider()).isEqualTo("network");
    }

    private LocationSample fix(double latitude, double longitude, String provider) {
        return new LocationSample(latitude, longitude, 5.0, clock.instant(), provider);
    }
}
