package com.locationsharing.engine.service.sampling;

import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.gateway.DeviceCommandGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes fixes streamed by the device to the sampler of their provider.
 *
 * The passive sampler sees every fix from every provider, the same way the
 * platform's passive provider piggybacks on other apps' requests.
 */
@Slf4j
@Component
public class DeviceLocationFeed {

    public static final String PASSIVE_PROVIDER = "passive";

    private final DeviceCommandGateway commands;
    private final Clock clock;
    private final Duration maxFixAge;
    private final Map<String, DeviceFeedLocationSampler> samplers = new ConcurrentHashMap<>();

    public DeviceLocationFeed(
        DeviceCommandGateway commands,
        Clock clock,
        @Value("${location-sharing.sampling.max-fix-age-seconds:10}") long maxFixAgeSeconds
    ) {
        this.commands = commands;
        this.clock = clock;
        this.maxFixAge = Duration.ofSeconds(maxFixAgeSeconds);
    }

    public DeviceFeedLocationSampler samplerFor(String provider) {
        return samplers.computeIfAbsent(provider,
            p -> new DeviceFeedLocationSampler(p, commands, clock, maxFixAge));
    }

    public void accept(LocationSample sample) {
        log.debug("Fix from device: {}", sample.toLogString());
        samplerFor(sample.sourceProvider()).accept(sample);
        if (!PASSIVE_PROVIDER.equals(sample.sourceProvider())) {
            samplerFor(PASSIVE_PROVIDER).accept(sample);
        }
    }

    public void setProviderEnabled(String provider, boolean enabled) {
        samplerFor(provider).setEnabled(enabled);
    }
}
