package com.locationsharing.engine.service.tracking;

import com.locationsharing.engine.service.sampling.LocationSampler;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * One way of acquiring location, tried in priority order by the coordinator.
 *
 * @param name                      stable name used in status and logs
 * @param sampler                   positioning backend of this strategy
 * @param requiresBackgroundConsent whether the strategy may only run with background consent
 */
public record TrackingStrategy(String name, LocationSampler sampler, boolean requiresBackgroundConsent) {

    public TrackingStrategy {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sampler, "sampler");
    }

    public String provider() {
        return sampler.provider();
    }

    /**
     * Parses a definition of the form {@code name=provider} or
     * {@code name=provider:background}.
     */
    public static TrackingStrategy fromDefinition(String definition, Function<String, ? extends LocationSampler> samplers) {
        String[] nameAndSource = definition.trim().split("=", 2);
        if (nameAndSource.length != 2 || nameAndSource[0].isBlank() || nameAndSource[1].isBlank()) {
            throw new IllegalArgumentException("Invalid strategy definition '" + definition
                + "', expected name=provider[:background]");
        }
        String[] providerAndFlag = nameAndSource[1].trim().split(":", 2);
        boolean background = providerAndFlag.length == 2;
        if (background && !"background".equalsIgnoreCase(providerAndFlag[1].trim())) {
            throw new IllegalArgumentException("Unknown strategy flag '" + providerAndFlag[1] + "' in '" + definition + "'");
        }
        String provider = providerAndFlag[0].trim().toLowerCase(Locale.ROOT);
        return new TrackingStrategy(nameAndSource[0].trim(), samplers.apply(provider), background);
    }
}
