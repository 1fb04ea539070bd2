package com.locationsharing.engine.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable position fix produced by a {@code LocationSampler}.
 *
 * Samples are facts: once captured they are passed through the tracking core
 * and published, never mutated. The compact constructor rejects coordinates
 * outside WGS84 bounds so an invalid fix cannot enter the pipeline.
 *
 * @param latitude       latitude in decimal degrees (WGS84)
 * @param longitude      longitude in decimal degrees (WGS84)
 * @param accuracyMeters horizontal accuracy radius in meters
 * @param capturedAt     when the platform captured the fix
 * @param sourceProvider platform provider that produced it (gps, network, passive)
 */
public record LocationSample(
    double latitude,
    double longitude,
    double accuracyMeters,
    Instant capturedAt,
    String sourceProvider
) {

    public LocationSample {
        if (latitude < -90.0 || latitude > 90.0 || Double.isNaN(latitude)) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0 || Double.isNaN(longitude)) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]: " + longitude);
        }
        if (accuracyMeters < 0 || Double.isNaN(accuracyMeters)) {
            throw new IllegalArgumentException("Accuracy must be >= 0: " + accuracyMeters);
        }
        Objects.requireNonNull(capturedAt, "capturedAt");
        Objects.requireNonNull(sourceProvider, "sourceProvider");
    }

    /**
     * Age of this fix relative to {@code now}; never negative.
     */
    public Duration age(Instant now) {
        Duration age = Duration.between(capturedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    public boolean isNewerThan(LocationSample other) {
        return other == null || capturedAt.isAfter(other.capturedAt());
    }

    /**
     * Compact representation for logging. Coordinates are rounded to ~100m.
     */
    public String toLogString() {
        return String.format("Sample[%.3f,%.3f ±%.0fm via %s at %s]",
            latitude, longitude, accuracyMeters, sourceProvider, capturedAt);
    }
}
