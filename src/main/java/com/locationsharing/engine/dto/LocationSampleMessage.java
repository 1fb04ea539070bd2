package com.locationsharing.engine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.*;

import java.time.Instant;
import java.util.Locale;

/**
 * Raw fix streamed by the device's platform positioning adapter.
 *
 * The adapter forwards whatever the OS hands it; this record validates the
 * shape once at the boundary and converts into the immutable
 * {@link LocationSample} used by the core.
 *
 * @param provider  platform provider that produced the fix (gps, network, passive)
 * @param latitude  GPS latitude in decimal degrees (WGS84)
 * @param longitude GPS longitude in decimal degrees (WGS84)
 * @param accuracy  horizontal accuracy in meters
 * @param timestamp when the platform captured the fix (epoch milliseconds on the wire)
 */
public record LocationSampleMessage(
    @NotBlank(message = "Provider cannot be blank")
    String provider,

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @PositiveOrZero(message = "Accuracy must be >= 0")
    Double accuracy,

    @NotNull(message = "Timestamp is required")
    @JsonFormat(shape = JsonFormat.Shape.NUMBER)
    Instant timestamp
) {

    /** Accuracy assumed when the platform reports none. */
    private static final double UNKNOWN_ACCURACY_METERS = 100.0;

    public LocationSample toSample() {
        return new LocationSample(
            latitude,
            longitude,
            accuracy != null ? accuracy : UNKNOWN_ACCURACY_METERS,
            timestamp,
            provider.trim().toLowerCase(Locale.ROOT)
        );
    }
}
