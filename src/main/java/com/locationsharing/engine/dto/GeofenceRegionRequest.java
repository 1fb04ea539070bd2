package com.locationsharing.engine.dto;

import jakarta.validation.constraints.*;

/**
 * Request to create a circular geofence region.
 */
public record GeofenceRegionRequest(
    @NotBlank(message = "Owner ID cannot be blank")
    String ownerId,

    @NotBlank(message = "Label cannot be blank")
    @Size(max = 255, message = "Label must be at most 255 characters")
    String label,

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @NotNull(message = "Radius is required")
    @DecimalMin(value = "10.0", message = "Radius must be >= 10 meters")
    @DecimalMax(value = "50000.0", message = "Radius must be <= 50 km")
    Double radiusMeters
) {
}
