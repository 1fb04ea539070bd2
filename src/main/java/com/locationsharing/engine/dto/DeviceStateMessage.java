package com.locationsharing.engine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Power, connectivity and consent report sent by the device whenever one of
 * them changes.
 */
public record DeviceStateMessage(
    @NotNull(message = "Battery level is required")
    @Min(value = 0, message = "Battery level must be >= 0")
    @Max(value = 100, message = "Battery level must be <= 100")
    Integer batteryLevel,

    boolean charging,

    boolean powerSaveMode,

    @NotNull(message = "Network class is required")
    NetworkClass networkClass,

    String manufacturer,

    boolean foregroundLocationGranted,

    boolean backgroundLocationGranted
) {

    public DeviceConditions toConditions() {
        return new DeviceConditions(
            batteryLevel,
            charging,
            powerSaveMode,
            networkClass,
            manufacturer,
            foregroundLocationGranted,
            backgroundLocationGranted
        );
    }
}
