package com.locationsharing.engine.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Sent by the device when a platform provider is switched on or off
 * (e.g. the user disables GPS).
 */
public record ProviderStatusMessage(
    @NotBlank(message = "Provider cannot be blank")
    String provider,

    boolean enabled
) {
}
