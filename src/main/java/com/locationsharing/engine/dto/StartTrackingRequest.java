package com.locationsharing.engine.dto;

import jakarta.validation.constraints.NotBlank;

public record StartTrackingRequest(
    @NotBlank(message = "User ID cannot be blank")
    String userId
) {
}
