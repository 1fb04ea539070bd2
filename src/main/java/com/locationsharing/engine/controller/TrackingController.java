package com.locationsharing.engine.controller;

import com.locationsharing.engine.dto.StartTrackingRequest;
import com.locationsharing.engine.dto.TrackingStatus;
import com.locationsharing.engine.service.tracking.TrackingCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Sharing on/off switch used by the local UI.
 *
 * Enabling sharing either reaches a running tracking state within a bounded
 * time or fails with a specific reason (see {@link ApiExceptionHandler}).
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tracking", description = "Start and stop location sharing")
public class TrackingController {

    private final TrackingCoordinator trackingCoordinator;

    @Operation(
            summary = "Enable location sharing",
            description = "Tries the tracking strategies in priority order until one produces a fix. " +
                    "Fails with 403 without consent, 503 when every strategy failed (sharing stays " +
                    "enabled and retries in the background) and 504 when tracking did not settle in time."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Tracking is running",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = "{\"userId\":\"alice\",\"phase\":\"RUNNING\",\"activeStrategy\":\"foreground-gps\",\"degraded\":false}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "403", description = "Location consent missing"),
            @ApiResponse(responseCode = "503", description = "No strategy could produce a fix")
    })
    @PostMapping("/start")
    public ResponseEntity<TrackingStatus> start(@Valid @RequestBody StartTrackingRequest request) {
        log.info("Sharing enable requested for user {}", request.userId());
        return ResponseEntity.ok(trackingCoordinator.start(request.userId()));
    }

    @Operation(summary = "Disable location sharing", description = "Withdraws the published location immediately.")
    @PostMapping("/stop")
    public ResponseEntity<TrackingStatus> stop() {
        trackingCoordinator.stop();
        return ResponseEntity.ok(trackingCoordinator.status());
    }

    @Operation(summary = "Sign out", description = "Stops sharing and removes the presence record.")
    @PostMapping("/sign-out")
    public ResponseEntity<TrackingStatus> signOut() {
        trackingCoordinator.signOut();
        return ResponseEntity.ok(trackingCoordinator.status());
    }

    @Operation(summary = "Current tracking status")
    @GetMapping("/status")
    public ResponseEntity<TrackingStatus> status() {
        return ResponseEntity.ok(trackingCoordinator.status());
    }

    @GetMapping("/strategies")
    public ResponseEntity<?> strategies() {
        return ResponseEntity.ok(Map.of("strategies", trackingCoordinator.strategyNames()));
    }
}
