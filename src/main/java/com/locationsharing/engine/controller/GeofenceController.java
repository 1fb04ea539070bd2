package com.locationsharing.engine.controller;

import com.locationsharing.engine.dto.GeofenceRegionRequest;
import com.locationsharing.engine.entity.GeofenceRegion;
import com.locationsharing.engine.entity.GeofenceTransition;
import com.locationsharing.engine.service.geofence.GeofenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Geofence region management and transition history.
 */
@RestController
@RequestMapping("/api/geofences")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geofences", description = "Circular regions evaluated against peers' locations")
public class GeofenceController {

    private final GeofenceService geofenceService;
    private final Clock clock;

    /**
     * Example request:
     * POST /api/geofences
     * {
     *   "ownerId": "alice",
     *   "label": "Home",
     *   "latitude": 52.5200,
     *   "longitude": 13.4050,
     *   "radiusMeters": 150
     * }
     */
    @Operation(summary = "Create a region", description = "Creates a circular region owned by a user.")
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody GeofenceRegionRequest request) {
        GeofenceRegion region = geofenceService.createRegion(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(region));
    }

    @Operation(summary = "List active regions")
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list(
        @Parameter(description = "Only regions of this owner", example = "alice")
        @RequestParam(required = false) String ownerId
    ) {
        return ResponseEntity.ok(geofenceService.getRegions(ownerId).stream()
            .map(GeofenceController::toResponse)
            .toList());
    }

    @Operation(summary = "Delete a region")
    @DeleteMapping("/{regionId}")
    public ResponseEntity<?> delete(@PathVariable Long regionId) {
        if (!geofenceService.deleteRegion(regionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of(
            "status", "DELETED",
            "regionId", regionId
        ));
    }

    @Operation(
            summary = "Recent transitions",
            description = "ENTER/EXIT transitions since the given instant (default: last 24 hours)."
    )
    @GetMapping("/transitions")
    public ResponseEntity<List<GeofenceTransition>> transitions(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since
    ) {
        Instant from = since != null ? since : clock.instant().minus(Duration.ofHours(24));
        return ResponseEntity.ok(geofenceService.getRecentTransitions(from));
    }

    @GetMapping("/transitions/peer/{peerId}")
    public ResponseEntity<List<GeofenceTransition>> peerTransitions(@PathVariable String peerId) {
        return ResponseEntity.ok(geofenceService.getPeerTransitions(peerId));
    }

    @GetMapping("/{regionId}/transitions")
    public ResponseEntity<List<GeofenceTransition>> regionTransitions(@PathVariable Long regionId) {
        return ResponseEntity.ok(geofenceService.getRegionTransitions(regionId));
    }

    @PostMapping("/cache/refresh")
    public ResponseEntity<?> refreshCache() {
        int refreshed = geofenceService.refreshRegions();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "regionsRefreshed", refreshed
        ));
    }

    // The JTS Point is not serialized directly.
    private static Map<String, Object> toResponse(GeofenceRegion region) {
        return Map.of(
            "id", region.getId(),
            "ownerId", region.getOwnerId(),
            "label", region.getLabel(),
            "latitude", region.getLatitude(),
            "longitude", region.getLongitude(),
            "radiusMeters", region.getRadiusMeters()
        );
    }
}
