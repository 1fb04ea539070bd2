package com.locationsharing.engine.controller;

import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.PublishedPresence;
import com.locationsharing.engine.service.presence.LastSeenFormatter;
import com.locationsharing.engine.service.presence.PresenceSyncEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of presence: the peers this device can see and the record it
 * publishes for its own user.
 */
@RestController
@RequestMapping("/api/presence")
@RequiredArgsConstructor
@Tag(name = "Presence", description = "Peer presence as derived on this device")
public class PresenceController {

    private final PresenceSyncEngine presenceSyncEngine;
    private final Clock clock;

    @Operation(
            summary = "List peers",
            description = "Returns every known peer with its derived state. Locations are only included for online peers."
    )
    @GetMapping("/peers")
    public ResponseEntity<List<Map<String, Object>>> peers() {
        Instant now = clock.instant();
        List<Map<String, Object>> peers = presenceSyncEngine.peerViews().stream()
            .map(view -> toResponse(view, now))
            .toList();
        return ResponseEntity.ok(peers);
    }

    @GetMapping("/peers/{userId}")
    public ResponseEntity<?> peer(@PathVariable String userId) {
        Optional<PeerPresenceView> view = presenceSyncEngine.peerView(userId);
        if (view.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toResponse(view.get(), clock.instant()));
    }

    @Operation(summary = "Own published presence")
    @GetMapping("/self")
    public ResponseEntity<?> self() {
        Optional<PublishedPresence> presence = presenceSyncEngine.localPresence();
        if (presence.isEmpty()) {
            return ResponseEntity.ok(Map.of("sharingEnabled", false));
        }
        return ResponseEntity.ok(presence.get());
    }

    private static Map<String, Object> toResponse(PeerPresenceView view, Instant now) {
        // HashMap: location and timestamps may be null.
        Map<String, Object> response = new HashMap<>();
        response.put("userId", view.userId());
        response.put("online", view.online());
        response.put("state", view.state());
        response.put("lastSeen", LastSeenFormatter.format(view, now));
        response.put("lastHeartbeatAt", view.lastHeartbeatAt());
        if (view.hasLocation()) {
            response.put("location", Map.of(
                "latitude", view.location().latitude(),
                "longitude", view.location().longitude(),
                "accuracyMeters", view.location().accuracyMeters(),
                "capturedAt", view.location().capturedAt()
            ));
        }
        return response;
    }
}
