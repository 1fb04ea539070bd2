package com.locationsharing.engine.gateway;

import com.locationsharing.engine.dto.GeofenceTransitionRecord;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.ProximityEvent;
import com.locationsharing.engine.dto.TrackingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Broadcasts core events to the local UI over STOMP.
 *
 * Topics:
 * - /topic/proximity: nearby-peer events
 * - /topic/geofence: region ENTER/EXIT transitions
 * - /topic/tracking-status: coordinator transitions, including degraded status
 * - /topic/peers: peer presence view changes
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompNotificationGateway implements NotificationGateway {

    static final String PROXIMITY_TOPIC = "/topic/proximity";
    static final String GEOFENCE_TOPIC = "/topic/geofence";
    static final String TRACKING_STATUS_TOPIC = "/topic/tracking-status";
    static final String PEERS_TOPIC = "/topic/peers";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void proximity(ProximityEvent event) {
        send(PROXIMITY_TOPIC, event);
    }

    @Override
    public void geofenceTransition(GeofenceTransitionRecord transition) {
        send(GEOFENCE_TOPIC, transition);
    }

    @Override
    public void trackingStatus(TrackingStatus status) {
        send(TRACKING_STATUS_TOPIC, status);
    }

    @Override
    public void peerPresence(PeerPresenceView view) {
        send(PEERS_TOPIC, view);
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            // The UI may not be connected; events are not queued for it.
            log.warn("Failed to deliver {} to {}: {}", payload.getClass().getSimpleName(), destination, e.getMessage());
        }
    }
}
