package com.locationsharing.engine.gateway;

import com.locationsharing.engine.dto.GeofenceTransitionRecord;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.ProximityEvent;
import com.locationsharing.engine.dto.TrackingStatus;

/**
 * Hand-off point to the notification/UI surface. The core has no opinion on
 * rendering, sound or channels.
 */
public interface NotificationGateway {

    void proximity(ProximityEvent event);

    void geofenceTransition(GeofenceTransitionRecord transition);

    void trackingStatus(TrackingStatus status);

    void peerPresence(PeerPresenceView view);
}
