package com.locationsharing.engine.support;

import com.locationsharing.engine.dto.GeofenceTransitionRecord;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.ProximityEvent;
import com.locationsharing.engine.dto.TrackingStatus;
import com.locationsharing.engine.gateway.NotificationGateway;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationGateway implements NotificationGateway {

    public final List<ProximityEvent> proximityEvents = new CopyOnWriteArrayList<>();
    public final List<GeofenceTransitionRecord> transitions = new CopyOnWriteArrayList<>();
    public final List<TrackingStatus> statuses = new CopyOnWriteArrayList<>();
    public final List<PeerPresenceView> peerViews = new CopyOnWriteArrayList<>();

    @Override
    public void proximity(ProximityEvent event) {
        proximityEvents.add(event);
    }

    @Override
    public void geofenceTransition(GeofenceTransitionRecord transition) {
        transitions.add(transition);
    }

    @Override
    public void trackingStatus(TrackingStatus status) {
        statuses.add(status);
    }

    @Override
    public void peerPresence(PeerPresenceView view) {
        peerViews.add(view);
    }

    public TrackingStatus lastStatus() {
        return statuses.get(statuses.size() - 1);
    }
}
