package com.locationsharing.engine.dto;

import java.time.Duration;
import java.time.Instant;

/**
 * Locally derived view of one peer. Never persisted.
 *
 * Recency of the heartbeat, not presence of a sample, decides liveness: a
 * peer whose heartbeat is older than the staleness threshold is offline and
 * its cached coordinates are withheld. Only {@link PresenceState#ONLINE}
 * views expose a location.
 *
 * @param userId          peer id
 * @param online          true only for {@link PresenceState#ONLINE}
 * @param state           derived presence state
 * @param location        peer's last fix, null unless online
 * @param lastHeartbeatAt last heartbeat seen, null when unknown
 * @param lastFixAt       capture time of the last fix seen, null when unknown
 */
public record PeerPresenceView(
    String userId,
    boolean online,
    PresenceState state,
    LocationSample location,
    Instant lastHeartbeatAt,
    Instant lastFixAt
) {

    /**
     * Derives the view of a published record at {@code now}.
     */
    public static PeerPresenceView derive(PublishedPresence presence, Instant now, Duration stalenessThreshold) {
        Instant lastFixAt = presence.lastSample() != null ? presence.lastSample().capturedAt() : null;

        if (!presence.sharingEnabled()) {
            return new PeerPresenceView(presence.userId(), false, PresenceState.NOT_SHARING,
                null, presence.lastHeartbeatAt(), null);
        }

        Duration heartbeatAge = Duration.between(presence.lastHeartbeatAt(), now);
        if (heartbeatAge.compareTo(stalenessThreshold) >= 0) {
            return new PeerPresenceView(presence.userId(), false, PresenceState.OFFLINE,
                null, presence.lastHeartbeatAt(), lastFixAt);
        }

        if (presence.trackingHealth() == TrackingHealth.NO_RECENT_FIX) {
            return new PeerPresenceView(presence.userId(), false, PresenceState.NO_RECENT_FIX,
                null, presence.lastHeartbeatAt(), lastFixAt);
        }

        return new PeerPresenceView(presence.userId(), true, PresenceState.ONLINE,
            presence.lastSample(), presence.lastHeartbeatAt(), lastFixAt);
    }

    /**
     * View of a peer whose record was removed from the store.
     */
    public static PeerPresenceView removed(String userId) {
        return new PeerPresenceView(userId, false, PresenceState.NOT_SHARING, null, null, null);
    }

    public boolean hasLocation() {
        return online && location != null;
    }
}
