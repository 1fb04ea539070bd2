package com.locationsharing.engine.dto;

import java.time.Instant;

/**
 * Raised when an online peer comes within the proximity threshold.
 *
 * @param peerId          the nearby peer
 * @param distanceMeters  great-circle distance from self to peer
 * @param bearingDegrees  initial bearing from self to peer, 0-360 (0 = north)
 * @param direction       cardinal direction of the bearing (N, NE, ...)
 * @param displayDistance rounded distance for display (e.g. "400m", "1.2km")
 * @param occurredAt      when the engine raised the event
 */
public record ProximityEvent(
    String peerId,
    double distanceMeters,
    double bearingDegrees,
    String direction,
    String displayDistance,
    Instant occurredAt
) {

    public String toLogString() {
        return String.format("Proximity[peer=%s, distance=%s, direction=%s]",
            peerId, displayDistance, direction);
    }
}
