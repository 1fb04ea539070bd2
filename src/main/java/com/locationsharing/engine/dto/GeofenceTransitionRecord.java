package com.locationsharing.engine.dto;

import java.time.Instant;

/**
 * Immutable record of a peer entering or leaving a geofence region.
 *
 * Sent to the notification surface and persisted as a
 * {@code GeofenceTransition} entity for history.
 *
 * @param transitionId     unique id of this transition
 * @param regionId         region that was crossed
 * @param regionLabel      human-readable region label
 * @param peerId           peer that crossed it
 * @param type             ENTER or EXIT
 * @param latitude         peer latitude at the transition
 * @param longitude        peer longitude at the transition
 * @param distanceToCenter distance from the peer to the region center in meters
 * @param occurredAt       capture time of the fix that caused the transition
 */
public record GeofenceTransitionRecord(
    String transitionId,
    Long regionId,
    String regionLabel,
    String peerId,
    GeofenceTransitionType type,
    double latitude,
    double longitude,
    double distanceToCenter,
    Instant occurredAt
) {

    public static GeofenceTransitionRecord fromSample(
        CachedRegionRecord region,
        String peerId,
        GeofenceTransitionType type,
        LocationSample sample,
        double distanceToCenter
    ) {
        String transitionId = String.format("%d_%s_%d_%s",
            region.regionId(), peerId, sample.capturedAt().toEpochMilli(), type);

        return new GeofenceTransitionRecord(
            transitionId,
            region.regionId(),
            region.label(),
            peerId,
            type,
            sample.latitude(),
            sample.longitude(),
            distanceToCenter,
            sample.capturedAt()
        );
    }

    public String toLogString() {
        return String.format("Transition[%s peer=%s region=%s distance=%.0fm]",
            type, peerId, regionLabel, distanceToCenter);
    }
}
