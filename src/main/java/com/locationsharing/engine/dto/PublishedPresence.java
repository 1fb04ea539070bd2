package com.locationsharing.engine.dto;

import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative shared-store record for one user.
 *
 * Written only by that user's own presence engine, read by every peer.
 * A record with sharing disabled never carries a sample: the compact
 * constructor drops it, so no position can leak after opt-out.
 *
 * @param userId          owner of the record
 * @param lastSample      last published fix, null when none or sharing disabled
 * @param sharingEnabled  whether the owner is currently sharing
 * @param lastHeartbeatAt liveness timestamp written on every heartbeat
 * @param trackingHealth  whether the owner's tracking currently produces fixes
 * @param revision        monotonic per-writer revision used for last-writer-wins
 */
public record PublishedPresence(
    String userId,
    LocationSample lastSample,
    boolean sharingEnabled,
    Instant lastHeartbeatAt,
    TrackingHealth trackingHealth,
    long revision
) {

    public PublishedPresence {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(lastHeartbeatAt, "lastHeartbeatAt");
        if (trackingHealth == null) {
            trackingHealth = TrackingHealth.TRACKING;
        }
        if (!sharingEnabled) {
            lastSample = null;
        }
    }

    public static PublishedPresence withdrawn(String userId, Instant at, long revision) {
        return new PublishedPresence(userId, null, false, at, TrackingHealth.TRACKING, revision);
    }

    public PublishedPresence withHeartbeat(Instant at, long newRevision) {
        return new PublishedPresence(userId, lastSample, sharingEnabled, at, trackingHealth, newRevision);
    }

    public PublishedPresence withSample(LocationSample sample, Instant at, long newRevision) {
        return new PublishedPresence(userId, sample, sharingEnabled, at, trackingHealth, newRevision);
    }

    public PublishedPresence withTrackingHealth(TrackingHealth health, Instant at, long newRevision) {
        return new PublishedPresence(userId, lastSample, sharingEnabled, at, health, newRevision);
    }

    public String toLogString() {
        return String.format("Presence[user=%s, sharing=%s, health=%s, heartbeat=%s, rev=%d, sample=%s]",
            userId, sharingEnabled, trackingHealth, lastHeartbeatAt, revision,
            lastSample != null ? lastSample.toLogString() : "none");
    }
}
