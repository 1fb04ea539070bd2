package com.locationsharing.engine.dto;

import java.time.Instant;

/**
 * Snapshot of the coordinator state, returned by start/status calls and
 * pushed to the device on every transition.
 *
 * @param userId         session owner, null when no session exists
 * @param phase          coordinator phase
 * @param activeStrategy strategy currently starting or running, null otherwise
 * @param degraded       true while every strategy is exhausted and backing off
 * @param sessionStartedAt when the current session was created
 * @param lastSampleAt   capture time of the last accepted fix
 * @param reason         human-readable reason of the last transition
 * @param timestamp      when the snapshot was taken
 */
public record TrackingStatus(
    String userId,
    TrackingPhase phase,
    String activeStrategy,
    boolean degraded,
    Instant sessionStartedAt,
    Instant lastSampleAt,
    String reason,
    Instant timestamp
) {

    public boolean isRunning() {
        return phase == TrackingPhase.RUNNING;
    }
}
