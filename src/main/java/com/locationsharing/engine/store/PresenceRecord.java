package com.locationsharing.engine.store;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire shape of a presence record in the shared store.
 *
 * <pre>
 * {"userId":"alice","sharingEnabled":true,"lat":52.52,"lng":13.40,"accuracy":12.0,
 *  "capturedAtEpochMs":1718000000000,"provider":"gps",
 *  "lastHeartbeatEpochMs":1718000005000,"trackingStatus":"TRACKING","revision":1718000005000}
 * </pre>
 *
 * Location fields are omitted entirely when sharing is disabled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceRecord(
    String userId,
    Boolean sharingEnabled,
    Double lat,
    Double lng,
    Double accuracy,
    Long capturedAtEpochMs,
    String provider,
    Long lastHeartbeatEpochMs,
    String trackingStatus,
    Long revision
) {
}
