package com.locationsharing.engine.dto;

/**
 * Derived presence state of a peer as seen by the local device.
 */
public enum PresenceState {
    ONLINE,
    /** Heartbeat is fresh but the peer's tracking reports no recent fix. */
    NO_RECENT_FIX,
    /** Sharing enabled but the heartbeat is older than the staleness threshold. */
    OFFLINE,
    NOT_SHARING
}
