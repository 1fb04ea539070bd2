package com.locationsharing.engine.dto;

/**
 * Tracking health advertised to peers in the published presence record.
 */
public enum TrackingHealth {
    /** A strategy is running and producing fixes. */
    TRACKING,
    /** Sharing is enabled but every strategy failed; no recent fix is available. */
    NO_RECENT_FIX
}
