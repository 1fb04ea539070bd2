package com.locationsharing.engine.exception;

/**
 * Error taxonomy of the tracking core.
 */
public enum TrackingErrorCode {
    /** Fatal to the session: strategies are not retried. */
    PERMISSION_DENIED,
    /** Provider hardware off or missing: triggers strategy failover. */
    PROVIDER_UNAVAILABLE,
    /** Transient: the cycle is abandoned and the next one runs at normal cadence. */
    SAMPLE_TIMEOUT,
    /** Transient store/network error: retried with bounded backoff, then dropped. */
    PUBLISH_FAILURE,
    /** Every strategy failed; the session stays active in a degraded state. */
    ALL_STRATEGIES_EXHAUSTED
}
