package com.locationsharing.engine.exception;

import java.time.Duration;

/**
 * Thrown by start when no strategy could produce a fix. The session stays
 * active and retries after {@link #getRetryIn()}.
 */
public class AllStrategiesExhaustedException extends TrackingException {

    private final Duration retryIn;

    public AllStrategiesExhaustedException(String message, Duration retryIn, Throwable lastFailure) {
        super(TrackingErrorCode.ALL_STRATEGIES_EXHAUSTED, message, lastFailure);
        this.retryIn = retryIn;
    }

    public Duration getRetryIn() {
        return retryIn;
    }
}
