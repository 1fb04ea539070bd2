package com.locationsharing.engine.exception;

import java.time.Duration;

public class SampleTimeoutException extends TrackingException {

    public SampleTimeoutException(String provider, Duration timeout) {
        super(TrackingErrorCode.SAMPLE_TIMEOUT,
            "No fix from provider '" + provider + "' within " + timeout.toMillis() + "ms");
    }

    public SampleTimeoutException(Duration waited) {
        super(TrackingErrorCode.SAMPLE_TIMEOUT,
            "Tracking did not reach a running state within " + waited.toMillis() + "ms");
    }
}
