package com.locationsharing.engine.exception;

/**
 * Base class of every failure the tracking core reports to its callers.
 */
public class TrackingException extends RuntimeException {

    private final TrackingErrorCode code;

    public TrackingException(TrackingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TrackingException(TrackingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public TrackingErrorCode getCode() {
        return code;
    }
}
