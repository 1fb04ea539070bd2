package com.locationsharing.engine.exception;

public class PublishFailureException extends TrackingException {

    public PublishFailureException(String message, Throwable cause) {
        super(TrackingErrorCode.PUBLISH_FAILURE, message, cause);
    }
}
