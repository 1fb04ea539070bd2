package com.locationsharing.engine.exception;

public class ProviderUnavailableException extends TrackingException {

    public ProviderUnavailableException(String message) {
        super(TrackingErrorCode.PROVIDER_UNAVAILABLE, message);
    }
}
