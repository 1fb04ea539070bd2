package com.locationsharing.engine.exception;

public class PermissionDeniedException extends TrackingException {

    public PermissionDeniedException(String message) {
        super(TrackingErrorCode.PERMISSION_DENIED, message);
    }
}
