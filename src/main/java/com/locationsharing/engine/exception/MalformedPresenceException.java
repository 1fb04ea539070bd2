package com.locationsharing.engine.exception;

/**
 * A payload read from the shared store does not have the expected shape.
 */
public class MalformedPresenceException extends RuntimeException {

    public MalformedPresenceException(String message) {
        super(message);
    }

    public MalformedPresenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
