package com.smpost.infrastructure.exception;

/**
 * A stored or received payload is not a readable event. Like an unknown event type,
 * this is a schema problem that retrying cannot fix.
 */
public class EventSerializationException extends RuntimeException {

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
