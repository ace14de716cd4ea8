package com.smpost.domain.error;

/**
 * Raised when an event kind has no reducer branch or projection handler.
 * This is a schema mismatch between writer and reader, never a business failure,
 * and must stop whatever is processing the stream.
 */
public class UnknownEventTypeException extends RuntimeException {

    private final String eventType;

    public UnknownEventTypeException(String eventType) {
        super("No handler defined for event type: " + eventType);
        this.eventType = eventType;
    }

    public UnknownEventTypeException(String eventType, Throwable cause) {
        super("No handler defined for event type: " + eventType, cause);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
