package com.smpost.infrastructure.exception;

/**
 * Events were stored but could not be handed to the bus. They stay in the event store
 * and reach the read model once republished.
 */
public class EventPublishException extends RuntimeException {

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
