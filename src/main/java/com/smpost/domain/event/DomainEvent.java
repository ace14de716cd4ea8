package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable fact recorded in an aggregate's stream.
 * The version is the event's 1-based position within that stream.
 */
public interface DomainEvent {
    UUID aggregateId();
    long version();
    Instant occurredAt();
    String eventType();
}
