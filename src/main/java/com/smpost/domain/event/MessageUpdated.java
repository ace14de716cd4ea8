package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record MessageUpdated(
    UUID aggregateId,
    long version,
    String message,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "MESSAGE_UPDATED";

    public static MessageUpdated from(UUID postId, long version, String message) {
        return new MessageUpdated(postId, version, message, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
