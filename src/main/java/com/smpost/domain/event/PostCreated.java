package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record PostCreated(
    UUID aggregateId,
    long version,
    String author,
    String message,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "POST_CREATED";

    public static PostCreated from(UUID postId, long version, String author, String message) {
        return new PostCreated(postId, version, author, message, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
