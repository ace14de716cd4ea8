package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

// Soft delete: the stream is kept, the post stops accepting changes
public record PostRemoved(
    UUID aggregateId,
    long version,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "POST_REMOVED";

    public static PostRemoved from(UUID postId, long version) {
        return new PostRemoved(postId, version, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
