package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record PostLiked(
    UUID aggregateId,
    long version,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "POST_LIKED";

    public static PostLiked from(UUID postId, long version) {
        return new PostLiked(postId, version, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
