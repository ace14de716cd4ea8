package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record CommentRemoved(
    UUID aggregateId,
    long version,
    UUID commentId,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "COMMENT_REMOVED";

    public static CommentRemoved from(UUID postId, long version, UUID commentId) {
        return new CommentRemoved(postId, version, commentId, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
