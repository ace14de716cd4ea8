package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record CommentAdded(
    UUID aggregateId,
    long version,
    UUID commentId,
    String comment,
    String username,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "COMMENT_ADDED";

    public static CommentAdded from(UUID postId, long version, UUID commentId, String comment, String username) {
        return new CommentAdded(postId, version, commentId, comment, username, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
