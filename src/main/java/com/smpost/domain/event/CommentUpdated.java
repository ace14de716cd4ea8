package com.smpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record CommentUpdated(
    UUID aggregateId,
    long version,
    UUID commentId,
    String comment,
    String username,
    Instant occurredAt
) implements PostEvent {

    public static final String TYPE = "COMMENT_UPDATED";

    public static CommentUpdated from(UUID postId, long version, UUID commentId, String comment, String username) {
        return new CommentUpdated(postId, version, commentId, comment, username, Instant.now());
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
