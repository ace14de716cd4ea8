package com.smpost.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-side projection of a post. Derived from the event stream, never written by commands.
 */
public record PostView(
    UUID postId,
    String author,
    String message,
    Instant datePosted,
    int likes,
    boolean active,
    long version,
    List<CommentView> comments
) {
    public PostView {
        comments = List.copyOf(comments);
    }

    public PostView withComments(List<CommentView> comments) {
        return new PostView(postId, author, message, datePosted, likes, active, version, comments);
    }
}
