package com.smpost.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-side projection of a comment. {@code commentDate} is when the comment was first added;
 * edits set {@code edited} and {@code editDate} without touching it.
 */
public record CommentView(
    UUID commentId,
    UUID postId,
    String username,
    String comment,
    Instant commentDate,
    boolean edited,
    Instant editDate
) {}
