package com.smpost.application.port.out;

import com.smpost.domain.model.CommentView;

import java.time.Instant;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Write side of the read model. Callers run each event's changes in one transaction.
 */
public interface PostProjectionRepository {

    /**
     * Inserts the post row at {@code version} unless it already exists.
     *
     * @return false when the row was already there
     */
    boolean insertPost(UUID postId, String author, String message, Instant datePosted, long version);

    /**
     * Moves the row's applied version to {@code version} only if the row is exactly one behind.
     *
     * @return false when the row is missing, already at or past {@code version}, or further behind
     */
    boolean claimVersion(UUID postId, long version);

    /**
     * Stream position the post row has been brought up to; empty if the row does not exist.
     */
    OptionalLong appliedVersion(UUID postId);

    void updateMessage(UUID postId, String message);

    void incrementLikes(UUID postId);

    void upsertComment(CommentView comment);

    void updateComment(UUID commentId, String comment, String username, Instant editDate);

    void deleteComment(UUID commentId);

    void markRemoved(UUID postId);

    void deleteAll();
}
