package com.smpost.domain.model;

import com.smpost.domain.error.UnknownEventTypeException;
import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.CommentRemoved;
import com.smpost.domain.event.CommentUpdated;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.event.PostRemoved;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Write-side state of a post. Only the fields business rules need are kept;
 * message text and likes live in the read model.
 */
public record PostState(
    UUID id,
    boolean active,
    String author,
    Map<UUID, Comment> comments
) {

    public static final PostState EMPTY = new PostState(null, false, null, Map.of());

    public PostState {
        comments = Map.copyOf(comments);
    }

    public record Comment(String text, String author) {}

    /**
     * Pure transition function: returns the state after {@code event}, never touching {@code this}.
     *
     * @throws UnknownEventTypeException for an event kind this reducer does not know
     */
    public PostState apply(PostEvent event) {
        if (event instanceof PostCreated created) {
            if (id != null) {
                throw new IllegalStateException("Post " + id + " is already created");
            }
            return new PostState(created.aggregateId(), true, created.author(), Map.of());
        }
        if (id == null) {
            throw new IllegalStateException("Event " + event.eventType() + " applied before the post was created");
        }
        if (event instanceof MessageUpdated || event instanceof PostLiked) {
            return this;
        }
        if (event instanceof CommentAdded added) {
            return withComment(added.commentId(), new Comment(added.comment(), added.username()));
        }
        if (event instanceof CommentUpdated updated) {
            return withComment(updated.commentId(), new Comment(updated.comment(), updated.username()));
        }
        if (event instanceof CommentRemoved removed) {
            Map<UUID, Comment> next = new HashMap<>(comments);
            next.remove(removed.commentId());
            return new PostState(id, active, author, next);
        }
        if (event instanceof PostRemoved) {
            return new PostState(id, false, author, comments);
        }
        throw new UnknownEventTypeException(event.eventType());
    }

    private PostState withComment(UUID commentId, Comment comment) {
        Map<UUID, Comment> next = new HashMap<>(comments);
        next.put(commentId, comment);
        return new PostState(id, active, author, next);
    }
}
