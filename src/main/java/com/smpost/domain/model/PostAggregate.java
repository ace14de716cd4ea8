package com.smpost.domain.model;

import com.smpost.domain.error.PostError;
import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.CommentRemoved;
import com.smpost.domain.event.CommentUpdated;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.event.PostRemoved;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Event-sourced blog post.
 *
 * <p>Every mutating method checks its rules first and only then raises an event, so a failed
 * call returns {@code Result.failure} and leaves version and buffer untouched. Inactive posts
 * reject every change; text arguments must not be blank; comment changes and deletion require
 * the original author (compared case-insensitively).
 */
public final class PostAggregate extends AggregateRoot<PostState, PostEvent> {

    public PostAggregate() {
        super(PostState.EMPTY, PostState::apply);
    }

    public static Result<PostAggregate, PostError> create(UUID postId, String author, String message) {
        if (isBlank(author)) {
            return Result.failure(new PostError.InvalidArgument("author"));
        }
        if (isBlank(message)) {
            return Result.failure(new PostError.InvalidArgument("message"));
        }
        PostAggregate post = new PostAggregate();
        post.raiseEvent(PostCreated.from(postId, post.nextVersion(), author, message));
        return Result.success(post);
    }

    /**
     * Reconstitutes a post from its stored stream.
     */
    public static PostAggregate fromHistory(List<? extends PostEvent> history) {
        PostAggregate post = new PostAggregate();
        post.replay(history);
        return post;
    }

    public Result<Void, PostError> editMessage(String message) {
        if (!isActive()) {
            return inactive();
        }
        if (isBlank(message)) {
            return Result.failure(new PostError.InvalidArgument("message"));
        }
        raiseEvent(MessageUpdated.from(id(), nextVersion(), message));
        return Result.done();
    }

    public Result<Void, PostError> likePost() {
        if (!isActive()) {
            return inactive();
        }
        raiseEvent(PostLiked.from(id(), nextVersion()));
        return Result.done();
    }

    public Result<Void, PostError> addComment(UUID commentId, String comment, String username) {
        if (!isActive()) {
            return inactive();
        }
        if (isBlank(comment)) {
            return Result.failure(new PostError.InvalidArgument("comment"));
        }
        if (isBlank(username)) {
            return Result.failure(new PostError.InvalidArgument("username"));
        }
        raiseEvent(CommentAdded.from(id(), nextVersion(), commentId, comment, username));
        return Result.done();
    }

    public Result<Void, PostError> editComment(UUID commentId, String comment, String username) {
        if (!isActive()) {
            return inactive();
        }
        if (isBlank(comment)) {
            return Result.failure(new PostError.InvalidArgument("comment"));
        }
        if (isBlank(username)) {
            return Result.failure(new PostError.InvalidArgument("username"));
        }
        PostState.Comment existing = state().comments().get(commentId);
        if (existing == null) {
            return Result.failure(new PostError.CommentNotFound(id(), commentId));
        }
        if (!existing.author().equalsIgnoreCase(username)) {
            return Result.failure(new PostError.Unauthorized(username, "edit a comment made by another user"));
        }
        raiseEvent(CommentUpdated.from(id(), nextVersion(), commentId, comment, username));
        return Result.done();
    }

    public Result<Void, PostError> removeComment(UUID commentId, String username) {
        if (!isActive()) {
            return inactive();
        }
        if (isBlank(username)) {
            return Result.failure(new PostError.InvalidArgument("username"));
        }
        PostState.Comment existing = state().comments().get(commentId);
        if (existing == null) {
            return Result.failure(new PostError.CommentNotFound(id(), commentId));
        }
        if (!existing.author().equalsIgnoreCase(username)) {
            return Result.failure(new PostError.Unauthorized(username, "remove a comment made by another user"));
        }
        raiseEvent(CommentRemoved.from(id(), nextVersion(), commentId));
        return Result.done();
    }

    public Result<Void, PostError> deletePost(String username) {
        if (!isActive()) {
            return inactive();
        }
        if (isBlank(username)) {
            return Result.failure(new PostError.InvalidArgument("username"));
        }
        if (!author().equalsIgnoreCase(username)) {
            return Result.failure(new PostError.Unauthorized(username, "delete a post made by someone else"));
        }
        raiseEvent(PostRemoved.from(id(), nextVersion()));
        return Result.done();
    }

    public UUID id() {
        return state().id();
    }

    public boolean isActive() {
        return state().active();
    }

    public String author() {
        return state().author();
    }

    public Map<UUID, PostState.Comment> comments() {
        return state().comments();
    }

    private <T> Result<T, PostError> inactive() {
        return Result.failure(new PostError.InactivePost(id()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
