package com.smpost.support;

import com.smpost.application.port.out.PostProjectionRepository;
import com.smpost.domain.model.CommentView;
import com.smpost.domain.model.PostView;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Read model fake mirroring the SQL of the JDBC projection repository.
 */
public class InMemoryPostProjectionRepository implements PostProjectionRepository {

    private final Map<UUID, PostView> posts = new LinkedHashMap<>();
    private final Map<UUID, CommentView> comments = new LinkedHashMap<>();

    @Override
    public boolean insertPost(UUID postId, String author, String message, Instant datePosted, long version) {
        if (posts.containsKey(postId)) {
            return false;
        }
        posts.put(postId, new PostView(postId, author, message, datePosted, 0, true, version, List.of()));
        return true;
    }

    @Override
    public boolean claimVersion(UUID postId, long version) {
        PostView post = posts.get(postId);
        if (post == null || post.version() != version - 1) {
            return false;
        }
        posts.put(postId, new PostView(post.postId(), post.author(), post.message(), post.datePosted(),
            post.likes(), post.active(), version, List.of()));
        return true;
    }

    @Override
    public OptionalLong appliedVersion(UUID postId) {
        PostView post = posts.get(postId);
        return post == null ? OptionalLong.empty() : OptionalLong.of(post.version());
    }

    @Override
    public void updateMessage(UUID postId, String message) {
        posts.computeIfPresent(postId, (id, post) -> new PostView(id, post.author(), message, post.datePosted(),
            post.likes(), post.active(), post.version(), List.of()));
    }

    @Override
    public void incrementLikes(UUID postId) {
        posts.computeIfPresent(postId, (id, post) -> new PostView(id, post.author(), post.message(),
            post.datePosted(), post.likes() + 1, post.active(), post.version(), List.of()));
    }

    @Override
    public void upsertComment(CommentView comment) {
        CommentView existing = comments.get(comment.commentId());
        if (existing == null) {
            comments.put(comment.commentId(), comment);
        } else {
            comments.put(comment.commentId(), new CommentView(existing.commentId(), existing.postId(),
                comment.username(), comment.comment(), existing.commentDate(), existing.edited(), existing.editDate()));
        }
    }

    @Override
    public void updateComment(UUID commentId, String comment, String username, Instant editDate) {
        comments.computeIfPresent(commentId, (id, existing) -> new CommentView(id, existing.postId(), username,
            comment, existing.commentDate(), true, editDate));
    }

    @Override
    public void deleteComment(UUID commentId) {
        comments.remove(commentId);
    }

    @Override
    public void markRemoved(UUID postId) {
        posts.computeIfPresent(postId, (id, post) -> new PostView(id, post.author(), post.message(),
            post.datePosted(), post.likes(), false, post.version(), List.of()));
    }

    @Override
    public void deleteAll() {
        comments.clear();
        posts.clear();
    }

    /**
     * Post row with its comments attached, regardless of the active flag.
     */
    public Optional<PostView> find(UUID postId) {
        return Optional.ofNullable(posts.get(postId))
            .map(post -> post.withComments(comments.values().stream()
                .filter(comment -> comment.postId().equals(postId))
                .sorted(Comparator.comparing(CommentView::commentDate))
                .toList()));
    }

    public int postCount() {
        return posts.size();
    }
}
