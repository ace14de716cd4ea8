package com.smpost.adapter.out.persistence;

import com.smpost.application.port.out.PostProjectionRepository;
import com.smpost.application.port.out.PostQueryPort;
import com.smpost.domain.model.CommentView;
import com.smpost.domain.model.PostView;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class JdbcPostProjectionRepository implements PostProjectionRepository, PostQueryPort {

    private static final String POST_COLUMNS = "post_id, author, message, date_posted, likes, active, version";

    private final JdbcTemplate jdbc;

    private static final RowMapper<PostView> POST_ROW_MAPPER = (rs, rowNum) -> new PostView(
        rs.getObject("post_id", UUID.class),
        rs.getString("author"),
        rs.getString("message"),
        rs.getTimestamp("date_posted").toInstant(),
        rs.getInt("likes"),
        rs.getBoolean("active"),
        rs.getLong("version"),
        List.of()
    );

    private static final RowMapper<CommentView> COMMENT_ROW_MAPPER = (rs, rowNum) -> {
        Timestamp editDate = rs.getTimestamp("edit_date");
        return new CommentView(
            rs.getObject("comment_id", UUID.class),
            rs.getObject("post_id", UUID.class),
            rs.getString("username"),
            rs.getString("comment"),
            rs.getTimestamp("comment_date").toInstant(),
            rs.getBoolean("edited"),
            editDate != null ? editDate.toInstant() : null
        );
    };

    public JdbcPostProjectionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insertPost(UUID postId, String author, String message, Instant datePosted, long version) {
        int inserted = jdbc.update("""
            INSERT INTO posts (post_id, author, message, date_posted, likes, active, version)
            VALUES (?, ?, ?, ?, 0, TRUE, ?)
            ON CONFLICT (post_id) DO NOTHING
            """,
            postId,
            author,
            message,
            Timestamp.from(datePosted),
            version
        );
        return inserted == 1;
    }

    @Override
    public boolean claimVersion(UUID postId, long version) {
        int updated = jdbc.update(
            "UPDATE posts SET version = ? WHERE post_id = ? AND version = ?",
            version,
            postId,
            version - 1
        );
        return updated == 1;
    }

    @Override
    public OptionalLong appliedVersion(UUID postId) {
        List<Long> versions = jdbc.queryForList(
            "SELECT version FROM posts WHERE post_id = ?",
            Long.class,
            postId
        );
        return versions.isEmpty() ? OptionalLong.empty() : OptionalLong.of(versions.get(0));
    }

    @Override
    public void updateMessage(UUID postId, String message) {
        jdbc.update("UPDATE posts SET message = ? WHERE post_id = ?", message, postId);
    }

    @Override
    public void incrementLikes(UUID postId) {
        jdbc.update("UPDATE posts SET likes = likes + 1 WHERE post_id = ?", postId);
    }

    @Override
    public void upsertComment(CommentView comment) {
        jdbc.update("""
            INSERT INTO comments (comment_id, post_id, username, comment, comment_date, edited, edit_date)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (comment_id) DO UPDATE
            SET username = EXCLUDED.username, comment = EXCLUDED.comment
            """,
            comment.commentId(),
            comment.postId(),
            comment.username(),
            comment.comment(),
            Timestamp.from(comment.commentDate()),
            comment.edited(),
            comment.editDate() != null ? Timestamp.from(comment.editDate()) : null
        );
    }

    @Override
    public void updateComment(UUID commentId, String comment, String username, Instant editDate) {
        jdbc.update("""
            UPDATE comments
            SET comment = ?, username = ?, edited = TRUE, edit_date = ?
            WHERE comment_id = ?
            """,
            comment,
            username,
            Timestamp.from(editDate),
            commentId
        );
    }

    @Override
    public void deleteComment(UUID commentId) {
        jdbc.update("DELETE FROM comments WHERE comment_id = ?", commentId);
    }

    @Override
    public void markRemoved(UUID postId) {
        jdbc.update("UPDATE posts SET active = FALSE WHERE post_id = ?", postId);
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM comments");
        jdbc.update("DELETE FROM posts");
    }

    @Override
    public List<PostView> findAll() {
        return withComments(jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts WHERE active ORDER BY date_posted DESC",
            POST_ROW_MAPPER
        ));
    }

    @Override
    public Optional<PostView> findById(UUID postId) {
        return withComments(jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts WHERE post_id = ? AND active",
            POST_ROW_MAPPER,
            postId
        )).stream().findFirst();
    }

    @Override
    public List<PostView> findByAuthor(String author) {
        return withComments(jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts WHERE LOWER(author) = LOWER(?) AND active ORDER BY date_posted DESC",
            POST_ROW_MAPPER,
            author
        ));
    }

    @Override
    public List<PostView> findWithComments() {
        return withComments(jdbc.query("""
            SELECT %s
            FROM posts p
            WHERE p.active AND EXISTS (SELECT 1 FROM comments c WHERE c.post_id = p.post_id)
            ORDER BY p.date_posted DESC
            """.formatted(POST_COLUMNS),
            POST_ROW_MAPPER
        ));
    }

    @Override
    public List<PostView> findWithLikes(int minLikes) {
        return withComments(jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts WHERE active AND likes >= ? ORDER BY date_posted DESC",
            POST_ROW_MAPPER,
            minLikes
        ));
    }

    private List<PostView> withComments(List<PostView> posts) {
        if (posts.isEmpty()) {
            return posts;
        }

        String placeholders = String.join(",", Collections.nCopies(posts.size(), "?"));
        Object[] postIds = posts.stream().map(PostView::postId).toArray();
        Map<UUID, List<CommentView>> commentsByPost = jdbc.query(
                "SELECT comment_id, post_id, username, comment, comment_date, edited, edit_date FROM comments "
                    + "WHERE post_id IN (" + placeholders + ") ORDER BY comment_date",
                COMMENT_ROW_MAPPER,
                postIds
            ).stream()
            .collect(Collectors.groupingBy(CommentView::postId, LinkedHashMap::new, Collectors.toList()));

        return posts.stream()
            .map(post -> post.withComments(commentsByPost.getOrDefault(post.postId(), List.of())))
            .toList();
    }
}
