package com.smpost.domain.error;

import java.util.UUID;

/**
 * Sealed type representing expected business errors for post operations.
 * A failed operation raises no event and leaves the aggregate untouched.
 */
public sealed interface PostError {

    record InvalidArgument(String field) implements PostError {
        @Override
        public String message() {
            return "The value of " + field + " cannot be null or empty";
        }

        @Override
        public String code() {
            return "INVALID_ARGUMENT";
        }
    }

    record Unauthorized(String username, String action) implements PostError {
        @Override
        public String message() {
            return "User " + username + " is not allowed to " + action;
        }

        @Override
        public String code() {
            return "UNAUTHORIZED";
        }
    }

    record InactivePost(UUID postId) implements PostError {
        @Override
        public String message() {
            return "Operation not allowed on inactive post " + postId;
        }

        @Override
        public String code() {
            return "INACTIVE_POST";
        }
    }

    record CommentNotFound(UUID postId, UUID commentId) implements PostError {
        @Override
        public String message() {
            return "Comment " + commentId + " not found on post " + postId;
        }

        @Override
        public String code() {
            return "COMMENT_NOT_FOUND";
        }
    }

    String message();

    String code();
}
