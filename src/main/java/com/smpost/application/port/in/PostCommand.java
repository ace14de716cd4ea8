package com.smpost.application.port.in;

import java.util.UUID;

/**
 * Typed write requests accepted by the command use cases.
 */
public sealed interface PostCommand {

    record CreatePost(String author, String message) implements PostCommand {}

    record EditMessage(UUID postId, String message) implements PostCommand {}

    record LikePost(UUID postId) implements PostCommand {}

    record AddComment(UUID postId, String comment, String username) implements PostCommand {}

    record EditComment(UUID postId, UUID commentId, String comment, String username) implements PostCommand {}

    record RemoveComment(UUID postId, UUID commentId, String username) implements PostCommand {}

    record DeletePost(UUID postId, String username) implements PostCommand {}
}
