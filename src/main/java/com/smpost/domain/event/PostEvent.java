package com.smpost.domain.event;

/**
 * Every kind of event the Post aggregate can emit.
 * Adding a kind here requires a reducer branch and a projection handler.
 */
public sealed interface PostEvent extends DomainEvent
    permits PostCreated, MessageUpdated, PostLiked, CommentAdded, CommentUpdated, CommentRemoved, PostRemoved {
}
