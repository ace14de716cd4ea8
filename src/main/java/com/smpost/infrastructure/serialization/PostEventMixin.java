package com.smpost.infrastructure.serialization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.CommentRemoved;
import com.smpost.domain.event.CommentUpdated;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.event.PostRemoved;

/**
 * Wire mapping for {@link com.smpost.domain.event.PostEvent}: the kind travels in a {@code type}
 * property, using the same names as {@code eventType()}. Kept out of the domain records.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PostCreated.class, name = PostCreated.TYPE),
    @JsonSubTypes.Type(value = MessageUpdated.class, name = MessageUpdated.TYPE),
    @JsonSubTypes.Type(value = PostLiked.class, name = PostLiked.TYPE),
    @JsonSubTypes.Type(value = CommentAdded.class, name = CommentAdded.TYPE),
    @JsonSubTypes.Type(value = CommentUpdated.class, name = CommentUpdated.TYPE),
    @JsonSubTypes.Type(value = CommentRemoved.class, name = CommentRemoved.TYPE),
    @JsonSubTypes.Type(value = PostRemoved.class, name = PostRemoved.TYPE)
})
@JsonIgnoreProperties({"eventType"})
abstract class PostEventMixin {
}
