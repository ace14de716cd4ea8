package com.smpost.application.service;

import com.smpost.application.port.out.MetricsPort;
import com.smpost.application.port.out.PostProjectionRepository;
import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.CommentRemoved;
import com.smpost.domain.event.CommentUpdated;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.event.PostRemoved;
import com.smpost.domain.model.CommentView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.OptionalLong;

/**
 * One handler per event kind, each applied in its own transaction.
 *
 * <p>Every handler first claims the event's stream position on the post row, and a position can
 * only be claimed right after the previous one. A redelivered event finds its position already
 * taken and changes nothing, which keeps non-idempotent updates such as the like counter safe
 * under at-least-once delivery. An event that arrives ahead of a missing predecessor fails, so it
 * is retried and then dead-lettered instead of being applied over the hole.
 */
@Service
@Transactional
public class PostProjectionUpdater {

    private static final Logger log = LoggerFactory.getLogger(PostProjectionUpdater.class);

    private final PostProjectionRepository repository;
    private final MetricsPort metrics;

    public PostProjectionUpdater(PostProjectionRepository repository, MetricsPort metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    public void onPostCreated(PostCreated event) {
        boolean inserted = repository.insertPost(
            event.aggregateId(), event.author(), event.message(), event.occurredAt(), event.version());
        applied(event, inserted);
    }

    public void onMessageUpdated(MessageUpdated event) {
        if (claim(event)) {
            repository.updateMessage(event.aggregateId(), event.message());
        }
    }

    public void onPostLiked(PostLiked event) {
        if (claim(event)) {
            repository.incrementLikes(event.aggregateId());
        }
    }

    public void onCommentAdded(CommentAdded event) {
        if (claim(event)) {
            repository.upsertComment(new CommentView(
                event.commentId(),
                event.aggregateId(),
                event.username(),
                event.comment(),
                event.occurredAt(),
                false,
                null
            ));
        }
    }

    public void onCommentUpdated(CommentUpdated event) {
        if (claim(event)) {
            repository.updateComment(event.commentId(), event.comment(), event.username(), event.occurredAt());
        }
    }

    public void onCommentRemoved(CommentRemoved event) {
        if (claim(event)) {
            repository.deleteComment(event.commentId());
        }
    }

    public void onPostRemoved(PostRemoved event) {
        if (claim(event)) {
            repository.markRemoved(event.aggregateId());
        }
    }

    private boolean claim(PostEvent event) {
        if (repository.claimVersion(event.aggregateId(), event.version())) {
            return applied(event, true);
        }

        OptionalLong current = repository.appliedVersion(event.aggregateId());
        if (current.isEmpty()) {
            // Not a duplicate: the creation never reached the read model. Fail so the record is retried or dead-lettered.
            throw new IllegalStateException(
                "Post " + event.aggregateId() + " is missing from the read model, cannot apply " + event.eventType());
        }
        if (event.version() > current.getAsLong() + 1) {
            // An earlier event is still missing, e.g. dead-lettered and not yet replayed
            throw new IllegalStateException(
                "Post " + event.aggregateId() + " is at version " + current.getAsLong() + ", cannot apply "
                    + event.eventType() + " at version " + event.version());
        }
        return applied(event, false);
    }

    private boolean applied(PostEvent event, boolean fresh) {
        if (fresh) {
            metrics.incrementProjectionEventsApplied();
            log.debug("Applied {} to post {} at version {}", event.eventType(), event.aggregateId(), event.version());
        } else {
            metrics.incrementProjectionDuplicatesSkipped();
            log.warn("Skipping already applied event: type={}, postId={}, version={}",
                event.eventType(), event.aggregateId(), event.version());
        }
        return fresh;
    }
}
