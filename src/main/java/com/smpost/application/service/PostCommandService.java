package com.smpost.application.service;

import com.smpost.application.port.in.AddCommentUseCase;
import com.smpost.application.port.in.CreatePostUseCase;
import com.smpost.application.port.in.DeletePostUseCase;
import com.smpost.application.port.in.EditCommentUseCase;
import com.smpost.application.port.in.EditMessageUseCase;
import com.smpost.application.port.in.LikePostUseCase;
import com.smpost.application.port.in.PostCommand;
import com.smpost.application.port.in.RemoveCommentUseCase;
import com.smpost.application.port.out.EventPublisher;
import com.smpost.application.port.out.EventStore;
import com.smpost.application.port.out.IdGenerator;
import com.smpost.application.port.out.MetricsPort;
import com.smpost.domain.error.PostError;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.model.PostAggregate;
import com.smpost.domain.model.Result;
import com.smpost.infrastructure.config.AppProperties;
import com.smpost.infrastructure.exception.ConcurrencyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs post commands: load the stream, replay, invoke the aggregate, append under the
 * expected-version guard, then publish. A concurrency conflict restarts the whole command
 * on a freshly loaded aggregate, up to {@code app.commands.max-attempts} times.
 */
@Service
public class PostCommandService implements CreatePostUseCase, EditMessageUseCase, LikePostUseCase,
        AddCommentUseCase, EditCommentUseCase, RemoveCommentUseCase, DeletePostUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostCommandService.class);

    private final EventStore eventStore;
    private final EventPublisher eventPublisher;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final AppProperties appProperties;

    public PostCommandService(
            EventStore eventStore,
            EventPublisher eventPublisher,
            IdGenerator idGenerator,
            MetricsPort metrics,
            AppProperties appProperties) {
        this.eventStore = eventStore;
        this.eventPublisher = eventPublisher;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.appProperties = appProperties;
    }

    @Override
    public Result<UUID, PostError> createPost(PostCommand.CreatePost command) {
        UUID postId = idGenerator.generate();
        log.debug("Creating post: postId={}, author={}", postId, command.author());

        var created = PostAggregate.create(postId, command.author(), command.message());
        if (created.isFailure()) {
            return rejected("createPost", postId, created.errorOrNull());
        }

        // Fresh ids cannot collide, so a conflict here is not retried
        commit(created.getOrThrow());
        metrics.incrementPostsCreated();
        log.info("Post created: postId={}, author={}", postId, command.author());
        return Result.success(postId);
    }

    @Override
    public Result<Long, PostError> editMessage(PostCommand.EditMessage command) {
        return execute(command.postId(), "editMessage", post -> post.editMessage(command.message()));
    }

    @Override
    public Result<Long, PostError> likePost(PostCommand.LikePost command) {
        return execute(command.postId(), "likePost", PostAggregate::likePost);
    }

    @Override
    public Result<UUID, PostError> addComment(PostCommand.AddComment command) {
        UUID commentId = idGenerator.generate();
        return execute(command.postId(), "addComment",
                post -> post.addComment(commentId, command.comment(), command.username()))
            .map(version -> commentId);
    }

    @Override
    public Result<Long, PostError> editComment(PostCommand.EditComment command) {
        return execute(command.postId(), "editComment",
            post -> post.editComment(command.commentId(), command.comment(), command.username()));
    }

    @Override
    public Result<Long, PostError> removeComment(PostCommand.RemoveComment command) {
        return execute(command.postId(), "removeComment",
            post -> post.removeComment(command.commentId(), command.username()));
    }

    @Override
    public Result<Long, PostError> deletePost(PostCommand.DeletePost command) {
        return execute(command.postId(), "deletePost", post -> post.deletePost(command.username()));
    }

    private Result<Long, PostError> execute(
            UUID postId,
            String operation,
            Function<PostAggregate, Result<Void, PostError>> action) {
        int maxAttempts = Math.max(1, appProperties.getCommands().getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            PostAggregate post = PostAggregate.fromHistory(eventStore.load(postId));
            log.debug("Loaded post: postId={}, version={}, operation={}", postId, post.version(), operation);

            Result<Void, PostError> outcome = action.apply(post);
            if (outcome.isFailure()) {
                return rejected(operation, postId, outcome.errorOrNull());
            }

            try {
                commit(post);
                log.info("Command applied: operation={}, postId={}, version={}", operation, postId, post.version());
                return Result.success(post.version());
            } catch (ConcurrencyConflictException e) {
                metrics.incrementConcurrencyConflicts();
                if (attempt >= maxAttempts) {
                    log.warn("Giving up after {} conflicting attempts: operation={}, postId={}",
                        attempt, operation, postId);
                    throw e;
                }
                log.debug("Concurrency conflict, reloading: operation={}, postId={}, attempt={}",
                    operation, postId, attempt);
            }
        }
    }

    private void commit(PostAggregate post) {
        List<PostEvent> events = post.uncommittedEvents();
        eventStore.append(post.id(), events, post.expectedVersion());
        post.markCommitted();
        metrics.incrementEventsAppended(events.size());

        // Stored events are the source of truth; a publish failure reaches the caller and is repaired by republishing
        eventPublisher.publish(events);
    }

    private <T> Result<T, PostError> rejected(String operation, UUID postId, PostError error) {
        log.warn("Command rejected: operation={}, postId={}, code={}, reason={}",
            operation, postId, error.code(), error.message());
        metrics.incrementCommandsRejected(error.code());
        return Result.failure(error);
    }
}
