package com.smpost.infrastructure.config;

import com.smpost.application.service.PostProjectionUpdater;
import com.smpost.application.service.ProjectionDispatcher;
import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.CommentRemoved;
import com.smpost.domain.event.CommentUpdated;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.event.PostRemoved;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProjectionConfig {

    @Bean
    public ProjectionDispatcher<PostEvent> postProjectionDispatcher(PostProjectionUpdater updater) {
        return ProjectionDispatcher.builder(PostEvent.class)
            .on(PostCreated.class, updater::onPostCreated)
            .on(MessageUpdated.class, updater::onMessageUpdated)
            .on(PostLiked.class, updater::onPostLiked)
            .on(CommentAdded.class, updater::onCommentAdded)
            .on(CommentUpdated.class, updater::onCommentUpdated)
            .on(CommentRemoved.class, updater::onCommentRemoved)
            .on(PostRemoved.class, updater::onPostRemoved)
            .build();
    }
}
