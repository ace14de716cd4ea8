package com.smpost.application.service;

import com.smpost.application.port.in.PostQueryUseCase;
import com.smpost.application.port.out.PostQueryPort;
import com.smpost.domain.model.PostView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Transactional(readOnly = true)
public class PostQueryService implements PostQueryUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostQueryService.class);

    private final PostQueryPort postQueryPort;

    public PostQueryService(PostQueryPort postQueryPort) {
        this.postQueryPort = postQueryPort;
    }

    @Override
    public List<PostView> findAll() {
        List<PostView> posts = postQueryPort.findAll();
        log.debug("Returning {} posts", posts.size());
        return posts;
    }

    @Override
    public Optional<PostView> findById(UUID postId) {
        return postQueryPort.findById(postId);
    }

    @Override
    public List<PostView> findByAuthor(String author) {
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
        return postQueryPort.findByAuthor(author);
    }

    @Override
    public List<PostView> findWithComments() {
        return postQueryPort.findWithComments();
    }

    @Override
    public List<PostView> findWithLikes(int minLikes) {
        if (minLikes < 0) {
            throw new IllegalArgumentException("minLikes must not be negative: " + minLikes);
        }
        return postQueryPort.findWithLikes(minLikes);
    }
}
