package com.smpost.application.port.out;

import com.smpost.domain.model.PostView;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to active posts in the read model, newest first, comments included.
 */
public interface PostQueryPort {
    List<PostView> findAll();
    Optional<PostView> findById(UUID postId);
    List<PostView> findByAuthor(String author);
    List<PostView> findWithComments();
    List<PostView> findWithLikes(int minLikes);
}
