package com.smpost.application.port.in;

import com.smpost.domain.model.PostView;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PostQueryUseCase {
    List<PostView> findAll();
    Optional<PostView> findById(UUID postId);
    List<PostView> findByAuthor(String author);
    List<PostView> findWithComments();
    List<PostView> findWithLikes(int minLikes);
}
