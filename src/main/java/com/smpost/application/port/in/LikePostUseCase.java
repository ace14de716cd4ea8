package com.smpost.application.port.in;

import com.smpost.domain.error.PostError;
import com.smpost.domain.model.Result;

public interface LikePostUseCase {
    Result<Long, PostError> likePost(PostCommand.LikePost command);
}
