package com.smpost.application.port.in;

import com.smpost.domain.error.PostError;
import com.smpost.domain.model.Result;

public interface DeletePostUseCase {
    Result<Long, PostError> deletePost(PostCommand.DeletePost command);
}
