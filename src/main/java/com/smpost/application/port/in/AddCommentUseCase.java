package com.smpost.application.port.in;

import com.smpost.domain.error.PostError;
import com.smpost.domain.model.Result;

import java.util.UUID;

public interface AddCommentUseCase {
    Result<UUID, PostError> addComment(PostCommand.AddComment command);
}
