package com.smpost.application.port.in;

import com.smpost.domain.error.PostError;
import com.smpost.domain.model.Result;

public interface RemoveCommentUseCase {
    Result<Long, PostError> removeComment(PostCommand.RemoveComment command);
}
