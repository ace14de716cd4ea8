package com.smpost.application.port.in;

import com.smpost.domain.error.PostError;
import com.smpost.domain.model.Result;

public interface EditCommentUseCase {
    Result<Long, PostError> editComment(PostCommand.EditComment command);
}
