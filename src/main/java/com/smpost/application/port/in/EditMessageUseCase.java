package com.smpost.application.port.in;

import com.smpost.domain.error.PostError;
import com.smpost.domain.model.Result;

public interface EditMessageUseCase {
    Result<Long, PostError> editMessage(PostCommand.EditMessage command);
}
