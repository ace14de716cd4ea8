package com.smpost.infrastructure.exception;

import java.util.UUID;

public class AggregateNotFoundException extends BusinessException {

    public AggregateNotFoundException(UUID aggregateId) {
        super("AGGREGATE_NOT_FOUND", "No event stream for aggregate: " + aggregateId);
    }
}
