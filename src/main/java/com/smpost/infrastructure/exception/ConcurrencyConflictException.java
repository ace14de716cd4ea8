package com.smpost.infrastructure.exception;

import java.util.UUID;

/**
 * The stream moved on since the aggregate was loaded. Nothing was written;
 * the command has to be reloaded and retried from scratch.
 */
public class ConcurrencyConflictException extends BusinessException {

    private final UUID aggregateId;
    private final long expectedVersion;

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion) {
        super("CONCURRENCY_CONFLICT",
            "Aggregate " + aggregateId + " is at version " + actualVersion + ", expected " + expectedVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, Throwable cause) {
        super("CONCURRENCY_CONFLICT",
            "Aggregate " + aggregateId + " was appended concurrently past version " + expectedVersion, cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
