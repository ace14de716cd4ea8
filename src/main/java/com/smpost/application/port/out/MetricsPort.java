package com.smpost.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementPostsCreated();

    void incrementCommandsRejected(String errorCode);

    void incrementEventsAppended(int count);

    void incrementConcurrencyConflicts();

    void incrementEventsPublished(int count);

    void incrementProjectionEventsApplied();

    void incrementProjectionDuplicatesSkipped();

    void incrementEventsDeadLettered();

    void recordProjectionUpdate(Runnable operation);
}
