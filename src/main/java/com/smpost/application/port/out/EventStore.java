package com.smpost.application.port.out;

import com.smpost.domain.event.PostEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-aggregate event log guarded by optimistic concurrency.
 */
public interface EventStore {

    /**
     * Appends {@code events} atomically if the stream currently holds exactly {@code expectedVersion} events.
     *
     * @throws com.smpost.infrastructure.exception.ConcurrencyConflictException if the stream length differs;
     *         nothing is written
     * @throws IllegalArgumentException if the events are not numbered {@code expectedVersion + 1} onwards
     */
    void append(UUID aggregateId, List<? extends PostEvent> events, long expectedVersion);

    /**
     * @throws com.smpost.infrastructure.exception.AggregateNotFoundException if no stream exists
     */
    List<PostEvent> load(UUID aggregateId);

    long currentVersion(UUID aggregateId);

    List<UUID> listAggregateIds();
}
