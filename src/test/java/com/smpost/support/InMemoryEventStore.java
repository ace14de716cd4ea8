package com.smpost.support;

import com.smpost.application.port.out.EventStore;
import com.smpost.domain.event.PostEvent;
import com.smpost.infrastructure.exception.AggregateNotFoundException;
import com.smpost.infrastructure.exception.ConcurrencyConflictException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Event store fake with the same expected-version contract as the JDBC one.
 */
public class InMemoryEventStore implements EventStore {

    private final Map<UUID, List<PostEvent>> streams = new LinkedHashMap<>();

    @Override
    public synchronized void append(UUID aggregateId, List<? extends PostEvent> events, long expectedVersion) {
        if (events.isEmpty()) {
            return;
        }
        List<PostEvent> stream = streams.getOrDefault(aggregateId, List.of());
        if (stream.size() != expectedVersion) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, stream.size());
        }
        long position = expectedVersion;
        for (PostEvent event : events) {
            if (event.version() != ++position) {
                throw new IllegalArgumentException("Event at version " + event.version() + ", expected " + position);
            }
        }
        List<PostEvent> next = new ArrayList<>(stream);
        next.addAll(events);
        streams.put(aggregateId, next);
    }

    @Override
    public synchronized List<PostEvent> load(UUID aggregateId) {
        List<PostEvent> stream = streams.get(aggregateId);
        if (stream == null) {
            throw new AggregateNotFoundException(aggregateId);
        }
        return List.copyOf(stream);
    }

    @Override
    public synchronized long currentVersion(UUID aggregateId) {
        return streams.getOrDefault(aggregateId, List.of()).size();
    }

    @Override
    public synchronized List<UUID> listAggregateIds() {
        return List.copyOf(streams.keySet());
    }
}
