package com.smpost.application.service;

import com.smpost.application.port.in.RestoreReadModelUseCase;
import com.smpost.application.port.out.EventPublisher;
import com.smpost.application.port.out.EventStore;
import com.smpost.application.port.out.PostProjectionRepository;
import com.smpost.domain.event.PostEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Rebuilds the read model from the event store by pushing stored streams back through the bus.
 * Republished events are deduplicated by the projection's version guard.
 */
@Service
public class ReadModelRestoreService implements RestoreReadModelUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReadModelRestoreService.class);

    private final EventStore eventStore;
    private final EventPublisher eventPublisher;
    private final PostProjectionRepository projectionRepository;

    public ReadModelRestoreService(
            EventStore eventStore,
            EventPublisher eventPublisher,
            PostProjectionRepository projectionRepository) {
        this.eventStore = eventStore;
        this.eventPublisher = eventPublisher;
        this.projectionRepository = projectionRepository;
    }

    @Override
    public int rebuildAll() {
        projectionRepository.deleteAll();
        log.info("Read model cleared, republishing all streams");

        List<UUID> aggregateIds = eventStore.listAggregateIds();
        int total = 0;
        for (UUID aggregateId : aggregateIds) {
            total += republish(aggregateId);
        }

        log.info("Republished {} events from {} streams", total, aggregateIds.size());
        return total;
    }

    @Override
    public int republish(UUID aggregateId) {
        List<PostEvent> events = eventStore.load(aggregateId);
        eventPublisher.publish(events);
        log.debug("Republished stream: aggregateId={}, events={}", aggregateId, events.size());
        return events.size();
    }
}
