package com.smpost.application.port.out;

import com.smpost.domain.event.PostEvent;

import java.util.List;

public interface EventPublisher {

    /**
     * Publishes stored events in order, keyed by aggregate id. Returns once every event is acknowledged.
     *
     * @throws com.smpost.infrastructure.exception.EventPublishException if any event could not be sent
     */
    void publish(List<? extends PostEvent> events);
}
