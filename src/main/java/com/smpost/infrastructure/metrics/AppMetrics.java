package com.smpost.infrastructure.metrics;

import com.smpost.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter postsCreated;
    private final Counter eventsAppended;
    private final Counter concurrencyConflicts;
    private final Counter eventsPublished;
    private final Counter projectionEventsApplied;
    private final Counter projectionDuplicatesSkipped;
    private final Counter eventsDeadLettered;
    private final Timer projectionUpdateDuration;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postsCreated = Counter.builder("posts_created_total")
            .description("Total number of posts created")
            .register(registry);

        this.eventsAppended = Counter.builder("event_store_events_appended_total")
            .description("Total number of events appended to the event store")
            .register(registry);

        this.concurrencyConflicts = Counter.builder("event_store_concurrency_conflicts_total")
            .description("Appends rejected because the stream moved past the expected version")
            .register(registry);

        this.eventsPublished = Counter.builder("events_published_total")
            .description("Total number of events published to Kafka")
            .register(registry);

        this.projectionEventsApplied = Counter.builder("projection_events_applied_total")
            .description("Events applied to the read model")
            .register(registry);

        this.projectionDuplicatesSkipped = Counter.builder("projection_duplicates_skipped_total")
            .description("Redelivered events the read model had already applied")
            .register(registry);

        this.eventsDeadLettered = Counter.builder("projection_events_dead_lettered_total")
            .description("Events sent to the dead-letter topic after exhausting retries")
            .register(registry);

        this.projectionUpdateDuration = Timer.builder("projection_update_duration_seconds")
            .description("Time taken to apply one event to the read model")
            .register(registry);
    }

    @Override
    public void incrementPostsCreated() {
        postsCreated.increment();
    }

    @Override
    public void incrementCommandsRejected(String errorCode) {
        Counter.builder("post_commands_rejected_total")
            .description("Commands rejected by a business rule")
            .tag("reason", errorCode)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementEventsAppended(int count) {
        eventsAppended.increment(count);
    }

    @Override
    public void incrementConcurrencyConflicts() {
        concurrencyConflicts.increment();
    }

    @Override
    public void incrementEventsPublished(int count) {
        eventsPublished.increment(count);
    }

    @Override
    public void incrementProjectionEventsApplied() {
        projectionEventsApplied.increment();
    }

    @Override
    public void incrementProjectionDuplicatesSkipped() {
        projectionDuplicatesSkipped.increment();
    }

    @Override
    public void incrementEventsDeadLettered() {
        eventsDeadLettered.increment();
    }

    @Override
    public void recordProjectionUpdate(Runnable operation) {
        projectionUpdateDuration.record(operation);
    }
}
