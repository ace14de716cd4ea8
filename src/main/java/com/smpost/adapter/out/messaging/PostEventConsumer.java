package com.smpost.adapter.out.messaging;

import com.smpost.application.port.out.MetricsPort;
import com.smpost.application.service.ProjectionDispatcher;
import com.smpost.domain.event.PostEvent;
import com.smpost.infrastructure.serialization.EventSerializer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Applies post events to the read model.
 * <p>
 * One listener thread owns each partition, so one post's events are applied in order. The offset
 * is acknowledged only after the projection update has committed; any exception leaves it
 * uncommitted and goes to the container's error handler (retry, dead letter, or stop).
 */
@Component
public class PostEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(PostEventConsumer.class);

    private final EventSerializer serializer;
    private final ProjectionDispatcher<PostEvent> dispatcher;
    private final MetricsPort metrics;

    public PostEventConsumer(
            EventSerializer serializer,
            ProjectionDispatcher<PostEvent> dispatcher,
            MetricsPort metrics) {
        this.serializer = serializer;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    @KafkaListener(
        topics = "${app.kafka.topic}",
        groupId = "${app.kafka.consumer-group}",
        concurrency = "${app.kafka.consumer-concurrency}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        if (record.key() != null) {
            MDC.put("aggregateId", record.key());
        }

        try {
            PostEvent event = serializer.deserialize(record.value());
            MDC.put("eventType", event.eventType());
            log.debug("Received event: type={}, aggregateId={}, version={}, partition={}, offset={}",
                event.eventType(), event.aggregateId(), event.version(), record.partition(), record.offset());

            metrics.recordProjectionUpdate(() -> dispatcher.dispatch(event));
            acknowledgment.acknowledge();

            log.debug("Committed offset {} on partition {}", record.offset(), record.partition());
        } finally {
            MDC.remove("aggregateId");
            MDC.remove("eventType");
        }
    }
}
