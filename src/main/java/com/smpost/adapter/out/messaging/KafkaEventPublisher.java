package com.smpost.adapter.out.messaging;

import com.smpost.application.port.out.EventPublisher;
import com.smpost.application.port.out.MetricsPort;
import com.smpost.domain.event.PostEvent;
import com.smpost.infrastructure.config.AppProperties;
import com.smpost.infrastructure.exception.EventPublishException;
import com.smpost.infrastructure.serialization.EventSerializer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes stored events keyed by aggregate id, so one post's events share a partition.
 * Each send is acknowledged before the next one goes out, which keeps them in stream order.
 */
@Component
public class KafkaEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EventSerializer serializer;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public KafkaEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            EventSerializer serializer,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.kafkaTemplate = kafkaTemplate;
        this.serializer = serializer;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public void publish(List<? extends PostEvent> events) {
        if (events.isEmpty()) {
            return;
        }

        for (PostEvent event : events) {
            send(event);
        }

        metrics.incrementEventsPublished(events.size());
        log.info("Published {} events to Kafka: aggregateId={}", events.size(), events.get(0).aggregateId());
    }

    private void send(PostEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            appProperties.getKafka().getTopic(),
            null,
            event.aggregateId().toString(),
            serializer.serialize(event)
        );

        // Headers for tracing; the payload's own type field is what consumers dispatch on
        record.headers().add(new RecordHeader("eventType", utf8(event.eventType())));
        record.headers().add(new RecordHeader("eventId", utf8(event.aggregateId() + ":" + event.version())));
        record.headers().add(new RecordHeader("aggregateVersion", utf8(Long.toString(event.version()))));

        try {
            kafkaTemplate.send(record).get(appProperties.getKafka().getPublishTimeoutMs(), TimeUnit.MILLISECONDS);
            log.debug("Published event: type={}, aggregateId={}, version={}",
                event.eventType(), event.aggregateId(), event.version());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException(failure(event), e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to publish event: type={}, aggregateId={}, version={}",
                event.eventType(), event.aggregateId(), event.version(), e);
            throw new EventPublishException(failure(event), e);
        }
    }

    private static String failure(PostEvent event) {
        return "Failed to publish " + event.eventType() + " for aggregate " + event.aggregateId()
            + " at version " + event.version();
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
