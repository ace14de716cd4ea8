package com.smpost.infrastructure.config;

import com.smpost.application.port.out.MetricsPort;
import com.smpost.domain.error.UnknownEventTypeException;
import com.smpost.infrastructure.exception.EventSerializationException;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.CommonDelegatingErrorHandler;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

/**
 * Topics and listener error handling for the post event stream.
 * <p>
 * Transient failures are retried with exponential backoff, then the record is copied to the
 * dead-letter topic and its offset committed. A payload whose kind cannot be resolved stops the
 * container without committing, so the record is redelivered once the deployment can read it.
 */
@Configuration
public class KafkaConfig {

    private static final Logger log = LoggerFactory.getLogger(KafkaConfig.class);

    private final AppProperties appProperties;

    public KafkaConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Bean
    public NewTopic postEventsTopic() {
        return TopicBuilder.name(appProperties.getKafka().getTopic())
            .partitions(appProperties.getKafka().getPartitions())
            .replicas(1)
            .build();
    }

    @Bean
    public NewTopic postEventsDeadLetterTopic() {
        return TopicBuilder.name(appProperties.getKafka().getDeadLetterTopic())
            .partitions(1)
            .replicas(1)
            .build();
    }

    @Bean
    public CommonErrorHandler projectionErrorHandler(KafkaTemplate<String, String> kafkaTemplate, MetricsPort metrics) {
        String deadLetterTopic = appProperties.getKafka().getDeadLetterTopic();

        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
            (record, exception) -> {
                log.error("Retries exhausted, dead-lettering record: topic={}, partition={}, offset={}, key={}",
                    record.topic(), record.partition(), record.offset(), record.key(), exception);
                metrics.incrementEventsDeadLettered();
                return new TopicPartition(deadLetterTopic, -1);
            });

        AppProperties.Retry retry = appProperties.getProjection().getRetry();
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(retry.getMaxRetries());
        backOff.setInitialInterval(retry.getInitialIntervalMs());
        backOff.setMultiplier(retry.getMultiplier());
        backOff.setMaxInterval(retry.getMaxIntervalMs());

        DefaultErrorHandler retrying = new DefaultErrorHandler(recoverer, backOff);
        retrying.setCommitRecovered(true);

        CommonContainerStoppingErrorHandler stopping = new CommonContainerStoppingErrorHandler();

        CommonDelegatingErrorHandler handler = new CommonDelegatingErrorHandler(retrying);
        handler.addDelegate(UnknownEventTypeException.class, stopping);
        handler.addDelegate(EventSerializationException.class, stopping);
        return handler;
    }
}
