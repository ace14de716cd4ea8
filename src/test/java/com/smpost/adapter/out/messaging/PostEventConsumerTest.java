package com.smpost.adapter.out.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smpost.application.port.out.MetricsPort;
import com.smpost.application.service.ProjectionDispatcher;
import com.smpost.domain.error.UnknownEventTypeException;
import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.CommentRemoved;
import com.smpost.domain.event.CommentUpdated;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.event.PostRemoved;
import com.smpost.infrastructure.exception.EventSerializationException;
import com.smpost.infrastructure.serialization.EventSerializer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.kafka.support.Acknowledgment;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PostEventConsumer.
 * Uses a real dispatcher whose handlers record what they received.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PostEventConsumer")
class PostEventConsumerTest {

    @Mock
    private MetricsPort metrics;

    @Mock
    private Acknowledgment acknowledgment;

    private final List<PostEvent> applied = new ArrayList<>();
    private EventSerializer serializer;
    private PostEventConsumer consumer;
    private UUID postId;
    private RuntimeException likeFailure;

    @BeforeEach
    void setUp() {
        serializer = new EventSerializer(new ObjectMapper());
        ProjectionDispatcher<PostEvent> dispatcher = ProjectionDispatcher.builder(PostEvent.class)
            .on(PostCreated.class, applied::add)
            .on(MessageUpdated.class, applied::add)
            .on(PostLiked.class, event -> {
                if (likeFailure != null) {
                    throw likeFailure;
                }
                applied.add(event);
            })
            .on(CommentAdded.class, applied::add)
            .on(CommentUpdated.class, applied::add)
            .on(CommentRemoved.class, applied::add)
            .on(PostRemoved.class, applied::add)
            .build();
        consumer = new PostEventConsumer(serializer, dispatcher, metrics);
        postId = UUID.randomUUID();
    }

    private void runProjectionUpdates() {
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(metrics).recordProjectionUpdate(any(Runnable.class));
    }

    private ConsumerRecord<String, String> record(String payload) {
        return new ConsumerRecord<>("post-events", 0, 42L, postId.toString(), payload);
    }

    @Nested
    @DisplayName("successful records")
    class SuccessTests {

        @Test
        @DisplayName("Should dispatch the decoded event and then acknowledge")
        void shouldDispatchAndAcknowledge() {
            // Given
            runProjectionUpdates();
            PostCreated created = PostCreated.from(postId, 1, "alice", "hello");

            // When
            consumer.consume(record(serializer.serialize(created)), acknowledgment);

            // Then
            assertEquals(List.of(created), applied);
            verify(acknowledgment).acknowledge();
        }

        @Test
        @DisplayName("Should clear MDC after the record")
        void shouldClearMdc() {
            runProjectionUpdates();

            consumer.consume(record(serializer.serialize(PostLiked.from(postId, 2))), acknowledgment);

            assertNull(MDC.get("aggregateId"));
            assertNull(MDC.get("eventType"));
        }
    }

    @Nested
    @DisplayName("failing records")
    class FailureTests {

        @Test
        @DisplayName("Should not acknowledge when the projection update fails")
        void shouldNotAcknowledgeOnHandlerFailure() {
            // Given
            runProjectionUpdates();
            likeFailure = new TransientDataAccessResourceException("database unavailable");

            // When
            assertThrows(TransientDataAccessResourceException.class,
                () -> consumer.consume(record(serializer.serialize(PostLiked.from(postId, 2))), acknowledgment));

            // Then
            verifyNoInteractions(acknowledgment);
            assertNull(MDC.get("aggregateId"));
        }

        @Test
        @DisplayName("Should treat an unknown discriminator as fatal")
        void shouldRejectUnknownType() {
            String payload = "{\"type\":\"POST_PINNED\",\"aggregateId\":\"" + postId + "\",\"version\":2}";

            UnknownEventTypeException error = assertThrows(UnknownEventTypeException.class,
                () -> consumer.consume(record(payload), acknowledgment));

            assertEquals("POST_PINNED", error.getEventType());
            verifyNoInteractions(acknowledgment, metrics);
            assertTrue(applied.isEmpty());
        }

        @Test
        @DisplayName("Should not acknowledge a malformed payload")
        void shouldRejectMalformedPayload() {
            assertThrows(EventSerializationException.class,
                () -> consumer.consume(record("{not json"), acknowledgment));

            verifyNoInteractions(acknowledgment);
        }
    }
}
