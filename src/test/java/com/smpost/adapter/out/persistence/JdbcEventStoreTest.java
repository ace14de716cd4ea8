package com.smpost.adapter.out.persistence;

import com.smpost.domain.event.CommentAdded;
import com.smpost.domain.event.MessageUpdated;
import com.smpost.domain.event.PostCreated;
import com.smpost.domain.event.PostEvent;
import com.smpost.domain.event.PostLiked;
import com.smpost.domain.model.PostAggregate;
import com.smpost.infrastructure.exception.AggregateNotFoundException;
import com.smpost.infrastructure.exception.ConcurrencyConflictException;
import com.smpost.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcEventStoreTest extends FullStackTestBase {

    @Autowired
    private JdbcEventStore eventStore;

    private UUID postId;

    @BeforeEach
    void setUpStream() {
        // Stream with one PostCreated (tables are cleaned by parent @BeforeEach)
        postId = UUID.randomUUID();
        eventStore.append(postId, List.of(PostCreated.from(postId, 1, "alice", "hello")), 0);
    }

    @Test
    void shouldLoadEventsInVersionOrder() {
        // Given
        UUID commentId = UUID.randomUUID();
        eventStore.append(postId, List.of(
            PostLiked.from(postId, 2),
            CommentAdded.from(postId, 3, commentId, "nice", "bob")
        ), 1);

        // When
        List<PostEvent> events = eventStore.load(postId);

        // Then
        assertEquals(3, events.size());
        assertInstanceOf(PostCreated.class, events.get(0));
        assertInstanceOf(PostLiked.class, events.get(1));
        CommentAdded added = assertInstanceOf(CommentAdded.class, events.get(2));
        assertEquals(commentId, added.commentId());
        assertEquals(3, eventStore.currentVersion(postId));
    }

    @Test
    void shouldReplayLoadedStreamIntoAggregate() {
        eventStore.append(postId, List.of(MessageUpdated.from(postId, 2, "edited")), 1);

        PostAggregate post = PostAggregate.fromHistory(eventStore.load(postId));

        assertEquals(2, post.version());
        assertEquals("alice", post.author());
        assertTrue(post.isActive());
    }

    @Test
    void shouldRejectStaleExpectedVersion() {
        eventStore.append(postId, List.of(PostLiked.from(postId, 2)), 1);

        ConcurrencyConflictException error = assertThrows(ConcurrencyConflictException.class,
            () -> eventStore.append(postId, List.of(PostLiked.from(postId, 2)), 1));

        assertEquals(postId, error.getAggregateId());
        assertEquals(1, error.getExpectedVersion());
        assertEquals(2, eventStore.currentVersion(postId));
    }

    @Test
    void shouldRejectMisnumberedBatch() {
        assertThrows(IllegalArgumentException.class,
            () -> eventStore.append(postId, List.of(PostLiked.from(postId, 3)), 1));

        assertEquals(1, eventStore.currentVersion(postId));
    }

    @Test
    void shouldFailLoadingUnknownStream() {
        assertThrows(AggregateNotFoundException.class, () -> eventStore.load(UUID.randomUUID()));
        assertEquals(0, eventStore.currentVersion(UUID.randomUUID()));
    }

    @Test
    void shouldListStreamsInFirstAppendOrder() {
        UUID second = UUID.randomUUID();
        eventStore.append(second, List.of(PostCreated.from(second, 1, "bob", "hi")), 0);
        eventStore.append(postId, List.of(PostLiked.from(postId, 2)), 1);

        assertEquals(List.of(postId, second), eventStore.listAggregateIds());
    }

    @Test
    void shouldLetExactlyOneConcurrentWriterWin() throws Exception {
        // Given: two writers that both loaded the stream at version 1
        List<List<PostEvent>> batches = List.of(
            List.of(PostLiked.from(postId, 2), MessageUpdated.from(postId, 3, "from writer A")),
            List.of(MessageUpdated.from(postId, 2, "from writer B"))
        );
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        // When
        List<Future<Boolean>> outcomes = new ArrayList<>();
        for (List<PostEvent> batch : batches) {
            outcomes.add(executor.submit(() -> {
                start.await();
                try {
                    eventStore.append(postId, batch, 1);
                    return true;
                } catch (ConcurrencyConflictException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        List<Boolean> results = new ArrayList<>();
        for (Future<Boolean> outcome : outcomes) {
            results.add(outcome.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Then
        assertEquals(1, results.stream().filter(Boolean::booleanValue).count());

        List<PostEvent> stream = eventStore.load(postId);
        int winner = results.indexOf(Boolean.TRUE);
        assertEquals(1 + batches.get(winner).size(), stream.size());
        for (int i = 0; i < stream.size(); i++) {
            assertEquals(i + 1, stream.get(i).version());
        }
        assertEquals(batches.get(winner), stream.subList(1, stream.size()));
    }
}
