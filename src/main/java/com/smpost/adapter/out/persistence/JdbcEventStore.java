package com.smpost.adapter.out.persistence;

import com.smpost.application.port.out.EventStore;
import com.smpost.domain.event.PostEvent;
import com.smpost.infrastructure.exception.AggregateNotFoundException;
import com.smpost.infrastructure.exception.ConcurrencyConflictException;
import com.smpost.infrastructure.serialization.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Event store on a single append-only table keyed by (aggregate_id, version).
 * <p>
 * The stream length is the version. The expected-version check rejects stale writers up front;
 * a writer that races past the check collides on the primary key and its whole batch rolls back.
 */
@Repository
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private final JdbcTemplate jdbc;
    private final EventSerializer serializer;

    public JdbcEventStore(JdbcTemplate jdbc, EventSerializer serializer) {
        this.jdbc = jdbc;
        this.serializer = serializer;
    }

    @Override
    @Transactional
    public void append(UUID aggregateId, List<? extends PostEvent> events, long expectedVersion) {
        if (events.isEmpty()) {
            return;
        }
        checkNumbering(aggregateId, events, expectedVersion);

        long currentVersion = currentVersion(aggregateId);
        if (currentVersion != expectedVersion) {
            log.debug("Rejecting append: aggregateId={}, expected={}, actual={}",
                aggregateId, expectedVersion, currentVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
        }

        List<PostEvent> batch = List.copyOf(events);
        try {
            jdbc.batchUpdate("""
                INSERT INTO event_store (aggregate_id, version, event_type, payload, occurred_at)
                VALUES (?, ?, ?, ?::jsonb, ?)
                """,
                batch,
                batch.size(),
                (ps, event) -> {
                    ps.setObject(1, aggregateId);
                    ps.setLong(2, event.version());
                    ps.setString(3, event.eventType());
                    ps.setString(4, serializer.serialize(event));
                    ps.setTimestamp(5, Timestamp.from(event.occurredAt()));
                }
            );
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, e);
        }

        log.debug("Appended {} events: aggregateId={}, version={}",
            events.size(), aggregateId, expectedVersion + events.size());
    }

    @Override
    public List<PostEvent> load(UUID aggregateId) {
        List<PostEvent> events = jdbc.query(
            "SELECT payload FROM event_store WHERE aggregate_id = ? ORDER BY version",
            (rs, rowNum) -> serializer.deserialize(rs.getString("payload")),
            aggregateId
        );
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateId);
        }
        return events;
    }

    @Override
    public long currentVersion(UUID aggregateId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM event_store WHERE aggregate_id = ?",
            Long.class,
            aggregateId
        );
        return count != null ? count : 0;
    }

    @Override
    public List<UUID> listAggregateIds() {
        return jdbc.query("""
            SELECT aggregate_id
            FROM event_store
            GROUP BY aggregate_id
            ORDER BY MIN(global_position)
            """,
            (rs, rowNum) -> rs.getObject("aggregate_id", UUID.class)
        );
    }

    private static void checkNumbering(UUID aggregateId, List<? extends PostEvent> events, long expectedVersion) {
        long position = expectedVersion;
        for (PostEvent event : events) {
            position++;
            if (!aggregateId.equals(event.aggregateId()) || event.version() != position) {
                throw new IllegalArgumentException(
                    "Event " + event.eventType() + " for " + event.aggregateId() + " at version " + event.version()
                        + " does not continue stream " + aggregateId + " at " + position);
            }
        }
    }
}
