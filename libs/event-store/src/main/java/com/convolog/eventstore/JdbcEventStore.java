package com.convolog.eventstore;

import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.EventSerializer;
import com.convolog.eventmodel.EventValidator;
import com.convolog.eventmodel.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link EventStore} on a relational database through Spring JDBC.
 *
 * <p>Each append runs in one transaction. The stream head is checked first so stale writers fail
 * fast; the unique index on {@code (stream_id, stream_version)} settles races between writers that
 * passed the check at the same time. Notifications go out only after the transaction committed.
 *
 * <p>Query and transaction timeouts are configured on the supplied {@link JdbcTemplate} and
 * {@link TransactionTemplate}.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String INSERT_EVENT = """
            INSERT INTO events (id, stream_id, stream_version, event_type, data, metadata, inserted_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_FORWARD = """
            SELECT id, stream_id, stream_version, event_type, data, metadata, inserted_at
            FROM events
            WHERE stream_id = ? AND stream_version >= ?
            ORDER BY stream_version
            LIMIT ?
            """;

    private static final String SELECT_CURRENT_VERSION =
            "SELECT COALESCE(MAX(stream_version), 0) FROM events WHERE stream_id = ?";

    private static final String SELECT_STREAM_IDS =
            "SELECT DISTINCT stream_id FROM events WHERE stream_id LIKE ? ESCAPE '\\' ORDER BY stream_id";

    private static final RowMapper<StoredEvent> EVENT_ROW_MAPPER = (rs, rowNum) -> new StoredEvent(
            rs.getObject("id", UUID.class),
            rs.getString("stream_id"),
            rs.getLong("stream_version"),
            rs.getString("event_type"),
            EventSerializer.readMap(rs.getString("data")),
            EventSerializer.readMap(rs.getString("metadata")),
            rs.getObject("inserted_at", OffsetDateTime.class).toInstant());

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EventBus eventBus;
    private final Clock clock;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, EventBus eventBus,
                          Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public List<StoredEvent> append(String streamId, long expectedVersion, List<EventData> events) {
        EventValidator.validateAppend(streamId, expectedVersion, events).requireValid();

        List<StoredEvent> stored;
        try {
            stored = transactionTemplate.execute(status -> insertAll(streamId, expectedVersion, events));
        } catch (DuplicateKeyException | ConcurrencyFailureException e) {
            log.debug("Append to {} at version {} lost a concurrent write", streamId, expectedVersion);
            throw new WrongExpectedVersionException(streamId, expectedVersion, e);
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to append to stream " + streamId, e);
        }

        log.debug("Appended {} event(s) to {} (versions {}-{})", stored.size(), streamId,
                expectedVersion + 1, expectedVersion + stored.size());
        eventBus.publish(new StreamAppended(streamId, stored));
        return stored;
    }

    private List<StoredEvent> insertAll(String streamId, long expectedVersion, List<EventData> events) {
        long current = queryCurrentVersion(streamId);
        if (current != expectedVersion) {
            throw new WrongExpectedVersionException(streamId, expectedVersion, current);
        }

        Instant insertedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        OffsetDateTime insertedAtColumn = OffsetDateTime.ofInstant(insertedAt, ZoneOffset.UTC);
        List<StoredEvent> stored = new ArrayList<>(events.size());
        long version = expectedVersion;
        for (EventData event : events) {
            version++;
            StoredEvent row = new StoredEvent(UUID.randomUUID(), streamId, version, event.eventType(),
                    event.data(), event.metadata(), insertedAt);
            jdbcTemplate.update(INSERT_EVENT,
                    row.id(),
                    row.streamId(),
                    row.streamVersion(),
                    row.eventType(),
                    EventSerializer.toJson(row.data()),
                    EventSerializer.toJson(row.metadata()),
                    insertedAtColumn);
            stored.add(row);
        }
        return List.copyOf(stored);
    }

    @Override
    public List<StoredEvent> readForward(String streamId, long fromVersion, int maxCount) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive");
        }
        try {
            return jdbcTemplate.query(SELECT_FORWARD, EVENT_ROW_MAPPER, streamId, Math.max(fromVersion, 1), maxCount);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read stream " + streamId, e);
        }
    }

    @Override
    public long currentVersion(String streamId) {
        try {
            return queryCurrentVersion(streamId);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read version of stream " + streamId, e);
        }
    }

    @Override
    public List<String> streamIds(String prefix) {
        try {
            return jdbcTemplate.queryForList(SELECT_STREAM_IDS, String.class, escapeLike(prefix) + "%");
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to list streams with prefix " + prefix, e);
        }
    }

    private long queryCurrentVersion(String streamId) {
        Long version = jdbcTemplate.queryForObject(SELECT_CURRENT_VERSION, Long.class, streamId);
        return version == null ? 0 : version;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
