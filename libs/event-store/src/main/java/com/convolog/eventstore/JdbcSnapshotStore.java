package com.convolog.eventstore;

import com.convolog.eventmodel.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SnapshotStore} on the {@code snapshots} table.
 */
public class JdbcSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private static final String INSERT_SNAPSHOT = """
            INSERT INTO snapshots (id, stream_id, stream_version, snapshot_type, data, inserted_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_LATEST = """
            SELECT stream_id, stream_version, snapshot_type, data, inserted_at
            FROM snapshots
            WHERE stream_id = ?
            ORDER BY stream_version DESC
            LIMIT 1
            """;

    private static final RowMapper<Snapshot> SNAPSHOT_ROW_MAPPER = (rs, rowNum) -> new Snapshot(
            rs.getString("stream_id"),
            rs.getLong("stream_version"),
            rs.getString("snapshot_type"),
            EventSerializer.readMap(rs.getString("data")),
            rs.getObject("inserted_at", OffsetDateTime.class).toInstant());

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcSnapshotStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public void save(String streamId, long version, String snapshotType, Map<String, Object> data) {
        try {
            jdbcTemplate.update(INSERT_SNAPSHOT,
                    UUID.randomUUID(),
                    streamId,
                    version,
                    snapshotType,
                    EventSerializer.toJson(data),
                    OffsetDateTime.ofInstant(clock.instant().truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC));
            log.debug("Saved {} snapshot of {} at version {}", snapshotType, streamId, version);
        } catch (DuplicateKeyException e) {
            log.debug("Snapshot of {} at version {} already exists", streamId, version);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to save snapshot of " + streamId + " at version " + version, e);
        }
    }

    @Override
    public Optional<Snapshot> latest(String streamId) {
        try {
            List<Snapshot> rows = jdbcTemplate.query(SELECT_LATEST, SNAPSHOT_ROW_MAPPER, streamId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read snapshot of " + streamId, e);
        }
    }
}
