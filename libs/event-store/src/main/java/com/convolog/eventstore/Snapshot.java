package com.convolog.eventstore;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate state captured at a stream version.
 *
 * @param streamId      stream the state was built from
 * @param streamVersion version of the last event folded into {@code data}
 * @param snapshotType  aggregate type tag
 * @param data          string-keyed aggregate state
 * @param insertedAt    when the snapshot was written
 */
public record Snapshot(
        String streamId,
        long streamVersion,
        String snapshotType,
        Map<String, Object> data,
        Instant insertedAt) {}
