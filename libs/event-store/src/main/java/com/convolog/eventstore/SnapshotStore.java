package com.convolog.eventstore;

import java.util.Map;
import java.util.Optional;

/**
 * Durable cache of aggregate state at a stream version.
 *
 * <p>Snapshots only bound replay cost. Deleting every snapshot must never change what a load
 * returns, so callers treat failures to save as non-fatal.
 */
public interface SnapshotStore {

    /**
     * Stores a snapshot. Saving the same {@code (streamId, version)} twice keeps the first one.
     */
    void save(String streamId, long version, String snapshotType, Map<String, Object> data);

    /** Returns the snapshot with the highest version for the stream, if any. */
    Optional<Snapshot> latest(String streamId);
}
