package com.convolog.eventstore;

import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.StoredEvent;

import java.util.List;

/**
 * Append-only, per-stream ordered event log with optimistic concurrency control.
 *
 * <p>Versions within a stream start at 1 and are gapless. Concurrency safety comes entirely from
 * the store's uniqueness check on {@code (stream_id, stream_version)} at commit time; there are no
 * locks held between reading a stream and appending to it.
 */
public interface EventStore {

    /**
     * Atomically appends events at versions {@code expectedVersion + 1 ..} in submission order.
     * On success a single {@link StreamAppended} is published before returning.
     *
     * @param streamId        target stream
     * @param expectedVersion the version the caller last saw (0 for a new stream)
     * @param events          events to append; must not be empty
     * @return the stored events, in version order
     * @throws WrongExpectedVersionException if another writer got there first; nothing is written
     * @throws EventStoreException           on storage failure
     * @throws IllegalArgumentException      if the request is malformed
     */
    List<StoredEvent> append(String streamId, long expectedVersion, List<EventData> events);

    /** Reads the whole stream in ascending version order. */
    default List<StoredEvent> readForward(String streamId) {
        return readForward(streamId, 1, Integer.MAX_VALUE);
    }

    /**
     * Reads at most {@code maxCount} events with version {@code >= fromVersion}, ascending.
     */
    List<StoredEvent> readForward(String streamId, long fromVersion, int maxCount);

    /** Version of the last event in the stream, 0 if the stream has no events. */
    long currentVersion(String streamId);

    /** Ids of all streams whose id starts with the given prefix, sorted. */
    List<String> streamIds(String prefix);
}
