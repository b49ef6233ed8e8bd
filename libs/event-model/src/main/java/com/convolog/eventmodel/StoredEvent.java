package com.convolog.eventmodel;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * An event as persisted in the event log. Immutable; a stored event is never updated or deleted.
 *
 * @param id opaque unique identifier
 * @param streamId stream the event belongs to
 * @param streamVersion 1-based position in the stream, unique per stream
 * @param eventType the event type tag
 * @param data event-specific payload
 * @param metadata causation and correlation information
 * @param insertedAt when the store persisted the event
 */
public record StoredEvent(
        UUID id,
        String streamId,
        long streamVersion,
        String eventType,
        Map<String, Object> data,
        Map<String, Object> metadata,
        Instant insertedAt) {

    public StoredEvent {
        data = data == null ? Map.of() : data;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
