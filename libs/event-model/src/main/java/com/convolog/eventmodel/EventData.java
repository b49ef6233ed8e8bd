package com.convolog.eventmodel;

import java.util.Map;

/**
 * An event as submitted for appending, before the store assigns its id, stream version and
 * insertion time.
 *
 * <p>Both {@code data} and {@code metadata} are string-keyed so the stored form never depends on
 * Java class or field identity. Typed payloads are converted with {@link EventSerializer#toData}.
 *
 * @param eventType the event type tag (e.g. "UserMessageAdded")
 * @param data event-specific payload
 * @param metadata causation and correlation information (may be empty)
 */
public record EventData(String eventType, Map<String, Object> data, Map<String, Object> metadata) {

    public EventData {
        data = data == null ? Map.of() : data;
        metadata = metadata == null ? Map.of() : metadata;
    }

    /** Creates event data without metadata. */
    public static EventData of(String eventType, Map<String, Object> data) {
        return new EventData(eventType, data, Map.of());
    }

    /** Returns a copy carrying the given metadata. */
    public EventData withMetadata(Map<String, Object> newMetadata) {
        return new EventData(eventType, data, newMetadata);
    }
}
