package com.convolog.eventstore;

import com.convolog.eventmodel.StoredEvent;

import java.util.List;

/**
 * Change notification published once per successful append.
 *
 * @param streamId the stream that was appended to
 * @param events   the newly stored events, in version order
 */
public record StreamAppended(String streamId, List<StoredEvent> events) {

    public StreamAppended {
        events = List.copyOf(events);
    }

    public long firstVersion() {
        return events.isEmpty() ? 0 : events.get(0).streamVersion();
    }

    public long lastVersion() {
        return events.isEmpty() ? 0 : events.get(events.size() - 1).streamVersion();
    }
}
